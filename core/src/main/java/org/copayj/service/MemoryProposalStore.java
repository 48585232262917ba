/*
 * Copyright 2026 copayj contributors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.copayj.service;

import com.google.common.collect.ImmutableList;
import org.copayj.proposal.TxProposal;

import javax.annotation.Nullable;
import javax.annotation.concurrent.GuardedBy;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * {@link ProposalStore} kept in memory, for tests and examples.
 */
public class MemoryProposalStore implements ProposalStore {
    @GuardedBy("this")
    private final Map<String, Map<String, TxProposal>> byWallet = new HashMap<>();

    @Override
    public synchronized void save(TxProposal txp) {
        Map<String, TxProposal> proposals = byWallet.get(txp.getWalletId());
        if (proposals == null) {
            proposals = new LinkedHashMap<>();
            byWallet.put(txp.getWalletId(), proposals);
        }
        proposals.put(txp.getId(), txp);
    }

    @Override
    @Nullable
    public synchronized TxProposal get(String walletId, String txpId) {
        Map<String, TxProposal> proposals = byWallet.get(walletId);
        return proposals != null ? proposals.get(txpId) : null;
    }

    @Override
    public synchronized ImmutableList<TxProposal> getPending(String walletId) {
        ImmutableList.Builder<TxProposal> result = ImmutableList.builder();
        Map<String, TxProposal> proposals = byWallet.get(walletId);
        if (proposals != null)
            for (TxProposal txp : proposals.values())
                if (txp.isPending())
                    result.add(txp);
        return result.build();
    }
}
