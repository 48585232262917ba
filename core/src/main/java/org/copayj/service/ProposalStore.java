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

import org.copayj.proposal.TxProposal;

import javax.annotation.Nullable;
import java.util.List;

/**
 * Persistence of a wallet's proposals.
 */
public interface ProposalStore {
    void save(TxProposal txp);

    @Nullable
    TxProposal get(String walletId, String txpId);

    /** Published proposals still collecting votes or waiting to be broadcast. */
    List<TxProposal> getPending(String walletId);
}
