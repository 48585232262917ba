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

package org.copayj.wallet;

import com.google.common.collect.ImmutableList;
import org.copayj.core.Chain;
import org.copayj.core.Defaults;
import org.copayj.core.Network;
import org.copayj.core.ScriptType;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

/**
 * An M-of-N wallet: its threshold, chain, network, script type and the ordered public key ring built
 * as copayers join.
 */
public class Wallet {
    private final String id;
    private final String name;
    private final int m;
    private final int n;
    private final Chain chain;
    private final Network network;
    private final ScriptType scriptType;
    @Nullable private final String pubKey;
    private final List<Copayer> copayers = new ArrayList<>();

    public Wallet(String id, String name, int m, int n, Chain chain, Network network,
                  @Nullable ScriptType scriptType, @Nullable String pubKey) {
        checkArgument(1 <= m && m <= n && n <= Defaults.MAX_KEYS, "Invalid combination of required copayers / total copayers: %s/%s", m, n);
        this.id = checkNotNull(id);
        this.name = name;
        this.m = m;
        this.n = n;
        this.chain = checkNotNull(chain);
        this.network = checkNotNull(network);
        this.scriptType = scriptType != null ? scriptType : ScriptType.defaultFor(n);
        this.pubKey = pubKey;
    }

    public Wallet(String id, int m, int n, Chain chain, Network network) {
        this(id, id, m, n, chain, network, null, null);
    }

    public void addCopayer(Copayer copayer) {
        checkState(copayers.size() < n, "Wallet %s is full", id);
        for (Copayer c : copayers)
            checkArgument(!c.getId().equals(copayer.getId()), "Copayer %s already in wallet", copayer.getId());
        copayers.add(copayer);
    }

    public boolean isComplete() {
        return copayers.size() == n;
    }

    @Nullable
    public Copayer getCopayer(String copayerId) {
        for (Copayer c : copayers)
            if (c.getId().equals(copayerId))
                return c;
        return null;
    }

    public List<Copayer> getCopayers() {
        return ImmutableList.copyOf(copayers);
    }

    /** Ring entries in joining order; the first entry is the escrow reclaim key. */
    public List<PublicKeyRingEntry> getPublicKeyRing() {
        ImmutableList.Builder<PublicKeyRingEntry> ring = ImmutableList.builder();
        for (Copayer c : copayers)
            ring.add(c.toPublicKeyRingEntry());
        return ring.build();
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public int getM() {
        return m;
    }

    public int getN() {
        return n;
    }

    public Chain getChain() {
        return chain;
    }

    public Network getNetwork() {
        return network;
    }

    public ScriptType getScriptType() {
        return scriptType;
    }

    /** Public half of the wallet key copayer registrations are signed with. */
    @Nullable
    public String getPubKey() {
        return pubKey;
    }

    @Override
    public String toString() {
        return String.format("Wallet{%s %d-of-%d %s/%s %s}", id, m, n, chain.getCode(), network.getCode(), scriptType);
    }
}
