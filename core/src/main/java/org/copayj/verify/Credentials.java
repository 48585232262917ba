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

package org.copayj.verify;

import com.google.common.collect.ImmutableList;
import org.bitcoinj.core.ECKey;
import org.copayj.core.Chain;
import org.copayj.core.Network;
import org.copayj.core.ScriptType;
import org.copayj.crypto.CopayerIds;
import org.copayj.wallet.PublicKeyRingEntry;

import javax.annotation.Nullable;
import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * What a copayer's client knows locally about a wallet, independently of the service: the wallet
 * parameters, the public key ring it accepted when the wallet completed, its own extended public key
 * and, once joined, the wallet's shared private key.
 */
public class Credentials {
    private final Chain chain;
    private final Network network;
    private final int m;
    private final int n;
    private final ScriptType addressType;
    private final String xPubKey;
    private final List<PublicKeyRingEntry> publicKeyRing;
    @Nullable private final ECKey walletPrivKey;

    private Credentials(Builder builder) {
        this.chain = checkNotNull(builder.chain, "chain");
        this.network = checkNotNull(builder.network, "network");
        checkArgument(builder.m >= 1 && builder.m <= builder.n, "invalid m/n: %s/%s", builder.m, builder.n);
        this.m = builder.m;
        this.n = builder.n;
        this.addressType = builder.addressType != null ? builder.addressType : ScriptType.defaultFor(builder.n);
        this.xPubKey = checkNotNull(builder.xPubKey, "xPubKey");
        this.publicKeyRing = ImmutableList.copyOf(builder.publicKeyRing);
        this.walletPrivKey = builder.walletPrivKey;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** True once the public key ring holds all {@code n} copayers. */
    public boolean isComplete() {
        return publicKeyRing.size() == n;
    }

    /** Key of the memo cipher shared by the copayers, or null before joining the wallet. */
    @Nullable
    public String getSharedEncryptingKey() {
        return walletPrivKey != null ? CopayerIds.privateKeyToAESKey(walletPrivKey) : null;
    }

    @Nullable
    public String getWalletPubKey() {
        return walletPrivKey != null ? walletPrivKey.getPublicKeyAsHex() : null;
    }

    public Chain getChain() {
        return chain;
    }

    public Network getNetwork() {
        return network;
    }

    public int getM() {
        return m;
    }

    public int getN() {
        return n;
    }

    public ScriptType getAddressType() {
        return addressType;
    }

    public String getXPubKey() {
        return xPubKey;
    }

    public List<PublicKeyRingEntry> getPublicKeyRing() {
        return publicKeyRing;
    }

    @Nullable
    public ECKey getWalletPrivKey() {
        return walletPrivKey;
    }

    public static class Builder {
        private Chain chain = Chain.BTC;
        private Network network = Network.LIVENET;
        private int m = 1;
        private int n = 1;
        private ScriptType addressType;
        private String xPubKey;
        private List<PublicKeyRingEntry> publicKeyRing = ImmutableList.of();
        private ECKey walletPrivKey;

        public Builder chain(Chain chain) {
            this.chain = chain;
            return this;
        }

        public Builder network(Network network) {
            this.network = network;
            return this;
        }

        public Builder m(int m) {
            this.m = m;
            return this;
        }

        public Builder n(int n) {
            this.n = n;
            return this;
        }

        public Builder addressType(ScriptType addressType) {
            this.addressType = addressType;
            return this;
        }

        public Builder xPubKey(String xPubKey) {
            this.xPubKey = xPubKey;
            return this;
        }

        public Builder publicKeyRing(List<PublicKeyRingEntry> publicKeyRing) {
            this.publicKeyRing = publicKeyRing;
            return this;
        }

        public Builder walletPrivKey(ECKey walletPrivKey) {
            this.walletPrivKey = walletPrivKey;
            return this;
        }

        public Credentials build() {
            return new Credentials(this);
        }
    }
}
