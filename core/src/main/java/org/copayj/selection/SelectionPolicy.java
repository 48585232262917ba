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

package org.copayj.selection;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.primitives.Ints;
import org.copayj.core.Defaults;
import org.copayj.wallet.Utxo;

import java.util.Collection;
import java.util.List;
import java.util.Set;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Tunables of the {@link CoinSelector}. Immutable; use {@link #builder()} or {@link #toBuilder()}.
 */
public class SelectionPolicy {
    private final double maxSingleUtxoFactor;
    private final double minTxAmountVsUtxoFactor;
    private final double maxFeeVsTxAmountFactor;
    private final double maxFeeVsSingleUtxoFeeFactor;
    private final int maxTxSizeInKb;
    private final long dustThreshold;
    private final boolean excludeUnconfirmedUtxos;
    private final boolean replaceTxByFee;
    private final List<Utxo> requiredInputs;
    private final Set<String> utxosToExclude;
    private final long escrowAmount;
    private final List<Integer> confirmationGroups;

    private SelectionPolicy(Builder builder) {
        this.maxSingleUtxoFactor = builder.maxSingleUtxoFactor;
        this.minTxAmountVsUtxoFactor = builder.minTxAmountVsUtxoFactor;
        this.maxFeeVsTxAmountFactor = builder.maxFeeVsTxAmountFactor;
        this.maxFeeVsSingleUtxoFeeFactor = builder.maxFeeVsSingleUtxoFeeFactor;
        this.maxTxSizeInKb = builder.maxTxSizeInKb;
        this.dustThreshold = builder.dustThreshold;
        this.excludeUnconfirmedUtxos = builder.excludeUnconfirmedUtxos;
        this.replaceTxByFee = builder.replaceTxByFee;
        this.requiredInputs = builder.requiredInputs;
        this.utxosToExclude = builder.utxosToExclude;
        this.escrowAmount = builder.escrowAmount;
        this.confirmationGroups = builder.confirmationGroups;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static SelectionPolicy defaults() {
        return new Builder().build();
    }

    public Builder toBuilder() {
        Builder b = new Builder();
        b.maxSingleUtxoFactor = maxSingleUtxoFactor;
        b.minTxAmountVsUtxoFactor = minTxAmountVsUtxoFactor;
        b.maxFeeVsTxAmountFactor = maxFeeVsTxAmountFactor;
        b.maxFeeVsSingleUtxoFeeFactor = maxFeeVsSingleUtxoFeeFactor;
        b.maxTxSizeInKb = maxTxSizeInKb;
        b.dustThreshold = dustThreshold;
        b.excludeUnconfirmedUtxos = excludeUnconfirmedUtxos;
        b.replaceTxByFee = replaceTxByFee;
        b.requiredInputs = requiredInputs;
        b.utxosToExclude = utxosToExclude;
        b.escrowAmount = escrowAmount;
        b.confirmationGroups = confirmationGroups;
        return b;
    }

    /** A utxo worth more than this factor times the target (plus a single input fee) is a big input. */
    public double getMaxSingleUtxoFactor() {
        return maxSingleUtxoFactor;
    }

    public double getMinTxAmountVsUtxoFactor() {
        return minTxAmountVsUtxoFactor;
    }

    public double getMaxFeeVsTxAmountFactor() {
        return maxFeeVsTxAmountFactor;
    }

    public double getMaxFeeVsSingleUtxoFeeFactor() {
        return maxFeeVsSingleUtxoFeeFactor;
    }

    public int getMaxTxSizeInKb() {
        return maxTxSizeInKb;
    }

    /** Change at or below this amount is added to the fee. */
    public long getDustThreshold() {
        return dustThreshold;
    }

    public boolean isExcludeUnconfirmedUtxos() {
        return excludeUnconfirmedUtxos;
    }

    public boolean isReplaceTxByFee() {
        return replaceTxByFee;
    }

    /** Inputs of the transaction being replaced; at least one of them is kept when replacing by fee. */
    public List<Utxo> getRequiredInputs() {
        return requiredInputs;
    }

    /** Outpoints ({@code txid:vout}) never to select. */
    public Set<String> getUtxosToExclude() {
        return utxosToExclude;
    }

    public long getEscrowAmount() {
        return escrowAmount;
    }

    /** Minimum confirmation depths tried in order. */
    public List<Integer> getConfirmationGroups() {
        return confirmationGroups;
    }

    @Override
    public String toString() {
        return "SelectionPolicy{groups=" + confirmationGroups + ", excludeUnconfirmed=" + excludeUnconfirmedUtxos
                + ", rbf=" + replaceTxByFee + ", escrow=" + escrowAmount + ", maxTxSizeInKb=" + maxTxSizeInKb + "}";
    }

    public static class Builder {
        private double maxSingleUtxoFactor = Defaults.UTXO_SELECTION_MAX_SINGLE_UTXO_FACTOR;
        private double minTxAmountVsUtxoFactor = Defaults.UTXO_SELECTION_MIN_TX_AMOUNT_VS_UTXO_FACTOR;
        private double maxFeeVsTxAmountFactor = Defaults.UTXO_SELECTION_MAX_FEE_VS_TX_AMOUNT_FACTOR;
        private double maxFeeVsSingleUtxoFeeFactor = Defaults.UTXO_SELECTION_MAX_FEE_VS_SINGLE_UTXO_FEE_FACTOR;
        private int maxTxSizeInKb = Defaults.MAX_TX_SIZE_IN_KB_BTC;
        private long dustThreshold = Math.max(Defaults.MIN_OUTPUT_AMOUNT, Defaults.DUST_AMOUNT);
        private boolean excludeUnconfirmedUtxos;
        private boolean replaceTxByFee;
        private List<Utxo> requiredInputs = ImmutableList.of();
        private Set<String> utxosToExclude = ImmutableSet.of();
        private long escrowAmount;
        private List<Integer> confirmationGroups = Defaults.UTXO_CONFIRMATION_GROUPS;

        private Builder() {
        }

        public Builder maxSingleUtxoFactor(double factor) {
            checkArgument(factor > 0, "factor must be positive");
            this.maxSingleUtxoFactor = factor;
            return this;
        }

        public Builder minTxAmountVsUtxoFactor(double factor) {
            this.minTxAmountVsUtxoFactor = factor;
            return this;
        }

        public Builder maxFeeVsTxAmountFactor(double factor) {
            this.maxFeeVsTxAmountFactor = factor;
            return this;
        }

        public Builder maxFeeVsSingleUtxoFeeFactor(double factor) {
            this.maxFeeVsSingleUtxoFeeFactor = factor;
            return this;
        }

        public Builder maxTxSizeInKb(int maxTxSizeInKb) {
            checkArgument(maxTxSizeInKb > 0, "size cap must be positive");
            this.maxTxSizeInKb = maxTxSizeInKb;
            return this;
        }

        public Builder dustThreshold(long dustThreshold) {
            checkArgument(dustThreshold >= 0, "negative dust threshold");
            this.dustThreshold = dustThreshold;
            return this;
        }

        public Builder excludeUnconfirmedUtxos(boolean exclude) {
            this.excludeUnconfirmedUtxos = exclude;
            return this;
        }

        public Builder replaceTxByFee(boolean replaceTxByFee) {
            this.replaceTxByFee = replaceTxByFee;
            return this;
        }

        public Builder requiredInputs(Collection<Utxo> requiredInputs) {
            this.requiredInputs = ImmutableList.copyOf(requiredInputs);
            return this;
        }

        public Builder utxosToExclude(Collection<String> outpointKeys) {
            this.utxosToExclude = ImmutableSet.copyOf(outpointKeys);
            return this;
        }

        public Builder escrowAmount(long escrowAmount) {
            checkArgument(escrowAmount >= 0, "negative escrow");
            this.escrowAmount = escrowAmount;
            return this;
        }

        public Builder confirmationGroups(int... groups) {
            checkArgument(groups.length > 0, "no confirmation groups");
            this.confirmationGroups = ImmutableList.copyOf(Ints.asList(groups));
            return this;
        }

        public SelectionPolicy build() {
            return new SelectionPolicy(this);
        }
    }
}
