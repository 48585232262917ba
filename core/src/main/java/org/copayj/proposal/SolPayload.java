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

package org.copayj.proposal;

import org.copayj.core.ChainFamily;

import javax.annotation.Nullable;

public final class SolPayload extends ChainPayload {
    @Nullable private final String blockHash;
    @Nullable private final Long blockHeight;
    @Nullable private final String nonceAddress;
    @Nullable private final String category;
    @Nullable private final Long computeUnits;
    @Nullable private final Long priorityFee;
    @Nullable private final String memo;
    @Nullable private final String fromAta;
    @Nullable private final Integer decimals;
    @Nullable private final Long space;

    private SolPayload(Builder builder) {
        this.blockHash = builder.blockHash;
        this.blockHeight = builder.blockHeight;
        this.nonceAddress = builder.nonceAddress;
        this.category = builder.category;
        this.computeUnits = builder.computeUnits;
        this.priorityFee = builder.priorityFee;
        this.memo = builder.memo;
        this.fromAta = builder.fromAta;
        this.decimals = builder.decimals;
        this.space = builder.space;
    }

    @Override
    public ChainFamily getFamily() {
        return ChainFamily.SOLANA;
    }

    /** Recent block hash the transaction is bound to. */
    @Nullable
    public String getBlockHash() {
        return blockHash;
    }

    /** Last block height at which a legacy transaction is still valid. */
    @Nullable
    public Long getBlockHeight() {
        return blockHeight;
    }

    /** Durable nonce account, when one replaces the recent block hash. */
    @Nullable
    public String getNonceAddress() {
        return nonceAddress;
    }

    @Nullable
    public String getCategory() {
        return category;
    }

    @Nullable
    public Long getComputeUnits() {
        return computeUnits;
    }

    @Nullable
    public Long getPriorityFee() {
        return priorityFee;
    }

    @Nullable
    public String getMemo() {
        return memo;
    }

    @Nullable
    public String getFromAta() {
        return fromAta;
    }

    @Nullable
    public Integer getDecimals() {
        return decimals;
    }

    @Nullable
    public Long getSpace() {
        return space;
    }

    public static class Builder {
        private String blockHash;
        private Long blockHeight;
        private String nonceAddress;
        private String category;
        private Long computeUnits;
        private Long priorityFee;
        private String memo;
        private String fromAta;
        private Integer decimals;
        private Long space;

        public Builder blockHash(String blockHash) {
            this.blockHash = blockHash;
            return this;
        }

        public Builder blockHeight(Long blockHeight) {
            this.blockHeight = blockHeight;
            return this;
        }

        public Builder nonceAddress(String nonceAddress) {
            this.nonceAddress = nonceAddress;
            return this;
        }

        public Builder category(String category) {
            this.category = category;
            return this;
        }

        public Builder computeUnits(Long computeUnits) {
            this.computeUnits = computeUnits;
            return this;
        }

        public Builder priorityFee(Long priorityFee) {
            this.priorityFee = priorityFee;
            return this;
        }

        public Builder memo(String memo) {
            this.memo = memo;
            return this;
        }

        public Builder fromAta(String fromAta) {
            this.fromAta = fromAta;
            return this;
        }

        public Builder decimals(Integer decimals) {
            this.decimals = decimals;
            return this;
        }

        public Builder space(Long space) {
            this.space = space;
            return this;
        }

        public SolPayload build() {
            return new SolPayload(this);
        }
    }
}
