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

/**
 * Ethereum family fields. Legacy (type 0) transactions use {@code gasPrice}; type 2 transactions use
 * {@code maxGasFee} and {@code priorityGasFee}.
 */
public final class EvmPayload extends ChainPayload {
    @Nullable private final String from;
    @Nullable private final Long nonce;
    @Nullable private final Long gasPrice;
    @Nullable private final Long maxGasFee;
    @Nullable private final Long priorityGasFee;
    @Nullable private final Long gasLimit;
    @Nullable private final Integer txType;
    @Nullable private final String tokenAddress;
    @Nullable private final String multisigContractAddress;
    private final boolean tokenSwap;

    private EvmPayload(Builder builder) {
        this.from = builder.from;
        this.nonce = builder.nonce;
        this.gasPrice = builder.gasPrice;
        this.maxGasFee = builder.maxGasFee;
        this.priorityGasFee = builder.priorityGasFee;
        this.gasLimit = builder.gasLimit;
        this.txType = builder.txType;
        this.tokenAddress = builder.tokenAddress;
        this.multisigContractAddress = builder.multisigContractAddress;
        this.tokenSwap = builder.tokenSwap;
    }

    @Override
    public ChainFamily getFamily() {
        return ChainFamily.EVM;
    }

    @Nullable
    public String getFrom() {
        return from;
    }

    @Nullable
    public Long getNonce() {
        return nonce;
    }

    @Nullable
    public Long getGasPrice() {
        return gasPrice;
    }

    @Nullable
    public Long getMaxGasFee() {
        return maxGasFee;
    }

    @Nullable
    public Long getPriorityGasFee() {
        return priorityGasFee;
    }

    @Nullable
    public Long getGasLimit() {
        return gasLimit;
    }

    @Nullable
    public Integer getTxType() {
        return txType;
    }

    @Nullable
    public String getTokenAddress() {
        return tokenAddress;
    }

    @Nullable
    public String getMultisigContractAddress() {
        return multisigContractAddress;
    }

    public boolean isTokenSwap() {
        return tokenSwap;
    }

    public static class Builder {
        private String from;
        private Long nonce;
        private Long gasPrice;
        private Long maxGasFee;
        private Long priorityGasFee;
        private Long gasLimit;
        private Integer txType;
        private String tokenAddress;
        private String multisigContractAddress;
        private boolean tokenSwap;

        public Builder from(String from) {
            this.from = from;
            return this;
        }

        public Builder nonce(Long nonce) {
            this.nonce = nonce;
            return this;
        }

        public Builder gasPrice(Long gasPrice) {
            this.gasPrice = gasPrice;
            return this;
        }

        public Builder maxGasFee(Long maxGasFee) {
            this.maxGasFee = maxGasFee;
            return this;
        }

        public Builder priorityGasFee(Long priorityGasFee) {
            this.priorityGasFee = priorityGasFee;
            return this;
        }

        public Builder gasLimit(Long gasLimit) {
            this.gasLimit = gasLimit;
            return this;
        }

        public Builder txType(Integer txType) {
            this.txType = txType;
            return this;
        }

        public Builder tokenAddress(String tokenAddress) {
            this.tokenAddress = tokenAddress;
            return this;
        }

        public Builder multisigContractAddress(String multisigContractAddress) {
            this.multisigContractAddress = multisigContractAddress;
            return this;
        }

        public Builder tokenSwap(boolean tokenSwap) {
            this.tokenSwap = tokenSwap;
            return this;
        }

        public EvmPayload build() {
            return new EvmPayload(this);
        }
    }
}
