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

package org.copayj.core;

/**
 * There is enough value to pay the outputs but not the outputs plus the fee.
 */
public class InsufficientFundsForFeeException extends CopayException {
    private final long requiredFee;
    private final long feePerKb;

    public InsufficientFundsForFeeException(Chain chain, long requiredFee, long feePerKb) {
        super(ErrorCode.INSUFFICIENT_FUNDS_FOR_FEE, String.format("%s. RequiredFee: %d Coin: %s feePerKb: %d",
                ErrorCode.INSUFFICIENT_FUNDS_FOR_FEE.getDefaultMessage(), requiredFee, chain.getCode(), feePerKb));
        this.requiredFee = requiredFee;
        this.feePerKb = feePerKb;
    }

    public long getRequiredFee() {
        return requiredFee;
    }

    public long getFeePerKb() {
        return feePerKb;
    }
}
