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

import org.copayj.chain.ChainAdapter;
import org.copayj.chain.EstimationOptions;
import org.copayj.core.Chain;
import org.copayj.core.Defaults;
import org.copayj.proposal.TxProposal;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Linear size model of a transaction being assembled: a base size (overhead and outputs) plus a fixed
 * size per input. Fees derived from it are rounded up and never below {@code minFee}.
 */
public class FeeModel {
    private final Chain chain;
    private final int baseSize;
    private final int sizePerInput;
    private final long feePerKb;
    private final long minFee;

    public FeeModel(Chain chain, int baseSize, int sizePerInput, long feePerKb, long minFee) {
        checkArgument(baseSize >= 0 && sizePerInput > 0, "invalid sizes %s/%s", baseSize, sizePerInput);
        checkArgument(feePerKb >= 0, "negative fee rate");
        this.chain = chain;
        this.baseSize = baseSize;
        this.sizePerInput = sizePerInput;
        this.feePerKb = feePerKb;
        this.minFee = minFee;
    }

    /**
     * Model of a proposal's transaction, measured by its chain adapter with the proposal's current
     * inputs removed.
     */
    public static FeeModel forProposal(ChainAdapter adapter, TxProposal txp, EstimationOptions opts) {
        checkArgument(txp.getInputs().isEmpty(), "proposal already has inputs");
        long minFee = Math.max(Defaults.MIN_OUTPUT_AMOUNT, adapter.getDustAmount());
        return new FeeModel(txp.getChain(), adapter.estimatedSize(txp, opts),
                adapter.estimatedSizeForSingleInput(txp, opts), txp.getFeePerKb(), minFee);
    }

    public int sizeFor(int inputs) {
        return baseSize + inputs * sizePerInput;
    }

    public long feeFor(int inputs) {
        long fee = (sizeFor(inputs) * feePerKb + 999) / 1000;
        return Math.max(fee, minFee);
    }

    /** Unrounded fee of the base size. */
    public double getBaseFee() {
        return baseSize * feePerKb / 1000.0;
    }

    /** Unrounded marginal fee of one input. */
    public double getFeePerInput() {
        return sizePerInput * feePerKb / 1000.0;
    }

    public Chain getChain() {
        return chain;
    }

    public int getBaseSize() {
        return baseSize;
    }

    public int getSizePerInput() {
        return sizePerInput;
    }

    public long getFeePerKb() {
        return feePerKb;
    }

    public long getMinFee() {
        return minFee;
    }

    @Override
    public String toString() {
        return "FeeModel{base=" + baseSize + ", perInput=" + sizePerInput + ", feePerKb=" + feePerKb + "}";
    }
}
