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
import org.copayj.wallet.Utxo;

import java.util.List;

/**
 * The largest amount a wallet can send in one transaction, and why the rest of its funds cannot be
 * sent: utxos worth less than their own fee, and utxos that would push the transaction over the size
 * cap.
 */
public class SendMaxInfo {
    private final int size;
    private final long amount;
    private final long fee;
    private final long feePerKb;
    private final List<Utxo> inputs;
    private final int utxosBelowFee;
    private final long amountBelowFee;
    private final int utxosAboveMaxSize;
    private final long amountAboveMaxSize;

    public SendMaxInfo(int size, long amount, long fee, long feePerKb, List<Utxo> inputs, int utxosBelowFee,
                       long amountBelowFee, int utxosAboveMaxSize, long amountAboveMaxSize) {
        this.size = size;
        this.amount = amount;
        this.fee = fee;
        this.feePerKb = feePerKb;
        this.inputs = ImmutableList.copyOf(inputs);
        this.utxosBelowFee = utxosBelowFee;
        this.amountBelowFee = amountBelowFee;
        this.utxosAboveMaxSize = utxosAboveMaxSize;
        this.amountAboveMaxSize = amountAboveMaxSize;
    }

    public int getSize() {
        return size;
    }

    public long getAmount() {
        return amount;
    }

    public long getFee() {
        return fee;
    }

    public long getFeePerKb() {
        return feePerKb;
    }

    /** Inputs to spend, empty unless requested. */
    public List<Utxo> getInputs() {
        return inputs;
    }

    public int getUtxosBelowFee() {
        return utxosBelowFee;
    }

    public long getAmountBelowFee() {
        return amountBelowFee;
    }

    public int getUtxosAboveMaxSize() {
        return utxosAboveMaxSize;
    }

    public long getAmountAboveMaxSize() {
        return amountAboveMaxSize;
    }

    @Override
    public String toString() {
        return "SendMaxInfo{amount=" + amount + ", fee=" + fee + ", size=" + size + ", belowFee=" + utxosBelowFee
                + ", aboveMaxSize=" + utxosAboveMaxSize + "}";
    }
}
