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
 * A set of inputs chosen by the {@link CoinSelector} and the fee they pay. Change dust that was folded
 * into the fee is already included in {@link #getFee()}.
 */
public class CoinSelection {
    private final List<Utxo> inputs;
    private final long fee;
    private final long target;

    public CoinSelection(List<Utxo> inputs, long fee, long target) {
        this.inputs = ImmutableList.copyOf(inputs);
        this.fee = fee;
        this.target = target;
    }

    public List<Utxo> getInputs() {
        return inputs;
    }

    public long getFee() {
        return fee;
    }

    /** Value the outputs must receive, escrow included. */
    public long getTarget() {
        return target;
    }

    public long getTotal() {
        long total = 0;
        for (Utxo input : inputs)
            total += input.getSatoshis();
        return total;
    }

    /** Value left for a change output. */
    public long getChange() {
        return getTotal() - target - fee;
    }

    @Override
    public String toString() {
        return "CoinSelection{" + inputs.size() + " inputs, total=" + getTotal() + ", fee=" + fee + ", change=" + getChange() + "}";
    }
}
