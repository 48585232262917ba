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

import javax.annotation.Nullable;
import java.util.List;

/**
 * A payment protocol invoice as fetched by the client: what to pay, where.
 */
public class PayProDetails {
    private final List<Instruction> instructions;
    @Nullable private final Double requiredFeeRate;

    public PayProDetails(List<Instruction> instructions, @Nullable Double requiredFeeRate) {
        this.instructions = ImmutableList.copyOf(instructions);
        this.requiredFeeRate = requiredFeeRate;
    }

    public List<Instruction> getInstructions() {
        return instructions;
    }

    /** Fee rate the merchant asks for, in sat/byte. Not enforced. */
    @Nullable
    public Double getRequiredFeeRate() {
        return requiredFeeRate;
    }

    public long getTotalAmount() {
        long total = 0;
        for (Instruction instruction : instructions)
            total += instruction.getAmount();
        return total;
    }

    public static class Instruction {
        private final String toAddress;
        private final long amount;

        public Instruction(String toAddress, long amount) {
            this.toAddress = toAddress;
            this.amount = amount;
        }

        public String getToAddress() {
            return toAddress;
        }

        public long getAmount() {
            return amount;
        }
    }
}
