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

/**
 * Totals over a set of UTXOs. Locked amounts are those reserved by pending proposals.
 */
public class Balance {
    private final long totalAmount;
    private final long lockedAmount;
    private final long totalConfirmedAmount;
    private final long lockedConfirmedAmount;

    public Balance(long totalAmount, long lockedAmount, long totalConfirmedAmount, long lockedConfirmedAmount) {
        this.totalAmount = totalAmount;
        this.lockedAmount = lockedAmount;
        this.totalConfirmedAmount = totalConfirmedAmount;
        this.lockedConfirmedAmount = lockedConfirmedAmount;
    }

    public static Balance of(Iterable<Utxo> utxos) {
        long total = 0, locked = 0, confirmed = 0, lockedConfirmed = 0;
        for (Utxo utxo : utxos) {
            total += utxo.getSatoshis();
            if (utxo.isLocked())
                locked += utxo.getSatoshis();
            if (utxo.getConfirmations() > 0) {
                confirmed += utxo.getSatoshis();
                if (utxo.isLocked())
                    lockedConfirmed += utxo.getSatoshis();
            }
        }
        return new Balance(total, locked, confirmed, lockedConfirmed);
    }

    public long getTotalAmount() {
        return totalAmount;
    }

    public long getLockedAmount() {
        return lockedAmount;
    }

    public long getTotalConfirmedAmount() {
        return totalConfirmedAmount;
    }

    public long getLockedConfirmedAmount() {
        return lockedConfirmedAmount;
    }

    public long getAvailableAmount() {
        return totalAmount - lockedAmount;
    }

    public long getAvailableConfirmedAmount() {
        return totalConfirmedAmount - lockedConfirmedAmount;
    }

    @Override
    public String toString() {
        return String.format("Balance{total=%d, locked=%d, confirmed=%d, lockedConfirmed=%d}",
                totalAmount, lockedAmount, totalConfirmedAmount, lockedConfirmedAmount);
    }
}
