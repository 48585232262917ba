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

import com.google.common.collect.ImmutableList;

public class Defaults {
    public static final int MAX_KEYS = 100;

    public static final long MIN_FEE_PER_KB = 0;
    public static final long MAX_FEE_PER_KB_BTC = 10000 * 1000; // 10k sat/b

    // Lowest value of a non OP_RETURN output, change included.
    public static final long MIN_OUTPUT_AMOUNT = 546;
    public static final long DUST_AMOUNT = 546;

    public static final int MAX_TX_SIZE_IN_KB_BTC = 100;
    public static final long MAX_TX_FEE_BTC = 5000000; // 0.05 BTC

    // A utxo bigger than this factor times the amount is "big": only used alone, as a fallback.
    public static final double UTXO_SELECTION_MAX_SINGLE_UTXO_FACTOR = 2;
    // Smallest share of the amount a small utxo must contribute while big ones are available.
    public static final double UTXO_SELECTION_MIN_TX_AMOUNT_VS_UTXO_FACTOR = 0.1;
    // Fee over amount ratio below which fees are not significant.
    public static final double UTXO_SELECTION_MAX_FEE_VS_TX_AMOUNT_FACTOR = 0.05;
    // How many times the single big input fee we accept paying for many small inputs.
    public static final double UTXO_SELECTION_MAX_FEE_VS_SINGLE_UTXO_FEE_FACTOR = 5;

    // Confirmation depths tried in order by the coin selector.
    public static final ImmutableList<Integer> UTXO_CONFIRMATION_GROUPS = ImmutableList.of(6, 1, 0);

    public static final double SIZE_ESTIMATION_MARGIN = 0.01;
    public static final int INPUT_SIZE_ESTIMATION_MARGIN = 2;

    public static final long LOCK_WAIT_TIME = 5 * 1000;
    public static final long LOCK_EXE_TIME = 40 * 1000;

    public static final int TX_PROPOSAL_VERSION = 3;

    // Path, below a copayer's extended key, of the key that authorizes request/proposal keys.
    public static final String PATH_REQUEST_KEY_AUTH = "m/2";

    private Defaults() {
    }
}
