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

import java.util.Locale;

public enum Chain {
    BTC(ChainFamily.BITCOIN),
    ETH(ChainFamily.EVM),
    MATIC(ChainFamily.EVM),
    ARB(ChainFamily.EVM),
    BASE(ChainFamily.EVM),
    OP(ChainFamily.EVM),
    XRP(ChainFamily.XRP),
    SOL(ChainFamily.SOLANA);

    private final ChainFamily family;

    Chain(ChainFamily family) {
        this.family = family;
    }

    public ChainFamily getFamily() {
        return family;
    }

    public boolean isUtxoChain() {
        return family.isUtxoModel();
    }

    /** Lower case name used in copayer ids and wire records. */
    public String getCode() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Chain fromCode(String code) {
        try {
            return valueOf(code.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException x) {
            throw new IllegalArgumentException("Unknown chain: " + code, x);
        }
    }
}
