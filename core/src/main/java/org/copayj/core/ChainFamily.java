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
 * Groups chains that share one transaction model and therefore one {@link org.copayj.chain.ChainAdapter}.
 */
public enum ChainFamily {
    BITCOIN(true),
    EVM(false),
    XRP(false),
    SOLANA(false);

    private final boolean utxoModel;

    ChainFamily(boolean utxoModel) {
        this.utxoModel = utxoModel;
    }

    public boolean isUtxoModel() {
        return utxoModel;
    }
}
