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

/**
 * Chain specific part of a proposal. The common envelope lives in {@link TxProposal}; fields that only
 * make sense on one chain family live in exactly one subclass, so a proposal cannot carry gas
 * parameters on a UTXO chain or an escrow on an account chain.
 */
public abstract class ChainPayload {
    public abstract ChainFamily getFamily();

    /** Empty payload for the given family. */
    public static ChainPayload defaultFor(ChainFamily family) {
        switch (family) {
            case BITCOIN:
                return new UtxoPayload(false, false, 0, null);
            case EVM:
                return new EvmPayload.Builder().build();
            case XRP:
                return new XrpPayload(null, null);
            case SOLANA:
                return new SolPayload.Builder().build();
            default:
                throw new IllegalArgumentException("Unknown chain family " + family);
        }
    }
}
