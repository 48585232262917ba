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
 * Address/script kinds a wallet can use for its own addresses.
 */
public enum ScriptType {
    /** pay to public key hash, single signer */
    P2PKH(false, -1),
    /** pay to script hash, M-of-N multisig */
    P2SH(true, -1),
    /** native segwit key hash */
    P2WPKH(false, 0),
    /** native segwit script hash, M-of-N multisig */
    P2WSH(true, 0),
    /** taproot key path */
    P2TR(false, 1);

    private final boolean multisig;
    private final int segwitVersion;

    ScriptType(boolean multisig, int segwitVersion) {
        this.multisig = multisig;
        this.segwitVersion = segwitVersion;
    }

    public boolean isMultisig() {
        return multisig;
    }

    public boolean isNativeSegwit() {
        return segwitVersion >= 0;
    }

    /** Witness version, or -1 for legacy scripts. */
    public int getSegwitVersion() {
        return segwitVersion;
    }

    /** Script type used when a wallet does not name one. */
    public static ScriptType defaultFor(int n) {
        return n > 1 ? P2SH : P2PKH;
    }
}
