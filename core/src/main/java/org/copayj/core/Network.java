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

import org.bitcoinj.core.NetworkParameters;
import org.bitcoinj.params.MainNetParams;
import org.bitcoinj.params.RegTestParams;
import org.bitcoinj.params.TestNet3Params;

import java.util.Locale;

/**
 * The network a wallet lives on. It is always passed explicitly; nothing in this library keeps a
 * global notion of the "current" network.
 */
public enum Network {
    LIVENET,
    TESTNET,
    REGTEST;

    /**
     * Returns the bitcoinj parameters for this network. Regtest keeps its own bech32 prefix but shares
     * the testnet base58 headers, exactly as bitcoinj defines it.
     */
    public NetworkParameters getParams() {
        switch (this) {
            case LIVENET:
                return MainNetParams.get();
            case TESTNET:
                return TestNet3Params.get();
            case REGTEST:
                return RegTestParams.get();
            default:
                throw new IllegalStateException("unreachable: " + this);
        }
    }

    public String getCode() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Network fromCode(String code) {
        try {
            return valueOf(code.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException x) {
            throw new IllegalArgumentException("Invalid network: " + code, x);
        }
    }

    public static Network fromParams(NetworkParameters params) {
        if (MainNetParams.get().equals(params))
            return LIVENET;
        if (RegTestParams.get().equals(params))
            return REGTEST;
        return TESTNET;
    }
}
