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

package org.copayj.crypto;

import com.google.common.base.Joiner;
import com.google.common.io.BaseEncoding;
import org.bitcoinj.core.ECKey;
import org.bitcoinj.core.NetworkParameters;
import org.bitcoinj.core.Sha256Hash;
import org.bitcoinj.crypto.DeterministicKey;
import org.copayj.core.Chain;
import org.copayj.core.Defaults;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import static org.bitcoinj.core.Utils.HEX;

/**
 * Copayer identity helpers: ids, the registration message hash and the request key authorization.
 */
public class CopayerIds {
    private static final Joiner PIPE = Joiner.on('|');

    private CopayerIds() {
    }

    /**
     * The copayer id is the hex SHA-256 of the extended public key string, prefixed with the chain code
     * for chains other than BTC so that one key reused on two chains yields two ids.
     */
    public static String xPubToCopayerId(Chain chain, String xPubKey) {
        String text = chain == Chain.BTC ? xPubKey : chain.getCode() + xPubKey;
        return HEX.encode(Sha256Hash.hash(text.getBytes(StandardCharsets.UTF_8)));
    }

    /** The text a wallet member signs, with the wallet key, to register a copayer. */
    public static String getCopayerHash(String name, String xPubKey, String requestPubKey) {
        return PIPE.join(name, xPubKey, requestPubKey);
    }

    public static String signRequestPubKey(String requestPubKey, DeterministicKey xPrivKey) {
        ECKey authKey = KeyPaths.derive(xPrivKey, Defaults.PATH_REQUEST_KEY_AUTH);
        return MessageSigner.signMessage(requestPubKey, authKey);
    }

    /** Checks that {@code requestPubKey} was authorized by the owner of {@code xPubKey}. */
    public static boolean verifyRequestPubKey(String requestPubKey, String signature, String xPubKey,
                                              NetworkParameters params) {
        String authPubKey;
        try {
            authPubKey = HEX.encode(KeyPaths.derivePublicKey(xPubKey, Defaults.PATH_REQUEST_KEY_AUTH, params));
        } catch (IllegalArgumentException x) {
            return false;
        }
        return MessageSigner.verifyMessage(requestPubKey, signature, authPubKey);
    }

    /** Base64 of the first 16 bytes of SHA-256 of the private key: the shared memo encryption key. */
    public static String privateKeyToAESKey(ECKey privateKey) {
        byte[] hash = Sha256Hash.hash(privateKey.getPrivKeyBytes());
        return BaseEncoding.base64().encode(Arrays.copyOf(hash, 16));
    }
}
