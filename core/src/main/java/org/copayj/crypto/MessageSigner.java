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
import org.bitcoinj.core.ECKey;
import org.bitcoinj.core.SignatureDecodeException;
import org.bitcoinj.core.Sha256Hash;
import org.bitcoinj.core.Utils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static org.bitcoinj.core.Utils.HEX;

/**
 * Signs and verifies the text messages copayers exchange with the service: request keys, proposal
 * bodies, copayer registrations.
 *
 * <p>The message hash is the double SHA-256 of the UTF-8 text, byte-reversed. Signatures are
 * deterministic (RFC 6979), low-S ECDSA, DER encoded and hex encoded on the wire.</p>
 */
public class MessageSigner {
    private static final Logger log = LoggerFactory.getLogger(MessageSigner.class);

    private static final Joiner PART_JOINER = Joiner.on(',');

    private MessageSigner() {
    }

    /** Multi-part messages are joined with commas before hashing. */
    public static String flatten(List<String> parts) {
        return PART_JOINER.join(parts);
    }

    /** Reversed double SHA-256 of the message, the form every signature is checked against. */
    public static byte[] hashMessage(String message) {
        byte[] hash = Sha256Hash.hashTwice(message.getBytes(StandardCharsets.UTF_8));
        return Utils.reverseBytes(hash);
    }

    public static String signMessage(String message, ECKey key) {
        checkNotNull(message);
        checkArgument(key.hasPrivKey(), "signing key has no private key");
        // the reversed hash is read as a little endian number, so the signed value is the plain double hash
        Sha256Hash hash = Sha256Hash.wrapReversed(hashMessage(message));
        ECKey.ECDSASignature signature = key.sign(hash);
        return HEX.encode(signature.encodeToDER());
    }

    public static String signMessage(List<String> parts, ECKey key) {
        return signMessage(flatten(parts), key);
    }

    /**
     * Returns true when {@code signatureHex} is a valid signature of {@code message} by the key
     * {@code pubKeyHex}. Malformed input is reported as false.
     */
    public static boolean verifyMessage(String message, String signatureHex, String pubKeyHex) {
        if (message == null || signatureHex == null || pubKeyHex == null)
            return false;
        try {
            Sha256Hash hash = Sha256Hash.wrapReversed(hashMessage(message));
            ECKey.ECDSASignature signature = ECKey.ECDSASignature.decodeFromDER(HEX.decode(signatureHex));
            return ECKey.verify(hash.getBytes(), signature, HEX.decode(pubKeyHex));
        } catch (SignatureDecodeException | IllegalArgumentException x) {
            log.debug("cannot verify message signature: {}", x.getMessage());
            return false;
        }
    }

    public static boolean verifyMessage(List<String> parts, String signatureHex, String pubKeyHex) {
        return verifyMessage(flatten(parts), signatureHex, pubKeyHex);
    }
}
