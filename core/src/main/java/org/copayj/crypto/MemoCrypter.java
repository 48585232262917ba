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

import com.google.common.base.Strings;
import com.google.common.io.BaseEncoding;
import org.bouncycastle.crypto.InvalidCipherTextException;
import org.bouncycastle.crypto.engines.AESEngine;
import org.bouncycastle.crypto.modes.CCMBlockCipher;
import org.bouncycastle.crypto.params.AEADParameters;
import org.bouncycastle.crypto.params.KeyParameter;
import org.json.JSONException;
import org.json.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.util.Arrays;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * <p>Encrypts the memos, output notes and copayer names shared among the members of a wallet.</p>
 *
 * <p>The key is the shared 128 bit wallet encrypting key (base64). Messages are encrypted with
 * AES-CCM and a 64 bit tag, and travel as a JSON envelope:
 * {@code {"iv":..,"v":1,"iter":1,"ks":128,"ts":64,"mode":"ccm","adata":"","cipher":"aes","ct":..}}
 * where {@code iv} and {@code ct} are base64 and {@code ct} carries the tag at its end.</p>
 */
public class MemoCrypter {
    private static final Logger log = LoggerFactory.getLogger(MemoCrypter.class);

    /** Returned by {@link #decryptMessageNoThrow(String, String)} when a memo cannot be decrypted. */
    public static final String CANNOT_DECRYPT = "<ECANNOTDECRYPT>";

    /**
     * The size of the initialisation vector in bytes. Only its first {@code 15 - L} bytes are used
     * as the CCM nonce, L being the width of the message length field.
     */
    public static final int IV_LENGTH = 16;
    public static final int KEY_SIZE_BITS = 128;
    public static final int TAG_SIZE_BITS = 64;

    private static final BaseEncoding BASE64 = BaseEncoding.base64();
    private static final SecureRandom secureRandom = new SecureRandom();

    private MemoCrypter() {
    }

    public static String encryptMessage(String message, String encryptingKey) {
        byte[] iv = new byte[IV_LENGTH];
        secureRandom.nextBytes(iv);
        return encryptMessage(message, encryptingKey, iv);
    }

    /** Encryption with a caller supplied iv, for tests. */
    static String encryptMessage(String message, String encryptingKey, byte[] iv) {
        checkNotNull(message);
        checkArgument(iv.length == IV_LENGTH, "iv must be %s bytes", IV_LENGTH);
        byte[] key = decodeKey(encryptingKey);
        byte[] plainBytes = message.getBytes(StandardCharsets.UTF_8);
        try {
            CCMBlockCipher cipher = new CCMBlockCipher(new AESEngine());
            cipher.init(true, new AEADParameters(new KeyParameter(key), TAG_SIZE_BITS, nonce(iv, plainBytes.length)));
            byte[] encryptedBytes = cipher.processPacket(plainBytes, 0, plainBytes.length);

            JSONObject envelope = new JSONObject();
            envelope.put("iv", BASE64.encode(iv));
            envelope.put("v", 1);
            envelope.put("iter", 1);
            envelope.put("ks", KEY_SIZE_BITS);
            envelope.put("ts", TAG_SIZE_BITS);
            envelope.put("mode", "ccm");
            envelope.put("adata", "");
            envelope.put("cipher", "aes");
            envelope.put("ct", BASE64.encode(encryptedBytes));
            return envelope.toString();
        } catch (InvalidCipherTextException | RuntimeException e) {
            throw new MemoCrypterException("Could not encrypt message", e);
        }
    }

    /**
     * Decrypts an envelope produced by {@link #encryptMessage(String, String)}.
     *
     * @throws MemoCrypterException on a wrong key, a malformed envelope or a failed tag check
     */
    public static String decryptMessage(String envelopeJson, String encryptingKey) {
        checkNotNull(envelopeJson);
        byte[] key = decodeKey(encryptingKey);
        try {
            JSONObject envelope = new JSONObject(envelopeJson);
            if (!"ccm".equals(envelope.optString("mode", "ccm")) || !"aes".equals(envelope.optString("cipher", "aes")))
                throw new MemoCrypterException("Unsupported cipher mode");
            int tagSize = envelope.optInt("ts", TAG_SIZE_BITS);
            byte[] iv = BASE64.decode(envelope.getString("iv"));
            byte[] cipherBytes = BASE64.decode(envelope.getString("ct"));
            byte[] adata = BASE64.decode(envelope.optString("adata", ""));
            int plainLength = cipherBytes.length - tagSize / 8;
            if (plainLength < 0)
                throw new MemoCrypterException("Ciphertext shorter than its tag");

            CCMBlockCipher cipher = new CCMBlockCipher(new AESEngine());
            cipher.init(false, new AEADParameters(new KeyParameter(key), tagSize, nonce(iv, plainLength), adata));
            byte[] plainBytes = cipher.processPacket(cipherBytes, 0, cipherBytes.length);
            return new String(plainBytes, StandardCharsets.UTF_8);
        } catch (InvalidCipherTextException e) {
            throw new MemoCrypterException("Could not decrypt message", e);
        } catch (JSONException | IllegalArgumentException | IllegalStateException e) {
            throw new MemoCrypterException("Malformed encrypted message", e);
        }
    }

    /**
     * Decrypts without failing: a missing key or a failed decryption yields {@link #CANNOT_DECRYPT}, an
     * empty message yields an empty string and text that is not an envelope is returned unchanged.
     */
    public static String decryptMessageNoThrow(@Nullable String envelopeJson, @Nullable String encryptingKey) {
        if (Strings.isNullOrEmpty(encryptingKey))
            return CANNOT_DECRYPT;
        if (Strings.isNullOrEmpty(envelopeJson))
            return "";
        if (!isEnvelope(envelopeJson))
            return envelopeJson;
        try {
            return decryptMessage(envelopeJson, encryptingKey);
        } catch (MemoCrypterException x) {
            log.debug("cannot decrypt message: {}", x.getMessage());
            return CANNOT_DECRYPT;
        }
    }

    /** Whether {@code text} looks like an encrypted memo envelope. */
    public static boolean isEnvelope(String text) {
        try {
            JSONObject json = new JSONObject(text);
            return json.has("iv") && json.has("ct");
        } catch (JSONException x) {
            return false;
        }
    }

    private static byte[] decodeKey(String encryptingKey) {
        checkArgument(!Strings.isNullOrEmpty(encryptingKey), "no encrypting key");
        byte[] key;
        try {
            key = BASE64.decode(encryptingKey);
        } catch (IllegalArgumentException x) {
            throw new MemoCrypterException("Encrypting key is not base64", x);
        }
        if (key.length != 16 && key.length != 24 && key.length != 32)
            throw new MemoCrypterException("Invalid encrypting key length: " + key.length);
        return key;
    }

    // Width of the length field grows with the message; the nonce takes what is left of 15 bytes.
    private static byte[] nonce(byte[] iv, int messageLength) {
        int lengthFieldSize = 2;
        while (lengthFieldSize < 4 && (messageLength >>> (8 * lengthFieldSize)) != 0)
            lengthFieldSize++;
        int nonceLength = 15 - lengthFieldSize;
        checkArgument(iv.length >= nonceLength, "iv too short");
        return Arrays.copyOf(iv, nonceLength);
    }
}
