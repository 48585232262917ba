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

import org.copayj.core.Chain;
import org.copayj.crypto.CopayerIds;

import javax.annotation.Nullable;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A member of a wallet. The name may be encrypted with the wallet's shared key. The signature is made
 * with the wallet private key over {@code name|xPubKey|requestPubKey}, proving the copayer was
 * admitted by someone holding the wallet secret.
 */
public class Copayer {
    private final String id;
    private final String name;
    private final String xPubKey;
    private final String requestPubKey;
    private final String signature;

    public Copayer(String id, @Nullable String name, String xPubKey, @Nullable String requestPubKey,
                   @Nullable String signature) {
        this.id = checkNotNull(id);
        this.name = name;
        this.xPubKey = checkNotNull(xPubKey);
        this.requestPubKey = requestPubKey;
        this.signature = signature;
    }

    /** Builds a copayer whose id is derived from its extended public key. */
    public static Copayer create(Chain chain, String name, String xPubKey, String requestPubKey, String signature) {
        return new Copayer(CopayerIds.xPubToCopayerId(chain, xPubKey), name, xPubKey, requestPubKey, signature);
    }

    public String getId() {
        return id;
    }

    @Nullable
    public String getName() {
        return name;
    }

    public String getXPubKey() {
        return xPubKey;
    }

    @Nullable
    public String getRequestPubKey() {
        return requestPubKey;
    }

    @Nullable
    public String getSignature() {
        return signature;
    }

    public PublicKeyRingEntry toPublicKeyRingEntry() {
        return new PublicKeyRingEntry(xPubKey, requestPubKey);
    }

    @Override
    public String toString() {
        return "Copayer{" + id + "}";
    }
}
