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

import java.util.Objects;

import static com.google.common.base.Preconditions.checkNotNull;

/** One copayer's keys as seen by the rest of the wallet. */
public class PublicKeyRingEntry {
    private final String xPubKey;
    private final String requestPubKey;

    public PublicKeyRingEntry(String xPubKey, String requestPubKey) {
        this.xPubKey = checkNotNull(xPubKey);
        this.requestPubKey = requestPubKey;
    }

    public String getXPubKey() {
        return xPubKey;
    }

    public String getRequestPubKey() {
        return requestPubKey;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PublicKeyRingEntry other = (PublicKeyRingEntry) o;
        return xPubKey.equals(other.xPubKey) && Objects.equals(requestPubKey, other.requestPubKey);
    }

    @Override
    public int hashCode() {
        return Objects.hash(xPubKey, requestPubKey);
    }

    @Override
    public String toString() {
        return "PublicKeyRingEntry{" + xPubKey + "}";
    }
}
