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

import com.google.common.collect.ImmutableList;
import org.copayj.core.ScriptType;

import java.util.List;
import java.util.Objects;

import static com.google.common.base.Preconditions.checkNotNull;

/** A wallet address together with the derivation data needed to re-derive and spend it. */
public class AddressInfo {
    private final String address;
    private final String path;
    private final List<String> publicKeys;
    private final ScriptType type;

    public AddressInfo(String address, String path, List<String> publicKeys, ScriptType type) {
        this.address = checkNotNull(address);
        this.path = checkNotNull(path);
        this.publicKeys = ImmutableList.copyOf(publicKeys);
        this.type = checkNotNull(type);
    }

    public String getAddress() {
        return address;
    }

    public String getPath() {
        return path;
    }

    public List<String> getPublicKeys() {
        return publicKeys;
    }

    public ScriptType getType() {
        return type;
    }

    /** Paths are {@code m/<change>/<index>}; a non zero change element marks a change address. */
    public boolean isChange() {
        String[] elements = path.split("/");
        return elements.length > 1 && !elements[1].equals("0");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        AddressInfo other = (AddressInfo) o;
        return address.equals(other.address) && path.equals(other.path)
                && publicKeys.equals(other.publicKeys) && type == other.type;
    }

    @Override
    public int hashCode() {
        return Objects.hash(address, path, publicKeys, type);
    }

    @Override
    public String toString() {
        return address + " (" + path + ")";
    }
}
