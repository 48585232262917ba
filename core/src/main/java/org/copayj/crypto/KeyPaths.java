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

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import org.bitcoinj.core.NetworkParameters;
import org.bitcoinj.crypto.ChildNumber;
import org.bitcoinj.crypto.DeterministicKey;
import org.bitcoinj.crypto.HDKeyDerivation;

import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Parsing of textual derivation paths ({@code m/0/5}, {@code m/44'/0'/0'}) and derivation relative to
 * an extended key. Paths are relative: {@code m} stands for the key the path is applied to.
 */
public class KeyPaths {
    private static final Splitter PATH_SPLITTER = Splitter.on('/').trimResults();

    private KeyPaths() {
    }

    public static List<ChildNumber> parse(String path) {
        checkArgument(path != null && !path.isEmpty(), "empty path");
        ImmutableList.Builder<ChildNumber> result = ImmutableList.builder();
        boolean first = true;
        for (String element : PATH_SPLITTER.split(path)) {
            if (first) {
                first = false;
                if (element.equals("m") || element.equals("M"))
                    continue;
            }
            if (element.isEmpty())
                continue;
            boolean hardened = element.endsWith("'") || element.endsWith("H") || element.endsWith("h");
            String digits = hardened ? element.substring(0, element.length() - 1) : element;
            int index;
            try {
                index = Integer.parseInt(digits);
            } catch (NumberFormatException x) {
                throw new IllegalArgumentException("Invalid path element '" + element + "' in " + path, x);
            }
            checkArgument(index >= 0, "Negative path element in %s", path);
            result.add(new ChildNumber(index, hardened));
        }
        return result.build();
    }

    public static DeterministicKey derive(DeterministicKey parent, String path) {
        return derive(parent, parse(path));
    }

    public static DeterministicKey derive(DeterministicKey parent, List<ChildNumber> path) {
        DeterministicKey key = parent;
        for (ChildNumber child : path)
            key = HDKeyDerivation.deriveChildKey(key, child);
        return key;
    }

    /** Parses a base58 extended public or private key for the given network. */
    public static DeterministicKey parseExtendedKey(String xkey, NetworkParameters params) {
        return DeterministicKey.deserializeB58(xkey, params);
    }

    public static byte[] derivePublicKey(String xPubKey, String path, NetworkParameters params) {
        return derive(parseExtendedKey(xPubKey, params), path).getPubKey();
    }
}
