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

import org.bitcoinj.core.Sha256Hash;
import org.bitcoinj.crypto.ChildNumber;
import org.bitcoinj.crypto.DeterministicKey;
import org.bitcoinj.crypto.HDKeyDerivation;
import org.junit.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class KeyPathsTest {
    @Test
    public void parseHardenedAndPlain() {
        List<ChildNumber> path = KeyPaths.parse("m/44'/0h/1/5");
        assertEquals(4, path.size());
        assertEquals(new ChildNumber(44, true), path.get(0));
        assertEquals(new ChildNumber(0, true), path.get(1));
        assertEquals(new ChildNumber(1, false), path.get(2));
        assertEquals(new ChildNumber(5, false), path.get(3));
    }

    @Test
    public void rootOnly() {
        assertTrue(KeyPaths.parse("m").isEmpty());
        assertEquals(2, KeyPaths.parse("0/7").size());
    }

    @Test(expected = IllegalArgumentException.class)
    public void garbageElement() {
        KeyPaths.parse("m/0/x");
    }

    @Test(expected = IllegalArgumentException.class)
    public void emptyPath() {
        KeyPaths.parse("");
    }

    @Test
    public void privateAndPublicDerivationAgree() {
        DeterministicKey master = HDKeyDerivation.createMasterPrivateKey(Sha256Hash.hash("paths".getBytes(StandardCharsets.UTF_8)));
        DeterministicKey account = KeyPaths.derive(master, "m/45'");
        DeterministicKey child = KeyPaths.derive(account, "m/0/3");
        DeterministicKey viaPublic = KeyPaths.derive(account.dropPrivateBytes().dropParent(), "m/0/3");
        assertArrayEquals(child.getPubKey(), viaPublic.getPubKey());
    }
}
