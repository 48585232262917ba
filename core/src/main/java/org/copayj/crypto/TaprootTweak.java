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

import org.bitcoinj.core.ECKey;
import org.bitcoinj.core.Sha256Hash;
import org.bouncycastle.math.ec.ECPoint;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Key path only taproot output keys (BIP 86): {@code Q = lift_x(P) + H_TapTweak(x(P))·G}.
 */
public class TaprootTweak {
    private TaprootTweak() {
    }

    /** 32 byte x coordinate of the internal key. */
    public static byte[] internalKey(byte[] compressedPubKey) {
        return ECKey.CURVE.getCurve().decodePoint(compressedPubKey).normalize().getAffineXCoord().getEncoded();
    }

    /** 32 byte x-only output key committed to by a P2TR script. */
    public static byte[] outputKey(byte[] compressedPubKey) {
        ECPoint p = ECKey.CURVE.getCurve().decodePoint(compressedPubKey).normalize();
        if (p.getAffineYCoord().testBitZero())
            p = p.negate().normalize();
        byte[] x = p.getAffineXCoord().getEncoded();
        BigInteger t = new BigInteger(1, taggedHash("TapTweak", x));
        checkArgument(t.compareTo(ECKey.CURVE.getN()) < 0, "tweak out of range");
        ECPoint q = p.add(ECKey.CURVE.getG().multiply(t)).normalize();
        checkArgument(!q.isInfinity(), "tweaked key is infinity");
        return q.getAffineXCoord().getEncoded();
    }

    static byte[] taggedHash(String tag, byte[] message) {
        byte[] tagHash = Sha256Hash.hash(tag.getBytes(StandardCharsets.UTF_8));
        byte[] data = new byte[tagHash.length * 2 + message.length];
        System.arraycopy(tagHash, 0, data, 0, tagHash.length);
        System.arraycopy(tagHash, 0, data, tagHash.length, tagHash.length);
        System.arraycopy(message, 0, data, tagHash.length * 2, message.length);
        return Sha256Hash.hash(data);
    }
}
