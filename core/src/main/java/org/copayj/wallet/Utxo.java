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

import javax.annotation.Nullable;
import java.util.List;
import java.util.Objects;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * An unspent output owned by a wallet, as reported by the chain indexer. The locked flag is set while a
 * pending proposal references it.
 */
public class Utxo {
    private final String txid;
    private final int vout;
    private final String address;
    private final String path;
    private final long satoshis;
    private final int confirmations;
    private final List<String> publicKeys;
    @Nullable private final String scriptPubKey;
    private boolean locked;

    public Utxo(String txid, int vout, String address, String path, long satoshis, int confirmations,
                List<String> publicKeys, @Nullable String scriptPubKey) {
        checkArgument(vout >= 0, "negative vout");
        checkArgument(satoshis >= 0, "negative value");
        this.txid = checkNotNull(txid);
        this.vout = vout;
        this.address = address;
        this.path = path;
        this.satoshis = satoshis;
        this.confirmations = confirmations;
        this.publicKeys = publicKeys == null ? ImmutableList.<String>of() : ImmutableList.copyOf(publicKeys);
        this.scriptPubKey = scriptPubKey;
    }

    public Utxo(String txid, int vout, String address, String path, long satoshis, int confirmations) {
        this(txid, vout, address, path, satoshis, confirmations, null, null);
    }

    /** {@code txid:vout}, the key used for exclusion lists and locking. */
    public String getOutpointKey() {
        return outpointKey(txid, vout);
    }

    public static String outpointKey(String txid, int vout) {
        return txid + ":" + vout;
    }

    public String getTxid() {
        return txid;
    }

    public int getVout() {
        return vout;
    }

    public String getAddress() {
        return address;
    }

    public String getPath() {
        return path;
    }

    public long getSatoshis() {
        return satoshis;
    }

    public int getConfirmations() {
        return confirmations;
    }

    public List<String> getPublicKeys() {
        return publicKeys;
    }

    @Nullable
    public String getScriptPubKey() {
        return scriptPubKey;
    }

    public boolean isLocked() {
        return locked;
    }

    public void setLocked(boolean locked) {
        this.locked = locked;
    }

    /** A copy of this output carrying the given lock flag. */
    public Utxo withLocked(boolean locked) {
        Utxo copy = new Utxo(txid, vout, address, path, satoshis, confirmations, publicKeys, scriptPubKey);
        copy.locked = locked;
        return copy;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Utxo other = (Utxo) o;
        return vout == other.vout && txid.equals(other.txid);
    }

    @Override
    public int hashCode() {
        return Objects.hash(txid, vout);
    }

    @Override
    public String toString() {
        return getOutpointKey() + " " + satoshis + " (" + confirmations + " conf" + (locked ? ", locked)" : ")");
    }
}
