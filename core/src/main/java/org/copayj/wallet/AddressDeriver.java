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
import org.bitcoinj.core.Address;
import org.bitcoinj.core.ECKey;
import org.bitcoinj.core.LegacyAddress;
import org.bitcoinj.core.NetworkParameters;
import org.bitcoinj.core.SegwitAddress;
import org.bitcoinj.core.Sha256Hash;
import org.bitcoinj.core.Utils;
import org.bitcoinj.script.Script;
import org.bitcoinj.script.ScriptBuilder;
import org.copayj.core.Network;
import org.copayj.core.ScriptType;
import org.copayj.crypto.KeyPaths;
import org.copayj.crypto.TaprootTweak;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;
import static org.bitcoinj.core.Utils.HEX;
import static org.bitcoinj.script.ScriptOpCodes.OP_CHECKMULTISIG;
import static org.bitcoinj.script.ScriptOpCodes.OP_CHECKSIG;
import static org.bitcoinj.script.ScriptOpCodes.OP_ELSE;
import static org.bitcoinj.script.ScriptOpCodes.OP_ENDIF;
import static org.bitcoinj.script.ScriptOpCodes.OP_IF;

/**
 * Derives wallet addresses from the public key ring. The same derivation runs on the service, when an
 * address is created, and on each client, when the address is checked, so it must stay deterministic:
 * no input besides the ring, the path, m, the script type and the network.
 */
public class AddressDeriver {
    private AddressDeriver() {
    }

    public static AddressInfo deriveAddress(ScriptType scriptType, List<PublicKeyRingEntry> publicKeyRing, String path,
                                            int m, Network network) {
        return deriveAddress(scriptType, publicKeyRing, path, m, network, null);
    }

    /**
     * @param escrowInputPaths when set on a P2SH wallet, the paths of the proposal inputs; the result
     *                         is then the escrow address reclaimable by the first ring key
     */
    public static AddressInfo deriveAddress(ScriptType scriptType, List<PublicKeyRingEntry> publicKeyRing, String path,
                                            int m, Network network, @Nullable List<String> escrowInputPaths) {
        checkArgument(!publicKeyRing.isEmpty(), "empty public key ring");
        NetworkParameters params = network.getParams();
        List<ECKey> publicKeys = new ArrayList<>();
        for (PublicKeyRingEntry entry : publicKeyRing)
            publicKeys.add(ECKey.fromPublicOnly(KeyPaths.derivePublicKey(entry.getXPubKey(), path, params)));

        Address address;
        switch (scriptType) {
            case P2WSH: {
                Script witnessScript = ScriptBuilder.createRedeemScript(m, publicKeys);
                address = SegwitAddress.fromHash(params, Sha256Hash.hash(witnessScript.getProgram()));
                break;
            }
            case P2SH:
                if (escrowInputPaths != null) {
                    List<ECKey> inputKeys = new ArrayList<>();
                    for (String inputPath : escrowInputPaths)
                        inputKeys.add(ECKey.fromPublicOnly(KeyPaths.derivePublicKey(publicKeyRing.get(0).getXPubKey(), inputPath, params)));
                    Script escrowScript = createEscrowRedeemScript(inputKeys, publicKeys.get(0));
                    address = LegacyAddress.fromScriptHash(params, Utils.sha256hash160(escrowScript.getProgram()));
                    List<ECKey> reported = new ArrayList<>();
                    reported.add(publicKeys.get(0));
                    reported.addAll(inputKeys);
                    publicKeys = reported;
                } else {
                    Script redeemScript = ScriptBuilder.createRedeemScript(m, publicKeys);
                    address = LegacyAddress.fromScriptHash(params, Utils.sha256hash160(redeemScript.getProgram()));
                }
                break;
            case P2WPKH:
                address = SegwitAddress.fromKey(params, publicKeys.get(0));
                break;
            case P2PKH:
                checkState(publicKeys.size() == 1, "P2PKH needs exactly one public key");
                address = LegacyAddress.fromKey(params, publicKeys.get(0));
                break;
            case P2TR:
                address = SegwitAddress.fromProgram(params, 1, TaprootTweak.outputKey(publicKeys.get(0).getPubKey()));
                break;
            default:
                throw new IllegalArgumentException("Unknown script type " + scriptType);
        }

        ImmutableList.Builder<String> keys = ImmutableList.builder();
        for (ECKey key : publicKeys)
            keys.add(key.getPublicKeyAsHex());
        return new AddressInfo(address.toString(), path, keys.build(), scriptType);
    }

    /**
     * Instant acceptance escrow: the reclaim key can spend alone, or any one of the input keys can claim
     * the escrow with a signature proving a double spend attempt.
     */
    public static Script createEscrowRedeemScript(List<ECKey> inputKeys, ECKey reclaimKey) {
        checkArgument(!inputKeys.isEmpty(), "escrow needs input keys");
        ScriptBuilder builder = new ScriptBuilder()
                .op(OP_IF)
                .data(reclaimKey.getPubKey())
                .op(OP_CHECKSIG)
                .op(OP_ELSE)
                .smallNum(1);
        for (ECKey key : inputKeys)
            builder.data(key.getPubKey());
        return builder.number(inputKeys.size())
                .op(OP_CHECKMULTISIG)
                .op(OP_ENDIF)
                .build();
    }

    /** Hex public keys of an address, parsed back to keys. */
    public static List<ECKey> parsePublicKeys(List<String> publicKeys) {
        List<ECKey> keys = new ArrayList<>(publicKeys.size());
        for (String hex : publicKeys)
            keys.add(ECKey.fromPublicOnly(HEX.decode(hex)));
        return keys;
    }
}
