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

package org.copayj.chain;

import com.google.common.collect.ImmutableList;
import org.bitcoinj.core.Coin;
import org.bitcoinj.core.ECKey;
import org.bitcoinj.core.Sha256Hash;
import org.bitcoinj.core.Transaction;
import org.bitcoinj.core.TransactionInput;
import org.bitcoinj.core.TransactionOutput;
import org.bitcoinj.core.TransactionWitness;
import org.bitcoinj.crypto.TransactionSignature;
import org.bitcoinj.script.Script;
import org.bitcoinj.script.ScriptBuilder;
import org.copayj.core.ScriptType;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkElementIndex;
import static org.bitcoinj.core.Utils.HEX;

/**
 * A bitcoinj {@link Transaction} built from a proposal, with what is needed to sign each input: its
 * value and, for multisig inputs, the redeem (or witness) script. Signatures are kept per input and
 * per key, and the input scripts and witnesses are rebuilt from them whenever one is added.
 */
public class UtxoTransaction implements ChainTransaction {
    private final Transaction tx;
    private final ScriptType scriptType;
    private final List<Coin> inputValues;
    private final List<Script> multisigScripts;
    private final List<Map<String, Signed>> signatures;
    private final String unsignedSerialization;

    private static class Signed {
        final ECKey key;
        final TransactionSignature signature;

        Signed(ECKey key, TransactionSignature signature) {
            this.key = key;
            this.signature = signature;
        }
    }

    /**
     * @param multisigScripts per input redeem script of a P2SH or P2WSH wallet, null entries otherwise
     */
    UtxoTransaction(Transaction tx, ScriptType scriptType, List<Coin> inputValues, List<Script> multisigScripts) {
        checkArgument(tx.getInputs().size() == inputValues.size(), "one value per input");
        checkArgument(tx.getInputs().size() == multisigScripts.size(), "one script per input");
        this.tx = tx;
        this.scriptType = scriptType;
        this.inputValues = ImmutableList.copyOf(inputValues);
        this.multisigScripts = new ArrayList<>(multisigScripts);
        this.signatures = new ArrayList<>();
        for (int i = 0; i < inputValues.size(); i++)
            signatures.add(new LinkedHashMap<String, Signed>());
        this.unsignedSerialization = HEX.encode(tx.bitcoinSerialize());
    }

    public Transaction getTransaction() {
        return tx;
    }

    public ScriptType getScriptType() {
        return scriptType;
    }

    /** Hash an input signature commits to, for the given signing key. */
    public Sha256Hash hashForSignature(int index, ECKey key) {
        checkElementIndex(index, inputValues.size());
        switch (scriptType) {
            case P2SH:
                return tx.hashForSignature(index, multisigScripts.get(index), Transaction.SigHash.ALL, false);
            case P2WSH:
                return tx.hashForWitnessSignature(index, multisigScripts.get(index), inputValues.get(index),
                        Transaction.SigHash.ALL, false);
            case P2PKH:
                return tx.hashForSignature(index, ScriptBuilder.createP2PKHOutputScript(key), Transaction.SigHash.ALL, false);
            case P2WPKH:
                return tx.hashForWitnessSignature(index, ScriptBuilder.createP2PKHOutputScript(key), inputValues.get(index),
                        Transaction.SigHash.ALL, false);
            default:
                throw new IllegalStateException("No signature hash for " + scriptType + " inputs");
        }
    }

    /** Whether a multisig input may be signed by this key. Single key inputs accept any key. */
    public boolean canSign(int index, ECKey key) {
        Script script = multisigScripts.get(index);
        if (script == null)
            return true;
        for (ECKey k : script.getPubKeys())
            if (Arrays.equals(k.getPubKey(), key.getPubKey()))
                return true;
        return false;
    }

    void addSignature(int index, ECKey key, TransactionSignature signature) {
        signatures.get(index).put(key.getPublicKeyAsHex(), new Signed(key, signature));
    }

    /** Rebuilds input scripts and witnesses from the collected signatures. */
    void updateInputs() {
        for (int i = 0; i < inputValues.size(); i++) {
            Map<String, Signed> inputSigs = signatures.get(i);
            if (inputSigs.isEmpty())
                continue;
            TransactionInput input = tx.getInput(i);
            switch (scriptType) {
                case P2SH:
                    input.setScriptSig(ScriptBuilder.createP2SHMultiSigInputScript(orderedSignatures(i), multisigScripts.get(i)));
                    break;
                case P2WSH: {
                    List<TransactionSignature> sigs = orderedSignatures(i);
                    TransactionWitness witness = new TransactionWitness(sigs.size() + 2);
                    witness.setPush(0, new byte[0]);
                    for (int j = 0; j < sigs.size(); j++)
                        witness.setPush(j + 1, sigs.get(j).encodeToBitcoin());
                    witness.setPush(sigs.size() + 1, multisigScripts.get(i).getProgram());
                    input.setScriptSig(new Script(new byte[0]));
                    input.setWitness(witness);
                    break;
                }
                case P2PKH: {
                    Signed signed = inputSigs.values().iterator().next();
                    input.setScriptSig(ScriptBuilder.createInputScript(signed.signature, signed.key));
                    break;
                }
                case P2WPKH: {
                    Signed signed = inputSigs.values().iterator().next();
                    input.setScriptSig(new Script(new byte[0]));
                    input.setWitness(TransactionWitness.redeemP2WPKH(signed.signature, signed.key));
                    break;
                }
                default:
                    throw new IllegalStateException("Cannot assemble " + scriptType + " inputs");
            }
        }
    }

    // CHECKMULTISIG wants signatures in the order of the keys in the script, at most m of them.
    private List<TransactionSignature> orderedSignatures(int index) {
        Script script = multisigScripts.get(index);
        int required = script.getNumberOfSignaturesRequiredToSpend();
        List<TransactionSignature> result = new ArrayList<>();
        Map<String, Signed> inputSigs = signatures.get(index);
        for (ECKey key : script.getPubKeys()) {
            Signed signed = inputSigs.get(key.getPublicKeyAsHex());
            if (signed != null && result.size() < required)
                result.add(signed.signature);
        }
        return result;
    }

    public int getSignatureCount(int index) {
        return signatures.get(index).size();
    }

    @Nullable
    public Script getMultisigScript(int index) {
        return multisigScripts.get(index);
    }

    @Override
    public String getUnsignedSerialization() {
        return unsignedSerialization;
    }

    @Override
    public String serialize() {
        return HEX.encode(tx.bitcoinSerialize());
    }

    @Override
    public String getTxId() {
        return tx.getTxId().toString();
    }

    @Override
    public List<String> getTxIds() {
        return ImmutableList.of(getTxId());
    }

    public long getInputTotal() {
        long total = 0;
        for (Coin value : inputValues)
            total += value.value;
        return total;
    }

    public long getOutputTotal() {
        long total = 0;
        for (TransactionOutput output : tx.getOutputs())
            total += output.getValue().value;
        return total;
    }

    @Override
    public long getFee() {
        return getInputTotal() - getOutputTotal();
    }

    @Override
    public String toString() {
        return "UtxoTransaction{" + getTxId() + ", " + tx.getInputs().size() + " in, " + tx.getOutputs().size() + " out}";
    }
}
