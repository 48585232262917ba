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

package org.copayj.verify;

import org.bitcoinj.core.ECKey;
import org.bitcoinj.core.Sha256Hash;
import org.bitcoinj.crypto.DeterministicKey;
import org.copayj.chain.ChainAdapter;
import org.copayj.chain.ChainTransaction;
import org.copayj.chain.UtxoTransaction;
import org.copayj.core.CopayException;
import org.copayj.core.ErrorCode;
import org.copayj.crypto.KeyPaths;
import org.copayj.crypto.MessageSigner;
import org.copayj.proposal.TxProposal;

import java.util.ArrayList;
import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;
import static org.bitcoinj.core.Utils.HEX;

/**
 * Client side signing of proposals: the creator's signature over the proposal hash, and a copayer's
 * input signatures for an accept vote.
 */
public class ProposalSigner {
    private ProposalSigner() {
    }

    /** Signature the creator sends when publishing, made with its request (or proposal) key. */
    public static String signProposal(ChainAdapter adapter, TxProposal txp, ECKey requestPrivKey) throws CopayException {
        return MessageSigner.signMessage(txp.getProposalHash(adapter), requestPrivKey);
    }

    /**
     * One DER hex signature per input, in input order, made with the keys derived from
     * {@code xPrivKey} at the input paths.
     */
    public static List<String> signInputs(ChainAdapter adapter, TxProposal txp, DeterministicKey xPrivKey)
            throws CopayException {
        checkArgument(xPrivKey.hasPrivKey(), "an extended private key is needed to sign");
        ChainTransaction chainTx = adapter.buildTransaction(txp, false);
        if (!(chainTx instanceof UtxoTransaction))
            throw new CopayException(ErrorCode.UNSUPPORTED_CHAIN, "Input signing is done for bitcoin transactions only");
        UtxoTransaction tx = (UtxoTransaction) chainTx;

        List<String> signatures = new ArrayList<>();
        List<String> paths = txp.getInputPaths();
        for (int i = 0; i < paths.size(); i++) {
            ECKey key = KeyPaths.derive(xPrivKey, paths.get(i));
            Sha256Hash hash;
            try {
                hash = tx.hashForSignature(i, key);
            } catch (IllegalStateException x) {
                throw new CopayException(ErrorCode.UNSUPPORTED_SCRIPT_TYPE, x.getMessage(), x);
            }
            signatures.add(HEX.encode(key.sign(hash).encodeToDER()));
        }
        return signatures;
    }
}
