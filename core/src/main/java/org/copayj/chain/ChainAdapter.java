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

import org.copayj.core.ChainFamily;
import org.copayj.core.CopayException;
import org.copayj.proposal.ProposalOutput;
import org.copayj.proposal.TxProposal;
import org.copayj.wallet.Balance;
import org.copayj.wallet.Utxo;
import org.copayj.wallet.Wallet;

import java.util.List;

/**
 * Chain specific transaction logic used by coin selection and the proposal state machine. One
 * implementation exists per {@link ChainFamily}; they are looked up through {@link ChainAdapters}.
 */
public interface ChainAdapter {
    ChainFamily getFamily();

    /** True when balances are sets of unspent outputs and proposals carry inputs. */
    boolean isUtxoModel();

    boolean supportsMultisig();

    /** Smallest output value the chain relays. */
    long getDustAmount();

    /** Largest transaction the service builds, in kB. */
    int getMaxTxSizeInKb();

    /** Estimated size in (virtual) bytes of the proposal's transaction with its current inputs. */
    int estimatedSize(TxProposal txp, EstimationOptions opts);

    /** Marginal size of one more input of the proposal's script type. */
    int estimatedSizeForSingleInput(TxProposal txp, EstimationOptions opts);

    /** Fee for the proposal at its fee rate, never below the dust amount. */
    long estimatedFee(TxProposal txp, EstimationOptions opts);

    /**
     * Builds the proposal's transaction.
     *
     * @param signed whether to apply the signatures of the proposal's accept votes
     */
    ChainTransaction buildTransaction(TxProposal txp, boolean signed) throws CopayException;

    /**
     * Verifies and applies one copayer's signatures, one per input, each checked against the key derived
     * from {@code xpub} at the input's path. Either every signature is applied or the transaction is
     * left untouched.
     */
    void addSignatures(ChainTransaction tx, List<Utxo> inputs, List<String> inputPaths, List<String> signatures,
                       String xpub, SigningMethod signingMethod) throws CopayException;

    /** Fails with INVALID_ADDRESS or INCORRECT_ADDRESS_NETWORK. */
    void validateAddress(Wallet wallet, String address) throws CopayException;

    void checkDust(ProposalOutput output) throws CopayException;

    void checkScriptOutput(ProposalOutput output) throws CopayException;

    /**
     * Final checks on a proposal with its inputs and fee set: size, input paths, dust and fee. Writes the
     * effective fee back to the proposal.
     */
    void checkTx(TxProposal txp) throws CopayException;

    Balance totalizeUtxos(List<Utxo> utxos);
}
