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
import org.bitcoinj.core.TransactionInput;
import org.bitcoinj.core.TransactionOutput;
import org.bitcoinj.script.Script;
import org.bitcoinj.script.ScriptBuilder;
import org.bitcoinj.script.ScriptException;
import org.copayj.core.Chain;
import org.copayj.core.CopayException;
import org.copayj.core.ErrorCode;
import org.copayj.core.ScriptType;
import org.copayj.proposal.ProposalOptions;
import org.copayj.proposal.ProposalOutput;
import org.copayj.proposal.TxProposal;
import org.copayj.proposal.UtxoPayload;
import org.copayj.testing.TestWallets;
import org.copayj.verify.ProposalSigner;
import org.copayj.wallet.Balance;
import org.copayj.wallet.Utxo;
import org.junit.Before;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class BtcChainAdapterTest {
    private BtcChainAdapter adapter;
    private TestWallets fixture;

    @Before
    public void setUp() {
        adapter = new BtcChainAdapter();
        fixture = TestWallets.twoOfThree();
    }

    private TxProposal proposal(TestWallets wallet, List<Utxo> inputs, long amount, long fee) throws CopayException {
        return TxProposal.create(wallet.proposalOptions()
                .addOutput(ProposalOutput.toAddress(TestWallets.externalAddress("payee"), amount))
                .changeAddress(wallet.address("m/1/0"))
                .inputs(inputs)
                .fee(fee)
                .feePerKb(1000));
    }

    private static void assertCode(ErrorCode expected, CopayException x) {
        assertEquals(x.toString(), expected, x.getCode());
    }

    @Test
    public void scenarioD() throws Exception {
        TxProposal txp = proposal(fixture, ImmutableList.of(
                fixture.utxo("d1", "m/0/0", 6300, 6),
                fixture.utxo("d2", "m/0/1", 4000, 6)), 10000, 300);
        UtxoTransaction tx = adapter.buildTransaction(txp, false);
        assertEquals(2, tx.getTransaction().getInputs().size());
        assertEquals(1, tx.getTransaction().getOutputs().size());
        assertEquals(10300, tx.getInputTotal());
        assertEquals(300, tx.getFee());
    }

    @Test
    public void dustChangeGoesToTheFee() throws Exception {
        TxProposal txp = proposal(fixture, ImmutableList.of(fixture.utxo("d1", "m/0/0", 10300, 6)), 10000, 100);
        UtxoTransaction tx = adapter.buildTransaction(txp, false);
        assertEquals(1, tx.getTransaction().getOutputs().size());
        assertEquals(300, tx.getFee());
    }

    @Test
    public void changeAboveDust() throws Exception {
        TxProposal txp = proposal(fixture, ImmutableList.of(fixture.utxo("c1", "m/0/0", 20000, 6)), 10000, 1000);
        UtxoTransaction tx = adapter.buildTransaction(txp, false);
        assertEquals(2, tx.getTransaction().getOutputs().size());
        assertEquals(1000, tx.getFee());
        // outputs in request order, then change
        assertEquals(9000, tx.getTransaction().getOutput(1).getValue().value);
        assertEquals(tx.getUnsignedSerialization(), txp.getProposalHash(adapter));
    }

    @Test
    public void replaceByFeeSignalling() throws Exception {
        TxProposal txp = TxProposal.create(fixture.proposalOptions()
                .addOutput(ProposalOutput.toAddress(TestWallets.externalAddress("payee"), 10000))
                .changeAddress(fixture.address("m/1/0"))
                .inputs(ImmutableList.of(fixture.utxo("r1", "m/0/0", 20000, 6)))
                .fee(1000L)
                .payload(new UtxoPayload(true, false, 0, null)));
        for (TransactionInput input : adapter.buildTransaction(txp, false).getTransaction().getInputs())
            assertEquals(BtcChainAdapter.RBF_SEQUENCE, input.getSequenceNumber());
    }

    @Test
    public void opReturnOutput() throws Exception {
        TxProposal txp = TxProposal.create(fixture.proposalOptions()
                .addOutput(ProposalOutput.toAddress(TestWallets.externalAddress("payee"), 10000))
                .addOutput(ProposalOutput.script("6a0568656c6c6f", 0))
                .changeAddress(fixture.address("m/1/0"))
                .inputs(ImmutableList.of(fixture.utxo("o1", "m/0/0", 20000, 6)))
                .fee(1000L));
        UtxoTransaction tx = adapter.buildTransaction(txp, false);
        TransactionOutput opReturn = tx.getTransaction().getOutput(1);
        assertEquals(0, opReturn.getValue().value);
        assertTrue(opReturn.getScriptPubKey().isOpReturn());
        adapter.checkTx(txp);
    }

    @Test
    public void inputSizes() throws Exception {
        ProposalOptions single = new ProposalOptions().chain(Chain.BTC).network(TestWallets.NETWORK)
                .walletM(1).walletN(1);
        assertEquals(148, adapter.estimatedSizeForSingleInput(TxProposal.create(single.addressType(ScriptType.P2PKH)), EstimationOptions.DEFAULT));
        assertEquals(69, adapter.estimatedSizeForSingleInput(TxProposal.create(single.addressType(ScriptType.P2WPKH)), EstimationOptions.DEFAULT));
        assertEquals(58, adapter.estimatedSizeForSingleInput(TxProposal.create(single.addressType(ScriptType.P2TR)), EstimationOptions.DEFAULT));
        assertEquals(60, adapter.estimatedSizeForSingleInput(TxProposal.create(single.addressType(ScriptType.P2TR)), EstimationOptions.CONSERVATIVE));

        TxProposal p2wsh = TxProposal.create(TestWallets.create(2, 3, ScriptType.P2WSH).proposalOptions());
        assertEquals(105, adapter.estimatedSizeForSingleInput(p2wsh, EstimationOptions.DEFAULT));
        TxProposal p2sh = TxProposal.create(fixture.proposalOptions());
        assertEquals(294, adapter.estimatedSizeForSingleInput(p2sh, EstimationOptions.DEFAULT));
    }

    @Test
    public void outputSizes() {
        assertEquals(34, adapter.estimatedSizeForSingleOutput(TestWallets.NETWORK.getParams(), TestWallets.externalAddress("a")));
        assertEquals(32, adapter.estimatedSizeForSingleOutput(TestWallets.NETWORK.getParams(), TestWallets.externalP2shAddress("a")));
        assertEquals(43, adapter.estimatedSizeForSingleOutput(TestWallets.NETWORK.getParams(), null));
        assertEquals(43, adapter.estimatedSizeForSingleOutput(TestWallets.NETWORK.getParams(), "garbage"));
    }

    @Test
    public void conservativeEstimateAddsMargins() throws Exception {
        TxProposal txp = proposal(fixture, ImmutableList.of(fixture.utxo("e1", "m/0/0", 20000, 6)), 10000, 1000);
        // 10 + 294 + 34 + 32
        assertEquals(370, adapter.estimatedSize(txp, EstimationOptions.DEFAULT));
        // input margin, then 1% over the total
        assertEquals((int) Math.ceil(372 * 1.01), adapter.estimatedSize(txp, EstimationOptions.CONSERVATIVE));
        assertEquals(546, adapter.estimatedFee(txp, EstimationOptions.DEFAULT));
        assertEquals(370 * 10, adapter.feeForSize(370, 10000));
    }

    @Test
    public void signP2sh() throws Exception {
        TxProposal txp = proposal(fixture, ImmutableList.of(
                fixture.utxo("s1", "m/0/0", 15000, 6),
                fixture.utxo("s2", "m/0/1", 9000, 6)), 20000, 1000);
        UtxoTransaction tx = adapter.buildTransaction(txp, false);
        Script scriptPubKey = ScriptBuilder.createP2SHOutputScript(tx.getMultisigScript(0));

        addSignatures(tx, txp, 0);
        assertEquals(1, tx.getSignatureCount(0));
        assertEquals(1, tx.getSignatureCount(1));
        try {
            tx.getTransaction().getInput(0).getScriptSig().correctlySpends(tx.getTransaction(), 0, null, null,
                    scriptPubKey, Script.ALL_VERIFY_FLAGS);
            fail("one signature is not enough");
        } catch (ScriptException x) {
            // expected
        }

        addSignatures(tx, txp, 2);
        assertEquals(2, tx.getSignatureCount(0));
        tx.getTransaction().getInput(0).getScriptSig().correctlySpends(tx.getTransaction(), 0, null, null,
                scriptPubKey, Script.ALL_VERIFY_FLAGS);
        tx.getTransaction().getInput(1).getScriptSig().correctlySpends(tx.getTransaction(), 1, null, null,
                ScriptBuilder.createP2SHOutputScript(tx.getMultisigScript(1)), Script.ALL_VERIFY_FLAGS);
        assertNotEquals(tx.getUnsignedSerialization(), tx.serialize());
    }

    @Test
    public void signP2wsh() throws Exception {
        TestWallets segwit = TestWallets.create(2, 3, ScriptType.P2WSH);
        TxProposal txp = proposal(segwit, ImmutableList.of(segwit.utxo("w1", "m/0/0", 15000, 6)), 10000, 1000);
        UtxoTransaction tx = adapter.buildTransaction(txp, false);
        assertEquals(tx.getTxId(), tx.getTransaction().getTxId().toString());

        addSignatures(tx, txp, segwit, 1);
        addSignatures(tx, txp, segwit, 2);
        TransactionInput input = tx.getTransaction().getInput(0);
        assertEquals(0, input.getScriptBytes().length);
        assertEquals(4, input.getWitness().getPushCount());
        assertEquals(0, input.getWitness().getPush(0).length);
        // signing does not change the txid of a segwit transaction
        assertEquals(adapter.buildTransaction(txp, false).getTxId(), tx.getTxId());
    }

    private void addSignatures(UtxoTransaction tx, TxProposal txp, int copayer) throws CopayException {
        addSignatures(tx, txp, fixture, copayer);
    }

    private void addSignatures(UtxoTransaction tx, TxProposal txp, TestWallets wallet, int copayer) throws CopayException {
        List<String> signatures = ProposalSigner.signInputs(adapter, txp, wallet.accountKeys.get(copayer));
        adapter.addSignatures(tx, txp.getInputs(), txp.getInputPaths(), signatures, wallet.copayer(copayer).getXPubKey(),
                SigningMethod.ECDSA);
    }

    @Test
    public void badSignaturesAreNotApplied() throws Exception {
        TxProposal txp = proposal(fixture, ImmutableList.of(
                fixture.utxo("b1", "m/0/0", 15000, 6),
                fixture.utxo("b2", "m/0/1", 9000, 6)), 20000, 1000);
        UtxoTransaction tx = adapter.buildTransaction(txp, false);
        List<String> signatures = ProposalSigner.signInputs(adapter, txp, fixture.accountKeys.get(0));

        try {
            adapter.addSignatures(tx, txp.getInputs(), txp.getInputPaths(), signatures.subList(0, 1),
                    fixture.copayer(0).getXPubKey(), SigningMethod.ECDSA);
            fail();
        } catch (CopayException x) {
            assertCode(ErrorCode.SIGNATURE_COUNT_MISMATCH, x);
        }
        try {
            // signed by copayer 0, claimed by copayer 1
            adapter.addSignatures(tx, txp.getInputs(), txp.getInputPaths(), signatures,
                    fixture.copayer(1).getXPubKey(), SigningMethod.ECDSA);
            fail();
        } catch (CopayException x) {
            assertCode(ErrorCode.BAD_SIGNATURES, x);
        }
        try {
            adapter.addSignatures(tx, txp.getInputs(), txp.getInputPaths(), ImmutableList.of(signatures.get(0), "zz"),
                    fixture.copayer(0).getXPubKey(), SigningMethod.ECDSA);
            fail();
        } catch (CopayException x) {
            assertCode(ErrorCode.BAD_SIGNATURES, x);
        }
        try {
            adapter.addSignatures(tx, txp.getInputs(), txp.getInputPaths(), signatures,
                    fixture.copayer(0).getXPubKey(), SigningMethod.SCHNORR);
            fail();
        } catch (CopayException x) {
            assertCode(ErrorCode.UNSUPPORTED_SCRIPT_TYPE, x);
        }
        assertEquals(0, tx.getSignatureCount(0));
        assertEquals(0, tx.getSignatureCount(1));
    }

    @Test
    public void inputPathsMustCoverEveryInput() throws Exception {
        TxProposal txp = proposal(fixture, ImmutableList.of(
                fixture.utxo("p1", "m/0/0", 15000, 6),
                fixture.utxo("p2", "m/0/1", 9000, 6)), 20000, 1000);
        UtxoTransaction tx = adapter.buildTransaction(txp, false);
        List<String> signatures = ProposalSigner.signInputs(adapter, txp, fixture.accountKeys.get(0));
        try {
            adapter.addSignatures(tx, txp.getInputs(), txp.getInputPaths().subList(0, 1), signatures,
                    fixture.copayer(0).getXPubKey(), SigningMethod.ECDSA);
            fail();
        } catch (CopayException x) {
            assertCode(ErrorCode.INTERNAL, x);
        }
        assertEquals(0, tx.getSignatureCount(0));
    }

    @Test
    public void validateAddress() throws Exception {
        adapter.validateAddress(fixture.wallet, TestWallets.externalAddress("x"));
        adapter.validateAddress(fixture.wallet, fixture.address("m/0/0").getAddress());
        try {
            adapter.validateAddress(fixture.wallet, "1BvBMSEYstWetqTFn5Au4m4GFg7xJaNVN2");
            fail();
        } catch (CopayException x) {
            assertCode(ErrorCode.INCORRECT_ADDRESS_NETWORK, x);
        }
        try {
            adapter.validateAddress(fixture.wallet, "not an address");
            fail();
        } catch (CopayException x) {
            assertCode(ErrorCode.INVALID_ADDRESS, x);
        }
    }

    @Test
    public void outputChecks() throws Exception {
        adapter.checkDust(ProposalOutput.toAddress("a", 546));
        try {
            adapter.checkDust(ProposalOutput.toAddress("a", 545));
            fail();
        } catch (CopayException x) {
            assertCode(ErrorCode.DUST_AMOUNT, x);
        }

        adapter.checkScriptOutput(ProposalOutput.script("6a0568656c6c6f", 0));
        try {
            adapter.checkScriptOutput(ProposalOutput.script("6a0568656c6c6f", 1));
            fail();
        } catch (CopayException x) {
            assertCode(ErrorCode.SCRIPT_OP_RETURN_AMOUNT, x);
        }
        try {
            adapter.checkScriptOutput(ProposalOutput.script("76a914", 0));
            fail();
        } catch (CopayException x) {
            assertCode(ErrorCode.SCRIPT_OP_RETURN, x);
        }
        try {
            adapter.checkScriptOutput(ProposalOutput.script("zz", 0));
            fail();
        } catch (CopayException x) {
            assertCode(ErrorCode.SCRIPT_TYPE, x);
        }
    }

    @Test
    public void checkTxRejectsDustOutputs() throws Exception {
        TxProposal txp = proposal(fixture, ImmutableList.of(fixture.utxo("t1", "m/0/0", 20000, 6)), 500, 1000);
        try {
            adapter.checkTx(txp);
            fail();
        } catch (CopayException x) {
            assertCode(ErrorCode.DUST_AMOUNT, x);
        }
    }

    @Test
    public void checkTxWritesEffectiveFee() throws Exception {
        TxProposal txp = proposal(fixture, ImmutableList.of(fixture.utxo("t1", "m/0/0", 10900, 6)), 10000, 600);
        adapter.checkTx(txp);
        // 300 of change is below dust
        assertEquals(Long.valueOf(900), txp.getFee());
    }

    @Test
    public void feeCap() throws Exception {
        TxProposal txp = TxProposal.create(fixture.proposalOptions()
                .addOutput(ProposalOutput.toAddress(TestWallets.externalAddress("payee"), 10000))
                .inputs(ImmutableList.of(fixture.utxo("f1", "m/0/0", 10000000, 6))));
        txp.setFee(9990000);
        try {
            adapter.buildTransaction(txp, false);
            fail();
        } catch (CopayException x) {
            assertCode(ErrorCode.TX_FEE_TOO_HIGH, x);
        }
    }

    @Test
    public void multiTxIsRejected() {
        try {
            TxProposal.create(fixture.proposalOptions().multiTx(true));
            fail();
        } catch (CopayException x) {
            assertCode(ErrorCode.MULTI_TX_UNSUPPORTED, x);
            assertEquals(ErrorCode.Category.CAPABILITY, x.getCategory());
        }
    }

    @Test
    public void balance() {
        Utxo a = fixture.utxo("a", "m/0/0", 1000, 0);
        Utxo b = fixture.utxo("b", "m/0/1", 2000, 3);
        Utxo c = fixture.utxo("c", "m/0/2", 4000, 6);
        c.setLocked(true);
        Balance balance = adapter.totalizeUtxos(ImmutableList.of(a, b, c));
        assertEquals(7000, balance.getTotalAmount());
        assertEquals(4000, balance.getLockedAmount());
        assertEquals(6000, balance.getTotalConfirmedAmount());
        assertEquals(4000, balance.getLockedConfirmedAmount());
        assertEquals(3000, balance.getAvailableAmount());
        assertEquals(2000, balance.getAvailableConfirmedAmount());
    }
}
