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

import com.google.common.collect.ImmutableList;
import org.bitcoinj.core.ECKey;
import org.copayj.chain.BtcChainAdapter;
import org.copayj.core.ScriptType;
import org.copayj.crypto.CopayerIds;
import org.copayj.crypto.MemoCrypter;
import org.copayj.proposal.ProposalOutput;
import org.copayj.proposal.TxProposal;
import org.copayj.proposal.UtxoPayload;
import org.copayj.testing.TestWallets;
import org.copayj.wallet.AddressDeriver;
import org.copayj.wallet.AddressInfo;
import org.copayj.wallet.Copayer;
import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class VerifierTest {
    private static final String PAYEE = TestWallets.externalAddress("payee");

    private Verifier verifier;
    private BtcChainAdapter adapter;
    private TestWallets fixture;
    private Credentials credentials;

    @Before
    public void setUp() {
        verifier = new Verifier();
        adapter = new BtcChainAdapter();
        fixture = TestWallets.twoOfThree();
        credentials = fixture.credentials(1);
    }

    private TxProposal proposal(String message) throws Exception {
        return TxProposal.create(fixture.proposalOptions()
                .addOutput(ProposalOutput.toAddress(PAYEE, 30000, message))
                .message(message)
                .changeAddress(fixture.address("m/1/0"))
                .inputs(ImmutableList.of(fixture.utxo("v", "m/0/0", 50000, 3)))
                .fee(1000L)
                .feePerKb(1000));
    }

    private TxProposal signedProposal() throws Exception {
        TxProposal txp = proposal(null);
        txp.setProposalSignature(ProposalSigner.signProposal(adapter, txp, fixture.requestKeys.get(0)), null, null);
        return txp;
    }

    @Test
    public void addresses() {
        assertTrue(verifier.checkAddress(credentials, fixture.address("m/0/7")));
        AddressInfo other = fixture.address("m/0/8");
        assertFalse(verifier.checkAddress(credentials, new AddressInfo(other.getAddress(), "m/0/7",
                other.getPublicKeys(), ScriptType.P2SH)));
        assertFalse(verifier.checkAddress(credentials, null));
    }

    @Test
    public void addressMissingOneOfOurKeys() {
        AddressInfo address = fixture.address("m/0/7");
        List<String> keys = new ArrayList<>(address.getPublicKeys());
        keys.remove(2);
        assertFalse(verifier.checkAddress(credentials, new AddressInfo(address.getAddress(), address.getPath(), keys,
                address.getType())));
    }

    @Test
    public void copayers() {
        List<Copayer> copayers = fixture.wallet.getCopayers();
        assertTrue(verifier.checkCopayers(credentials, copayers));
        assertFalse(verifier.checkCopayers(credentials, copayers.subList(0, 2)));

        List<Copayer> repeated = new ArrayList<>(copayers);
        repeated.set(2, copayers.get(0));
        assertFalse(verifier.checkCopayers(credentials, repeated));

        Copayer c = copayers.get(2);
        List<Copayer> renamed = new ArrayList<>(copayers);
        renamed.set(2, new Copayer(c.getId(), "mallory", c.getXPubKey(), c.getRequestPubKey(), c.getSignature()));
        assertFalse(verifier.checkCopayers(credentials, renamed));
    }

    @Test
    public void copayersWithoutUs() {
        TestWallets strangers = TestWallets.create(2, 3, ScriptType.P2WSH);
        Credentials ours = Credentials.builder()
                .chain(credentials.getChain())
                .network(credentials.getNetwork())
                .m(2)
                .n(3)
                .xPubKey(credentials.getXPubKey())
                .publicKeyRing(credentials.getPublicKeyRing())
                .walletPrivKey(strangers.walletKey)
                .build();
        assertFalse(verifier.checkCopayers(ours, strangers.wallet.getCopayers()));
    }

    @Test
    public void proposalCreation() throws Exception {
        String key = credentials.getSharedEncryptingKey();
        String memo = MemoCrypter.encryptMessage("lunch", key);
        TxProposal txp = proposal(memo);
        ProposalRequest request = new ProposalRequest(ImmutableList.of(ProposalOutput.toAddress(PAYEE, 30000, memo)),
                null, 1000L, null, memo, null);
        assertTrue(verifier.checkProposalCreation(request, txp, key));

        ProposalRequest otherAmount = new ProposalRequest(ImmutableList.of(ProposalOutput.toAddress(PAYEE, 30001, memo)),
                null, 1000L, null, memo, null);
        assertFalse(verifier.checkProposalCreation(otherAmount, txp, key));

        ProposalRequest otherFee = new ProposalRequest(request.getOutputs(), null, 2000L, null, memo, null);
        assertFalse(verifier.checkProposalCreation(otherFee, txp, key));

        ProposalRequest otherChange = new ProposalRequest(request.getOutputs(), fixture.address("m/1/1").getAddress(),
                1000L, null, memo, null);
        assertFalse(verifier.checkProposalCreation(otherChange, txp, key));
    }

    @Test
    public void proposalCreationWithReplacedMemo() throws Exception {
        String key = credentials.getSharedEncryptingKey();
        String sent = MemoCrypter.encryptMessage("lunch", key);
        TxProposal txp = proposal(MemoCrypter.encryptMessage("dinner", key));
        ProposalRequest request = new ProposalRequest(ImmutableList.of(ProposalOutput.toAddress(PAYEE, 30000, sent)),
                null, null, null, sent, null);
        assertFalse(verifier.checkProposalCreation(request, txp, key));
    }

    @Test
    public void proposalCreationCustomData() throws Exception {
        TxProposal txp = TxProposal.create(fixture.proposalOptions()
                .addOutput(ProposalOutput.toAddress(PAYEE, 30000))
                .customData("{\"a\":1,\"b\":[2,3]}"));
        ProposalRequest same = new ProposalRequest(txp.getOutputs(), null, null, null, null, "{\"b\":[2,3],\"a\":1}");
        assertTrue(verifier.checkProposalCreation(same, txp, null));
        ProposalRequest other = new ProposalRequest(txp.getOutputs(), null, null, null, null, "{\"a\":2}");
        assertFalse(verifier.checkProposalCreation(other, txp, null));
    }

    @Test
    public void proposalSignature() throws Exception {
        TxProposal txp = signedProposal();
        assertTrue(verifier.checkTxProposalSignature(credentials, txp));
        assertTrue(verifier.checkTxProposal(credentials, txp, null));
    }

    @Test
    public void proposalSignedByAnotherCopayer() throws Exception {
        TxProposal txp = proposal(null);
        txp.setProposalSignature(ProposalSigner.signProposal(adapter, txp, fixture.requestKeys.get(1)), null, null);
        assertFalse(verifier.checkTxProposalSignature(credentials, txp));
    }

    @Test
    public void tamperedProposal() throws Exception {
        TxProposal txp = signedProposal();
        txp.setFee(999);
        assertFalse(verifier.checkTxProposalSignature(credentials, txp));
    }

    @Test
    public void prePublishRawFallback() throws Exception {
        TxProposal txp = proposal(null);
        String prePublishRaw = txp.getProposalHash(adapter);
        txp.setProposalSignature(ProposalSigner.signProposal(adapter, txp, fixture.requestKeys.get(0)), null, null);
        txp.setPrePublishRaw(prePublishRaw);
        txp.setFee(1100);
        assertTrue(verifier.checkTxProposalSignature(credentials, txp));
    }

    @Test
    public void foreignChangeAddress() throws Exception {
        TxProposal txp = proposal(null);
        AddressInfo ours = fixture.address("m/1/0");
        txp.setChangeAddress(new AddressInfo(TestWallets.externalP2shAddress("thief"), ours.getPath(),
                ours.getPublicKeys(), ScriptType.P2SH));
        txp.setProposalSignature(ProposalSigner.signProposal(adapter, txp, fixture.requestKeys.get(0)), null, null);
        assertFalse(verifier.checkTxProposalSignature(credentials, txp));
    }

    @Test
    public void delegatedProposalKey() throws Exception {
        TxProposal txp = proposal(null);
        ECKey proposalKey = new ECKey();
        String pubKey = proposalKey.getPublicKeyAsHex();
        txp.setProposalSignature(ProposalSigner.signProposal(adapter, txp, proposalKey), pubKey,
                CopayerIds.signRequestPubKey(pubKey, fixture.accountKeys.get(0)));
        assertTrue(verifier.checkTxProposalSignature(credentials, txp));

        // authorized by someone else's extended key
        txp.setProposalSignature(ProposalSigner.signProposal(adapter, txp, proposalKey), pubKey,
                CopayerIds.signRequestPubKey(pubKey, fixture.accountKeys.get(2)));
        assertFalse(verifier.checkTxProposalSignature(credentials, txp));
    }

    @Test
    public void escrowAddress() throws Exception {
        TxProposal txp = TxProposal.create(fixture.proposalOptions()
                .addOutput(ProposalOutput.toAddress(PAYEE, 30000))
                .changeAddress(fixture.address("m/1/0"))
                .inputs(ImmutableList.of(fixture.utxo("e", "m/0/3", 50000, 3)))
                .payload(new UtxoPayload(false, false, 2000, null))
                .fee(1000L));
        AddressInfo escrow = AddressDeriver.deriveAddress(ScriptType.P2SH, fixture.wallet.getPublicKeyRing(), "m/1/1",
                2, TestWallets.NETWORK, txp.getInputPaths());
        txp.setEscrowAddress(escrow);
        txp.setProposalSignature(ProposalSigner.signProposal(adapter, txp, fixture.requestKeys.get(0)), null, null);
        assertTrue(verifier.checkTxProposalSignature(credentials, txp));

        AddressInfo plain = fixture.address("m/1/1");
        txp.setEscrowAddress(plain);
        txp.setProposalSignature(ProposalSigner.signProposal(adapter, txp, fixture.requestKeys.get(0)), null, null);
        assertFalse(verifier.checkTxProposalSignature(credentials, txp));
    }

    @Test
    public void paypro() throws Exception {
        TxProposal txp = proposal(null);
        PayProDetails invoice = new PayProDetails(ImmutableList.of(new PayProDetails.Instruction(PAYEE, 30000)), 10.0);
        assertTrue(verifier.checkPaypro(txp, invoice));

        PayProDetails more = new PayProDetails(ImmutableList.of(new PayProDetails.Instruction(PAYEE, 30000),
                new PayProDetails.Instruction(TestWallets.externalAddress("tip"), 100)), null);
        assertFalse(verifier.checkPaypro(txp, more));

        PayProDetails elsewhere = new PayProDetails(ImmutableList.of(
                new PayProDetails.Instruction(TestWallets.externalAddress("other"), 30000)), null);
        assertFalse(verifier.checkPaypro(txp, elsewhere));

        assertFalse(verifier.checkPaypro(txp, new PayProDetails(ImmutableList.<PayProDetails.Instruction>of(), null)));
    }

    @Test
    public void proposalWithoutCreator() throws Exception {
        TxProposal txp = TxProposal.create(fixture.proposalOptions()
                .creatorId(null)
                .addOutput(ProposalOutput.toAddress(PAYEE, 30000))
                .changeAddress(fixture.address("m/1/0"))
                .inputs(ImmutableList.of(fixture.utxo("v", "m/0/0", 50000, 3)))
                .fee(1000L)
                .feePerKb(1000));
        txp.setProposalSignature(ProposalSigner.signProposal(adapter, txp, fixture.requestKeys.get(0)), null, null);
        assertFalse(verifier.checkTxProposalSignature(credentials, txp));
    }

    @Test
    public void incompleteWalletChecksNothing() throws Exception {
        Credentials joining = Credentials.builder()
                .chain(credentials.getChain())
                .network(credentials.getNetwork())
                .m(2)
                .n(3)
                .xPubKey(credentials.getXPubKey())
                .publicKeyRing(credentials.getPublicKeyRing().subList(0, 2))
                .build();
        assertFalse(verifier.checkTxProposalSignature(joining, signedProposal()));
        assertFalse(verifier.checkAddress(joining, fixture.address("m/0/7")));
        assertFalse(verifier.checkCopayers(joining, fixture.wallet.getCopayers()));
    }
}
