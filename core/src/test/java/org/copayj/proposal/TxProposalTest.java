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

package org.copayj.proposal;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import org.bitcoinj.core.Transaction;
import org.bitcoinj.core.Utils;
import org.copayj.chain.BtcChainAdapter;
import org.copayj.core.CopayException;
import org.copayj.core.ErrorCode;
import org.copayj.core.ScriptType;
import org.copayj.testing.TestWallets;
import org.copayj.verify.ProposalSigner;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.util.List;

import static org.bitcoinj.core.Utils.HEX;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class TxProposalTest {
    private BtcChainAdapter adapter;
    private TestWallets fixture;
    private TxProposal txp;

    @Before
    public void setUp() throws Exception {
        Utils.setMockClock();
        adapter = new BtcChainAdapter();
        fixture = TestWallets.twoOfThree();
        txp = TxProposal.create(fixture.proposalOptions()
                .addOutput(ProposalOutput.toAddress(TestWallets.externalAddress("payee"), 20000))
                .changeAddress(fixture.address("m/1/0"))
                .inputs(ImmutableList.of(
                        fixture.utxo("i1", "m/0/0", 10000, 6),
                        fixture.utxo("i2", "m/0/1", 8000, 6),
                        fixture.utxo("i3", "m/0/2", 5000, 6)))
                .fee(1200L)
                .feePerKb(1000));
    }

    @After
    public void tearDown() {
        Utils.resetMocking();
    }

    private List<String> signatures(int copayer) throws CopayException {
        return ProposalSigner.signInputs(adapter, txp, fixture.accountKeys.get(copayer));
    }

    private void sign(int copayer) throws CopayException {
        txp.sign(adapter, fixture.copayerId(copayer), signatures(copayer), fixture.copayer(copayer).getXPubKey());
    }

    private void reject(int copayer) throws CopayException {
        txp.reject(fixture.copayerId(copayer), "no");
    }

    @Test
    public void newProposal() {
        assertTrue(txp.isTemporary());
        assertFalse(txp.isPending());
        assertEquals(TxProposalStatus.TEMPORARY, txp.getStatus());
        assertEquals(3, txp.getVersion());
        assertEquals(2, txp.getRequiredSignatures());
        assertEquals(2, txp.getRequiredRejections());
        assertEquals(20000, txp.getAmount());
        assertEquals(Utils.currentTimeSeconds(), txp.getCreatedOn());
        assertEquals(ImmutableList.of(0, 1), txp.getOutputOrder());
        assertEquals(ImmutableList.of("m/0/0", "m/0/1", "m/0/2"), txp.getInputPaths());
    }

    @Test
    public void quorums() throws Exception {
        assertEquals(1, TxProposal.create(TestWallets.create(1, 1, ScriptType.P2PKH).proposalOptions()).getRequiredRejections());
        assertEquals(3, TxProposal.create(TestWallets.create(3, 5, ScriptType.P2SH).proposalOptions()).getRequiredRejections());
        assertEquals(2, TxProposal.create(TestWallets.create(2, 5, ScriptType.P2SH).proposalOptions()).getRequiredRejections());
        assertEquals(1, TxProposal.create(TestWallets.create(3, 3, ScriptType.P2SH).proposalOptions()).getRequiredRejections());
    }

    @Test
    public void temporaryProposalsCannotBeVotedOn() throws Exception {
        try {
            reject(1);
            fail();
        } catch (CopayException x) {
            assertEquals(ErrorCode.TX_NOT_PENDING, x.getCode());
        }
        assertTrue(txp.getActions().isEmpty());
    }

    @Test(expected = IllegalStateException.class)
    public void publishOnce() {
        txp.publish();
        txp.publish();
    }

    @Test
    public void scenarioB() throws Exception {
        txp.publish();
        reject(0);
        assertEquals(TxProposalStatus.PENDING, txp.getStatus());
        reject(1);
        assertEquals(TxProposalStatus.REJECTED, txp.getStatus());
        assertTrue(txp.isRejected());
        try {
            sign(2);
            fail();
        } catch (CopayException x) {
            assertEquals(ErrorCode.TX_NOT_PENDING, x.getCode());
        }
        assertEquals(TxProposalStatus.REJECTED, txp.getStatus());
        assertEquals(ImmutableList.of(fixture.copayerId(0), fixture.copayerId(1)), txp.getRejecters());
        assertTrue(txp.getApprovers().isEmpty());
    }

    @Test
    public void scenarioC() throws Exception {
        txp.publish();
        List<String> signatures = signatures(0);
        try {
            txp.sign(adapter, fixture.copayerId(0), signatures.subList(0, 2), fixture.copayer(0).getXPubKey());
            fail();
        } catch (CopayException x) {
            assertEquals(ErrorCode.SIGNATURE_COUNT_MISMATCH, x.getCode());
        }
        assertTrue(txp.getActions().isEmpty());
        assertEquals(TxProposalStatus.PENDING, txp.getStatus());
        assertNull(txp.getActionBy(fixture.copayerId(0)));

        // the same copayer can still vote once its signatures are right
        sign(0);
        assertEquals(ActionType.ACCEPT, txp.getActionBy(fixture.copayerId(0)).getType());
    }

    @Test
    public void forgedSignaturesAreNotRecorded() throws Exception {
        txp.publish();
        try {
            txp.sign(adapter, fixture.copayerId(1), signatures(0), fixture.copayer(1).getXPubKey());
            fail();
        } catch (CopayException x) {
            assertEquals(ErrorCode.BAD_SIGNATURES, x.getCode());
        }
        assertTrue(txp.getActions().isEmpty());
    }

    @Test
    public void acceptedOnceQuorumIsReached() throws Exception {
        txp.publish();
        sign(0);
        assertEquals(TxProposalStatus.PENDING, txp.getStatus());
        assertNull(txp.getTxid());
        sign(2);
        assertEquals(TxProposalStatus.ACCEPTED, txp.getStatus());
        assertNotNull(txp.getTxid());
        String raw = txp.getRaw();
        Transaction tx = new Transaction(TestWallets.NETWORK.getParams(), HEX.decode(raw));
        assertEquals(txp.getTxid(), tx.getTxId().toString());
        assertEquals(3, tx.getInputs().size());

        // a late accept is recorded but changes nothing
        sign(1);
        assertEquals(TxProposalStatus.ACCEPTED, txp.getStatus());
        assertEquals(raw, txp.getRaw());
        assertEquals(3, txp.getApprovers().size());
        assertEquals(ImmutableList.of(fixture.copayerId(0), fixture.copayerId(2), fixture.copayerId(1)), txp.getActors());
    }

    @Test
    public void oneVotePerCopayer() throws Exception {
        txp.publish();
        sign(0);
        try {
            reject(0);
            fail();
        } catch (CopayException x) {
            assertEquals(ErrorCode.COPAYER_VOTED, x.getCode());
        }
        assertEquals(1, txp.getActions().size());
    }

    @Test
    public void rejectedProposalStaysRejected() throws Exception {
        txp.publish();
        sign(0);
        reject(1);
        reject(2);
        assertEquals(TxProposalStatus.REJECTED, txp.getStatus());
        assertFalse(txp.isPending());
        assertEquals("no", txp.getActionBy(fixture.copayerId(1)).getComment());
    }

    @Test
    public void broadcast() throws Exception {
        txp.publish();
        try {
            txp.markBroadcasted();
            fail();
        } catch (CopayException x) {
            assertEquals(ErrorCode.TX_NOT_ACCEPTED, x.getCode());
        }
        sign(0);
        sign(1);
        Utils.rollMockClock(60);
        txp.markBroadcasted();
        assertTrue(txp.isBroadcasted());
        assertFalse(txp.isPending());
        assertEquals(Long.valueOf(Utils.currentTimeSeconds()), txp.getBroadcastedOn());
        try {
            txp.markBroadcasted();
            fail();
        } catch (CopayException x) {
            assertEquals(ErrorCode.TX_NOT_ACCEPTED, x.getCode());
        }
    }

    @Test
    public void proposalHashIsTheUnsignedTransaction() throws Exception {
        String hash = txp.getProposalHash(adapter);
        assertEquals(adapter.buildTransaction(txp, false).getUnsignedSerialization(), hash);
        txp.publish();
        sign(0);
        assertEquals(hash, txp.getProposalHash(adapter));
    }

    @Test(expected = IllegalArgumentException.class)
    public void invalidThreshold() throws Exception {
        TxProposal.create(fixture.proposalOptions().walletM(4));
    }

    @Test(expected = IllegalArgumentException.class)
    public void oldVersionsAreNotCreated() throws Exception {
        TxProposal.create(fixture.proposalOptions().version(2));
    }

    @Test
    public void duplicateOutputSlotsAreNotBuilt() throws Exception {
        txp.outputOrder = Lists.newArrayList(0, 0, 2);
        try {
            adapter.buildTransaction(txp, false);
            fail();
        } catch (CopayException x) {
            assertEquals(ErrorCode.INTERNAL, x.getCode());
        }
    }
}
