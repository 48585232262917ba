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

package org.copayj.selection;

import com.google.common.collect.ImmutableList;
import org.copayj.chain.BtcChainAdapter;
import org.copayj.chain.EstimationOptions;
import org.copayj.chain.UtxoTransaction;
import org.copayj.core.Chain;
import org.copayj.core.CopayException;
import org.copayj.core.Defaults;
import org.copayj.core.ErrorCode;
import org.copayj.core.InsufficientFundsForFeeException;
import org.copayj.proposal.ProposalOutput;
import org.copayj.proposal.TxProposal;
import org.copayj.testing.TestWallets;
import org.copayj.wallet.Utxo;
import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Random;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class CoinSelectorTest {
    // 2-of-3 P2SH paying one P2SH output with change: 10 + 32 + 32 bytes, then 46 + 2 * 73 + 3 * 34 per input
    private static final FeeModel TWO_OF_THREE = new FeeModel(Chain.BTC, 74, 294, 1000, 546);

    private TestWallets fixture;
    private CoinSelector selector;
    private BtcChainAdapter adapter;

    @Before
    public void setUp() {
        fixture = TestWallets.twoOfThree();
        selector = new CoinSelector(new Random(7));
        adapter = new BtcChainAdapter();
    }

    private Utxo utxo(String label, long satoshis, int confirmations) {
        return new Utxo(TestWallets.txid(label), 0, "addr-" + label, "m/0/0", satoshis, confirmations);
    }

    private Utxo locked(Utxo utxo) {
        utxo.setLocked(true);
        return utxo;
    }

    private static List<Long> values(CoinSelection selection) {
        List<Long> values = new ArrayList<>();
        for (Utxo input : selection.getInputs())
            values.add(input.getSatoshis());
        return values;
    }

    private void assertFails(ErrorCode expected, List<Utxo> utxos, long amount, SelectionPolicy policy) {
        try {
            selector.select(utxos, amount, TWO_OF_THREE, policy);
            fail("expected " + expected);
        } catch (CopayException x) {
            assertEquals(expected, x.getCode());
        }
    }

    @Test
    public void scenarioA() throws Exception {
        List<Utxo> utxos = ImmutableList.of(
                fixture.utxo("a", "m/0/0", 5000, 6),
                fixture.utxo("b", "m/0/1", 3000, 6),
                fixture.utxo("c", "m/0/2", 1000, 6));
        TxProposal txp = TxProposal.create(fixture.proposalOptions()
                .addOutput(ProposalOutput.toAddress(TestWallets.externalP2shAddress("shop"), 4000))
                .changeAddress(fixture.address("m/1/0"))
                .feePerKb(1000));

        assertEquals(294, adapter.estimatedSizeForSingleInput(txp, EstimationOptions.DEFAULT));
        FeeModel model = FeeModel.forProposal(adapter, txp, EstimationOptions.DEFAULT);
        assertEquals(74, model.getBaseSize());
        assertEquals(294, model.getSizePerInput());

        CoinSelection selection = selector.selectTxInputs(txp, utxos, adapter, SelectionPolicy.defaults());
        assertEquals(ImmutableList.of(5000L), values(selection));
        // 368 sat by size, raised to the 546 minimum, plus the 454 change folded as dust
        assertEquals(1000, selection.getFee());
        assertEquals(0, selection.getChange());
        assertEquals(Long.valueOf(1000), txp.getFee());
        assertEquals(1, txp.getInputs().size());
        assertEquals(ImmutableList.of("m/0/0"), txp.getInputPaths());

        UtxoTransaction tx = adapter.buildTransaction(txp, false);
        assertEquals(1, tx.getTransaction().getOutputs().size());
        assertEquals(1000, tx.getFee());
    }

    @Test
    public void smallInputsBeforeBigFallback() throws Exception {
        List<Utxo> utxos = ImmutableList.of(utxo("big", 100000, 6), utxo("s1", 3000, 6), utxo("s2", 2000, 6));
        CoinSelection selection = selector.select(utxos, 4000, TWO_OF_THREE, SelectionPolicy.defaults());
        assertEquals(ImmutableList.of(3000L, 2000L), values(selection));
        // 662 by size plus 338 of folded change
        assertEquals(1000, selection.getFee());
    }

    @Test
    public void bigFallbackWhenSmallInputsAreUneconomic() throws Exception {
        List<Utxo> utxos = ImmutableList.of(utxo("big", 100000, 6), utxo("s1", 500, 6), utxo("s2", 400, 6));
        CoinSelection selection = selector.select(utxos, 4000, TWO_OF_THREE, SelectionPolicy.defaults());
        assertEquals(ImmutableList.of(100000L), values(selection));
        assertEquals(546, selection.getFee());
        assertEquals(95454, selection.getChange());
    }

    @Test
    public void smallestBigInputIsTheFallback() throws Exception {
        List<Utxo> utxos = ImmutableList.of(utxo("big1", 500000, 6), utxo("big2", 90000, 6), utxo("s1", 350, 6));
        CoinSelection selection = selector.select(utxos, 4000, TWO_OF_THREE, SelectionPolicy.defaults());
        assertEquals(ImmutableList.of(90000L), values(selection));
    }

    @Test
    public void insufficientFunds() {
        assertFails(ErrorCode.INSUFFICIENT_FUNDS, ImmutableList.of(utxo("a", 1000, 6), utxo("b", 2000, 6)), 5000,
                SelectionPolicy.defaults());
    }

    @Test
    public void lockedFunds() {
        assertFails(ErrorCode.LOCKED_FUNDS, ImmutableList.of(locked(utxo("a", 5000, 6)), utxo("b", 1000, 6)), 3000,
                SelectionPolicy.defaults());
    }

    @Test
    public void insufficientFundsForFee() throws Exception {
        try {
            selector.select(ImmutableList.of(utxo("a", 4100, 6)), 4000, TWO_OF_THREE, SelectionPolicy.defaults());
            fail();
        } catch (InsufficientFundsForFeeException x) {
            assertEquals(ErrorCode.INSUFFICIENT_FUNDS_FOR_FEE, x.getCode());
            assertEquals(546, x.getRequiredFee());
            assertEquals(1000, x.getFeePerKb());
        }
    }

    @Test
    public void uneconomicInputsArePruned() {
        // each input is worth less than the 294 sat it costs to spend
        List<Utxo> utxos = new ArrayList<>();
        for (int i = 0; i < 20; i++)
            utxos.add(utxo("tiny" + i, 290, 6));
        assertFails(ErrorCode.INSUFFICIENT_FUNDS_FOR_FEE, utxos, 1000, SelectionPolicy.defaults());
    }

    @Test
    public void confirmedUtxosArePreferred() throws Exception {
        List<Utxo> utxos = ImmutableList.of(utxo("unconfirmed", 6000, 0), utxo("confirmed", 5000, 6));
        CoinSelection selection = selector.select(utxos, 4000, TWO_OF_THREE, SelectionPolicy.defaults());
        assertEquals(ImmutableList.of(5000L), values(selection));
    }

    @Test
    public void unconfirmedUtxosAsLastResort() throws Exception {
        List<Utxo> utxos = ImmutableList.of(utxo("unconfirmed", 6000, 0), utxo("confirmed", 3000, 6));
        CoinSelection selection = selector.select(utxos, 4000, TWO_OF_THREE, SelectionPolicy.defaults());
        assertEquals(ImmutableList.of(6000L), values(selection));
        assertEquals(546, selection.getFee());

        SelectionPolicy confirmedOnly = SelectionPolicy.defaults().toBuilder().excludeUnconfirmedUtxos(true).build();
        assertFails(ErrorCode.INSUFFICIENT_FUNDS, utxos, 4000, confirmedOnly);
    }

    @Test
    public void excludedUtxosAreNotSelected() throws Exception {
        Utxo excluded = utxo("a", 5000, 6);
        List<Utxo> utxos = ImmutableList.of(excluded, utxo("b", 3000, 6), utxo("c", 2000, 6));
        SelectionPolicy policy = SelectionPolicy.defaults().toBuilder()
                .utxosToExclude(ImmutableList.of(excluded.getOutpointKey()))
                .build();
        CoinSelection selection = selector.select(utxos, 4000, TWO_OF_THREE, policy);
        assertFalse(selection.getInputs().contains(excluded));
        assertEquals(ImmutableList.of(3000L, 2000L), values(selection));
    }

    @Test
    public void sizeCap() {
        List<Utxo> utxos = new ArrayList<>();
        for (int i = 0; i < 10; i++)
            utxos.add(utxo("u" + i, 1000, 6));
        SelectionPolicy policy = SelectionPolicy.defaults().toBuilder().maxTxSizeInKb(1).build();
        assertFails(ErrorCode.TX_MAX_SIZE_EXCEEDED, utxos, 5000, policy);
    }

    @Test
    public void replacementKeepsAnInputOfTheReplacedTransaction() throws Exception {
        Utxo original = locked(utxo("original", 1000, 0));
        List<Utxo> utxos = ImmutableList.of(original, utxo("other", 5000, 6));
        SelectionPolicy policy = SelectionPolicy.defaults().toBuilder()
                .replaceTxByFee(true)
                .requiredInputs(ImmutableList.of(original))
                .build();
        CoinSelection selection = selector.select(utxos, 4000, TWO_OF_THREE, policy);
        assertTrue(selection.getInputs().contains(original));
        assertEquals(ImmutableList.of(1000L, 5000L), values(selection));
        assertEquals(662, selection.getFee());
    }

    @Test
    public void replacementWithoutItsInputs() {
        Utxo gone = utxo("gone", 1000, 0);
        SelectionPolicy policy = SelectionPolicy.defaults().toBuilder()
                .replaceTxByFee(true)
                .requiredInputs(ImmutableList.of(gone))
                .build();
        assertFails(ErrorCode.UNAVAILABLE_UTXOS, ImmutableList.of(utxo("other", 5000, 6)), 4000, policy);
    }

    @Test
    public void escrowIsAddedToTheTarget() throws Exception {
        List<Utxo> utxos = ImmutableList.of(utxo("a", 3000, 6), utxo("b", 2500, 6), utxo("c", 2000, 6));
        SelectionPolicy policy = SelectionPolicy.defaults().toBuilder().escrowAmount(1000).build();
        CoinSelection selection = selector.select(utxos, 2000, TWO_OF_THREE, policy);
        // target 3000, then the escrow output carries the fee once more
        assertEquals(ImmutableList.of(3000L, 2500L), values(selection));
        assertEquals(662, selection.getFee());
        assertEquals(3000 + 662, selection.getTarget());
        assertEquals(5500 - 3662 - 662, selection.getChange());
    }

    @Test
    public void presetInputsAreKept() throws Exception {
        Utxo input = fixture.utxo("preset", "m/0/3", 20000, 3);
        TxProposal txp = TxProposal.create(fixture.proposalOptions()
                .addOutput(ProposalOutput.toAddress(TestWallets.externalAddress("shop"), 10000))
                .changeAddress(fixture.address("m/1/0"))
                .inputs(ImmutableList.of(input))
                .feePerKb(1000));
        assertNull(selector.selectTxInputs(txp, ImmutableList.of(input, fixture.utxo("other", "m/0/4", 50000, 6)),
                adapter, SelectionPolicy.defaults()));
        assertEquals(ImmutableList.of(input), txp.getInputs());
        assertEquals(Long.valueOf(adapter.estimatedFee(txp, EstimationOptions.CONSERVATIVE)), txp.getFee());
    }

    @Test
    public void failedSelectionLeavesNoInputs() throws Exception {
        TxProposal txp = TxProposal.create(fixture.proposalOptions()
                .addOutput(ProposalOutput.toAddress(TestWallets.externalAddress("shop"), 100000))
                .changeAddress(fixture.address("m/1/0"))
                .feePerKb(1000));
        try {
            selector.selectTxInputs(txp, ImmutableList.of(fixture.utxo("a", "m/0/0", 5000, 6)), adapter,
                    SelectionPolicy.defaults());
            fail();
        } catch (CopayException x) {
            assertEquals(ErrorCode.INSUFFICIENT_FUNDS, x.getCode());
        }
        assertTrue(txp.getInputs().isEmpty());
        assertNull(txp.getFee());
    }

    @Test
    public void deterministic() throws Exception {
        List<Utxo> utxos = new ArrayList<>();
        Random random = new Random(3);
        for (int i = 0; i < 30; i++)
            utxos.add(utxo("d" + i, 500 + random.nextInt(20000), random.nextInt(8)));
        CoinSelection first = selector.select(utxos, 45000, TWO_OF_THREE, SelectionPolicy.defaults());
        for (int i = 0; i < 5; i++) {
            CoinSelection again = new CoinSelector(new Random(i)).select(utxos, 45000, TWO_OF_THREE, SelectionPolicy.defaults());
            assertEquals(first.getInputs(), again.getInputs());
            assertEquals(first.getFee(), again.getFee());
        }
    }

    @Test
    public void selectionsCoverTargetAndFee() {
        Random random = new Random(42);
        long[] rates = {1000, 5000, 20000};
        int selections = 0;
        for (int round = 0; round < 300; round++) {
            FeeModel model = new FeeModel(Chain.BTC, 74, 294, rates[random.nextInt(rates.length)], 546);
            List<Utxo> utxos = new ArrayList<>();
            int count = 1 + random.nextInt(12);
            for (int i = 0; i < count; i++)
                utxos.add(utxo(round + "-" + i, 100 + random.nextInt(200000), random.nextInt(10)));
            long amount = 1000 + random.nextInt(150000);
            try {
                CoinSelection selection = selector.select(utxos, amount, model, SelectionPolicy.defaults());
                selections++;
                assertTrue(utxos.containsAll(selection.getInputs()));
                assertEquals(selection.getInputs().size(), new HashSet<>(selection.getInputs()).size());
                assertTrue(selection.getFee() >= model.feeFor(selection.getInputs().size()));
                long change = selection.getChange();
                assertTrue("change " + change, change == 0 || change > Defaults.DUST_AMOUNT);
                assertEquals(selection.getTotal(), amount + selection.getFee() + change);
            } catch (CopayException x) {
                assertTrue(x.toString(), x.getCategory() == ErrorCode.Category.FUNDS
                        || x.getCode() == ErrorCode.TX_MAX_SIZE_EXCEEDED);
            }
        }
        assertTrue(selections > 0);
    }

    @Test
    public void confirmationGroupsCannotBeChanged() {
        List<Integer> groups = SelectionPolicy.builder().build().getConfirmationGroups();
        assertEquals(ImmutableList.of(6, 1, 0), groups);
        try {
            Defaults.UTXO_CONFIRMATION_GROUPS.set(0, 0);
            fail();
        } catch (UnsupportedOperationException x) {
            // expected
        }
        assertEquals(ImmutableList.of(6, 1, 0), SelectionPolicy.builder().build().getConfirmationGroups());
        assertEquals(ImmutableList.of(3, 0), SelectionPolicy.builder().confirmationGroups(3, 0).build().getConfirmationGroups());
    }
}
