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

import org.copayj.chain.ChainAdapter;
import org.copayj.chain.EstimationOptions;
import org.copayj.core.CopayException;
import org.copayj.core.Defaults;
import org.copayj.core.ErrorCode;
import org.copayj.core.InsufficientFundsForFeeException;
import org.copayj.proposal.TxProposal;
import org.copayj.wallet.Utxo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * <p>Chooses the inputs of a spend and the fee it pays.</p>
 *
 * <p>Candidates are split in "big" utxos, worth more than about twice the target, and "small" ones.
 * Small utxos are accumulated largest first until their value, net of their own fee, covers the target
 * and the fee. While a big utxo is available the accumulation gives up as soon as it stops being
 * economic: an input contributing too little to the amount, or fees both significant with respect to
 * the amount and several times what a single input would cost. Giving up falls back to the smallest big
 * utxo.</p>
 *
 * <p>The whole selection is tried first on utxos with 6 confirmations or more, then 1, then (unless
 * unconfirmed funds are excluded) all of them, keeping the first that succeeds. Change at or below the
 * dust threshold is never produced: it is added to the fee.</p>
 *
 * <p>Selection is deterministic for a given candidate list. Only {@link #selectTxInputs} shuffles the
 * chosen inputs, with the {@link Random} given at construction.</p>
 */
public class CoinSelector {
    private static final Logger log = LoggerFactory.getLogger(CoinSelector.class);

    private final Random random;

    public CoinSelector() {
        this(new SecureRandom());
    }

    public CoinSelector(Random random) {
        this.random = checkNotNull(random);
    }

    /**
     * Selects inputs paying {@code amount} (plus the policy's escrow) and their fee.
     *
     * @param utxos all the wallet's utxos, locked ones included
     * @throws CopayException INSUFFICIENT_FUNDS, LOCKED_FUNDS, INSUFFICIENT_FUNDS_FOR_FEE or TX_MAX_SIZE_EXCEEDED
     */
    public CoinSelection select(List<Utxo> utxos, long amount, FeeModel feeModel, SelectionPolicy policy)
            throws CopayException {
        checkArgument(amount >= 0, "negative amount");
        Set<String> pinned = pinnedTxids(policy);
        boolean rbf = policy.isReplaceTxByFee();
        boolean confirmedOnly = policy.isExcludeUnconfirmedUtxos() && !rbf;

        long totalAmount = 0;
        long availableAmount = 0;
        for (Utxo utxo : utxos) {
            if (confirmedOnly && utxo.getConfirmations() == 0)
                continue;
            totalAmount += utxo.getSatoshis();
            if (isUsable(utxo, pinned, rbf))
                availableAmount += utxo.getSatoshis();
        }
        if (totalAmount < amount)
            throw new CopayException(ErrorCode.INSUFFICIENT_FUNDS);
        if (availableAmount < amount)
            throw new CopayException(ErrorCode.LOCKED_FUNDS);

        List<Utxo> sanitized = new ArrayList<>();
        for (Utxo utxo : utxos) {
            if (!isUsable(utxo, pinned, rbf))
                continue;
            if (confirmedOnly && utxo.getConfirmations() == 0)
                continue;
            if (policy.getUtxosToExclude().contains(utxo.getOutpointKey()))
                continue;
            sanitized.add(utxo);
        }

        long target = amount + policy.getEscrowAmount();
        log.debug("Selecting for {} sat, {}, big input threshold {}", target, feeModel,
                bigInputThreshold(target, feeModel, policy));

        CopayException lastError = null;
        Integer lastGroupSize = null;
        for (int group : policy.getConfirmationGroups()) {
            if (group == 0 && confirmedOnly)
                continue;
            List<Utxo> candidates = new ArrayList<>();
            for (Utxo utxo : sanitized)
                if (utxo.getConfirmations() >= group)
                    candidates.add(utxo);
            if (policy.getEscrowAmount() > 0)
                candidates = uniqueAddresses(candidates);
            if (!pinned.isEmpty())
                candidates.sort(pinnedFirst(pinned));
            if (lastGroupSize != null && lastGroupSize == candidates.size())
                continue;
            lastGroupSize = candidates.size();

            try {
                CoinSelection selection = selectFrom(candidates, target, feeModel, policy, pinned);
                log.debug("Selected from utxos with {}+ confirmations: {}", group, selection);
                return selection;
            } catch (CopayException x) {
                log.debug("No selection with {}+ confirmations: {}", group, x.toString());
                lastError = x;
            }
        }
        throw lastError != null ? lastError : new CopayException(ErrorCode.INSUFFICIENT_FUNDS);
    }

    private CoinSelection selectFrom(List<Utxo> candidates, long target, FeeModel feeModel, SelectionPolicy policy,
                                     final Set<String> pinned) throws CopayException {
        long rawTotal = sum(candidates);
        if (rawTotal < target) {
            log.debug("Total value in utxos ({}) is insufficient for {}", rawTotal, target);
            throw new CopayException(ErrorCode.INSUFFICIENT_FUNDS);
        }
        boolean escrow = policy.getEscrowAmount() > 0;
        double feePerInput = feeModel.getFeePerInput();

        // not worth spending: costs more than it brings
        List<Utxo> utxos = new ArrayList<>();
        for (Utxo utxo : candidates)
            if (pinned.contains(utxo.getTxid()) || utxo.getSatoshis() > feePerInput)
                utxos.add(utxo);

        long netTotalFee = feeModel.feeFor(utxos.size());
        if (sum(utxos) - netTotalFee - (escrow ? netTotalFee : 0) < target) {
            log.debug("Value after fees in utxos is insufficient for {}", target);
            throw new InsufficientFundsForFeeException(feeModel.getChain(), feeModel.feeFor(1), feeModel.getFeePerKb());
        }

        double threshold = bigInputThreshold(target, feeModel, policy);
        List<Utxo> bigInputs = new ArrayList<>();
        List<Utxo> smallInputs = new ArrayList<>();
        for (Utxo utxo : utxos)
            (utxo.getSatoshis() > threshold ? bigInputs : smallInputs).add(utxo);
        bigInputs.sort(pinnedFirst(pinned).thenComparingLong(Utxo::getSatoshis));
        smallInputs.sort(pinnedFirst(pinned).thenComparing(Comparator.comparingLong(Utxo::getSatoshis).reversed()));
        log.debug("Considering {} big and {} small inputs", bigInputs.size(), smallInputs.size());

        List<Utxo> selected = new ArrayList<>();
        long total = 0;
        long fee = 0;
        long fullTarget = target;
        boolean reached = false;
        boolean sizeExceeded = false;
        long singleInputFee = feeModel.feeFor(1);
        for (Utxo input : smallInputs) {
            selected.add(input);
            total += input.getSatoshis();
            int n = selected.size();
            fee = feeModel.feeFor(n);
            // the escrow output also carries the fee of the payment it secures
            fullTarget = escrow ? target + fee : target;

            if (feeModel.sizeFor(n) / 1000.0 > policy.getMaxTxSizeInKb()) {
                sizeExceeded = true;
                break;
            }
            if (!bigInputs.isEmpty()) {
                double netInputAmount = input.getSatoshis() - feePerInput;
                if (netInputAmount / fullTarget < policy.getMinTxAmountVsUtxoFactor()) {
                    log.debug("Input {} too small compared to the amount", input.getOutpointKey());
                    break;
                }
                if ((double) fee / fullTarget > policy.getMaxFeeVsTxAmountFactor()
                        && (double) fee / singleInputFee > policy.getMaxFeeVsSingleUtxoFeeFactor()) {
                    log.debug("Fee {} too high compared to the amount and to a single input fee", fee);
                    break;
                }
            }
            if (total >= fullTarget + fee) {
                reached = true;
                break;
            }
        }

        if (!reached) {
            log.debug("Small inputs cannot reach {}, {} big inputs available", fullTarget, bigInputs.size());
            selected.clear();
            total = 0;
            if (bigInputs.isEmpty()) {
                if (sizeExceeded)
                    throw new CopayException(ErrorCode.TX_MAX_SIZE_EXCEEDED);
                throw new InsufficientFundsForFeeException(feeModel.getChain(), fee, feeModel.getFeePerKb());
            }
            Utxo big = bigInputs.get(0);
            selected.add(big);
            total = big.getSatoshis();
            fee = singleInputFee;
            fullTarget = escrow ? target + fee : target;
            if (total < fullTarget + fee)
                throw new InsufficientFundsForFeeException(feeModel.getChain(), fee, feeModel.getFeePerKb());
        }

        if (!pinned.isEmpty() && !containsPinned(selected, pinned)) {
            Utxo replaced = null;
            for (Utxo utxo : utxos) {
                if (pinned.contains(utxo.getTxid())) {
                    replaced = utxo;
                    break;
                }
            }
            if (replaced == null)
                throw new CopayException(ErrorCode.UNAVAILABLE_UTXOS, "No input of the replaced transaction is available");
            selected.add(replaced);
            total += replaced.getSatoshis();
            fee = feeModel.feeFor(selected.size());
            fullTarget = escrow ? target + fee : target;
            if (total < fullTarget + fee)
                throw new InsufficientFundsForFeeException(feeModel.getChain(), fee, feeModel.getFeePerKb());
        }

        long change = total - fullTarget - fee;
        // with an escrow output the fee is also paid into escrow, so dust change stays implicit
        if (!escrow && change > 0 && change <= policy.getDustThreshold()) {
            log.debug("Change {} below dust threshold {}, added to the fee", change, policy.getDustThreshold());
            fee += change;
        }
        return new CoinSelection(selected, fee, fullTarget);
    }

    /**
     * Selects the inputs of a temporary proposal and sets them, shuffled, with the fee. A proposal that
     * already has inputs, and does not replace a transaction, keeps them; it only gets a conservative
     * fee if it has none. Either way the resulting transaction is checked by the adapter.
     *
     * @return the selection, or null when the proposal kept its own inputs
     */
    public CoinSelection selectTxInputs(TxProposal txp, List<Utxo> utxos, ChainAdapter adapter, SelectionPolicy policy)
            throws CopayException {
        checkArgument(adapter.isUtxoModel(), "coin selection on an account chain");
        if (!txp.getInputs().isEmpty() && !txp.isReplaceTxByFee()) {
            if (txp.getFee() == null)
                txp.setFee(adapter.estimatedFee(txp, EstimationOptions.CONSERVATIVE));
            adapter.checkTx(txp);
            return null;
        }

        List<Utxo> replacedInputs = new ArrayList<>(txp.getInputs());
        List<Utxo> required = policy.getRequiredInputs().isEmpty() ? replacedInputs : policy.getRequiredInputs();
        SelectionPolicy effective = policy.toBuilder()
                .excludeUnconfirmedUtxos(txp.isExcludeUnconfirmedUtxos())
                .replaceTxByFee(txp.isReplaceTxByFee())
                .requiredInputs(txp.isReplaceTxByFee() ? required : Collections.<Utxo>emptyList())
                .escrowAmount(txp.getInstantAcceptanceEscrow())
                .maxTxSizeInKb(Math.min(policy.getMaxTxSizeInKb(), adapter.getMaxTxSizeInKb()))
                .dustThreshold(Math.max(Defaults.MIN_OUTPUT_AMOUNT, adapter.getDustAmount()))
                .build();

        txp.setInputs(null);
        CoinSelection selection;
        try {
            EstimationOptions opts = EstimationOptions.of(txp.getPayProUrl() != null);
            FeeModel feeModel = FeeModel.forProposal(adapter, txp, opts);
            selection = select(utxos, txp.getTotalAmount(), feeModel, effective);
        } catch (CopayException x) {
            txp.setInputs(replacedInputs);
            throw x;
        }

        List<Utxo> inputs = new ArrayList<>(selection.getInputs());
        Collections.shuffle(inputs, random);
        txp.setInputs(inputs);
        txp.setFee(selection.getFee());
        try {
            adapter.checkTx(txp);
        } catch (CopayException x) {
            log.warn("Error building transaction for proposal {}: {}", txp.getId(), x.toString());
            throw x;
        }
        log.debug("Proposal {}: {} inputs, fee {}, change {}", txp.getId(), inputs.size(), txp.getFee(),
                selection.getChange());
        return selection;
    }

    /**
     * Largest amount sendable from the given utxos by a proposal shaped like {@code template} (wallet
     * m/n, address type, fee rate, no inputs).
     */
    public SendMaxInfo getSendMaxInfo(TxProposal template, List<Utxo> utxos, ChainAdapter adapter,
                                      boolean excludeUnconfirmedUtxos, boolean returnInputs) {
        checkArgument(adapter.isUtxoModel(), "send max on an account chain");
        checkArgument(template.getInputs().isEmpty(), "template proposal already has inputs");
        long feePerKb = template.getFeePerKb();
        List<Utxo> candidates = new ArrayList<>();
        for (Utxo utxo : utxos) {
            if (utxo.isLocked())
                continue;
            if (excludeUnconfirmedUtxos && utxo.getConfirmations() == 0)
                continue;
            candidates.add(utxo);
        }
        candidates.sort(Comparator.comparingLong(Utxo::getSatoshis).reversed());
        if (candidates.isEmpty())
            return new SendMaxInfo(0, 0, 0, 0, Collections.<Utxo>emptyList(), 0, 0, 0, 0);

        FeeModel feeModel = FeeModel.forProposal(adapter, template, EstimationOptions.CONSERVATIVE);
        double feePerInput = feeModel.getFeePerInput();

        List<Utxo> worthSpending = new ArrayList<>();
        int utxosBelowFee = 0;
        long amountBelowFee = 0;
        for (Utxo utxo : candidates) {
            if (utxo.getSatoshis() > feePerInput) {
                worthSpending.add(utxo);
            } else {
                utxosBelowFee++;
                amountBelowFee += utxo.getSatoshis();
            }
        }

        List<Utxo> inputs = new ArrayList<>();
        int utxosAboveMaxSize = 0;
        long amountAboveMaxSize = 0;
        int maxTxSizeInKb = adapter.getMaxTxSizeInKb();
        for (int i = 0; i < worthSpending.size(); i++) {
            if (feeModel.sizeFor(i + 1) / 1000.0 > maxTxSizeInKb) {
                List<Utxo> rest = worthSpending.subList(i, worthSpending.size());
                utxosAboveMaxSize = rest.size();
                amountAboveMaxSize = sum(rest);
                break;
            }
            inputs.add(worthSpending.get(i));
        }

        SendMaxInfo empty = new SendMaxInfo(0, 0, 0, feePerKb, Collections.<Utxo>emptyList(), utxosBelowFee,
                amountBelowFee, utxosAboveMaxSize, amountAboveMaxSize);
        if (inputs.isEmpty())
            return empty;

        template.setInputs(inputs);
        try {
            long fee = adapter.estimatedFee(template, EstimationOptions.CONSERVATIVE);
            long amount = sum(inputs) - fee;
            if (amount < Defaults.MIN_OUTPUT_AMOUNT)
                return empty;
            int size = adapter.estimatedSize(template, EstimationOptions.CONSERVATIVE);
            List<Utxo> returned = new ArrayList<>();
            if (returnInputs) {
                returned.addAll(inputs);
                Collections.shuffle(returned, random);
            }
            return new SendMaxInfo(size, amount, fee, feePerKb, returned, utxosBelowFee, amountBelowFee,
                    utxosAboveMaxSize, amountAboveMaxSize);
        } finally {
            template.setInputs(null);
        }
    }

    private static double bigInputThreshold(long target, FeeModel feeModel, SelectionPolicy policy) {
        return target * policy.getMaxSingleUtxoFactor() + feeModel.getBaseFee() + feeModel.getFeePerInput();
    }

    private static boolean isUsable(Utxo utxo, Set<String> pinned, boolean rbf) {
        return !utxo.isLocked() || (rbf && pinned.contains(utxo.getTxid()));
    }

    private static Set<String> pinnedTxids(SelectionPolicy policy) {
        Set<String> txids = new HashSet<>();
        if (policy.isReplaceTxByFee())
            for (Utxo utxo : policy.getRequiredInputs())
                txids.add(utxo.getTxid());
        return txids;
    }

    private static Comparator<Utxo> pinnedFirst(final Set<String> pinned) {
        return Comparator.comparing((Utxo u) -> !pinned.contains(u.getTxid()));
    }

    private static boolean containsPinned(List<Utxo> selected, Set<String> pinned) {
        for (Utxo utxo : selected)
            if (pinned.contains(utxo.getTxid()))
                return true;
        return false;
    }

    // Keeps the largest utxo of each address.
    private static List<Utxo> uniqueAddresses(List<Utxo> utxos) {
        List<Utxo> sorted = new ArrayList<>(utxos);
        sorted.sort(Comparator.comparingLong(Utxo::getSatoshis).reversed());
        Map<String, Utxo> byAddress = new LinkedHashMap<>();
        for (Utxo utxo : sorted)
            if (!byAddress.containsKey(utxo.getAddress()))
                byAddress.put(utxo.getAddress(), utxo);
        return new ArrayList<>(byAddress.values());
    }

    private static long sum(List<Utxo> utxos) {
        long total = 0;
        for (Utxo utxo : utxos)
            total += utxo.getSatoshis();
        return total;
    }
}
