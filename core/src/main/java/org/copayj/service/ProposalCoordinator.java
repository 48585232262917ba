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

package org.copayj.service;

import org.copayj.chain.ChainAdapter;
import org.copayj.chain.ChainAdapters;
import org.copayj.chain.EstimationOptions;
import org.copayj.core.CopayException;
import org.copayj.core.Defaults;
import org.copayj.core.ErrorCode;
import org.copayj.core.ScriptType;
import org.copayj.crypto.CopayerIds;
import org.copayj.crypto.MessageSigner;
import org.copayj.proposal.ProposalOptions;
import org.copayj.proposal.ProposalOutput;
import org.copayj.proposal.TxProposal;
import org.copayj.selection.CoinSelector;
import org.copayj.selection.SelectionPolicy;
import org.copayj.selection.SendMaxInfo;
import org.copayj.wallet.AddressDeriver;
import org.copayj.wallet.AddressInfo;
import org.copayj.wallet.Balance;
import org.copayj.wallet.Copayer;
import org.copayj.wallet.Utxo;
import org.copayj.wallet.Wallet;
import org.copayj.wallet.WalletLockManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

/**
 * <p>Runs the proposal lifecycle of wallets on behalf of their copayers: create (validation, change
 * address and coin selection), publish (creator signature and input availability), sign, reject and
 * broadcast bookkeeping.</p>
 *
 * <p>Every operation that reads or changes a wallet's utxos or proposals holds that wallet's lock from
 * {@link WalletLockManager}, so two proposals never select the same inputs. Inputs of pending
 * proposals are reported locked to the coin selector.</p>
 */
public class ProposalCoordinator {
    private static final Logger log = LoggerFactory.getLogger(ProposalCoordinator.class);

    private final ChainAdapters adapters;
    private final WalletBackend backend;
    private final ProposalStore store;
    private final WalletLockManager lockManager;
    private final CoinSelector coinSelector;

    public ProposalCoordinator(ChainAdapters adapters, WalletBackend backend, ProposalStore store) {
        this(adapters, backend, store, new WalletLockManager(), new CoinSelector());
    }

    public ProposalCoordinator(ChainAdapters adapters, WalletBackend backend, ProposalStore store,
                               WalletLockManager lockManager, CoinSelector coinSelector) {
        this.adapters = checkNotNull(adapters);
        this.backend = checkNotNull(backend);
        this.store = checkNotNull(store);
        this.lockManager = checkNotNull(lockManager);
        this.coinSelector = checkNotNull(coinSelector);
    }

    public TxProposal createTx(Wallet wallet, String copayerId, ProposalOptions opts) throws CopayException {
        return createTx(wallet, copayerId, opts, SelectionPolicy.defaults());
    }

    /**
     * Creates a temporary proposal with its inputs and fee. It is invisible to the other copayers until
     * its creator publishes it.
     */
    public TxProposal createTx(final Wallet wallet, String copayerId, ProposalOptions opts, final SelectionPolicy policy)
            throws CopayException {
        checkCopayer(wallet, copayerId);
        checkState(wallet.isComplete(), "wallet %s is not complete", wallet.getId());
        final ChainAdapter adapter = adapters.get(wallet.getChain());

        opts.walletId(wallet.getId())
                .creatorId(copayerId)
                .chain(wallet.getChain())
                .network(wallet.getNetwork())
                .walletM(wallet.getM())
                .walletN(wallet.getN());
        if (wallet.getScriptType() != null)
            opts.addressType(wallet.getScriptType());
        final TxProposal txp = TxProposal.create(opts);
        validateOutputs(wallet, adapter, txp);
        if (adapter.isUtxoModel() && (txp.getFeePerKb() < Defaults.MIN_FEE_PER_KB || txp.getFeePerKb() > Defaults.MAX_FEE_PER_KB_BTC))
            throw new CopayException(ErrorCode.INVALID_FEE_RATE);

        return lockManager.runLocked(wallet.getId(), new WalletLockManager.LockedOperation<TxProposal>() {
            @Override
            public TxProposal run() throws CopayException {
                if (!adapter.isUtxoModel()) {
                    if (txp.getFee() == null)
                        txp.setFee(adapter.estimatedFee(txp, EstimationOptions.DEFAULT));
                    adapter.checkTx(txp);
                    store.save(txp);
                    return txp;
                }

                if (txp.getChangeAddress() == null)
                    txp.setChangeAddress(deriveChangeAddress(wallet, txp.getAddressType(), null));
                List<Utxo> utxos = getUtxosWithLocks(wallet, null);
                coinSelector.selectTxInputs(txp, utxos, adapter, policy);

                if (txp.getInstantAcceptanceEscrow() > 0) {
                    if (txp.getAddressType() != ScriptType.P2SH)
                        throw new CopayException(ErrorCode.UNSUPPORTED_SCRIPT_TYPE, "Escrow needs a P2SH wallet");
                    List<String> inputPaths = new ArrayList<>();
                    for (Utxo input : txp.getInputs())
                        inputPaths.add(input.getPath());
                    txp.setEscrowAddress(deriveEscrowAddress(wallet, inputPaths));
                    adapter.checkTx(txp);
                }
                store.save(txp);
                log.info("Proposal {} created in wallet {}: {} inputs, fee {}", txp.getId(), wallet.getId(),
                        txp.getInputs().size(), txp.getFee());
                return txp;
            }
        });
    }

    /**
     * Publishes a temporary proposal after checking its creator's signature over the proposal hash. The
     * signature is made either by the creator's request key or by a proposal key that the creator's
     * extended key authorized ({@code signaturePubKey} and {@code signaturePubKeySig}).
     * Publishing an already published proposal returns it unchanged.
     */
    public TxProposal publishTx(final Wallet wallet, final String copayerId, final String txpId,
                                final String proposalSignature, @Nullable final String signaturePubKey,
                                @Nullable final String signaturePubKeySig) throws CopayException {
        final Copayer copayer = checkCopayer(wallet, copayerId);
        final ChainAdapter adapter = adapters.get(wallet.getChain());
        return lockManager.runLocked(wallet.getId(), new WalletLockManager.LockedOperation<TxProposal>() {
            @Override
            public TxProposal run() throws CopayException {
                TxProposal txp = getTx(wallet.getId(), txpId);
                if (!copayerId.equals(txp.getCreatorId()))
                    throw new CopayException(ErrorCode.NOT_AUTHORIZED, "Only the creator can publish a proposal");
                if (!txp.isTemporary())
                    return txp;

                String signingKey = copayer.getRequestPubKey();
                if (signaturePubKey != null) {
                    if (!CopayerIds.verifyRequestPubKey(signaturePubKey, signaturePubKeySig, copayer.getXPubKey(),
                            wallet.getNetwork().getParams()))
                        throw new CopayException(ErrorCode.BAD_SIGNATURES, "Proposal key not authorized by its creator");
                    signingKey = signaturePubKey;
                }
                String hash = txp.getProposalHash(adapter);
                boolean verified = MessageSigner.verifyMessage(hash, proposalSignature, signingKey);
                if (!verified && txp.getPrePublishRaw() != null)
                    verified = MessageSigner.verifyMessage(txp.getPrePublishRaw(), proposalSignature, signingKey);
                if (!verified)
                    throw new CopayException(ErrorCode.PROPOSAL_HASH_MISMATCH);

                if (adapter.isUtxoModel() && !txp.isReplaceTxByFee())
                    checkTxUtxos(wallet, txp);

                txp.setProposalSignature(proposalSignature, signaturePubKey, signaturePubKeySig);
                txp.publish();
                store.save(txp);
                log.info("Proposal {} published", txp.getId());
                return txp;
            }
        });
    }

    /** Accept vote with one signature per input. */
    public TxProposal signTx(final Wallet wallet, final String copayerId, final String txpId, final List<String> signatures)
            throws CopayException {
        final Copayer copayer = checkCopayer(wallet, copayerId);
        final ChainAdapter adapter = adapters.get(wallet.getChain());
        return lockManager.runLocked(wallet.getId(), new WalletLockManager.LockedOperation<TxProposal>() {
            @Override
            public TxProposal run() throws CopayException {
                TxProposal txp = getTx(wallet.getId(), txpId);
                txp.sign(adapter, copayerId, signatures, copayer.getXPubKey());
                store.save(txp);
                return txp;
            }
        });
    }

    public TxProposal rejectTx(final Wallet wallet, final String copayerId, final String txpId, @Nullable final String reason)
            throws CopayException {
        checkCopayer(wallet, copayerId);
        return lockManager.runLocked(wallet.getId(), new WalletLockManager.LockedOperation<TxProposal>() {
            @Override
            public TxProposal run() throws CopayException {
                TxProposal txp = getTx(wallet.getId(), txpId);
                txp.reject(copayerId, reason);
                store.save(txp);
                return txp;
            }
        });
    }

    /** Records that the embedding service broadcast the accepted transaction. */
    public TxProposal markBroadcasted(final Wallet wallet, final String txpId) throws CopayException {
        return lockManager.runLocked(wallet.getId(), new WalletLockManager.LockedOperation<TxProposal>() {
            @Override
            public TxProposal run() throws CopayException {
                TxProposal txp = getTx(wallet.getId(), txpId);
                txp.markBroadcasted();
                store.save(txp);
                log.info("Proposal {} broadcast as {}", txp.getId(), txp.getTxid());
                return txp;
            }
        });
    }

    public Balance getBalance(final Wallet wallet) throws CopayException {
        final ChainAdapter adapter = adapters.get(wallet.getChain());
        return lockManager.runLocked(wallet.getId(), new WalletLockManager.LockedOperation<Balance>() {
            @Override
            public Balance run() throws CopayException {
                return adapter.totalizeUtxos(getUtxosWithLocks(wallet, null));
            }
        });
    }

    public SendMaxInfo getSendMaxInfo(final Wallet wallet, long feePerKb, final boolean excludeUnconfirmedUtxos,
                                      final boolean returnInputs) throws CopayException {
        final ChainAdapter adapter = adapters.get(wallet.getChain());
        if (!adapter.isUtxoModel())
            throw new CopayException(ErrorCode.UNSUPPORTED_CHAIN, "Send max is computed for utxo chains only");
        ProposalOptions opts = new ProposalOptions()
                .walletId(wallet.getId())
                .chain(wallet.getChain())
                .network(wallet.getNetwork())
                .walletM(wallet.getM())
                .walletN(wallet.getN())
                .feePerKb(feePerKb);
        if (wallet.getScriptType() != null)
            opts.addressType(wallet.getScriptType());
        final TxProposal template = TxProposal.create(opts);
        return lockManager.runLocked(wallet.getId(), new WalletLockManager.LockedOperation<SendMaxInfo>() {
            @Override
            public SendMaxInfo run() throws CopayException {
                return coinSelector.getSendMaxInfo(template, getUtxosWithLocks(wallet, null), adapter,
                        excludeUnconfirmedUtxos, returnInputs);
            }
        });
    }

    public TxProposal getTx(String walletId, String txpId) throws CopayException {
        TxProposal txp = store.get(walletId, txpId);
        if (txp == null)
            throw new CopayException(ErrorCode.TX_NOT_FOUND);
        return txp;
    }

    private Copayer checkCopayer(Wallet wallet, String copayerId) throws CopayException {
        Copayer copayer = wallet.getCopayer(copayerId);
        if (copayer == null)
            throw new CopayException(ErrorCode.NOT_AUTHORIZED);
        return copayer;
    }

    private void validateOutputs(Wallet wallet, ChainAdapter adapter, TxProposal txp) throws CopayException {
        for (ProposalOutput output : txp.getOutputs()) {
            if (output.getScript() != null) {
                adapter.checkScriptOutput(output);
                continue;
            }
            adapter.validateAddress(wallet, output.getToAddress());
            if (output.getAmount() <= 0)
                throw new CopayException(ErrorCode.INVALID_AMOUNT);
            adapter.checkDust(output);
        }
    }

    // Inputs of the pending proposals, other than the excluded one, are locked.
    private List<Utxo> getUtxosWithLocks(Wallet wallet, @Nullable TxProposal excluded) throws CopayException {
        Set<String> locked = new HashSet<>();
        for (TxProposal pending : store.getPending(wallet.getId())) {
            if (excluded != null && pending.getId().equals(excluded.getId()))
                continue;
            for (Utxo input : pending.getInputs())
                locked.add(input.getOutpointKey());
        }
        // the backend owns its outputs: flag copies
        List<Utxo> utxos = new ArrayList<>();
        for (Utxo utxo : backend.getUtxos(wallet))
            utxos.add(utxo.withLocked(locked.contains(utxo.getOutpointKey())));
        return utxos;
    }

    private void checkTxUtxos(Wallet wallet, TxProposal txp) throws CopayException {
        Map<String, Utxo> byOutpoint = new HashMap<>();
        for (Utxo utxo : getUtxosWithLocks(wallet, txp))
            byOutpoint.put(utxo.getOutpointKey(), utxo);
        for (Utxo input : txp.getInputs()) {
            Utxo current = byOutpoint.get(input.getOutpointKey());
            if (current == null || current.isLocked()) {
                log.info("Input {} of proposal {} is no longer available", input.getOutpointKey(), txp.getId());
                throw new CopayException(ErrorCode.UNAVAILABLE_UTXOS);
            }
        }
    }

    private AddressInfo deriveChangeAddress(Wallet wallet, ScriptType scriptType, @Nullable List<String> escrowInputPaths) {
        return AddressDeriver.deriveAddress(scriptType, wallet.getPublicKeyRing(), backend.nextChangePath(wallet),
                wallet.getM(), wallet.getNetwork(), escrowInputPaths);
    }

    private AddressInfo deriveEscrowAddress(Wallet wallet, List<String> inputPaths) {
        return deriveChangeAddress(wallet, ScriptType.P2SH, inputPaths);
    }
}
