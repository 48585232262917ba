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
import org.bitcoinj.core.Utils;
import org.copayj.chain.ChainAdapter;
import org.copayj.chain.ChainTransaction;
import org.copayj.chain.SigningMethod;
import org.copayj.core.Chain;
import org.copayj.core.CopayException;
import org.copayj.core.Defaults;
import org.copayj.core.ErrorCode;
import org.copayj.core.Network;
import org.copayj.core.ScriptType;
import org.copayj.wallet.AddressInfo;
import org.copayj.wallet.Utxo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

/**
 * <p>A spend proposal and its voting state machine.</p>
 *
 * <p>A proposal is created {@link TxProposalStatus#TEMPORARY}, becomes {@link TxProposalStatus#PENDING}
 * when published, and then collects votes. It is {@link TxProposalStatus#REJECTED} as soon as
 * {@code min(m, n - m + 1)} copayers reject it, because no accepting quorum of {@code m} is possible
 * any more, and {@link TxProposalStatus#ACCEPTED} when {@code m} copayers have signed. The fully signed
 * transaction and its id are recorded on that transition only. An accepted proposal moves to
 * {@link TxProposalStatus#BROADCASTED} once the embedding service has sent it.</p>
 *
 * <p>A vote either fully succeeds or leaves the proposal untouched: signatures are verified against
 * the rebuilt transaction before the action is appended.</p>
 */
public class TxProposal {
    private static final Logger log = LoggerFactory.getLogger(TxProposal.class);

    int version;
    long createdOn;
    String id;
    String walletId;
    String creatorId;
    Chain chain;
    Network network;
    String message;
    String payProUrl;
    AddressInfo changeAddress;
    List<ProposalOutput> outputs = new ArrayList<>();
    List<Utxo> inputs = new ArrayList<>();
    List<String> inputPaths = new ArrayList<>();
    List<Integer> outputOrder = new ArrayList<>();
    int walletM;
    int walletN;
    int requiredSignatures;
    int requiredRejections;
    TxProposalStatus status;
    List<VoteAction> actions = new ArrayList<>();
    String feeLevel;
    long feePerKb;
    boolean excludeUnconfirmedUtxos;
    ScriptType addressType;
    String customData;
    long amount;
    Long fee;
    String txid;
    List<String> txids;
    String raw;
    Long broadcastedOn;
    String proposalSignature;
    String proposalSignaturePubKey;
    String proposalSignaturePubKeySig;
    SigningMethod signingMethod = SigningMethod.ECDSA;
    String prePublishRaw;
    boolean refreshOnPublish;
    boolean multiTx;
    ChainPayload payload;

    TxProposal() {
    }

    public static TxProposal create(ProposalOptions opts) throws CopayException {
        checkNotNull(opts.chain, "chain");
        checkArgument(opts.network != null, "Invalid network");
        checkArgument(opts.walletM >= 1 && opts.walletM <= opts.walletN && opts.walletN <= Defaults.MAX_KEYS,
                "Invalid wallet m/n: %s/%s", opts.walletM, opts.walletN);
        if (opts.version != 0)
            checkArgument(opts.version >= Defaults.TX_PROPOSAL_VERSION, "version %s not supported", opts.version);
        if (opts.multiTx && opts.chain.isUtxoChain())
            throw new CopayException(ErrorCode.MULTI_TX_UNSUPPORTED);

        TxProposal x = new TxProposal();
        x.version = opts.version != 0 ? opts.version : Defaults.TX_PROPOSAL_VERSION;
        checkState(x.version <= Defaults.TX_PROPOSAL_VERSION, "txp version %s not allowed yet", x.version);

        x.createdOn = Utils.currentTimeSeconds();
        x.id = opts.id != null ? opts.id : UUID.randomUUID().toString();
        x.walletId = opts.walletId;
        x.creatorId = opts.creatorId;
        x.chain = opts.chain;
        x.network = opts.network;
        x.signingMethod = opts.signingMethod != null ? opts.signingMethod : SigningMethod.ECDSA;
        x.message = opts.message;
        x.payProUrl = opts.payProUrl;
        x.changeAddress = opts.changeAddress;
        x.payload = opts.payload != null ? opts.payload : ChainPayload.defaultFor(opts.chain.getFamily());
        checkArgument(x.payload.getFamily() == opts.chain.getFamily(), "%s payload on a %s proposal",
                x.payload.getFamily(), opts.chain);
        x.outputs = new ArrayList<>(opts.outputs);
        x.multiTx = opts.multiTx;

        // output slots: requested outputs, then escrow, then change
        int numOutputs = x.outputs.size();
        if (!opts.multiTx)
            numOutputs++;
        if (x.getInstantAcceptanceEscrow() > 0)
            numOutputs++;
        List<Integer> order = new ArrayList<>();
        for (int i = 0; i < numOutputs; i++)
            order.add(i);
        if (!opts.noShuffleOutputs)
            Collections.shuffle(order, opts.random != null ? opts.random : new SecureRandom());
        x.outputOrder = order;

        x.walletM = opts.walletM;
        x.walletN = opts.walletN;
        x.requiredSignatures = x.walletM;
        x.requiredRejections = Math.min(x.walletM, x.walletN - x.walletM + 1);
        x.status = TxProposalStatus.TEMPORARY;
        x.actions = new ArrayList<>();
        x.feeLevel = opts.feeLevel;
        x.feePerKb = opts.feePerKb;
        x.excludeUnconfirmedUtxos = opts.excludeUnconfirmedUtxos;
        x.addressType = opts.addressType != null ? opts.addressType : ScriptType.defaultFor(x.walletN);
        x.customData = opts.customData;
        x.amount = opts.amount != null ? opts.amount : x.getTotalAmount();
        x.setInputs(opts.inputs);
        x.fee = opts.fee;
        x.refreshOnPublish = opts.refreshOnPublish;
        return x;
    }

    /** Sets the selected inputs and their derivation paths. */
    public void setInputs(@Nullable List<Utxo> inputs) {
        this.inputs = inputs == null ? new ArrayList<Utxo>() : new ArrayList<>(inputs);
        List<String> paths = new ArrayList<>();
        for (Utxo input : this.inputs)
            paths.add(input.getPath());
        this.inputPaths = paths;
    }

    public void setFee(long fee) {
        this.fee = fee;
    }

    public void setChangeAddress(@Nullable AddressInfo changeAddress) {
        this.changeAddress = changeAddress;
    }

    public void setEscrowAddress(AddressInfo escrowAddress) {
        UtxoPayload utxoPayload = getUtxoPayload();
        checkState(utxoPayload != null, "escrow needs a bitcoin family proposal");
        this.payload = utxoPayload.withEscrowAddress(escrowAddress);
    }

    /**
     * Records the creator's signature over the proposal hash. {@code signaturePubKey} and
     * {@code signaturePubKeySig} are set when a one-time proposal key, itself authorized by the
     * creator's extended key, made the signature.
     */
    public void setProposalSignature(String signature, @Nullable String signaturePubKey,
                                     @Nullable String signaturePubKeySig) {
        this.proposalSignature = signature;
        this.proposalSignaturePubKey = signaturePubKey;
        this.proposalSignaturePubKeySig = signaturePubKeySig;
    }

    public void setPrePublishRaw(@Nullable String prePublishRaw) {
        this.prePublishRaw = prePublishRaw;
    }

    /** Makes a temporary proposal visible to the other copayers. */
    public void publish() {
        checkState(status == TxProposalStatus.TEMPORARY, "Proposal %s is already %s", id, status.getCode());
        status = TxProposalStatus.PENDING;
    }

    /**
     * Text the creator signs: the unsigned transaction serialization.
     */
    public String getProposalHash(ChainAdapter adapter) throws CopayException {
        return adapter.buildTransaction(this, false).getUnsignedSerialization();
    }

    /**
     * Accept vote. The signatures, one per input in input order, are checked against the keys derived
     * from {@code xpub} at the input paths. On any failure nothing is recorded.
     *
     * @throws CopayException TX_NOT_PENDING, COPAYER_VOTED, SIGNATURE_COUNT_MISMATCH or BAD_SIGNATURES
     */
    public void sign(ChainAdapter adapter, String copayerId, List<String> signatures, String xpub) throws CopayException {
        checkNotNull(signatures);
        checkCanVote(copayerId);
        ChainTransaction tx = adapter.buildTransaction(this, true);
        try {
            adapter.addSignatures(tx, inputs, inputPaths, signatures, xpub, signingMethod);
        } catch (CopayException x) {
            log.debug("Rejected signatures of {} on proposal {}: {}", copayerId, id, x.getMessage());
            throw x;
        }

        TxProposalStatus before = status;
        addAction(VoteAction.accept(copayerId, signatures, xpub));
        if (before == TxProposalStatus.PENDING && status == TxProposalStatus.ACCEPTED) {
            raw = tx.serialize();
            txid = tx.getTxId();
            if (multiTx)
                txids = new ArrayList<>(tx.getTxIds());
            log.info("Proposal {} accepted, txid {}", id, txid);
        }
    }

    /**
     * Reject vote.
     *
     * @throws CopayException TX_NOT_PENDING or COPAYER_VOTED
     */
    public void reject(String copayerId, @Nullable String reason) throws CopayException {
        checkCanVote(copayerId);
        addAction(VoteAction.reject(copayerId, reason));
        if (status == TxProposalStatus.REJECTED)
            log.info("Proposal {} rejected", id);
    }

    /**
     * Records that the accepted transaction was broadcast.
     *
     * @throws CopayException TX_NOT_ACCEPTED or TX_MISSING_ID
     */
    public void markBroadcasted() throws CopayException {
        if (status != TxProposalStatus.ACCEPTED)
            throw new CopayException(ErrorCode.TX_NOT_ACCEPTED);
        if (txid == null)
            throw new CopayException(ErrorCode.TX_MISSING_ID);
        status = TxProposalStatus.BROADCASTED;
        broadcastedOn = Utils.currentTimeSeconds();
    }

    private void checkCanVote(String copayerId) throws CopayException {
        checkNotNull(copayerId);
        if (!isPending())
            throw new CopayException(ErrorCode.TX_NOT_PENDING);
        if (getActionBy(copayerId) != null)
            throw new CopayException(ErrorCode.COPAYER_VOTED);
    }

    private void addAction(VoteAction action) {
        actions.add(action);
        updateStatus();
    }

    private void updateStatus() {
        if (status != TxProposalStatus.PENDING)
            return;
        if (isRejected())
            status = TxProposalStatus.REJECTED;
        else if (isAccepted())
            status = TxProposalStatus.ACCEPTED;
    }

    /** Accept votes, in voting order. */
    public List<VoteAction> getCurrentSignatures() {
        ImmutableList.Builder<VoteAction> result = ImmutableList.builder();
        for (VoteAction action : actions)
            if (action.getType() == ActionType.ACCEPT)
                result.add(action);
        return result.build();
    }

    /** Sum of the requested outputs, change and escrow excluded. */
    public long getTotalAmount() {
        long total = 0;
        for (ProposalOutput output : outputs)
            total += output.getAmount();
        return total;
    }

    /** Copayers that voted, in voting order. */
    public List<String> getActors() {
        ImmutableList.Builder<String> result = ImmutableList.builder();
        for (VoteAction action : actions)
            result.add(action.getCopayerId());
        return result.build();
    }

    public List<String> getApprovers() {
        return copayersVoting(ActionType.ACCEPT);
    }

    public List<String> getRejecters() {
        return copayersVoting(ActionType.REJECT);
    }

    private List<String> copayersVoting(ActionType type) {
        ImmutableList.Builder<String> result = ImmutableList.builder();
        for (VoteAction action : actions)
            if (action.getType() == type)
                result.add(action.getCopayerId());
        return result.build();
    }

    @Nullable
    public VoteAction getActionBy(String copayerId) {
        for (VoteAction action : actions)
            if (action.getCopayerId().equals(copayerId))
                return action;
        return null;
    }

    /** True while votes are accepted: pending, and accepted until broadcast. */
    public boolean isPending() {
        return status != TxProposalStatus.TEMPORARY && status != TxProposalStatus.BROADCASTED
                && status != TxProposalStatus.REJECTED;
    }

    public boolean isTemporary() {
        return status == TxProposalStatus.TEMPORARY;
    }

    public boolean isAccepted() {
        return getApprovers().size() >= requiredSignatures;
    }

    public boolean isRejected() {
        return getRejecters().size() >= requiredRejections;
    }

    public boolean isBroadcasted() {
        return status == TxProposalStatus.BROADCASTED;
    }

    @Nullable
    public UtxoPayload getUtxoPayload() {
        return payload instanceof UtxoPayload ? (UtxoPayload) payload : null;
    }

    public boolean isEnableRBF() {
        UtxoPayload p = getUtxoPayload();
        return p != null && p.isEnableRBF();
    }

    public boolean isReplaceTxByFee() {
        UtxoPayload p = getUtxoPayload();
        return p != null && p.isReplaceTxByFee();
    }

    public long getInstantAcceptanceEscrow() {
        UtxoPayload p = getUtxoPayload();
        return p != null ? p.getInstantAcceptanceEscrow() : 0;
    }

    @Nullable
    public AddressInfo getEscrowAddress() {
        UtxoPayload p = getUtxoPayload();
        return p != null ? p.getEscrowAddress() : null;
    }

    public int getVersion() {
        return version;
    }

    /** Seconds since the epoch. */
    public long getCreatedOn() {
        return createdOn;
    }

    public String getId() {
        return id;
    }

    public String getWalletId() {
        return walletId;
    }

    public String getCreatorId() {
        return creatorId;
    }

    public Chain getChain() {
        return chain;
    }

    public Network getNetwork() {
        return network;
    }

    @Nullable
    public String getMessage() {
        return message;
    }

    @Nullable
    public String getPayProUrl() {
        return payProUrl;
    }

    @Nullable
    public AddressInfo getChangeAddress() {
        return changeAddress;
    }

    public List<ProposalOutput> getOutputs() {
        return Collections.unmodifiableList(outputs);
    }

    public List<Utxo> getInputs() {
        return Collections.unmodifiableList(inputs);
    }

    public List<String> getInputPaths() {
        return Collections.unmodifiableList(inputPaths);
    }

    public List<Integer> getOutputOrder() {
        return Collections.unmodifiableList(outputOrder);
    }

    public int getWalletM() {
        return walletM;
    }

    public int getWalletN() {
        return walletN;
    }

    public int getRequiredSignatures() {
        return requiredSignatures;
    }

    public int getRequiredRejections() {
        return requiredRejections;
    }

    public TxProposalStatus getStatus() {
        return status;
    }

    public List<VoteAction> getActions() {
        return Collections.unmodifiableList(actions);
    }

    @Nullable
    public String getFeeLevel() {
        return feeLevel;
    }

    public long getFeePerKb() {
        return feePerKb;
    }

    public boolean isExcludeUnconfirmedUtxos() {
        return excludeUnconfirmedUtxos;
    }

    public ScriptType getAddressType() {
        return addressType;
    }

    @Nullable
    public String getCustomData() {
        return customData;
    }

    public long getAmount() {
        return amount;
    }

    /** Null until inputs are selected. */
    @Nullable
    public Long getFee() {
        return fee;
    }

    @Nullable
    public String getTxid() {
        return txid;
    }

    @Nullable
    public List<String> getTxids() {
        return txids;
    }

    /** Fully signed transaction, set when the proposal is accepted. */
    @Nullable
    public String getRaw() {
        return raw;
    }

    @Nullable
    public Long getBroadcastedOn() {
        return broadcastedOn;
    }

    @Nullable
    public String getProposalSignature() {
        return proposalSignature;
    }

    @Nullable
    public String getProposalSignaturePubKey() {
        return proposalSignaturePubKey;
    }

    @Nullable
    public String getProposalSignaturePubKeySig() {
        return proposalSignaturePubKeySig;
    }

    public SigningMethod getSigningMethod() {
        return signingMethod;
    }

    @Nullable
    public String getPrePublishRaw() {
        return prePublishRaw;
    }

    public boolean isRefreshOnPublish() {
        return refreshOnPublish;
    }

    public boolean isMultiTx() {
        return multiTx;
    }

    public ChainPayload getPayload() {
        return payload;
    }

    @Override
    public String toString() {
        return String.format("TxProposal{%s %s %s amount=%d fee=%s %d/%d}", id, chain.getCode(), status.getCode(),
                amount, fee, getApprovers().size(), requiredSignatures);
    }
}
