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

import org.copayj.chain.SigningMethod;
import org.copayj.core.Chain;
import org.copayj.core.Network;
import org.copayj.core.ScriptType;
import org.copayj.wallet.AddressInfo;
import org.copayj.wallet.Utxo;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Parameters of {@link TxProposal#create(ProposalOptions)}. Unset optional values take the defaults
 * documented on each setter.
 */
public class ProposalOptions {
    String id;
    String walletId;
    String creatorId;
    Chain chain;
    Network network;
    List<ProposalOutput> outputs = new ArrayList<>();
    String message;
    String payProUrl;
    AddressInfo changeAddress;
    String feeLevel;
    long feePerKb;
    boolean excludeUnconfirmedUtxos;
    ScriptType addressType;
    String customData;
    Long amount;
    List<Utxo> inputs;
    Long fee;
    int walletM;
    int walletN;
    int version;
    SigningMethod signingMethod = SigningMethod.ECDSA;
    boolean multiTx;
    boolean noShuffleOutputs;
    boolean refreshOnPublish;
    ChainPayload payload;
    Random random;

    /** Random UUID when unset. */
    public ProposalOptions id(String id) {
        this.id = id;
        return this;
    }

    public ProposalOptions walletId(String walletId) {
        this.walletId = walletId;
        return this;
    }

    public ProposalOptions creatorId(String creatorId) {
        this.creatorId = creatorId;
        return this;
    }

    public ProposalOptions chain(Chain chain) {
        this.chain = chain;
        return this;
    }

    public ProposalOptions network(Network network) {
        this.network = network;
        return this;
    }

    public ProposalOptions outputs(List<ProposalOutput> outputs) {
        this.outputs = new ArrayList<>(outputs);
        return this;
    }

    public ProposalOptions addOutput(ProposalOutput output) {
        this.outputs.add(output);
        return this;
    }

    public ProposalOptions message(String message) {
        this.message = message;
        return this;
    }

    public ProposalOptions payProUrl(String payProUrl) {
        this.payProUrl = payProUrl;
        return this;
    }

    public ProposalOptions changeAddress(AddressInfo changeAddress) {
        this.changeAddress = changeAddress;
        return this;
    }

    public ProposalOptions feeLevel(String feeLevel) {
        this.feeLevel = feeLevel;
        return this;
    }

    public ProposalOptions feePerKb(long feePerKb) {
        this.feePerKb = feePerKb;
        return this;
    }

    public ProposalOptions excludeUnconfirmedUtxos(boolean excludeUnconfirmedUtxos) {
        this.excludeUnconfirmedUtxos = excludeUnconfirmedUtxos;
        return this;
    }

    /** P2SH for multisig wallets and P2PKH otherwise, when unset. */
    public ProposalOptions addressType(ScriptType addressType) {
        this.addressType = addressType;
        return this;
    }

    public ProposalOptions customData(String customData) {
        this.customData = customData;
        return this;
    }

    /** Sum of the outputs when unset. */
    public ProposalOptions amount(Long amount) {
        this.amount = amount;
        return this;
    }

    public ProposalOptions inputs(List<Utxo> inputs) {
        this.inputs = inputs;
        return this;
    }

    public ProposalOptions fee(Long fee) {
        this.fee = fee;
        return this;
    }

    public ProposalOptions walletM(int walletM) {
        this.walletM = walletM;
        return this;
    }

    public ProposalOptions walletN(int walletN) {
        this.walletN = walletN;
        return this;
    }

    /** 3 when unset, the only version this library creates. */
    public ProposalOptions version(int version) {
        this.version = version;
        return this;
    }

    public ProposalOptions signingMethod(SigningMethod signingMethod) {
        this.signingMethod = signingMethod;
        return this;
    }

    public ProposalOptions multiTx(boolean multiTx) {
        this.multiTx = multiTx;
        return this;
    }

    /** Keeps outputs in request order: change last, after the escrow output. */
    public ProposalOptions noShuffleOutputs(boolean noShuffleOutputs) {
        this.noShuffleOutputs = noShuffleOutputs;
        return this;
    }

    public ProposalOptions refreshOnPublish(boolean refreshOnPublish) {
        this.refreshOnPublish = refreshOnPublish;
        return this;
    }

    /** Empty payload of the chain's family when unset. */
    public ProposalOptions payload(ChainPayload payload) {
        this.payload = payload;
        return this;
    }

    /** Source of the output order shuffle; a fresh {@link java.security.SecureRandom} when unset. */
    public ProposalOptions random(Random random) {
        this.random = random;
        return this;
    }
}
