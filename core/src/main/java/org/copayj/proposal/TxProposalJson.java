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
import org.copayj.core.CopayException;
import org.copayj.core.Defaults;
import org.copayj.core.ErrorCode;
import org.copayj.core.Network;
import org.copayj.core.ScriptType;
import org.copayj.core.UnsupportedFormatException;
import org.copayj.wallet.AddressInfo;
import org.copayj.wallet.Utxo;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;

/**
 * <p>The proposal wire record: a JSON object exchanged with copayers and persisted by the embedding
 * service. Chain specific fields travel in a nested {@code payload} object whose shape follows the
 * proposal's chain family.</p>
 *
 * <p>Only records of schema version 3 or later are read. Older ones raise
 * {@link UnsupportedFormatException}; converting them is the job of a separate importer.</p>
 */
public class TxProposalJson {
    private TxProposalJson() {
    }

    public static JSONObject toJson(TxProposal txp) {
        JSONObject json = new JSONObject();
        json.put("version", txp.version);
        json.put("createdOn", txp.createdOn);
        json.put("id", txp.id);
        json.putOpt("walletId", txp.walletId);
        json.putOpt("creatorId", txp.creatorId);
        json.put("chain", txp.chain.getCode());
        json.put("network", txp.network.getCode());
        json.putOpt("message", txp.message);
        json.putOpt("payProUrl", txp.payProUrl);
        if (txp.changeAddress != null)
            json.put("changeAddress", addressToJson(txp.changeAddress));

        JSONArray outputs = new JSONArray();
        for (ProposalOutput output : txp.outputs)
            outputs.put(outputToJson(output));
        json.put("outputs", outputs);
        JSONArray inputs = new JSONArray();
        for (Utxo input : txp.inputs)
            inputs.put(utxoToJson(input));
        json.put("inputs", inputs);
        json.put("inputPaths", new JSONArray(txp.inputPaths));
        json.put("outputOrder", new JSONArray(txp.outputOrder));

        json.put("walletM", txp.walletM);
        json.put("walletN", txp.walletN);
        json.put("requiredSignatures", txp.requiredSignatures);
        json.put("requiredRejections", txp.requiredRejections);
        json.put("status", txp.status.getCode());
        JSONArray actions = new JSONArray();
        for (VoteAction action : txp.actions)
            actions.put(actionToJson(action));
        json.put("actions", actions);

        json.putOpt("feeLevel", txp.feeLevel);
        json.put("feePerKb", txp.feePerKb);
        json.put("excludeUnconfirmedUtxos", txp.excludeUnconfirmedUtxos);
        json.put("addressType", txp.addressType.name());
        json.putOpt("customData", txp.customData);
        json.put("amount", txp.amount);
        json.putOpt("fee", txp.fee);
        json.putOpt("txid", txp.txid);
        if (txp.txids != null)
            json.put("txids", new JSONArray(txp.txids));
        json.putOpt("raw", txp.raw);
        json.putOpt("broadcastedOn", txp.broadcastedOn);
        json.putOpt("proposalSignature", txp.proposalSignature);
        json.putOpt("proposalSignaturePubKey", txp.proposalSignaturePubKey);
        json.putOpt("proposalSignaturePubKeySig", txp.proposalSignaturePubKeySig);
        json.put("signingMethod", txp.signingMethod.getCode());
        json.putOpt("prePublishRaw", txp.prePublishRaw);
        json.put("refreshOnPublish", txp.refreshOnPublish);
        json.put("multiTx", txp.multiTx);
        json.put("payload", payloadToJson(txp.payload));
        return json;
    }

    public static String toJsonString(TxProposal txp) {
        return toJson(txp).toString();
    }

    public static TxProposal fromJson(String text) throws CopayException {
        JSONObject json;
        try {
            json = new JSONObject(text);
        } catch (JSONException x) {
            throw new CopayException(ErrorCode.UNSUPPORTED_FORMAT, "Malformed proposal record", x);
        }
        return fromJson(json);
    }

    /**
     * @throws UnsupportedFormatException for records older than version 3
     * @throws CopayException UNSUPPORTED_FORMAT when a required field is missing or invalid
     */
    public static TxProposal fromJson(JSONObject json) throws CopayException {
        int version = json.optInt("version", 1);
        if (version < Defaults.TX_PROPOSAL_VERSION)
            throw new UnsupportedFormatException(version);
        try {
            TxProposal x = new TxProposal();
            x.version = version;
            x.createdOn = json.getLong("createdOn");
            x.id = json.getString("id");
            x.walletId = optString(json, "walletId");
            x.creatorId = optString(json, "creatorId");
            x.chain = Chain.fromCode(json.getString("chain"));
            x.network = Network.fromCode(json.getString("network"));
            x.message = optString(json, "message");
            x.payProUrl = optString(json, "payProUrl");
            JSONObject changeAddress = json.optJSONObject("changeAddress");
            x.changeAddress = changeAddress != null ? addressFromJson(changeAddress) : null;

            x.outputs = new ArrayList<>();
            JSONArray outputs = json.getJSONArray("outputs");
            for (int i = 0; i < outputs.length(); i++)
                x.outputs.add(outputFromJson(outputs.getJSONObject(i)));
            x.inputs = new ArrayList<>();
            JSONArray inputs = json.optJSONArray("inputs");
            if (inputs != null)
                for (int i = 0; i < inputs.length(); i++)
                    x.inputs.add(utxoFromJson(inputs.getJSONObject(i)));
            List<String> inputPaths = stringList(json.optJSONArray("inputPaths"));
            x.setInputs(x.inputs);
            if (json.has("inputPaths") && !inputPaths.equals(x.inputPaths))
                throw new CopayException(ErrorCode.UNSUPPORTED_FORMAT, "Input paths " + inputPaths
                        + " do not match the inputs of proposal " + x.id);
            x.outputOrder = new ArrayList<>();
            JSONArray outputOrder = json.optJSONArray("outputOrder");
            if (outputOrder != null)
                for (int i = 0; i < outputOrder.length(); i++)
                    x.outputOrder.add(outputOrder.getInt(i));

            x.walletM = json.getInt("walletM");
            x.walletN = json.getInt("walletN");
            if (x.walletM < 1 || x.walletM > x.walletN || x.walletN > Defaults.MAX_KEYS)
                throw new CopayException(ErrorCode.UNSUPPORTED_FORMAT, "Invalid wallet threshold " + x.walletM + "-of-" + x.walletN);
            x.requiredSignatures = x.walletM;
            x.requiredRejections = Math.min(x.walletM, x.walletN - x.walletM + 1);
            if (json.optInt("requiredSignatures", x.requiredSignatures) != x.requiredSignatures
                    || json.optInt("requiredRejections", x.requiredRejections) != x.requiredRejections)
                throw new CopayException(ErrorCode.UNSUPPORTED_FORMAT, "Quorum of proposal " + x.id
                        + " does not match a " + x.walletM + "-of-" + x.walletN + " wallet");
            x.status = TxProposalStatus.fromCode(json.getString("status"));
            x.actions = new ArrayList<>();
            JSONArray actions = json.optJSONArray("actions");
            if (actions != null)
                for (int i = 0; i < actions.length(); i++)
                    x.actions.add(actionFromJson(actions.getJSONObject(i)));

            x.feeLevel = optString(json, "feeLevel");
            x.feePerKb = json.optLong("feePerKb", 0);
            x.excludeUnconfirmedUtxos = json.optBoolean("excludeUnconfirmedUtxos", false);
            x.addressType = json.has("addressType") ? ScriptType.valueOf(json.getString("addressType"))
                    : ScriptType.defaultFor(x.walletN);
            x.customData = optString(json, "customData");
            x.amount = json.optLong("amount", 0);
            x.fee = optLong(json, "fee");
            x.txid = optString(json, "txid");
            JSONArray txids = json.optJSONArray("txids");
            x.txids = txids != null ? stringList(txids) : null;
            x.raw = optString(json, "raw");
            x.broadcastedOn = optLong(json, "broadcastedOn");
            x.proposalSignature = optString(json, "proposalSignature");
            x.proposalSignaturePubKey = optString(json, "proposalSignaturePubKey");
            x.proposalSignaturePubKeySig = optString(json, "proposalSignaturePubKeySig");
            String signingMethod = optString(json, "signingMethod");
            x.signingMethod = signingMethod != null ? SigningMethod.fromCode(signingMethod) : SigningMethod.ECDSA;
            x.prePublishRaw = optString(json, "prePublishRaw");
            x.refreshOnPublish = json.optBoolean("refreshOnPublish", false);
            x.multiTx = json.optBoolean("multiTx", false);
            JSONObject payload = json.optJSONObject("payload");
            x.payload = payload != null ? payloadFromJson(x.chain, payload) : ChainPayload.defaultFor(x.chain.getFamily());
            checkOutputOrder(x);
            return x;
        } catch (JSONException | IllegalArgumentException x) {
            throw new CopayException(ErrorCode.UNSUPPORTED_FORMAT, "Invalid proposal record: " + x.getMessage(), x);
        }
    }

    // one slot per requested output, plus escrow and change when the proposal carries them
    private static void checkOutputOrder(TxProposal x) throws CopayException {
        int expected = x.outputs.size();
        if (!x.multiTx)
            expected++;
        if (x.getInstantAcceptanceEscrow() > 0)
            expected++;
        boolean[] seen = new boolean[expected];
        for (Integer i : x.outputOrder) {
            if (i < 0 || i >= expected || seen[i])
                throw new CopayException(ErrorCode.UNSUPPORTED_FORMAT, "Output order " + x.outputOrder
                        + " of proposal " + x.id + " is not a permutation of " + expected + " outputs");
            seen[i] = true;
        }
        if (x.outputOrder.size() != expected)
            throw new CopayException(ErrorCode.UNSUPPORTED_FORMAT, "Output order " + x.outputOrder
                    + " of proposal " + x.id + " is not a permutation of " + expected + " outputs");
    }

    static JSONObject addressToJson(AddressInfo address) {
        JSONObject json = new JSONObject();
        json.put("address", address.getAddress());
        json.put("path", address.getPath());
        json.put("publicKeys", new JSONArray(address.getPublicKeys()));
        json.put("type", address.getType().name());
        return json;
    }

    static AddressInfo addressFromJson(JSONObject json) {
        return new AddressInfo(json.getString("address"), json.getString("path"),
                stringList(json.optJSONArray("publicKeys")), ScriptType.valueOf(json.getString("type")));
    }

    private static JSONObject outputToJson(ProposalOutput output) {
        JSONObject json = new JSONObject();
        json.put("amount", output.getAmount());
        json.putOpt("toAddress", output.getToAddress());
        json.putOpt("script", output.getScript());
        json.putOpt("message", output.getMessage());
        json.putOpt("data", output.getData());
        json.putOpt("gasLimit", output.getGasLimit());
        json.putOpt("tag", output.getTag());
        return json;
    }

    private static ProposalOutput outputFromJson(JSONObject json) {
        return new ProposalOutput(json.getLong("amount"), optString(json, "toAddress"), optString(json, "script"),
                optString(json, "message"), optString(json, "data"), optLong(json, "gasLimit"), optLong(json, "tag"));
    }

    private static JSONObject utxoToJson(Utxo utxo) {
        JSONObject json = new JSONObject();
        json.put("txid", utxo.getTxid());
        json.put("vout", utxo.getVout());
        json.put("address", utxo.getAddress());
        json.put("path", utxo.getPath());
        json.put("satoshis", utxo.getSatoshis());
        json.put("confirmations", utxo.getConfirmations());
        json.put("publicKeys", new JSONArray(utxo.getPublicKeys()));
        json.putOpt("scriptPubKey", utxo.getScriptPubKey());
        json.put("locked", utxo.isLocked());
        return json;
    }

    private static Utxo utxoFromJson(JSONObject json) {
        Utxo utxo = new Utxo(json.getString("txid"), json.getInt("vout"), json.getString("address"),
                json.getString("path"), json.getLong("satoshis"), json.optInt("confirmations", 0),
                stringList(json.optJSONArray("publicKeys")), optString(json, "scriptPubKey"));
        utxo.setLocked(json.optBoolean("locked", false));
        return utxo;
    }

    private static JSONObject actionToJson(VoteAction action) {
        JSONObject json = new JSONObject();
        json.put("copayerId", action.getCopayerId());
        json.put("type", action.getType().getCode());
        if (!action.getSignatures().isEmpty())
            json.put("signatures", new JSONArray(action.getSignatures()));
        json.putOpt("xpub", action.getXpub());
        json.putOpt("comment", action.getComment());
        json.put("createdOn", action.getCreatedOn());
        return json;
    }

    private static VoteAction actionFromJson(JSONObject json) {
        return new VoteAction(json.getString("copayerId"), ActionType.fromCode(json.getString("type")),
                stringList(json.optJSONArray("signatures")), optString(json, "xpub"), optString(json, "comment"),
                json.optLong("createdOn", 0));
    }

    private static JSONObject payloadToJson(ChainPayload payload) {
        JSONObject json = new JSONObject();
        json.put("family", payload.getFamily().name());
        if (payload instanceof UtxoPayload) {
            UtxoPayload p = (UtxoPayload) payload;
            json.put("enableRBF", p.isEnableRBF());
            json.put("replaceTxByFee", p.isReplaceTxByFee());
            json.put("instantAcceptanceEscrow", p.getInstantAcceptanceEscrow());
            if (p.getEscrowAddress() != null)
                json.put("escrowAddress", addressToJson(p.getEscrowAddress()));
        } else if (payload instanceof EvmPayload) {
            EvmPayload p = (EvmPayload) payload;
            json.putOpt("from", p.getFrom());
            json.putOpt("nonce", p.getNonce());
            json.putOpt("gasPrice", p.getGasPrice());
            json.putOpt("maxGasFee", p.getMaxGasFee());
            json.putOpt("priorityGasFee", p.getPriorityGasFee());
            json.putOpt("gasLimit", p.getGasLimit());
            json.putOpt("txType", p.getTxType());
            json.putOpt("tokenAddress", p.getTokenAddress());
            json.putOpt("multisigContractAddress", p.getMultisigContractAddress());
            json.put("tokenSwap", p.isTokenSwap());
        } else if (payload instanceof XrpPayload) {
            XrpPayload p = (XrpPayload) payload;
            json.putOpt("destinationTag", p.getDestinationTag());
            json.putOpt("invoiceId", p.getInvoiceId());
        } else if (payload instanceof SolPayload) {
            SolPayload p = (SolPayload) payload;
            json.putOpt("blockHash", p.getBlockHash());
            json.putOpt("blockHeight", p.getBlockHeight());
            json.putOpt("nonceAddress", p.getNonceAddress());
            json.putOpt("category", p.getCategory());
            json.putOpt("computeUnits", p.getComputeUnits());
            json.putOpt("priorityFee", p.getPriorityFee());
            json.putOpt("memo", p.getMemo());
            json.putOpt("fromAta", p.getFromAta());
            json.putOpt("decimals", p.getDecimals());
            json.putOpt("space", p.getSpace());
        }
        return json;
    }

    private static ChainPayload payloadFromJson(Chain chain, JSONObject json) {
        switch (chain.getFamily()) {
            case BITCOIN: {
                JSONObject escrowAddress = json.optJSONObject("escrowAddress");
                return new UtxoPayload(json.optBoolean("enableRBF", false), json.optBoolean("replaceTxByFee", false),
                        json.optLong("instantAcceptanceEscrow", 0),
                        escrowAddress != null ? addressFromJson(escrowAddress) : null);
            }
            case EVM:
                return new EvmPayload.Builder()
                        .from(optString(json, "from"))
                        .nonce(optLong(json, "nonce"))
                        .gasPrice(optLong(json, "gasPrice"))
                        .maxGasFee(optLong(json, "maxGasFee"))
                        .priorityGasFee(optLong(json, "priorityGasFee"))
                        .gasLimit(optLong(json, "gasLimit"))
                        .txType(json.has("txType") ? json.getInt("txType") : null)
                        .tokenAddress(optString(json, "tokenAddress"))
                        .multisigContractAddress(optString(json, "multisigContractAddress"))
                        .tokenSwap(json.optBoolean("tokenSwap", false))
                        .build();
            case XRP:
                return new XrpPayload(optLong(json, "destinationTag"), optString(json, "invoiceId"));
            case SOLANA:
                return new SolPayload.Builder()
                        .blockHash(optString(json, "blockHash"))
                        .blockHeight(optLong(json, "blockHeight"))
                        .nonceAddress(optString(json, "nonceAddress"))
                        .category(optString(json, "category"))
                        .computeUnits(optLong(json, "computeUnits"))
                        .priorityFee(optLong(json, "priorityFee"))
                        .memo(optString(json, "memo"))
                        .fromAta(optString(json, "fromAta"))
                        .decimals(json.has("decimals") ? json.getInt("decimals") : null)
                        .space(optLong(json, "space"))
                        .build();
            default:
                throw new IllegalArgumentException("No payload for " + chain);
        }
    }

    @Nullable
    private static String optString(JSONObject json, String key) {
        return json.has(key) && !json.isNull(key) ? json.getString(key) : null;
    }

    @Nullable
    private static Long optLong(JSONObject json, String key) {
        return json.has(key) && !json.isNull(key) ? json.getLong(key) : null;
    }

    private static List<String> stringList(@Nullable JSONArray array) {
        List<String> result = new ArrayList<>();
        if (array != null)
            for (int i = 0; i < array.length(); i++)
                result.add(array.getString(i));
        return result;
    }
}
