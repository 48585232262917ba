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

import com.google.common.base.Strings;
import org.bitcoinj.core.Address;
import org.bitcoinj.core.AddressFormatException;
import org.copayj.chain.ChainAdapter;
import org.copayj.chain.ChainAdapters;
import org.copayj.core.ChainFamily;
import org.copayj.core.CopayException;
import org.copayj.crypto.CopayerIds;
import org.copayj.crypto.MemoCrypter;
import org.copayj.crypto.MemoCrypterException;
import org.copayj.crypto.MessageSigner;
import org.copayj.proposal.ProposalOutput;
import org.copayj.proposal.TxProposal;
import org.copayj.wallet.AddressDeriver;
import org.copayj.wallet.AddressInfo;
import org.copayj.wallet.Copayer;
import org.copayj.wallet.PublicKeyRingEntry;
import org.copayj.wallet.Utxo;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.json.JSONTokener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * <p>Client side re-derivation of what the service reports about a wallet: addresses, copayers,
 * proposals and payment protocol invoices. Everything is recomputed from the client's own
 * {@link Credentials}.</p>
 *
 * <p>Every check answers true or false and nothing else. The reason of a failure is only logged
 * locally, so that a dishonest service cannot use the answers to refine forged data.</p>
 */
public class Verifier {
    private static final Logger log = LoggerFactory.getLogger(Verifier.class);

    private final ChainAdapters adapters;

    public Verifier() {
        this(ChainAdapters.withDefaults());
    }

    public Verifier(ChainAdapters adapters) {
        this.adapters = adapters;
    }

    public boolean checkAddress(Credentials credentials, AddressInfo address) {
        return checkAddress(credentials, address, null);
    }

    /**
     * Recomputes {@code address} from the local public key ring.
     *
     * @param escrowInputs for an escrow address, the inputs of the proposal it secures
     */
    public boolean checkAddress(Credentials credentials, @Nullable AddressInfo address, @Nullable List<Utxo> escrowInputs) {
        if (address == null)
            return false;
        if (!credentials.isComplete()) {
            log.debug("Cannot check address {} before the wallet is complete", address.getAddress());
            return false;
        }
        if (credentials.getChain().getFamily() != ChainFamily.BITCOIN) {
            log.warn("Cannot derive {} addresses locally", credentials.getChain());
            return false;
        }
        List<String> escrowInputPaths = null;
        if (escrowInputs != null) {
            escrowInputPaths = new ArrayList<>();
            for (Utxo input : escrowInputs)
                escrowInputPaths.add(input.getPath());
        }
        AddressInfo local;
        try {
            local = AddressDeriver.deriveAddress(address.getType() != null ? address.getType() : credentials.getAddressType(),
                    credentials.getPublicKeyRing(), address.getPath(), credentials.getM(), credentials.getNetwork(),
                    escrowInputPaths);
        } catch (IllegalArgumentException | IllegalStateException x) {
            log.warn("Cannot derive address at {}: {}", address.getPath(), x.getMessage());
            return false;
        }
        if (!local.getAddress().equals(address.getAddress())) {
            log.warn("Address mismatch at {}: got {}, derived {}", address.getPath(), address.getAddress(), local.getAddress());
            return false;
        }
        if (!address.getPublicKeys().containsAll(local.getPublicKeys())) {
            log.warn("Public keys mismatch for {}", address.getAddress());
            return false;
        }
        return true;
    }

    /**
     * Checks the copayers of a complete wallet: {@code n} of them, no extended key twice, every one
     * registered with a signature by the wallet key, and one of them us.
     */
    public boolean checkCopayers(Credentials credentials, List<Copayer> copayers) {
        String walletPubKey = credentials.getWalletPubKey();
        if (walletPubKey == null) {
            log.debug("No wallet key to check the copayers against");
            return false;
        }
        if (copayers.size() != credentials.getN()) {
            log.error("Missing public keys in server response");
            return false;
        }
        Set<String> xPubKeys = new HashSet<>();
        for (Copayer copayer : copayers) {
            if (!xPubKeys.add(copayer.getXPubKey())) {
                log.error("Repeated public keys in server response");
                return false;
            }
            if (Strings.isNullOrEmpty(copayer.getName()) || Strings.isNullOrEmpty(copayer.getRequestPubKey())
                    || Strings.isNullOrEmpty(copayer.getSignature())) {
                log.error("Missing copayer fields in server response");
                return false;
            }
            String hash = CopayerIds.getCopayerHash(copayer.getName(), copayer.getXPubKey(), copayer.getRequestPubKey());
            if (!MessageSigner.verifyMessage(hash, copayer.getSignature(), walletPubKey)) {
                log.error("Invalid signatures in server response");
                return false;
            }
        }
        if (!xPubKeys.contains(credentials.getXPubKey())) {
            log.error("Server response does not contain our public keys");
            return false;
        }
        return true;
    }

    /**
     * Compares a proposal echoed by the service with the request that created it. Memos of the request
     * are decrypted with {@code encryptingKey}; a memo that does not decrypt fails the check.
     */
    public boolean checkProposalCreation(ProposalRequest request, TxProposal txp, @Nullable String encryptingKey) {
        List<ProposalOutput> sent = request.getOutputs();
        List<ProposalOutput> echoed = txp.getOutputs();
        if (sent.size() != echoed.size())
            return false;
        for (int i = 0; i < echoed.size(); i++) {
            ProposalOutput o1 = echoed.get(i);
            ProposalOutput o2 = sent.get(i);
            if (!strEqual(o1.getToAddress(), o2.getToAddress()))
                return false;
            if (!strEqual(o1.getScript(), o2.getScript()))
                return false;
            if (o1.getAmount() != o2.getAmount())
                return false;
            String decrypted;
            try {
                decrypted = decrypt(o2.getMessage(), encryptingKey);
            } catch (MemoCrypterException | IllegalArgumentException x) {
                log.warn("Cannot decrypt output memo: {}", x.getMessage());
                return false;
            }
            if (!strEqual(plain(o1.getMessage(), encryptingKey), decrypted))
                return false;
        }

        String changeAddress = txp.getChangeAddress() != null ? txp.getChangeAddress().getAddress() : null;
        if (request.getChangeAddress() != null && !strEqual(changeAddress, request.getChangeAddress()))
            return false;
        if (request.getFeePerKb() != null && txp.getFeePerKb() != request.getFeePerKb())
            return false;
        if (!strEqual(txp.getPayProUrl(), request.getPayProUrl()))
            return false;

        String decrypted;
        try {
            decrypted = decrypt(request.getMessage(), encryptingKey);
        } catch (MemoCrypterException | IllegalArgumentException x) {
            log.warn("Cannot decrypt proposal memo: {}", x.getMessage());
            return false;
        }
        if (!strEqual(plain(txp.getMessage(), encryptingKey), decrypted))
            return false;
        if ((request.getCustomData() != null || txp.getCustomData() != null)
                && !jsonEqual(txp.getCustomData(), request.getCustomData()))
            return false;
        return true;
    }

    /**
     * Checks the creator's signature over the proposal hash, walking the delegation to a proposal
     * signing key when one is used, and for bitcoin wallets re-derives the change and escrow addresses.
     */
    public boolean checkTxProposalSignature(Credentials credentials, TxProposal txp) {
        if (txp.getCreatorId() == null) {
            log.debug("Proposal {} has no creator", txp.getId());
            return false;
        }
        if (!credentials.isComplete()) {
            log.debug("Cannot check proposal {} before the wallet is complete", txp.getId());
            return false;
        }

        PublicKeyRingEntry creatorKeys = null;
        for (PublicKeyRingEntry entry : credentials.getPublicKeyRing()) {
            if (CopayerIds.xPubToCopayerId(txp.getChain(), entry.getXPubKey()).equals(txp.getCreatorId())) {
                creatorKeys = entry;
                break;
            }
        }
        if (creatorKeys == null)
            return false;

        String creatorSigningPubKey;
        if (txp.getProposalSignaturePubKey() != null) {
            if (!CopayerIds.verifyRequestPubKey(txp.getProposalSignaturePubKey(), txp.getProposalSignaturePubKeySig(),
                    creatorKeys.getXPubKey(), credentials.getNetwork().getParams()))
                return false;
            creatorSigningPubKey = txp.getProposalSignaturePubKey();
        } else {
            creatorSigningPubKey = creatorKeys.getRequestPubKey();
        }
        if (creatorSigningPubKey == null)
            return false;

        String hash;
        try {
            ChainAdapter adapter = adapters.get(txp.getChain());
            hash = txp.getProposalHash(adapter);
        } catch (CopayException x) {
            log.warn("Cannot rebuild proposal {}: {}", txp.getId(), x.toString());
            return false;
        }
        log.debug("Regenerating & verifying tx proposal hash -> Hash: {} Signature: {}", hash, txp.getProposalSignature());

        boolean verified = MessageSigner.verifyMessage(hash, txp.getProposalSignature(), creatorSigningPubKey);
        if (!verified) {
            if (txp.getPrePublishRaw() == null)
                return false;
            if (!MessageSigner.verifyMessage(txp.getPrePublishRaw(), txp.getProposalSignature(), creatorSigningPubKey))
                return false;
        }

        if (txp.getChain().isUtxoChain()) {
            if (txp.getChangeAddress() != null && !checkAddress(credentials, txp.getChangeAddress()))
                return false;
            if (txp.getEscrowAddress() != null && !checkAddress(credentials, txp.getEscrowAddress(), txp.getInputs()))
                return false;
        }
        return true;
    }

    /**
     * Compares an invoice with the proposal paying it: same total, and the first instruction's address
     * as the first output. Bitcoin addresses are compared parsed, so that bech32 case does not matter.
     */
    public boolean checkPaypro(TxProposal txp, PayProDetails paypro) {
        if (paypro.getInstructions().isEmpty() || txp.getOutputs().isEmpty())
            return false;
        if (txp.getAmount() != paypro.getTotalAmount())
            return false;
        String toAddress = txp.getOutputs().get(0).getToAddress();
        String expected = paypro.getInstructions().get(0).getToAddress();
        if (toAddress == null || expected == null)
            return false;
        if (!sameAddress(txp, toAddress, expected))
            return false;
        // requiredFeeRate is not compared
        return true;
    }

    /** Proposal signature, then the invoice when there is one. */
    public boolean checkTxProposal(Credentials credentials, TxProposal txp, @Nullable PayProDetails paypro) {
        if (!checkTxProposalSignature(credentials, txp))
            return false;
        return paypro == null || checkPaypro(txp, paypro);
    }

    private static boolean sameAddress(TxProposal txp, String a, String b) {
        switch (txp.getChain().getFamily()) {
            case BITCOIN:
                try {
                    return Address.fromString(txp.getNetwork().getParams(), a)
                            .equals(Address.fromString(txp.getNetwork().getParams(), b));
                } catch (AddressFormatException x) {
                    return false;
                }
            case EVM:
                // mixed case checksum encoding
                return a.toLowerCase(Locale.ROOT).equals(b.toLowerCase(Locale.ROOT));
            default:
                return a.equals(b);
        }
    }

    // Decrypts a memo the client sent; plain text memos pass through.
    @Nullable
    private static String decrypt(@Nullable String message, @Nullable String encryptingKey) {
        if (Strings.isNullOrEmpty(message))
            return null;
        if (encryptingKey == null || !MemoCrypter.isEnvelope(message))
            return message;
        return MemoCrypter.decryptMessage(message, encryptingKey);
    }

    // A memo echoed by the service, decrypted if it still is an envelope.
    @Nullable
    private static String plain(@Nullable String message, @Nullable String encryptingKey) {
        if (Strings.isNullOrEmpty(message))
            return null;
        if (encryptingKey == null || !MemoCrypter.isEnvelope(message))
            return message;
        return MemoCrypter.decryptMessageNoThrow(message, encryptingKey);
    }

    private static boolean strEqual(@Nullable String a, @Nullable String b) {
        return (Strings.isNullOrEmpty(a) && Strings.isNullOrEmpty(b)) || Objects.equals(a, b);
    }

    private static boolean jsonEqual(@Nullable String a, @Nullable String b) {
        if (a == null || b == null)
            return a == null && b == null;
        try {
            Object x = new JSONTokener(a).nextValue();
            Object y = new JSONTokener(b).nextValue();
            if (x instanceof JSONObject && y instanceof JSONObject)
                return ((JSONObject) x).similar(y);
            if (x instanceof JSONArray && y instanceof JSONArray)
                return ((JSONArray) x).similar(y);
            return Objects.equals(x, y);
        } catch (JSONException x) {
            return a.equals(b);
        }
    }
}
