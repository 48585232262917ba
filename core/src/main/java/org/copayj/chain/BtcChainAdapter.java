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

import org.bitcoinj.core.Address;
import org.bitcoinj.core.AddressFormatException;
import org.bitcoinj.core.Coin;
import org.bitcoinj.core.ECKey;
import org.bitcoinj.core.NetworkParameters;
import org.bitcoinj.core.SegwitAddress;
import org.bitcoinj.core.Sha256Hash;
import org.bitcoinj.core.SignatureDecodeException;
import org.bitcoinj.core.Transaction;
import org.bitcoinj.core.TransactionInput;
import org.bitcoinj.core.TransactionOutPoint;
import org.bitcoinj.core.TransactionOutput;
import org.bitcoinj.crypto.DeterministicKey;
import org.bitcoinj.crypto.HDDerivationException;
import org.bitcoinj.crypto.TransactionSignature;
import org.bitcoinj.script.Script;
import org.bitcoinj.script.ScriptBuilder;
import org.copayj.core.ChainFamily;
import org.copayj.core.CopayException;
import org.copayj.core.Defaults;
import org.copayj.core.ErrorCode;
import org.copayj.core.InsufficientFundsForFeeException;
import org.copayj.core.ScriptType;
import org.copayj.crypto.KeyPaths;
import org.copayj.proposal.ProposalOutput;
import org.copayj.proposal.TxProposal;
import org.copayj.proposal.VoteAction;
import org.copayj.wallet.AddressInfo;
import org.copayj.wallet.AddressDeriver;
import org.copayj.wallet.Balance;
import org.copayj.wallet.Utxo;
import org.copayj.wallet.Wallet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;
import static org.bitcoinj.core.Utils.HEX;

/**
 * {@link ChainAdapter} for bitcoin. Transactions are built with bitcoinj, sizes are estimated in virtual
 * bytes from closed form per script type, and copayer signatures are verified against the keys derived
 * from their extended public keys before being applied.
 */
public class BtcChainAdapter implements ChainAdapter {
    private static final Logger log = LoggerFactory.getLogger(BtcChainAdapter.class);

    // 72 byte DER signature plus sighash, pushed
    private static final int SIGNATURE_SIZE = 72 + 1;
    // compressed key, pushed
    private static final int PUBKEY_SIZE = 33 + 1;
    // version, locktime, input count, output count
    private static final int TX_OVERHEAD = 4 + 4 + 1 + 1;

    public static final long RBF_SEQUENCE = 0xfffffffdL;

    private final Options options;

    public BtcChainAdapter() {
        this(new Options.Builder().build());
    }

    public BtcChainAdapter(Options options) {
        this.options = options;
    }

    public Options getOptions() {
        return options;
    }

    @Override
    public ChainFamily getFamily() {
        return ChainFamily.BITCOIN;
    }

    @Override
    public boolean isUtxoModel() {
        return true;
    }

    @Override
    public boolean supportsMultisig() {
        return true;
    }

    @Override
    public long getDustAmount() {
        return options.dustAmount;
    }

    @Override
    public int getMaxTxSizeInKb() {
        return options.maxTxSizeInKb;
    }

    @Override
    public int estimatedSizeForSingleInput(TxProposal txp, EstimationOptions opts) {
        int margin = opts.isConservative() ? options.inputSizeEstimationMargin : 0;
        int m = txp.getRequiredSignatures();
        int n = txp.getWalletN();
        switch (txp.getAddressType()) {
            case P2PKH:
                return 148 + margin;
            case P2WPKH:
                return 69 + margin;
            case P2TR:
                return 58 + margin;
            case P2WSH:
                return (int) Math.ceil(32 + 4 + 1 + (5 + m * 74 + n * 34) / 4.0 + 4) + margin;
            case P2SH:
                return 46 + m * SIGNATURE_SIZE + n * PUBKEY_SIZE + margin;
            default:
                log.warn("Unknown address type {}, estimating as P2SH", txp.getAddressType());
                return 46 + m * SIGNATURE_SIZE + n * PUBKEY_SIZE + margin;
        }
    }

    /** Size of an output paying to the given address, or of a 34 byte script when unknown. */
    public int estimatedSizeForSingleOutput(@Nullable NetworkParameters params, @Nullable String address) {
        int scriptSize = 34;
        if (address != null) {
            try {
                Address a = Address.fromString(params, address);
                if (a instanceof SegwitAddress) {
                    SegwitAddress segwit = (SegwitAddress) a;
                    if (segwit.getWitnessVersion() == 0)
                        scriptSize = segwit.getWitnessProgram().length == 20 ? 22 : 34;
                } else {
                    scriptSize = a.getOutputScriptType() == Script.ScriptType.P2SH ? 23 : 25;
                }
            } catch (AddressFormatException x) {
                log.debug("Cannot parse output address {}, assuming the default output size", address);
            }
        }
        // value and script length
        return scriptSize + 8 + 1;
    }

    @Override
    public int estimatedSize(TxProposal txp, EstimationOptions opts) {
        NetworkParameters params = txp.getNetwork().getParams();
        int inputSize = estimatedSizeForSingleInput(txp, opts);
        int outputsSize = 0;
        for (ProposalOutput output : txp.getOutputs())
            outputsSize += estimatedSizeForSingleOutput(params, output.getToAddress());
        if (txp.getChangeAddress() != null)
            outputsSize += estimatedSizeForSingleOutput(params, txp.getChangeAddress().getAddress());
        if (txp.getInstantAcceptanceEscrow() > 0)
            outputsSize += 23 + 8 + 1;
        // no output defined yet (send max): count a single default one
        if (outputsSize == 0)
            outputsSize = estimatedSizeForSingleOutput(params, null);

        double size = TX_OVERHEAD + inputSize * txp.getInputs().size() + outputsSize;
        double margin = opts.isConservative() ? size * options.sizeEstimationMargin : 0;
        return (int) Math.ceil(size + margin);
    }

    @Override
    public long estimatedFee(TxProposal txp, EstimationOptions opts) {
        // a proposal without change pays whatever its inputs do not send
        if (!txp.getInputs().isEmpty() && txp.getChangeAddress() == null && !txp.getOutputs().isEmpty()) {
            long totalInputs = 0;
            for (Utxo input : txp.getInputs())
                totalInputs += input.getSatoshis();
            long totalOutputs = txp.getTotalAmount();
            if (totalInputs > 0 && totalOutputs > 0)
                return totalInputs - totalOutputs;
        }
        return feeForSize(estimatedSize(txp, opts), txp.getFeePerKb());
    }

    /** {@code ceil(size * feePerKb / 1000)}, at least the dust amount. */
    public long feeForSize(long size, long feePerKb) {
        long fee = (size * feePerKb + 999) / 1000;
        return Math.max(fee, options.dustAmount);
    }

    @Override
    public UtxoTransaction buildTransaction(TxProposal txp, boolean signed) throws CopayException {
        if (txp.isMultiTx())
            throw new CopayException(ErrorCode.MULTI_TX_UNSUPPORTED);
        if (txp.getFee() == null)
            throw new CopayException(ErrorCode.INTERNAL, "Proposal " + txp.getId() + " has no fee");
        try {
            UtxoTransaction tx = build(txp);
            if (signed) {
                for (VoteAction action : txp.getCurrentSignatures())
                    addSignatures(tx, txp.getInputs(), txp.getInputPaths(), action.getSignatures(), action.getXpub(),
                            txp.getSigningMethod());
            }
            return tx;
        } catch (AddressFormatException x) {
            throw new CopayException(ErrorCode.INVALID_ADDRESS, x.getMessage(), x);
        } catch (RuntimeException x) {
            log.warn("Error building transaction for proposal {}", txp.getId(), x);
            throw CopayException.internal("Error building transaction: " + x.getMessage(), x);
        }
    }

    private UtxoTransaction build(TxProposal txp) throws CopayException {
        NetworkParameters params = txp.getNetwork().getParams();
        ScriptType scriptType = txp.getAddressType();
        Transaction tx = new Transaction(params);
        tx.setVersion(1);

        List<Coin> inputValues = new ArrayList<>();
        List<Script> multisigScripts = new ArrayList<>();
        for (Utxo utxo : txp.getInputs()) {
            Script multisig = null;
            if (scriptType.isMultisig()) {
                if (utxo.getPublicKeys().isEmpty())
                    throw new CopayException(ErrorCode.INTERNAL, "Inputs should include public keys");
                multisig = ScriptBuilder.createRedeemScript(txp.getRequiredSignatures(),
                        AddressDeriver.parsePublicKeys(utxo.getPublicKeys()));
            }
            Coin value = Coin.valueOf(utxo.getSatoshis());
            TransactionOutPoint outPoint = new TransactionOutPoint(params, utxo.getVout(), Sha256Hash.wrap(utxo.getTxid()));
            TransactionInput input = new TransactionInput(params, tx, new byte[0], outPoint, value);
            if (txp.isEnableRBF())
                input.setSequenceNumber(RBF_SEQUENCE);
            tx.addInput(input);
            inputValues.add(value);
            multisigScripts.add(multisig);
        }

        long fee = txp.getFee();
        long totalInputs = 0;
        for (Coin value : inputValues)
            totalInputs += value.value;

        // natural order: requested outputs, escrow, change
        List<TransactionOutput> outputs = new ArrayList<>();
        for (ProposalOutput o : txp.getOutputs()) {
            byte[] script = o.getScript() != null
                    ? HEX.decode(o.getScript())
                    : ScriptBuilder.createOutputScript(Address.fromString(params, o.getToAddress())).getProgram();
            outputs.add(new TransactionOutput(params, tx, Coin.valueOf(o.getAmount()), script));
        }
        AddressInfo escrowAddress = txp.getEscrowAddress();
        if (txp.getInstantAcceptanceEscrow() > 0 && escrowAddress != null) {
            Address escrow = Address.fromString(params, escrowAddress.getAddress());
            outputs.add(new TransactionOutput(params, tx, Coin.valueOf(txp.getInstantAcceptanceEscrow() + fee),
                    ScriptBuilder.createOutputScript(escrow).getProgram()));
        }
        long totalOutputs = 0;
        for (TransactionOutput output : outputs)
            totalOutputs += output.getValue().value;

        long change = totalInputs - totalOutputs - fee;
        if (change > options.dustAmount) {
            if (txp.getChangeAddress() == null)
                throw new CopayException(ErrorCode.INTERNAL, "Proposal " + txp.getId() + " has change but no change address");
            Address changeAddress = Address.fromString(params, txp.getChangeAddress().getAddress());
            outputs.add(new TransactionOutput(params, tx, Coin.valueOf(change),
                    ScriptBuilder.createOutputScript(changeAddress).getProgram()));
            totalOutputs += change;
        } else if (change > 0) {
            log.debug("Change {} below dust, added to the fee", change);
        }

        if (outputs.size() > 1) {
            // slots past the built outputs belong to an unset escrow or a folded change
            List<Integer> order = new ArrayList<>();
            boolean[] seen = new boolean[outputs.size()];
            for (Integer i : txp.getOutputOrder()) {
                if (i < 0 || (i < outputs.size() && seen[i]))
                    throw new CopayException(ErrorCode.INTERNAL, "Output order " + txp.getOutputOrder()
                            + " of proposal " + txp.getId() + " is not a permutation");
                if (i < outputs.size()) {
                    seen[i] = true;
                    order.add(i);
                }
            }
            if (order.size() != outputs.size())
                throw new CopayException(ErrorCode.INTERNAL, "Output order does not match the outputs of proposal " + txp.getId());
            List<TransactionOutput> ordered = new ArrayList<>();
            for (Integer i : order)
                ordered.add(outputs.get(i));
            outputs = ordered;
        }
        for (TransactionOutput output : outputs)
            tx.addOutput(output);

        if (totalInputs <= 0 || totalOutputs <= 0 || totalInputs < totalOutputs)
            throw new CopayException(ErrorCode.INSUFFICIENT_FUNDS, "Not enough inputs for proposal " + txp.getId());
        if (totalInputs - totalOutputs > options.maxTxFee)
            throw new CopayException(ErrorCode.TX_FEE_TOO_HIGH);

        return new UtxoTransaction(tx, scriptType, inputValues, multisigScripts);
    }

    @Override
    public void addSignatures(ChainTransaction chainTx, List<Utxo> inputs, List<String> inputPaths, List<String> signatures,
                              String xpub, SigningMethod signingMethod) throws CopayException {
        checkArgument(chainTx instanceof UtxoTransaction, "not a bitcoin transaction");
        UtxoTransaction tx = (UtxoTransaction) chainTx;
        if (signingMethod != SigningMethod.ECDSA)
            throw new CopayException(ErrorCode.UNSUPPORTED_SCRIPT_TYPE, "Signing method " + signingMethod.getCode() + " not supported");
        if (tx.getScriptType() == ScriptType.P2TR)
            throw new CopayException(ErrorCode.UNSUPPORTED_SCRIPT_TYPE, "Taproot inputs cannot be signed");
        if (signatures.size() != inputs.size() || inputs.size() != tx.getTransaction().getInputs().size())
            throw new CopayException(ErrorCode.SIGNATURE_COUNT_MISMATCH);
        if (inputPaths.size() != inputs.size())
            throw new CopayException(ErrorCode.INTERNAL, "Expected " + inputs.size() + " input paths, got " + inputPaths.size());
        if (xpub == null)
            throw new CopayException(ErrorCode.BAD_SIGNATURES, "No extended public key");

        List<ECKey> keys = new ArrayList<>();
        List<TransactionSignature> verified = new ArrayList<>();
        try {
            DeterministicKey x = KeyPaths.parseExtendedKey(xpub, tx.getTransaction().getParams());
            for (int i = 0; i < signatures.size(); i++) {
                ECKey pub = ECKey.fromPublicOnly(KeyPaths.derive(x, inputPaths.get(i)).getPubKey());
                ECKey.ECDSASignature signature = ECKey.ECDSASignature.decodeFromDER(HEX.decode(signatures.get(i)));
                if (!tx.canSign(i, pub))
                    throw new CopayException(ErrorCode.BAD_SIGNATURES, "Key at " + inputPaths.get(i) + " cannot sign input " + i);
                Sha256Hash hash = tx.hashForSignature(i, pub);
                if (!ECKey.verify(hash.getBytes(), signature, pub.getPubKey()))
                    throw new CopayException(ErrorCode.BAD_SIGNATURES, "Invalid signature for input " + i);
                keys.add(pub);
                verified.add(new TransactionSignature(signature, Transaction.SigHash.ALL, false));
            }
        } catch (SignatureDecodeException | IllegalArgumentException | HDDerivationException x) {
            throw new CopayException(ErrorCode.BAD_SIGNATURES, x.getMessage(), x);
        }

        for (int i = 0; i < verified.size(); i++)
            tx.addSignature(i, keys.get(i), verified.get(i));
        tx.updateInputs();
    }

    @Override
    public void validateAddress(Wallet wallet, String address) throws CopayException {
        NetworkParameters params = wallet.getNetwork().getParams();
        try {
            Address.fromString(params, address);
        } catch (AddressFormatException.WrongNetwork x) {
            throw new CopayException(ErrorCode.INCORRECT_ADDRESS_NETWORK);
        } catch (AddressFormatException x) {
            try {
                Address.fromString(null, address);
            } catch (AddressFormatException y) {
                throw new CopayException(ErrorCode.INVALID_ADDRESS);
            }
            throw new CopayException(ErrorCode.INCORRECT_ADDRESS_NETWORK);
        }
    }

    @Override
    public void checkDust(ProposalOutput output) throws CopayException {
        long dustThreshold = Math.max(Defaults.MIN_OUTPUT_AMOUNT, options.dustAmount);
        if (output.getAmount() < dustThreshold)
            throw new CopayException(ErrorCode.DUST_AMOUNT);
    }

    @Override
    public void checkScriptOutput(ProposalOutput output) throws CopayException {
        String script = output.getScript();
        if (script == null)
            return;
        if (!HEX.canDecode(script))
            throw new CopayException(ErrorCode.SCRIPT_TYPE);
        if (!script.startsWith("6a"))
            throw new CopayException(ErrorCode.SCRIPT_OP_RETURN);
        if (output.getAmount() != 0)
            throw new CopayException(ErrorCode.SCRIPT_OP_RETURN_AMOUNT);
    }

    @Override
    public void checkTx(TxProposal txp) throws CopayException {
        if (estimatedSize(txp, EstimationOptions.CONSERVATIVE) / 1000.0 > options.maxTxSizeInKb)
            throw new CopayException(ErrorCode.TX_MAX_SIZE_EXCEEDED);
        if (txp.getInputPaths().isEmpty())
            throw new CopayException(ErrorCode.NO_INPUT_PATHS);

        boolean hasOpReturn = false;
        for (ProposalOutput output : txp.getOutputs())
            hasOpReturn |= output.isOpReturn();

        UtxoTransaction tx;
        try {
            tx = buildTransaction(txp, true);
        } catch (CopayException x) {
            log.warn("Error building transaction for proposal {}: {}", txp.getId(), x.toString());
            throw x;
        }
        if (tx.getFee() < txp.getFee())
            throw new InsufficientFundsForFeeException(txp.getChain(), txp.getFee(), txp.getFeePerKb());
        if (!hasOpReturn) {
            for (TransactionOutput output : tx.getTransaction().getOutputs())
                if (output.getValue().value < options.dustAmount)
                    throw new CopayException(ErrorCode.DUST_AMOUNT);
        }
        // the escrow output carries the fee, so a proposal with escrow keeps the fee it was built with
        if (txp.getInstantAcceptanceEscrow() == 0)
            txp.setFee(tx.getFee());
    }

    @Override
    public Balance totalizeUtxos(List<Utxo> utxos) {
        return Balance.of(utxos);
    }

    /**
     * Size estimation margins and chain limits. Margins only apply to conservative estimates.
     */
    public static class Options {
        private final double sizeEstimationMargin;
        private final int inputSizeEstimationMargin;
        private final int maxTxSizeInKb;
        private final long maxTxFee;
        private final long dustAmount;

        private Options(Builder builder) {
            this.sizeEstimationMargin = builder.sizeEstimationMargin;
            this.inputSizeEstimationMargin = builder.inputSizeEstimationMargin;
            this.maxTxSizeInKb = builder.maxTxSizeInKb;
            this.maxTxFee = builder.maxTxFee;
            this.dustAmount = builder.dustAmount;
        }

        public double getSizeEstimationMargin() {
            return sizeEstimationMargin;
        }

        public int getInputSizeEstimationMargin() {
            return inputSizeEstimationMargin;
        }

        public int getMaxTxSizeInKb() {
            return maxTxSizeInKb;
        }

        public long getMaxTxFee() {
            return maxTxFee;
        }

        public long getDustAmount() {
            return dustAmount;
        }

        public static class Builder {
            private double sizeEstimationMargin = Defaults.SIZE_ESTIMATION_MARGIN;
            private int inputSizeEstimationMargin = Defaults.INPUT_SIZE_ESTIMATION_MARGIN;
            private int maxTxSizeInKb = Defaults.MAX_TX_SIZE_IN_KB_BTC;
            private long maxTxFee = Defaults.MAX_TX_FEE_BTC;
            private long dustAmount = Defaults.DUST_AMOUNT;

            /** Proportional margin added to conservative size estimates. */
            public Builder sizeEstimationMargin(double sizeEstimationMargin) {
                checkArgument(sizeEstimationMargin >= 0, "negative margin");
                this.sizeEstimationMargin = sizeEstimationMargin;
                return this;
            }

            /** Bytes added to each input in conservative estimates. */
            public Builder inputSizeEstimationMargin(int inputSizeEstimationMargin) {
                checkArgument(inputSizeEstimationMargin >= 0, "negative margin");
                this.inputSizeEstimationMargin = inputSizeEstimationMargin;
                return this;
            }

            public Builder maxTxSizeInKb(int maxTxSizeInKb) {
                this.maxTxSizeInKb = maxTxSizeInKb;
                return this;
            }

            public Builder maxTxFee(long maxTxFee) {
                this.maxTxFee = maxTxFee;
                return this;
            }

            public Builder dustAmount(long dustAmount) {
                this.dustAmount = dustAmount;
                return this;
            }

            public Options build() {
                return new Options(this);
            }
        }
    }
}
