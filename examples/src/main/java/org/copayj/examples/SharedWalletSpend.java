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

package org.copayj.examples;

import com.google.common.collect.ImmutableList;
import org.bitcoinj.crypto.DeterministicKey;
import org.bitcoinj.crypto.HDKeyDerivation;
import org.bitcoinj.core.ECKey;
import org.bitcoinj.core.Sha256Hash;
import org.bitcoinj.utils.BriefLogFormatter;
import org.bitcoinj.wallet.DeterministicSeed;
import org.copayj.chain.ChainAdapter;
import org.copayj.chain.ChainAdapters;
import org.copayj.core.Chain;
import org.copayj.core.Network;
import org.copayj.core.ScriptType;
import org.copayj.crypto.CopayerIds;
import org.copayj.crypto.KeyPaths;
import org.copayj.crypto.MessageSigner;
import org.copayj.proposal.ProposalOptions;
import org.copayj.proposal.ProposalOutput;
import org.copayj.proposal.TxProposal;
import org.copayj.service.MemoryProposalStore;
import org.copayj.service.ProposalCoordinator;
import org.copayj.service.WalletBackend;
import org.copayj.verify.ProposalSigner;
import org.copayj.wallet.AddressDeriver;
import org.copayj.wallet.AddressInfo;
import org.copayj.wallet.Copayer;
import org.copayj.wallet.Utxo;
import org.copayj.wallet.Wallet;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * The following example walks a 2-of-3 testnet wallet through one spend: three copayers are derived from
 * seed phrases, the wallet receives two (made up) payments, the first copayer proposes a payment and
 * publishes it, and two copayers sign it. The fully signed transaction is printed at the end; broadcasting
 * it is left to whatever node or explorer you use.
 */
public class SharedWalletSpend {
    private static final String ACCOUNT_PATH = "m/48'/1'/0'/0'";
    private static final String REQUEST_KEY_PATH = "m/1'/0";

    public static void main(String[] args) throws Exception {
        BriefLogFormatter.init();
        Network network = Network.TESTNET;
        String[] phrases = args.length == 3 ? args : new String[]{
                "abandon abandon abandon abandon abandon abandon abandon abandon abandon abandon abandon about",
                "legal winner thank year wave sausage worth useful legal winner thank yellow",
                "letter advice cage absurd amount doctor acoustic avoid letter advice cage above"
        };

        // The wallet key only signs copayer registrations.
        ECKey walletKey = ECKey.fromPrivate(Sha256Hash.hash("shared wallet secret".getBytes(StandardCharsets.UTF_8)));
        Wallet wallet = new Wallet("example-wallet", "Example", 2, 3, Chain.BTC, network, ScriptType.P2SH,
                walletKey.getPublicKeyAsHex());

        List<DeterministicKey> accountKeys = new ArrayList<>();
        List<ECKey> requestKeys = new ArrayList<>();
        for (int i = 0; i < phrases.length; i++) {
            DeterministicSeed seed = new DeterministicSeed(phrases[i], null, "", 0);
            DeterministicKey master = HDKeyDerivation.createMasterPrivateKey(seed.getSeedBytes());
            DeterministicKey account = KeyPaths.derive(master, ACCOUNT_PATH);
            ECKey requestKey = KeyPaths.derive(master, REQUEST_KEY_PATH);
            accountKeys.add(account);
            requestKeys.add(requestKey);

            String xPubKey = account.serializePubB58(network.getParams());
            String name = "copayer " + (i + 1);
            String signature = MessageSigner.signMessage(
                    CopayerIds.getCopayerHash(name, xPubKey, requestKey.getPublicKeyAsHex()), walletKey);
            wallet.addCopayer(Copayer.create(Chain.BTC, name, xPubKey, requestKey.getPublicKeyAsHex(), signature));
        }
        System.out.println("Wallet complete: " + wallet.isComplete());

        final List<Utxo> utxos = new ArrayList<>();
        AddressInfo receive0 = AddressDeriver.deriveAddress(ScriptType.P2SH, wallet.getPublicKeyRing(), "m/0/0", 2, network);
        AddressInfo receive1 = AddressDeriver.deriveAddress(ScriptType.P2SH, wallet.getPublicKeyRing(), "m/0/1", 2, network);
        utxos.add(new Utxo(Sha256Hash.of("funding 1".getBytes(StandardCharsets.UTF_8)).toString(), 0,
                receive0.getAddress(), receive0.getPath(), 150000, 12, receive0.getPublicKeys(), null));
        utxos.add(new Utxo(Sha256Hash.of("funding 2".getBytes(StandardCharsets.UTF_8)).toString(), 1,
                receive1.getAddress(), receive1.getPath(), 60000, 3, receive1.getPublicKeys(), null));
        System.out.println("Funds at " + receive0 + " and " + receive1);

        WalletBackend backend = new WalletBackend() {
            private int changeIndex;

            @Override
            public List<Utxo> getUtxos(Wallet w) {
                return utxos;
            }

            @Override
            public String nextChangePath(Wallet w) {
                return "m/1/" + changeIndex++;
            }
        };

        ChainAdapters adapters = ChainAdapters.withDefaults();
        ChainAdapter adapter = adapters.get(Chain.BTC);
        ProposalCoordinator coordinator = new ProposalCoordinator(adapters, backend, new MemoryProposalStore());
        System.out.println(coordinator.getBalance(wallet));

        List<Copayer> copayers = wallet.getCopayers();
        AddressInfo destination = AddressDeriver.deriveAddress(ScriptType.P2PKH,
                ImmutableList.of(wallet.getPublicKeyRing().get(2)), "m/0/7", 1, network);
        ProposalOptions opts = new ProposalOptions()
                .addOutput(ProposalOutput.toAddress(destination.getAddress(), 120000))
                .message("rent")
                .feePerKb(2000);
        TxProposal txp = coordinator.createTx(wallet, copayers.get(0).getId(), opts);
        System.out.println("Created " + txp);

        String proposalSignature = ProposalSigner.signProposal(adapter, txp, requestKeys.get(0));
        txp = coordinator.publishTx(wallet, copayers.get(0).getId(), txp.getId(), proposalSignature, null, null);
        System.out.println("Published, status " + txp.getStatus());

        for (int i = 0; i < 2; i++) {
            List<String> signatures = ProposalSigner.signInputs(adapter, txp, accountKeys.get(i));
            txp = coordinator.signTx(wallet, copayers.get(i).getId(), txp.getId(), signatures);
            System.out.println("Signed by " + copayers.get(i).getName() + ", status " + txp.getStatus());
        }

        System.out.println("txid " + txp.getTxid());
        System.out.println(txp.getRaw());
    }
}
