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

import org.copayj.core.CopayException;
import org.copayj.wallet.Utxo;
import org.copayj.wallet.Wallet;

import java.util.List;

/**
 * What the coordinator needs from the embedding service's storage and blockchain indexer.
 */
public interface WalletBackend {
    /** Every unspent output of the wallet, confirmed or not. Locks are set by the coordinator. */
    List<Utxo> getUtxos(Wallet wallet) throws CopayException;

    /** Reserves and returns the next unused change path of the wallet, such as {@code m/1/7}. */
    String nextChangePath(Wallet wallet);
}
