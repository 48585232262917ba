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

package org.copayj.core;

public class WalletBusyException extends CopayException {
    private final String walletId;

    public WalletBusyException(String walletId) {
        super(ErrorCode.WALLET_BUSY, ErrorCode.WALLET_BUSY.getDefaultMessage() + ": " + walletId);
        this.walletId = walletId;
    }

    public String getWalletId() {
        return walletId;
    }
}
