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

import org.copayj.core.ChainFamily;
import org.copayj.wallet.AddressInfo;

import javax.annotation.Nullable;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Bitcoin family fields: replace-by-fee signalling and the instant acceptance escrow.
 */
public final class UtxoPayload extends ChainPayload {
    private final boolean enableRBF;
    private final boolean replaceTxByFee;
    private final long instantAcceptanceEscrow;
    @Nullable private final AddressInfo escrowAddress;

    public UtxoPayload(boolean enableRBF, boolean replaceTxByFee, long instantAcceptanceEscrow,
                       @Nullable AddressInfo escrowAddress) {
        checkArgument(instantAcceptanceEscrow >= 0, "negative escrow");
        this.enableRBF = enableRBF;
        this.replaceTxByFee = replaceTxByFee;
        this.instantAcceptanceEscrow = instantAcceptanceEscrow;
        this.escrowAddress = escrowAddress;
    }

    @Override
    public ChainFamily getFamily() {
        return ChainFamily.BITCOIN;
    }

    /** Input sequence numbers signal replaceability. */
    public boolean isEnableRBF() {
        return enableRBF;
    }

    /** This proposal replaces a previous transaction and must reuse one of its inputs. */
    public boolean isReplaceTxByFee() {
        return replaceTxByFee;
    }

    public long getInstantAcceptanceEscrow() {
        return instantAcceptanceEscrow;
    }

    @Nullable
    public AddressInfo getEscrowAddress() {
        return escrowAddress;
    }

    public UtxoPayload withEscrowAddress(@Nullable AddressInfo escrowAddress) {
        return new UtxoPayload(enableRBF, replaceTxByFee, instantAcceptanceEscrow, escrowAddress);
    }
}
