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

import javax.annotation.Nullable;

public final class XrpPayload extends ChainPayload {
    @Nullable private final Long destinationTag;
    @Nullable private final String invoiceId;

    public XrpPayload(@Nullable Long destinationTag, @Nullable String invoiceId) {
        this.destinationTag = destinationTag;
        this.invoiceId = invoiceId;
    }

    @Override
    public ChainFamily getFamily() {
        return ChainFamily.XRP;
    }

    @Nullable
    public Long getDestinationTag() {
        return destinationTag;
    }

    @Nullable
    public String getInvoiceId() {
        return invoiceId;
    }
}
