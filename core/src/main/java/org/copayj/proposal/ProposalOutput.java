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

import javax.annotation.Nullable;
import java.util.Objects;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * A requested payment: an amount sent either to an address or to a raw output script (hex, OP_RETURN
 * only). The message is an encrypted memo. Data, gas limit and tag are used by account model chains.
 */
public final class ProposalOutput {
    private final long amount;
    @Nullable private final String toAddress;
    @Nullable private final String script;
    @Nullable private final String message;
    @Nullable private final String data;
    @Nullable private final Long gasLimit;
    @Nullable private final Long tag;

    public ProposalOutput(long amount, @Nullable String toAddress, @Nullable String script, @Nullable String message,
                          @Nullable String data, @Nullable Long gasLimit, @Nullable Long tag) {
        checkArgument(toAddress != null || script != null, "Output should have either toAddress or script specified");
        this.amount = amount;
        this.toAddress = toAddress;
        this.script = script;
        this.message = message;
        this.data = data;
        this.gasLimit = gasLimit;
        this.tag = tag;
    }

    public static ProposalOutput toAddress(String address, long amount) {
        return new ProposalOutput(amount, address, null, null, null, null, null);
    }

    public static ProposalOutput toAddress(String address, long amount, @Nullable String message) {
        return new ProposalOutput(amount, address, null, message, null, null, null);
    }

    public static ProposalOutput script(String scriptHex, long amount) {
        return new ProposalOutput(amount, null, scriptHex, null, null, null, null);
    }

    public long getAmount() {
        return amount;
    }

    @Nullable
    public String getToAddress() {
        return toAddress;
    }

    @Nullable
    public String getScript() {
        return script;
    }

    public boolean isOpReturn() {
        return script != null && script.startsWith("6a");
    }

    @Nullable
    public String getMessage() {
        return message;
    }

    @Nullable
    public String getData() {
        return data;
    }

    @Nullable
    public Long getGasLimit() {
        return gasLimit;
    }

    @Nullable
    public Long getTag() {
        return tag;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ProposalOutput other = (ProposalOutput) o;
        return amount == other.amount && Objects.equals(toAddress, other.toAddress)
                && Objects.equals(script, other.script) && Objects.equals(message, other.message)
                && Objects.equals(data, other.data) && Objects.equals(gasLimit, other.gasLimit)
                && Objects.equals(tag, other.tag);
    }

    @Override
    public int hashCode() {
        return Objects.hash(amount, toAddress, script, message, data, gasLimit, tag);
    }

    @Override
    public String toString() {
        return amount + " to " + (toAddress != null ? toAddress : "script " + script);
    }
}
