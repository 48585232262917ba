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

import com.google.common.collect.ImmutableList;
import org.copayj.proposal.ProposalOutput;

import javax.annotation.Nullable;
import java.util.List;

/**
 * The creation arguments a client sent for a new proposal, memos still encrypted as they were sent.
 * The service's echo of the proposal is compared against it by
 * {@link Verifier#checkProposalCreation(ProposalRequest, org.copayj.proposal.TxProposal, String)}.
 */
public class ProposalRequest {
    private final List<ProposalOutput> outputs;
    @Nullable private final String changeAddress;
    @Nullable private final Long feePerKb;
    @Nullable private final String payProUrl;
    @Nullable private final String message;
    @Nullable private final String customData;

    public ProposalRequest(List<ProposalOutput> outputs, @Nullable String changeAddress, @Nullable Long feePerKb,
                           @Nullable String payProUrl, @Nullable String message, @Nullable String customData) {
        this.outputs = ImmutableList.copyOf(outputs);
        this.changeAddress = changeAddress;
        this.feePerKb = feePerKb;
        this.payProUrl = payProUrl;
        this.message = message;
        this.customData = customData;
    }

    public List<ProposalOutput> getOutputs() {
        return outputs;
    }

    @Nullable
    public String getChangeAddress() {
        return changeAddress;
    }

    @Nullable
    public Long getFeePerKb() {
        return feePerKb;
    }

    @Nullable
    public String getPayProUrl() {
        return payProUrl;
    }

    @Nullable
    public String getMessage() {
        return message;
    }

    @Nullable
    public String getCustomData() {
        return customData;
    }
}
