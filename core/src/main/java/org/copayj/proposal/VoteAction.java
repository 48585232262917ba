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

import com.google.common.collect.ImmutableList;
import org.bitcoinj.core.Utils;

import javax.annotation.Nullable;
import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A copayer's vote on a proposal. Accept votes carry one detached signature per input and the extended
 * public key they were checked against. Actions are appended to a proposal and never changed.
 */
public final class VoteAction {
    private final String copayerId;
    private final ActionType type;
    private final List<String> signatures;
    @Nullable private final String xpub;
    @Nullable private final String comment;
    private final long createdOn;

    public VoteAction(String copayerId, ActionType type, @Nullable List<String> signatures, @Nullable String xpub,
                      @Nullable String comment, long createdOn) {
        this.copayerId = checkNotNull(copayerId);
        this.type = checkNotNull(type);
        checkArgument(type == ActionType.ACCEPT || signatures == null || signatures.isEmpty(),
                "only accept votes carry signatures");
        this.signatures = signatures == null ? ImmutableList.<String>of() : ImmutableList.copyOf(signatures);
        this.xpub = xpub;
        this.comment = comment;
        this.createdOn = createdOn;
    }

    static VoteAction accept(String copayerId, List<String> signatures, String xpub) {
        return new VoteAction(copayerId, ActionType.ACCEPT, signatures, xpub, null, Utils.currentTimeSeconds());
    }

    static VoteAction reject(String copayerId, @Nullable String reason) {
        return new VoteAction(copayerId, ActionType.REJECT, null, null, reason, Utils.currentTimeSeconds());
    }

    public String getCopayerId() {
        return copayerId;
    }

    public ActionType getType() {
        return type;
    }

    public List<String> getSignatures() {
        return signatures;
    }

    @Nullable
    public String getXpub() {
        return xpub;
    }

    @Nullable
    public String getComment() {
        return comment;
    }

    /** Seconds since the epoch. */
    public long getCreatedOn() {
        return createdOn;
    }

    @Override
    public String toString() {
        return type.getCode() + " by " + copayerId;
    }
}
