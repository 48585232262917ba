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

import java.util.List;

/**
 * A transaction built from a proposal by a {@link ChainAdapter}, possibly partially signed.
 */
public interface ChainTransaction {
    /**
     * Hex serialization without signatures. The proposal creator signs this text, so it must be a pure
     * function of the proposal content.
     */
    String getUnsignedSerialization();

    /** Hex serialization including every signature applied so far. */
    String serialize();

    String getTxId();

    /** Ids of every transaction, for proposals that expand to several transactions. */
    List<String> getTxIds();

    /** Effective fee: total input value minus total output value. */
    long getFee();
}
