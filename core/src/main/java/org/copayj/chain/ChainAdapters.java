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

import org.copayj.core.Chain;
import org.copayj.core.ChainFamily;
import org.copayj.core.CopayException;
import org.copayj.core.ErrorCode;

import java.util.EnumMap;
import java.util.Map;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Registry of chain adapters, one per chain family. The bitcoin adapter is built in; account model
 * families are provided by the embedding service.
 */
public class ChainAdapters {
    private final Map<ChainFamily, ChainAdapter> adapters = new EnumMap<>(ChainFamily.class);

    public ChainAdapters() {
    }

    /** A registry holding a {@link BtcChainAdapter} with default options. */
    public static ChainAdapters withDefaults() {
        return new ChainAdapters().register(new BtcChainAdapter());
    }

    public ChainAdapters register(ChainAdapter adapter) {
        checkArgument(!adapters.containsKey(adapter.getFamily()), "Adapter for %s already registered", adapter.getFamily());
        adapters.put(adapter.getFamily(), adapter);
        return this;
    }

    public ChainAdapter get(Chain chain) throws CopayException {
        ChainAdapter adapter = adapters.get(chain.getFamily());
        if (adapter == null)
            throw new CopayException(ErrorCode.UNSUPPORTED_CHAIN, "No adapter for chain " + chain.getCode());
        return adapter;
    }

    public boolean supports(Chain chain) {
        return adapters.containsKey(chain.getFamily());
    }
}
