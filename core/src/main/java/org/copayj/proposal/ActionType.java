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

import java.util.Locale;

public enum ActionType {
    ACCEPT,
    REJECT;

    public String getCode() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ActionType fromCode(String code) {
        return valueOf(code.toUpperCase(Locale.ROOT));
    }
}
