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

/**
 * Raised for proposal records older than schema version 3. Those belong to a separate legacy importer.
 */
public class UnsupportedFormatException extends CopayException {
    private final int version;

    public UnsupportedFormatException(int version) {
        super(ErrorCode.UNSUPPORTED_FORMAT, ErrorCode.UNSUPPORTED_FORMAT.getDefaultMessage() + ": version " + version);
        this.version = version;
    }

    public int getVersion() {
        return version;
    }
}
