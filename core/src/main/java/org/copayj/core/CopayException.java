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

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Business level failure of a wallet operation. The {@link ErrorCode} tells the caller what went
 * wrong precisely enough to offer a remedy (add funds, lower the fee, retry later...).
 */
public class CopayException extends Exception {
    private final ErrorCode code;

    public CopayException(ErrorCode code) {
        this(code, code.getDefaultMessage());
    }

    public CopayException(ErrorCode code, String message) {
        super(message);
        this.code = checkNotNull(code);
    }

    public CopayException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = checkNotNull(code);
    }

    public ErrorCode getCode() {
        return code;
    }

    public ErrorCode.Category getCategory() {
        return code.getCategory();
    }

    public static CopayException internal(String message, Throwable cause) {
        return new CopayException(ErrorCode.INTERNAL, message, cause);
    }

    @Override
    public String toString() {
        return code + ": " + getMessage();
    }
}
