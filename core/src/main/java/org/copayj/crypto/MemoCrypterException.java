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

package org.copayj.crypto;

/**
 * <p>Exception to provide the following to {@link MemoCrypter}:</p>
 * <ul>
 * <li>Provision of decryption failures caused by a wrong key or a tampered envelope.</li>
 * </ul>
 */
public class MemoCrypterException extends RuntimeException {
    public MemoCrypterException(String s) {
        super(s);
    }

    public MemoCrypterException(String s, Throwable throwable) {
        super(s, throwable);
    }
}
