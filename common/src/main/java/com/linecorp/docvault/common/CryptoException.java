/*
 * Copyright 2025 LINE Corporation
 *
 * LINE Corporation licenses this file to you under the Apache License,
 * version 2.0 (the "License"); you may not use this file except in compliance
 * with the License. You may obtain a copy of the License at:
 *
 *   https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS, WITHOUT
 * WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied. See the
 * License for the specific language governing permissions and limitations
 * under the License.
 */
package com.linecorp.docvault.common;

/**
 * A {@link DocumentStoreException} that is raised when encrypted data or a wrapped key cannot be
 * verified. A {@link CryptoException} is never retried automatically because it may indicate
 * tampering.
 */
public class CryptoException extends DocumentStoreException {

    private static final long serialVersionUID = 8866250343716412734L;

    /**
     * Creates a new instance.
     */
    public CryptoException(String message) {
        super(message);
    }

    /**
     * Creates a new instance.
     */
    public CryptoException(String message, Throwable cause) {
        super(message, cause);
    }
}
