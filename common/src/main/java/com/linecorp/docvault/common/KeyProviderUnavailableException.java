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
 * A {@link DocumentStoreException} that is raised when the key custodian did not answer in time or
 * could not be reached. Unlike a {@link CryptoException}, the failed call may be retried with backoff.
 */
public class KeyProviderUnavailableException extends DocumentStoreException {

    private static final long serialVersionUID = 6140574920358170813L;

    /**
     * Creates a new instance.
     */
    public KeyProviderUnavailableException(String message) {
        super(message);
    }

    /**
     * Creates a new instance.
     */
    public KeyProviderUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
