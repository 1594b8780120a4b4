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
 * A {@link CryptoException} that is raised when decrypted content authenticates but does not match
 * the checksum or size recorded on its revision.
 */
public class IntegrityViolationException extends CryptoException {

    private static final long serialVersionUID = -1850046021797512766L;

    /**
     * Creates a new instance.
     */
    public IntegrityViolationException(String message) {
        super(message);
    }
}
