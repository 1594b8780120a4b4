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
package com.linecorp.docvault.server.storage.encryption;

import java.util.concurrent.CompletableFuture;

/**
 * Wraps and unwraps tenant key encryption keys using an external key custodian, such as a key management
 * service. An implementation is discovered via {@link java.util.ServiceLoader} unless one is specified
 * explicitly.
 */
public interface KeyWrapper {

    /**
     * Wraps the given key encryption key using the key custodian.
     *
     * @param kek the key encryption key to be wrapped.
     * @param rootKeyId the identifier of the custodian's key to be used for wrapping.
     */
    CompletableFuture<String> wrap(byte[] kek, String rootKeyId);

    /**
     * Unwraps the given wrapped key encryption key using the key custodian.
     */
    CompletableFuture<byte[]> unwrap(String wrappedKek, String rootKeyId);
}
