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

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Base64;
import java.util.concurrent.CompletableFuture;

/**
 * Wraps a key by prefixing it with the identifier of the root key, so that a key can only be unwrapped
 * with the root key identifier it was wrapped with.
 */
public final class TestKeyWrapper implements KeyWrapper {

    @Override
    public CompletableFuture<String> wrap(byte[] kek, String rootKeyId) {
        final byte[] prefix = prefix(rootKeyId);
        final byte[] wrapped = new byte[prefix.length + kek.length];
        System.arraycopy(prefix, 0, wrapped, 0, prefix.length);
        System.arraycopy(kek, 0, wrapped, prefix.length, kek.length);
        return CompletableFuture.completedFuture(Base64.getEncoder().encodeToString(wrapped));
    }

    @Override
    public CompletableFuture<byte[]> unwrap(String wrappedKek, String rootKeyId) {
        final byte[] decoded = Base64.getDecoder().decode(wrappedKek);
        final byte[] prefix = prefix(rootKeyId);
        if (decoded.length <= prefix.length ||
            !Arrays.equals(prefix, Arrays.copyOf(decoded, prefix.length))) {
            return CompletableFuture.failedFuture(
                    new IllegalArgumentException("not wrapped with " + rootKeyId));
        }
        return CompletableFuture.completedFuture(Arrays.copyOfRange(decoded, prefix.length, decoded.length));
    }

    private static byte[] prefix(String rootKeyId) {
        return ("wrapped-" + rootKeyId + ':').getBytes(StandardCharsets.UTF_8);
    }
}
