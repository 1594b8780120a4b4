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
package com.linecorp.docvault.server.internal.storage.encryption;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import com.google.common.base.MoreObjects;

import com.linecorp.armeria.common.util.Exceptions;
import com.linecorp.docvault.common.CryptoException;
import com.linecorp.docvault.common.KeyProviderUnavailableException;
import com.linecorp.docvault.common.UnwrapFailureException;
import com.linecorp.docvault.server.storage.encryption.KeyWrapper;

/**
 * A key provider which delegates the wrapping of tenant keys to an external key custodian through a
 * {@link KeyWrapper}. Every call to the custodian is bounded by a timeout.
 */
public final class ExternalKeyProvider extends AbstractKeyProvider {

    public static final long DEFAULT_TIMEOUT_MILLIS = 10_000;

    private final KeyWrapper keyWrapper;
    private final String rootKeyId;
    private final long timeoutMillis;

    public ExternalKeyProvider(TenantKeyStorage storage, String kekCacheSpec, KeyWrapper keyWrapper,
                               String rootKeyId, Duration timeout) {
        super(storage, kekCacheSpec);
        this.keyWrapper = requireNonNull(keyWrapper, "keyWrapper");
        this.rootKeyId = requireNonNull(rootKeyId, "rootKeyId");
        requireNonNull(timeout, "timeout");
        checkArgument(!timeout.isNegative() && !timeout.isZero(), "timeout: %s (expected: > 0)", timeout);
        timeoutMillis = timeout.toMillis();
    }

    @Override
    protected String wrapKek(String tenantId, int version, byte[] kek) {
        final String target = tenantId + '/' + version;
        final CompletableFuture<String> future;
        try {
            future = keyWrapper.wrap(kek, rootKeyId);
        } catch (RuntimeException e) {
            throw new CryptoException("Failed to wrap the key encryption key of " + target, e);
        }
        final Throwable cause;
        try {
            return await(future, target);
        } catch (ExecutionException e) {
            cause = Exceptions.peel(e);
        }
        if (isTransient(cause)) {
            throw new KeyProviderUnavailableException(
                    "Key custodian failed to wrap the key encryption key of " + target, cause);
        }
        throw new CryptoException("Key custodian rejected the key encryption key of " + target, cause);
    }

    @Override
    protected byte[] unwrapKek(String tenantId, int version, String kekCiphertext) {
        final String target = tenantId + '/' + version;
        final CompletableFuture<byte[]> future;
        try {
            future = keyWrapper.unwrap(kekCiphertext, rootKeyId);
        } catch (RuntimeException e) {
            throw new UnwrapFailureException("Failed to unwrap the key encryption key of " + target, e);
        }
        final Throwable cause;
        try {
            return await(future, target);
        } catch (ExecutionException e) {
            cause = Exceptions.peel(e);
        }
        if (isTransient(cause)) {
            throw new KeyProviderUnavailableException(
                    "Key custodian failed to unwrap the key encryption key of " + target, cause);
        }
        throw new UnwrapFailureException("Key custodian rejected the key encryption key of " + target, cause);
    }

    private <T> T await(CompletableFuture<T> future, String target) throws ExecutionException {
        try {
            final T result = future.get(timeoutMillis, TimeUnit.MILLISECONDS);
            if (result == null) {
                throw new ExecutionException(new NullPointerException("key custodian returned null"));
            }
            return result;
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new KeyProviderUnavailableException(
                    "Key custodian did not answer in " + timeoutMillis + " ms: " + target, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new KeyProviderUnavailableException("Interrupted while waiting for the key custodian: " +
                                                      target, e);
        }
    }

    private static boolean isTransient(Throwable cause) {
        return cause instanceof IOException || cause instanceof TimeoutException ||
               cause instanceof KeyProviderUnavailableException;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                          .add("keyWrapper", keyWrapper)
                          .add("rootKeyId", rootKeyId)
                          .add("timeoutMillis", timeoutMillis)
                          .toString();
    }
}
