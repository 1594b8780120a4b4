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

import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.Lock;

import javax.crypto.SecretKey;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.google.common.base.MoreObjects;
import com.google.common.util.concurrent.Striped;

import com.linecorp.docvault.common.TenantKey;
import com.linecorp.docvault.common.UnwrapFailureException;
import com.linecorp.docvault.internal.Util;
import com.linecorp.docvault.server.storage.encryption.KeyProvider;
import com.linecorp.docvault.server.storage.encryption.SecretKeyWithVersion;

/**
 * A skeletal {@link KeyProvider} that keeps tenant keys, wrapped by a root key custodian, in
 * {@link TenantKeyStorage}. Subclasses only wrap and unwrap.
 *
 * <p>Unwrapped keys are cached by tenant and version. A version never changes once written, so the cache
 * never serves a stale key.
 */
public abstract class AbstractKeyProvider implements KeyProvider {

    private static final Logger logger = LoggerFactory.getLogger(AbstractKeyProvider.class);

    public static final String DEFAULT_KEK_CACHE_SPEC = "maximumSize=1024,expireAfterAccess=10m";

    private final TenantKeyStorage storage;
    private final Cache<CacheKey, SecretKey> cache;
    private final Striped<Lock> tenantLocks = Striped.lock(64);

    protected AbstractKeyProvider(TenantKeyStorage storage, String kekCacheSpec) {
        this.storage = requireNonNull(storage, "storage");
        cache = Caffeine.from(requireNonNull(kekCacheSpec, "kekCacheSpec")).build();
    }

    /**
     * Wraps a new key encryption key of the specified tenant and version.
     */
    protected abstract String wrapKek(String tenantId, int version, byte[] kek);

    /**
     * Unwraps a key encryption key of the specified tenant and version.
     *
     * @throws UnwrapFailureException if the key could not be unwrapped
     */
    protected abstract byte[] unwrapKek(String tenantId, int version, String kekCiphertext);

    @Override
    public SecretKeyWithVersion getActiveKek(String tenantId) {
        Util.validateTenantId(tenantId, "tenantId");
        TenantKey active = storage.active(tenantId);
        if (active == null) {
            active = createInitialKek(tenantId);
        }
        return new SecretKeyWithVersion(unwrapCached(active), active.kekVersion());
    }

    @Override
    public SecretKey getKekByVersion(String tenantId, int version) {
        Util.validateTenantId(tenantId, "tenantId");
        final SecretKey cached = cache.getIfPresent(new CacheKey(tenantId, version));
        if (cached != null) {
            return cached;
        }
        final TenantKey tenantKey = storage.version(tenantId, version);
        if (tenantKey == null) {
            throw new UnwrapFailureException(
                    "version " + version + " of the key encryption key of " + tenantId + " does not exist");
        }
        return unwrapCached(tenantKey);
    }

    @Override
    public int rotateKek(String tenantId) {
        Util.validateTenantId(tenantId, "tenantId");
        for (;;) {
            final int currentVersion = getActiveKek(tenantId).version();
            final int nextVersion = currentVersion + 1;
            final byte[] kek = AesGcmCipher.generateAes256Key();
            final String kekCiphertext;
            try {
                // Wrap outside of the lock because the custodian may be slow.
                kekCiphertext = wrapKek(tenantId, nextVersion, kek);
            } finally {
                Arrays.fill(kek, (byte) 0);
            }

            final Lock lock = tenantLocks.get(tenantId);
            lock.lock();
            try {
                final TenantKey current = storage.active(tenantId);
                if (current == null || current.kekVersion() != currentVersion) {
                    // Rotated concurrently. Start over from the new active version.
                    continue;
                }
                final Instant now = Instant.now();
                storage.storeRotated(current.retired(now),
                                     new TenantKey(tenantId, kekCiphertext, nextVersion, now, null));
            } finally {
                lock.unlock();
            }
            logger.info("Rotated the key encryption key of {}: version {} -> {}",
                        tenantId, currentVersion, nextVersion);
            return nextVersion;
        }
    }

    @Override
    public List<TenantKey> kekVersions(String tenantId) {
        Util.validateTenantId(tenantId, "tenantId");
        return storage.versions(tenantId);
    }

    @Override
    public boolean containsKekVersion(String tenantId, int version) {
        Util.validateTenantId(tenantId, "tenantId");
        return storage.version(tenantId, version) != null;
    }

    @Override
    public void removeKekVersion(String tenantId, int version) {
        Util.validateTenantId(tenantId, "tenantId");
        final Lock lock = tenantLocks.get(tenantId);
        lock.lock();
        try {
            final TenantKey active = storage.active(tenantId);
            checkState(active == null || active.kekVersion() != version,
                       "cannot remove the active key encryption key: %s/%s", tenantId, version);
            storage.remove(tenantId, version);
        } finally {
            lock.unlock();
        }
        cache.invalidate(new CacheKey(tenantId, version));
        logger.info("Removed version {} of the key encryption key of {}", version, tenantId);
    }

    private TenantKey createInitialKek(String tenantId) {
        final byte[] kek = AesGcmCipher.generateAes256Key();
        final String kekCiphertext;
        try {
            kekCiphertext = wrapKek(tenantId, 1, kek);
        } finally {
            Arrays.fill(kek, (byte) 0);
        }

        final Lock lock = tenantLocks.get(tenantId);
        lock.lock();
        try {
            final TenantKey existing = storage.active(tenantId);
            if (existing != null) {
                return existing;
            }
            final TenantKey initial = new TenantKey(tenantId, kekCiphertext, 1, Instant.now(), null);
            storage.storeInitial(initial);
            logger.info("Created the key encryption key of {}", tenantId);
            return initial;
        } finally {
            lock.unlock();
        }
    }

    private SecretKey unwrapCached(TenantKey tenantKey) {
        final CacheKey cacheKey = new CacheKey(tenantKey.tenantId(), tenantKey.kekVersion());
        final SecretKey cached = cache.getIfPresent(cacheKey);
        if (cached != null) {
            return cached;
        }
        final byte[] kek = unwrapKek(tenantKey.tenantId(), tenantKey.kekVersion(), tenantKey.kekCiphertext());
        final SecretKey secretKey;
        try {
            secretKey = AesGcmCipher.aesSecretKey(kek);
        } catch (IllegalArgumentException e) {
            throw new UnwrapFailureException("Unwrapped an invalid key encryption key of " +
                                             tenantKey.tenantId() + '/' + tenantKey.kekVersion(), e);
        } finally {
            Arrays.fill(kek, (byte) 0);
        }
        cache.put(cacheKey, secretKey);
        return secretKey;
    }

    private static final class CacheKey {
        private final String tenantId;
        private final int version;

        CacheKey(String tenantId, int version) {
            this.tenantId = tenantId;
            this.version = version;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof CacheKey)) {
                return false;
            }
            final CacheKey that = (CacheKey) o;
            return version == that.version && tenantId.equals(that.tenantId);
        }

        @Override
        public int hashCode() {
            return Objects.hash(tenantId, version);
        }

        @Override
        public String toString() {
            return MoreObjects.toStringHelper(this)
                              .add("tenantId", tenantId)
                              .add("version", version)
                              .toString();
        }
    }
}
