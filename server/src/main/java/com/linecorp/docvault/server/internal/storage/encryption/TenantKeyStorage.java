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

import static com.linecorp.docvault.server.internal.storage.RocksDBStorage.TENANT_KEYS_COLUMN_FAMILY;
import static com.linecorp.docvault.server.internal.storage.RocksDBStorage.TENANT_KEY_VERSIONS_COLUMN_FAMILY;
import static java.util.Objects.requireNonNull;

import java.util.List;

import javax.annotation.Nullable;

import org.rocksdb.ColumnFamilyHandle;
import org.rocksdb.RocksDBException;
import org.rocksdb.WriteBatch;

import com.fasterxml.jackson.core.JsonParseException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.google.common.collect.ImmutableList;

import com.linecorp.docvault.common.TenantKey;
import com.linecorp.docvault.internal.Jackson;
import com.linecorp.docvault.server.internal.storage.DbKeys;
import com.linecorp.docvault.server.internal.storage.PrefixIterable;
import com.linecorp.docvault.server.internal.storage.RocksDBStorage;
import com.linecorp.docvault.server.storage.StorageException;

/**
 * Stores the wrapped key encryption keys of tenants. The active version of a tenant is kept in
 * {@value RocksDBStorage#TENANT_KEYS_COLUMN_FAMILY} and every version, including the active one, in
 * {@value RocksDBStorage#TENANT_KEY_VERSIONS_COLUMN_FAMILY}.
 */
public final class TenantKeyStorage {

    private final RocksDBStorage storage;

    public TenantKeyStorage(RocksDBStorage storage) {
        this.storage = requireNonNull(storage, "storage");
    }

    @Nullable
    public TenantKey active(String tenantId) {
        final byte[] key = DbKeys.tenantKeyKey(tenantId);
        return decode(storage.get(TENANT_KEYS_COLUMN_FAMILY, key), key);
    }

    @Nullable
    public TenantKey version(String tenantId, int kekVersion) {
        final byte[] key = DbKeys.tenantKeyVersionKey(tenantId, kekVersion);
        return decode(storage.get(TENANT_KEY_VERSIONS_COLUMN_FAMILY, key), key);
    }

    public List<TenantKey> versions(String tenantId) {
        return ImmutableList.copyOf(new PrefixIterable<>(storage, TENANT_KEY_VERSIONS_COLUMN_FAMILY,
                                                         DbKeys.tenantPrefix(tenantId), false,
                                                         (snapshot, key, value) -> decode(value, key)));
    }

    /**
     * Stores the first version of a tenant's key.
     */
    public void storeInitial(TenantKey tenantKey) {
        try (WriteBatch batch = new WriteBatch()) {
            put(batch, tenantKey, true);
            storage.write(batch);
        }
    }

    /**
     * Makes {@code next} the active key of the tenant and marks {@code current} as superseded, atomically.
     */
    public void storeRotated(TenantKey current, TenantKey next) {
        try (WriteBatch batch = new WriteBatch()) {
            put(batch, current, false);
            put(batch, next, true);
            storage.write(batch);
        }
    }

    public void remove(String tenantId, int kekVersion) {
        try (WriteBatch batch = new WriteBatch()) {
            batch.delete(storage.getColumnFamilyHandle(TENANT_KEY_VERSIONS_COLUMN_FAMILY),
                         DbKeys.tenantKeyVersionKey(tenantId, kekVersion));
            storage.write(batch);
        } catch (RocksDBException e) {
            throw new StorageException("Failed to remove version " + kekVersion + " of the key of " +
                                       tenantId, e);
        }
    }

    private void put(WriteBatch batch, TenantKey tenantKey, boolean active) {
        final byte[] value;
        try {
            value = Jackson.writeValueAsBytes(tenantKey);
        } catch (JsonProcessingException e) {
            throw new StorageException("Failed to serialize " + tenantKey, e);
        }
        final String tenantId = tenantKey.tenantId();
        try {
            final ColumnFamilyHandle versionsCf =
                    storage.getColumnFamilyHandle(TENANT_KEY_VERSIONS_COLUMN_FAMILY);
            batch.put(versionsCf, DbKeys.tenantKeyVersionKey(tenantId, tenantKey.kekVersion()), value);
            if (active) {
                batch.put(storage.getColumnFamilyHandle(TENANT_KEYS_COLUMN_FAMILY),
                          DbKeys.tenantKeyKey(tenantId), value);
            }
        } catch (RocksDBException e) {
            throw new StorageException("Failed to add " + tenantKey + " to a batch", e);
        }
    }

    @Nullable
    private static TenantKey decode(@Nullable byte[] value, byte[] key) {
        if (value == null) {
            return null;
        }
        try {
            return Jackson.readValue(value, TenantKey.class);
        } catch (JsonParseException | JsonMappingException e) {
            throw new StorageException("Failed to read a tenant key at " + DbKeys.toString(key), e);
        }
    }
}
