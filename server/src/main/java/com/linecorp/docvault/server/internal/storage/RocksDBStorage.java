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
package com.linecorp.docvault.server.internal.storage;

import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import javax.annotation.Nullable;

import org.rocksdb.BlockBasedTableConfig;
import org.rocksdb.BloomFilter;
import org.rocksdb.ColumnFamilyDescriptor;
import org.rocksdb.ColumnFamilyHandle;
import org.rocksdb.ColumnFamilyOptions;
import org.rocksdb.CompressionType;
import org.rocksdb.DBOptions;
import org.rocksdb.ReadOptions;
import org.rocksdb.RocksDB;
import org.rocksdb.RocksDBException;
import org.rocksdb.RocksIterator;
import org.rocksdb.RocksObject;
import org.rocksdb.WriteBatch;
import org.rocksdb.WriteOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

import com.linecorp.docvault.server.storage.StorageException;

/**
 * The RocksDB database that holds every table of the store, one column family per table.
 */
public final class RocksDBStorage {

    private static final Logger logger = LoggerFactory.getLogger(RocksDBStorage.class);

    public static final String NODES_COLUMN_FAMILY = "nodes";
    // tenant/id1/.../idN -> nodeId, the subtree prefix index.
    public static final String NODE_PATHS_COLUMN_FAMILY = "node_paths";
    // tenant/parentId/slug -> nodeId, keeps slugs unique among siblings.
    public static final String NODE_SLUGS_COLUMN_FAMILY = "node_slugs";
    public static final String REVISIONS_COLUMN_FAMILY = "revisions";
    public static final String REVISION_CHUNKS_COLUMN_FAMILY = "revision_chunks";
    public static final String METADATA_COLUMN_FAMILY = "metadata";
    public static final String TENANT_KEYS_COLUMN_FAMILY = "tenant_keys";
    public static final String TENANT_KEY_VERSIONS_COLUMN_FAMILY = "tenant_key_versions";

    private static final List<String> ALL_COLUMN_FAMILY_NAMES = ImmutableList.of(
            "default", NODES_COLUMN_FAMILY, NODE_PATHS_COLUMN_FAMILY, NODE_SLUGS_COLUMN_FAMILY,
            REVISIONS_COLUMN_FAMILY, REVISION_CHUNKS_COLUMN_FAMILY, METADATA_COLUMN_FAMILY,
            TENANT_KEYS_COLUMN_FAMILY, TENANT_KEY_VERSIONS_COLUMN_FAMILY
    );

    // Column families mostly read by point lookups.
    private static final Set<String> BLOOM_FILTERED_COLUMN_FAMILY_NAMES = ImmutableSet.of(
            NODES_COLUMN_FAMILY, METADATA_COLUMN_FAMILY, TENANT_KEYS_COLUMN_FAMILY);

    private final RocksDB rocksDb;
    private final DBOptions dbOptions;
    private final Map<String, ColumnFamilyOptions> columnFamilyOptions;
    private final Map<String, ColumnFamilyHandle> columnFamilyHandlesMap;
    private final BloomFilter bloomFilter;

    // Guarded by itself. A snapshot must never be released once the database is closed.
    private final Set<StorageSnapshot> openSnapshots = new HashSet<>();
    private boolean closed;

    public RocksDBStorage(String rocksDbPath) {
        requireNonNull(rocksDbPath, "rocksDbPath");
        RocksDB.loadLibrary();

        bloomFilter = new BloomFilter();
        final Map<String, ColumnFamilyOptions> cfNameToOptions = new HashMap<>();
        for (String cfName : ALL_COLUMN_FAMILY_NAMES) {
            cfNameToOptions.put(cfName, createColumnFamilyOptions(
                    cfName, BLOOM_FILTERED_COLUMN_FAMILY_NAMES.contains(cfName)));
        }
        columnFamilyOptions = ImmutableMap.copyOf(cfNameToOptions);
        final List<ColumnFamilyDescriptor> cfDescriptors = new ArrayList<>();
        for (String cfName : ALL_COLUMN_FAMILY_NAMES) {
            cfDescriptors.add(new ColumnFamilyDescriptor(
                    cfName.getBytes(StandardCharsets.UTF_8), cfNameToOptions.get(cfName)
            ));
        }

        dbOptions = new DBOptions().setCreateIfMissing(true).setCreateMissingColumnFamilies(true);

        final List<ColumnFamilyHandle> openedHandlesList = new ArrayList<>();
        try {
            rocksDb = RocksDB.open(dbOptions, rocksDbPath, cfDescriptors, openedHandlesList);
        } catch (RocksDBException e) {
            bloomFilter.close();
            cfNameToOptions.values().forEach(ColumnFamilyOptions::close);
            dbOptions.close();
            throw new StorageException("Failed to open RocksDB with column families at " + rocksDbPath, e);
        }

        final ImmutableMap.Builder<String, ColumnFamilyHandle> handlesMapBuilder = ImmutableMap.builder();
        for (ColumnFamilyHandle handle : openedHandlesList) {
            try {
                handlesMapBuilder.put(new String(handle.getName(), StandardCharsets.UTF_8), handle);
            } catch (RocksDBException e) {
                bloomFilter.close();
                openedHandlesList.forEach(RocksDBStorage::closeSilently);
                closeSilently(rocksDb);
                cfNameToOptions.values().forEach(ColumnFamilyOptions::close);
                dbOptions.close();
                throw new StorageException("Failed to get name for a column family handle", e);
            }
        }
        columnFamilyHandlesMap = handlesMapBuilder.build();

        for (String cfName : ALL_COLUMN_FAMILY_NAMES) {
            if (!columnFamilyHandlesMap.containsKey(cfName)) {
                close();
                throw new StorageException("Column family handle not found for: " + cfName);
            }
        }
        logger.info("Opened the document store database at {}", rocksDbPath);
    }

    private ColumnFamilyOptions createColumnFamilyOptions(String cfName, boolean withBloomFilter) {
        final ColumnFamilyOptions options = new ColumnFamilyOptions();
        if (REVISION_CHUNKS_COLUMN_FAMILY.equals(cfName)) {
            // Sealed chunks are indistinguishable from random bytes.
            options.setCompressionType(CompressionType.NO_COMPRESSION);
        }
        if (!withBloomFilter) {
            return options;
        }
        return options.setTableFormatConfig(new BlockBasedTableConfig().setFilterPolicy(bloomFilter));
    }

    @Nullable
    public byte[] get(String cfName, byte[] key) {
        try {
            return rocksDb.get(getColumnFamilyHandle(cfName), key);
        } catch (RocksDBException e) {
            throw new StorageException("Failed to get " + DbKeys.toString(key) + " from " + cfName, e);
        }
    }

    @Nullable
    public byte[] get(String cfName, ReadOptions readOptions, byte[] key) {
        try {
            return rocksDb.get(getColumnFamilyHandle(cfName), readOptions, key);
        } catch (RocksDBException e) {
            throw new StorageException("Failed to get " + DbKeys.toString(key) + " from " + cfName, e);
        }
    }

    /**
     * Writes a single value without waiting for the write-ahead log to be synced. Used for rows that are
     * unreachable until a later {@linkplain #write(WriteBatch) synced batch} refers to them.
     */
    public void putUnsynced(String cfName, byte[] key, byte[] value) {
        try (WriteOptions writeOptions = new WriteOptions()) {
            rocksDb.put(getColumnFamilyHandle(cfName), writeOptions, key, value);
        } catch (RocksDBException e) {
            throw new StorageException("Failed to put " + DbKeys.toString(key) + " into " + cfName, e);
        }
    }

    /**
     * Applies the specified {@link WriteBatch} atomically and waits until it is durable.
     */
    public void write(WriteBatch writeBatch) {
        try (WriteOptions writeOptions = new WriteOptions()) {
            writeOptions.setSync(true);
            rocksDb.write(writeOptions, writeBatch);
        } catch (RocksDBException e) {
            throw new StorageException("Failed to write a batch of " + writeBatch.count() + " operations", e);
        }
    }

    public RocksIterator newIterator(String cfName) {
        return rocksDb.newIterator(getColumnFamilyHandle(cfName));
    }

    public RocksIterator newIterator(String cfName, ReadOptions readOptions) {
        return rocksDb.newIterator(getColumnFamilyHandle(cfName), readOptions);
    }

    public ColumnFamilyHandle getColumnFamilyHandle(String cfName) {
        final ColumnFamilyHandle handle = columnFamilyHandlesMap.get(cfName);
        if (handle == null) {
            throw new IllegalArgumentException("Column family not found: " + cfName);
        }
        return handle;
    }

    /**
     * Returns a new consistent view of the whole database. The returned snapshot must be closed.
     */
    public StorageSnapshot snapshot() {
        synchronized (openSnapshots) {
            checkState(!closed, "storage closed");
            final StorageSnapshot snapshot = new StorageSnapshot(this, rocksDb.getSnapshot());
            openSnapshots.add(snapshot);
            return snapshot;
        }
    }

    void releaseSnapshot(StorageSnapshot snapshot) {
        synchronized (openSnapshots) {
            if (openSnapshots.remove(snapshot)) {
                rocksDb.releaseSnapshot(snapshot.rocksSnapshot());
            }
        }
    }

    @VisibleForTesting
    int numOpenSnapshots() {
        synchronized (openSnapshots) {
            return openSnapshots.size();
        }
    }

    public void close() {
        synchronized (openSnapshots) {
            if (closed) {
                return;
            }
            closed = true;
            if (!openSnapshots.isEmpty()) {
                logger.debug("Releasing {} open snapshot(s) before closing the database", openSnapshots.size());
                openSnapshots.forEach(snapshot -> rocksDb.releaseSnapshot(snapshot.rocksSnapshot()));
                openSnapshots.clear();
            }
        }
        columnFamilyHandlesMap.values().forEach(RocksDBStorage::closeSilently);
        closeSilently(rocksDb);
        closeSilently(dbOptions);
        columnFamilyOptions.values().forEach(RocksDBStorage::closeSilently);
        bloomFilter.close();
        logger.info("Closed the document store database");
    }

    private static void closeSilently(RocksObject obj) {
        try {
            obj.close();
        } catch (Exception e) {
            logger.warn("Failed to close RocksObject silently", e);
        }
    }
}
