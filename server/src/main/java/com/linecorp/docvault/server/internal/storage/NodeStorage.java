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

import static com.linecorp.docvault.server.internal.storage.RocksDBStorage.METADATA_COLUMN_FAMILY;
import static com.linecorp.docvault.server.internal.storage.RocksDBStorage.NODES_COLUMN_FAMILY;
import static com.linecorp.docvault.server.internal.storage.RocksDBStorage.NODE_PATHS_COLUMN_FAMILY;
import static com.linecorp.docvault.server.internal.storage.RocksDBStorage.NODE_SLUGS_COLUMN_FAMILY;
import static java.util.Objects.requireNonNull;

import java.nio.charset.StandardCharsets;
import java.util.List;

import javax.annotation.Nullable;

import org.rocksdb.RocksDBException;
import org.rocksdb.RocksIterator;
import org.rocksdb.WriteBatch;

import com.fasterxml.jackson.core.JsonParseException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonMappingException;

import com.linecorp.docvault.common.DocumentMetadata;
import com.linecorp.docvault.common.DocumentNode;
import com.linecorp.docvault.internal.Jackson;
import com.linecorp.docvault.server.storage.StorageException;

/**
 * Reads and writes the rows of nodes, their path and slug indexes, and the metadata of documents.
 */
public final class NodeStorage {

    private final RocksDBStorage storage;

    public NodeStorage(RocksDBStorage storage) {
        this.storage = requireNonNull(storage, "storage");
    }

    public RocksDBStorage storage() {
        return storage;
    }

    @Nullable
    public DocumentNode node(String tenantId, String nodeId) {
        return node(tenantId, nodeId, null);
    }

    /**
     * Returns the specified node as seen by the specified snapshot, or by the latest state if
     * {@code snapshot} is {@code null}.
     */
    @Nullable
    public DocumentNode node(String tenantId, String nodeId, @Nullable StorageSnapshot snapshot) {
        final byte[] key = DbKeys.nodeKey(tenantId, nodeId);
        final byte[] value;
        if (snapshot != null) {
            value = storage.get(NODES_COLUMN_FAMILY, snapshot.readOptions(), key);
        } else {
            value = storage.get(NODES_COLUMN_FAMILY, key);
        }
        return decode(value, key, DocumentNode.class);
    }

    @Nullable
    public String childIdBySlug(String tenantId, @Nullable String parentId, String slug) {
        final byte[] value = storage.get(NODE_SLUGS_COLUMN_FAMILY, DbKeys.slugKey(tenantId, parentId, slug));
        return value != null ? new String(value, StandardCharsets.UTF_8) : null;
    }

    public boolean hasChildren(String tenantId, String nodeId) {
        final byte[] prefix = DbKeys.childrenPrefix(tenantId, nodeId);
        try (RocksIterator it = storage.newIterator(NODE_SLUGS_COLUMN_FAMILY)) {
            it.seek(prefix);
            return it.isValid() && DbKeys.startsWith(it.key(), prefix);
        }
    }

    /**
     * Returns the children of the specified parent, or the roots of the tenant if {@code parentId} is
     * {@code null}, ordered by slug.
     */
    public Iterable<DocumentNode> children(String tenantId, @Nullable String parentId) {
        return new PrefixIterable<>(storage, NODE_SLUGS_COLUMN_FAMILY,
                                    DbKeys.childrenPrefix(tenantId, parentId), false,
                                    (snapshot, key, value) -> nodeOf(tenantId, value, snapshot));
    }

    /**
     * Returns the descendants of the node at the specified path, excluding the node itself. A parent is
     * always returned before its children.
     */
    public Iterable<DocumentNode> descendants(String tenantId, List<String> path) {
        return new PrefixIterable<>(storage, NODE_PATHS_COLUMN_FAMILY,
                                    DbKeys.descendantsPrefix(tenantId, path), false,
                                    (snapshot, key, value) -> nodeOf(tenantId, value, snapshot));
    }

    /**
     * Returns the descendants of the specified node, excluding the node itself. Every iterator looks up
     * the path of the node in its own snapshot, so a subtree moved concurrently is listed either entirely
     * at its old path or entirely at its new one. The iterator is empty if the node does not exist in
     * its snapshot.
     */
    public Iterable<DocumentNode> subtree(String tenantId, String nodeId) {
        return new PrefixIterable<>(storage, NODE_PATHS_COLUMN_FAMILY, snapshot -> {
            final DocumentNode node = node(tenantId, nodeId, snapshot);
            return node != null ? DbKeys.descendantsPrefix(tenantId, node.path()) : null;
        }, false, (snapshot, key, value) -> nodeOf(tenantId, value, snapshot));
    }

    @Nullable
    private DocumentNode nodeOf(String tenantId, byte[] nodeId, StorageSnapshot snapshot) {
        return node(tenantId, new String(nodeId, StandardCharsets.UTF_8), snapshot);
    }

    /**
     * Adds the row of the specified node and its index entries to the batch.
     */
    public void putNode(WriteBatch batch, DocumentNode node) {
        final String tenantId = node.tenantId();
        final byte[] id = node.id().getBytes(StandardCharsets.UTF_8);
        try {
            batch.put(storage.getColumnFamilyHandle(NODES_COLUMN_FAMILY),
                      DbKeys.nodeKey(tenantId, node.id()), encode(node));
            batch.put(storage.getColumnFamilyHandle(NODE_PATHS_COLUMN_FAMILY),
                      DbKeys.pathKey(tenantId, node.path()), id);
            batch.put(storage.getColumnFamilyHandle(NODE_SLUGS_COLUMN_FAMILY),
                      DbKeys.slugKey(tenantId, node.parentId(), node.slug()), id);
        } catch (RocksDBException e) {
            throw new StorageException("Failed to add node " + tenantId + '/' + node.id() + " to a batch", e);
        }
    }

    /**
     * Adds the removal of the index entries of the specified node to the batch. The row itself is kept,
     * so that the caller may put an updated one.
     */
    public void removeIndexes(WriteBatch batch, DocumentNode node) {
        final String tenantId = node.tenantId();
        try {
            batch.delete(storage.getColumnFamilyHandle(NODE_PATHS_COLUMN_FAMILY),
                         DbKeys.pathKey(tenantId, node.path()));
            batch.delete(storage.getColumnFamilyHandle(NODE_SLUGS_COLUMN_FAMILY),
                         DbKeys.slugKey(tenantId, node.parentId(), node.slug()));
        } catch (RocksDBException e) {
            throw new StorageException("Failed to remove the indexes of node " + tenantId + '/' + node.id(),
                                       e);
        }
    }

    /**
     * Adds the removal of the specified node, its index entries and its metadata to the batch.
     */
    public void removeNode(WriteBatch batch, DocumentNode node) {
        removeIndexes(batch, node);
        final String tenantId = node.tenantId();
        try {
            batch.delete(storage.getColumnFamilyHandle(NODES_COLUMN_FAMILY),
                         DbKeys.nodeKey(tenantId, node.id()));
            batch.delete(storage.getColumnFamilyHandle(METADATA_COLUMN_FAMILY),
                         DbKeys.metadataKey(tenantId, node.id()));
        } catch (RocksDBException e) {
            throw new StorageException("Failed to remove node " + tenantId + '/' + node.id(), e);
        }
    }

    @Nullable
    public DocumentMetadata metadata(String tenantId, String documentId) {
        final byte[] key = DbKeys.metadataKey(tenantId, documentId);
        return decode(storage.get(METADATA_COLUMN_FAMILY, key), key, DocumentMetadata.class);
    }

    public void putMetadata(WriteBatch batch, DocumentMetadata metadata) {
        try {
            batch.put(storage.getColumnFamilyHandle(METADATA_COLUMN_FAMILY),
                      DbKeys.metadataKey(metadata.tenantId(), metadata.documentId()), encode(metadata));
        } catch (RocksDBException e) {
            throw new StorageException("Failed to add the metadata of " + metadata.tenantId() + '/' +
                                       metadata.documentId() + " to a batch", e);
        }
    }

    public void write(WriteBatch batch) {
        storage.write(batch);
    }

    static byte[] encode(Object value) {
        try {
            return Jackson.writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw new StorageException("Failed to serialize " + value, e);
        }
    }

    @Nullable
    static <T> T decode(@Nullable byte[] value, byte[] key, Class<T> type) {
        if (value == null) {
            return null;
        }
        try {
            return Jackson.readValue(value, type);
        } catch (JsonParseException | JsonMappingException e) {
            throw new StorageException("Failed to read a " + type.getSimpleName() + " at " +
                                       DbKeys.toString(key), e);
        }
    }
}
