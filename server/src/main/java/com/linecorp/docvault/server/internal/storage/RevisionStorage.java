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

import static com.linecorp.docvault.server.internal.storage.NodeStorage.decode;
import static com.linecorp.docvault.server.internal.storage.NodeStorage.encode;
import static com.linecorp.docvault.server.internal.storage.RocksDBStorage.REVISIONS_COLUMN_FAMILY;
import static com.linecorp.docvault.server.internal.storage.RocksDBStorage.REVISION_CHUNKS_COLUMN_FAMILY;
import static java.util.Objects.requireNonNull;

import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.Set;

import javax.annotation.Nullable;

import org.rocksdb.ColumnFamilyHandle;
import org.rocksdb.RocksDBException;
import org.rocksdb.RocksIterator;
import org.rocksdb.WriteBatch;

import com.google.common.collect.AbstractIterator;
import com.google.common.collect.ImmutableList;

import com.linecorp.docvault.common.DocumentRevision;
import com.linecorp.docvault.server.storage.StorageException;

/**
 * Reads and writes revision headers and the sealed chunks of their content.
 */
public final class RevisionStorage {

    // Upper bound of the rows a single stale scan reads, whether they are stale or not.
    private static final int MAX_SCANNED_ROWS_PER_BATCH_FACTOR = 16;

    private final RocksDBStorage storage;

    public RevisionStorage(RocksDBStorage storage) {
        this.storage = requireNonNull(storage, "storage");
    }

    @Nullable
    public DocumentRevision revision(String tenantId, String documentId, int revisionNo,
                                     @Nullable StorageSnapshot snapshot) {
        final byte[] key = DbKeys.revisionKey(tenantId, documentId, revisionNo);
        final byte[] value;
        if (snapshot != null) {
            value = storage.get(REVISIONS_COLUMN_FAMILY, snapshot.readOptions(), key);
        } else {
            value = storage.get(REVISIONS_COLUMN_FAMILY, key);
        }
        return decode(value, key, DocumentRevision.class);
    }

    @Nullable
    public DocumentRevision latest(String tenantId, String documentId, @Nullable StorageSnapshot snapshot) {
        final byte[] prefix = DbKeys.revisionsPrefix(tenantId, documentId);
        try (RocksIterator it = snapshot != null ? storage.newIterator(REVISIONS_COLUMN_FAMILY,
                                                                       snapshot.readOptions())
                                                 : storage.newIterator(REVISIONS_COLUMN_FAMILY)) {
            it.seekForPrev(DbKeys.prefixEnd(prefix));
            if (!it.isValid() || !DbKeys.startsWith(it.key(), prefix)) {
                return null;
            }
            return decode(it.value(), it.key(), DocumentRevision.class);
        }
    }

    /**
     * Returns the revisions of the specified document, the latest first.
     */
    public Iterable<DocumentRevision> revisions(String tenantId, String documentId) {
        return new PrefixIterable<>(storage, REVISIONS_COLUMN_FAMILY,
                                    DbKeys.revisionsPrefix(tenantId, documentId), true,
                                    (snapshot, key, value) -> decode(value, key, DocumentRevision.class));
    }

    /**
     * Stores a sealed chunk. Chunks are unreachable until the header of their revision is written.
     */
    public void putChunk(String revisionId, long chunkIndex, byte[] sealedChunk) {
        storage.putUnsynced(REVISION_CHUNKS_COLUMN_FAMILY, DbKeys.chunkKey(revisionId, chunkIndex),
                            sealedChunk);
    }

    /**
     * Returns the sealed chunks of the specified revision in order, as seen by the specified snapshot.
     * Chunks are read one at a time.
     */
    public Iterator<byte[]> chunks(String revisionId, StorageSnapshot snapshot) {
        requireNonNull(revisionId, "revisionId");
        requireNonNull(snapshot, "snapshot");
        return new AbstractIterator<byte[]>() {
            private long nextIndex;

            @Override
            protected byte[] computeNext() {
                final byte[] chunk = storage.get(REVISION_CHUNKS_COLUMN_FAMILY, snapshot.readOptions(),
                                                 DbKeys.chunkKey(revisionId, nextIndex));
                if (chunk == null) {
                    return endOfData();
                }
                nextIndex++;
                return chunk;
            }
        };
    }

    public void putRevision(WriteBatch batch, DocumentRevision revision) {
        try {
            batch.put(storage.getColumnFamilyHandle(REVISIONS_COLUMN_FAMILY),
                      DbKeys.revisionKey(revision.tenantId(), revision.documentId(), revision.revisionNo()),
                      encode(revision));
        } catch (RocksDBException e) {
            throw new StorageException("Failed to add revision " + revision.revisionNo() + " of " +
                                       revision.tenantId() + '/' + revision.documentId() + " to a batch", e);
        }
    }

    /**
     * Adds the removal of every revision of the specified document and their chunks to the batch.
     */
    public void removeRevisions(WriteBatch batch, String tenantId, String documentId) {
        final ColumnFamilyHandle chunksCf = storage.getColumnFamilyHandle(REVISION_CHUNKS_COLUMN_FAMILY);
        final byte[] prefix = DbKeys.revisionsPrefix(tenantId, documentId);
        try {
            for (DocumentRevision revision : revisions(tenantId, documentId)) {
                final byte[] chunksPrefix = DbKeys.chunksPrefix(revision.id());
                batch.deleteRange(chunksCf, chunksPrefix, DbKeys.prefixEnd(chunksPrefix));
            }
            batch.deleteRange(storage.getColumnFamilyHandle(REVISIONS_COLUMN_FAMILY),
                              prefix, DbKeys.prefixEnd(prefix));
        } catch (RocksDBException e) {
            throw new StorageException("Failed to remove the revisions of " + tenantId + '/' + documentId, e);
        }
    }

    /**
     * Removes the chunks of a revision whose header was never written.
     */
    public void removeChunks(String revisionId) {
        final byte[] chunksPrefix = DbKeys.chunksPrefix(revisionId);
        try (WriteBatch batch = new WriteBatch()) {
            batch.deleteRange(storage.getColumnFamilyHandle(REVISION_CHUNKS_COLUMN_FAMILY),
                              chunksPrefix, DbKeys.prefixEnd(chunksPrefix));
            storage.write(batch);
        } catch (RocksDBException e) {
            throw new StorageException("Failed to remove the chunks of revision " + revisionId, e);
        }
    }

    /**
     * Replaces the header of an existing revision.
     */
    public void updateRevision(DocumentRevision revision) {
        try (WriteBatch batch = new WriteBatch()) {
            putRevision(batch, revision);
            storage.write(batch);
        }
    }

    /**
     * Returns the next revisions of the specified tenant whose data encryption key is wrapped by a key
     * encryption key older than {@code activeKekVersion}, starting right after {@code cursor}.
     *
     * @param excludedIds the IDs of the revisions to leave out, e.g. the ones that failed to be re-wrapped
     */
    public StalePage scanStale(String tenantId, int activeKekVersion, @Nullable byte[] cursor, int batchSize,
                               Set<String> excludedIds) {
        final byte[] prefix = DbKeys.tenantPrefix(tenantId);
        final int maxScannedRows = batchSize * MAX_SCANNED_ROWS_PER_BATCH_FACTOR;
        final ImmutableList.Builder<DocumentRevision> builder = ImmutableList.builder();
        int found = 0;
        int scanned = 0;
        try (RocksIterator it = storage.newIterator(REVISIONS_COLUMN_FAMILY)) {
            if (cursor == null) {
                it.seek(prefix);
            } else {
                it.seek(cursor);
                if (it.isValid() && Arrays.equals(it.key(), cursor)) {
                    it.next();
                }
            }
            while (it.isValid() && DbKeys.startsWith(it.key(), prefix)) {
                final byte[] key = it.key();
                final DocumentRevision revision = decode(it.value(), key, DocumentRevision.class);
                scanned++;
                if (revision != null && revision.kekVersion() < activeKekVersion &&
                    !excludedIds.contains(revision.id())) {
                    builder.add(revision);
                    found++;
                }
                if (found >= batchSize || scanned >= maxScannedRows) {
                    return new StalePage(builder.build(), key);
                }
                it.next();
            }
        }
        return new StalePage(builder.build(), null);
    }

    /**
     * Returns whether any revision of the specified tenant has its data encryption key wrapped by the
     * specified key encryption key version.
     */
    public boolean isKekVersionReferenced(String tenantId, int kekVersion) {
        final byte[] prefix = DbKeys.tenantPrefix(tenantId);
        try (RocksIterator it = storage.newIterator(REVISIONS_COLUMN_FAMILY)) {
            for (it.seek(prefix); it.isValid() && DbKeys.startsWith(it.key(), prefix); it.next()) {
                final DocumentRevision revision = decode(it.value(), it.key(), DocumentRevision.class);
                if (revision != null && revision.kekVersion() == kekVersion) {
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * A batch of stale revisions and where the next scan resumes.
     */
    public static final class StalePage {

        private final List<DocumentRevision> revisions;
        @Nullable
        private final byte[] nextCursor;

        StalePage(List<DocumentRevision> revisions, @Nullable byte[] nextCursor) {
            this.revisions = revisions;
            this.nextCursor = nextCursor;
        }

        public List<DocumentRevision> revisions() {
            return revisions;
        }

        /**
         * Returns the key after which the next scan resumes, or {@code null} if the scan reached the end
         * of the tenant's revisions.
         */
        @Nullable
        public byte[] nextCursor() {
            return nextCursor;
        }
    }
}
