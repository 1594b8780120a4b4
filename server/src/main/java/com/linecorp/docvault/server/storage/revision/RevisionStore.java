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
package com.linecorp.docvault.server.storage.revision;

import static com.google.common.base.Preconditions.checkArgument;
import static com.linecorp.docvault.server.internal.storage.TenantLocks.metadataLockKey;
import static com.linecorp.docvault.server.internal.storage.TenantLocks.nodeLockKey;
import static java.util.Objects.requireNonNull;

import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.UUID;

import javax.annotation.Nullable;
import javax.crypto.SecretKey;

import org.rocksdb.WriteBatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableMap;

import com.linecorp.armeria.common.util.SafeCloseable;
import com.linecorp.docvault.common.AuthenticationFailureException;
import com.linecorp.docvault.common.DocumentMetadata;
import com.linecorp.docvault.common.DocumentNode;
import com.linecorp.docvault.common.DocumentRevision;
import com.linecorp.docvault.common.IntegrityViolationException;
import com.linecorp.docvault.common.InvalidNodeOperationException;
import com.linecorp.docvault.common.KeyProviderUnavailableException;
import com.linecorp.docvault.common.MutationFailure;
import com.linecorp.docvault.common.MutationResult;
import com.linecorp.docvault.common.NodeNotFoundException;
import com.linecorp.docvault.common.RevisionNotFoundException;
import com.linecorp.docvault.common.UnwrapFailureException;
import com.linecorp.docvault.internal.Util;
import com.linecorp.docvault.server.audit.AuditActions;
import com.linecorp.docvault.server.audit.Auditor;
import com.linecorp.docvault.server.internal.storage.NodeStorage;
import com.linecorp.docvault.server.internal.storage.RevisionStorage;
import com.linecorp.docvault.server.internal.storage.StorageSnapshot;
import com.linecorp.docvault.server.internal.storage.TenantLocks;
import com.linecorp.docvault.server.storage.encryption.EncryptionSummary;
import com.linecorp.docvault.server.storage.encryption.EnvelopeCrypto;
import com.linecorp.docvault.server.storage.encryption.KeyProvider;
import com.linecorp.docvault.server.storage.encryption.SecretKeyWithVersion;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

/**
 * Append-only, encrypted revisions of documents, and the metadata side table of documents.
 *
 * <p>Every revision is encrypted with its own data encryption key, which is wrapped by the active key
 * encryption key of the tenant. Sealed chunks are stored while the content is being read from the caller,
 * and become visible only when the revision header is committed together with the version bump of the
 * document node.
 */
public final class RevisionStore {

    private static final Logger logger = LoggerFactory.getLogger(RevisionStore.class);

    /**
     * The revision number that denotes the latest revision of a document.
     */
    public static final int LATEST = -1;

    private static final int MAX_REWRAP_ATTEMPTS = 3;

    private final NodeStorage nodes;
    private final RevisionStorage revisions;
    private final TenantLocks locks;
    private final KeyProvider keyProvider;
    private final EnvelopeCrypto crypto;
    private final Auditor auditor;

    private final Counter appendedCounter;
    private final Counter readCounter;
    private final Counter unwrapFailureCounter;
    private final Counter authenticationFailureCounter;
    private final Counter integrityViolationCounter;

    public RevisionStore(NodeStorage nodes, RevisionStorage revisions, TenantLocks locks,
                         KeyProvider keyProvider, EnvelopeCrypto crypto, Auditor auditor,
                         MeterRegistry meterRegistry) {
        this.nodes = requireNonNull(nodes, "nodes");
        this.revisions = requireNonNull(revisions, "revisions");
        this.locks = requireNonNull(locks, "locks");
        this.keyProvider = requireNonNull(keyProvider, "keyProvider");
        this.crypto = requireNonNull(crypto, "crypto");
        this.auditor = requireNonNull(auditor, "auditor");
        requireNonNull(meterRegistry, "meterRegistry");

        appendedCounter = Counter.builder("docvault.revisions")
                                 .tag("operation", "append")
                                 .register(meterRegistry);
        readCounter = Counter.builder("docvault.revisions")
                             .tag("operation", "read")
                             .register(meterRegistry);
        unwrapFailureCounter = Counter.builder("docvault.crypto.failures")
                                      .tag("type", "unwrap")
                                      .register(meterRegistry);
        authenticationFailureCounter = Counter.builder("docvault.crypto.failures")
                                              .tag("type", "authentication")
                                              .register(meterRegistry);
        integrityViolationCounter = Counter.builder("docvault.crypto.failures")
                                           .tag("type", "integrity")
                                           .register(meterRegistry);
    }

    /**
     * Encrypts the specified plaintext as the next revision of the specified document. The plaintext is
     * read until its end but is not closed.
     *
     * <p>The stream is consumed before the version of the document is checked again, so a concurrent writer
     * with the same {@code expectedVersion} may still win. The loser gets
     * {@link MutationFailure#VERSION_CONFLICT} and nothing it stored remains.
     *
     * @throws NodeNotFoundException if the document does not exist or was deleted meanwhile
     * @throws InvalidNodeOperationException if the node is a folder
     * @throws java.util.concurrent.CancellationException if the calling thread was interrupted
     * @throws KeyProviderUnavailableException if the key custodian could not be reached before the commit,
     *                                         in which case nothing is stored
     * @throws IOException if failed to read the plaintext
     */
    public MutationResult<DocumentRevision> appendRevision(String tenantId, String documentId,
                                                           long expectedVersion, InputStream plaintext,
                                                           String contentType, String actorId)
            throws IOException {
        Util.validateTenantId(tenantId, "tenantId");
        requireNonNull(plaintext, "plaintext");
        requireNonNull(contentType, "contentType");
        requireNonNull(actorId, "actorId");

        final DocumentNode document = requireDocument(tenantId, documentId);
        if (document.version() != expectedVersion) {
            return versionConflict(document, expectedVersion);
        }

        // May block on the key custodian, so no lock must be held.
        SecretKeyWithVersion kek = keyProvider.getActiveKek(tenantId);

        final String revisionId = UUID.randomUUID().toString();
        final byte[] dek = crypto.generateDek();
        final byte[] nonceBase = crypto.generateNonceBase();
        boolean committed = false;
        DocumentRevision revision = null;
        try {
            final EncryptionSummary summary = crypto.streamEncrypt(
                    dek, nonceBase, plaintext,
                    (chunkIndex, sealedChunk) -> revisions.putChunk(revisionId, chunkIndex, sealedChunk));

            for (int attempt = 1; ; attempt++) {
                final byte[] dekCiphertext = crypto.wrapDek(dek, kek.secretKey());
                try (SafeCloseable ignored = locks.lockRows(tenantId, nodeLockKey(tenantId, documentId))) {
                    final DocumentNode current = nodes.node(tenantId, documentId);
                    if (current == null) {
                        throw NodeNotFoundException.of(tenantId, documentId);
                    }
                    if (current.version() != expectedVersion) {
                        return versionConflict(current, expectedVersion);
                    }

                    // The tenant lock held here excludes pruning, so a version seen now outlives the commit.
                    if (keyProvider.containsKekVersion(tenantId, kek.version())) {
                        final DocumentRevision latest = revisions.latest(tenantId, documentId, null);
                        final int revisionNo = latest != null ? latest.revisionNo() + 1 : 1;
                        final Instant now = Instant.now();
                        revision = new DocumentRevision(
                                revisionId, tenantId, documentId, revisionNo, dekCiphertext, kek.version(),
                                nonceBase, summary.checksum(), summary.sizeBytes(), crypto.chunkSize(),
                                summary.chunkCount(), contentType, actorId, now);
                        try (WriteBatch batch = new WriteBatch()) {
                            revisions.putRevision(batch, revision);
                            nodes.putNode(batch, current.touched(now));
                            nodes.write(batch);
                        }
                        committed = true;
                        break;
                    }
                }

                if (attempt >= MAX_REWRAP_ATTEMPTS) {
                    throw new IllegalStateException(
                            "key encryption key of " + tenantId + " was removed during " + MAX_REWRAP_ATTEMPTS +
                            " attempts to append a revision of " + documentId);
                }
                logger.debug("Version {} of the key encryption key of {} was removed while appending a " +
                             "revision of {}; wrapping with the active version", kek.version(), tenantId,
                             documentId);
                kek = keyProvider.getActiveKek(tenantId);
            }

            try {
                rewrapIfRotated(revision, dek);
            } catch (RuntimeException e) {
                logger.warn("Failed to re-wrap revision {} of {}/{} after appending it; leaving it to the " +
                            "next rotation pass", revision.revisionNo(), tenantId, documentId, e);
            }
        } finally {
            Arrays.fill(dek, (byte) 0);
            if (!committed) {
                removeOrphanChunks(revisionId);
            }
        }

        appendedCounter.increment();
        auditor.emit(tenantId, actorId, AuditActions.REVISION_APPENDED, documentId,
                     ImmutableMap.of("revisionNo", revision.revisionNo(),
                                     "sizeBytes", revision.sizeBytes(),
                                     "kekVersion", revision.kekVersion()));
        return MutationResult.success(revision);
    }

    /**
     * Re-wraps the data encryption key of a just committed revision if the key encryption key of the
     * tenant was rotated while the revision was being written. Otherwise the revision would be left for
     * the next rotation pass, which may never come.
     */
    private void rewrapIfRotated(DocumentRevision revision, byte[] dek) {
        final String tenantId = revision.tenantId();
        final String documentId = revision.documentId();
        int kekVersion = revision.kekVersion();
        for (int i = 0; i < MAX_REWRAP_ATTEMPTS; i++) {
            final SecretKeyWithVersion active;
            try {
                active = keyProvider.getActiveKek(tenantId);
            } catch (KeyProviderUnavailableException e) {
                logger.warn("Failed to check the active key encryption key of {} after appending revision " +
                            "{} of {}; leaving it to the next rotation pass", tenantId, revision.revisionNo(),
                            documentId, e);
                return;
            }
            if (active.version() <= kekVersion) {
                return;
            }
            final byte[] rewrapped = crypto.wrapDek(dek, active.secretKey());
            try (SafeCloseable ignored = locks.lockRows(tenantId, nodeLockKey(tenantId, documentId))) {
                final DocumentRevision current = revisions.revision(tenantId, documentId,
                                                                    revision.revisionNo(), null);
                if (current == null || current.kekVersion() != kekVersion) {
                    // Deleted, or re-wrapped by the rotation worker already.
                    return;
                }
                revisions.updateRevision(current.withWrappedDek(rewrapped, active.version()));
            }
            logger.debug("Re-wrapped revision {} of {}/{}: kekVersion {} -> {}", revision.revisionNo(),
                         tenantId, documentId, kekVersion, active.version());
            kekVersion = active.version();
        }
    }

    private void removeOrphanChunks(String revisionId) {
        try {
            revisions.removeChunks(revisionId);
        } catch (RuntimeException e) {
            logger.warn("Failed to remove the orphan chunks of revision {}", revisionId, e);
        }
    }

    /**
     * Returns the specified revision of a document, or the latest one if {@code revisionNo} is
     * {@link #LATEST}. Every chunk is authenticated and the checksum is verified before this method
     * returns, so the caller never sees plaintext of a tampered revision.
     *
     * @throws RevisionNotFoundException if the revision does not exist
     * @throws UnwrapFailureException if the data encryption key could not be unwrapped
     * @throws AuthenticationFailureException if a chunk failed authentication
     * @throws IntegrityViolationException if the chunk sequence or the checksum does not match the header
     * @throws KeyProviderUnavailableException if the key custodian could not be reached in time
     */
    public RevisionContent getRevision(String tenantId, String documentId, int revisionNo) {
        Util.validateTenantId(tenantId, "tenantId");
        checkArgument(revisionNo == LATEST || revisionNo > 0,
                      "revisionNo: %s (expected: > 0 or %s)", revisionNo, LATEST);
        requireDocument(tenantId, documentId);

        final StorageSnapshot snapshot = nodes.storage().snapshot();
        try {
            final DocumentRevision revision =
                    revisionNo == LATEST ? revisions.latest(tenantId, documentId, snapshot)
                                         : revisions.revision(tenantId, documentId, revisionNo, snapshot);
            if (revision == null) {
                throw revisionNo == LATEST ?
                      new RevisionNotFoundException("document " + documentId + " has no revisions")
                                           : new RevisionNotFoundException(documentId, revisionNo);
            }
            final InputStream plaintext = open(revision, snapshot);
            readCounter.increment();
            return new RevisionContent(revision, new FilterInputStream(plaintext) {
                @Override
                public void close() throws IOException {
                    try {
                        super.close();
                    } finally {
                        snapshot.close();
                    }
                }
            });
        } catch (Throwable t) {
            snapshot.close();
            throw t;
        }
    }

    private InputStream open(DocumentRevision revision, StorageSnapshot snapshot) {
        final SecretKey kek;
        try {
            kek = keyProvider.getKekByVersion(revision.tenantId(), revision.kekVersion());
        } catch (UnwrapFailureException e) {
            unwrapFailureCounter.increment();
            auditFailure(revision, AuditActions.UNWRAP_FAILURE, e);
            throw e;
        }

        final byte[] dek;
        try {
            dek = crypto.unwrapDek(revision.dekCiphertext(), kek);
        } catch (UnwrapFailureException e) {
            unwrapFailureCounter.increment();
            auditFailure(revision, AuditActions.UNWRAP_FAILURE, e);
            throw e;
        }

        try {
            final byte[] nonceBase = revision.nonceBase();
            final EncryptionSummary summary;
            try {
                summary = crypto.verify(dek, nonceBase, revision.chunkSize(),
                                        revisions.chunks(revision.id(), snapshot));
            } catch (AuthenticationFailureException e) {
                authenticationFailureCounter.increment();
                auditFailure(revision, AuditActions.AUTHENTICATION_FAILURE, e);
                throw e;
            } catch (IntegrityViolationException e) {
                integrityViolationCounter.increment();
                auditFailure(revision, AuditActions.INTEGRITY_VIOLATION, e);
                throw e;
            }

            final String mismatch = mismatch(revision, summary);
            if (mismatch != null) {
                final IntegrityViolationException e = new IntegrityViolationException(
                        "revision " + revision.revisionNo() + " of " + revision.tenantId() + '/' +
                        revision.documentId() + " does not match its header: " + mismatch);
                integrityViolationCounter.increment();
                auditFailure(revision, AuditActions.INTEGRITY_VIOLATION, e);
                throw e;
            }

            return crypto.streamDecrypt(dek, nonceBase, revision.chunkSize(),
                                        revisions.chunks(revision.id(), snapshot));
        } finally {
            Arrays.fill(dek, (byte) 0);
        }
    }

    @Nullable
    private static String mismatch(DocumentRevision revision, EncryptionSummary summary) {
        if (summary.chunkCount() != revision.chunkCount()) {
            return "chunkCount: " + summary.chunkCount() + " (expected: " + revision.chunkCount() + ')';
        }
        if (summary.sizeBytes() != revision.sizeBytes()) {
            return "sizeBytes: " + summary.sizeBytes() + " (expected: " + revision.sizeBytes() + ')';
        }
        if (!summary.checksum().equals(revision.checksum())) {
            return "checksum: " + summary.checksum() + " (expected: " + revision.checksum() + ')';
        }
        return null;
    }

    private void auditFailure(DocumentRevision revision, String action, Exception cause) {
        auditor.emit(revision.tenantId(), AuditActions.SYSTEM_ACTOR, action, revision.documentId(),
                     ImmutableMap.of("revisionNo", revision.revisionNo(),
                                     "kekVersion", revision.kekVersion(),
                                     "reason", String.valueOf(cause.getMessage())));
    }

    /**
     * Returns the revisions of the specified document, the latest first.
     */
    public Iterable<DocumentRevision> listRevisions(String tenantId, String documentId) {
        Util.validateTenantId(tenantId, "tenantId");
        requireDocument(tenantId, documentId);
        return revisions.revisions(tenantId, documentId);
    }

    /**
     * Returns the number of revisions of the specified document.
     */
    public int countRevisions(String tenantId, String documentId) {
        Util.validateTenantId(tenantId, "tenantId");
        requireDocument(tenantId, documentId);
        final DocumentRevision latest = revisions.latest(tenantId, documentId, null);
        return latest != null ? latest.revisionNo() : 0;
    }

    public DocumentMetadata getMetadata(String tenantId, String documentId) {
        Util.validateTenantId(tenantId, "tenantId");
        final DocumentNode document = requireDocument(tenantId, documentId);
        final DocumentMetadata metadata = nodes.metadata(tenantId, documentId);
        return metadata != null ? metadata : DocumentMetadata.of(tenantId, documentId, document.createdAt());
    }

    /**
     * Updates the metadata of the specified document. {@code null} arguments keep the current values.
     * The version of the document node is left unchanged.
     */
    public MutationResult<DocumentMetadata> updateMetadata(String tenantId, String documentId,
                                                           long expectedVersion, @Nullable List<String> tags,
                                                           @Nullable Boolean published,
                                                           @Nullable Boolean favorited, String actorId) {
        Util.validateTenantId(tenantId, "tenantId");
        requireNonNull(actorId, "actorId");

        final DocumentMetadata updated;
        try (SafeCloseable ignored = locks.lockRows(tenantId, metadataLockKey(tenantId, documentId))) {
            final DocumentMetadata current = getMetadata(tenantId, documentId);
            if (current.version() != expectedVersion) {
                return MutationResult.failure(MutationFailure.VERSION_CONFLICT,
                                              "metadata version of " + tenantId + '/' + documentId + ": " +
                                              current.version() + " (expected: " + expectedVersion + ')');
            }
            updated = current.updated(tags, published, favorited, Instant.now());
            putMetadata(updated);
        }

        auditor.emit(tenantId, actorId, AuditActions.METADATA_UPDATED, documentId,
                     ImmutableMap.of("version", updated.version(),
                                     "tags", updated.tags(),
                                     "published", updated.published(),
                                     "favorited", updated.favorited()));
        return MutationResult.success(updated);
    }

    /**
     * Records when the specified document was indexed. The metadata version is left unchanged.
     */
    public DocumentMetadata markIndexed(String tenantId, String documentId, Instant indexedAt) {
        Util.validateTenantId(tenantId, "tenantId");
        requireNonNull(indexedAt, "indexedAt");
        try (SafeCloseable ignored = locks.lockRows(tenantId, metadataLockKey(tenantId, documentId))) {
            final DocumentMetadata updated = getMetadata(tenantId, documentId).indexed(indexedAt);
            putMetadata(updated);
            return updated;
        }
    }

    private void putMetadata(DocumentMetadata metadata) {
        try (WriteBatch batch = new WriteBatch()) {
            nodes.putMetadata(batch, metadata);
            nodes.write(batch);
        }
    }

    private DocumentNode requireDocument(String tenantId, String documentId) {
        Util.validateId(documentId, "documentId");
        final DocumentNode node = nodes.node(tenantId, documentId);
        if (node == null) {
            throw NodeNotFoundException.of(tenantId, documentId);
        }
        if (node.isFolder()) {
            throw new InvalidNodeOperationException("not a document: " + tenantId + '/' + documentId);
        }
        return node;
    }

    private static <T> MutationResult<T> versionConflict(DocumentNode node, long expectedVersion) {
        return MutationResult.failure(MutationFailure.VERSION_CONFLICT,
                                      "version of " + node.tenantId() + '/' + node.id() + ": " +
                                      node.version() + " (expected: " + expectedVersion + ')');
    }
}
