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
package com.linecorp.docvault.server;

import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.ServiceLoader;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledExecutorService;

import javax.annotation.Nullable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import com.linecorp.armeria.common.Flags;
import com.linecorp.armeria.common.util.SafeCloseable;
import com.linecorp.docvault.common.DocumentMetadata;
import com.linecorp.docvault.common.DocumentNode;
import com.linecorp.docvault.common.DocumentRevision;
import com.linecorp.docvault.common.MutationResult;
import com.linecorp.docvault.common.NodeKind;
import com.linecorp.docvault.common.TenantKey;
import com.linecorp.docvault.internal.Util;
import com.linecorp.docvault.server.audit.AuditActions;
import com.linecorp.docvault.server.audit.AuditSink;
import com.linecorp.docvault.server.audit.Auditor;
import com.linecorp.docvault.server.internal.storage.NodeStorage;
import com.linecorp.docvault.server.internal.storage.RevisionStorage;
import com.linecorp.docvault.server.internal.storage.RocksDBStorage;
import com.linecorp.docvault.server.internal.storage.TenantLocks;
import com.linecorp.docvault.server.internal.storage.encryption.ExternalKeyProvider;
import com.linecorp.docvault.server.internal.storage.encryption.LocalKeyProvider;
import com.linecorp.docvault.server.internal.storage.encryption.TenantKeyStorage;
import com.linecorp.docvault.server.storage.encryption.EnvelopeCrypto;
import com.linecorp.docvault.server.storage.encryption.KeyProvider;
import com.linecorp.docvault.server.storage.encryption.KeyWrapper;
import com.linecorp.docvault.server.storage.revision.RevisionContent;
import com.linecorp.docvault.server.storage.revision.RevisionStore;
import com.linecorp.docvault.server.storage.rotation.KeyRotationWorker;
import com.linecorp.docvault.server.storage.rotation.RotationReport;
import com.linecorp.docvault.server.storage.rotation.RotationStatus;
import com.linecorp.docvault.server.storage.tree.DocumentTree;

import io.micrometer.core.instrument.MeterRegistry;

/**
 * An encrypted, hierarchical document store backed by RocksDB.
 *
 * <p>This is the entry point of the API layer. It wires the {@link DocumentTree}, the
 * {@link RevisionStore}, the {@link KeyProvider} selected by the configuration and the
 * {@link KeyRotationWorker}, and delegates every operation to them. Mutations take the version the caller
 * last saw and return a {@link MutationResult}. Callers are expected to have authenticated the actor and
 * resolved the tenant already.
 */
public final class DocumentStore implements SafeCloseable {

    private static final Logger logger = LoggerFactory.getLogger(DocumentStore.class);

    /**
     * Opens a new {@link DocumentStore} with the configuration in the specified file.
     */
    public static DocumentStore forConfig(File configFile) throws IOException {
        requireNonNull(configFile, "configFile");
        return new DocumentStore(DocumentStoreConfig.load(configFile), null, AuditSink.ofLogger(),
                                 Flags.meterRegistry(), null);
    }

    private final DocumentStoreConfig config;
    private final RocksDBStorage storage;
    private final TenantLocks locks = new TenantLocks();
    private final RevisionStorage revisionStorage;
    private final Auditor auditor;
    private final KeyProvider keyProvider;
    private final DocumentTree documentTree;
    private final RevisionStore revisionStore;
    private final KeyRotationWorker rotationWorker;

    DocumentStore(DocumentStoreConfig config, @Nullable KeyWrapper keyWrapper, AuditSink auditSink,
                  MeterRegistry meterRegistry, @Nullable ScheduledExecutorService rotationExecutor) {
        this.config = requireNonNull(config, "config");
        requireNonNull(auditSink, "auditSink");
        requireNonNull(meterRegistry, "meterRegistry");

        final File dataDir = config.dataDir();
        if (!dataDir.isDirectory() && !dataDir.mkdirs()) {
            throw new IllegalStateException("failed to create the data directory: " + dataDir);
        }
        storage = new RocksDBStorage(dataDir.getPath());
        try {
            final NodeStorage nodeStorage = new NodeStorage(storage);
            revisionStorage = new RevisionStorage(storage);
            auditor = new Auditor(auditSink);
            keyProvider = newKeyProvider(config.keyProvider(), new TenantKeyStorage(storage), keyWrapper);
            final EnvelopeCrypto crypto = new EnvelopeCrypto(config.chunkSize());

            documentTree = new DocumentTree(nodeStorage, revisionStorage, locks, auditor);
            revisionStore = new RevisionStore(nodeStorage, revisionStorage, locks, keyProvider, crypto,
                                              auditor, meterRegistry);
            rotationWorker = new KeyRotationWorker(revisionStorage, locks, keyProvider, crypto, auditor,
                                                   config.rotation(), meterRegistry, rotationExecutor);
        } catch (Throwable t) {
            storage.close();
            throw t;
        }
        logger.info("Started a document store: {}", config);
    }

    private static KeyProvider newKeyProvider(KeyProviderConfig cfg, TenantKeyStorage tenantKeyStorage,
                                              @Nullable KeyWrapper keyWrapper) {
        switch (cfg.type()) {
            case LOCAL:
                return new LocalKeyProvider(tenantKeyStorage, cfg.kekCacheSpec(),
                                            cfg.secret(), cfg.salt(), cfg.kdfIterations());
            case EXTERNAL:
                final KeyWrapper wrapper = keyWrapper != null ? keyWrapper : loadKeyWrapper();
                return new ExternalKeyProvider(tenantKeyStorage, cfg.kekCacheSpec(), wrapper,
                                               requireNonNull(cfg.kekId(), "kekId"),
                                               Duration.ofMillis(cfg.unwrapTimeoutMillis()));
            default:
                throw new Error("unknown key provider type: " + cfg.type());
        }
    }

    private static KeyWrapper loadKeyWrapper() {
        final List<KeyWrapper> keyWrappers = ImmutableList.copyOf(ServiceLoader.load(
                KeyWrapper.class, DocumentStore.class.getClassLoader()));
        if (keyWrappers.size() != 1) {
            throw new IllegalStateException(
                    "A single KeyWrapper implementation must be provided. found: " + keyWrappers);
        }
        return keyWrappers.get(0);
    }

    public DocumentStoreConfig config() {
        return config;
    }

    public DocumentTree documentTree() {
        return documentTree;
    }

    public RevisionStore revisionStore() {
        return revisionStore;
    }

    public KeyProvider keyProvider() {
        return keyProvider;
    }

    public KeyRotationWorker rotationWorker() {
        return rotationWorker;
    }

    @VisibleForTesting
    RocksDBStorage storage() {
        return storage;
    }

    // Tree

    public MutationResult<DocumentNode> createNode(String tenantId, @Nullable String parentId, NodeKind kind,
                                                   String title, String actorId) {
        return documentTree.createNode(tenantId, parentId, kind, title, actorId);
    }

    public MutationResult<DocumentNode> rename(String tenantId, String nodeId, String newTitle,
                                               long expectedVersion, String actorId) {
        return documentTree.rename(tenantId, nodeId, newTitle, expectedVersion, actorId);
    }

    public MutationResult<DocumentNode> move(String tenantId, String nodeId, @Nullable String newParentId,
                                             long expectedVersion, String actorId) {
        return documentTree.move(tenantId, nodeId, newParentId, expectedVersion, actorId);
    }

    public MutationResult<Integer> delete(String tenantId, String nodeId, long expectedVersion,
                                          boolean cascade, String actorId) {
        return documentTree.delete(tenantId, nodeId, expectedVersion, cascade, actorId);
    }

    public MutationResult<DocumentNode> archive(String tenantId, String nodeId, boolean archived,
                                                long expectedVersion, String actorId) {
        return documentTree.archive(tenantId, nodeId, archived, expectedVersion, actorId);
    }

    public DocumentNode getNode(String tenantId, String nodeId) {
        return documentTree.get(tenantId, nodeId);
    }

    public Iterable<DocumentNode> listRoots(String tenantId) {
        return documentTree.listRoots(tenantId);
    }

    public Iterable<DocumentNode> listChildren(String tenantId, String nodeId) {
        return documentTree.listChildren(tenantId, nodeId);
    }

    public Iterable<DocumentNode> listSubtree(String tenantId, String nodeId) {
        return documentTree.listSubtree(tenantId, nodeId);
    }

    // Revisions

    public MutationResult<DocumentRevision> appendRevision(String tenantId, String documentId,
                                                           long expectedVersion, InputStream plaintext,
                                                           String contentType, String actorId)
            throws IOException {
        return revisionStore.appendRevision(tenantId, documentId, expectedVersion, plaintext, contentType,
                                            actorId);
    }

    /**
     * Returns the specified revision, or the latest one if {@code revisionNo} is {@link RevisionStore#LATEST}.
     * The returned content must be closed.
     */
    public RevisionContent getRevision(String tenantId, String documentId, int revisionNo) {
        return revisionStore.getRevision(tenantId, documentId, revisionNo);
    }

    public RevisionContent getLatestRevision(String tenantId, String documentId) {
        return revisionStore.getRevision(tenantId, documentId, RevisionStore.LATEST);
    }

    public Iterable<DocumentRevision> listRevisions(String tenantId, String documentId) {
        return revisionStore.listRevisions(tenantId, documentId);
    }

    public int countRevisions(String tenantId, String documentId) {
        return revisionStore.countRevisions(tenantId, documentId);
    }

    public DocumentMetadata getMetadata(String tenantId, String documentId) {
        return revisionStore.getMetadata(tenantId, documentId);
    }

    public MutationResult<DocumentMetadata> updateMetadata(String tenantId, String documentId,
                                                           long expectedVersion, @Nullable List<String> tags,
                                                           @Nullable Boolean published,
                                                           @Nullable Boolean favorited, String actorId) {
        return revisionStore.updateMetadata(tenantId, documentId, expectedVersion, tags, published, favorited,
                                            actorId);
    }

    public DocumentMetadata markIndexed(String tenantId, String documentId, Instant indexedAt) {
        return revisionStore.markIndexed(tenantId, documentId, indexedAt);
    }

    // Keys

    /**
     * Rotates the key encryption key of the specified tenant. Existing revisions keep working with the
     * superseded version until they are re-wrapped by {@link #triggerRotation(String)}.
     *
     * @return the new active version
     */
    public int rotateKek(String tenantId, String actorId) {
        return rotationWorker.rotateKek(tenantId, actorId);
    }

    /**
     * Rotates the key encryption key of the specified tenant and schedules the re-wrapping of its revisions.
     */
    public CompletableFuture<RotationReport> rotateAndRewrap(String tenantId, String actorId) {
        return rotationWorker.rotateAndRewrap(tenantId, actorId);
    }

    /**
     * Schedules the re-wrapping of the revisions of the specified tenant which still use a superseded key
     * encryption key.
     */
    public CompletableFuture<RotationReport> triggerRotation(String tenantId) {
        return rotationWorker.schedule(tenantId);
    }

    public RotationStatus rotationStatus(String tenantId) {
        return rotationWorker.status(tenantId);
    }

    public List<TenantKey> kekVersions(String tenantId) {
        return keyProvider.kekVersions(tenantId);
    }

    /**
     * Removes a superseded key encryption key version of the specified tenant.
     *
     * @throws IllegalStateException if the version is active or a revision still uses it
     */
    public void pruneKek(String tenantId, int kekVersion, String actorId) {
        Util.validateTenantId(tenantId, "tenantId");
        requireNonNull(actorId, "actorId");
        // Excludes commits in progress, which may still wrap with a superseded version.
        try (SafeCloseable ignored = locks.lockTenant(tenantId)) {
            checkState(!revisionStorage.isKekVersionReferenced(tenantId, kekVersion),
                       "key encryption key %s/%s is still in use", tenantId, kekVersion);
            keyProvider.removeKekVersion(tenantId, kekVersion);
        }
        auditor.emit(tenantId, actorId, AuditActions.KEK_PRUNED, tenantId,
                     ImmutableMap.of("kekVersion", kekVersion));
    }

    @Override
    public void close() {
        try {
            rotationWorker.close();
        } finally {
            storage.close();
        }
    }
}
