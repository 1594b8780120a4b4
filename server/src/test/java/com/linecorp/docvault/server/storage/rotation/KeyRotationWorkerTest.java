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

package com.linecorp.docvault.server.storage.rotation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.RegisterExtension;

import com.google.common.io.ByteStreams;

import com.linecorp.docvault.common.DocumentNode;
import com.linecorp.docvault.common.DocumentRevision;
import com.linecorp.docvault.common.KeyProviderUnavailableException;
import com.linecorp.docvault.common.NodeKind;
import com.linecorp.docvault.common.TenantKey;
import com.linecorp.docvault.server.DocumentStore;
import com.linecorp.docvault.server.DocumentStoreBuilder;
import com.linecorp.docvault.server.DocumentStoreExtension;
import com.linecorp.docvault.server.KeyProviderConfig;
import com.linecorp.docvault.server.RotationConfig;
import com.linecorp.docvault.server.audit.AuditActions;
import com.linecorp.docvault.server.internal.storage.RevisionStorage;
import com.linecorp.docvault.server.storage.encryption.KeyWrapper;
import com.linecorp.docvault.server.storage.encryption.TestKeyWrapper;
import com.linecorp.docvault.server.storage.revision.RevisionContent;

class KeyRotationWorkerTest {

    private static final String TENANT = "acme";
    private static final String ACTOR = "alice";

    @RegisterExtension
    final DocumentStoreExtension extension = new DocumentStoreExtension() {
        @Override
        protected void configure(DocumentStoreBuilder builder) {
            builder.rotation(new RotationConfig(2, 10L, 50L, 3));
        }
    };

    @Test
    void rotationKeepsRevisionsReadableAndRewrapsThem() throws Exception {
        final DocumentStore store = extension.store();
        final List<DocumentRevision> written = appendRevisions(store, 5);
        assertThat(written).allSatisfy(revision -> assertThat(revision.kekVersion()).isOne());

        assertThat(store.rotateKek(TENANT, ACTOR)).isEqualTo(2);

        // Readable with the superseded key before the pass.
        assertThat(read(store, written.get(0))).isEqualTo("content 0");
        assertThat(store.kekVersions(TENANT)).extracting(TenantKey::kekVersion).containsExactly(1, 2);
        assertThat(store.kekVersions(TENANT).get(0).rotatedAt()).isNotNull();

        final RotationReport report = store.triggerRotation(TENANT).get(10, TimeUnit.SECONDS);

        assertThat(report.tenantId()).isEqualTo(TENANT);
        assertThat(report.targetVersion()).isEqualTo(2);
        assertThat(report.rewrapped()).isEqualTo(5);
        assertThat(report.failed()).isZero();
        assertThat(report.batches()).isEqualTo(3);

        final RevisionStorage revisions = new RevisionStorage(extension.storage());
        for (DocumentRevision revision : written) {
            final DocumentRevision rewrapped = revisions.revision(TENANT, revision.documentId(),
                                                                  revision.revisionNo(), null);
            assertThat(rewrapped.kekVersion()).isEqualTo(2);
            assertThat(rewrapped.dekCiphertext()).isNotEqualTo(revision.dekCiphertext());
            assertThat(rewrapped.nonceBase()).isEqualTo(revision.nonceBase());
            assertThat(rewrapped.checksum()).isEqualTo(revision.checksum());
            assertThat(read(store, rewrapped)).isEqualTo(read(store, revision));
        }
        assertThat(extension.auditEvents(AuditActions.KEK_ROTATED)).hasSize(1);
        assertThat(extension.auditEvents(AuditActions.ROTATION_COMPLETED)).singleElement().satisfies(
                event -> assertThat(event.payload()).containsEntry("rewrapped", "5"));
        assertThat(extension.meterRegistry().get("docvault.rotation.revisions").tag("result", "rewrapped")
                            .counter().count()).isEqualTo(5);

        // A second pass has nothing to do.
        assertThat(store.rotationWorker().runPass(TENANT).rewrapped()).isZero();
    }

    @Test
    void newRevisionsUseActiveKey() throws Exception {
        final DocumentStore store = extension.store();
        final DocumentNode doc = newDocument(store, "Doc");
        store.rotateKek(TENANT, ACTOR);

        final DocumentRevision revision = append(store, doc, 1, "after rotation");

        assertThat(revision.kekVersion()).isEqualTo(2);
        assertThat(store.triggerRotation(TENANT).get(10, TimeUnit.SECONDS).rewrapped()).isZero();
    }

    @Test
    void pruneOnlyAfterRewrapping() throws Exception {
        final DocumentStore store = extension.store();
        final List<DocumentRevision> written = appendRevisions(store, 2);
        store.rotateKek(TENANT, ACTOR);

        assertThatThrownBy(() -> store.pruneKek(TENANT, 1, ACTOR))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("still in use");
        assertThatThrownBy(() -> store.pruneKek(TENANT, 2, ACTOR))
                .isInstanceOf(IllegalStateException.class);

        store.rotateAndRewrap(TENANT, ACTOR).get(10, TimeUnit.SECONDS);
        store.pruneKek(TENANT, 1, ACTOR);
        store.pruneKek(TENANT, 2, ACTOR);

        assertThat(store.kekVersions(TENANT)).extracting(TenantKey::kekVersion).containsExactly(3);
        assertThat(read(store, written.get(1))).isEqualTo("content 1");
        assertThat(extension.auditEvents(AuditActions.KEK_PRUNED)).hasSize(2);
    }

    @Test
    void unwrappableRevisionIsCountedAsFailed() throws Exception {
        final DocumentStore store = extension.store();
        final List<DocumentRevision> written = appendRevisions(store, 3);
        final DocumentRevision broken = written.get(1);
        final byte[] dekCiphertext = broken.dekCiphertext();
        dekCiphertext[dekCiphertext.length - 1] ^= 1;
        final RevisionStorage revisions = new RevisionStorage(extension.storage());
        revisions.updateRevision(broken.withWrappedDek(dekCiphertext, broken.kekVersion()));
        store.rotateKek(TENANT, ACTOR);

        final RotationReport report = store.triggerRotation(TENANT).get(10, TimeUnit.SECONDS);

        assertThat(report.rewrapped()).isEqualTo(2);
        assertThat(report.failed()).isOne();
        assertThat(revisions.revision(TENANT, broken.documentId(), 1, null).kekVersion()).isOne();
        assertThat(extension.auditEvents(AuditActions.UNWRAP_FAILURE)).singleElement().satisfies(
                event -> assertThat(event.targetId()).isEqualTo(broken.documentId()));
        // The superseded key must be kept for the broken revision.
        assertThatThrownBy(() -> store.pruneKek(TENANT, 1, ACTOR))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void status() throws Exception {
        final DocumentStore store = extension.store();
        final RotationStatus idle = store.rotationStatus(TENANT);
        assertThat(idle.state()).isEqualTo(RotationState.IDLE);
        assertThat(idle.lastCompletedAt()).isNull();

        appendRevisions(store, 3);
        store.rotateAndRewrap(TENANT, ACTOR).get(10, TimeUnit.SECONDS);

        final RotationStatus status = store.rotationStatus(TENANT);
        assertThat(status.state()).isEqualTo(RotationState.IDLE);
        assertThat(status.targetVersion()).isEqualTo(2);
        assertThat(status.rewrappedSoFar()).isEqualTo(3);
        assertThat(status.lastError()).isNull();
        assertThat(status.lastCompletedAt()).isNotNull();
    }

    @Test
    void scheduleAfterClose_shouldFail() {
        final KeyRotationWorker worker = extension.store().rotationWorker();
        worker.close();

        final CompletableFuture<RotationReport> future = worker.schedule(TENANT);

        assertThat(future).isCompletedExceptionally();
    }

    @Nested
    class UnavailableKeyCustodianTest {

        private final FlakyKeyWrapper keyWrapper = new FlakyKeyWrapper();

        @RegisterExtension
        final DocumentStoreExtension externalExtension = new DocumentStoreExtension() {
            @Override
            protected void configure(DocumentStoreBuilder builder) {
                builder.keyProvider(KeyProviderConfig.ofExternal("root-1"))
                       .keyWrapper(keyWrapper)
                       .rotation(new RotationConfig(100, 10L, 50L, 5));
            }
        };

        @Test
        void passIsRetriedUntilCustodianIsBack() throws Exception {
            final DocumentStore store = externalExtension.store();
            appendRevisions(store, 2);
            store.rotateKek(TENANT, ACTOR);
            keyWrapper.failNextUnwraps(2);

            final CompletableFuture<RotationReport> future = store.triggerRotation(TENANT);

            await().until(future::isDone);
            assertThat(future.get().rewrapped()).isEqualTo(2);
            assertThat(keyWrapper.failedUnwraps()).isEqualTo(2);
            assertThat(store.rotationStatus(TENANT).lastError()).isNull();
        }

        @Test
        void passGivesUpAfterMaxAttempts() throws Exception {
            final DocumentStore store = externalExtension.store();
            appendRevisions(store, 1);
            store.rotateKek(TENANT, ACTOR);
            keyWrapper.failNextUnwraps(Integer.MAX_VALUE);

            final CompletableFuture<RotationReport> future = store.triggerRotation(TENANT);

            await().until(future::isDone);
            assertThatThrownBy(future::get)
                    .isInstanceOf(ExecutionException.class)
                    .hasCauseInstanceOf(KeyProviderUnavailableException.class);
            assertThat(keyWrapper.failedUnwraps()).isEqualTo(5);
            assertThat(store.rotationStatus(TENANT).lastError()).contains("KeyProviderUnavailable");
        }
    }

    private static List<DocumentRevision> appendRevisions(DocumentStore store, int count) throws IOException {
        final List<DocumentRevision> revisions = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            revisions.add(append(store, newDocument(store, "Doc " + i), 1, "content " + i));
        }
        return revisions;
    }

    private static DocumentNode newDocument(DocumentStore store, String title) {
        DocumentNode root = null;
        for (DocumentNode node : store.listRoots(TENANT)) {
            root = node;
        }
        if (root == null) {
            root = store.createNode(TENANT, null, NodeKind.FOLDER, "Matters", ACTOR).value();
        }
        return store.createNode(TENANT, root.id(), NodeKind.DOCUMENT, title, ACTOR).value();
    }

    private static DocumentRevision append(DocumentStore store, DocumentNode doc, long expectedVersion,
                                           String content) throws IOException {
        return store.appendRevision(TENANT, doc.id(), expectedVersion,
                                    new ByteArrayInputStream(content.getBytes(StandardCharsets.UTF_8)),
                                    "text/plain", ACTOR).value();
    }

    private static String read(DocumentStore store, DocumentRevision revision) throws IOException {
        try (RevisionContent content = store.getRevision(TENANT, revision.documentId(),
                                                         revision.revisionNo())) {
            return new String(ByteStreams.toByteArray(content.plaintext()), StandardCharsets.UTF_8);
        }
    }

    private static final class FlakyKeyWrapper implements KeyWrapper {

        private final KeyWrapper delegate = new TestKeyWrapper();
        private final AtomicInteger unwrapFailuresLeft = new AtomicInteger();
        private final AtomicInteger failedUnwraps = new AtomicInteger();

        void failNextUnwraps(int count) {
            unwrapFailuresLeft.set(count);
        }

        int failedUnwraps() {
            return failedUnwraps.get();
        }

        @Override
        public CompletableFuture<String> wrap(byte[] kek, String rootKeyId) {
            return delegate.wrap(kek, rootKeyId);
        }

        @Override
        public CompletableFuture<byte[]> unwrap(String wrappedKek, String rootKeyId) {
            if (unwrapFailuresLeft.getAndUpdate(n -> n > 0 ? n - 1 : 0) > 0) {
                failedUnwraps.incrementAndGet();
                return CompletableFuture.failedFuture(new IOException("custodian unavailable"));
            }
            return delegate.unwrap(wrappedKek, rootKeyId);
        }
    }
}
