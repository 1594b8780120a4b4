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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.RegisterExtension;
import org.junit.jupiter.api.io.TempDir;

import com.google.common.io.ByteStreams;
import com.google.common.io.MoreFiles;

import com.linecorp.docvault.common.AuditEvent;
import com.linecorp.docvault.common.DocumentNode;
import com.linecorp.docvault.common.DocumentRevision;
import com.linecorp.docvault.common.NodeKind;
import com.linecorp.docvault.server.audit.AuditActions;
import com.linecorp.docvault.server.internal.storage.encryption.ExternalKeyProvider;
import com.linecorp.docvault.server.internal.storage.encryption.LocalKeyProvider;
import com.linecorp.docvault.server.storage.revision.RevisionContent;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

class DocumentStoreTest {

    private static final String TENANT = "acme";
    private static final String ACTOR = "alice";

    @RegisterExtension
    final DocumentStoreExtension extension = new DocumentStoreExtension();

    @TempDir
    Path tempDir;

    @Test
    void intakeScenario() throws Exception {
        final DocumentStore store = extension.store();
        final DocumentNode matters = store.createNode(TENANT, null, NodeKind.FOLDER, "Matters", ACTOR).value();
        final DocumentNode intake =
                store.createNode(TENANT, matters.id(), NodeKind.DOCUMENT, "intake.md", ACTOR).value();

        final DocumentRevision revision = store.appendRevision(
                TENANT, intake.id(), intake.version(),
                new ByteArrayInputStream("# New matter\n".getBytes(StandardCharsets.UTF_8)),
                "text/markdown", ACTOR).value();

        assertThat(revision.revisionNo()).isOne();
        try (RevisionContent content = store.getLatestRevision(TENANT, intake.id())) {
            assertThat(content.revision()).isEqualTo(revision);
            assertThat(new String(ByteStreams.toByteArray(content.plaintext()), StandardCharsets.UTF_8))
                    .isEqualTo("# New matter\n");
        }
        assertThat(store.listChildren(TENANT, matters.id()))
                .extracting(DocumentNode::slug)
                .containsExactly("intake-md");

        // Nothing in the data directory holds the plaintext.
        for (Path file : MoreFiles.fileTraverser().depthFirstPreOrder(extension.dataDir())) {
            if (Files.isRegularFile(file)) {
                assertThat(new String(Files.readAllBytes(file), StandardCharsets.ISO_8859_1))
                        .doesNotContain("New matter");
            }
        }

        assertThat(extension.auditEvents()).extracting(AuditEvent::action)
                                           .containsExactly(AuditActions.NODE_CREATED,
                                                            AuditActions.NODE_CREATED,
                                                            AuditActions.REVISION_APPENDED);
    }

    @Test
    void builderRequiresKeyProvider() {
        assertThatThrownBy(() -> new DocumentStoreBuilder(tempDir.toFile()).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("keyProvider");
        assertThatThrownBy(() -> new DocumentStoreBuilder(tempDir.toFile()).chunkSize(0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void builderRejectsFileAsDataDir() throws Exception {
        final Path file = Files.createFile(tempDir.resolve("not-a-dir"));
        assertThatThrownBy(() -> new DocumentStoreBuilder(file.toFile()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not a directory");
    }

    @Test
    void keyProviderIsSelectedByConfig() {
        assertThat(extension.store().keyProvider()).isInstanceOf(LocalKeyProvider.class);

        // The external key provider finds TestKeyWrapper via ServiceLoader.
        try (DocumentStore store = new DocumentStoreBuilder(tempDir.resolve("external").toFile())
                .keyProvider(KeyProviderConfig.ofExternal("root-1"))
                .meterRegistry(new SimpleMeterRegistry())
                .build()) {
            assertThat(store.keyProvider()).isInstanceOf(ExternalKeyProvider.class);
            assertThat(store.keyProvider().getActiveKek(TENANT).version()).isOne();
        }
    }

    @Test
    void suppliedRotationExecutorIsNotShutDown() throws Exception {
        final ScheduledExecutorService executor = Executors.newSingleThreadScheduledExecutor();
        try {
            try (DocumentStore store = new DocumentStoreBuilder(tempDir.resolve("data").toFile())
                    .keyProvider(DocumentStoreExtension.localKeyProvider())
                    .meterRegistry(new SimpleMeterRegistry())
                    .rotationExecutor(executor)
                    .build()) {
                store.rotateKek(TENANT, ACTOR);
                assertThat(store.triggerRotation(TENANT).get(10, TimeUnit.SECONDS).targetVersion())
                        .isEqualTo(2);
            }
            assertThat(executor.isShutdown()).isFalse();
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void kekVersionsPerTenant() {
        final DocumentStore store = extension.store();
        store.rotateKek("acme", ACTOR);
        store.rotateKek("acme", ACTOR);
        store.rotateKek("globex", ACTOR);

        assertThat(store.kekVersions("acme")).hasSize(3);
        assertThat(store.kekVersions("globex")).hasSize(2);
        assertThat(store.kekVersions("initech")).isEmpty();
    }
}
