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

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

import org.junit.jupiter.api.extension.AfterEachCallback;
import org.junit.jupiter.api.extension.BeforeEachCallback;
import org.junit.jupiter.api.extension.Extension;
import org.junit.jupiter.api.extension.ExtensionContext;

import com.google.common.io.MoreFiles;
import com.google.common.io.RecursiveDeleteOption;

import com.linecorp.docvault.common.AuditEvent;
import com.linecorp.docvault.server.internal.storage.RocksDBStorage;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

/**
 * A JUnit {@link Extension} that opens a {@link DocumentStore} in a temporary directory before each test
 * and closes it after the test.
 *
 * <pre>{@code
 * > class MyTest {
 * >     @RegisterExtension
 * >     final DocumentStoreExtension extension = new DocumentStoreExtension();
 * >
 * >     @Test
 * >     void test() throws Exception {
 * >         extension.store().createNode("acme", null, NodeKind.FOLDER, "Matters", "alice");
 * >         ...
 * >     }
 * > }
 * }</pre>
 */
public class DocumentStoreExtension implements BeforeEachCallback, AfterEachCallback {

    public static final String TEST_SECRET = "test-secret";
    public static final String TEST_SALT = "test-salt";

    /**
     * Returns a local {@link KeyProviderConfig} with a cheap key derivation.
     */
    public static KeyProviderConfig localKeyProvider() {
        return new KeyProviderConfig(KeyProviderConfig.Type.LOCAL, TEST_SECRET, TEST_SALT, 1000,
                                     null, null, null);
    }

    private final List<AuditEvent> auditEvents = new CopyOnWriteArrayList<>();
    private Path dataDir;
    private SimpleMeterRegistry meterRegistry;
    private DocumentStore store;

    @Override
    public void beforeEach(ExtensionContext context) throws Exception {
        dataDir = Files.createTempDirectory("docvault");
        auditEvents.clear();
        meterRegistry = new SimpleMeterRegistry();
        store = newStore();
    }

    @Override
    public void afterEach(ExtensionContext context) throws Exception {
        try {
            if (store != null) {
                store.close();
            }
        } finally {
            MoreFiles.deleteRecursively(dataDir, RecursiveDeleteOption.ALLOW_INSECURE);
        }
    }

    /**
     * Closes the current {@link DocumentStore} and opens it again with the same data directory.
     */
    public DocumentStore reopen() {
        store.close();
        store = null;
        store = newStore();
        return store;
    }

    private DocumentStore newStore() {
        final DocumentStoreBuilder builder =
                new DocumentStoreBuilder(dataDir.toFile())
                        .keyProvider(localKeyProvider())
                        .auditSink(auditEvents::add)
                        .meterRegistry(meterRegistry);
        configure(builder);
        return builder.build();
    }

    /**
     * Override this method to customize the {@link DocumentStore}.
     */
    protected void configure(DocumentStoreBuilder builder) {}

    public DocumentStore store() {
        return store;
    }

    /**
     * Returns the underlying {@link RocksDBStorage}, for tampering with stored rows.
     */
    public RocksDBStorage storage() {
        return store.storage();
    }

    public Path dataDir() {
        return dataDir;
    }

    public SimpleMeterRegistry meterRegistry() {
        return meterRegistry;
    }

    public List<AuditEvent> auditEvents() {
        return auditEvents;
    }

    /**
     * Returns the recorded audit events of the specified action.
     */
    public List<AuditEvent> auditEvents(String action) {
        return auditEvents.stream()
                          .filter(event -> event.action().equals(action))
                          .collect(Collectors.toList());
    }
}
