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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import java.io.File;
import java.util.concurrent.ScheduledExecutorService;

import javax.annotation.Nullable;

import com.linecorp.armeria.common.Flags;
import com.linecorp.docvault.server.audit.AuditSink;
import com.linecorp.docvault.server.storage.encryption.EnvelopeCrypto;
import com.linecorp.docvault.server.storage.encryption.KeyWrapper;

import io.micrometer.core.instrument.MeterRegistry;

/**
 * Builds a new {@link DocumentStore}.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * DocumentStore store = new DocumentStoreBuilder(new File("/var/lib/docvault"))
 *         .keyProvider(KeyProviderConfig.ofLocal("env:DOCVAULT_SECRET", "file:/etc/docvault/salt"))
 *         .auditSink(event -> auditLog.append(event))
 *         .build();
 * }</pre>
 */
public final class DocumentStoreBuilder {

    private final File dataDir;
    private int chunkSize = EnvelopeCrypto.DEFAULT_CHUNK_SIZE;
    @Nullable
    private KeyProviderConfig keyProviderConfig;
    private RotationConfig rotationConfig = RotationConfig.DEFAULT;

    @Nullable
    private KeyWrapper keyWrapper;
    private AuditSink auditSink = AuditSink.ofLogger();
    private MeterRegistry meterRegistry = Flags.meterRegistry();
    @Nullable
    private ScheduledExecutorService rotationExecutor;

    /**
     * Creates a new builder with the specified data directory.
     */
    public DocumentStoreBuilder(File dataDir) {
        this.dataDir = requireNonNull(dataDir, "dataDir");
        if (dataDir.exists() && !dataDir.isDirectory()) {
            throw new IllegalArgumentException("dataDir: " + dataDir + " (not a directory)");
        }
    }

    /**
     * Sets the number of plaintext bytes sealed per chunk of a new revision. Existing revisions keep the
     * chunk size they were written with. If unspecified, {@value EnvelopeCrypto#DEFAULT_CHUNK_SIZE} is used.
     */
    public DocumentStoreBuilder chunkSize(int chunkSize) {
        checkArgument(chunkSize > 0, "chunkSize: %s (expected: > 0)", chunkSize);
        this.chunkSize = chunkSize;
        return this;
    }

    /**
     * Sets the configuration of the custodian of the tenant keys. It must be specified.
     */
    public DocumentStoreBuilder keyProvider(KeyProviderConfig keyProviderConfig) {
        this.keyProviderConfig = requireNonNull(keyProviderConfig, "keyProviderConfig");
        return this;
    }

    public DocumentStoreBuilder rotation(RotationConfig rotationConfig) {
        this.rotationConfig = requireNonNull(rotationConfig, "rotationConfig");
        return this;
    }

    /**
     * Sets the {@link KeyWrapper} used by an {@linkplain KeyProviderConfig.Type#EXTERNAL external} key
     * provider. If unspecified, the only implementation found via {@link java.util.ServiceLoader} is used.
     */
    public DocumentStoreBuilder keyWrapper(KeyWrapper keyWrapper) {
        this.keyWrapper = requireNonNull(keyWrapper, "keyWrapper");
        return this;
    }

    /**
     * Sets the {@link AuditSink} that receives the audit events. If unspecified, the events are written to
     * the {@code docvault.audit} logger.
     */
    public DocumentStoreBuilder auditSink(AuditSink auditSink) {
        this.auditSink = requireNonNull(auditSink, "auditSink");
        return this;
    }

    public DocumentStoreBuilder meterRegistry(MeterRegistry meterRegistry) {
        this.meterRegistry = requireNonNull(meterRegistry, "meterRegistry");
        return this;
    }

    /**
     * Sets the executor that runs scheduled key rotation passes. It is not shut down when the store is
     * closed. If unspecified, the store creates and owns a single-threaded executor.
     */
    public DocumentStoreBuilder rotationExecutor(ScheduledExecutorService rotationExecutor) {
        this.rotationExecutor = requireNonNull(rotationExecutor, "rotationExecutor");
        return this;
    }

    /**
     * Returns a newly-created {@link DocumentStore} opened with the properties set so far.
     */
    public DocumentStore build() {
        return new DocumentStore(buildConfig(), keyWrapper, auditSink, meterRegistry, rotationExecutor);
    }

    DocumentStoreConfig buildConfig() {
        checkArgument(keyProviderConfig != null, "keyProvider must be specified.");
        return new DocumentStoreConfig(dataDir, chunkSize, keyProviderConfig, rotationConfig);
    }
}
