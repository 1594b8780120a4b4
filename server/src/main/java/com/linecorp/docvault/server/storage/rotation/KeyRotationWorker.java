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

import static com.linecorp.docvault.server.internal.storage.TenantLocks.nodeLockKey;
import static java.util.Objects.requireNonNull;

import java.time.Instant;
import java.util.Arrays;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

import javax.annotation.Nullable;
import javax.crypto.SecretKey;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableMap;

import com.linecorp.armeria.client.retry.Backoff;
import com.linecorp.armeria.common.util.SafeCloseable;
import com.linecorp.armeria.common.util.ThreadFactories;
import com.linecorp.docvault.common.DocumentRevision;
import com.linecorp.docvault.common.KeyProviderUnavailableException;
import com.linecorp.docvault.common.UnwrapFailureException;
import com.linecorp.docvault.internal.Util;
import com.linecorp.docvault.server.RotationConfig;
import com.linecorp.docvault.server.audit.AuditActions;
import com.linecorp.docvault.server.audit.Auditor;
import com.linecorp.docvault.server.internal.storage.RevisionStorage;
import com.linecorp.docvault.server.internal.storage.RevisionStorage.StalePage;
import com.linecorp.docvault.server.internal.storage.TenantLocks;
import com.linecorp.docvault.server.storage.encryption.EnvelopeCrypto;
import com.linecorp.docvault.server.storage.encryption.KeyProvider;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.jvm.ExecutorServiceMetrics;

/**
 * Re-wraps the data encryption keys of revisions with the active key encryption key of their tenant.
 *
 * <p>A pass sweeps the revisions of a tenant in batches and re-wraps every revision whose key encryption
 * key version is older than the active one. Each revision is updated on its own, under the lock of its
 * document only, and only if nobody re-wrapped it meanwhile, so a pass may be interrupted and started
 * again at any time. The ciphertext of a revision is never read or written. A pass ends when a sweep finds
 * no stale revision. At most one pass runs per tenant at a time.
 */
public final class KeyRotationWorker implements SafeCloseable {

    private static final Logger logger = LoggerFactory.getLogger(KeyRotationWorker.class);

    private enum RowResult {
        REWRAPPED,
        SKIPPED,
        FAILED
    }

    private final RevisionStorage revisions;
    private final TenantLocks locks;
    private final KeyProvider keyProvider;
    private final EnvelopeCrypto crypto;
    private final Auditor auditor;
    private final RotationConfig config;
    private final Backoff backoff;
    private final MeterRegistry meterRegistry;
    private final ScheduledExecutorService executor;
    private final boolean shutdownExecutorOnClose;

    private final Map<String, TenantRotation> rotations = new ConcurrentHashMap<>();
    private final Map<String, CompletableFuture<RotationReport>> inflightPasses = new ConcurrentHashMap<>();

    private final Counter rewrappedCounter;
    private final Counter skippedCounter;
    private final Counter failedCounter;
    private final Timer passTimer;
    private volatile boolean closed;

    public KeyRotationWorker(RevisionStorage revisions, TenantLocks locks, KeyProvider keyProvider,
                             EnvelopeCrypto crypto, Auditor auditor, RotationConfig config,
                             MeterRegistry meterRegistry, @Nullable ScheduledExecutorService executor) {
        this.revisions = requireNonNull(revisions, "revisions");
        this.locks = requireNonNull(locks, "locks");
        this.keyProvider = requireNonNull(keyProvider, "keyProvider");
        this.crypto = requireNonNull(crypto, "crypto");
        this.auditor = requireNonNull(auditor, "auditor");
        this.config = requireNonNull(config, "config");
        this.meterRegistry = requireNonNull(meterRegistry, "meterRegistry");
        backoff = Backoff.exponential(Math.max(1, config.retryInitialDelayMillis()),
                                      Math.max(1, config.retryMaxDelayMillis()));

        if (executor != null) {
            this.executor = executor;
            shutdownExecutorOnClose = false;
        } else {
            this.executor = ExecutorServiceMetrics.monitor(
                    meterRegistry,
                    Executors.newSingleThreadScheduledExecutor(
                            ThreadFactories.newThreadFactory("docvault-rotation", true)),
                    "docvaultRotation");
            shutdownExecutorOnClose = true;
        }

        rewrappedCounter = Counter.builder("docvault.rotation.revisions")
                                  .tag("result", "rewrapped")
                                  .register(meterRegistry);
        skippedCounter = Counter.builder("docvault.rotation.revisions")
                                .tag("result", "skipped")
                                .register(meterRegistry);
        failedCounter = Counter.builder("docvault.rotation.revisions")
                               .tag("result", "failed")
                               .register(meterRegistry);
        passTimer = Timer.builder("docvault.rotation.pass")
                         .register(meterRegistry);
    }

    /**
     * Rotates the key encryption key of the specified tenant.
     *
     * @return the new active version
     */
    public int rotateKek(String tenantId, String actorId) {
        Util.validateTenantId(tenantId, "tenantId");
        requireNonNull(actorId, "actorId");
        final int newVersion = keyProvider.rotateKek(tenantId);
        auditor.emit(tenantId, actorId, AuditActions.KEK_ROTATED, tenantId,
                     ImmutableMap.of("kekVersion", newVersion));
        return newVersion;
    }

    /**
     * Rotates the key encryption key of the specified tenant and schedules a pass which re-wraps the
     * revisions with it.
     */
    public CompletableFuture<RotationReport> rotateAndRewrap(String tenantId, String actorId) {
        rotateKek(tenantId, actorId);
        return schedule(tenantId);
    }

    /**
     * Schedules a pass for the specified tenant. If the key custodian is unavailable, the pass is retried
     * with exponential backoff up to {@link RotationConfig#maxAttempts()} times. If a pass is already
     * scheduled or running, its future is returned.
     */
    public CompletableFuture<RotationReport> schedule(String tenantId) {
        Util.validateTenantId(tenantId, "tenantId");
        if (closed) {
            return CompletableFuture.failedFuture(
                    new RejectedExecutionException("rotation worker closed"));
        }
        return inflightPasses.computeIfAbsent(tenantId, key -> {
            final CompletableFuture<RotationReport> future = new CompletableFuture<>();
            // Registered before the first attempt so that the removal never runs inside computeIfAbsent().
            future.whenComplete((unused1, unused2) -> inflightPasses.remove(tenantId, future));
            submit(tenantId, 1, 0, future);
            return future;
        });
    }

    private void submit(String tenantId, int attempt, long delayMillis,
                        CompletableFuture<RotationReport> future) {
        try {
            executor.schedule(() -> runAttempt(tenantId, attempt, future), delayMillis, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            future.completeExceptionally(e);
        }
    }

    private void runAttempt(String tenantId, int attempt, CompletableFuture<RotationReport> future) {
        try {
            future.complete(runPass(tenantId));
        } catch (KeyProviderUnavailableException e) {
            if (closed || attempt >= config.maxAttempts()) {
                future.completeExceptionally(e);
                return;
            }
            final long delayMillis = backoff.nextDelayMillis(attempt);
            logger.warn("Key custodian unavailable during the rotation pass of {}; retrying in {} ms " +
                        "(attempt {}/{})", tenantId, delayMillis, attempt, config.maxAttempts(), e);
            submit(tenantId, attempt + 1, delayMillis, future);
        } catch (Throwable t) {
            future.completeExceptionally(t);
        }
    }

    /**
     * Runs a pass for the specified tenant in the calling thread. Blocks while another pass of the tenant
     * is running.
     *
     * @throws KeyProviderUnavailableException if the key custodian could not be reached. The pass may be
     *                                         run again later and resumes where it left off.
     * @throws CancellationException if the calling thread was interrupted
     */
    public RotationReport runPass(String tenantId) {
        Util.validateTenantId(tenantId, "tenantId");
        final TenantRotation rotation = rotations.computeIfAbsent(tenantId, TenantRotation::new);
        rotation.passLock.lock();
        try {
            return runPass(rotation);
        } finally {
            rotation.passLock.unlock();
        }
    }

    private RotationReport runPass(TenantRotation rotation) {
        final String tenantId = rotation.tenantId;
        final Timer.Sample sample = Timer.start(meterRegistry);
        final Set<String> failedIds = new HashSet<>();
        long rewrapped = 0;
        long skipped = 0;
        int batches = 0;
        int targetVersion = 0;
        try {
            targetVersion = keyProvider.getActiveKek(tenantId).version();
            rotation.start(targetVersion);
            for (;;) {
                final SecretKey targetKek = keyProvider.getKekByVersion(tenantId, targetVersion);
                long staleInSweep = 0;
                byte[] cursor = null;
                do {
                    rotation.state = RotationState.SCANNING;
                    final StalePage page = revisions.scanStale(tenantId, targetVersion, cursor,
                                                               config.batchSize(), failedIds);
                    cursor = page.nextCursor();
                    if (page.revisions().isEmpty()) {
                        continue;
                    }

                    batches++;
                    rotation.state = RotationState.REWRAPPING;
                    for (DocumentRevision revision : page.revisions()) {
                        if (Thread.currentThread().isInterrupted()) {
                            throw new CancellationException("rotation pass of " + tenantId + " interrupted");
                        }
                        staleInSweep++;
                        switch (rewrap(revision, targetKek, targetVersion)) {
                            case REWRAPPED:
                                rewrapped++;
                                rotation.rewrapped.incrementAndGet();
                                rewrappedCounter.increment();
                                break;
                            case SKIPPED:
                                skipped++;
                                skippedCounter.increment();
                                break;
                            case FAILED:
                                failedIds.add(revision.id());
                                failedCounter.increment();
                                break;
                        }
                    }
                } while (cursor != null);

                if (staleInSweep == 0) {
                    break;
                }
                // Sweep again. The key may have been rotated again, or revisions written with an older key
                // may have been committed behind the cursor.
                final int activeVersion = keyProvider.getActiveKek(tenantId).version();
                if (activeVersion != targetVersion) {
                    targetVersion = activeVersion;
                    rotation.targetVersion = activeVersion;
                }
            }
        } catch (RuntimeException e) {
            rotation.fail(e);
            throw e;
        } finally {
            sample.stop(passTimer);
        }

        final RotationReport report = new RotationReport(tenantId, targetVersion, rewrapped, skipped,
                                                         failedIds.size(), batches);
        rotation.complete(Instant.now());
        if (rewrapped > 0 || !failedIds.isEmpty()) {
            logger.info("Completed the rotation pass of {}: {}", tenantId, report);
        }
        auditor.emit(tenantId, AuditActions.SYSTEM_ACTOR, AuditActions.ROTATION_COMPLETED, tenantId,
                     ImmutableMap.of("kekVersion", targetVersion,
                                     "rewrapped", rewrapped,
                                     "skipped", skipped,
                                     "failed", failedIds.size()));
        return report;
    }

    private RowResult rewrap(DocumentRevision revision, SecretKey targetKek, int targetVersion) {
        final String tenantId = revision.tenantId();
        final byte[] rewrapped;
        try {
            final SecretKey oldKek = keyProvider.getKekByVersion(tenantId, revision.kekVersion());
            final byte[] dek = crypto.unwrapDek(revision.dekCiphertext(), oldKek);
            try {
                rewrapped = crypto.wrapDek(dek, targetKek);
            } finally {
                Arrays.fill(dek, (byte) 0);
            }
        } catch (UnwrapFailureException e) {
            logger.warn("Failed to unwrap the data encryption key of revision {} of {}/{}; leaving it as is",
                        revision.revisionNo(), tenantId, revision.documentId(), e);
            auditor.emit(tenantId, AuditActions.SYSTEM_ACTOR, AuditActions.UNWRAP_FAILURE,
                         revision.documentId(),
                         ImmutableMap.of("revisionNo", revision.revisionNo(),
                                         "kekVersion", revision.kekVersion(),
                                         "reason", String.valueOf(e.getMessage())));
            return RowResult.FAILED;
        }

        try (SafeCloseable ignored = locks.lockRows(tenantId, nodeLockKey(tenantId, revision.documentId()))) {
            final DocumentRevision current = revisions.revision(tenantId, revision.documentId(),
                                                                revision.revisionNo(), null);
            if (current == null || !current.id().equals(revision.id()) ||
                current.kekVersion() != revision.kekVersion()) {
                return RowResult.SKIPPED;
            }
            revisions.updateRevision(current.withWrappedDek(rewrapped, targetVersion));
        }
        return RowResult.REWRAPPED;
    }

    /**
     * Returns the state of the re-wrapping of the specified tenant.
     */
    public RotationStatus status(String tenantId) {
        Util.validateTenantId(tenantId, "tenantId");
        final TenantRotation rotation = rotations.get(tenantId);
        if (rotation == null) {
            return new RotationStatus(tenantId, RotationState.IDLE, 0, 0, null, null);
        }
        return rotation.status();
    }

    @Override
    public void close() {
        closed = true;
        inflightPasses.values().forEach(future -> future.cancel(false));
        if (shutdownExecutorOnClose) {
            final boolean interrupted = terminate(executor);
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private static boolean terminate(ScheduledExecutorService executor) {
        boolean interrupted = false;
        for (;;) {
            executor.shutdownNow();
            try {
                if (executor.awaitTermination(1, TimeUnit.MINUTES)) {
                    break;
                }
            } catch (InterruptedException e) {
                // Propagate later.
                interrupted = true;
            }
        }
        return interrupted;
    }

    private static final class TenantRotation {
        final String tenantId;
        final ReentrantLock passLock = new ReentrantLock();
        final AtomicLong rewrapped = new AtomicLong();
        volatile RotationState state = RotationState.IDLE;
        volatile int targetVersion;
        @Nullable
        volatile String lastError;
        @Nullable
        volatile Instant lastCompletedAt;

        TenantRotation(String tenantId) {
            this.tenantId = tenantId;
        }

        void start(int targetVersion) {
            this.targetVersion = targetVersion;
            rewrapped.set(0);
            state = RotationState.SCANNING;
        }

        void fail(Throwable cause) {
            lastError = cause.toString();
            state = RotationState.IDLE;
        }

        void complete(Instant at) {
            lastError = null;
            lastCompletedAt = at;
            state = RotationState.IDLE;
        }

        RotationStatus status() {
            return new RotationStatus(tenantId, state, targetVersion, rewrapped.get(), lastError,
                                      lastCompletedAt);
        }
    }
}
