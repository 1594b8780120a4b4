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

import static java.util.Objects.requireNonNull;

import java.time.Instant;

import javax.annotation.Nullable;

import com.google.common.base.MoreObjects;

/**
 * A point-in-time view of the re-wrapping of a tenant.
 */
public final class RotationStatus {

    private final String tenantId;
    private final RotationState state;
    private final int targetVersion;
    private final long rewrappedSoFar;
    @Nullable
    private final String lastError;
    @Nullable
    private final Instant lastCompletedAt;

    RotationStatus(String tenantId, RotationState state, int targetVersion, long rewrappedSoFar,
                   @Nullable String lastError, @Nullable Instant lastCompletedAt) {
        this.tenantId = requireNonNull(tenantId, "tenantId");
        this.state = requireNonNull(state, "state");
        this.targetVersion = targetVersion;
        this.rewrappedSoFar = rewrappedSoFar;
        this.lastError = lastError;
        this.lastCompletedAt = lastCompletedAt;
    }

    public String tenantId() {
        return tenantId;
    }

    public RotationState state() {
        return state;
    }

    /**
     * Returns the key encryption key version of the current or last pass, or {@code 0} if no pass has run.
     */
    public int targetVersion() {
        return targetVersion;
    }

    /**
     * Returns the number of revisions re-wrapped by the current or last pass.
     */
    public long rewrappedSoFar() {
        return rewrappedSoFar;
    }

    /**
     * Returns the error which ended the last pass, or {@code null} if it succeeded.
     */
    @Nullable
    public String lastError() {
        return lastError;
    }

    @Nullable
    public Instant lastCompletedAt() {
        return lastCompletedAt;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                          .omitNullValues()
                          .add("tenantId", tenantId)
                          .add("state", state)
                          .add("targetVersion", targetVersion)
                          .add("rewrappedSoFar", rewrappedSoFar)
                          .add("lastError", lastError)
                          .add("lastCompletedAt", lastCompletedAt)
                          .toString();
    }
}
