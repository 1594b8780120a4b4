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

import com.google.common.base.MoreObjects;

/**
 * The outcome of a completed re-wrapping pass.
 */
public final class RotationReport {

    private final String tenantId;
    private final int targetVersion;
    private final long rewrapped;
    private final long skipped;
    private final long failed;
    private final int batches;

    RotationReport(String tenantId, int targetVersion, long rewrapped, long skipped, long failed,
                   int batches) {
        this.tenantId = requireNonNull(tenantId, "tenantId");
        this.targetVersion = targetVersion;
        this.rewrapped = rewrapped;
        this.skipped = skipped;
        this.failed = failed;
        this.batches = batches;
    }

    public String tenantId() {
        return tenantId;
    }

    /**
     * Returns the key encryption key version every revision was re-wrapped with.
     */
    public int targetVersion() {
        return targetVersion;
    }

    public long rewrapped() {
        return rewrapped;
    }

    /**
     * Returns the number of stale revisions which were re-wrapped or deleted by someone else meanwhile.
     */
    public long skipped() {
        return skipped;
    }

    /**
     * Returns the number of revisions whose data encryption key could not be unwrapped. They are left
     * as they are.
     */
    public long failed() {
        return failed;
    }

    public int batches() {
        return batches;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                          .add("tenantId", tenantId)
                          .add("targetVersion", targetVersion)
                          .add("rewrapped", rewrapped)
                          .add("skipped", skipped)
                          .add("failed", failed)
                          .add("batches", batches)
                          .toString();
    }
}
