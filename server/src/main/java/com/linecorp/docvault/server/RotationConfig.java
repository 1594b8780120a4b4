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

import static com.google.common.base.MoreObjects.firstNonNull;
import static com.google.common.base.MoreObjects.toStringHelper;
import static com.google.common.base.Preconditions.checkArgument;

import javax.annotation.Nullable;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A configuration of the background re-wrapping of data encryption keys after a key rotation.
 */
public final class RotationConfig {

    static final int DEFAULT_BATCH_SIZE = 100;
    static final long DEFAULT_RETRY_INITIAL_DELAY_MILLIS = 1000;
    static final long DEFAULT_RETRY_MAX_DELAY_MILLIS = 60_000;
    static final int DEFAULT_MAX_ATTEMPTS = 10;

    /**
     * The configuration with the default values.
     */
    public static final RotationConfig DEFAULT = new RotationConfig(null, null, null, null);

    private final int batchSize;
    private final long retryInitialDelayMillis;
    private final long retryMaxDelayMillis;
    private final int maxAttempts;

    /**
     * Creates a new instance.
     */
    @JsonCreator
    public RotationConfig(@JsonProperty("batchSize") @Nullable Integer batchSize,
                          @JsonProperty("retryInitialDelayMillis") @Nullable Long retryInitialDelayMillis,
                          @JsonProperty("retryMaxDelayMillis") @Nullable Long retryMaxDelayMillis,
                          @JsonProperty("maxAttempts") @Nullable Integer maxAttempts) {
        this.batchSize = firstNonNull(batchSize, DEFAULT_BATCH_SIZE);
        this.retryInitialDelayMillis = firstNonNull(retryInitialDelayMillis,
                                                    DEFAULT_RETRY_INITIAL_DELAY_MILLIS);
        this.retryMaxDelayMillis = firstNonNull(retryMaxDelayMillis, DEFAULT_RETRY_MAX_DELAY_MILLIS);
        this.maxAttempts = firstNonNull(maxAttempts, DEFAULT_MAX_ATTEMPTS);
        checkArgument(this.batchSize > 0, "batchSize: %s (expected: > 0)", this.batchSize);
        checkArgument(this.retryInitialDelayMillis >= 0,
                      "retryInitialDelayMillis: %s (expected: >= 0)", this.retryInitialDelayMillis);
        checkArgument(this.retryMaxDelayMillis >= this.retryInitialDelayMillis,
                      "retryMaxDelayMillis: %s (expected: >= %s)",
                      this.retryMaxDelayMillis, this.retryInitialDelayMillis);
        checkArgument(this.maxAttempts > 0, "maxAttempts: %s (expected: > 0)", this.maxAttempts);
    }

    /**
     * Returns the maximum number of stale revisions re-wrapped per batch.
     */
    @JsonProperty
    public int batchSize() {
        return batchSize;
    }

    @JsonProperty
    public long retryInitialDelayMillis() {
        return retryInitialDelayMillis;
    }

    @JsonProperty
    public long retryMaxDelayMillis() {
        return retryMaxDelayMillis;
    }

    /**
     * Returns the maximum number of attempts of a scheduled pass whose key custodian is unavailable.
     */
    @JsonProperty
    public int maxAttempts() {
        return maxAttempts;
    }

    @Override
    public String toString() {
        return toStringHelper(this).add("batchSize", batchSize)
                                   .add("retryInitialDelayMillis", retryInitialDelayMillis)
                                   .add("retryMaxDelayMillis", retryMaxDelayMillis)
                                   .add("maxAttempts", maxAttempts)
                                   .toString();
    }
}
