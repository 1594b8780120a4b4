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
package com.linecorp.docvault.common;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import java.time.Instant;
import java.util.Objects;

import javax.annotation.Nullable;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.MoreObjects;

/**
 * A version of a tenant's key encryption key, wrapped by the root key custodian.
 *
 * <p>Exactly one version is active per tenant. Superseded versions keep their row, with
 * {@link #rotatedAt()} set, so that data encryption keys wrapped by them can still be unwrapped.
 */
@JsonInclude(Include.NON_NULL)
public final class TenantKey {

    private final String tenantId;
    private final String kekCiphertext;
    private final int kekVersion;
    private final Instant createdAt;
    @Nullable
    private final Instant rotatedAt;

    /**
     * Creates a new instance.
     */
    @JsonCreator
    public TenantKey(@JsonProperty("tenantId") String tenantId,
                     @JsonProperty("kekCiphertext") String kekCiphertext,
                     @JsonProperty("kekVersion") int kekVersion,
                     @JsonProperty("createdAt") Instant createdAt,
                     @JsonProperty("rotatedAt") @Nullable Instant rotatedAt) {
        this.tenantId = requireNonNull(tenantId, "tenantId");
        this.kekCiphertext = requireNonNull(kekCiphertext, "kekCiphertext");
        checkArgument(kekVersion > 0, "kekVersion: %s (expected: > 0)", kekVersion);
        this.kekVersion = kekVersion;
        this.createdAt = requireNonNull(createdAt, "createdAt");
        this.rotatedAt = rotatedAt;
    }

    @JsonProperty
    public String tenantId() {
        return tenantId;
    }

    /**
     * Returns the key encryption key wrapped by the root key custodian, in the custodian's own
     * encoding.
     */
    @JsonProperty
    public String kekCiphertext() {
        return kekCiphertext;
    }

    @JsonProperty
    public int kekVersion() {
        return kekVersion;
    }

    @JsonProperty
    public Instant createdAt() {
        return createdAt;
    }

    /**
     * Returns when this version was superseded, or {@code null} if it is the active version.
     */
    @Nullable
    @JsonProperty
    public Instant rotatedAt() {
        return rotatedAt;
    }

    /**
     * Returns a copy of this key marked as superseded at the specified time.
     */
    public TenantKey retired(Instant at) {
        return new TenantKey(tenantId, kekCiphertext, kekVersion, createdAt, at);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TenantKey)) {
            return false;
        }
        final TenantKey that = (TenantKey) o;
        return kekVersion == that.kekVersion &&
               tenantId.equals(that.tenantId) &&
               kekCiphertext.equals(that.kekCiphertext) &&
               createdAt.equals(that.createdAt) &&
               Objects.equals(rotatedAt, that.rotatedAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(tenantId, kekVersion);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                          .omitNullValues()
                          .add("tenantId", tenantId)
                          .add("kekCiphertext", "****")
                          .add("kekVersion", kekVersion)
                          .add("createdAt", createdAt)
                          .add("rotatedAt", rotatedAt)
                          .toString();
    }
}
