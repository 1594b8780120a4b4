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
import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import javax.annotation.Nullable;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.MoreObjects;

import com.linecorp.docvault.server.internal.storage.encryption.AbstractKeyProvider;
import com.linecorp.docvault.server.internal.storage.encryption.ExternalKeyProvider;
import com.linecorp.docvault.server.internal.storage.encryption.LocalKeyProvider;

/**
 * A configuration of the custodian of the tenant key encryption keys.
 */
public final class KeyProviderConfig {

    /**
     * The kind of the root key custodian.
     */
    public enum Type {
        /**
         * The root key is derived from a secret in the configuration.
         */
        @JsonProperty("local")
        LOCAL,
        /**
         * The root key never leaves an external custodian, reached through a
         * {@link com.linecorp.docvault.server.storage.encryption.KeyWrapper}.
         */
        @JsonProperty("external")
        EXTERNAL
    }

    /**
     * Returns a configuration of a local key provider.
     */
    public static KeyProviderConfig ofLocal(String secret, String salt) {
        return new KeyProviderConfig(Type.LOCAL, secret, salt, null, null, null, null);
    }

    /**
     * Returns a configuration of an external key provider.
     */
    public static KeyProviderConfig ofExternal(String kekId) {
        return new KeyProviderConfig(Type.EXTERNAL, null, null, null, kekId, null, null);
    }

    private final Type type;
    @Nullable
    private final String secret;
    @Nullable
    private final String salt;
    private final int kdfIterations;
    @Nullable
    private final String kekId;
    private final long unwrapTimeoutMillis;
    private final String kekCacheSpec;

    /**
     * Creates a new instance.
     */
    @JsonCreator
    public KeyProviderConfig(@JsonProperty("type") @Nullable Type type,
                             @JsonProperty("secret") @Nullable String secret,
                             @JsonProperty("salt") @Nullable String salt,
                             @JsonProperty("kdfIterations") @Nullable Integer kdfIterations,
                             @JsonProperty("kekId") @Nullable String kekId,
                             @JsonProperty("unwrapTimeoutMillis") @Nullable Long unwrapTimeoutMillis,
                             @JsonProperty("kekCacheSpec") @Nullable String kekCacheSpec) {
        this.type = firstNonNull(type, Type.LOCAL);
        this.secret = DocumentStoreConfig.convertValue(secret, "keyProvider.secret");
        this.salt = DocumentStoreConfig.convertValue(salt, "keyProvider.salt");
        this.kdfIterations = firstNonNull(kdfIterations, LocalKeyProvider.DEFAULT_KDF_ITERATIONS);
        this.kekId = kekId;
        this.unwrapTimeoutMillis = firstNonNull(unwrapTimeoutMillis,
                                                ExternalKeyProvider.DEFAULT_TIMEOUT_MILLIS);
        this.kekCacheSpec = firstNonNull(kekCacheSpec, AbstractKeyProvider.DEFAULT_KEK_CACHE_SPEC);

        if (this.type == Type.LOCAL) {
            requireNonNull(this.secret, "secret");
            requireNonNull(this.salt, "salt");
        } else {
            requireNonNull(kekId, "kekId");
        }
        checkArgument(this.kdfIterations > 0, "kdfIterations: %s (expected: > 0)", this.kdfIterations);
        checkArgument(this.unwrapTimeoutMillis > 0,
                      "unwrapTimeoutMillis: %s (expected: > 0)", this.unwrapTimeoutMillis);
    }

    @JsonProperty
    public Type type() {
        return type;
    }

    /**
     * Returns the secret from which the local root key is derived.
     */
    @Nullable
    public String secret() {
        return secret;
    }

    @Nullable
    public String salt() {
        return salt;
    }

    @JsonProperty
    public int kdfIterations() {
        return kdfIterations;
    }

    /**
     * Returns the ID of the root key of the external custodian.
     */
    @Nullable
    @JsonProperty
    public String kekId() {
        return kekId;
    }

    @JsonProperty
    public long unwrapTimeoutMillis() {
        return unwrapTimeoutMillis;
    }

    /**
     * Returns the Caffeine specification of the cache of unwrapped key encryption keys.
     */
    @JsonProperty
    public String kekCacheSpec() {
        return kekCacheSpec;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                          .omitNullValues()
                          .add("type", type)
                          .add("secret", secret != null ? "****" : null)
                          .add("salt", salt != null ? "****" : null)
                          .add("kdfIterations", kdfIterations)
                          .add("kekId", kekId)
                          .add("unwrapTimeoutMillis", unwrapTimeoutMillis)
                          .add("kekCacheSpec", kekCacheSpec)
                          .toString();
    }
}
