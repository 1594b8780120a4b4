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

import static java.util.Objects.requireNonNull;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableMap;

/**
 * A structured record of something that happened to a tenant's tree or keys. Events are write-only
 * from the point of view of the store. They never carry plaintext or key material.
 */
public final class AuditEvent {

    /**
     * Returns a new event with a random ID, created now.
     */
    public static AuditEvent of(String tenantId, String actorId, String action, String targetId,
                                Map<String, ?> payload) {
        final ImmutableMap.Builder<String, String> builder = ImmutableMap.builder();
        requireNonNull(payload, "payload").forEach((k, v) -> builder.put(k, String.valueOf(v)));
        return new AuditEvent(UUID.randomUUID().toString(), tenantId, actorId, action, targetId,
                              builder.build(), Instant.now());
    }

    private final String id;
    private final String tenantId;
    private final String actorId;
    private final String action;
    private final String targetId;
    private final Map<String, String> payload;
    private final Instant createdAt;

    /**
     * Creates a new instance.
     */
    @JsonCreator
    public AuditEvent(@JsonProperty("id") String id,
                      @JsonProperty("tenantId") String tenantId,
                      @JsonProperty("actorId") String actorId,
                      @JsonProperty("action") String action,
                      @JsonProperty("targetId") String targetId,
                      @JsonProperty("payload") Map<String, String> payload,
                      @JsonProperty("createdAt") Instant createdAt) {
        this.id = requireNonNull(id, "id");
        this.tenantId = requireNonNull(tenantId, "tenantId");
        this.actorId = requireNonNull(actorId, "actorId");
        this.action = requireNonNull(action, "action");
        this.targetId = requireNonNull(targetId, "targetId");
        this.payload = ImmutableMap.copyOf(requireNonNull(payload, "payload"));
        this.createdAt = requireNonNull(createdAt, "createdAt");
    }

    @JsonProperty
    public String id() {
        return id;
    }

    @JsonProperty
    public String tenantId() {
        return tenantId;
    }

    @JsonProperty
    public String actorId() {
        return actorId;
    }

    @JsonProperty
    public String action() {
        return action;
    }

    /**
     * Returns the ID of the node, revision or key version this event is about.
     */
    @JsonProperty
    public String targetId() {
        return targetId;
    }

    @JsonProperty
    public Map<String, String> payload() {
        return payload;
    }

    @JsonProperty
    public Instant createdAt() {
        return createdAt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof AuditEvent)) {
            return false;
        }
        final AuditEvent that = (AuditEvent) o;
        return id.equals(that.id) &&
               tenantId.equals(that.tenantId) &&
               actorId.equals(that.actorId) &&
               action.equals(that.action) &&
               targetId.equals(that.targetId) &&
               payload.equals(that.payload) &&
               createdAt.equals(that.createdAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                          .add("id", id)
                          .add("tenantId", tenantId)
                          .add("actorId", actorId)
                          .add("action", action)
                          .add("targetId", targetId)
                          .add("payload", payload)
                          .add("createdAt", createdAt)
                          .toString();
    }
}
