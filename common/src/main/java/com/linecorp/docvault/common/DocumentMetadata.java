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
import java.util.List;
import java.util.Objects;

import javax.annotation.Nullable;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;

/**
 * Mutable, non-secret properties of a document. Its {@link #version()} is independent of the version of
 * the {@link DocumentNode}, so tagging a document never creates a revision or conflicts with a writer.
 */
@JsonInclude(Include.NON_NULL)
public final class DocumentMetadata {

    /**
     * Returns the initial metadata of a newly created document.
     */
    public static DocumentMetadata of(String tenantId, String documentId, Instant createdAt) {
        return new DocumentMetadata(documentId, tenantId, ImmutableList.of(), false, false, 1,
                                    null, createdAt);
    }

    private final String documentId;
    private final String tenantId;
    private final List<String> tags;
    private final boolean published;
    private final boolean favorited;
    private final long version;
    @Nullable
    private final Instant lastIndexedAt;
    private final Instant updatedAt;

    /**
     * Creates a new instance.
     */
    @JsonCreator
    public DocumentMetadata(@JsonProperty("documentId") String documentId,
                            @JsonProperty("tenantId") String tenantId,
                            @JsonProperty("tags") @Nullable List<String> tags,
                            @JsonProperty("published") boolean published,
                            @JsonProperty("favorited") boolean favorited,
                            @JsonProperty("version") long version,
                            @JsonProperty("lastIndexedAt") @Nullable Instant lastIndexedAt,
                            @JsonProperty("updatedAt") Instant updatedAt) {
        this.documentId = requireNonNull(documentId, "documentId");
        this.tenantId = requireNonNull(tenantId, "tenantId");
        this.tags = tags != null ? ImmutableList.copyOf(tags) : ImmutableList.of();
        this.published = published;
        this.favorited = favorited;
        checkArgument(version > 0, "version: %s (expected: > 0)", version);
        this.version = version;
        this.lastIndexedAt = lastIndexedAt;
        this.updatedAt = requireNonNull(updatedAt, "updatedAt");
    }

    @JsonProperty
    public String documentId() {
        return documentId;
    }

    @JsonProperty
    public String tenantId() {
        return tenantId;
    }

    @JsonProperty
    public List<String> tags() {
        return tags;
    }

    @JsonProperty
    public boolean published() {
        return published;
    }

    @JsonProperty
    public boolean favorited() {
        return favorited;
    }

    @JsonProperty
    public long version() {
        return version;
    }

    /**
     * Returns when the document was last indexed, or {@code null} if it never was.
     */
    @Nullable
    @JsonProperty
    public Instant lastIndexedAt() {
        return lastIndexedAt;
    }

    @JsonProperty
    public Instant updatedAt() {
        return updatedAt;
    }

    /**
     * Returns a copy of this metadata with the specified properties replaced and the next version.
     * {@code null} arguments keep the current values.
     */
    public DocumentMetadata updated(@Nullable List<String> tags, @Nullable Boolean published,
                                    @Nullable Boolean favorited, Instant at) {
        return new DocumentMetadata(documentId, tenantId,
                                    tags != null ? tags : this.tags,
                                    published != null ? published : this.published,
                                    favorited != null ? favorited : this.favorited,
                                    version + 1, lastIndexedAt, at);
    }

    /**
     * Returns a copy of this metadata with the specified indexing time. The version is left unchanged.
     */
    public DocumentMetadata indexed(Instant at) {
        return new DocumentMetadata(documentId, tenantId, tags, published, favorited, version, at,
                                    updatedAt);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DocumentMetadata)) {
            return false;
        }
        final DocumentMetadata that = (DocumentMetadata) o;
        return published == that.published &&
               favorited == that.favorited &&
               version == that.version &&
               documentId.equals(that.documentId) &&
               tenantId.equals(that.tenantId) &&
               tags.equals(that.tags) &&
               Objects.equals(lastIndexedAt, that.lastIndexedAt) &&
               updatedAt.equals(that.updatedAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(documentId, version);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                          .omitNullValues()
                          .add("documentId", documentId)
                          .add("tenantId", tenantId)
                          .add("tags", tags)
                          .add("published", published)
                          .add("favorited", favorited)
                          .add("version", version)
                          .add("lastIndexedAt", lastIndexedAt)
                          .toString();
    }
}
