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
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;

/**
 * A folder or document in a tenant's tree.
 *
 * <p>Nodes never refer to each other directly. The {@link #path()} is the list of ancestor IDs from
 * the tenant root down to this node, ending with the node's own ID, so that subtree membership is
 * answered by a prefix test rather than a traversal.
 */
@JsonInclude(Include.NON_NULL)
public final class DocumentNode {

    /**
     * Returns a newly created node whose version is {@code 1}.
     */
    public static DocumentNode of(String tenantId, String id, @Nullable DocumentNode parent, NodeKind kind,
                                  String title, String slug, Instant createdAt) {
        requireNonNull(tenantId, "tenantId");
        checkArgument(parent == null || tenantId.equals(parent.tenantId()),
                      "parent belongs to another tenant: %s", parent);
        final List<String> path = parent == null ? ImmutableList.of(id)
                                                 : ImmutableList.<String>builder()
                                                                .addAll(parent.path())
                                                                .add(id)
                                                                .build();
        return new DocumentNode(id, parent != null ? parent.id() : null, path, kind, title, slug,
                                tenantId, 1, false, createdAt, createdAt);
    }

    private final String id;
    @Nullable
    private final String parentId;
    private final List<String> path;
    private final NodeKind kind;
    private final String title;
    private final String slug;
    private final String tenantId;
    private final long version;
    private final boolean archived;
    private final Instant createdAt;
    private final Instant updatedAt;

    /**
     * Creates a new instance.
     */
    @JsonCreator
    public DocumentNode(@JsonProperty("id") String id,
                        @JsonProperty("parentId") @Nullable String parentId,
                        @JsonProperty("path") List<String> path,
                        @JsonProperty("kind") NodeKind kind,
                        @JsonProperty("title") String title,
                        @JsonProperty("slug") String slug,
                        @JsonProperty("tenantId") String tenantId,
                        @JsonProperty("version") long version,
                        @JsonProperty("archived") boolean archived,
                        @JsonProperty("createdAt") Instant createdAt,
                        @JsonProperty("updatedAt") Instant updatedAt) {
        this.id = requireNonNull(id, "id");
        this.parentId = parentId;
        this.path = ImmutableList.copyOf(requireNonNull(path, "path"));
        checkArgument(!this.path.isEmpty() && id.equals(Iterables.getLast(this.path)),
                      "path: %s (expected: ends with %s)", path, id);
        checkArgument(parentId == null ? this.path.size() == 1
                                       : this.path.size() >= 2 &&
                                         parentId.equals(this.path.get(this.path.size() - 2)),
                      "path: %s (expected: ends with parentId %s)", path, parentId);
        this.kind = requireNonNull(kind, "kind");
        this.title = requireNonNull(title, "title");
        this.slug = requireNonNull(slug, "slug");
        this.tenantId = requireNonNull(tenantId, "tenantId");
        checkArgument(version > 0, "version: %s (expected: > 0)", version);
        this.version = version;
        this.archived = archived;
        this.createdAt = requireNonNull(createdAt, "createdAt");
        this.updatedAt = requireNonNull(updatedAt, "updatedAt");
    }

    /**
     * Returns the ID of this node.
     */
    @JsonProperty
    public String id() {
        return id;
    }

    /**
     * Returns the ID of the parent folder, or {@code null} if this node is a tenant root.
     */
    @Nullable
    @JsonProperty
    public String parentId() {
        return parentId;
    }

    /**
     * Returns the IDs of the ancestors of this node, root first, followed by the ID of this node.
     */
    @JsonProperty
    public List<String> path() {
        return path;
    }

    @JsonProperty
    public NodeKind kind() {
        return kind;
    }

    @JsonProperty
    public String title() {
        return title;
    }

    /**
     * Returns the URL-safe name of this node, unique among its siblings.
     */
    @JsonProperty
    public String slug() {
        return slug;
    }

    @JsonProperty
    public String tenantId() {
        return tenantId;
    }

    /**
     * Returns the optimistic-concurrency version of this node. Every mutation of this node, including
     * appending a revision to a document, increments it by one.
     */
    @JsonProperty
    public long version() {
        return version;
    }

    @JsonProperty
    public boolean archived() {
        return archived;
    }

    @JsonProperty
    public Instant createdAt() {
        return createdAt;
    }

    @JsonProperty
    public Instant updatedAt() {
        return updatedAt;
    }

    /**
     * Returns whether this node is a folder.
     */
    @JsonIgnore
    public boolean isFolder() {
        return kind == NodeKind.FOLDER;
    }

    /**
     * Returns {@code true} if this node is the specified node or one of its descendants.
     */
    public boolean isSelfOrDescendantOf(DocumentNode node) {
        requireNonNull(node, "node");
        final List<String> prefix = node.path();
        return path.size() >= prefix.size() && path.subList(0, prefix.size()).equals(prefix);
    }

    /**
     * Returns a copy of this node with the specified title and slug and the next version.
     */
    public DocumentNode renamed(String title, String slug, Instant at) {
        return new DocumentNode(id, parentId, path, kind, title, slug, tenantId, version + 1,
                                archived, createdAt, at);
    }

    /**
     * Returns a copy of this node placed under the specified parent, with the next version.
     */
    public DocumentNode moved(@Nullable String parentId, List<String> path, String slug, Instant at) {
        return new DocumentNode(id, parentId, path, kind, title, slug, tenantId, version + 1,
                                archived, createdAt, at);
    }

    /**
     * Returns a copy of this node whose path was re-derived because one of its ancestors moved.
     * The version is left unchanged.
     */
    public DocumentNode rebased(List<String> path, Instant at) {
        return new DocumentNode(id, parentId, path, kind, title, slug, tenantId, version,
                                archived, createdAt, at);
    }

    /**
     * Returns a copy of this node with the specified archive flag. The version is incremented only
     * when {@code bumpVersion} is {@code true}, i.e. for the node the caller addressed.
     */
    public DocumentNode archived(boolean archived, boolean bumpVersion, Instant at) {
        return new DocumentNode(id, parentId, path, kind, title, slug, tenantId,
                                bumpVersion ? version + 1 : version, archived, createdAt, at);
    }

    /**
     * Returns a copy of this node with the next version.
     */
    public DocumentNode touched(Instant at) {
        return new DocumentNode(id, parentId, path, kind, title, slug, tenantId, version + 1,
                                archived, createdAt, at);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DocumentNode)) {
            return false;
        }
        final DocumentNode that = (DocumentNode) o;
        return version == that.version &&
               archived == that.archived &&
               id.equals(that.id) &&
               Objects.equals(parentId, that.parentId) &&
               path.equals(that.path) &&
               kind == that.kind &&
               title.equals(that.title) &&
               slug.equals(that.slug) &&
               tenantId.equals(that.tenantId) &&
               createdAt.equals(that.createdAt) &&
               updatedAt.equals(that.updatedAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, tenantId, version);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                          .omitNullValues()
                          .add("id", id)
                          .add("parentId", parentId)
                          .add("kind", kind)
                          .add("title", title)
                          .add("slug", slug)
                          .add("tenantId", tenantId)
                          .add("version", version)
                          .add("archived", archived)
                          .add("depth", path.size())
                          .toString();
    }
}
