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
package com.linecorp.docvault.server.storage.tree;

import static com.linecorp.docvault.server.internal.storage.TenantLocks.childrenLockKey;
import static com.linecorp.docvault.server.internal.storage.TenantLocks.nodeLockKey;
import static com.linecorp.docvault.server.internal.storage.TenantLocks.rootsLockKey;
import static java.util.Objects.requireNonNull;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

import javax.annotation.Nullable;

import org.rocksdb.WriteBatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import com.linecorp.armeria.common.util.SafeCloseable;
import com.linecorp.docvault.common.DocumentMetadata;
import com.linecorp.docvault.common.DocumentNode;
import com.linecorp.docvault.common.InvalidNodeOperationException;
import com.linecorp.docvault.common.MutationFailure;
import com.linecorp.docvault.common.MutationResult;
import com.linecorp.docvault.common.NodeKind;
import com.linecorp.docvault.common.NodeNotFoundException;
import com.linecorp.docvault.internal.Util;
import com.linecorp.docvault.server.audit.AuditActions;
import com.linecorp.docvault.server.audit.Auditor;
import com.linecorp.docvault.server.internal.storage.NodeStorage;
import com.linecorp.docvault.server.internal.storage.RevisionStorage;
import com.linecorp.docvault.server.internal.storage.TenantLocks;
import com.linecorp.docvault.server.internal.storage.tree.Slugs;

/**
 * The folders and documents of every tenant, stored as a materialized-path hierarchy.
 *
 * <p>Mutations that rewrite a subtree ({@link #move}, {@link #delete} and {@link #archive}) hold the
 * exclusive lock of the tenant while they build and commit their batch. The other mutations lock the rows
 * they touch only, and reads never lock.
 */
public final class DocumentTree {

    private static final Logger logger = LoggerFactory.getLogger(DocumentTree.class);

    private final NodeStorage nodes;
    private final RevisionStorage revisions;
    private final TenantLocks locks;
    private final Auditor auditor;

    public DocumentTree(NodeStorage nodes, RevisionStorage revisions, TenantLocks locks, Auditor auditor) {
        this.nodes = requireNonNull(nodes, "nodes");
        this.revisions = requireNonNull(revisions, "revisions");
        this.locks = requireNonNull(locks, "locks");
        this.auditor = requireNonNull(auditor, "auditor");
    }

    /**
     * Creates a new node under the specified parent folder, or a new root folder if {@code parentId} is
     * {@code null}.
     *
     * @return the created node, or {@link MutationFailure#SLUG_CONFLICT} if no unique slug was found
     * @throws NodeNotFoundException if the parent does not exist
     * @throws InvalidNodeOperationException if the parent is not a folder, or a root document was requested
     * @throws IllegalArgumentException if the title is blank
     */
    public MutationResult<DocumentNode> createNode(String tenantId, @Nullable String parentId, NodeKind kind,
                                                   String title, String actorId) {
        Util.validateTenantId(tenantId, "tenantId");
        requireNonNull(kind, "kind");
        requireNonNull(actorId, "actorId");
        final String baseSlug = Slugs.slugify(title, kind);
        if (parentId == null && kind != NodeKind.FOLDER) {
            throw new InvalidNodeOperationException("a tenant root must be a folder: " + title);
        }

        final String lockKey = parentId != null ? childrenLockKey(tenantId, parentId) : rootsLockKey(tenantId);
        final DocumentNode node;
        try (SafeCloseable ignored = locks.lockRows(tenantId, lockKey)) {
            final DocumentNode parent;
            if (parentId != null) {
                parent = require(tenantId, parentId, "parentId");
                if (!parent.isFolder()) {
                    throw new InvalidNodeOperationException("parent is not a folder: " + tenantId + '/' +
                                                            parentId);
                }
            } else {
                parent = null;
            }

            final String slug = uniqueSlug(tenantId, parentId, baseSlug, null);
            if (slug == null) {
                return slugConflict(tenantId, parentId, baseSlug);
            }

            final Instant now = Instant.now();
            node = DocumentNode.of(tenantId, UUID.randomUUID().toString(), parent, kind, title, slug, now);
            try (WriteBatch batch = new WriteBatch()) {
                nodes.putNode(batch, node);
                if (kind == NodeKind.DOCUMENT) {
                    nodes.putMetadata(batch, DocumentMetadata.of(tenantId, node.id(), now));
                }
                nodes.write(batch);
            }
        }

        auditor.emit(tenantId, actorId, AuditActions.NODE_CREATED, node.id(),
                     ImmutableMap.of("kind", kind, "parentId", Objects.toString(parentId, ""),
                                     "slug", node.slug()));
        return MutationResult.success(node);
    }

    /**
     * Changes the title of the specified node and re-derives its slug. The path is left unchanged.
     */
    public MutationResult<DocumentNode> rename(String tenantId, String nodeId, String newTitle,
                                               long expectedVersion, String actorId) {
        Util.validateTenantId(tenantId, "tenantId");
        requireNonNull(actorId, "actorId");
        DocumentNode node = require(tenantId, nodeId, "nodeId");
        final String baseSlug = Slugs.slugify(newTitle, node.kind());

        DocumentNode renamed;
        for (;;) {
            final String parentId = node.parentId();
            final String siblingsLockKey = parentId != null ? childrenLockKey(tenantId, parentId)
                                                            : rootsLockKey(tenantId);
            try (SafeCloseable ignored = locks.lockRows(tenantId, nodeLockKey(tenantId, nodeId),
                                                        siblingsLockKey)) {
                final DocumentNode current = require(tenantId, nodeId, "nodeId");
                if (!Objects.equals(current.parentId(), parentId)) {
                    // Moved before the lock was acquired. Lock the new siblings instead.
                    node = current;
                    continue;
                }
                if (current.version() != expectedVersion) {
                    return versionConflict(current, expectedVersion);
                }
                final String slug = uniqueSlug(tenantId, parentId, baseSlug, nodeId);
                if (slug == null) {
                    return slugConflict(tenantId, parentId, baseSlug);
                }
                renamed = current.renamed(newTitle, slug, Instant.now());
                try (WriteBatch batch = new WriteBatch()) {
                    nodes.removeIndexes(batch, current);
                    nodes.putNode(batch, renamed);
                    nodes.write(batch);
                }
                node = current;
                break;
            }
        }

        auditor.emit(tenantId, actorId, AuditActions.NODE_RENAMED, nodeId,
                     ImmutableMap.of("from", node.slug(), "to", renamed.slug()));
        return MutationResult.success(renamed);
    }

    /**
     * Moves the specified node and its subtree under another folder, or makes it a root folder if
     * {@code newParentId} is {@code null}. The paths of every descendant are rewritten in the same batch.
     *
     * @return the moved node, {@link MutationFailure#VERSION_CONFLICT}, {@link MutationFailure#CYCLE_REJECTED}
     *         or {@link MutationFailure#SLUG_CONFLICT}
     */
    public MutationResult<DocumentNode> move(String tenantId, String nodeId, @Nullable String newParentId,
                                             long expectedVersion, String actorId) {
        Util.validateTenantId(tenantId, "tenantId");
        requireNonNull(actorId, "actorId");

        final DocumentNode node;
        final DocumentNode moved;
        int rebased = 0;
        try (SafeCloseable ignored = locks.lockTenant(tenantId)) {
            node = require(tenantId, nodeId, "nodeId");
            if (node.version() != expectedVersion) {
                return versionConflict(node, expectedVersion);
            }

            final List<String> newPath;
            if (newParentId != null) {
                final DocumentNode newParent = require(tenantId, newParentId, "newParentId");
                if (newParentId.equals(nodeId) || newParent.isSelfOrDescendantOf(node)) {
                    return MutationResult.failure(MutationFailure.CYCLE_REJECTED,
                                                  "cannot move " + nodeId + " under itself or its " +
                                                  "descendant " + newParentId);
                }
                if (!newParent.isFolder()) {
                    throw new InvalidNodeOperationException("new parent is not a folder: " + tenantId + '/' +
                                                            newParentId);
                }
                newPath = ImmutableList.<String>builder().addAll(newParent.path()).add(nodeId).build();
            } else {
                if (!node.isFolder()) {
                    throw new InvalidNodeOperationException("a tenant root must be a folder: " + tenantId +
                                                            '/' + nodeId);
                }
                newPath = ImmutableList.of(nodeId);
            }

            String slug = node.slug();
            final String occupant = nodes.childIdBySlug(tenantId, newParentId, slug);
            if (occupant != null && !occupant.equals(nodeId)) {
                final String baseSlug = Slugs.slugify(node.title(), node.kind());
                slug = uniqueSlug(tenantId, newParentId, baseSlug, nodeId);
                if (slug == null) {
                    return slugConflict(tenantId, newParentId, baseSlug);
                }
            }

            final Instant now = Instant.now();
            moved = node.moved(newParentId, newPath, slug, now);
            final int oldDepth = node.path().size();
            try (WriteBatch batch = new WriteBatch()) {
                for (DocumentNode descendant : nodes.descendants(tenantId, node.path())) {
                    final List<String> path = descendant.path();
                    final List<String> rebasedPath = ImmutableList.<String>builder()
                                                                  .addAll(newPath)
                                                                  .addAll(path.subList(oldDepth, path.size()))
                                                                  .build();
                    nodes.removeIndexes(batch, descendant);
                    nodes.putNode(batch, descendant.rebased(rebasedPath, now));
                    rebased++;
                }
                nodes.removeIndexes(batch, node);
                nodes.putNode(batch, moved);
                nodes.write(batch);
            }
        }

        logger.debug("Moved {}/{} with {} descendant(s): {} -> {}",
                     tenantId, nodeId, rebased, node.parentId(), newParentId);
        auditor.emit(tenantId, actorId, AuditActions.NODE_MOVED, nodeId,
                     ImmutableMap.of("from", Objects.toString(node.parentId(), ""),
                                     "to", Objects.toString(newParentId, ""),
                                     "descendants", rebased));
        return MutationResult.success(moved);
    }

    /**
     * Deletes the specified node. A folder with children is deleted only if {@code cascade} is
     * {@code true}, in which case every descendant is deleted as well, together with the revisions and
     * metadata of the deleted documents.
     *
     * @return the number of deleted nodes, {@link MutationFailure#VERSION_CONFLICT} or
     *         {@link MutationFailure#NOT_EMPTY}
     */
    public MutationResult<Integer> delete(String tenantId, String nodeId, long expectedVersion,
                                          boolean cascade, String actorId) {
        Util.validateTenantId(tenantId, "tenantId");
        requireNonNull(actorId, "actorId");

        final List<DocumentNode> victims = new ArrayList<>();
        try (SafeCloseable ignored = locks.lockTenant(tenantId)) {
            final DocumentNode node = require(tenantId, nodeId, "nodeId");
            if (node.version() != expectedVersion) {
                return versionConflict(node, expectedVersion);
            }
            if (!cascade && nodes.hasChildren(tenantId, nodeId)) {
                return MutationResult.failure(MutationFailure.NOT_EMPTY,
                                              "node has children: " + tenantId + '/' + nodeId);
            }

            victims.add(node);
            if (cascade) {
                nodes.descendants(tenantId, node.path()).forEach(victims::add);
            }
            try (WriteBatch batch = new WriteBatch()) {
                for (DocumentNode victim : victims) {
                    nodes.removeNode(batch, victim);
                    if (victim.kind() == NodeKind.DOCUMENT) {
                        revisions.removeRevisions(batch, tenantId, victim.id());
                    }
                }
                nodes.write(batch);
            }
        }

        auditor.emit(tenantId, actorId, AuditActions.NODE_DELETED, nodeId,
                     ImmutableMap.of("cascade", cascade, "deleted", victims.size()));
        return MutationResult.success(victims.size());
    }

    /**
     * Sets or clears the archive flag of the specified node and its descendants. Only the version of the
     * specified node is incremented.
     */
    public MutationResult<DocumentNode> archive(String tenantId, String nodeId, boolean archived,
                                                long expectedVersion, String actorId) {
        Util.validateTenantId(tenantId, "tenantId");
        requireNonNull(actorId, "actorId");

        final DocumentNode updated;
        int affected = 1;
        try (SafeCloseable ignored = locks.lockTenant(tenantId)) {
            final DocumentNode node = require(tenantId, nodeId, "nodeId");
            if (node.version() != expectedVersion) {
                return versionConflict(node, expectedVersion);
            }
            final Instant now = Instant.now();
            updated = node.archived(archived, true, now);
            try (WriteBatch batch = new WriteBatch()) {
                nodes.putNode(batch, updated);
                for (DocumentNode descendant : nodes.descendants(tenantId, node.path())) {
                    nodes.putNode(batch, descendant.archived(archived, false, now));
                    affected++;
                }
                nodes.write(batch);
            }
        }

        auditor.emit(tenantId, actorId, AuditActions.NODE_ARCHIVED, nodeId,
                     ImmutableMap.of("archived", archived, "affected", affected));
        return MutationResult.success(updated);
    }

    /**
     * Returns the specified node.
     *
     * @throws NodeNotFoundException if the node does not exist in the tenant
     */
    public DocumentNode get(String tenantId, String nodeId) {
        Util.validateTenantId(tenantId, "tenantId");
        return require(tenantId, nodeId, "nodeId");
    }

    /**
     * Returns the root folders of the specified tenant, ordered by slug.
     */
    public Iterable<DocumentNode> listRoots(String tenantId) {
        Util.validateTenantId(tenantId, "tenantId");
        return nodes.children(tenantId, null);
    }

    /**
     * Returns the direct children of the specified node, ordered by slug. Every {@link Iterable#iterator()}
     * reads the children afresh from one consistent snapshot.
     *
     * @throws NodeNotFoundException if the node does not exist in the tenant
     */
    public Iterable<DocumentNode> listChildren(String tenantId, String nodeId) {
        Util.validateTenantId(tenantId, "tenantId");
        require(tenantId, nodeId, "nodeId");
        return nodes.children(tenantId, nodeId);
    }

    /**
     * Returns every descendant of the specified node, excluding the node itself, in depth-first order.
     * Every {@link Iterable#iterator()} reads one consistent snapshot and resolves the path of the node in
     * it, so a subtree moved in the meantime is still listed, and a move that commits while iterating
     * is not seen halfway. An iterator over a node deleted in the meantime is empty.
     *
     * @throws NodeNotFoundException if the node does not exist in the tenant
     */
    public Iterable<DocumentNode> listSubtree(String tenantId, String nodeId) {
        Util.validateTenantId(tenantId, "tenantId");
        require(tenantId, nodeId, "nodeId");
        return nodes.subtree(tenantId, nodeId);
    }

    private DocumentNode require(String tenantId, String nodeId, String paramName) {
        Util.validateId(nodeId, paramName);
        final DocumentNode node = nodes.node(tenantId, nodeId);
        if (node == null) {
            throw NodeNotFoundException.of(tenantId, nodeId);
        }
        return node;
    }

    @Nullable
    private String uniqueSlug(String tenantId, @Nullable String parentId, String baseSlug,
                              @Nullable String selfId) {
        for (int attempt = 1; attempt <= Slugs.MAX_SLUG_ATTEMPTS; attempt++) {
            final String candidate = Slugs.candidate(baseSlug, attempt);
            final String occupant = nodes.childIdBySlug(tenantId, parentId, candidate);
            if (occupant == null || occupant.equals(selfId)) {
                return candidate;
            }
        }
        return null;
    }

    private static <T> MutationResult<T> versionConflict(DocumentNode node, long expectedVersion) {
        return MutationResult.failure(MutationFailure.VERSION_CONFLICT,
                                      "version of " + node.tenantId() + '/' + node.id() + ": " +
                                      node.version() + " (expected: " + expectedVersion + ')');
    }

    private static <T> MutationResult<T> slugConflict(String tenantId, @Nullable String parentId,
                                                      String baseSlug) {
        return MutationResult.failure(MutationFailure.SLUG_CONFLICT,
                                      "no unique slug for '" + baseSlug + "' under " + tenantId + '/' +
                                      Objects.toString(parentId, "<root>") + " after " +
                                      Slugs.MAX_SLUG_ATTEMPTS + " attempts");
    }
}
