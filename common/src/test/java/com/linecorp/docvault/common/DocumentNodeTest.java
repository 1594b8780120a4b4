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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Instant;

import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableList;

import com.linecorp.docvault.internal.Jackson;

class DocumentNodeTest {

    private static final Instant NOW = Instant.parse("2025-03-01T10:15:30Z");

    @Test
    void pathIsParentPathPlusOwnId() {
        final DocumentNode root = DocumentNode.of("acme", "r", null, NodeKind.FOLDER, "Matters", "matters",
                                                  NOW);
        final DocumentNode child = DocumentNode.of("acme", "c", root, NodeKind.FOLDER, "Child", "child", NOW);
        final DocumentNode doc = DocumentNode.of("acme", "d", child, NodeKind.DOCUMENT, "intake.md",
                                                 "intake-md", NOW);

        assertThat(root.path()).containsExactly("r");
        assertThat(root.parentId()).isNull();
        assertThat(doc.path()).containsExactly("r", "c", "d");
        assertThat(doc.parentId()).isEqualTo("c");
        assertThat(doc.version()).isOne();
        assertThat(doc.archived()).isFalse();
    }

    @Test
    void descendantTestUsesPathPrefix() {
        final DocumentNode root = DocumentNode.of("acme", "r", null, NodeKind.FOLDER, "R", "r", NOW);
        final DocumentNode child = DocumentNode.of("acme", "c", root, NodeKind.FOLDER, "C", "c", NOW);
        final DocumentNode other = DocumentNode.of("acme", "o", null, NodeKind.FOLDER, "O", "o", NOW);

        assertThat(child.isSelfOrDescendantOf(root)).isTrue();
        assertThat(root.isSelfOrDescendantOf(root)).isTrue();
        assertThat(root.isSelfOrDescendantOf(child)).isFalse();
        assertThat(child.isSelfOrDescendantOf(other)).isFalse();
    }

    @Test
    void rejectsInconsistentPath() {
        assertThatThrownBy(() -> new DocumentNode("a", "p", ImmutableList.of("x", "a"), NodeKind.FOLDER,
                                                  "A", "a", "acme", 1, false, NOW, NOW))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new DocumentNode("a", null, ImmutableList.of("x", "a"), NodeKind.FOLDER,
                                                  "A", "a", "acme", 1, false, NOW, NOW))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new DocumentNode("a", null, ImmutableList.of("a"), NodeKind.FOLDER,
                                                  "A", "a", "acme", 0, false, NOW, NOW))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rejectsParentOfAnotherTenant() {
        final DocumentNode root = DocumentNode.of("acme", "r", null, NodeKind.FOLDER, "R", "r", NOW);
        assertThatThrownBy(() -> DocumentNode.of("globex", "c", root, NodeKind.FOLDER, "C", "c", NOW))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("another tenant");
    }

    @Test
    void mutationsBumpVersionExceptRebaseAndCascadedArchive() {
        final DocumentNode node = DocumentNode.of("acme", "r", null, NodeKind.FOLDER, "R", "r", NOW);
        final Instant later = NOW.plusSeconds(1);

        assertThat(node.renamed("S", "s", later).version()).isEqualTo(2);
        assertThat(node.touched(later).version()).isEqualTo(2);
        assertThat(node.moved(null, ImmutableList.of("r"), "r-2", later).version()).isEqualTo(2);
        assertThat(node.rebased(ImmutableList.of("r"), later).version()).isOne();
        assertThat(node.archived(true, false, later).version()).isOne();
        assertThat(node.archived(true, true, later).version()).isEqualTo(2);
        assertThat(node.archived(true, true, later).archived()).isTrue();
    }

    @Test
    void jsonRoundTrip() throws Exception {
        final DocumentNode root = DocumentNode.of("acme", "r", null, NodeKind.FOLDER, "R", "r", NOW);
        final DocumentNode doc = DocumentNode.of("acme", "d", root, NodeKind.DOCUMENT, "D", "d", NOW);

        final String json = Jackson.writeValueAsString(doc);
        assertThat(json).contains("\"kind\":\"DOCUMENT\"").contains("\"path\":[\"r\",\"d\"]");
        assertThat(Jackson.readValue(json, DocumentNode.class)).isEqualTo(doc);

        // A root has no parentId property at all.
        assertThat(Jackson.writeValueAsString(root)).doesNotContain("parentId");
    }
}
