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
package com.linecorp.docvault.server.internal.storage;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Instant;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.google.common.collect.ImmutableSet;

import com.linecorp.docvault.common.DocumentRevision;
import com.linecorp.docvault.server.internal.storage.RevisionStorage.StalePage;

class RevisionStorageTest {

    private static final String TENANT = "acme";

    @TempDir
    Path tempDir;

    private RocksDBStorage rocksDbStorage;
    private RevisionStorage revisions;

    @BeforeEach
    void setUp() {
        rocksDbStorage = new RocksDBStorage(tempDir.toString());
        revisions = new RevisionStorage(rocksDbStorage);
    }

    @AfterEach
    void tearDown() {
        rocksDbStorage.close();
    }

    @Test
    void scanStaleSkipsEmptyRows() {
        revisions.updateRevision(revision("r1", "doc-1", 1, 1));
        // A row whose value reads as JSON null.
        rocksDbStorage.putUnsynced(RocksDBStorage.REVISIONS_COLUMN_FAMILY,
                                   DbKeys.revisionKey(TENANT, "doc-1", 2),
                                   "null".getBytes(StandardCharsets.UTF_8));
        revisions.updateRevision(revision("r3", "doc-1", 3, 2));
        revisions.updateRevision(revision("r4", "doc-2", 1, 1));

        final StalePage page = revisions.scanStale(TENANT, 2, null, 10, ImmutableSet.of("r4"));

        assertThat(page.revisions()).extracting(DocumentRevision::id).containsExactly("r1");
        assertThat(page.nextCursor()).isNull();
        assertThat(revisions.isKekVersionReferenced(TENANT, 2)).isTrue();
        assertThat(revisions.isKekVersionReferenced(TENANT, 3)).isFalse();
    }

    @Test
    void scanStaleResumesFromCursor() {
        for (int i = 1; i <= 3; i++) {
            revisions.updateRevision(revision("r" + i, "doc-1", i, 1));
        }

        final StalePage first = revisions.scanStale(TENANT, 2, null, 2, ImmutableSet.of());
        assertThat(first.revisions()).extracting(DocumentRevision::id).containsExactly("r1", "r2");
        assertThat(first.nextCursor()).isNotNull();

        final StalePage second = revisions.scanStale(TENANT, 2, first.nextCursor(), 2, ImmutableSet.of());
        assertThat(second.revisions()).extracting(DocumentRevision::id).containsExactly("r3");
        assertThat(second.nextCursor()).isNull();
    }

    private static DocumentRevision revision(String id, String documentId, int revisionNo, int kekVersion) {
        return new DocumentRevision(id, TENANT, documentId, revisionNo, new byte[60], kekVersion, new byte[12],
                                    "00", 0, 16, 1, "text/plain", "alice", Instant.EPOCH);
    }
}
