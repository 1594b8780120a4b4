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
import java.util.Iterator;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.rocksdb.WriteBatch;

import com.google.common.collect.ImmutableList;

import com.linecorp.docvault.server.internal.storage.PrefixIterable.SnapshotIterator;

class PrefixIterableTest {

    private static final String CF = RocksDBStorage.NODES_COLUMN_FAMILY;

    @TempDir
    Path tempDir;

    private RocksDBStorage rocksDbStorage;

    @BeforeEach
    void setUp() {
        rocksDbStorage = new RocksDBStorage(tempDir.toString());
        for (String key : new String[] { "acme/a", "acme/b", "acme/c", "acme/d", "acme/e",
                                         "acme.corp/x", "acmf/y", "acm/z" }) {
            put(key, key);
        }
    }

    @AfterEach
    void tearDown() {
        if (rocksDbStorage != null) {
            rocksDbStorage.close();
        }
    }

    @Test
    void iteratesMatchingEntriesAcrossPages() {
        final PrefixIterable<String> iterable = newIterable("acme/", false, 2);

        assertThat(iterable).containsExactly("acme/a", "acme/b", "acme/c", "acme/d", "acme/e");
    }

    @Test
    void reverseOrder() {
        assertThat(newIterable("acme/", true, 2))
                .containsExactly("acme/e", "acme/d", "acme/c", "acme/b", "acme/a");
        assertThat(newIterable("acme/", true, 100)).first().isEqualTo("acme/e");
    }

    @Test
    void iterationIsRestartable() {
        final PrefixIterable<String> iterable = newIterable("acme/", false, 2);
        assertThat(iterable).hasSize(5);

        put("acme/f", "acme/f");

        assertThat(iterable).hasSize(6).endsWith("acme/f");
    }

    @Test
    void iteratorReadsTheSnapshotTakenWhenItWasCreated() throws Exception {
        final PrefixIterable<String> iterable = newIterable("acme/", false, 2);
        final Iterator<String> it = iterable.iterator();
        assertThat(it.next()).isEqualTo("acme/a");

        // Moves "acme/d" to "acme/0" and adds "acme/f" in one batch, behind and ahead of the cursor.
        try (WriteBatch batch = new WriteBatch()) {
            batch.delete(rocksDbStorage.getColumnFamilyHandle(CF), utf8("acme/d"));
            batch.put(rocksDbStorage.getColumnFamilyHandle(CF), utf8("acme/0"), utf8("acme/d"));
            batch.put(rocksDbStorage.getColumnFamilyHandle(CF), utf8("acme/f"), utf8("acme/f"));
            rocksDbStorage.write(batch);
        }

        assertThat(ImmutableList.copyOf(it)).containsExactly("acme/b", "acme/c", "acme/d", "acme/e");
        assertThat(iterable).containsExactly("acme/d", "acme/a", "acme/b", "acme/c", "acme/e", "acme/f");
    }

    @Test
    void entriesRewrittenBehindTheCursorAreNotReturnedTwice() {
        final Iterator<String> it = newIterable("acme/", false, 2).iterator();
        assertThat(it.next()).isEqualTo("acme/a");
        assertThat(it.next()).isEqualTo("acme/b");
        put("acme/a", "acme/a");
        assertThat(it.next()).isEqualTo("acme/c");
    }

    @Test
    void nullDecodedEntriesAreSkipped() {
        final PrefixIterable<String> iterable = new PrefixIterable<>(
                rocksDbStorage, CF, utf8("acme/"), false, 2, (snapshot, key, value) -> {
                    final String decoded = new String(value, StandardCharsets.UTF_8);
                    return decoded.endsWith("b") || decoded.endsWith("c") ? null : decoded;
                });

        assertThat(iterable).containsExactly("acme/a", "acme/d", "acme/e");
    }

    @Test
    void noMatch() {
        assertThat(newIterable("globex/", false, 2)).isEmpty();
        assertThat(newIterable("globex/", true, 2)).isEmpty();
        assertThat(rocksDbStorage.numOpenSnapshots()).isZero();
    }

    @Test
    void prefixIsResolvedFromTheSnapshot() throws Exception {
        // "acme.corp/x" names the prefix to scan.
        final PrefixIterable<String> iterable = new PrefixIterable<>(
                rocksDbStorage, CF, snapshot -> {
                    final byte[] target = rocksDbStorage.get(CF, snapshot.readOptions(), utf8("acme.corp/x"));
                    return target != null ? utf8("acm") : null;
                }, false, 2, (snapshot, key, value) -> new String(key, StandardCharsets.UTF_8));

        assertThat(iterable).containsExactly("acm/z", "acme.corp/x", "acme/a", "acme/b", "acme/c",
                                             "acme/d", "acme/e", "acmf/y");

        try (WriteBatch batch = new WriteBatch()) {
            batch.delete(rocksDbStorage.getColumnFamilyHandle(CF), utf8("acme.corp/x"));
            rocksDbStorage.write(batch);
        }
        assertThat(iterable).isEmpty();
        assertThat(rocksDbStorage.numOpenSnapshots()).isZero();
    }

    @Test
    void snapshotIsReleasedWhenExhaustedOrClosed() {
        final PrefixIterable<String> iterable = newIterable("acme/", false, 2);

        assertThat(ImmutableList.copyOf(iterable)).hasSize(5);
        assertThat(rocksDbStorage.numOpenSnapshots()).isZero();

        final SnapshotIterator<String> it = iterable.iterator();
        assertThat(it.next()).isEqualTo("acme/a");
        assertThat(rocksDbStorage.numOpenSnapshots()).isOne();

        it.close();
        assertThat(rocksDbStorage.numOpenSnapshots()).isZero();
        assertThat(it.hasNext()).isFalse();
        it.close();
    }

    @Test
    void closingStorageReleasesAbandonedSnapshots() {
        final SnapshotIterator<String> it = newIterable("acme/", false, 2).iterator();
        assertThat(it.next()).isEqualTo("acme/a");

        rocksDbStorage.close();
        assertThat(rocksDbStorage.numOpenSnapshots()).isZero();
        // No-op once the storage is closed.
        it.close();
        rocksDbStorage = null;
    }

    private PrefixIterable<String> newIterable(String prefix, boolean reverse, int pageSize) {
        return new PrefixIterable<>(rocksDbStorage, CF, utf8(prefix), reverse, pageSize,
                                    (snapshot, key, value) -> new String(value, StandardCharsets.UTF_8));
    }

    private void put(String key, String value) {
        rocksDbStorage.putUnsynced(CF, utf8(key), utf8(value));
    }

    private static byte[] utf8(String value) {
        return value.getBytes(StandardCharsets.UTF_8);
    }
}
