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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import java.lang.ref.Cleaner;
import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;
import java.util.Iterator;

import javax.annotation.Nullable;

import org.rocksdb.RocksIterator;

import com.google.common.collect.AbstractIterator;

import com.linecorp.armeria.common.util.SafeCloseable;
import com.linecorp.armeria.common.util.ThreadFactories;

/**
 * A lazy, finite and restartable view of the entries of a column family that start with a prefix.
 *
 * <p>Every {@link #iterator()} starts afresh and reads from a {@link StorageSnapshot} taken when it is
 * created, so it sees every atomic batch either in full or not at all and returns each entry once.
 * Entries are fetched in pages, each through a short-lived {@link RocksIterator} over that snapshot, so
 * that no native iterator outlives a call to {@link Iterator#next()}.
 *
 * <p>The snapshot is released as soon as the iterator is exhausted, fails or is
 * {@linkplain SnapshotIterator#close() closed}. An abandoned iterator releases it once it becomes
 * unreachable, and {@link RocksDBStorage#close()} releases whatever is left.
 */
public final class PrefixIterable<T> implements Iterable<T> {

    /**
     * Decodes a matching entry. Returning {@code null} skips the entry.
     */
    @FunctionalInterface
    public interface EntryDecoder<T> {
        /**
         * Decodes the specified entry. Any other row needed to decode it must be read from
         * {@code snapshot}.
         */
        @Nullable
        T decode(StorageSnapshot snapshot, byte[] key, byte[] value);
    }

    /**
     * Resolves the prefix to scan from the snapshot of a new iterator.
     */
    @FunctionalInterface
    public interface PrefixResolver {
        /**
         * Returns the prefix, or {@code null} if the iterator has no entries.
         */
        @Nullable
        byte[] resolve(StorageSnapshot snapshot);
    }

    static final int DEFAULT_PAGE_SIZE = 128;

    private static final Cleaner cleaner =
            Cleaner.create(ThreadFactories.newThreadFactory("docvault-snapshot-cleaner", true));

    private final RocksDBStorage storage;
    private final String cfName;
    private final PrefixResolver prefixResolver;
    private final boolean reverse;
    private final int pageSize;
    private final EntryDecoder<T> decoder;

    public PrefixIterable(RocksDBStorage storage, String cfName, byte[] prefix, boolean reverse,
                          EntryDecoder<T> decoder) {
        this(storage, cfName, fixedPrefix(prefix), reverse, DEFAULT_PAGE_SIZE, decoder);
    }

    public PrefixIterable(RocksDBStorage storage, String cfName, PrefixResolver prefixResolver,
                          boolean reverse, EntryDecoder<T> decoder) {
        this(storage, cfName, prefixResolver, reverse, DEFAULT_PAGE_SIZE, decoder);
    }

    PrefixIterable(RocksDBStorage storage, String cfName, byte[] prefix, boolean reverse, int pageSize,
                   EntryDecoder<T> decoder) {
        this(storage, cfName, fixedPrefix(prefix), reverse, pageSize, decoder);
    }

    PrefixIterable(RocksDBStorage storage, String cfName, PrefixResolver prefixResolver, boolean reverse,
                   int pageSize, EntryDecoder<T> decoder) {
        this.storage = requireNonNull(storage, "storage");
        this.cfName = requireNonNull(cfName, "cfName");
        this.prefixResolver = requireNonNull(prefixResolver, "prefixResolver");
        this.reverse = reverse;
        checkArgument(pageSize > 0, "pageSize: %s (expected: > 0)", pageSize);
        this.pageSize = pageSize;
        this.decoder = requireNonNull(decoder, "decoder");
    }

    private static PrefixResolver fixedPrefix(byte[] prefix) {
        final byte[] copy = requireNonNull(prefix, "prefix").clone();
        checkArgument(copy.length > 0, "prefix is empty.");
        return snapshot -> copy;
    }

    @Override
    public SnapshotIterator<T> iterator() {
        final StorageSnapshot snapshot = storage.snapshot();
        final byte[] prefix;
        try {
            prefix = prefixResolver.resolve(snapshot);
        } catch (Throwable t) {
            snapshot.close();
            throw t;
        }
        return new SnapshotIterator<>(this, snapshot, prefix);
    }

    /**
     * An {@link Iterator} over the entries seen by one {@link StorageSnapshot}. Closing it before it is
     * exhausted releases the snapshot early.
     */
    public static final class SnapshotIterator<T> extends AbstractIterator<T> implements SafeCloseable {

        private final PrefixIterable<T> parent;
        private final StorageSnapshot snapshot;
        @Nullable
        private final byte[] prefix;
        private final Cleaner.Cleanable cleanable;
        private final Deque<T> page = new ArrayDeque<>();
        @Nullable
        private byte[] lastKey;
        private boolean exhausted;

        SnapshotIterator(PrefixIterable<T> parent, StorageSnapshot snapshot, @Nullable byte[] prefix) {
            this.parent = parent;
            this.snapshot = snapshot;
            this.prefix = prefix;
            exhausted = prefix == null;
            // Must not capture this iterator, or it would never become unreachable.
            cleanable = cleaner.register(this, snapshot::close);
        }

        @Override
        protected T computeNext() {
            while (page.isEmpty()) {
                if (exhausted) {
                    close();
                    return endOfData();
                }
                try {
                    fetchPage();
                } catch (Throwable t) {
                    close();
                    throw t;
                }
            }
            return page.poll();
        }

        @Override
        public void close() {
            exhausted = true;
            page.clear();
            cleanable.clean();
        }

        private void fetchPage() {
            final byte[] prefix = this.prefix;
            if (prefix == null) {
                exhausted = true;
                return;
            }
            int scanned = 0;
            try (RocksIterator it = parent.storage.newIterator(parent.cfName, snapshot.readOptions())) {
                seek(it, prefix);
                while (it.isValid() && scanned < parent.pageSize) {
                    final byte[] key = it.key();
                    if (!DbKeys.startsWith(key, prefix)) {
                        break;
                    }
                    lastKey = key;
                    scanned++;
                    final T decoded = parent.decoder.decode(snapshot, key, it.value());
                    if (decoded != null) {
                        page.add(decoded);
                    }
                    advance(it);
                }
                if (scanned < parent.pageSize) {
                    exhausted = true;
                }
            }
        }

        private void seek(RocksIterator it, byte[] prefix) {
            if (lastKey == null) {
                if (parent.reverse) {
                    final byte[] end = DbKeys.prefixEnd(prefix);
                    it.seekForPrev(end);
                    if (it.isValid() && Arrays.equals(it.key(), end)) {
                        it.prev();
                    }
                } else {
                    it.seek(prefix);
                }
                return;
            }

            if (parent.reverse) {
                it.seekForPrev(lastKey);
            } else {
                it.seek(lastKey);
            }
            if (it.isValid() && Arrays.equals(it.key(), lastKey)) {
                advance(it);
            }
        }

        private void advance(RocksIterator it) {
            if (parent.reverse) {
                it.prev();
            } else {
                it.next();
            }
        }
    }
}
