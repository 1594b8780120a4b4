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

import static java.util.Objects.requireNonNull;

import java.util.concurrent.atomic.AtomicBoolean;

import org.rocksdb.ReadOptions;
import org.rocksdb.Snapshot;

import com.linecorp.armeria.common.util.SafeCloseable;

/**
 * A point-in-time view of the database. Every atomic batch written before the snapshot was taken is
 * visible in full, and nothing written afterwards is. Closing a snapshot after its
 * {@link RocksDBStorage} was closed is a no-op.
 */
public final class StorageSnapshot implements SafeCloseable {

    private final RocksDBStorage storage;
    private final Snapshot snapshot;
    private final ReadOptions readOptions;
    private final AtomicBoolean closed = new AtomicBoolean();

    StorageSnapshot(RocksDBStorage storage, Snapshot snapshot) {
        this.storage = requireNonNull(storage, "storage");
        this.snapshot = requireNonNull(snapshot, "snapshot");
        readOptions = new ReadOptions().setSnapshot(snapshot);
    }

    /**
     * Returns the {@link ReadOptions} that read from this snapshot.
     */
    public ReadOptions readOptions() {
        return readOptions;
    }

    Snapshot rocksSnapshot() {
        return snapshot;
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        storage.releaseSnapshot(this);
        readOptions.close();
    }
}
