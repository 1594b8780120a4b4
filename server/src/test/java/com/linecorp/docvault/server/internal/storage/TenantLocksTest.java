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
import static org.awaitility.Awaitility.await;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.Test;

import com.linecorp.armeria.common.util.SafeCloseable;

class TenantLocksTest {

    private final TenantLocks locks = new TenantLocks();

    @Test
    void tenantLockExcludesRowLocks() throws Exception {
        final CompletableFuture<Void> rowsLocked;
        try (SafeCloseable ignored = locks.lockTenant("acme")) {
            rowsLocked = CompletableFuture.runAsync(() -> {
                try (SafeCloseable ignored2 = locks.lockRows("acme", TenantLocks.rootsLockKey("acme"))) {
                    // Acquired.
                }
            });
            Thread.sleep(100);
            assertThat(rowsLocked).isNotDone();
        }
        rowsLocked.get(10, TimeUnit.SECONDS);
    }

    @Test
    void rowLocksExcludeEachOtherButNotOtherRows() throws Exception {
        final String row = TenantLocks.nodeLockKey("acme", "doc");
        final CompletableFuture<Void> sameRow;
        try (SafeCloseable ignored = locks.lockRows("acme", row, TenantLocks.metadataLockKey("acme", "doc"))) {
            sameRow = CompletableFuture.runAsync(() -> locks.lockRows("acme", row).close());
            locks.lockRows("acme", TenantLocks.nodeLockKey("acme", "other")).close();
            Thread.sleep(100);
            assertThat(sameRow).isNotDone();
        }
        await().until(sameRow::isDone);
        assertThat(sameRow).isCompleted();
    }
}
