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

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReadWriteLock;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.util.concurrent.Striped;

import com.linecorp.armeria.common.util.SafeCloseable;

/**
 * The write-side locks of the store.
 *
 * <p>Each tenant has a read-write lock. Operations that rewrite many rows of a tenant, such as moving or
 * deleting a subtree, hold its write side. Operations that touch a few rows hold its read side together
 * with the striped locks of the rows they compare and swap, acquired in the stripe order so that no two
 * such operations deadlock. Readers take no lock and read from a snapshot instead.
 *
 * <p>Locks are never held while waiting for a key custodian.
 */
public final class TenantLocks {

    private static final int NUM_TENANT_STRIPES = 64;
    private static final int NUM_ROW_STRIPES = 1024;

    private final Striped<ReadWriteLock> tenantLocks = Striped.readWriteLock(NUM_TENANT_STRIPES);
    private final Striped<Lock> rowLocks = Striped.lock(NUM_ROW_STRIPES);

    public static String nodeLockKey(String tenantId, String nodeId) {
        return "node:" + tenantId + '/' + nodeId;
    }

    /**
     * Returns the key of the lock that guards the slug namespace under the specified parent.
     */
    public static String childrenLockKey(String tenantId, String parentId) {
        return "children:" + tenantId + '/' + parentId;
    }

    public static String rootsLockKey(String tenantId) {
        return "roots:" + tenantId;
    }

    public static String metadataLockKey(String tenantId, String documentId) {
        return "metadata:" + tenantId + '/' + documentId;
    }

    /**
     * Acquires the exclusive lock of the specified tenant.
     */
    public SafeCloseable lockTenant(String tenantId) {
        requireNonNull(tenantId, "tenantId");
        final Lock lock = tenantLocks.get(tenantId).writeLock();
        lock.lock();
        return lock::unlock;
    }

    /**
     * Acquires the shared lock of the specified tenant and then the locks of the specified rows.
     */
    public SafeCloseable lockRows(String tenantId, String... rowKeys) {
        requireNonNull(tenantId, "tenantId");
        requireNonNull(rowKeys, "rowKeys");
        final Lock tenantLock = tenantLocks.get(tenantId).readLock();
        tenantLock.lock();

        final List<Lock> acquired = new ArrayList<>(rowKeys.length);
        try {
            // bulkGet() returns the stripes in a consistent order.
            for (Lock lock : rowLocks.bulkGet(ImmutableList.copyOf(rowKeys))) {
                lock.lock();
                acquired.add(lock);
            }
        } catch (Throwable t) {
            Lists.reverse(acquired).forEach(Lock::unlock);
            tenantLock.unlock();
            throw t;
        }

        return () -> {
            Lists.reverse(acquired).forEach(Lock::unlock);
            tenantLock.unlock();
        };
    }
}
