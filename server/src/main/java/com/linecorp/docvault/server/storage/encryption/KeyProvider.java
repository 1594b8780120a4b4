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
package com.linecorp.docvault.server.storage.encryption;

import java.util.List;

import javax.crypto.SecretKey;

import com.linecorp.docvault.common.KeyProviderUnavailableException;
import com.linecorp.docvault.common.TenantKey;
import com.linecorp.docvault.common.UnwrapFailureException;

/**
 * Supplies the key encryption keys of tenants.
 *
 * <p>A tenant has exactly one active version at a time. Superseded versions stay retrievable until they
 * are {@linkplain #removeKekVersion(String, int) removed}, so that data encryption keys wrapped by them
 * can still be unwrapped while they are being re-wrapped. Calls may block on a key custodian and must
 * not be made while holding a lock of the store.
 */
public interface KeyProvider {

    /**
     * Returns the active key encryption key of the specified tenant, creating version {@code 1} if the
     * tenant has none yet.
     *
     * @throws KeyProviderUnavailableException if the key custodian could not be reached in time
     * @throws UnwrapFailureException if the stored key could not be unwrapped
     */
    SecretKeyWithVersion getActiveKek(String tenantId);

    /**
     * Returns the specified version of the key encryption key of the specified tenant.
     *
     * @throws UnwrapFailureException if the version does not exist or could not be unwrapped
     * @throws KeyProviderUnavailableException if the key custodian could not be reached in time
     */
    SecretKey getKekByVersion(String tenantId, int version);

    /**
     * Creates a new key encryption key for the specified tenant and makes it the active one.
     *
     * @return the new version
     */
    int rotateKek(String tenantId);

    /**
     * Returns every retained version of the key encryption key of the specified tenant, oldest first.
     */
    List<TenantKey> kekVersions(String tenantId);

    /**
     * Returns whether the specified version of the key encryption key of the specified tenant is still
     * retained. Reads local state only and never calls a key custodian.
     */
    boolean containsKekVersion(String tenantId, int version);

    /**
     * Removes the specified retired version. The caller is responsible for making sure that no data
     * encryption key is still wrapped by it.
     *
     * @throws IllegalStateException if the version is the active one
     */
    void removeKekVersion(String tenantId, int version);
}
