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
package com.linecorp.docvault.internal;

import static java.util.Objects.requireNonNull;

import java.util.regex.Pattern;

public final class Util {

    private static final Pattern TENANT_ID_PATTERN = Pattern.compile(
            "^[0-9A-Za-z](?:[-_0-9A-Za-z\\.]*[0-9A-Za-z])?$");
    private static final Pattern ID_PATTERN = Pattern.compile(
            "^[0-9A-Za-z](?:[-_0-9A-Za-z]*[0-9A-Za-z])?$");

    /**
     * Validates a tenant ID. Tenant IDs are used as the first segment of every storage key, so they must
     * never contain a {@code '/'}.
     */
    public static String validateTenantId(String tenantId, String paramName) {
        requireNonNull(tenantId, paramName);
        if (!isValidTenantId(tenantId)) {
            throw new IllegalArgumentException(
                    paramName + ": " + tenantId + " (expected: " + TENANT_ID_PATTERN.pattern() + ')');
        }
        return tenantId;
    }

    public static boolean isValidTenantId(String tenantId) {
        requireNonNull(tenantId, "tenantId");
        return TENANT_ID_PATTERN.matcher(tenantId).matches();
    }

    /**
     * Validates the ID of a node, a revision or an actor.
     */
    public static String validateId(String id, String paramName) {
        requireNonNull(id, paramName);
        if (!isValidId(id)) {
            throw new IllegalArgumentException(
                    paramName + ": " + id + " (expected: " + ID_PATTERN.pattern() + ')');
        }
        return id;
    }

    public static boolean isValidId(String id) {
        requireNonNull(id, "id");
        return ID_PATTERN.matcher(id).matches();
    }

    private Util() {}
}
