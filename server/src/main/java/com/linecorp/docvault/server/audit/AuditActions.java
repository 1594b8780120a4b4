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
package com.linecorp.docvault.server.audit;

/**
 * The names of the actions recorded in {@link com.linecorp.docvault.common.AuditEvent#action()}.
 */
public final class AuditActions {

    public static final String NODE_CREATED = "node.created";
    public static final String NODE_RENAMED = "node.renamed";
    public static final String NODE_MOVED = "node.moved";
    public static final String NODE_DELETED = "node.deleted";
    public static final String NODE_ARCHIVED = "node.archived";
    public static final String REVISION_APPENDED = "revision.appended";
    public static final String METADATA_UPDATED = "metadata.updated";

    public static final String KEK_ROTATED = "kek.rotated";
    public static final String KEK_PRUNED = "kek.pruned";
    public static final String ROTATION_COMPLETED = "rotation.completed";

    public static final String UNWRAP_FAILURE = "crypto.unwrap_failure";
    public static final String AUTHENTICATION_FAILURE = "crypto.authentication_failure";
    public static final String INTEGRITY_VIOLATION = "crypto.integrity_violation";

    /**
     * The actor recorded for events raised by the store itself, such as key rotation.
     */
    public static final String SYSTEM_ACTOR = "system";

    private AuditActions() {}
}
