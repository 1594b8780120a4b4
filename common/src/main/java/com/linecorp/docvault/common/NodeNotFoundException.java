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

/**
 * A {@link DocumentStoreException} that is raised when attempted to access a non-existent
 * {@link DocumentNode}, or a node that belongs to another tenant.
 */
public class NodeNotFoundException extends DocumentStoreException {

    private static final long serialVersionUID = -2236381962263271458L;

    /**
     * Returns a new {@link NodeNotFoundException} for the specified node.
     */
    public static NodeNotFoundException of(String tenantId, String nodeId) {
        return new NodeNotFoundException("node not found: " + tenantId + '/' + nodeId);
    }

    /**
     * Creates a new instance.
     */
    public NodeNotFoundException() {}

    /**
     * Creates a new instance.
     */
    public NodeNotFoundException(String message) {
        super(message);
    }

    /**
     * Creates a new instance.
     */
    public NodeNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
