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
 * The kind of a {@link DocumentNode}.
 */
public enum NodeKind {
    /**
     * A node that may contain other nodes but never holds content.
     */
    FOLDER("folder"),
    /**
     * A leaf node whose content is kept as a sequence of encrypted revisions.
     */
    DOCUMENT("doc");

    private final String slugFallbackPrefix;

    NodeKind(String slugFallbackPrefix) {
        this.slugFallbackPrefix = slugFallbackPrefix;
    }

    /**
     * Returns the prefix of the slug used when a title has no URL-safe characters.
     */
    public String slugFallbackPrefix() {
        return slugFallbackPrefix;
    }
}
