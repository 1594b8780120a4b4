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
 * A {@link DocumentStoreException} that is raised when attempted to access a non-existent revision.
 */
public class RevisionNotFoundException extends DocumentStoreException {

    private static final long serialVersionUID = -7794127049325871163L;

    /**
     * Creates a new instance.
     */
    public RevisionNotFoundException() {}

    /**
     * Creates a new instance.
     */
    public RevisionNotFoundException(String documentId, int revisionNo) {
        this("revision " + revisionNo + " of document " + documentId + " does not exist");
    }

    /**
     * Creates a new instance.
     */
    public RevisionNotFoundException(String message) {
        super(message);
    }

    /**
     * Creates a new instance.
     *
     * @param message the detail message
     * @param writableStackTrace whether or not the stack trace should be writable
     */
    public RevisionNotFoundException(String message, boolean writableStackTrace) {
        super(message, writableStackTrace);
    }
}
