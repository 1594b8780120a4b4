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
 * A {@link RuntimeException} that is raised when failed to access the document store.
 */
public class DocumentStoreException extends RuntimeException {

    private static final long serialVersionUID = 4417262840171926386L;

    /**
     * Creates a new instance.
     */
    public DocumentStoreException() {}

    /**
     * Creates a new instance.
     */
    public DocumentStoreException(String message) {
        super(message);
    }

    /**
     * Creates a new instance.
     */
    public DocumentStoreException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Creates a new instance.
     */
    public DocumentStoreException(Throwable cause) {
        super(cause);
    }

    /**
     * Creates a new instance.
     *
     * @param message the detail message
     * @param writableStackTrace whether or not the stack trace should be writable
     */
    public DocumentStoreException(String message, boolean writableStackTrace) {
        super(message, null, true, writableStackTrace);
    }

    /**
     * Creates a new instance.
     */
    protected DocumentStoreException(String message, Throwable cause, boolean enableSuppression,
                                     boolean writableStackTrace) {
        super(message, cause, enableSuppression, writableStackTrace);
    }
}
