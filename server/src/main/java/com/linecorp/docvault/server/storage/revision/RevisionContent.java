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
package com.linecorp.docvault.server.storage.revision;

import static java.util.Objects.requireNonNull;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;

import com.google.common.base.MoreObjects;

import com.linecorp.armeria.common.util.SafeCloseable;
import com.linecorp.docvault.common.DocumentRevision;

/**
 * The header and the plaintext of a revision which passed authentication and checksum verification.
 *
 * <p>The plaintext is decrypted lazily while it is read, from the storage snapshot at which it was
 * verified. The snapshot is released when the content is closed, so the content must always be closed.
 */
public final class RevisionContent implements SafeCloseable {

    private final DocumentRevision revision;
    private final InputStream plaintext;

    RevisionContent(DocumentRevision revision, InputStream plaintext) {
        this.revision = requireNonNull(revision, "revision");
        this.plaintext = requireNonNull(plaintext, "plaintext");
    }

    public DocumentRevision revision() {
        return revision;
    }

    /**
     * Returns the plaintext stream. Closing it is equivalent to closing this content.
     */
    public InputStream plaintext() {
        return plaintext;
    }

    @Override
    public void close() {
        try {
            plaintext.close();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                          .add("revision", revision)
                          .toString();
    }
}
