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
package com.linecorp.docvault.server.internal.storage.encryption;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import java.util.Iterator;
import java.util.concurrent.CancellationException;

import javax.annotation.Nullable;

import com.linecorp.docvault.common.AuthenticationFailureException;
import com.linecorp.docvault.common.IntegrityViolationException;

/**
 * Opens the sealed chunks of a revision one at a time, in order.
 */
public final class ChunkReader {

    private final ChunkCipher cipher;
    private final int chunkSize;
    private final Iterator<byte[]> sealedChunks;
    private long nextIndex;
    private boolean finished;

    public ChunkReader(ChunkCipher cipher, int chunkSize, Iterator<byte[]> sealedChunks) {
        this.cipher = requireNonNull(cipher, "cipher");
        checkArgument(chunkSize > 0, "chunkSize: %s (expected: > 0)", chunkSize);
        this.chunkSize = chunkSize;
        this.sealedChunks = requireNonNull(sealedChunks, "sealedChunks");
    }

    /**
     * Returns the plaintext of the next chunk, or {@code null} after the final chunk was returned.
     *
     * @throws AuthenticationFailureException if the chunk failed authentication, or the sequence has no
     *                                        final chunk
     * @throws CancellationException if the current thread was interrupted
     */
    @Nullable
    public byte[] next() {
        if (finished) {
            return null;
        }
        if (Thread.currentThread().isInterrupted()) {
            throw new CancellationException("decryption interrupted at chunk " + nextIndex);
        }
        if (!sealedChunks.hasNext()) {
            throw new AuthenticationFailureException("missing chunk " + nextIndex);
        }

        final long index = nextIndex++;
        final byte[] sealed = sealedChunks.next();
        final boolean last = !sealedChunks.hasNext();
        final byte[] plaintext = cipher.open(index, last, sealed);
        if (plaintext.length > chunkSize || (!last && plaintext.length != chunkSize)) {
            throw new IntegrityViolationException(
                    "chunk " + index + " has " + plaintext.length + " bytes (chunk size: " + chunkSize + ')');
        }
        finished = last;
        return plaintext;
    }

    /**
     * Returns the number of chunks opened so far.
     */
    public long chunkCount() {
        return nextIndex;
    }
}
