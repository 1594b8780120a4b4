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

import static java.util.Objects.requireNonNull;

import java.io.IOException;
import java.io.InputStream;
import java.util.Arrays;

import javax.annotation.Nullable;

/**
 * An {@link InputStream} that yields the plaintext of a revision while opening its chunks lazily.
 * At most one chunk is held in memory.
 */
public final class DecryptingInputStream extends InputStream {

    private final ChunkReader reader;
    @Nullable
    private byte[] current;
    private int position;
    private boolean eof;
    private boolean closed;

    public DecryptingInputStream(ChunkReader reader) {
        this.reader = requireNonNull(reader, "reader");
    }

    @Override
    public int read() throws IOException {
        final byte[] one = new byte[1];
        final int n = read(one, 0, 1);
        return n < 0 ? -1 : one[0] & 0xFF;
    }

    @Override
    public int read(byte[] b, int off, int len) throws IOException {
        if (closed) {
            throw new IOException("stream closed");
        }
        if (len == 0) {
            return 0;
        }
        while (current == null || position == current.length) {
            if (eof) {
                return -1;
            }
            discardCurrent();
            current = reader.next();
            position = 0;
            if (current == null) {
                eof = true;
                return -1;
            }
        }

        final int n = Math.min(len, current.length - position);
        System.arraycopy(current, position, b, off, n);
        position += n;
        return n;
    }

    @Override
    public int available() {
        return current != null ? current.length - position : 0;
    }

    @Override
    public void close() {
        closed = true;
        discardCurrent();
    }

    private void discardCurrent() {
        if (current != null) {
            Arrays.fill(current, (byte) 0);
            current = null;
        }
    }
}
