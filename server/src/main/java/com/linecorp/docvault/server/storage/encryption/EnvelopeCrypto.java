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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import java.io.IOException;
import java.io.InputStream;
import java.io.PushbackInputStream;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.util.Arrays;
import java.util.Iterator;
import java.util.concurrent.CancellationException;

import javax.crypto.SecretKey;

import com.google.common.hash.Hasher;
import com.google.common.hash.Hashing;
import com.google.common.io.ByteStreams;

import com.linecorp.docvault.common.AuthenticationFailureException;
import com.linecorp.docvault.common.CryptoException;
import com.linecorp.docvault.common.UnwrapFailureException;
import com.linecorp.docvault.server.internal.storage.encryption.AesGcmCipher;
import com.linecorp.docvault.server.internal.storage.encryption.ChunkCipher;
import com.linecorp.docvault.server.internal.storage.encryption.ChunkReader;
import com.linecorp.docvault.server.internal.storage.encryption.DecryptingInputStream;

/**
 * Envelope encryption of document content.
 *
 * <p>Every revision is encrypted with its own data encryption key (DEK). The DEK is wrapped by the
 * tenant's key encryption key (KEK) with AES-256-GCM, the random 96-bit nonce being prefixed to the
 * output. The content is split into chunks of {@link #chunkSize()} bytes, each sealed independently
 * with AES-256-GCM, so that neither encryption nor decryption ever holds more than one chunk in memory.
 */
public final class EnvelopeCrypto {

    public static final int DEFAULT_CHUNK_SIZE = 64 * 1024;

    // Binds a wrapped DEK to its purpose so that it cannot be confused with a wrapped KEK.
    private static final byte[] DEK_WRAP_AAD = "docvault/dek".getBytes(StandardCharsets.UTF_8);

    private final int chunkSize;

    public EnvelopeCrypto() {
        this(DEFAULT_CHUNK_SIZE);
    }

    public EnvelopeCrypto(int chunkSize) {
        checkArgument(chunkSize > 0, "chunkSize: %s (expected: > 0)", chunkSize);
        this.chunkSize = chunkSize;
    }

    /**
     * Returns the number of plaintext bytes in every chunk but the final one of a new revision.
     */
    public int chunkSize() {
        return chunkSize;
    }

    /**
     * Returns a new random 256-bit data encryption key.
     */
    public byte[] generateDek() {
        return AesGcmCipher.generateAes256Key();
    }

    public byte[] generateNonceBase() {
        return AesGcmCipher.generateNonce();
    }

    public byte[] wrapDek(byte[] dek, SecretKey kek) {
        requireNonNull(dek, "dek");
        requireNonNull(kek, "kek");
        final byte[] nonce = AesGcmCipher.generateNonce();
        try {
            final byte[] sealed = AesGcmCipher.encrypt(kek, nonce, DEK_WRAP_AAD, dek, 0, dek.length);
            final byte[] wrapped = new byte[nonce.length + sealed.length];
            System.arraycopy(nonce, 0, wrapped, 0, nonce.length);
            System.arraycopy(sealed, 0, wrapped, nonce.length, sealed.length);
            return wrapped;
        } catch (GeneralSecurityException e) {
            throw new CryptoException("Failed to wrap a data encryption key", e);
        }
    }

    /**
     * Unwraps a data encryption key.
     *
     * @throws UnwrapFailureException if the key encryption key is not the one that wrapped it, or the
     *                                wrapped key was altered
     */
    public byte[] unwrapDek(byte[] dekCiphertext, SecretKey kek) {
        requireNonNull(dekCiphertext, "dekCiphertext");
        requireNonNull(kek, "kek");
        final int nonceSize = AesGcmCipher.NONCE_SIZE_BYTES;
        if (dekCiphertext.length != nonceSize + AesGcmCipher.KEY_SIZE_BYTES + AesGcmCipher.TAG_SIZE_BYTES) {
            throw new UnwrapFailureException("Invalid wrapped data encryption key length: " +
                                             dekCiphertext.length);
        }
        final byte[] nonce = Arrays.copyOfRange(dekCiphertext, 0, nonceSize);
        try {
            return AesGcmCipher.decrypt(kek, nonce, DEK_WRAP_AAD, dekCiphertext, nonceSize,
                                        dekCiphertext.length - nonceSize);
        } catch (GeneralSecurityException e) {
            throw new UnwrapFailureException("Failed to unwrap a data encryption key", e);
        }
    }

    /**
     * Encrypts the specified plaintext chunk by chunk, handing each sealed chunk to the {@code sink} as
     * soon as it is produced. An empty plaintext yields a single empty chunk.
     *
     * @throws CancellationException if the current thread was interrupted
     * @throws IOException if failed to read the plaintext
     */
    public EncryptionSummary streamEncrypt(byte[] dek, byte[] nonceBase, InputStream plaintext,
                                           ChunkSink sink) throws IOException {
        requireNonNull(plaintext, "plaintext");
        requireNonNull(sink, "sink");
        final ChunkCipher cipher = new ChunkCipher(dek, nonceBase);
        final Hasher hasher = Hashing.sha256().newHasher();
        final PushbackInputStream in = new PushbackInputStream(plaintext, 1);
        final byte[] buf = new byte[chunkSize];
        long index = 0;
        long size = 0;
        try {
            for (;;) {
                if (Thread.currentThread().isInterrupted()) {
                    throw new CancellationException("encryption interrupted at chunk " + index);
                }
                final int n = ByteStreams.read(in, buf, 0, chunkSize);
                final boolean last = n < chunkSize || isEof(in);
                hasher.putBytes(buf, 0, n);
                size += n;
                sink.accept(index, cipher.seal(index, last, buf, 0, n));
                index++;
                if (last) {
                    break;
                }
            }
        } finally {
            Arrays.fill(buf, (byte) 0);
        }
        return new EncryptionSummary(hasher.hash().toString(), size, index);
    }

    private static boolean isEof(PushbackInputStream in) throws IOException {
        final int next = in.read();
        if (next < 0) {
            return true;
        }
        in.unread(next);
        return false;
    }

    /**
     * Returns a stream of the plaintext of the specified sealed chunks. Chunks are read and authenticated
     * lazily, and {@link AuthenticationFailureException} is raised by the {@code read} call that reaches
     * a chunk failing authentication.
     */
    public InputStream streamDecrypt(byte[] dek, byte[] nonceBase, int chunkSize,
                                     Iterator<byte[]> sealedChunks) {
        return new DecryptingInputStream(new ChunkReader(new ChunkCipher(dek, nonceBase), chunkSize,
                                                         sealedChunks));
    }

    /**
     * Authenticates every chunk and computes the checksum of the plaintext without releasing any of it.
     *
     * @throws AuthenticationFailureException if a chunk failed authentication
     * @throws CancellationException if the current thread was interrupted
     */
    public EncryptionSummary verify(byte[] dek, byte[] nonceBase, int chunkSize,
                                    Iterator<byte[]> sealedChunks) {
        final ChunkReader reader = new ChunkReader(new ChunkCipher(dek, nonceBase), chunkSize, sealedChunks);
        final Hasher hasher = Hashing.sha256().newHasher();
        long size = 0;
        for (byte[] chunk = reader.next(); chunk != null; chunk = reader.next()) {
            hasher.putBytes(chunk);
            size += chunk.length;
            Arrays.fill(chunk, (byte) 0);
        }
        return new EncryptionSummary(hasher.hash().toString(), size, reader.chunkCount());
    }
}
