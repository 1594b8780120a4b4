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

import java.security.GeneralSecurityException;

import javax.crypto.SecretKey;

import com.google.common.primitives.Longs;

import com.linecorp.docvault.common.AuthenticationFailureException;
import com.linecorp.docvault.common.CryptoException;

/**
 * Seals and opens the chunks of a revision's content.
 *
 * <p>The nonce of a chunk is the revision's nonce base whose last 8 bytes are XOR'd with the chunk index,
 * so no two chunks of a revision share a nonce. The associated data of a chunk is its index followed by a
 * flag telling whether it is the final chunk, which makes reordering, truncation and extension of the
 * chunk sequence fail authentication.
 */
public final class ChunkCipher {

    private static final byte FINAL = 1;
    private static final byte NOT_FINAL = 0;

    private final SecretKey key;
    private final byte[] nonceBase;

    public ChunkCipher(byte[] dek, byte[] nonceBase) {
        key = AesGcmCipher.aesSecretKey(requireNonNull(dek, "dek"));
        requireNonNull(nonceBase, "nonceBase");
        checkArgument(nonceBase.length == AesGcmCipher.NONCE_SIZE_BYTES,
                      "nonceBase.length: %s (expected: %s)", nonceBase.length, AesGcmCipher.NONCE_SIZE_BYTES);
        this.nonceBase = nonceBase.clone();
    }

    public byte[] seal(long chunkIndex, boolean last, byte[] data, int off, int len) {
        try {
            return AesGcmCipher.encrypt(key, nonce(chunkIndex), aad(chunkIndex, last), data, off, len);
        } catch (GeneralSecurityException e) {
            throw new CryptoException("Failed to seal chunk " + chunkIndex, e);
        }
    }

    /**
     * Authenticates and decrypts a chunk.
     *
     * @throws AuthenticationFailureException if the chunk was altered, moved, or is not where it claims
     *                                        to be in the sequence
     */
    public byte[] open(long chunkIndex, boolean last, byte[] sealedChunk) {
        if (sealedChunk.length < AesGcmCipher.TAG_SIZE_BYTES) {
            throw new AuthenticationFailureException(
                    "chunk " + chunkIndex + " is too short: " + sealedChunk.length + " bytes");
        }
        try {
            return AesGcmCipher.decrypt(key, nonce(chunkIndex), aad(chunkIndex, last),
                                        sealedChunk, 0, sealedChunk.length);
        } catch (GeneralSecurityException e) {
            throw new AuthenticationFailureException("chunk " + chunkIndex + " failed authentication", e);
        }
    }

    private byte[] nonce(long chunkIndex) {
        final byte[] nonce = nonceBase.clone();
        final byte[] index = Longs.toByteArray(chunkIndex);
        final int offset = nonce.length - index.length;
        for (int i = 0; i < index.length; i++) {
            nonce[offset + i] ^= index[i];
        }
        return nonce;
    }

    private static byte[] aad(long chunkIndex, boolean last) {
        final byte[] aad = new byte[Long.BYTES + 1];
        System.arraycopy(Longs.toByteArray(chunkIndex), 0, aad, 0, Long.BYTES);
        aad[Long.BYTES] = last ? FINAL : NOT_FINAL;
        return aad;
    }
}
