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

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.util.Arrays;
import java.util.Base64;

import javax.crypto.SecretKey;
import javax.crypto.SecretKeyFactory;
import javax.crypto.spec.PBEKeySpec;

import com.google.common.base.MoreObjects;

import com.linecorp.docvault.common.CryptoException;
import com.linecorp.docvault.common.UnwrapFailureException;

/**
 * A key provider whose root key is derived from a secret with PBKDF2-HMAC-SHA256. The wrap of each tenant
 * key is bound to the tenant and the version, so that a wrapped key cannot be replayed under another
 * tenant or version.
 */
public final class LocalKeyProvider extends AbstractKeyProvider {

    public static final int DEFAULT_KDF_ITERATIONS = 210_000;

    private static final String KDF_ALGORITHM = "PBKDF2WithHmacSHA256";

    private final SecretKey rootKey;
    private final int kdfIterations;

    public LocalKeyProvider(TenantKeyStorage storage, String kekCacheSpec,
                            String secret, String salt, int kdfIterations) {
        super(storage, kekCacheSpec);
        requireNonNull(secret, "secret");
        requireNonNull(salt, "salt");
        checkArgument(!secret.isEmpty(), "secret is empty.");
        checkArgument(!salt.isEmpty(), "salt is empty.");
        checkArgument(kdfIterations > 0, "kdfIterations: %s (expected: > 0)", kdfIterations);
        this.kdfIterations = kdfIterations;
        rootKey = deriveRootKey(secret, salt, kdfIterations);
    }

    private static SecretKey deriveRootKey(String secret, String salt, int iterations) {
        final char[] password = secret.toCharArray();
        final PBEKeySpec spec = new PBEKeySpec(password, salt.getBytes(StandardCharsets.UTF_8), iterations,
                                               AesGcmCipher.KEY_SIZE_BYTES * 8);
        try {
            final byte[] derived = SecretKeyFactory.getInstance(KDF_ALGORITHM)
                                                   .generateSecret(spec)
                                                   .getEncoded();
            try {
                return AesGcmCipher.aesSecretKey(derived);
            } finally {
                Arrays.fill(derived, (byte) 0);
            }
        } catch (GeneralSecurityException e) {
            throw new CryptoException("Failed to derive the root key", e);
        } finally {
            spec.clearPassword();
            Arrays.fill(password, '\0');
        }
    }

    @Override
    protected String wrapKek(String tenantId, int version, byte[] kek) {
        final byte[] nonce = AesGcmCipher.generateNonce();
        try {
            final byte[] sealed = AesGcmCipher.encrypt(rootKey, nonce, aad(tenantId, version), kek, 0,
                                                       kek.length);
            final byte[] wrapped = new byte[nonce.length + sealed.length];
            System.arraycopy(nonce, 0, wrapped, 0, nonce.length);
            System.arraycopy(sealed, 0, wrapped, nonce.length, sealed.length);
            return Base64.getEncoder().encodeToString(wrapped);
        } catch (GeneralSecurityException e) {
            throw new CryptoException("Failed to wrap the key encryption key of " + tenantId + '/' + version,
                                      e);
        }
    }

    @Override
    protected byte[] unwrapKek(String tenantId, int version, String kekCiphertext) {
        final byte[] wrapped;
        try {
            wrapped = Base64.getDecoder().decode(kekCiphertext);
        } catch (IllegalArgumentException e) {
            throw new UnwrapFailureException("Malformed key encryption key of " + tenantId + '/' + version, e);
        }
        final int nonceSize = AesGcmCipher.NONCE_SIZE_BYTES;
        if (wrapped.length <= nonceSize + AesGcmCipher.TAG_SIZE_BYTES) {
            throw new UnwrapFailureException("Malformed key encryption key of " + tenantId + '/' + version);
        }
        try {
            return AesGcmCipher.decrypt(rootKey, Arrays.copyOf(wrapped, nonceSize), aad(tenantId, version),
                                        wrapped, nonceSize, wrapped.length - nonceSize);
        } catch (GeneralSecurityException e) {
            throw new UnwrapFailureException(
                    "Failed to unwrap the key encryption key of " + tenantId + '/' + version, e);
        }
    }

    private static byte[] aad(String tenantId, int version) {
        return (tenantId + '/' + version).getBytes(StandardCharsets.UTF_8);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                          .add("rootKey", "****")
                          .add("kdfIterations", kdfIterations)
                          .toString();
    }
}
