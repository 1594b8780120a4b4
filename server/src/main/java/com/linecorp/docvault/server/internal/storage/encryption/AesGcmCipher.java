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

import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.security.Security;

import javax.annotation.Nullable;
import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;

import org.bouncycastle.jce.provider.BouncyCastleProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class AesGcmCipher {

    private static final Logger logger = LoggerFactory.getLogger(AesGcmCipher.class);

    private static final String ALGORITHM = "AES/GCM/NoPadding";
    public static final int KEY_SIZE_BYTES = 32;
    public static final int NONCE_SIZE_BYTES = 12;
    private static final int TAG_SIZE_BITS = 128;
    public static final int TAG_SIZE_BYTES = TAG_SIZE_BITS / 8;

    private static final SecureRandom SECURE_RANDOM = new SecureRandom();

    private static final String PROVIDER = BouncyCastleProvider.PROVIDER_NAME;

    static {
        if (Security.getProvider(PROVIDER) == null) {
            Security.addProvider(new BouncyCastleProvider());
        }
        logger.info("Using cryptographic provider: {}", PROVIDER);
    }

    public static byte[] generateAes256Key() {
        final byte[] keyBytes = new byte[KEY_SIZE_BYTES];
        SECURE_RANDOM.nextBytes(keyBytes);
        return keyBytes;
    }

    public static byte[] generateNonce() {
        final byte[] nonce = new byte[NONCE_SIZE_BYTES];
        SECURE_RANDOM.nextBytes(nonce);
        return nonce;
    }

    public static SecretKey aesSecretKey(byte[] key) {
        if (key.length != KEY_SIZE_BYTES) {
            throw new IllegalArgumentException(
                    "key.length: " + key.length + " (expected: " + KEY_SIZE_BYTES + ')');
        }
        return new SecretKeySpec(key, "AES");
    }

    public static byte[] encrypt(SecretKey key, byte[] nonce, @Nullable byte[] aad,
                                 byte[] data, int off, int len) throws GeneralSecurityException {
        final Cipher cipher = Cipher.getInstance(ALGORITHM, PROVIDER);
        cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(TAG_SIZE_BITS, nonce));
        if (aad != null) {
            cipher.updateAAD(aad);
        }
        return cipher.doFinal(data, off, len);
    }

    /**
     * Decrypts and authenticates the specified ciphertext.
     *
     * @throws javax.crypto.AEADBadTagException if the ciphertext, the nonce or the associated data
     *                                          was altered, or the key is not the one that encrypted it
     */
    public static byte[] decrypt(SecretKey key, byte[] nonce, @Nullable byte[] aad,
                                 byte[] ciphertext, int off, int len) throws GeneralSecurityException {
        final Cipher cipher = Cipher.getInstance(ALGORITHM, PROVIDER);
        cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(TAG_SIZE_BITS, nonce));
        if (aad != null) {
            cipher.updateAAD(aad);
        }
        return cipher.doFinal(ciphertext, off, len);
    }

    private AesGcmCipher() {}
}
