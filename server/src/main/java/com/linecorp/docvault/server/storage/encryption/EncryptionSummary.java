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

import com.google.common.base.MoreObjects;

/**
 * What {@link EnvelopeCrypto} learned about a plaintext while encrypting or verifying it.
 */
public final class EncryptionSummary {

    private final String checksum;
    private final long sizeBytes;
    private final long chunkCount;

    public EncryptionSummary(String checksum, long sizeBytes, long chunkCount) {
        this.checksum = requireNonNull(checksum, "checksum");
        checkArgument(sizeBytes >= 0, "sizeBytes: %s (expected: >= 0)", sizeBytes);
        this.sizeBytes = sizeBytes;
        checkArgument(chunkCount > 0, "chunkCount: %s (expected: > 0)", chunkCount);
        this.chunkCount = chunkCount;
    }

    /**
     * Returns the lowercase hexadecimal SHA-256 digest of the plaintext.
     */
    public String checksum() {
        return checksum;
    }

    public long sizeBytes() {
        return sizeBytes;
    }

    public long chunkCount() {
        return chunkCount;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                          .add("checksum", checksum)
                          .add("sizeBytes", sizeBytes)
                          .add("chunkCount", chunkCount)
                          .toString();
    }
}
