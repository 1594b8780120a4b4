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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import java.time.Instant;
import java.util.Arrays;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.MoreObjects;

/**
 * An immutable, encrypted snapshot of a document's content.
 *
 * <p>This type carries the header of a revision only. The ciphertext itself is kept as a sequence of
 * sealed chunks next to it and is never loaded as a whole. The wrapped data encryption key
 * ({@link #dekCiphertext()}) and the {@link #kekVersion()} that wrapped it are the only columns that
 * change after creation, when the key encryption key of the tenant is rotated.
 */
public final class DocumentRevision {

    private final String id;
    private final String tenantId;
    private final String documentId;
    private final int revisionNo;
    private final byte[] dekCiphertext;
    private final int kekVersion;
    private final byte[] nonceBase;
    private final String checksum;
    private final long sizeBytes;
    private final int chunkSize;
    private final long chunkCount;
    private final String contentType;
    private final String createdBy;
    private final Instant createdAt;

    /**
     * Creates a new instance.
     */
    @JsonCreator
    public DocumentRevision(@JsonProperty("id") String id,
                            @JsonProperty("tenantId") String tenantId,
                            @JsonProperty("documentId") String documentId,
                            @JsonProperty("revisionNo") int revisionNo,
                            @JsonProperty("dekCiphertext") byte[] dekCiphertext,
                            @JsonProperty("kekVersion") int kekVersion,
                            @JsonProperty("nonceBase") byte[] nonceBase,
                            @JsonProperty("checksum") String checksum,
                            @JsonProperty("sizeBytes") long sizeBytes,
                            @JsonProperty("chunkSize") int chunkSize,
                            @JsonProperty("chunkCount") long chunkCount,
                            @JsonProperty("contentType") String contentType,
                            @JsonProperty("createdBy") String createdBy,
                            @JsonProperty("createdAt") Instant createdAt) {
        this.id = requireNonNull(id, "id");
        this.tenantId = requireNonNull(tenantId, "tenantId");
        this.documentId = requireNonNull(documentId, "documentId");
        checkArgument(revisionNo > 0, "revisionNo: %s (expected: > 0)", revisionNo);
        this.revisionNo = revisionNo;
        this.dekCiphertext = requireNonNull(dekCiphertext, "dekCiphertext");
        checkArgument(kekVersion > 0, "kekVersion: %s (expected: > 0)", kekVersion);
        this.kekVersion = kekVersion;
        this.nonceBase = requireNonNull(nonceBase, "nonceBase");
        this.checksum = requireNonNull(checksum, "checksum");
        checkArgument(sizeBytes >= 0, "sizeBytes: %s (expected: >= 0)", sizeBytes);
        this.sizeBytes = sizeBytes;
        checkArgument(chunkSize > 0, "chunkSize: %s (expected: > 0)", chunkSize);
        this.chunkSize = chunkSize;
        checkArgument(chunkCount > 0, "chunkCount: %s (expected: > 0)", chunkCount);
        this.chunkCount = chunkCount;
        this.contentType = requireNonNull(contentType, "contentType");
        this.createdBy = requireNonNull(createdBy, "createdBy");
        this.createdAt = requireNonNull(createdAt, "createdAt");
    }

    @JsonProperty
    public String id() {
        return id;
    }

    @JsonProperty
    public String tenantId() {
        return tenantId;
    }

    @JsonProperty
    public String documentId() {
        return documentId;
    }

    /**
     * Returns the revision number, starting from {@code 1} and increasing by one per document.
     */
    @JsonProperty
    public int revisionNo() {
        return revisionNo;
    }

    /**
     * Returns the data encryption key of this revision, wrapped by the key encryption key of
     * {@link #kekVersion()}.
     */
    @JsonProperty
    public byte[] dekCiphertext() {
        return dekCiphertext.clone();
    }

    @JsonProperty
    public int kekVersion() {
        return kekVersion;
    }

    /**
     * Returns the value from which the nonce of every chunk is derived.
     */
    @JsonProperty
    public byte[] nonceBase() {
        return nonceBase.clone();
    }

    /**
     * Returns the lowercase hexadecimal SHA-256 digest of the plaintext.
     */
    @JsonProperty
    public String checksum() {
        return checksum;
    }

    /**
     * Returns the length of the plaintext.
     */
    @JsonProperty
    public long sizeBytes() {
        return sizeBytes;
    }

    /**
     * Returns the maximum number of plaintext bytes in a chunk of this revision.
     */
    @JsonProperty
    public int chunkSize() {
        return chunkSize;
    }

    @JsonProperty
    public long chunkCount() {
        return chunkCount;
    }

    @JsonProperty
    public String contentType() {
        return contentType;
    }

    @JsonProperty
    public String createdBy() {
        return createdBy;
    }

    @JsonProperty
    public Instant createdAt() {
        return createdAt;
    }

    /**
     * Returns a copy of this revision whose data encryption key is wrapped by another key encryption
     * key version. Nothing else changes.
     */
    public DocumentRevision withWrappedDek(byte[] dekCiphertext, int kekVersion) {
        return new DocumentRevision(id, tenantId, documentId, revisionNo, dekCiphertext, kekVersion,
                                    nonceBase, checksum, sizeBytes, chunkSize, chunkCount, contentType,
                                    createdBy, createdAt);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DocumentRevision)) {
            return false;
        }
        final DocumentRevision that = (DocumentRevision) o;
        return revisionNo == that.revisionNo &&
               kekVersion == that.kekVersion &&
               sizeBytes == that.sizeBytes &&
               chunkSize == that.chunkSize &&
               chunkCount == that.chunkCount &&
               id.equals(that.id) &&
               tenantId.equals(that.tenantId) &&
               documentId.equals(that.documentId) &&
               Arrays.equals(dekCiphertext, that.dekCiphertext) &&
               Arrays.equals(nonceBase, that.nonceBase) &&
               checksum.equals(that.checksum) &&
               contentType.equals(that.contentType) &&
               createdBy.equals(that.createdBy) &&
               createdAt.equals(that.createdAt);
    }

    @Override
    public int hashCode() {
        return id.hashCode() * 31 + kekVersion;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                          .add("id", id)
                          .add("tenantId", tenantId)
                          .add("documentId", documentId)
                          .add("revisionNo", revisionNo)
                          .add("dekCiphertext", "****")
                          .add("kekVersion", kekVersion)
                          .add("checksum", checksum)
                          .add("sizeBytes", sizeBytes)
                          .add("chunkSize", chunkSize)
                          .add("chunkCount", chunkCount)
                          .add("contentType", contentType)
                          .add("createdBy", createdBy)
                          .add("createdAt", createdAt)
                          .toString();
    }
}
