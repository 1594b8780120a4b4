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
package com.linecorp.docvault.server.internal.storage;

import static com.google.common.base.Preconditions.checkArgument;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;

import javax.annotation.Nullable;

import com.google.common.base.Joiner;
import com.google.common.primitives.Bytes;
import com.google.common.primitives.Ints;
import com.google.common.primitives.Longs;

/**
 * Builds the keys of the column families in {@link RocksDBStorage}. Every key starts with a textual
 * prefix whose segments are delimited by {@code '/'}, so that a prefix scan over {@code "tenant/"}
 * never matches another tenant. Numeric suffixes are big-endian so that they sort numerically.
 */
public final class DbKeys {

    // The parent segment of the slug index entries of tenant roots. Never a valid node ID.
    private static final String ROOT_PARENT = "_root";
    private static final Joiner PATH_JOINER = Joiner.on('/');

    public static byte[] nodeKey(String tenantId, String nodeId) {
        return utf8(tenantId + '/' + nodeId);
    }

    public static byte[] pathKey(String tenantId, List<String> path) {
        return utf8(tenantId + '/' + PATH_JOINER.join(path));
    }

    /**
     * Returns the prefix shared by the path index entries of the descendants of the node at the
     * specified path. The node itself does not match.
     */
    public static byte[] descendantsPrefix(String tenantId, List<String> path) {
        return utf8(tenantId + '/' + PATH_JOINER.join(path) + '/');
    }

    public static byte[] slugKey(String tenantId, @Nullable String parentId, String slug) {
        return utf8(tenantId + '/' + parentSegment(parentId) + '/' + slug);
    }

    public static byte[] childrenPrefix(String tenantId, @Nullable String parentId) {
        return utf8(tenantId + '/' + parentSegment(parentId) + '/');
    }

    public static byte[] metadataKey(String tenantId, String documentId) {
        return utf8(tenantId + '/' + documentId);
    }

    public static byte[] revisionKey(String tenantId, String documentId, int revisionNo) {
        return Bytes.concat(revisionsPrefix(tenantId, documentId), Ints.toByteArray(revisionNo));
    }

    public static byte[] revisionsPrefix(String tenantId, String documentId) {
        return utf8(tenantId + '/' + documentId + '/');
    }

    public static byte[] tenantPrefix(String tenantId) {
        return utf8(tenantId + '/');
    }

    public static byte[] chunkKey(String revisionId, long chunkIndex) {
        return Bytes.concat(chunksPrefix(revisionId), Longs.toByteArray(chunkIndex));
    }

    public static byte[] chunksPrefix(String revisionId) {
        return utf8(revisionId + '/');
    }

    public static byte[] tenantKeyKey(String tenantId) {
        return utf8(tenantId);
    }

    public static byte[] tenantKeyVersionKey(String tenantId, int kekVersion) {
        return Bytes.concat(tenantPrefix(tenantId), Ints.toByteArray(kekVersion));
    }

    /**
     * Returns the smallest key greater than every key that starts with the specified prefix.
     */
    public static byte[] prefixEnd(byte[] prefix) {
        checkArgument(prefix.length > 0, "prefix is empty.");
        final byte[] end = Arrays.copyOf(prefix, prefix.length);
        for (int i = end.length - 1; i >= 0; i--) {
            if (end[i] != (byte) 0xFF) {
                end[i]++;
                return Arrays.copyOf(end, i + 1);
            }
        }
        throw new IllegalArgumentException("prefix has no upper bound: " + toString(prefix));
    }

    public static boolean startsWith(byte[] key, byte[] prefix) {
        if (key.length < prefix.length) {
            return false;
        }
        for (int i = 0; i < prefix.length; i++) {
            if (key[i] != prefix[i]) {
                return false;
            }
        }
        return true;
    }

    /**
     * Returns the human-readable form of a key for logging. Binary suffixes are rendered as hex.
     */
    public static String toString(byte[] key) {
        final StringBuilder buf = new StringBuilder(key.length + 8);
        for (byte b : key) {
            if (b >= 0x20 && b < 0x7F) {
                buf.append((char) b);
            } else {
                buf.append(String.format("\\x%02x", b & 0xFF));
            }
        }
        return buf.toString();
    }

    private static String parentSegment(@Nullable String parentId) {
        return parentId != null ? parentId : ROOT_PARENT;
    }

    private static byte[] utf8(String key) {
        return key.getBytes(StandardCharsets.UTF_8);
    }

    private DbKeys() {}
}
