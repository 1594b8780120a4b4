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
package com.linecorp.docvault.server.internal.storage.tree;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import java.nio.charset.StandardCharsets;
import java.text.Normalizer;
import java.util.Locale;
import java.util.regex.Pattern;

import com.google.common.hash.Hashing;

import com.linecorp.docvault.common.NodeKind;

/**
 * Derives URL-safe node names from titles.
 */
public final class Slugs {

    /**
     * The maximum number of candidates tried before giving up on a unique slug.
     */
    public static final int MAX_SLUG_ATTEMPTS = 50;

    static final int MAX_SLUG_LENGTH = 160;

    private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{M}+");
    private static final Pattern UNSAFE_CHARS = Pattern.compile("[^a-z0-9]+");

    /**
     * Returns the base slug of the specified title: NFKD-normalized, lowercased, with every run of
     * characters other than {@code [a-z0-9]} replaced by a single {@code '-'}.
     *
     * @throws IllegalArgumentException if the title is blank
     */
    public static String slugify(String title, NodeKind kind) {
        requireNonNull(title, "title");
        requireNonNull(kind, "kind");
        checkArgument(!title.isBlank(), "title is blank.");

        String slug = Normalizer.normalize(title, Normalizer.Form.NFKD);
        slug = COMBINING_MARKS.matcher(slug).replaceAll("");
        slug = UNSAFE_CHARS.matcher(slug.toLowerCase(Locale.ROOT)).replaceAll("-");
        slug = trimHyphens(slug);
        if (slug.length() > MAX_SLUG_LENGTH) {
            slug = trimHyphens(slug.substring(0, MAX_SLUG_LENGTH));
        }
        if (slug.isEmpty()) {
            final String hash = Hashing.sha256().hashString(title, StandardCharsets.UTF_8).toString();
            return kind.slugFallbackPrefix() + '-' + hash.substring(0, 8);
        }
        return slug;
    }

    /**
     * Returns the {@code attempt}-th candidate of the specified base slug, i.e. {@code base},
     * {@code base-2}, {@code base-3} and so on.
     */
    public static String candidate(String base, int attempt) {
        checkArgument(attempt > 0 && attempt <= MAX_SLUG_ATTEMPTS,
                      "attempt: %s (expected: 1 .. %s)", attempt, MAX_SLUG_ATTEMPTS);
        return attempt == 1 ? base : base + '-' + attempt;
    }

    private static String trimHyphens(String slug) {
        int start = 0;
        int end = slug.length();
        while (start < end && slug.charAt(start) == '-') {
            start++;
        }
        while (end > start && slug.charAt(end - 1) == '-') {
            end--;
        }
        return slug.substring(start, end);
    }

    private Slugs() {}
}
