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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import com.google.common.base.Strings;

import com.linecorp.docvault.common.NodeKind;

class SlugsTest {

    @ParameterizedTest
    @CsvSource({
            "Matters, matters",
            "Q3 Board Minutes, q3-board-minutes",
            "  --Intake.md--  , intake-md",
            "Café Crème, cafe-creme",
            "a___b...c, a-b-c",
            "ﬁle, file"
    })
    void slugify(String title, String expected) {
        assertThat(Slugs.slugify(title, NodeKind.DOCUMENT)).isEqualTo(expected);
    }

    @Test
    void titleWithoutSlugCharactersFallsBackToHash() {
        final String docSlug = Slugs.slugify("契約書", NodeKind.DOCUMENT);
        assertThat(docSlug).matches("doc-[0-9a-f]{8}");
        assertThat(Slugs.slugify("契約書", NodeKind.DOCUMENT)).isEqualTo(docSlug);
        assertThat(Slugs.slugify("契約書", NodeKind.FOLDER)).matches("folder-[0-9a-f]{8}");
        assertThat(Slugs.slugify("???", NodeKind.DOCUMENT)).isNotEqualTo(docSlug);
    }

    @Test
    void longTitleIsTruncated() {
        final String slug = Slugs.slugify(Strings.repeat("ab ", 100), NodeKind.FOLDER);
        assertThat(slug).hasSizeLessThanOrEqualTo(Slugs.MAX_SLUG_LENGTH)
                        .doesNotEndWith("-")
                        .startsWith("ab-ab");
    }

    @Test
    void blankTitle_shouldBeRejected() {
        assertThatThrownBy(() -> Slugs.slugify("  ", NodeKind.FOLDER))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void candidates() {
        assertThat(Slugs.candidate("intake", 1)).isEqualTo("intake");
        assertThat(Slugs.candidate("intake", 2)).isEqualTo("intake-2");
        assertThat(Slugs.candidate("intake", Slugs.MAX_SLUG_ATTEMPTS)).isEqualTo("intake-50");
        assertThatThrownBy(() -> Slugs.candidate("intake", Slugs.MAX_SLUG_ATTEMPTS + 1))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
