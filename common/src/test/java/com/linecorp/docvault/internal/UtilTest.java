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
package com.linecorp.docvault.internal;

import static com.linecorp.docvault.internal.Util.validateId;
import static com.linecorp.docvault.internal.Util.validateTenantId;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class UtilTest {

    @Test
    void tenantIds() {
        assertThat(validateTenantId("acme", "tenantId")).isEqualTo("acme");
        assertThat(validateTenantId("acme.eu-1", "tenantId")).isEqualTo("acme.eu-1");

        // No separators, they delimit storage keys.
        assertThatThrownBy(() -> validateTenantId("acme/eu", "tenantId"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageStartingWith("tenantId: acme/eu");
        assertThatThrownBy(() -> validateTenantId("", "tenantId"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> validateTenantId(".acme", "tenantId"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void ids() {
        assertThat(validateId("6f1c2a5e-0b5c-4c39-9d0e-1a7f0f3f2d11", "nodeId")).isNotNull();
        assertThatThrownBy(() -> validateId("a/b", "nodeId")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> validateId("a.b", "nodeId")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> validateId(null, "nodeId")).isInstanceOf(NullPointerException.class);
    }
}
