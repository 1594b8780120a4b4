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

package com.linecorp.docvault.server;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.fasterxml.jackson.databind.JsonMappingException;
import com.google.common.collect.ImmutableList;

import com.linecorp.docvault.internal.Jackson;
import com.linecorp.docvault.server.internal.storage.encryption.AbstractKeyProvider;
import com.linecorp.docvault.server.internal.storage.encryption.ExternalKeyProvider;
import com.linecorp.docvault.server.internal.storage.encryption.LocalKeyProvider;
import com.linecorp.docvault.server.storage.encryption.EnvelopeCrypto;

class DocumentStoreConfigTest {

    @TempDir
    Path tempDir;

    @Test
    void minimalLocalConfig() throws Exception {
        final DocumentStoreConfig config = DocumentStoreConfig.load(
                "{ \"dataDir\": \"/var/lib/docvault\"," +
                "  \"keyProvider\": { \"secret\": \"s3cret\", \"salt\": \"pepper\" } }");

        assertThat(config.dataDir()).isEqualTo(new File("/var/lib/docvault"));
        assertThat(config.chunkSize()).isEqualTo(EnvelopeCrypto.DEFAULT_CHUNK_SIZE);
        assertThat(config.keyProvider().type()).isEqualTo(KeyProviderConfig.Type.LOCAL);
        assertThat(config.keyProvider().secret()).isEqualTo("s3cret");
        assertThat(config.keyProvider().salt()).isEqualTo("pepper");
        assertThat(config.keyProvider().kdfIterations()).isEqualTo(LocalKeyProvider.DEFAULT_KDF_ITERATIONS);
        assertThat(config.keyProvider().kekCacheSpec()).isEqualTo(AbstractKeyProvider.DEFAULT_KEK_CACHE_SPEC);
        assertThat(config.rotation().batchSize()).isEqualTo(RotationConfig.DEFAULT.batchSize());
        assertThat(config.rotation().maxAttempts()).isEqualTo(RotationConfig.DEFAULT.maxAttempts());
    }

    @Test
    void fullExternalConfig() throws Exception {
        final DocumentStoreConfig config = DocumentStoreConfig.load(
                "{ \"dataDir\": \"data\"," +
                "  \"chunkSize\": 4096," +
                "  \"keyProvider\": {" +
                "    \"type\": \"external\"," +
                "    \"kekId\": \"projects/acme/keys/docvault\"," +
                "    \"unwrapTimeoutMillis\": 2500," +
                "    \"kekCacheSpec\": \"maximumSize=10\"" +
                "  }," +
                "  \"rotation\": {" +
                "    \"batchSize\": 50," +
                "    \"retryInitialDelayMillis\": 200," +
                "    \"retryMaxDelayMillis\": 5000," +
                "    \"maxAttempts\": 3" +
                "  }," +
                "  \"unknownProperty\": true }");

        assertThat(config.chunkSize()).isEqualTo(4096);
        final KeyProviderConfig keyProvider = config.keyProvider();
        assertThat(keyProvider.type()).isEqualTo(KeyProviderConfig.Type.EXTERNAL);
        assertThat(keyProvider.kekId()).isEqualTo("projects/acme/keys/docvault");
        assertThat(keyProvider.unwrapTimeoutMillis()).isEqualTo(2500);
        assertThat(keyProvider.kekCacheSpec()).isEqualTo("maximumSize=10");
        assertThat(keyProvider.secret()).isNull();
        final RotationConfig rotation = config.rotation();
        assertThat(rotation.batchSize()).isEqualTo(50);
        assertThat(rotation.retryInitialDelayMillis()).isEqualTo(200);
        assertThat(rotation.retryMaxDelayMillis()).isEqualTo(5000);
        assertThat(rotation.maxAttempts()).isEqualTo(3);
    }

    @Test
    void externalDefaults() {
        final KeyProviderConfig keyProvider = KeyProviderConfig.ofExternal("root");
        assertThat(keyProvider.unwrapTimeoutMillis()).isEqualTo(ExternalKeyProvider.DEFAULT_TIMEOUT_MILLIS);
    }

    @Test
    void secretsFromFileAndEnvironment() throws Exception {
        final Path secretFile = tempDir.resolve("secret");
        Files.write(secretFile, "  s3cret\n".getBytes(StandardCharsets.UTF_8));

        final DocumentStoreConfig config = DocumentStoreConfig.load(
                "{ \"dataDir\": \"data\"," +
                "  \"keyProvider\": {" +
                "    \"secret\": " + Jackson.writeValueAsString("file:" + secretFile.toAbsolutePath()) + ',' +
                "    \"salt\": \"env:PATH\" } }");

        assertThat(config.keyProvider().secret()).isEqualTo("s3cret");
        assertThat(config.keyProvider().salt()).isEqualTo(System.getenv("PATH"));
    }

    @Test
    void secretsFromCustomConverter() throws Exception {
        final DocumentStoreConfig config = DocumentStoreConfig.load(
                "{ \"dataDir\": \"data\"," +
                "  \"keyProvider\": { \"secret\": \"vault:secret\", \"salt\": \"vault:salt\" } }");

        assertThat(config.keyProvider().secret()).isEqualTo("open sesame");
        assertThat(config.keyProvider().salt()).isEqualTo("sea salt");
    }

    @Test
    void unknownPrefixIsKeptAsIs() {
        assertThat(DocumentStoreConfig.convertValue("plain:value", "secret")).isEqualTo("plain:value");
        assertThat(DocumentStoreConfig.convertValue("no prefix", "secret")).isEqualTo("no prefix");
        assertThat(DocumentStoreConfig.convertValue(":value", "secret")).isEqualTo(":value");
        assertThat(DocumentStoreConfig.convertValue(null, "secret")).isNull();
    }

    @Test
    void missingEnvironmentVariable_shouldFail() {
        assertThatThrownBy(() -> DocumentStoreConfig.load(
                "{ \"dataDir\": \"data\"," +
                "  \"keyProvider\": { \"secret\": \"env:DOCVAULT_UNDEFINED_VARIABLE\", \"salt\": \"x\" } }"))
                .isInstanceOf(JsonMappingException.class)
                .hasRootCauseInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void invalidConfigs_shouldFail() {
        // No key provider.
        assertThatThrownBy(() -> DocumentStoreConfig.load("{ \"dataDir\": \"data\" }"))
                .isInstanceOf(JsonMappingException.class);
        // No salt for a local key provider.
        assertThatThrownBy(() -> DocumentStoreConfig.load(
                "{ \"dataDir\": \"data\", \"keyProvider\": { \"secret\": \"s\" } }"))
                .isInstanceOf(JsonMappingException.class);
        // No key ID for an external key provider.
        assertThatThrownBy(() -> DocumentStoreConfig.load(
                "{ \"dataDir\": \"data\", \"keyProvider\": { \"type\": \"external\" } }"))
                .isInstanceOf(JsonMappingException.class);
        assertThatThrownBy(() -> DocumentStoreConfig.load(
                "{ \"dataDir\": \"data\", \"chunkSize\": 0," +
                "  \"keyProvider\": { \"secret\": \"s\", \"salt\": \"s\" } }"))
                .isInstanceOf(JsonMappingException.class);
    }

    @Test
    void toStringMasksSecrets() {
        final KeyProviderConfig keyProvider = KeyProviderConfig.ofLocal("s3cret", "pepper");
        assertThat(keyProvider.toString()).doesNotContain("s3cret")
                                          .doesNotContain("pepper");
    }

    @Test
    void loadFromFile() throws Exception {
        final Path configFile = tempDir.resolve("docvault.json");
        final String dataDir = tempDir.resolve("data").toAbsolutePath().toString();
        Files.write(configFile, ("{ \"dataDir\": " + Jackson.writeValueAsString(dataDir) + ',' +
                                 "  \"keyProvider\": { \"secret\": \"s\", \"salt\": \"s\"," +
                                 "                     \"kdfIterations\": 1000 } }")
                .getBytes(StandardCharsets.UTF_8));

        assertThat(DocumentStoreConfig.load(configFile.toFile()).dataDir()).isEqualTo(new File(dataDir));
        try (DocumentStore store = DocumentStore.forConfig(configFile.toFile())) {
            assertThat(store.config().keyProvider().kdfIterations()).isEqualTo(1000);
            assertThat(new File(dataDir)).isDirectory();
        }
    }

    public static class VaultConfigValueConverter implements ConfigValueConverter {

        @Override
        public List<String> supportedPrefixes() {
            return ImmutableList.of("vault");
        }

        @Override
        public String convert(String prefix, String value) {
            if ("secret".equals(value)) {
                return "open sesame";
            }
            if ("salt".equals(value)) {
                return "sea salt";
            }
            throw new IllegalArgumentException("unsupported prefix: " + prefix + ", value: " + value);
        }
    }
}
