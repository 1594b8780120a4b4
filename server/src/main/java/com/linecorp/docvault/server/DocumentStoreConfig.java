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

import static com.google.common.base.MoreObjects.firstNonNull;
import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import java.io.File;
import java.io.IOError;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.ServiceLoader;
import java.util.regex.Pattern;

import javax.annotation.Nullable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonParseException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Streams;

import com.linecorp.docvault.server.storage.encryption.EnvelopeCrypto;

/**
 * {@link DocumentStore} configuration.
 */
public final class DocumentStoreConfig {

    private static final Logger logger = LoggerFactory.getLogger(DocumentStoreConfig.class);

    private static final ObjectMapper objectMapper =
            new ObjectMapper().disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private static final Pattern PREFIX_PATTERN = Pattern.compile("^[a-z0-9_-]+$");

    private static final Map<String, ConfigValueConverter> CONFIG_VALUE_CONVERTERS;

    static {
        final ArrayList<ConfigValueConverter> configValueConverters = new ArrayList<>();
        Streams.stream(ServiceLoader.load(ConfigValueConverter.class)).forEach(configValueConverters::add);
        configValueConverters.add(DefaultConfigValueConverter.INSTANCE);
        // A converter loaded earlier takes precedence for the same prefix.
        final Map<String, ConfigValueConverter> converters = new LinkedHashMap<>();
        for (ConfigValueConverter converter : configValueConverters) {
            if (converter.supportedPrefixes().stream().anyMatch(p -> !PREFIX_PATTERN.matcher(p).matches())) {
                logger.warn("{} isn't used because it has an invalid prefix: {}. (expected: {})",
                            converter, converter.supportedPrefixes(), PREFIX_PATTERN.pattern());
                continue;
            }
            for (String prefix : converter.supportedPrefixes()) {
                converters.putIfAbsent(prefix, converter);
            }
        }
        CONFIG_VALUE_CONVERTERS = ImmutableMap.copyOf(converters);
        logger.debug("Available {}s: {}", ConfigValueConverter.class.getSimpleName(), CONFIG_VALUE_CONVERTERS);
    }

    /**
     * Converts the specified {@code value} using {@link ConfigValueConverter} if the specified {@code value}
     * starts with a prefix followed by a colon {@code ':'}.
     */
    @Nullable
    public static String convertValue(@Nullable String value, String propertyName) {
        if (value == null) {
            return null;
        }

        final int index = value.indexOf(':');
        if (index <= 0) {
            // no prefix or starts with ':'.
            return value;
        }

        final String prefix = value.substring(0, index);
        if (!PREFIX_PATTERN.matcher(prefix).matches()) {
            return value;
        }
        final ConfigValueConverter converter = CONFIG_VALUE_CONVERTERS.get(prefix);
        if (converter != null) {
            return converter.convert(prefix, value.substring(index + 1));
        }
        logger.warn("No {} found for {}. prefix: {}",
                    ConfigValueConverter.class.getSimpleName(), propertyName, prefix);
        return value;
    }

    /**
     * Loads the configuration from the specified {@link File}.
     */
    public static DocumentStoreConfig load(File configFile) throws JsonMappingException, JsonParseException {
        requireNonNull(configFile, "configFile");
        try {
            return objectMapper.readValue(configFile, DocumentStoreConfig.class);
        } catch (JsonParseException | JsonMappingException e) {
            throw e;
        } catch (IOException e) {
            throw new IOError(e);
        }
    }

    /**
     * Loads the configuration from the specified JSON string.
     */
    public static DocumentStoreConfig load(String json) throws JsonMappingException, JsonParseException {
        requireNonNull(json, "json");
        try {
            return objectMapper.readValue(json, DocumentStoreConfig.class);
        } catch (JsonParseException | JsonMappingException e) {
            throw e;
        } catch (IOException e) {
            throw new IOError(e);
        }
    }

    private final File dataDir;
    private final int chunkSize;
    private final KeyProviderConfig keyProvider;
    private final RotationConfig rotation;

    /**
     * Creates a new instance.
     */
    @JsonCreator
    public DocumentStoreConfig(@JsonProperty(value = "dataDir", required = true) File dataDir,
                               @JsonProperty("chunkSize") @Nullable Integer chunkSize,
                               @JsonProperty(value = "keyProvider", required = true)
                               KeyProviderConfig keyProvider,
                               @JsonProperty("rotation") @Nullable RotationConfig rotation) {
        this.dataDir = requireNonNull(dataDir, "dataDir");
        this.chunkSize = firstNonNull(chunkSize, EnvelopeCrypto.DEFAULT_CHUNK_SIZE);
        checkArgument(this.chunkSize > 0, "chunkSize: %s (expected: > 0)", this.chunkSize);
        this.keyProvider = requireNonNull(keyProvider, "keyProvider");
        this.rotation = firstNonNull(rotation, RotationConfig.DEFAULT);
    }

    /**
     * Returns the directory where the RocksDB files are stored.
     */
    @JsonProperty
    public File dataDir() {
        return dataDir;
    }

    /**
     * Returns the number of plaintext bytes sealed per chunk of a new revision.
     */
    @JsonProperty
    public int chunkSize() {
        return chunkSize;
    }

    @JsonProperty
    public KeyProviderConfig keyProvider() {
        return keyProvider;
    }

    @JsonProperty
    public RotationConfig rotation() {
        return rotation;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                          .add("dataDir", dataDir)
                          .add("chunkSize", chunkSize)
                          .add("keyProvider", keyProvider)
                          .add("rotation", rotation)
                          .toString();
    }
}
