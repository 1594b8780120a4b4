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

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.List;

import com.google.common.collect.ImmutableList;

enum DefaultConfigValueConverter implements ConfigValueConverter {
    INSTANCE;

    private static final String FILE = "file";
    private static final String ENV = "env";

    private static final List<String> SUPPORTED_PREFIXES = ImmutableList.of(FILE, ENV);

    @Override
    public List<String> supportedPrefixes() {
        return SUPPORTED_PREFIXES;
    }

    @Override
    public String convert(String prefix, String value) {
        switch (prefix) {
            case FILE:
                try {
                    return new String(Files.readAllBytes(Paths.get(value)), StandardCharsets.UTF_8).trim();
                } catch (IOException e) {
                    throw new UncheckedIOException("failed to read a file: " + value, e);
                }
            case ENV:
                final String env = System.getenv(value);
                if (env == null) {
                    throw new IllegalArgumentException("environment variable not set: " + value);
                }
                return env;
            default:
                throw new IllegalArgumentException("unsupported prefix: " + prefix + ", value: " + value);
        }
    }
}
