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
package com.linecorp.docvault.server.audit;

import static java.util.Objects.requireNonNull;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;

import com.linecorp.docvault.common.AuditEvent;
import com.linecorp.docvault.internal.Jackson;

final class LoggingAuditSink implements AuditSink {

    static final LoggingAuditSink INSTANCE = new LoggingAuditSink();

    private static final Logger logger = LoggerFactory.getLogger("docvault.audit");

    @Override
    public void emit(AuditEvent event) {
        requireNonNull(event, "event");
        if (!logger.isInfoEnabled()) {
            return;
        }
        try {
            logger.info(Jackson.writeValueAsString(event));
        } catch (JsonProcessingException e) {
            logger.warn("Failed to serialize an audit event: {}", event, e);
        }
    }

    private LoggingAuditSink() {}
}
