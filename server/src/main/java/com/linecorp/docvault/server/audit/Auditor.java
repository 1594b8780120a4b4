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

import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.linecorp.docvault.common.AuditEvent;

/**
 * Emits {@link AuditEvent}s to an {@link AuditSink}, isolating the caller from the failures of the sink.
 */
public final class Auditor {

    private static final Logger logger = LoggerFactory.getLogger(Auditor.class);

    private final AuditSink sink;

    public Auditor(AuditSink sink) {
        this.sink = requireNonNull(sink, "sink");
    }

    public void emit(String tenantId, String actorId, String action, String targetId,
                     Map<String, ?> payload) {
        final AuditEvent event = AuditEvent.of(tenantId, actorId, action, targetId, payload);
        try {
            sink.emit(event);
        } catch (Exception e) {
            logger.warn("Failed to emit an audit event: {}", event, e);
        }
    }
}
