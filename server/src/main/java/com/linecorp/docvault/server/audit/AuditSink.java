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

import com.linecorp.docvault.common.AuditEvent;

/**
 * Receives the audit events of a document store. Events are emitted after the audited mutation has been
 * committed, or right before a cryptographic failure is propagated to the caller.
 *
 * <p>An implementation must not block for long. Exceptions it raises are logged and do not fail the
 * audited operation.
 */
@FunctionalInterface
public interface AuditSink {

    /**
     * Returns an {@link AuditSink} which writes every event to the {@code docvault.audit} logger.
     */
    static AuditSink ofLogger() {
        return LoggingAuditSink.INSTANCE;
    }

    void emit(AuditEvent event);
}
