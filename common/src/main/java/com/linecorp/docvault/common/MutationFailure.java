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
package com.linecorp.docvault.common;

/**
 * The expected, non-exceptional reasons for which a mutation may be refused.
 */
public enum MutationFailure {
    /**
     * The version of the target did not match the expected version. The caller should re-read and retry.
     */
    VERSION_CONFLICT,
    /**
     * The new parent of a move is the moved node itself or one of its descendants.
     */
    CYCLE_REJECTED,
    /**
     * A non-cascading delete was requested for a folder that has children.
     */
    NOT_EMPTY,
    /**
     * No unique slug could be found among the siblings within the allowed number of attempts.
     */
    SLUG_CONFLICT
}
