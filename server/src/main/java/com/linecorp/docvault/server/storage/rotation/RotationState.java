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
package com.linecorp.docvault.server.storage.rotation;

/**
 * The state of the re-wrapping pass of a tenant. A pass moves from {@link #IDLE} to {@link #SCANNING},
 * alternates between {@link #SCANNING} and {@link #REWRAPPING} per batch, and returns to {@link #IDLE}
 * when a sweep finds no stale revision or the pass fails.
 */
public enum RotationState {
    IDLE,
    SCANNING,
    REWRAPPING
}
