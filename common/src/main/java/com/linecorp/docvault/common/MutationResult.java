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

import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;

import java.util.Objects;

import javax.annotation.Nullable;

import com.google.common.base.MoreObjects;

/**
 * The outcome of a mutation that takes an expected version. It holds either the updated entity or the
 * {@link MutationFailure} that prevented the mutation. A failed mutation changed nothing.
 *
 * @param <T> the type of the updated entity
 */
public final class MutationResult<T> {

    /**
     * Returns a successful result.
     */
    public static <T> MutationResult<T> success(T value) {
        return new MutationResult<>(requireNonNull(value, "value"), null, null);
    }

    /**
     * Returns a failed result.
     */
    public static <T> MutationResult<T> failure(MutationFailure failure, String message) {
        return new MutationResult<>(null, requireNonNull(failure, "failure"),
                                    requireNonNull(message, "message"));
    }

    @Nullable
    private final T value;
    @Nullable
    private final MutationFailure failure;
    @Nullable
    private final String message;

    private MutationResult(@Nullable T value, @Nullable MutationFailure failure, @Nullable String message) {
        this.value = value;
        this.failure = failure;
        this.message = message;
    }

    public boolean isSuccess() {
        return failure == null;
    }

    /**
     * Returns the updated entity.
     *
     * @throws IllegalStateException if the mutation failed
     */
    public T value() {
        checkState(value != null, "mutation failed: %s (%s)", failure, message);
        return value;
    }

    /**
     * Returns the reason of the failure, or {@code null} if the mutation succeeded.
     */
    @Nullable
    public MutationFailure failure() {
        return failure;
    }

    /**
     * Returns the human-readable detail of the failure, or {@code null} if the mutation succeeded.
     */
    @Nullable
    public String message() {
        return message;
    }

    /**
     * Returns a failed result of another entity type carrying the same failure.
     *
     * @throws IllegalStateException if the mutation succeeded
     */
    @SuppressWarnings("unchecked")
    public <U> MutationResult<U> castFailure() {
        checkState(failure != null, "not a failure: %s", this);
        return (MutationResult<U>) this;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof MutationResult)) {
            return false;
        }
        final MutationResult<?> that = (MutationResult<?>) o;
        return Objects.equals(value, that.value) &&
               failure == that.failure &&
               Objects.equals(message, that.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, failure, message);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                          .omitNullValues()
                          .add("value", value)
                          .add("failure", failure)
                          .add("message", message)
                          .toString();
    }
}
