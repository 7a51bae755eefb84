package me.matrixwarden.bot.domain.model;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.Builder;
import lombok.Data;

/**
 * Outcome of a homeserver call: either a value or a failure reason. Every
 * {@link me.matrixwarden.bot.port.outbound.MatrixPort} operation returns one,
 * so callers check failures uniformly instead of catching transport
 * exceptions.
 *
 * @param <T>
 *            type of the value carried on success
 */
@Data
@Builder
public class MatrixResult<T> {

    @SuppressWarnings("PMD.AvoidFieldNameMatchingMethodName") // Lombok generates isSuccess()
    private boolean success;
    private T value;
    private String error;

    /**
     * Creates a successful result carrying a value (may be null for
     * acknowledgements).
     */
    public static <T> MatrixResult<T> ok(T value) {
        return MatrixResult.<T>builder()
                .success(true)
                .value(value)
                .build();
    }

    /**
     * Creates a failed result with a human-readable reason.
     */
    public static <T> MatrixResult<T> failed(String reason) {
        return MatrixResult.<T>builder()
                .success(false)
                .error(reason != null ? reason : "unknown error")
                .build();
    }

    public boolean isFailed() {
        return !success;
    }
}
