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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Persisted administrative record: the provisioned room ids and the
 * last-processed server timestamp.
 *
 * <p>
 * Serialized as a single JSON object with the keys {@code ADMIN_SPACE},
 * {@code CONTROL_ROOM}, {@code LOG_ROOM} and {@code LAST_TIMESTAMP}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AdminConfig {

    @JsonProperty("ADMIN_SPACE")
    private String adminSpace;

    @JsonProperty("CONTROL_ROOM")
    private String controlRoom;

    @JsonProperty("LOG_ROOM")
    private String logRoom;

    @JsonProperty("LAST_TIMESTAMP")
    private Long lastTimestamp;

    public static AdminConfig empty() {
        return new AdminConfig();
    }

    @JsonIgnore
    public boolean isProvisioned() {
        return adminSpace != null && !adminSpace.isBlank();
    }

    @JsonIgnore
    public long getLastTimestampOrZero() {
        return lastTimestamp != null ? lastTimestamp : 0L;
    }
}
