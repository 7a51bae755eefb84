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

import java.util.Map;

/**
 * Side effect requested by command dispatch. Effects are values; the loop
 * executes them in order.
 */
public interface Effect {

    /**
     * Timestamped log line to local output and to a room.
     */
    record Log(String message, String roomId) implements Effect {
    }

    /**
     * Re-send event content verbatim into a room.
     */
    record Forward(String roomId, String eventType, Map<String, Object> content) implements Effect {
    }

    /**
     * Close the homeserver connection.
     */
    record CloseSession() implements Effect {
    }

    /**
     * Store the given server timestamp as the new watermark and flush the
     * config record.
     */
    record PersistConfig(long timestamp) implements Effect {
    }

    /**
     * End the sync loop with the given exit code.
     */
    record Terminate(int code) implements Effect {
    }
}
