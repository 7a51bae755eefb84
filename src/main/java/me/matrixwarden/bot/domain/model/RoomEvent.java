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

import java.util.Map;

/**
 * A room timeline event as delivered by sync or message history.
 */
@Data
@Builder
public class RoomEvent {

    public static final String TYPE_MESSAGE = "m.room.message";

    private String roomId;
    private String eventId;
    private String sender;
    private String type;
    private long serverTimestamp; // origin_server_ts, milliseconds
    private Map<String, Object> content;

    public boolean isMessage() {
        return TYPE_MESSAGE.equals(type);
    }

    /**
     * Returns the {@code body} of a message event, or null when absent.
     */
    public String getBody() {
        if (content == null) {
            return null;
        }
        Object body = content.get("body");
        return body instanceof String ? (String) body : null;
    }

    public String getMsgtype() {
        if (content == null) {
            return null;
        }
        Object msgtype = content.get("msgtype");
        return msgtype instanceof String ? (String) msgtype : null;
    }
}
