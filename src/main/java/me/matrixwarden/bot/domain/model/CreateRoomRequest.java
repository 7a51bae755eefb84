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

import java.util.List;
import java.util.Map;

/**
 * Options for creating a room or a space.
 */
@Data
@Builder
public class CreateRoomRequest {

    private String name;
    private String topic;
    @Builder.Default
    private String preset = "private_chat";
    private String roomType; // "m.space" for spaces, null for ordinary rooms
    @Builder.Default
    private List<StateEvent> initialState = List.of();

    public boolean isSpace() {
        return ROOM_TYPE_SPACE.equals(roomType);
    }

    public static final String ROOM_TYPE_SPACE = "m.space";

    /**
     * State event applied while the room is created.
     */
    public record StateEvent(String type, String stateKey, Map<String, Object> content) {
    }
}
