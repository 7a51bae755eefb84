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

/**
 * Room identity set the bot works with. Ids are opaque and compared by
 * equality only.
 */
public record AdminRooms(String adminSpace, String controlRoom, String logRoom) {

    /**
     * Resolves the rooms from the persisted record, falling back to the
     * configured log room when none has been recorded yet.
     */
    public static AdminRooms resolve(AdminConfig config, String configuredLogRoom) {
        String logRoom = config.getLogRoom() != null && !config.getLogRoom().isBlank()
                ? config.getLogRoom()
                : configuredLogRoom;
        return new AdminRooms(config.getAdminSpace(), config.getControlRoom(), logRoom);
    }

    public boolean isControlRoom(String roomId) {
        return controlRoom != null && controlRoom.equals(roomId);
    }

    public boolean isLogRoom(String roomId) {
        return logRoom != null && logRoom.equals(roomId);
    }
}
