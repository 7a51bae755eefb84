package me.matrixwarden.bot.port.outbound;

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

import me.matrixwarden.bot.domain.model.CreateRoomRequest;
import me.matrixwarden.bot.domain.model.MatrixResult;
import me.matrixwarden.bot.domain.model.RoomEvent;

import java.time.Duration;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Port for the Matrix client-server API.
 *
 * <p>
 * All request operations are blocking and report failures through
 * {@link MatrixResult} rather than exceptions.
 */
public interface MatrixPort {

    /**
     * Logs in with the configured user id and the given password. On success
     * the access token is kept for subsequent calls.
     *
     * @return the device id assigned by the homeserver
     */
    MatrixResult<String> login(String password);

    /**
     * Creates a room or a space.
     *
     * @return the new room id
     */
    MatrixResult<String> createRoom(CreateRoomRequest request);

    /**
     * Writes a state event.
     *
     * @return the id of the resulting state event
     */
    MatrixResult<String> putRoomState(String roomId, String eventType, Map<String, Object> content,
            String stateKey);

    /**
     * Sends a room event.
     *
     * @return the id of the sent event
     */
    MatrixResult<String> sendMessage(String roomId, String eventType, Map<String, Object> content);

    /**
     * Sends a plain {@code m.text} message.
     */
    default MatrixResult<String> sendText(String roomId, String body) {
        return sendMessage(roomId, RoomEvent.TYPE_MESSAGE, Map.of("msgtype", "m.text", "body", body));
    }

    MatrixResult<Void> inviteUser(String roomId, String userId);

    MatrixResult<Set<String>> listJoinedRooms();

    /**
     * Fetches up to {@code count} most recent message events of a room, oldest
     * first.
     */
    MatrixResult<List<RoomEvent>> fetchRoomMessages(String roomId, int count);

    /**
     * Starts the sync stream. Each call to {@code next()} blocks for at most the
     * given timeout and returns the events of one sync batch, possibly empty.
     * The iterator never ends and cannot be restarted.
     */
    Iterator<List<RoomEvent>> syncForever(Duration timeout);

    /**
     * Closes the connection to the homeserver.
     */
    void close();
}
