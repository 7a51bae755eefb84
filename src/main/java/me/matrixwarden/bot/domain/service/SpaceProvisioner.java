package me.matrixwarden.bot.domain.service;

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

import me.matrixwarden.bot.domain.model.AdminConfig;
import me.matrixwarden.bot.domain.model.CreateRoomRequest;
import me.matrixwarden.bot.domain.model.MatrixResult;
import me.matrixwarden.bot.infrastructure.config.BotProperties;
import me.matrixwarden.bot.port.outbound.AdminConfigPort;
import me.matrixwarden.bot.port.outbound.MatrixPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * One-time bootstrap of the administrative space.
 *
 * <p>
 * Steps, each required by the next:
 * <ol>
 * <li>create the space
 * <li>create the control room with a parent link, then add the child link on
 * the space
 * <li>attach the configured log room to the space and rename it
 * <li>store the room ids in the config record
 * </ol>
 * A failed step raises {@link ProvisioningException}; nothing is rolled back.
 * The controller, when configured, is invited afterwards on a best-effort
 * basis.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SpaceProvisioner {

    static final String SPACE_NAME = "Bot Admin";
    static final String CONTROL_ROOM_NAME = "Control";
    static final String LOG_ROOM_NAME = "Log";
    static final String SPACE_CHILD = "m.space.child";
    static final String SPACE_PARENT = "m.space.parent";
    static final String ROOM_NAME = "m.room.name";

    private final MatrixPort matrixPort;
    private final RoomLogger roomLogger;
    private final AdminConfigPort configPort;
    private final BotProperties properties;

    public void provision(AdminConfig config) {
        BotProperties.MatrixProperties matrix = properties.getMatrix();
        List<String> via = List.of(matrix.getServerName());
        String logRoom = matrix.getLogRoom();

        log.info("[Provision] Creating admin space");
        MatrixResult<String> space = matrixPort.createRoom(CreateRoomRequest.builder()
                .name(SPACE_NAME)
                .roomType(CreateRoomRequest.ROOM_TYPE_SPACE)
                .build());
        String spaceId = requireRoomId(space, "Failed to create admin space");
        config.setAdminSpace(spaceId);

        MatrixResult<String> control = matrixPort.createRoom(CreateRoomRequest.builder()
                .name(CONTROL_ROOM_NAME)
                .initialState(List.of(new CreateRoomRequest.StateEvent(SPACE_PARENT, spaceId,
                        Map.of("via", via, "canonical", true))))
                .build());
        String controlRoomId = requireRoomId(control, "Failed to create control room");
        linkChild(spaceId, controlRoomId, via);
        config.setControlRoom(controlRoomId);

        linkChild(spaceId, logRoom, via);
        require(matrixPort.putRoomState(logRoom, ROOM_NAME, Map.of("name", LOG_ROOM_NAME), ""),
                "Failed to rename log room");
        config.setLogRoom(logRoom);

        configPort.save(config);
        roomLogger.log("Provisioned admin space " + spaceId + " with control room " + controlRoomId);

        if (matrix.hasController()) {
            invite(spaceId, matrix.getController());
            invite(controlRoomId, matrix.getController());
        }
    }

    private void linkChild(String spaceId, String childId, List<String> via) {
        MatrixResult<String> link = matrixPort.putRoomState(spaceId, SPACE_CHILD, Map.of("via", via), childId);
        String eventId = require(link, "Failed to link " + childId + " into space");
        if (eventId == null) {
            throw new IllegalStateException("Space child link for " + childId + " produced no state event");
        }
    }

    private void invite(String roomId, String userId) {
        MatrixResult<Void> result = matrixPort.inviteUser(roomId, userId);
        if (result.isFailed()) {
            roomLogger.log("Failed to invite " + userId + " to " + roomId + ": " + result.getError());
        } else {
            log.info("[Provision] Invited {} to {}", userId, roomId);
        }
    }

    private String requireRoomId(MatrixResult<String> result, String failureMessage) {
        String roomId = require(result, failureMessage);
        if (roomId == null) {
            String message = failureMessage + ": no room id in response";
            roomLogger.log(message);
            throw new ProvisioningException(message);
        }
        return roomId;
    }

    private <T> T require(MatrixResult<T> result, String failureMessage) {
        if (result.isFailed()) {
            String message = failureMessage + ": " + result.getError();
            roomLogger.log(message);
            throw new ProvisioningException(message);
        }
        return result.getValue();
    }
}
