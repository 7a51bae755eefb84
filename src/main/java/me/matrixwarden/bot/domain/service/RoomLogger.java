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

import me.matrixwarden.bot.domain.model.MatrixResult;
import me.matrixwarden.bot.infrastructure.config.BotProperties;
import me.matrixwarden.bot.port.outbound.MatrixPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Writes timestamped lines to the local log and mirrors them into a room.
 *
 * <p>
 * A failed send is reported locally only; {@link #log} never throws.
 */
@Service
@Slf4j
public class RoomLogger {

    private static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final MatrixPort matrixPort;
    private final Clock clock;
    private volatile String defaultRoom;

    public RoomLogger(MatrixPort matrixPort, Clock clock, BotProperties properties) {
        this.matrixPort = matrixPort;
        this.clock = clock;
        this.defaultRoom = properties.getMatrix().getLogRoom();
    }

    /**
     * Switches the room used by {@link #log(String)}.
     */
    public void useDefaultRoom(String roomId) {
        this.defaultRoom = roomId;
    }

    public String getDefaultRoom() {
        return defaultRoom;
    }

    public void log(String message) {
        log(message, defaultRoom);
    }

    public void log(String message, String roomId) {
        String line = format(message);
        log.info(line);
        try {
            MatrixResult<String> result = matrixPort.sendText(roomId, line);
            if (result.isFailed()) {
                log.warn("Failed to send log line to {}: {}", roomId, result.getError());
            }
        } catch (RuntimeException e) {
            log.warn("Failed to send log line to {}", roomId, e);
        }
    }

    String format(String message) {
        return LocalDateTime.now(clock).format(TIMESTAMP_FORMAT) + " - " + message;
    }
}
