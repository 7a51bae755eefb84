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

import me.matrixwarden.bot.domain.model.AdminRooms;
import me.matrixwarden.bot.domain.model.AdmissionDecision;
import me.matrixwarden.bot.domain.model.RoomEvent;
import me.matrixwarden.bot.domain.model.SessionState;
import lombok.extern.slf4j.Slf4j;

/**
 * Decides whether an event from the sync stream may reach command dispatch.
 *
 * <p>
 * A reconnecting sync replays history, so an event is admitted only when its
 * server timestamp is not below the watermark and this run's handshake marker
 * has already been seen. The marker itself is never admitted.
 */
@Slf4j
public class SessionGate {

    private final SessionState state;
    private final AdminRooms rooms;
    private final RoomLogger roomLogger;

    public SessionGate(SessionState state, AdminRooms rooms, RoomLogger roomLogger) {
        this.state = state;
        this.rooms = rooms;
        this.roomLogger = roomLogger;
    }

    public AdmissionDecision admit(RoomEvent event) {
        if (event.getServerTimestamp() < state.getLastProcessedTimestamp()) {
            log.trace("[Session] Suppressed stale event {}", event.getEventId());
            return AdmissionDecision.SUPPRESSED;
        }

        if (isOwnHandshakeMarker(event)) {
            if (!state.isSessionStarted()) {
                state.markStarted();
                state.advanceWatermark(event.getServerTimestamp());
                roomLogger.log("Session started");
            }
            return AdmissionDecision.SUPPRESSED;
        }

        if (!state.isSessionStarted()) {
            log.trace("[Session] Suppressed event {} before handshake", event.getEventId());
            return AdmissionDecision.SUPPRESSED;
        }
        return AdmissionDecision.ADMITTED;
    }

    private boolean isOwnHandshakeMarker(RoomEvent event) {
        return event.isMessage()
                && rooms.isLogRoom(event.getRoomId())
                && state.handshakeMarker().equals(event.getBody());
    }
}
