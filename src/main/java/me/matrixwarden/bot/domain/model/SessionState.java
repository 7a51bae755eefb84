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

import lombok.Getter;

/**
 * In-memory state of one bot run.
 *
 * <p>
 * {@code sessionStarted} only goes from false to true, and the watermark never
 * moves backwards.
 */
@Getter
public class SessionState {

    private final String handshakeToken;
    private boolean sessionStarted;
    private long lastProcessedTimestamp;

    public SessionState(String handshakeToken, long initialWatermark) {
        this.handshakeToken = handshakeToken;
        this.lastProcessedTimestamp = initialWatermark;
    }

    /**
     * Body of the marker message this run sends into the log room.
     */
    public String handshakeMarker() {
        return "Timestamp: " + handshakeToken;
    }

    public void markStarted() {
        this.sessionStarted = true;
    }

    public void advanceWatermark(long timestamp) {
        if (timestamp > lastProcessedTimestamp) {
            lastProcessedTimestamp = timestamp;
        }
    }
}
