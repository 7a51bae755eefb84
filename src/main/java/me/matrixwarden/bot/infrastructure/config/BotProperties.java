package me.matrixwarden.bot.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Centralized configuration properties for the bot, bound from
 * application.properties.
 *
 * <p>
 * All bot configuration is organized under the {@code bot.*} prefix:
 * <ul>
 * <li>{@link MatrixProperties} - homeserver, credentials and rooms</li>
 * <li>{@link StorageProperties} - location of the persisted config record</li>
 * <li>{@link HttpProperties} - OkHttp timeouts and pooling</li>
 * </ul>
 *
 * <p>
 * The Matrix settings are filled from the {@code SERVER_URL}, {@code USER_ID},
 * {@code PASSWORD}, {@code LOG_ROOM} and {@code CONTROLLER} variables. This is
 * the only place that sees them; every other component receives this object.
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "bot")
@Data
public class BotProperties {

    private MatrixProperties matrix = new MatrixProperties();
    private StorageProperties storage = new StorageProperties();
    private HttpProperties http = new HttpProperties();

    /**
     * Checks the mandatory Matrix settings.
     *
     * @throws IllegalStateException
     *             listing every missing setting
     */
    public void validate() {
        List<String> missing = new ArrayList<>();
        if (isBlank(matrix.getServerUrl())) {
            missing.add("SERVER_URL");
        }
        if (isBlank(matrix.getUserId())) {
            missing.add("USER_ID");
        }
        if (isBlank(matrix.getPassword())) {
            missing.add("PASSWORD");
        }
        if (isBlank(matrix.getLogRoom())) {
            missing.add("LOG_ROOM");
        }
        if (!missing.isEmpty()) {
            throw new IllegalStateException("Missing required configuration: " + String.join(", ", missing));
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    @Data
    public static class MatrixProperties {
        private String serverUrl;
        private String userId;
        private String password;
        private String logRoom;
        private String controller;
        private String deviceName = "matrix-warden";
        private long syncTimeout = 30000;

        public boolean hasController() {
            return controller != null && !controller.isBlank();
        }

        /**
         * Server name part of the user id ({@code @bot:example.org} gives
         * {@code example.org}), used as the {@code via} server of space links.
         */
        public String getServerName() {
            if (userId == null) {
                return null;
            }
            int colon = userId.indexOf(':');
            return colon >= 0 ? userId.substring(colon + 1) : userId;
        }
    }

    @Data
    public static class StorageProperties {
        private String configFile = "config.json";
    }

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 60000;
        private long writeTimeout = 60000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300000;
    }
}
