package me.matrixwarden.bot;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for the Matrix Warden bot.
 *
 * <p>
 * The bot logs into a Matrix homeserver, provisions an administrative space on
 * first run and then follows the {@code /sync} stream, executing commands typed
 * into the control room.
 *
 * <h2>Commands</h2>
 * <ul>
 * <li><b>!ping</b> - answers "Pong!" in the control room</li>
 * <li><b>!exit</b> - persists the watermark and shuts the bot down</li>
 * <li><b>!crawl &lt;roomId&gt; &lt;count&gt;</b> - forwards recent history of a
 * room into the log room</li>
 * </ul>
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports & Adapters):
 *
 * <pre>
 * Input Layer        → BotRunner, AdminBotLoop (sync pull loop)
 * Domain Layer       → SessionGate, CommandDispatcher, SpaceProvisioner
 * Infrastructure     → MatrixClientAdapter, JsonFileAdminConfigAdapter
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * Configuration via {@code application.properties} under {@code bot.*} prefix,
 * populated from the environment or a {@code .env} file.
 *
 * @version 1.0
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class BotApplication {

    public static void main(String[] args) {
        SpringApplication.run(BotApplication.class, args);
    }

}
