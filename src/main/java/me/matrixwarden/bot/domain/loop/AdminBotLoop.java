package me.matrixwarden.bot.domain.loop;

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
import me.matrixwarden.bot.domain.model.AdminRooms;
import me.matrixwarden.bot.domain.model.AdmissionDecision;
import me.matrixwarden.bot.domain.model.Effect;
import me.matrixwarden.bot.domain.model.MatrixResult;
import me.matrixwarden.bot.domain.model.RoomEvent;
import me.matrixwarden.bot.domain.model.SessionState;
import me.matrixwarden.bot.domain.service.CommandDispatcher;
import me.matrixwarden.bot.domain.service.EffectExecutor;
import me.matrixwarden.bot.domain.service.ProcessExitService;
import me.matrixwarden.bot.domain.service.ProvisioningException;
import me.matrixwarden.bot.domain.service.RoomLogger;
import me.matrixwarden.bot.domain.service.SessionGate;
import me.matrixwarden.bot.domain.service.SpaceProvisioner;
import me.matrixwarden.bot.infrastructure.config.BotProperties;
import me.matrixwarden.bot.port.outbound.AdminConfigPort;
import me.matrixwarden.bot.port.outbound.MatrixPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.Iterator;
import java.util.List;
import java.util.OptionalInt;

/**
 * Start-up sequencing and the sync pull loop.
 *
 * <p>
 * Flow:
 * <ol>
 * <li>load the config record and log in
 * <li>provision the admin space when none is recorded
 * <li>send this run's handshake marker into the log room
 * <li>pull sync batches; every event goes through {@link SessionGate}, then
 * {@link CommandDispatcher}, then {@link EffectExecutor}
 * </ol>
 * Events are handled one at a time in arrival order. The loop ends only when an
 * effect list contains {@link Effect.Terminate}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AdminBotLoop {

    private final MatrixPort matrixPort;
    private final AdminConfigPort configPort;
    private final SpaceProvisioner spaceProvisioner;
    private final RoomLogger roomLogger;
    private final BotProperties properties;
    private final Clock clock;

    /**
     * Runs the bot until {@code !exit}.
     *
     * @return the process exit code
     * @throws ProvisioningException
     *             when the admin space cannot be created
     * @throws IllegalStateException
     *             when login fails
     */
    public int run() {
        BotProperties.MatrixProperties matrix = properties.getMatrix();
        AdminConfig config = configPort.load();

        MatrixResult<String> login = matrixPort.login(matrix.getPassword());
        if (login.isFailed()) {
            throw new IllegalStateException("Login failed for " + matrix.getUserId() + ": " + login.getError());
        }

        if (!config.isProvisioned()) {
            provision(config);
        }

        AdminRooms rooms = AdminRooms.resolve(config, matrix.getLogRoom());
        roomLogger.useDefaultRoom(rooms.logRoom());

        SessionState state = new SessionState(String.valueOf(clock.millis()), config.getLastTimestampOrZero());
        MatrixResult<String> marker = matrixPort.sendText(rooms.logRoom(), state.handshakeMarker());
        if (marker.isFailed()) {
            log.error("[Session] Failed to send handshake marker: {}", marker.getError());
        } else {
            log.info("[Session] Handshake marker sent, waiting for it in the sync stream");
        }

        SessionGate gate = new SessionGate(state, rooms, roomLogger);
        CommandDispatcher dispatcher = new CommandDispatcher(matrixPort, rooms);
        EffectExecutor executor = new EffectExecutor(matrixPort, roomLogger, configPort, config);

        Iterator<List<RoomEvent>> batches = matrixPort.syncForever(Duration.ofMillis(matrix.getSyncTimeout()));
        while (batches.hasNext()) {
            for (RoomEvent event : batches.next()) {
                OptionalInt exitCode = handle(event, gate, dispatcher, executor);
                if (exitCode.isPresent()) {
                    log.info("Stopping with exit code {}", exitCode.getAsInt());
                    return exitCode.getAsInt();
                }
            }
        }
        log.warn("Sync stream ended without an exit command");
        return ProcessExitService.EXIT_OK;
    }

    private OptionalInt handle(RoomEvent event, SessionGate gate, CommandDispatcher dispatcher,
            EffectExecutor executor) {
        if (event.isMessage() && log.isDebugEnabled()) {
            log.debug("Message received in room {}: {} | {}", event.getRoomId(), event.getSender(),
                    event.getBody());
        }
        if (gate.admit(event) != AdmissionDecision.ADMITTED) {
            return OptionalInt.empty();
        }
        List<Effect> effects = dispatcher.dispatch(event);
        if (effects.isEmpty()) {
            return OptionalInt.empty();
        }
        return executor.execute(effects);
    }

    private void provision(AdminConfig config) {
        try {
            spaceProvisioner.provision(config);
        } catch (IllegalStateException e) {
            throw new ProvisioningException(e.getMessage(), e);
        }
    }
}
