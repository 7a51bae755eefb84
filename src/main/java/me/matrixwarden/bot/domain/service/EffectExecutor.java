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
import me.matrixwarden.bot.domain.model.Effect;
import me.matrixwarden.bot.domain.model.MatrixResult;
import me.matrixwarden.bot.port.outbound.AdminConfigPort;
import me.matrixwarden.bot.port.outbound.MatrixPort;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.OptionalInt;

/**
 * Applies dispatch effects in order.
 *
 * <p>
 * Send failures are logged and do not stop the remaining effects. Execution
 * stops at the first {@link Effect.Terminate}, whose code is returned.
 */
@Slf4j
public class EffectExecutor {

    private final MatrixPort matrixPort;
    private final RoomLogger roomLogger;
    private final AdminConfigPort configPort;
    private final AdminConfig config;

    public EffectExecutor(MatrixPort matrixPort, RoomLogger roomLogger, AdminConfigPort configPort,
            AdminConfig config) {
        this.matrixPort = matrixPort;
        this.roomLogger = roomLogger;
        this.configPort = configPort;
        this.config = config;
    }

    /**
     * @return the exit code when a {@link Effect.Terminate} was reached
     */
    public OptionalInt execute(List<Effect> effects) {
        for (Effect effect : effects) {
            if (effect instanceof Effect.Log logEffect) {
                roomLogger.log(logEffect.message(), logEffect.roomId());
            } else if (effect instanceof Effect.Forward forward) {
                forward(forward);
            } else if (effect instanceof Effect.CloseSession) {
                matrixPort.close();
            } else if (effect instanceof Effect.PersistConfig persist) {
                persist(persist.timestamp());
            } else if (effect instanceof Effect.Terminate terminate) {
                return OptionalInt.of(terminate.code());
            } else {
                log.warn("Ignoring unsupported effect {}", effect);
            }
        }
        return OptionalInt.empty();
    }

    private void forward(Effect.Forward forward) {
        MatrixResult<String> result = matrixPort.sendMessage(forward.roomId(), forward.eventType(),
                forward.content());
        if (result.isFailed()) {
            log.warn("Failed to forward message to {}: {}", forward.roomId(), result.getError());
        }
    }

    private void persist(long timestamp) {
        config.setLastTimestamp(timestamp);
        try {
            configPort.save(config);
        } catch (RuntimeException e) {
            log.error("[Config] Failed to persist watermark {}", timestamp, e);
        }
    }
}
