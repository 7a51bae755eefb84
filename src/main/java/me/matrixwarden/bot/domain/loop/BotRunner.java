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

import me.matrixwarden.bot.domain.service.ProcessExitService;
import me.matrixwarden.bot.domain.service.ProvisioningException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Runs {@link AdminBotLoop} once the context is up and turns its outcome into
 * the process exit code: 0 after {@code !exit}, 1 when provisioning fails.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class BotRunner implements ApplicationRunner {

    private final AdminBotLoop loop;
    private final ProcessExitService exitService;

    @Override
    public void run(ApplicationArguments args) {
        int exitCode;
        try {
            exitCode = loop.run();
        } catch (ProvisioningException e) {
            log.error("Provisioning failed, manual cleanup of the admin space may be required", e);
            exitCode = ProcessExitService.EXIT_PROVISIONING_FAILED;
        }
        exitService.exit(exitCode);
    }
}
