package me.matrixwarden.bot.adapter.outbound.storage;

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
import me.matrixwarden.bot.infrastructure.config.BotProperties;
import me.matrixwarden.bot.port.outbound.AdminConfigPort;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;

/**
 * Stores the {@link AdminConfig} record as a JSON file on local disk.
 *
 * <p>
 * Writes go to a {@code .tmp} sibling first, are fsynced, and then replace the
 * target with an atomic rename where the filesystem supports it.
 *
 * <p>
 * Path configured via {@code bot.storage.config-file}, defaults to
 * {@code config.json} in the working directory.
 *
 * @see me.matrixwarden.bot.port.outbound.AdminConfigPort
 */
@Component
@Slf4j
public class JsonFileAdminConfigAdapter implements AdminConfigPort {

    private final Path configPath;
    private final ObjectMapper objectMapper;

    public JsonFileAdminConfigAdapter(BotProperties properties, ObjectMapper objectMapper) {
        this.configPath = Paths.get(properties.getStorage().getConfigFile()).toAbsolutePath().normalize();
        this.objectMapper = objectMapper;
    }

    @Override
    public AdminConfig load() {
        if (!Files.exists(configPath)) {
            log.info("[Config] No config file at {}, starting with an empty record", configPath);
            return AdminConfig.empty();
        }
        try {
            String json = Files.readString(configPath, StandardCharsets.UTF_8);
            if (json.isBlank()) {
                return AdminConfig.empty();
            }
            AdminConfig config = objectMapper.readValue(json, AdminConfig.class);
            log.debug("[Config] Loaded {}", configPath);
            return config;
        } catch (IOException e) {
            throw new AdminConfigStoreException("Failed to read config file: " + configPath, e);
        }
    }

    @Override
    public void save(AdminConfig config) {
        Path tempPath = configPath.resolveSibling(configPath.getFileName() + ".tmp");
        try {
            Path parent = configPath.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }

            byte[] bytes = objectMapper.writerWithDefaultPrettyPrinter()
                    .writeValueAsString(config)
                    .getBytes(StandardCharsets.UTF_8);
            try (OutputStream os = Files.newOutputStream(tempPath,
                    StandardOpenOption.CREATE,
                    StandardOpenOption.TRUNCATE_EXISTING,
                    StandardOpenOption.SYNC);
                    FileChannel channel = FileChannel.open(tempPath, StandardOpenOption.WRITE)) {
                os.write(bytes);
                os.flush();
                channel.force(true);
            }

            try {
                Files.move(tempPath, configPath,
                        StandardCopyOption.REPLACE_EXISTING,
                        StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                log.warn("[Config] Atomic move not supported, using regular move");
                Files.move(tempPath, configPath, StandardCopyOption.REPLACE_EXISTING);
            }
            log.info("[Config] Saved {}", configPath);
        } catch (IOException e) {
            try {
                Files.deleteIfExists(tempPath);
            } catch (IOException cleanupEx) {
                log.warn("[Config] Failed to cleanup temp file: {}", tempPath);
            }
            throw new AdminConfigStoreException("Failed to write config file: " + configPath, e);
        }
    }

    Path getConfigPath() {
        return configPath;
    }
}
