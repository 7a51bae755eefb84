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

import me.matrixwarden.bot.domain.model.Command;

/**
 * Parses control-room message bodies into {@link Command} values.
 */
public final class CommandParser {

    public static final String SIGIL = "!";
    static final String CRAWL_USAGE = "Usage: !crawl <roomId> <count>";
    private static final int CRAWL_ARG_COUNT = 2;

    private CommandParser() {
    }

    public static boolean isCommand(String body) {
        return body != null && body.startsWith(SIGIL);
    }

    /**
     * Parses a {@code !}-prefixed body. Words are split on whitespace and the
     * command word is matched case-sensitively.
     */
    public static Command parse(String body) {
        String[] parts = body.trim().split("\\s+");
        String word = parts[0];
        return switch (word) {
        case "!ping" -> new Command.Ping();
        case "!exit" -> new Command.Exit();
        case "!crawl" -> parseCrawl(parts);
        default -> new Command.Unknown(body);
        };
    }

    private static Command parseCrawl(String[] parts) {
        if (parts.length - 1 != CRAWL_ARG_COUNT) {
            return new Command.Invalid(CRAWL_USAGE);
        }
        int count;
        try {
            count = Integer.parseInt(parts[2]);
        } catch (NumberFormatException e) {
            return new Command.Invalid("Invalid count '" + parts[2] + "'. " + CRAWL_USAGE);
        }
        if (count <= 0) {
            return new Command.Invalid("Count must be positive. " + CRAWL_USAGE);
        }
        return new Command.Crawl(parts[1], count);
    }
}
