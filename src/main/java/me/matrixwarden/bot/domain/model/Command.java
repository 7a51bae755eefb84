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

/**
 * A control-room command parsed from a single message body. Built per event
 * and consumed immediately.
 */
public interface Command {

    /**
     * {@code !ping}
     */
    record Ping() implements Command {
    }

    /**
     * {@code !exit}
     */
    record Exit() implements Command {
    }

    /**
     * {@code !crawl <roomId> <count>} with validated arguments.
     */
    record Crawl(String targetRoomId, int messageCount) implements Command {
    }

    /**
     * {@code !crawl} with malformed arguments.
     */
    record Invalid(String reason) implements Command {
    }

    /**
     * Any other {@code !}-prefixed body.
     */
    record Unknown(String raw) implements Command {
    }
}
