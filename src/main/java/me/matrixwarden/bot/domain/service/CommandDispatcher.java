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
import me.matrixwarden.bot.domain.model.Command;
import me.matrixwarden.bot.domain.model.Effect;
import me.matrixwarden.bot.domain.model.MatrixResult;
import me.matrixwarden.bot.domain.model.RoomEvent;
import me.matrixwarden.bot.port.outbound.MatrixPort;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Turns admitted control-room commands into effects.
 *
 * <ul>
 * <li>!ping - answers "Pong!"
 * <li>!exit - signs off, closes the session, persists the watermark and
 * terminates
 * <li>!crawl &lt;roomId&gt; &lt;count&gt; - forwards the latest messages of a
 * joined room into the log room
 * </ul>
 *
 * <p>
 * Crawl validation and history lookup happen here; the forwarding itself is
 * returned as {@link Effect.Forward} values.
 */
@Slf4j
public class CommandDispatcher {

    static final String PONG = "Pong!";
    static final String EXITING = "Exiting...";
    static final String SIGN_OFF = "Goodbye!";
    static final String USAGE = "Unknown command. Available commands: !ping, !exit, !crawl <roomId> <count>";

    private final MatrixPort matrixPort;
    private final AdminRooms rooms;

    public CommandDispatcher(MatrixPort matrixPort, AdminRooms rooms) {
        this.matrixPort = matrixPort;
        this.rooms = rooms;
    }

    public List<Effect> dispatch(RoomEvent event) {
        if (!event.isMessage() || !rooms.isControlRoom(event.getRoomId())) {
            return List.of();
        }
        String body = event.getBody();
        if (!CommandParser.isCommand(body)) {
            return List.of();
        }

        Command command = CommandParser.parse(body);
        log.debug("Dispatching {} from {}", command, event.getSender());

        if (command instanceof Command.Ping) {
            return List.of(reply(PONG));
        }
        if (command instanceof Command.Exit) {
            return List.of(
                    reply(EXITING),
                    reply(SIGN_OFF),
                    new Effect.CloseSession(),
                    new Effect.PersistConfig(event.getServerTimestamp()),
                    new Effect.Terminate(0));
        }
        if (command instanceof Command.Crawl crawl) {
            return crawl(crawl);
        }
        if (command instanceof Command.Invalid invalid) {
            return List.of(reply(invalid.reason()));
        }
        return List.of(reply(USAGE));
    }

    private List<Effect> crawl(Command.Crawl crawl) {
        String target = crawl.targetRoomId();

        MatrixResult<Set<String>> joined = matrixPort.listJoinedRooms();
        if (joined.isFailed()) {
            return List.of(reply("Failed to list joined rooms: " + joined.getError()));
        }
        if (!joined.getValue().contains(target)) {
            return List.of(reply("Not in room " + target));
        }

        List<Effect> effects = new ArrayList<>();
        effects.add(reply("Crawling " + crawl.messageCount() + " messages from " + target + "..."));

        MatrixResult<List<RoomEvent>> history = matrixPort.fetchRoomMessages(target, crawl.messageCount());
        if (history.isFailed()) {
            effects.add(reply("Failed to fetch messages from " + target + ": " + history.getError()));
            return effects;
        }
        for (RoomEvent message : history.getValue()) {
            if (message.isMessage()) {
                effects.add(new Effect.Forward(rooms.logRoom(), message.getType(), message.getContent()));
            }
        }
        return effects;
    }

    private Effect reply(String message) {
        return new Effect.Log(message, rooms.controlRoom());
    }
}
