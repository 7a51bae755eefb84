package me.matrixwarden.bot.adapter.outbound.matrix;

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

import me.matrixwarden.bot.domain.model.CreateRoomRequest;
import me.matrixwarden.bot.domain.model.MatrixResult;
import me.matrixwarden.bot.domain.model.RoomEvent;
import me.matrixwarden.bot.infrastructure.config.BotProperties;
import me.matrixwarden.bot.port.outbound.MatrixPort;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Matrix adapter that talks to a homeserver over the client-server REST API
 * ({@code /_matrix/client/v3}).
 *
 * <p>
 * Endpoints:
 * <ul>
 * <li>POST /login - password login, keeps the access token
 * <li>POST /createRoom - rooms and spaces
 * <li>PUT /rooms/{room}/state/{type}/{key} - state writes
 * <li>PUT /rooms/{room}/send/{type}/{txn} - message sends
 * <li>POST /rooms/{room}/invite - invites
 * <li>GET /joined_rooms - joined-room listing
 * <li>GET /rooms/{room}/messages - history, newest first on the wire
 * <li>GET /sync - long-poll event stream
 * </ul>
 *
 * <p>
 * Non-2xx responses and I/O errors become {@link MatrixResult#failed}; nothing
 * escapes as an exception.
 *
 * @see me.matrixwarden.bot.port.outbound.MatrixPort
 */
@Component
@Slf4j
public class MatrixClientAdapter implements MatrixPort {

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final String API_PREFIX = "_matrix/client/v3";
    private static final String MESSAGE_FILTER = "{\"types\":[\"m.room.message\"]}";
    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final BotProperties.MatrixProperties matrix;
    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final AtomicLong transactionCounter = new AtomicLong();

    private volatile String accessToken;
    private volatile boolean closed = false;
    private Duration syncErrorPause = Duration.ofSeconds(1);

    public MatrixClientAdapter(BotProperties properties, OkHttpClient baseHttpClient, ObjectMapper objectMapper) {
        this.matrix = properties.getMatrix();
        this.objectMapper = objectMapper;

        // Long-poll sync must outlive the server-side timeout
        long readTimeoutMs = matrix.getSyncTimeout() + 10000;
        this.httpClient = baseHttpClient.newBuilder()
                .readTimeout(Math.max(readTimeoutMs, baseHttpClient.readTimeoutMillis()), TimeUnit.MILLISECONDS)
                .build();
    }

    /**
     * Package-private setter for testing. Shortens the pause after a failed
     * sync poll.
     */
    void setSyncErrorPause(Duration pause) {
        this.syncErrorPause = pause;
    }

    /**
     * Package-private setter for testing. Skips the login round-trip.
     */
    void setAccessToken(String accessToken) {
        this.accessToken = accessToken;
    }

    @Override
    public MatrixResult<String> login(String password) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("type", "m.login.password");
        body.put("identifier", Map.of("type", "m.id.user", "user", matrix.getUserId()));
        body.put("password", password);
        body.put("initial_device_display_name", matrix.getDeviceName());

        MatrixResult<JsonNode> result = execute("POST", apiUrl().addPathSegment("login").build(), body, false);
        if (result.isFailed()) {
            return MatrixResult.failed(result.getError());
        }
        JsonNode node = result.getValue();
        String token = node.path("access_token").asText(null);
        if (token == null) {
            return MatrixResult.failed("login response without access_token");
        }
        this.accessToken = token;
        this.closed = false;
        String deviceId = node.path("device_id").asText(null);
        log.info("[Matrix] Logged in as {} (device {})", matrix.getUserId(), deviceId);
        return MatrixResult.ok(deviceId);
    }

    @Override
    public MatrixResult<String> createRoom(CreateRoomRequest request) {
        Map<String, Object> body = new LinkedHashMap<>();
        if (request.getName() != null) {
            body.put("name", request.getName());
        }
        if (request.getTopic() != null) {
            body.put("topic", request.getTopic());
        }
        body.put("preset", request.getPreset());
        if (request.getRoomType() != null) {
            body.put("creation_content", Map.of("type", request.getRoomType()));
        }
        if (request.getInitialState() != null && !request.getInitialState().isEmpty()) {
            List<Map<String, Object>> initialState = new ArrayList<>();
            for (CreateRoomRequest.StateEvent state : request.getInitialState()) {
                Map<String, Object> event = new LinkedHashMap<>();
                event.put("type", state.type());
                event.put("state_key", state.stateKey() != null ? state.stateKey() : "");
                event.put("content", state.content());
                initialState.add(event);
            }
            body.put("initial_state", initialState);
        }

        MatrixResult<JsonNode> result = execute("POST", apiUrl().addPathSegment("createRoom").build(), body, true);
        return extractText(result, "room_id");
    }

    @Override
    public MatrixResult<String> putRoomState(String roomId, String eventType, Map<String, Object> content,
            String stateKey) {
        HttpUrl url = apiUrl()
                .addPathSegment("rooms")
                .addPathSegment(roomId)
                .addPathSegment("state")
                .addPathSegment(eventType)
                .addPathSegment(stateKey != null ? stateKey : "")
                .build();
        return extractText(execute("PUT", url, content, true), "event_id");
    }

    @Override
    public MatrixResult<String> sendMessage(String roomId, String eventType, Map<String, Object> content) {
        HttpUrl url = apiUrl()
                .addPathSegment("rooms")
                .addPathSegment(roomId)
                .addPathSegment("send")
                .addPathSegment(eventType)
                .addPathSegment(nextTransactionId())
                .build();
        return extractText(execute("PUT", url, content, true), "event_id");
    }

    @Override
    public MatrixResult<Void> inviteUser(String roomId, String userId) {
        HttpUrl url = apiUrl()
                .addPathSegment("rooms")
                .addPathSegment(roomId)
                .addPathSegment("invite")
                .build();
        MatrixResult<JsonNode> result = execute("POST", url, Map.of("user_id", userId), true);
        return result.isFailed() ? MatrixResult.failed(result.getError()) : MatrixResult.ok(null);
    }

    @Override
    public MatrixResult<Set<String>> listJoinedRooms() {
        MatrixResult<JsonNode> result = execute("GET", apiUrl().addPathSegment("joined_rooms").build(), null, true);
        if (result.isFailed()) {
            return MatrixResult.failed(result.getError());
        }
        Set<String> rooms = new LinkedHashSet<>();
        for (JsonNode room : result.getValue().path("joined_rooms")) {
            rooms.add(room.asText());
        }
        return MatrixResult.ok(rooms);
    }

    @Override
    public MatrixResult<List<RoomEvent>> fetchRoomMessages(String roomId, int count) {
        HttpUrl url = apiUrl()
                .addPathSegment("rooms")
                .addPathSegment(roomId)
                .addPathSegment("messages")
                .addQueryParameter("dir", "b")
                .addQueryParameter("limit", String.valueOf(count))
                .addQueryParameter("filter", MESSAGE_FILTER)
                .build();
        MatrixResult<JsonNode> result = execute("GET", url, null, true);
        if (result.isFailed()) {
            return MatrixResult.failed(result.getError());
        }
        List<RoomEvent> events = new ArrayList<>();
        for (JsonNode node : result.getValue().path("chunk")) {
            events.add(toRoomEvent(roomId, node));
        }
        // dir=b returns newest first
        Collections.reverse(events);
        return MatrixResult.ok(events);
    }

    @Override
    public Iterator<List<RoomEvent>> syncForever(Duration timeout) {
        return new SyncIterator(timeout);
    }

    @Override
    public void close() {
        closed = true;
        httpClient.dispatcher().cancelAll();
        httpClient.connectionPool().evictAll();
        log.info("[Matrix] Connection closed");
    }

    public boolean isClosed() {
        return closed;
    }

    MatrixResult<SyncResponse> sync(String since, Duration timeout) {
        HttpUrl.Builder url = apiUrl()
                .addPathSegment("sync")
                .addQueryParameter("timeout", String.valueOf(timeout.toMillis()));
        if (since != null) {
            url.addQueryParameter("since", since);
        }
        MatrixResult<JsonNode> result = execute("GET", url.build(), null, true);
        if (result.isFailed()) {
            return MatrixResult.failed(result.getError());
        }
        JsonNode node = result.getValue();
        List<RoomEvent> events = new ArrayList<>();
        node.path("rooms").path("join").fields().forEachRemaining(entry -> {
            for (JsonNode event : entry.getValue().path("timeline").path("events")) {
                events.add(toRoomEvent(entry.getKey(), event));
            }
        });
        return MatrixResult.ok(new SyncResponse(node.path("next_batch").asText(since), events));
    }

    private MatrixResult<JsonNode> execute(String method, HttpUrl url, Object body, boolean authenticated) {
        if (closed) {
            return MatrixResult.failed("connection closed");
        }
        if (authenticated && accessToken == null) {
            return MatrixResult.failed("not logged in");
        }
        try {
            RequestBody requestBody = body != null
                    ? RequestBody.create(objectMapper.writeValueAsString(body), JSON)
                    : null;
            Request.Builder requestBuilder = new Request.Builder()
                    .url(url)
                    .method(method, requestBody);
            if (authenticated) {
                requestBuilder.header("Authorization", "Bearer " + accessToken);
            }

            try (Response response = httpClient.newCall(requestBuilder.build()).execute()) {
                ResponseBody responseBody = response.body();
                String responseStr = responseBody != null ? responseBody.string() : "";
                if (!response.isSuccessful()) {
                    return MatrixResult.failed(describeError(response.code(), responseStr));
                }
                return MatrixResult.ok(responseStr.isBlank()
                        ? objectMapper.createObjectNode()
                        : objectMapper.readTree(responseStr));
            }
        } catch (IOException e) {
            log.debug("[Matrix] {} {} failed: {}", method, url.encodedPath(), e.getMessage());
            return MatrixResult.failed(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
    }

    private String describeError(int code, String responseBody) {
        try {
            JsonNode node = objectMapper.readTree(responseBody);
            String errcode = node.path("errcode").asText("");
            String error = node.path("error").asText("");
            if (!errcode.isEmpty()) {
                return "HTTP " + code + ": " + errcode + (error.isEmpty() ? "" : " " + error);
            }
        } catch (JsonProcessingException e) {
            log.trace("[Matrix] Non-JSON error body");
        }
        return "HTTP " + code;
    }

    private MatrixResult<String> extractText(MatrixResult<JsonNode> result, String field) {
        if (result.isFailed()) {
            return MatrixResult.failed(result.getError());
        }
        return MatrixResult.ok(result.getValue().path(field).asText(null));
    }

    private RoomEvent toRoomEvent(String roomId, JsonNode node) {
        Map<String, Object> content = node.has("content")
                ? objectMapper.convertValue(node.get("content"), MAP_TYPE)
                : Map.of();
        return RoomEvent.builder()
                .roomId(node.path("room_id").asText(roomId))
                .eventId(node.path("event_id").asText(null))
                .sender(node.path("sender").asText(null))
                .type(node.path("type").asText(null))
                .serverTimestamp(node.path("origin_server_ts").asLong(0))
                .content(content)
                .build();
    }

    private HttpUrl.Builder apiUrl() {
        String base = matrix.getServerUrl();
        while (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return HttpUrl.get(base).newBuilder().addPathSegments(API_PREFIX);
    }

    private String nextTransactionId() {
        return "mw" + System.currentTimeMillis() + "." + transactionCounter.incrementAndGet();
    }

    record SyncResponse(String nextBatch, List<RoomEvent> events) {
    }

    private final class SyncIterator implements Iterator<List<RoomEvent>> {

        private final Duration timeout;
        private String since;

        private SyncIterator(Duration timeout) {
            this.timeout = timeout;
        }

        @Override
        public boolean hasNext() {
            return !closed;
        }

        @Override
        public List<RoomEvent> next() {
            if (closed) {
                throw new NoSuchElementException("sync stream closed");
            }
            MatrixResult<SyncResponse> result = sync(since, timeout);
            if (result.isFailed()) {
                log.warn("[Matrix] Sync failed: {}", result.getError());
                pauseAfterError();
                return List.of();
            }
            since = result.getValue().nextBatch();
            return result.getValue().events();
        }

        private void pauseAfterError() {
            try {
                Thread.sleep(syncErrorPause.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }
}
