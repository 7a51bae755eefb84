package me.matrixwarden.bot.domain.loop;

import me.matrixwarden.bot.adapter.outbound.storage.JsonFileAdminConfigAdapter;
import me.matrixwarden.bot.domain.model.AdminConfig;
import me.matrixwarden.bot.domain.model.MatrixResult;
import me.matrixwarden.bot.domain.model.RoomEvent;
import me.matrixwarden.bot.domain.service.ProvisioningException;
import me.matrixwarden.bot.domain.service.RoomLogger;
import me.matrixwarden.bot.domain.service.SpaceProvisioner;
import me.matrixwarden.bot.infrastructure.config.AutoConfiguration;
import me.matrixwarden.bot.infrastructure.config.BotProperties;
import me.matrixwarden.bot.port.outbound.AdminConfigPort;
import me.matrixwarden.bot.port.outbound.MatrixPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class AdminBotLoopTest {

    private static final String SPACE = "!space:example.org";
    private static final String CONTROL = "!control:example.org";
    private static final String LOG = "!log:example.org";
    private static final long NOW = 1700000000000L;
    private static final String MARKER = "Timestamp: " + NOW;

    @TempDir
    Path tempDir;

    private MatrixPort matrixPort;
    private RoomLogger roomLogger;
    private SpaceProvisioner provisioner;
    private InMemoryConfigPort configPort;
    private BotProperties properties;
    private Clock clock;

    @BeforeEach
    void setUp() {
        matrixPort = mock(MatrixPort.class);
        roomLogger = mock(RoomLogger.class);
        provisioner = mock(SpaceProvisioner.class);
        configPort = new InMemoryConfigPort();
        properties = new BotProperties();
        properties.getMatrix().setUserId("@warden:example.org");
        properties.getMatrix().setPassword("secret");
        properties.getMatrix().setLogRoom(LOG);
        clock = Clock.fixed(Instant.ofEpochMilli(NOW), ZoneOffset.UTC);

        when(matrixPort.login("secret")).thenReturn(MatrixResult.ok("DEVICE"));
        when(matrixPort.sendText(anyString(), anyString())).thenReturn(MatrixResult.ok("$marker"));
    }

    @Test
    void replayedCommandsAreIgnoredAndExitPersistsWatermark() {
        configPort.stored = provisionedConfig(500L);
        when(matrixPort.syncForever(any(Duration.class))).thenReturn(List.of(
                List.of(message(CONTROL, "!ping", 400L), message(CONTROL, "!exit", 600L)),
                List.of(message(LOG, MARKER, 1000L), message(CONTROL, "!ping", 1100L)),
                List.of(message(CONTROL, "!exit", 1200L), message(CONTROL, "!ping", 1300L))).iterator());

        int exitCode = newLoop().run();

        assertEquals(0, exitCode);
        verify(matrixPort).sendText(LOG, MARKER);
        verify(roomLogger, times(1)).log("Pong!", CONTROL);
        verify(roomLogger).log("Exiting...", CONTROL);
        verify(matrixPort).close();
        assertEquals(1200L, configPort.stored.getLastTimestampOrZero());
        assertEquals(1, configPort.saves);
        verify(provisioner, never()).provision(any());
    }

    @Test
    void noCommandRunsWithoutOwnMarker() {
        configPort.stored = provisionedConfig(0L);
        when(matrixPort.syncForever(any(Duration.class))).thenReturn(List.of(
                List.of(message(LOG, "Timestamp: 1600000000000", 100L),
                        message(CONTROL, "!exit", 200L))).iterator());

        int exitCode = newLoop().run();

        assertEquals(0, exitCode);
        verify(matrixPort, never()).close();
        assertEquals(0, configPort.saves);
    }

    @Test
    void provisionsOnlyWhenSpaceIsMissing() {
        configPort.stored = AdminConfig.empty();
        doAnswer(invocation -> {
            AdminConfig config = invocation.getArgument(0);
            config.setAdminSpace(SPACE);
            config.setControlRoom(CONTROL);
            config.setLogRoom(LOG);
            return null;
        }).when(provisioner).provision(any());
        when(matrixPort.syncForever(any(Duration.class))).thenReturn(Collections.emptyIterator());

        newLoop().run();

        verify(provisioner).provision(any());
        verify(roomLogger).useDefaultRoom(LOG);
    }

    @Test
    void loginFailureAbortsBeforeProvisioning() {
        configPort.stored = AdminConfig.empty();
        when(matrixPort.login("secret")).thenReturn(MatrixResult.failed("HTTP 403: M_FORBIDDEN"));

        IllegalStateException error = assertThrows(IllegalStateException.class, () -> newLoop().run());

        assertTrue(error.getMessage().contains("M_FORBIDDEN"));
        verify(provisioner, never()).provision(any());
        verify(matrixPort, never()).syncForever(any());
    }

    @Test
    void provisioningInvariantViolationBecomesProvisioningFailure() {
        configPort.stored = AdminConfig.empty();
        doThrow(new IllegalStateException("no state event")).when(provisioner).provision(any());

        assertThrows(ProvisioningException.class, () -> newLoop().run());
    }

    @Test
    void provisionedRoomsAreUsedOnNextRun() {
        properties.getStorage().setConfigFile(tempDir.resolve("config.json").toString());
        AdminConfigPort filePort = new JsonFileAdminConfigAdapter(properties, AutoConfiguration.objectMapper());
        SpaceProvisioner realProvisioner = new SpaceProvisioner(matrixPort, roomLogger, filePort, properties);
        when(matrixPort.createRoom(any()))
                .thenReturn(MatrixResult.ok(SPACE))
                .thenReturn(MatrixResult.ok(CONTROL));
        when(matrixPort.putRoomState(anyString(), anyString(), any(), anyString()))
                .thenReturn(MatrixResult.ok("$state"));
        when(matrixPort.syncForever(any(Duration.class)))
                .thenReturn(Collections.emptyIterator())
                .thenReturn(List.of(
                        List.of(message(LOG, MARKER, 10L), message(CONTROL, "!ping", 11L))).iterator());

        new AdminBotLoop(matrixPort, filePort, realProvisioner, roomLogger, properties, clock).run();
        properties.getMatrix().setLogRoom("!changed:example.org");
        new AdminBotLoop(matrixPort, filePort, realProvisioner, roomLogger, properties, clock).run();

        verify(matrixPort, times(2)).createRoom(any());
        verify(matrixPort, times(2)).sendText(LOG, MARKER);
        verify(roomLogger).log("Pong!", CONTROL);
        assertEquals(SPACE, filePort.load().getAdminSpace());
    }

    private AdminBotLoop newLoop() {
        return new AdminBotLoop(matrixPort, configPort, provisioner, roomLogger, properties, clock);
    }

    private static AdminConfig provisionedConfig(long lastTimestamp) {
        return AdminConfig.builder()
                .adminSpace(SPACE)
                .controlRoom(CONTROL)
                .logRoom(LOG)
                .lastTimestamp(lastTimestamp)
                .build();
    }

    private static RoomEvent message(String roomId, String body, long timestamp) {
        return RoomEvent.builder()
                .roomId(roomId)
                .eventId("$" + timestamp)
                .sender("@admin:example.org")
                .type(RoomEvent.TYPE_MESSAGE)
                .serverTimestamp(timestamp)
                .content(Map.of("msgtype", "m.text", "body", body))
                .build();
    }

    private static final class InMemoryConfigPort implements AdminConfigPort {
        private AdminConfig stored = AdminConfig.empty();
        private int saves;

        @Override
        public AdminConfig load() {
            return stored;
        }

        @Override
        public void save(AdminConfig config) {
            stored = config;
            saves++;
        }
    }
}
