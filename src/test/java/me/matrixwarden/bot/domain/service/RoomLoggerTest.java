package me.matrixwarden.bot.domain.service;

import me.matrixwarden.bot.domain.model.MatrixResult;
import me.matrixwarden.bot.infrastructure.config.BotProperties;
import me.matrixwarden.bot.port.outbound.MatrixPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZoneId;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RoomLoggerTest {

    private static final String LOG = "!log:example.org";
    private static final ZoneId ZONE = ZoneId.of("Europe/Berlin");

    private MatrixPort matrixPort;
    private RoomLogger roomLogger;

    @BeforeEach
    void setUp() {
        matrixPort = mock(MatrixPort.class);
        Clock clock = Clock.fixed(LocalDateTime.of(2026, 3, 4, 5, 6, 7).atZone(ZONE).toInstant(), ZONE);
        BotProperties properties = new BotProperties();
        properties.getMatrix().setLogRoom(LOG);
        roomLogger = new RoomLogger(matrixPort, clock, properties);
    }

    @Test
    void prefixesLocalTimestampAndSendsToDefaultRoom() {
        when(matrixPort.sendText(anyString(), anyString())).thenReturn(MatrixResult.ok("$1"));

        roomLogger.log("Pong!");

        verify(matrixPort).sendText(LOG, "2026-03-04 05:06:07 - Pong!");
    }

    @Test
    void sendsToExplicitRoom() {
        when(matrixPort.sendText(anyString(), anyString())).thenReturn(MatrixResult.ok("$1"));

        roomLogger.log("hello", "!control:example.org");

        verify(matrixPort).sendText("!control:example.org", "2026-03-04 05:06:07 - hello");
    }

    @Test
    void defaultRoomCanBeSwitched() {
        when(matrixPort.sendText(anyString(), anyString())).thenReturn(MatrixResult.ok("$1"));

        roomLogger.useDefaultRoom("!other:example.org");
        roomLogger.log("moved");

        assertEquals("!other:example.org", roomLogger.getDefaultRoom());
        verify(matrixPort).sendText("!other:example.org", "2026-03-04 05:06:07 - moved");
    }

    @Test
    void sendFailuresNeverPropagate() {
        when(matrixPort.sendText(anyString(), anyString())).thenReturn(MatrixResult.failed("HTTP 502"));
        assertDoesNotThrow(() -> roomLogger.log("first"));

        when(matrixPort.sendText(anyString(), anyString())).thenThrow(new IllegalStateException("boom"));
        assertDoesNotThrow(() -> roomLogger.log("second"));
    }
}
