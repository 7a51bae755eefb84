package me.matrixwarden.bot.domain.service;

import me.matrixwarden.bot.domain.model.AdminConfig;
import me.matrixwarden.bot.domain.model.Effect;
import me.matrixwarden.bot.domain.model.MatrixResult;
import me.matrixwarden.bot.port.outbound.AdminConfigPort;
import me.matrixwarden.bot.port.outbound.MatrixPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

import java.util.List;
import java.util.Map;
import java.util.OptionalInt;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class EffectExecutorTest {

    private static final String CONTROL = "!control:example.org";
    private static final String LOG = "!log:example.org";

    private MatrixPort matrixPort;
    private RoomLogger roomLogger;
    private AdminConfigPort configPort;
    private AdminConfig config;
    private EffectExecutor executor;

    @BeforeEach
    void setUp() {
        matrixPort = mock(MatrixPort.class);
        roomLogger = mock(RoomLogger.class);
        configPort = mock(AdminConfigPort.class);
        config = AdminConfig.builder().adminSpace("!space:x").controlRoom(CONTROL).logRoom(LOG).build();
        executor = new EffectExecutor(matrixPort, roomLogger, configPort, config);
    }

    @Test
    void exitSequencePersistsBeforeTerminating() {
        OptionalInt code = executor.execute(List.of(
                new Effect.Log("Exiting...", CONTROL),
                new Effect.Log("Goodbye!", CONTROL),
                new Effect.CloseSession(),
                new Effect.PersistConfig(777L),
                new Effect.Terminate(0)));

        assertEquals(OptionalInt.of(0), code);
        assertEquals(777L, config.getLastTimestampOrZero());
        InOrder order = inOrder(roomLogger, matrixPort, configPort);
        order.verify(roomLogger).log("Exiting...", CONTROL);
        order.verify(roomLogger).log("Goodbye!", CONTROL);
        order.verify(matrixPort).close();
        order.verify(configPort).save(config);
    }

    @Test
    void effectsAfterTerminateAreNotExecuted() {
        OptionalInt code = executor.execute(List.of(
                new Effect.Terminate(3),
                new Effect.Log("late", CONTROL)));

        assertEquals(OptionalInt.of(3), code);
        verify(roomLogger, never()).log("late", CONTROL);
    }

    @Test
    void failedForwardDoesNotStopRemainingEffects() {
        Map<String, Object> first = Map.of("msgtype", "m.text", "body", "a");
        Map<String, Object> second = Map.of("msgtype", "m.text", "body", "b");
        when(matrixPort.sendMessage(LOG, "m.room.message", first)).thenReturn(MatrixResult.failed("HTTP 500"));
        when(matrixPort.sendMessage(LOG, "m.room.message", second)).thenReturn(MatrixResult.ok("$b"));

        OptionalInt code = executor.execute(List.of(
                new Effect.Forward(LOG, "m.room.message", first),
                new Effect.Forward(LOG, "m.room.message", second)));

        assertTrue(code.isEmpty());
        verify(matrixPort).sendMessage(LOG, "m.room.message", second);
    }

    @Test
    void persistFailureStillReachesTerminate() {
        doThrow(new IllegalStateException("disk full")).when(configPort).save(any());

        OptionalInt code = executor.execute(List.of(new Effect.PersistConfig(5L), new Effect.Terminate(0)));

        assertEquals(OptionalInt.of(0), code);
    }
}
