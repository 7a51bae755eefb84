package me.matrixwarden.bot.domain.loop;

import me.matrixwarden.bot.domain.service.ProcessExitService;
import me.matrixwarden.bot.domain.service.ProvisioningException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.DefaultApplicationArguments;

import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class BotRunnerTest {

    private AdminBotLoop loop;
    private ProcessExitService exitService;
    private BotRunner runner;

    @BeforeEach
    void setUp() {
        loop = mock(AdminBotLoop.class);
        exitService = mock(ProcessExitService.class);
        runner = new BotRunner(loop, exitService);
    }

    @Test
    void exitsWithLoopCode() {
        when(loop.run()).thenReturn(0);

        runner.run(new DefaultApplicationArguments());

        verify(exitService).exit(0);
    }

    @Test
    void provisioningFailureExitsWithOne() {
        when(loop.run()).thenThrow(new ProvisioningException("Failed to create admin space: HTTP 500"));

        runner.run(new DefaultApplicationArguments());

        verify(exitService).exit(ProcessExitService.EXIT_PROVISIONING_FAILED);
    }

    @Test
    void loginFailurePropagatesToStartup() {
        when(loop.run()).thenThrow(new IllegalStateException("Login failed"));

        assertThrows(IllegalStateException.class, () -> runner.run(new DefaultApplicationArguments()));
        verify(exitService, never()).exit(anyInt());
    }
}
