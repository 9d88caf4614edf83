package com.phillippitts.serverwarden.service.orchestration;

import com.phillippitts.serverwarden.config.properties.LoopProperties;
import com.phillippitts.serverwarden.exception.ServiceControlException;
import com.phillippitts.serverwarden.exception.ServiceControlException.Severity;
import com.phillippitts.serverwarden.service.metrics.WardenMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.atLeast;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.mockingDetails;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class OrchestrationRunnerTest {

    private static final Instant NOW = Instant.parse("2024-10-17T14:00:00Z");

    private OrchestrationLoop loop;
    private SimpleMeterRegistry meterRegistry;
    private OrchestrationRunner runner;

    @BeforeEach
    void setUp() {
        loop = mock(OrchestrationLoop.class);
        meterRegistry = new SimpleMeterRegistry();
        LoopProperties props = new LoopProperties();
        props.setErrorBackoffMs(2500);
        runner = new OrchestrationRunner(loop, new WardenMetrics(meterRegistry),
                Clock.fixed(NOW, ZoneOffset.UTC), props);
    }

    @AfterEach
    void tearDown() {
        runner.stop();
        ThreadContext.clearAll();
    }

    @Test
    void runOnceReturnsTheLoopsSleep() {
        when(loop.tick(NOW)).thenReturn(new TickResult(false, true, Duration.ofMillis(500)));

        assertThat(runner.runOnce()).isEqualTo(Duration.ofMillis(500));
        assertThat(ThreadContext.get(OrchestrationRunner.TICK_KEY)).isNull();
    }

    @Test
    void failingTickBacksOffAndIsCounted() {
        when(loop.tick(any())).thenThrow(new ServiceControlException("boom", "pzserver", "is-active",
                Severity.TRANSIENT));

        assertThat(runner.runOnce()).isEqualTo(Duration.ofMillis(2500));
        assertThat(runner.runOnce()).isEqualTo(Duration.ofMillis(2500));
        assertThat(meterRegistry.get("warden.tick.failures").counter().count()).isEqualTo(2.0);
    }

    @Test
    void lifecycleTicksUntilStopped() {
        when(loop.tick(any())).thenReturn(new TickResult(false, true, Duration.ofMillis(10)));

        runner.start();
        assertThat(runner.isRunning()).isTrue();

        await().atMost(Duration.ofSeconds(5)).untilAsserted(() -> verify(loop, atLeast(3)).tick(any()));

        runner.stop();
        assertThat(runner.isRunning()).isFalse();
        int ticksAtStop = mockingDetails(loop).getInvocations().size();
        await().during(Duration.ofMillis(100)).atMost(Duration.ofSeconds(1))
                .until(() -> mockingDetails(loop).getInvocations().size() == ticksAtStop);
    }
}
