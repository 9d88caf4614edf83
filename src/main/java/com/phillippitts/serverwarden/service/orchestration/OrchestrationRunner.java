package com.phillippitts.serverwarden.service.orchestration;

import com.phillippitts.serverwarden.config.properties.LoopProperties;
import com.phillippitts.serverwarden.service.metrics.WardenMetrics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;

/**
 * Drives {@link OrchestrationLoop} on a dedicated thread for the application's lifetime.
 *
 * <p>A failing tick is logged and followed by the configured error backoff; it never ends the loop.
 * Each tick logs with a {@code tick} ThreadContext key.
 */
@Service
@ConditionalOnProperty(prefix = "warden.loop", name = "enabled", havingValue = "true", matchIfMissing = true)
public class OrchestrationRunner implements SmartLifecycle {

    private static final Logger LOG = LogManager.getLogger(OrchestrationRunner.class);

    static final String TICK_KEY = "tick";
    private static final Duration STOP_JOIN_TIMEOUT = Duration.ofSeconds(10);

    private final OrchestrationLoop loop;
    private final WardenMetrics metrics;
    private final Clock clock;
    private final Duration errorBackoff;

    private volatile boolean running;
    private volatile Thread thread;
    private long tickCount;

    public OrchestrationRunner(OrchestrationLoop loop, WardenMetrics metrics, Clock clock, LoopProperties props) {
        this.loop = Objects.requireNonNull(loop, "loop");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.errorBackoff = Duration.ofMillis(props.getErrorBackoffMs());
    }

    @Override
    public void start() {
        if (running) {
            return;
        }
        running = true;
        Thread t = new Thread(this::runLoop, "warden-loop");
        t.setDaemon(true);
        thread = t;
        t.start();
        LOG.info("Orchestration loop started");
    }

    @Override
    public void stop() {
        if (!running) {
            return;
        }
        running = false;
        Thread t = thread;
        if (t != null) {
            t.interrupt();
            try {
                t.join(STOP_JOIN_TIMEOUT.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            if (t.isAlive()) {
                LOG.warn("Orchestration loop did not stop within {}s", STOP_JOIN_TIMEOUT.toSeconds());
            }
        }
        thread = null;
        LOG.info("Orchestration loop stopped after {} ticks", tickCount);
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    private void runLoop() {
        while (running) {
            Duration sleep = runOnce();
            try {
                Thread.sleep(sleep.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
    }

    /**
     * Runs a single tick and returns the delay before the next one.
     */
    Duration runOnce() {
        tickCount++;
        ThreadContext.put(TICK_KEY, Long.toString(tickCount));
        try {
            return loop.tick(clock.instant()).sleep();
        } catch (RuntimeException e) {
            metrics.incrementTickFailure();
            LOG.error("Tick {} failed; retrying in {}ms", tickCount, errorBackoff.toMillis(), e);
            return errorBackoff;
        } finally {
            ThreadContext.remove(TICK_KEY);
        }
    }
}
