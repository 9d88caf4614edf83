package com.phillippitts.serverwarden.testutil;

import com.phillippitts.serverwarden.exception.ServiceControlException;
import com.phillippitts.serverwarden.service.control.ServiceController;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Test double for ServiceController backed by a running flag.
 *
 * <p>Start and restart set the flag, stop clears it. Every call is recorded as
 * {@code "start"}, {@code "stop"} or {@code "restart"} so tests can assert the exact sequence of
 * operations issued against the server.
 */
public class FakeServiceController implements ServiceController {
    public volatile boolean running;
    public volatile boolean refuse;
    public volatile ServiceControlException failure;
    public volatile ServiceControlException queryFailure;
    public final List<String> calls = new CopyOnWriteArrayList<>();

    public FakeServiceController(boolean running) {
        this.running = running;
    }

    @Override
    public String serviceName() {
        return "pzserver";
    }

    @Override
    public boolean isRunning() {
        if (queryFailure != null) {
            throw queryFailure;
        }
        return running;
    }

    @Override
    public boolean exists() {
        return true;
    }

    @Override
    public boolean start(String context) {
        return perform("start", true);
    }

    @Override
    public boolean stop(String reason) {
        return perform("stop", false);
    }

    @Override
    public boolean restart(String reason) {
        return perform("restart", true);
    }

    private boolean perform(String op, boolean runningAfter) {
        calls.add(op);
        if (failure != null) {
            throw failure;
        }
        if (refuse) {
            return false;
        }
        running = runningAfter;
        return true;
    }

    /** Number of calls that targeted the server. */
    public int operationCount() {
        return calls.size();
    }
}
