package com.phillippitts.serverwarden.service.control;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

/**
 * Shared test doubles for command execution tests.
 * Provides fake Process implementations so no real service manager or updater is spawned.
 */
final class ProcessTestDoubles {

    private ProcessTestDoubles() {}

    /**
     * Encapsulates test process behavior configuration.
     *
     * @param stdout stdout content to return
     * @param stderr stderr content to return
     * @param exitCode process exit code
     * @param finishAfterMillis delay before process finishes (-1 means never finish on its own)
     */
    record ProcessBehavior(String stdout, String stderr, int exitCode, long finishAfterMillis) {

        static ProcessBehavior exits(int exitCode, String stdout) {
            return new ProcessBehavior(stdout, "", exitCode, 0);
        }
    }

    /**
     * Stub ProcessFactory that returns a pre-configured Process and records the commands it was asked to run.
     */
    static final class StubProcessFactory implements ProcessFactory {
        private final Process p;
        final List<List<String>> commands = new CopyOnWriteArrayList<>();

        StubProcessFactory(Process p) {
            this.p = p;
        }

        @Override
        public Process start(List<String> command, Path workingDir) {
            commands.add(new ArrayList<>(command));
            return p;
        }
    }

    /**
     * Factory whose executable cannot be found.
     */
    static final class FailingProcessFactory implements ProcessFactory {
        @Override
        public Process start(List<String> command, Path workingDir) throws IOException {
            throw new IOException("Cannot run program \"" + command.get(0) + "\": error=2, No such file or directory");
        }
    }

    /**
     * Minimal fake Process with controlled output, exit code and termination timing.
     */
    static final class TestProcess extends Process {
        private final byte[] out;
        private final byte[] err;
        private final int exitCode;
        private final long finishAfterMillis;
        private volatile boolean alive = true;
        private volatile boolean destroyCalled = false;

        TestProcess(ProcessBehavior behavior) {
            this.out = behavior.stdout().getBytes(StandardCharsets.UTF_8);
            this.err = behavior.stderr().getBytes(StandardCharsets.UTF_8);
            this.exitCode = behavior.exitCode();
            this.finishAfterMillis = behavior.finishAfterMillis();
            if (finishAfterMillis == 0) {
                this.alive = false;
            }
        }

        boolean wasDestroyCalled() {
            return destroyCalled;
        }

        @Override
        public OutputStream getOutputStream() {
            return new ByteArrayOutputStream();
        }

        @Override
        public InputStream getInputStream() {
            return new ByteArrayInputStream(out);
        }

        @Override
        public InputStream getErrorStream() {
            return new ByteArrayInputStream(err);
        }

        @Override
        public int waitFor() {
            this.alive = false;
            return exitCode;
        }

        @Override
        public boolean waitFor(long timeout, TimeUnit unit) throws InterruptedException {
            if (!alive) {
                return true;
            }
            long ms = unit.toMillis(timeout);
            if (finishAfterMillis < 0 || finishAfterMillis > ms) {
                Thread.sleep(ms);
                return !alive;
            }
            Thread.sleep(finishAfterMillis);
            this.alive = false;
            return true;
        }

        @Override
        public int exitValue() {
            return exitCode;
        }

        @Override
        public void destroy() {
            destroyCalled = true;
            alive = false;
        }

        @Override
        public Process destroyForcibly() {
            destroyCalled = true;
            alive = false;
            return this;
        }

        @Override
        public boolean isAlive() {
            return alive;
        }
    }
}
