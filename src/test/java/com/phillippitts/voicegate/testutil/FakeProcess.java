package com.phillippitts.voicegate.testutil;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.TimeUnit;

/**
 * Minimal fake {@link Process} with scripted output, exit code and run time.
 * A negative {@code finishAfterMillis} never finishes on its own.
 */
public final class FakeProcess extends Process {

    private final byte[] out;
    private final byte[] err;
    private final int exitCode;
    private final long finishAfterMillis;
    private volatile boolean alive = true;
    private volatile boolean destroyCalled = false;

    public FakeProcess(String stdout, String stderr, int exitCode, long finishAfterMillis) {
        this.out = stdout.getBytes(StandardCharsets.UTF_8);
        this.err = stderr.getBytes(StandardCharsets.UTF_8);
        this.exitCode = exitCode;
        this.finishAfterMillis = finishAfterMillis;
        if (finishAfterMillis == 0) {
            this.alive = false;
        }
    }

    public static FakeProcess exited(String stdout, String stderr, int exitCode) {
        return new FakeProcess(stdout, stderr, exitCode, 0);
    }

    public static FakeProcess hanging() {
        return new FakeProcess("", "", 0, -1);
    }

    public boolean wasDestroyCalled() {
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
        alive = false;
        return exitCode;
    }

    @Override
    public boolean waitFor(long timeout, TimeUnit unit) throws InterruptedException {
        long ms = unit.toMillis(timeout);
        if (!alive) {
            return true;
        }
        if (finishAfterMillis < 0 || finishAfterMillis > ms) {
            Thread.sleep(ms);
            return !alive;
        }
        Thread.sleep(finishAfterMillis);
        alive = false;
        return true;
    }

    @Override
    public int exitValue() {
        if (alive) {
            throw new IllegalThreadStateException("process has not exited");
        }
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
