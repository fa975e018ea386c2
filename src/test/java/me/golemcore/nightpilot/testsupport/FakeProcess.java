package me.golemcore.nightpilot.testsupport;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

/**
 * In-memory process that exits when the test says so.
 */
public class FakeProcess extends Process {

    private final CountDownLatch exited = new CountDownLatch(1);
    private final byte[] stdout;
    private final byte[] stderr;
    private volatile int exitCode;
    private volatile boolean destroyed;

    public FakeProcess(String stdout, String stderr, int exitCode) {
        this.stdout = stdout.getBytes(StandardCharsets.UTF_8);
        this.stderr = stderr.getBytes(StandardCharsets.UTF_8);
        this.exitCode = exitCode;
    }

    public static FakeProcess exited(String stdout, int exitCode) {
        FakeProcess process = new FakeProcess(stdout, "", exitCode);
        process.exit();
        return process;
    }

    public void exit() {
        exited.countDown();
    }

    public boolean isDestroyed() {
        return destroyed;
    }

    @Override
    public OutputStream getOutputStream() {
        return new ByteArrayOutputStream();
    }

    @Override
    public InputStream getInputStream() {
        return new ByteArrayInputStream(stdout);
    }

    @Override
    public InputStream getErrorStream() {
        return new ByteArrayInputStream(stderr);
    }

    @Override
    public int waitFor() throws InterruptedException {
        exited.await();
        return exitCode;
    }

    @Override
    public boolean waitFor(long timeout, TimeUnit unit) throws InterruptedException {
        return exited.await(timeout, unit);
    }

    @Override
    public int exitValue() {
        if (exited.getCount() > 0) {
            throw new IllegalThreadStateException("process has not exited");
        }
        return exitCode;
    }

    @Override
    public void destroy() {
        destroyed = true;
        exitCode = 137;
        exited.countDown();
    }

    @Override
    public Process destroyForcibly() {
        destroy();
        return this;
    }

    @Override
    public boolean isAlive() {
        return exited.getCount() > 0;
    }

    @Override
    public Stream<ProcessHandle> descendants() {
        return Stream.empty();
    }
}
