package com.phillippitts.voicegate.service.provider.process;

import com.phillippitts.voicegate.domain.ErrorKind;
import com.phillippitts.voicegate.exception.ProviderException;
import com.phillippitts.voicegate.exception.ProviderExceptionBuilder;
import com.phillippitts.voicegate.util.ProcessTimeouts;
import com.phillippitts.voicegate.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Runs one external command to completion with a deadline.
 *
 * <p>Stateless: every call owns its process and gobbler threads, so one runner is safely shared by
 * concurrent requests. stdout and stderr are drained concurrently to avoid pipe deadlock, and capped to
 * bound memory. A timeout or an interrupt destroys the process.
 *
 * <p>Failures are reported as {@link ProviderException}: start failures, timeouts and interrupts are
 * {@link ErrorKind#TRANSIENT}; a non-zero exit is {@link ErrorKind#PROVIDER_ERROR}.
 */
public final class ProcessRunner {

    private static final Logger LOG = LogManager.getLogger(ProcessRunner.class);

    static final int STDERR_MAX_CHARS = 16 * 1024;
    static final int ERROR_SNIPPET_MAX_CHARS = 512;

    private final ProcessFactory processFactory;

    public ProcessRunner(ProcessFactory processFactory) {
        this.processFactory = Objects.requireNonNull(processFactory, "processFactory");
    }

    /**
     * @param provider      provider name for error context
     * @param command       command line
     * @param workingDir    working directory, may be null
     * @param timeout       deadline for the whole run
     * @param maxStdoutChars cap on captured stdout
     * @return captured output of a zero-exit run
     * @throws ProviderException on start failure, timeout, interrupt or non-zero exit
     */
    public ProcessOutput run(String provider, List<String> command, Path workingDir, Duration timeout,
                             int maxStdoutChars) {
        long start = System.nanoTime();
        StringBuilder stdout = new StringBuilder();
        StringBuilder stderr = new StringBuilder();
        Process process = null;
        Thread outGobbler = null;
        Thread errGobbler = null;
        try {
            process = processFactory.start(command, workingDir);
            outGobbler = startGobbler(process.getInputStream(), stdout, provider + "-out", maxStdoutChars);
            errGobbler = startGobbler(process.getErrorStream(), stderr, provider + "-err", STDERR_MAX_CHARS);

            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                destroyProcess(process);
                throw error(provider, ErrorKind.TRANSIENT, "Timeout after " + timeout.toMillis() + "ms",
                        -1, start, command, stderr, null);
            }
            joinQuietly(outGobbler, ProcessTimeouts.GOBBLER_FLUSH_TIMEOUT);
            joinQuietly(errGobbler, ProcessTimeouts.GOBBLER_FLUSH_TIMEOUT);

            int exitCode = process.exitValue();
            if (exitCode != 0) {
                throw error(provider, ErrorKind.PROVIDER_ERROR, "Non-zero exit: " + exitCode,
                        exitCode, start, command, stderr, null);
            }
            LOG.debug("Process for {} finished in {}ms, stdout={} chars", provider,
                    TimeUtils.elapsedMillis(start), stdout.length());
            String out;
            synchronized (stdout) {
                out = stdout.toString();
            }
            return new ProcessOutput(exitCode, out, stderrText(stderr), TimeUtils.elapsedMillis(start));
        } catch (IOException e) {
            throw error(provider, ErrorKind.TRANSIENT, "I/O failure: " + e.getMessage(), -1, start, command, stderr, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            if (process != null) {
                destroyProcess(process);
            }
            throw error(provider, ErrorKind.TRANSIENT, "Interrupted", -1, start, command, stderr, e);
        }
    }

    private Thread startGobbler(InputStream in, StringBuilder sink, String name, int maxChars) {
        Thread thread = new Thread(new StreamGobbler(in, sink, name, maxChars), name);
        thread.setDaemon(true);
        thread.start();
        return thread;
    }

    /**
     * Reads lines into the sink until the cap, then keeps draining without accumulating.
     */
    private static final class StreamGobbler implements Runnable {
        private final InputStream inputStream;
        private final StringBuilder sink;
        private final String name;
        private final int maxChars;

        StreamGobbler(InputStream inputStream, StringBuilder sink, String name, int maxChars) {
            this.inputStream = inputStream;
            this.sink = sink;
            this.name = name;
            this.maxChars = maxChars;
        }

        @Override
        public void run() {
            try (BufferedReader br = new BufferedReader(new InputStreamReader(inputStream, StandardCharsets.UTF_8))) {
                String line;
                boolean capReached = false;
                while ((line = br.readLine()) != null) {
                    synchronized (sink) {
                        if (sink.length() >= maxChars) {
                            if (!capReached) {
                                LOG.warn("Stream '{}' reached {} char cap; discarding further output", name, maxChars);
                                capReached = true;
                            }
                            continue;
                        }
                        if (!sink.isEmpty()) {
                            sink.append('\n');
                        }
                        int available = maxChars - sink.length();
                        sink.append(line, 0, Math.min(line.length(), Math.max(0, available)));
                    }
                }
            } catch (IOException e) {
                LOG.debug("Stream gobbler '{}' stopped: {}", name, e.toString());
            }
        }
    }

    private static void joinQuietly(Thread thread, Duration timeout) {
        if (thread == null) {
            return;
        }
        try {
            thread.join(timeout.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void destroyProcess(Process process) {
        try {
            process.destroy();
            boolean exited = process.waitFor(ProcessTimeouts.GRACEFUL_SHUTDOWN_TIMEOUT.toMillis(),
                    TimeUnit.MILLISECONDS);
            if (!exited && process.isAlive()) {
                process.destroyForcibly();
                process.waitFor(ProcessTimeouts.FORCEFUL_SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
                if (process.isAlive()) {
                    LOG.warn("Process still alive after destroyForcibly");
                }
            }
        } catch (InterruptedException e) {
            // keep the interrupt for the caller; the process has been asked to stop
            Thread.currentThread().interrupt();
            process.destroyForcibly();
        }
    }

    private static String stderrText(StringBuilder stderr) {
        synchronized (stderr) {
            return stderr.toString();
        }
    }

    private static ProviderException error(String provider, ErrorKind kind, String message, int exitCode,
                                           long startNanos, List<String> command, StringBuilder stderr,
                                           Throwable cause) {
        String snippet;
        synchronized (stderr) {
            snippet = stderr.substring(0, Math.min(ERROR_SNIPPET_MAX_CHARS, stderr.length()));
        }
        ProviderExceptionBuilder builder = ProviderExceptionBuilder.create(message)
                .provider(provider)
                .kind(kind)
                .exitCode(exitCode)
                .durationMs(TimeUtils.elapsedMillis(startNanos))
                .metadata("binary", command.isEmpty() ? null : command.get(0));
        if (!snippet.isEmpty()) {
            builder.metadata("stderr", snippet);
        }
        if (cause != null) {
            builder.cause(cause);
        }
        return builder.build();
    }
}
