package com.phillippitts.voicegate.service.provider.process;

import com.phillippitts.voicegate.domain.ErrorKind;
import com.phillippitts.voicegate.exception.ProviderException;
import com.phillippitts.voicegate.exception.TransientProviderException;
import com.phillippitts.voicegate.testutil.FakeProcess;
import com.phillippitts.voicegate.testutil.ScriptedProcessFactory;
import org.awaitility.Awaitility;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ProcessRunnerTest {

    private static final List<String> COMMAND = List.of("/usr/bin/whisper", "-f", "in.wav");

    @Test
    void successReturnsCapturedStreams() {
        ProcessRunner runner = new ProcessRunner(
                ScriptedProcessFactory.returning(FakeProcess.exited("hello world", "loading model", 0)));

        ProcessOutput out = runner.run("whisper", COMMAND, null, Duration.ofSeconds(2), 1024);

        assertThat(out.exitCode()).isZero();
        assertThat(out.stdout()).isEqualTo("hello world");
        assertThat(out.stderr()).isEqualTo("loading model");
    }

    @Test
    void stdoutIsCapped() {
        ProcessRunner runner = new ProcessRunner(
                ScriptedProcessFactory.returning(FakeProcess.exited("abcdefghij\nklmnop", "", 0)));

        ProcessOutput out = runner.run("whisper", COMMAND, null, Duration.ofSeconds(2), 5);

        assertThat(out.stdout()).isEqualTo("abcde");
    }

    @Test
    void nonZeroExitIsProviderErrorWithStderrSnippet() {
        ProcessRunner runner = new ProcessRunner(
                ScriptedProcessFactory.returning(FakeProcess.exited("", "model file corrupt", 3)));

        assertThatThrownBy(() -> runner.run("whisper", COMMAND, null, Duration.ofSeconds(2), 1024))
                .isInstanceOfSatisfying(ProviderException.class,
                        e -> assertThat(e.getKind()).isEqualTo(ErrorKind.PROVIDER_ERROR))
                .hasMessageContaining("Non-zero exit: 3")
                .hasMessageContaining("stderr=model file corrupt")
                .hasMessageContaining("binary=/usr/bin/whisper")
                .hasMessageContaining("provider: whisper");
    }

    @Test
    void timeoutDestroysProcessAndIsTransient() {
        FakeProcess process = FakeProcess.hanging();
        ProcessRunner runner = new ProcessRunner(ScriptedProcessFactory.returning(process));

        assertThatThrownBy(() -> runner.run("whisper", COMMAND, null, Duration.ofMillis(100), 1024))
                .isInstanceOf(TransientProviderException.class)
                .hasMessageContaining("Timeout after 100ms");

        Awaitility.await().atMost(2, TimeUnit.SECONDS).until(process::wasDestroyCalled);
    }

    @Test
    void startFailureIsTransient() {
        ProcessRunner runner = new ProcessRunner(new ScriptedProcessFactory(command -> {
            throw new IOException("No such file or directory");
        }));

        assertThatThrownBy(() -> runner.run("whisper", COMMAND, null, Duration.ofSeconds(1), 1024))
                .isInstanceOf(TransientProviderException.class)
                .hasMessageContaining("No such file or directory")
                .hasCauseInstanceOf(IOException.class);
    }

    @Test
    void interruptDestroysProcessAndKeepsFlag() {
        FakeProcess process = FakeProcess.hanging();
        ProcessRunner runner = new ProcessRunner(ScriptedProcessFactory.returning(process));

        Thread.currentThread().interrupt();
        try {
            assertThatThrownBy(() -> runner.run("whisper", COMMAND, null, Duration.ofSeconds(5), 1024))
                    .isInstanceOf(TransientProviderException.class)
                    .hasMessageContaining("Interrupted");
            assertThat(Thread.currentThread().isInterrupted()).isTrue();
            assertThat(process.wasDestroyCalled()).isTrue();
        } finally {
            Thread.interrupted();
        }
    }
}
