package com.phillippitts.voicegate.service.provider.whisper;

import com.phillippitts.voicegate.domain.ProviderCategory;
import com.phillippitts.voicegate.domain.ProviderDescriptor;
import com.phillippitts.voicegate.exception.ProviderConfigurationException;
import com.phillippitts.voicegate.service.provider.SpeechProvider;
import com.phillippitts.voicegate.service.provider.process.ProcessRunner;
import com.phillippitts.voicegate.testutil.FakeProcess;
import com.phillippitts.voicegate.testutil.ScriptedProcessFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisabledOnOs(OS.WINDOWS)
class WhisperCliProviderFactoryTest {

    @TempDir
    Path dir;

    private Path binary;
    private Path model;
    private WhisperCliProviderFactory factory;

    @BeforeEach
    void setUp() throws IOException {
        binary = Files.writeString(dir.resolve("whisper"), "#!/bin/sh\n");
        assertThat(binary.toFile().setExecutable(true)).isTrue();
        model = Files.write(dir.resolve("ggml-base.bin"), new byte[]{0});
        factory = new WhisperCliProviderFactory(
                new ProcessRunner(ScriptedProcessFactory.returning(FakeProcess.exited("", "", 0))));
    }

    private static ProviderDescriptor descriptor(Map<String, String> settings) {
        return new ProviderDescriptor("local-whisper", WhisperCliProviderFactory.TYPE, ProviderCategory.STT, 0,
                true, settings);
    }

    @Test
    void createsSttAdapterWithResolvedPaths() {
        SpeechProvider adapter = factory.create(descriptor(Map.of(
                "binary-path", binary.toString(), "model-path", model.toString(), "threads", "8")));

        assertThat(adapter).isInstanceOf(WhisperCliSttProvider.class);
        assertThat(adapter.name()).isEqualTo("local-whisper");
        assertThat(adapter.capabilities().category()).isEqualTo(ProviderCategory.STT);
        assertThat(adapter.health().ok()).isTrue();
        assertThat(factory.type()).isEqualTo("whisper-cli");
        assertThat(factory.category()).isEqualTo(ProviderCategory.STT);
    }

    @Test
    void missingBinaryIsConfigurationError() {
        assertThatThrownBy(() -> factory.create(descriptor(Map.of(
                "binary-path", dir.resolve("nope").toString(), "model-path", model.toString()))))
                .isInstanceOf(ProviderConfigurationException.class)
                .hasMessageContaining("whisper binary not found")
                .hasMessageContaining("local-whisper");
    }

    @Test
    void missingModelIsConfigurationError() {
        assertThatThrownBy(() -> factory.create(descriptor(Map.of(
                "binary-path", binary.toString(), "model-path", dir.resolve("absent.bin").toString()))))
                .isInstanceOf(ProviderConfigurationException.class)
                .hasMessageContaining("whisper model not found");
    }

    @Test
    void missingRequiredSettingIsConfigurationError() {
        assertThatThrownBy(() -> factory.create(descriptor(Map.of("binary-path", binary.toString()))))
                .isInstanceOf(ProviderConfigurationException.class)
                .hasMessageContaining("Missing required setting 'model-path'");
    }

    @Test
    void nonPositiveThreadsIsConfigurationError() {
        assertThatThrownBy(() -> factory.create(descriptor(Map.of(
                "binary-path", binary.toString(), "model-path", model.toString(), "threads", "0"))))
                .isInstanceOf(ProviderConfigurationException.class)
                .hasMessageContaining("'threads' must be positive");
    }
}
