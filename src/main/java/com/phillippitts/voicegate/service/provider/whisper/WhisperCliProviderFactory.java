package com.phillippitts.voicegate.service.provider.whisper;

import com.phillippitts.voicegate.domain.ProviderCategory;
import com.phillippitts.voicegate.domain.ProviderDescriptor;
import com.phillippitts.voicegate.exception.ProviderConfigurationException;
import com.phillippitts.voicegate.service.provider.ProviderFactory;
import com.phillippitts.voicegate.service.provider.ProviderSettings;
import com.phillippitts.voicegate.service.provider.SpeechProvider;
import com.phillippitts.voicegate.service.provider.process.Executables;
import com.phillippitts.voicegate.service.provider.process.ProcessRunner;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Registers the {@code whisper-cli} STT type.
 *
 * <p>Settings: {@code binary-path} and {@code model-path} (required, must exist), {@code threads} (4),
 * {@code timeout-seconds} (60), {@code max-stdout-chars} (1048576).
 */
@Component
public class WhisperCliProviderFactory implements ProviderFactory {

    public static final String TYPE = "whisper-cli";

    private final ProcessRunner runner;

    public WhisperCliProviderFactory(ProcessRunner runner) {
        this.runner = runner;
    }

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    public ProviderCategory category() {
        return ProviderCategory.STT;
    }

    @Override
    public SpeechProvider create(ProviderDescriptor descriptor) {
        ProviderSettings s = ProviderSettings.of(descriptor);
        String binary = s.required("binary-path");
        Path binaryPath = Executables.resolve(binary).orElseThrow(() ->
                new ProviderConfigurationException("whisper binary not found or not executable: " + binary,
                        descriptor.name()));
        Path modelPath = Path.of(s.required("model-path")).toAbsolutePath().normalize();
        if (!Files.isRegularFile(modelPath)) {
            throw new ProviderConfigurationException("whisper model not found: " + modelPath, descriptor.name());
        }
        WhisperSettings settings = new WhisperSettings(binaryPath, modelPath,
                s.positiveInt("threads", 4),
                Duration.ofSeconds(s.positiveInt("timeout-seconds", 60)),
                s.positiveInt("max-stdout-chars", 1_048_576));
        return new WhisperCliSttProvider(descriptor.name(), settings, runner);
    }
}
