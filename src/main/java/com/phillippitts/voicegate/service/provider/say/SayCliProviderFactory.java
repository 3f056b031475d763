package com.phillippitts.voicegate.service.provider.say;

import com.phillippitts.voicegate.domain.ProviderCategory;
import com.phillippitts.voicegate.domain.ProviderDescriptor;
import com.phillippitts.voicegate.exception.ProviderConfigurationException;
import com.phillippitts.voicegate.service.provider.ProviderFactory;
import com.phillippitts.voicegate.service.provider.ProviderSettings;
import com.phillippitts.voicegate.service.provider.SpeechProvider;
import com.phillippitts.voicegate.service.provider.process.Executables;
import com.phillippitts.voicegate.service.provider.process.ProcessRunner;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;

/**
 * Registers the {@code say-cli} TTS type.
 *
 * <p>Settings: {@code binary-path} (required), {@code voice}, {@code format} (aiff),
 * {@code timeout-seconds} (60).
 */
@Component
public class SayCliProviderFactory implements ProviderFactory {

    public static final String TYPE = "say-cli";

    private final ProcessRunner runner;

    public SayCliProviderFactory(ProcessRunner runner) {
        this.runner = runner;
    }

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    public ProviderCategory category() {
        return ProviderCategory.TTS;
    }

    @Override
    public SpeechProvider create(ProviderDescriptor descriptor) {
        ProviderSettings s = ProviderSettings.of(descriptor);
        String binary = s.required("binary-path");
        Path binaryPath = Executables.resolve(binary).orElseThrow(() ->
                new ProviderConfigurationException("say binary not found or not executable: " + binary,
                        descriptor.name()));
        String format = s.optional("format", "aiff").toLowerCase(Locale.ROOT);
        if (!SayTtsProvider.CONTENT_TYPES.containsKey(format)) {
            throw new ProviderConfigurationException("Unsupported default format '" + format + "'", descriptor.name());
        }
        return new SayTtsProvider(descriptor.name(), binaryPath, s.optional("voice", null), format,
                Duration.ofSeconds(s.positiveInt("timeout-seconds", 60)), runner);
    }
}
