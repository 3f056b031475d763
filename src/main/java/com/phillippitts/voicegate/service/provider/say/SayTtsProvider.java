package com.phillippitts.voicegate.service.provider.say;

import com.phillippitts.voicegate.domain.HealthProbe;
import com.phillippitts.voicegate.domain.ProviderCapabilities;
import com.phillippitts.voicegate.domain.ProviderCategory;
import com.phillippitts.voicegate.domain.Synthesis;
import com.phillippitts.voicegate.domain.VoiceOptions;
import com.phillippitts.voicegate.exception.ProviderExceptionBuilder;
import com.phillippitts.voicegate.exception.ProviderValidationException;
import com.phillippitts.voicegate.exception.TransientProviderException;
import com.phillippitts.voicegate.service.provider.TtsProvider;
import com.phillippitts.voicegate.service.provider.process.ProcessRunner;
import com.phillippitts.voicegate.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Text-to-speech through a {@code say}-compatible command.
 *
 * <p>CLI contract:
 * <pre>
 * ${binary} [-v ${voice}] -f ${textFile} -o ${audioFile}
 * </pre>
 * The output format follows the audio file extension. The adapter returns raw bytes; the orchestrator
 * stores them and hands the caller a reference.
 */
public final class SayTtsProvider implements TtsProvider {

    private static final Logger LOG = LogManager.getLogger(SayTtsProvider.class);

    static final Map<String, String> CONTENT_TYPES = Map.of(
            "aiff", "audio/aiff",
            "wav", "audio/wav",
            "m4a", "audio/mp4",
            "caf", "audio/x-caf");

    private final String name;
    private final Path binaryPath;
    private final String defaultVoice;
    private final String defaultFormat;
    private final Duration timeout;
    private final ProcessRunner runner;

    SayTtsProvider(String name, Path binaryPath, String defaultVoice, String defaultFormat, Duration timeout,
                   ProcessRunner runner) {
        this.name = Objects.requireNonNull(name, "name");
        this.binaryPath = Objects.requireNonNull(binaryPath, "binaryPath");
        this.defaultVoice = defaultVoice;
        this.defaultFormat = Objects.requireNonNull(defaultFormat, "defaultFormat");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
        this.runner = Objects.requireNonNull(runner, "runner");
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public ProviderCapabilities capabilities() {
        return new ProviderCapabilities(ProviderCategory.TTS, Set.of(), CONTENT_TYPES.keySet());
    }

    @Override
    public Synthesis synthesize(String text, VoiceOptions voiceOptions) {
        String format = voiceOptions.format() == null
                ? defaultFormat : voiceOptions.format().toLowerCase(Locale.ROOT);
        String contentType = CONTENT_TYPES.get(format);
        if (contentType == null) {
            throw new ProviderValidationException("Unsupported output format '" + format + "'", name);
        }
        String voice = voiceOptions.voice() != null ? voiceOptions.voice() : defaultVoice;

        Path textFile = null;
        Path audioFile = null;
        try {
            textFile = Files.createTempFile("voicegate-tts-", ".txt");
            Files.writeString(textFile, text, StandardCharsets.UTF_8);
            audioFile = Files.createTempFile("voicegate-tts-", "." + format);
            runner.run(name, buildCommand(textFile, audioFile, voice), textFile.getParent(), timeout, 4096);
            byte[] audio = Files.readAllBytes(audioFile);
            if (audio.length == 0) {
                throw ProviderExceptionBuilder.create("Synthesizer produced no audio")
                        .provider(name)
                        .metadata("format", format)
                        .build();
            }
            return Synthesis.ofBytes(audio, contentType);
        } catch (IOException e) {
            throw new TransientProviderException("Audio staging failed: " + e.getMessage(), name, e);
        } finally {
            deleteQuietly(textFile);
            deleteQuietly(audioFile);
        }
    }

    @Override
    public HealthProbe health() {
        long start = System.nanoTime();
        boolean ok = Files.isExecutable(binaryPath);
        double latency = TimeUtils.elapsedMillisPrecise(start);
        return ok ? HealthProbe.up(latency) : HealthProbe.down(latency, "binary not executable");
    }

    List<String> buildCommand(Path textFile, Path audioFile, String voice) {
        List<String> cmd = new ArrayList<>();
        cmd.add(binaryPath.toString());
        if (voice != null && !voice.isBlank()) {
            cmd.add("-v");
            cmd.add(voice);
        }
        cmd.add("-f");
        cmd.add(textFile.toAbsolutePath().toString());
        cmd.add("-o");
        cmd.add(audioFile.toAbsolutePath().toString());
        return cmd;
    }

    private static void deleteQuietly(Path file) {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            LOG.warn("Failed to delete temp file {}: {}", file, e.toString());
        }
    }
}
