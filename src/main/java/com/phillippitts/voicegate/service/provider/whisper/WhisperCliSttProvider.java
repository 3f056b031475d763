package com.phillippitts.voicegate.service.provider.whisper;

import com.phillippitts.voicegate.domain.HealthProbe;
import com.phillippitts.voicegate.domain.ProviderCapabilities;
import com.phillippitts.voicegate.domain.ProviderCategory;
import com.phillippitts.voicegate.domain.Transcription;
import com.phillippitts.voicegate.exception.ProviderValidationException;
import com.phillippitts.voicegate.exception.TransientProviderException;
import com.phillippitts.voicegate.service.provider.SttProvider;
import com.phillippitts.voicegate.service.provider.process.ProcessOutput;
import com.phillippitts.voicegate.service.provider.process.ProcessRunner;
import com.phillippitts.voicegate.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Speech-to-text through a local whisper.cpp binary.
 *
 * <p>CLI contract:
 * <pre>
 * ${binary} -m ${model} -f ${audioFile} -l ${language} -oj -of stdout -t ${threads}
 * </pre>
 *
 * <p>Each call writes the audio to its own temp file and runs its own process, so the adapter holds no
 * per-request state.
 */
public final class WhisperCliSttProvider implements SttProvider {

    private static final Logger LOG = LogManager.getLogger(WhisperCliSttProvider.class);

    static final Set<String> SUPPORTED_FORMATS = Set.of("wav", "mp3", "ogg", "flac");

    private final String name;
    private final WhisperSettings settings;
    private final ProcessRunner runner;

    WhisperCliSttProvider(String name, WhisperSettings settings, ProcessRunner runner) {
        this.name = Objects.requireNonNull(name, "name");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.runner = Objects.requireNonNull(runner, "runner");
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public ProviderCapabilities capabilities() {
        return new ProviderCapabilities(ProviderCategory.STT, Set.of(), SUPPORTED_FORMATS);
    }

    @Override
    public Transcription transcribe(byte[] audio, String language, Map<String, String> options) {
        String format = options.getOrDefault("format", "wav").toLowerCase(Locale.ROOT);
        if (!SUPPORTED_FORMATS.contains(format)) {
            throw new ProviderValidationException("Unsupported audio format '" + format + "'", name);
        }
        Path audioFile = null;
        try {
            audioFile = Files.createTempFile("voicegate-stt-", "." + format);
            Files.write(audioFile, audio);
            ProcessOutput out = runner.run(name, buildCommand(audioFile, language), audioFile.getParent(),
                    settings.timeout(), settings.maxStdoutChars());
            return toTranscription(out.stdout(), language);
        } catch (IOException e) {
            throw new TransientProviderException("Cannot stage audio file: " + e.getMessage(), name, e);
        } finally {
            deleteQuietly(audioFile);
        }
    }

    @Override
    public HealthProbe health() {
        long start = System.nanoTime();
        boolean ok = Files.isExecutable(settings.binaryPath()) && Files.isReadable(settings.modelPath());
        double latency = TimeUtils.elapsedMillisPrecise(start);
        return ok ? HealthProbe.up(latency) : HealthProbe.down(latency, "binary or model not accessible");
    }

    List<String> buildCommand(Path audioFile, String language) {
        List<String> cmd = new ArrayList<>();
        cmd.add(settings.binaryPath().toString());
        cmd.add("-m");
        cmd.add(settings.modelPath().toString());
        cmd.add("-f");
        cmd.add(audioFile.toAbsolutePath().toString());
        cmd.add("-l");
        cmd.add(whisperLanguage(language));
        cmd.add("-oj");
        cmd.add("-of");
        cmd.add("stdout");
        cmd.add("-t");
        cmd.add(String.valueOf(settings.threads()));
        return cmd;
    }

    /**
     * whisper.cpp takes ISO 639-1 codes: "en-US" becomes "en", absent becomes "auto".
     */
    static String whisperLanguage(String language) {
        if (language == null || language.isBlank() || "auto".equalsIgnoreCase(language)) {
            return "auto";
        }
        int dash = language.indexOf('-');
        return (dash > 0 ? language.substring(0, dash) : language).toLowerCase(Locale.ROOT);
    }

    private Transcription toTranscription(String stdout, String requestedLanguage) {
        String text;
        String language;
        if (WhisperJsonParser.looksLikeJson(stdout)) {
            text = WhisperJsonParser.extractText(stdout).orElse("");
            language = WhisperJsonParser.extractLanguage(stdout).orElse(requestedLanguage);
        } else {
            text = stdout == null ? "" : stdout.trim();
            language = requestedLanguage;
        }
        if (text.isBlank()) {
            throw new ProviderValidationException("No speech recognized", name);
        }
        return new Transcription(text, null, language);
    }

    private static void deleteQuietly(Path file) {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            LOG.warn("Failed to delete temp audio {}: {}", file, e.toString());
        }
    }
}
