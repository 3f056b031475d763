package com.phillippitts.voicegate.service.provider.whisper;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Resolved settings of one whisper-cli provider.
 *
 * @param binaryPath     absolute path of the whisper.cpp executable
 * @param modelPath      absolute path of the ggml model
 * @param threads        decoder threads
 * @param timeout        process deadline
 * @param maxStdoutChars cap on captured stdout
 */
record WhisperSettings(Path binaryPath, Path modelPath, int threads, Duration timeout, int maxStdoutChars) {
}
