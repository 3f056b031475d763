package com.phillippitts.voicegate.service.provider.process;

/**
 * Captured result of a finished external process.
 *
 * @param exitCode   process exit status
 * @param stdout     captured standard output, capped
 * @param stderr     captured standard error, capped
 * @param durationMs wall-clock run time
 */
public record ProcessOutput(int exitCode, String stdout, String stderr, long durationMs) {
}
