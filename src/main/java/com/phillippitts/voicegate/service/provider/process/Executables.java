package com.phillippitts.voicegate.service.provider.process;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Resolves executable paths for command-line adapters.
 */
public final class Executables {

    private Executables() {
    }

    /**
     * Resolves a configured binary. Values containing a path separator are checked as-is (relative ones
     * against the working directory); bare names are searched on {@code PATH}.
     *
     * @param binary configured value
     * @return absolute path of an executable file, or empty
     */
    public static Optional<Path> resolve(String binary) {
        if (binary == null || binary.isBlank()) {
            return Optional.empty();
        }
        try {
            Path candidate = Path.of(binary);
            if (candidate.getParent() != null || candidate.isAbsolute()) {
                Path absolute = candidate.toAbsolutePath().normalize();
                return Files.isRegularFile(absolute) && Files.isExecutable(absolute)
                        ? Optional.of(absolute) : Optional.empty();
            }
            String path = System.getenv("PATH");
            if (path == null) {
                return Optional.empty();
            }
            for (String dir : path.split(File.pathSeparator)) {
                if (dir.isBlank()) {
                    continue;
                }
                Path p = Path.of(dir, binary);
                if (Files.isRegularFile(p) && Files.isExecutable(p)) {
                    return Optional.of(p.toAbsolutePath());
                }
            }
            return Optional.empty();
        } catch (InvalidPathException e) {
            return Optional.empty();
        }
    }
}
