package com.phillippitts.voicegate.service.provider.process;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Abstraction over {@link ProcessBuilder} so command-line adapters can be tested without real binaries.
 */
public interface ProcessFactory {

    /**
     * @param command    full command line, executable first
     * @param workingDir working directory, may be null
     * @return started process
     * @throws IOException if the process cannot be started
     */
    Process start(List<String> command, Path workingDir) throws IOException;
}
