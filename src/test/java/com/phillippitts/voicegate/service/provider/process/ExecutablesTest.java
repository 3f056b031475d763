package com.phillippitts.voicegate.service.provider.process;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class ExecutablesTest {

    @TempDir
    Path dir;

    @Test
    @DisabledOnOs(OS.WINDOWS)
    void resolvesExecutableFileByPath() throws IOException {
        Path bin = Files.createFile(dir.resolve("whisper"));
        assertThat(bin.toFile().setExecutable(true)).isTrue();

        assertThat(Executables.resolve(bin.toString())).contains(bin.toAbsolutePath().normalize());
    }

    @Test
    @DisabledOnOs(OS.WINDOWS)
    void rejectsNonExecutableFile() throws IOException {
        Path file = Files.createFile(dir.resolve("model.bin"));
        assertThat(file.toFile().setExecutable(false)).isTrue();

        assertThat(Executables.resolve(file.toString())).isEmpty();
    }

    @Test
    void missingOrBlankIsEmpty() {
        assertThat(Executables.resolve(dir.resolve("absent").toString())).isEmpty();
        assertThat(Executables.resolve(" ")).isEmpty();
        assertThat(Executables.resolve(null)).isEmpty();
        assertThat(Executables.resolve("definitely-not-a-real-binary-xyz")).isEmpty();
    }
}
