package com.phillippitts.voicegate.config.properties;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Local object storage for synthesized audio (prefix {@code voice.storage}).
 */
@ConfigurationProperties(prefix = "voice.storage")
@Validated
public class StorageProperties {

    @NotBlank
    private String baseDir = System.getProperty("java.io.tmpdir") + "/voicegate-audio";

    public String getBaseDir() {
        return baseDir;
    }

    public void setBaseDir(String baseDir) {
        this.baseDir = baseDir;
    }
}
