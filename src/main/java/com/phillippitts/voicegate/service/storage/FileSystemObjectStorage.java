package com.phillippitts.voicegate.service.storage;

import com.phillippitts.voicegate.exception.VoiceGateException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;
import java.util.Map;

/**
 * Content-addressed {@link ObjectStorage} on the local file system.
 *
 * <p>Files are named {@code sha256.ext}; storing identical bytes twice yields the same reference. Writes go
 * to a temp file first and are moved into place atomically, so readers never see partial files.
 */
public class FileSystemObjectStorage implements ObjectStorage {

    private static final Logger LOG = LogManager.getLogger(FileSystemObjectStorage.class);

    static final String SCHEME = "file-store://";

    private static final Map<String, String> EXTENSIONS = Map.of(
            "audio/aiff", "aiff",
            "audio/wav", "wav",
            "audio/mpeg", "mp3",
            "audio/ogg", "ogg",
            "audio/mp4", "m4a",
            "audio/x-caf", "caf");

    private final Path baseDir;

    public FileSystemObjectStorage(Path baseDir) {
        this.baseDir = baseDir.toAbsolutePath().normalize();
    }

    @Override
    public String put(byte[] bytes, String contentType) {
        if (bytes == null || bytes.length == 0) {
            throw new IllegalArgumentException("bytes must not be empty");
        }
        String name = sha256(bytes) + '.' + extension(contentType);
        Path target = baseDir.resolve(name);
        try {
            Files.createDirectories(baseDir);
            if (!Files.exists(target)) {
                Path tmp = Files.createTempFile(baseDir, "upload-", ".tmp");
                try {
                    Files.write(tmp, bytes);
                    Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE);
                } catch (FileAlreadyExistsException e) {
                    LOG.debug("Object {} stored concurrently", name);
                } finally {
                    Files.deleteIfExists(tmp);
                }
            }
        } catch (IOException e) {
            throw new VoiceGateException("Failed to store audio object " + name, e);
        }
        return SCHEME + name;
    }

    /**
     * Resolves a reference returned by {@link #put} back to its file.
     */
    public Path resolve(String reference) {
        if (reference == null || !reference.startsWith(SCHEME)) {
            throw new IllegalArgumentException("Not a file-store reference: " + reference);
        }
        Path p = baseDir.resolve(reference.substring(SCHEME.length())).normalize();
        if (!p.startsWith(baseDir)) {
            throw new IllegalArgumentException("Reference escapes storage directory: " + reference);
        }
        return p;
    }

    static String extension(String contentType) {
        if (contentType == null) {
            return "bin";
        }
        return EXTENSIONS.getOrDefault(contentType.toLowerCase(Locale.ROOT), "bin");
    }

    private static String sha256(byte[] data) {
        try {
            return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(data));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
