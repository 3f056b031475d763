package com.phillippitts.voicegate.service.cache;

import com.phillippitts.voicegate.domain.SpeechRequest;
import com.phillippitts.voicegate.domain.TtsRequest;
import com.phillippitts.voicegate.domain.SttRequest;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Derives cache keys of the form {@code prefix:kind:sha256(content):sha256(normalized settings)}.
 *
 * <p>Normalized settings: language lower-cased ({@code auto} when absent), format and voice lower-cased,
 * options sorted by key, then the caller fingerprint. The provider is not part of the key.
 */
public class CacheKeyFactory {

    private final String prefix;

    public CacheKeyFactory(String prefix) {
        this.prefix = prefix;
    }

    public String keyFor(SpeechRequest request) {
        return prefix + ':' + request.category().label() + ':' + sha256(request.contentBytes()) + ':'
                + sha256(normalizedSettings(request).getBytes(StandardCharsets.UTF_8));
    }

    static String normalizedSettings(SpeechRequest request) {
        StringBuilder sb = new StringBuilder();
        sb.append("lang=").append(lower(request.language(), "auto"));
        if (request instanceof SttRequest stt) {
            sb.append(";format=").append(lower(stt.audioFormat(), ""));
        } else if (request instanceof TtsRequest tts) {
            sb.append(";voice=").append(lower(tts.voice(), ""));
            sb.append(";format=").append(lower(tts.outputFormat(), ""));
        }
        Map<String, String> sorted = new TreeMap<>(request.options());
        sorted.forEach((k, v) -> sb.append(';').append(k).append('=').append(v));
        sb.append(";fp=").append(request.cacheSettingsFingerprint() == null ? "" : request.cacheSettingsFingerprint());
        return sb.toString();
    }

    private static String lower(String value, String fallback) {
        return (value == null || value.isBlank()) ? fallback : value.trim().toLowerCase(Locale.ROOT);
    }

    static String sha256(byte[] data) {
        try {
            return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(data));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
