package com.phillippitts.voicegate.domain;

/**
 * Raw synthesis returned by a TTS adapter. Adapters that upload audio themselves return
 * {@code audioRef}; adapters that return bytes leave it null and the orchestrator stores the bytes.
 *
 * @param audioRef    opaque reference, or null
 * @param audio       raw audio bytes, or null when {@code audioRef} is set
 * @param contentType MIME type of the audio
 */
public record Synthesis(String audioRef, byte[] audio, String contentType) {

    public Synthesis {
        boolean hasRef = audioRef != null && !audioRef.isBlank();
        boolean hasBytes = audio != null && audio.length > 0;
        if (!hasRef && !hasBytes) {
            throw new IllegalArgumentException("Synthesis requires an audio reference or audio bytes");
        }
        audio = audio == null ? null : audio.clone();
        contentType = contentType == null ? "application/octet-stream" : contentType;
    }

    @Override
    public byte[] audio() {
        return audio == null ? null : audio.clone();
    }

    public static Synthesis ofReference(String audioRef, String contentType) {
        return new Synthesis(audioRef, null, contentType);
    }

    public static Synthesis ofBytes(byte[] audio, String contentType) {
        return new Synthesis(null, audio, contentType);
    }

    public boolean hasReference() {
        return audioRef != null && !audioRef.isBlank();
    }
}
