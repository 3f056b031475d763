package com.phillippitts.voicegate.service.storage;

/**
 * Binary object store for generated audio.
 */
public interface ObjectStorage {

    /**
     * Stores bytes and returns an opaque reference.
     *
     * @throws com.phillippitts.voicegate.exception.VoiceGateException if the object cannot be stored
     */
    String put(byte[] bytes, String contentType);
}
