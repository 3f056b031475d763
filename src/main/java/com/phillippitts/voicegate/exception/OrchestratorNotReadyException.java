package com.phillippitts.voicegate.exception;

/**
 * Thrown when a request reaches the orchestrator before {@code init} or after {@code shutdown}.
 */
public class OrchestratorNotReadyException extends VoiceGateException {

    public OrchestratorNotReadyException(String message) {
        super(message);
    }
}
