package com.phillippitts.voicegate.presentation.exception;

import com.phillippitts.voicegate.exception.InvalidRequestException;
import com.phillippitts.voicegate.exception.OrchestratorNotReadyException;
import com.phillippitts.voicegate.exception.ProviderNotFoundException;
import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import static org.assertj.core.api.Assertions.assertThat;

class GlobalExceptionHandlerTest {

    private GlobalExceptionHandler handler;

    @BeforeEach
    void setUp() {
        handler = new GlobalExceptionHandler();
    }

    @Test
    void unknownProviderReturns404WithName() {
        ResponseEntity<?> response = handler.handleProviderNotFound(new ProviderNotFoundException("ghost"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(response.getBody()).isNotNull();
        assertThat(response.getBody().toString())
                .contains("ProviderNotFoundException")
                .contains("ghost");
    }

    @Test
    void invalidRequestReturns400() {
        ResponseEntity<?> response = handler.handleInvalidRequest(
                new InvalidRequestException("Malformed language code", "xx!"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody().toString()).contains("Invalid request").contains("xx!");
    }

    @Test
    void notReadyReturns503WithRetryHint() {
        ResponseEntity<?> response = handler.handleNotReady(new OrchestratorNotReadyException("stopped"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(response.getBody().toString()).contains("retry");
    }

    @Test
    void unexpectedReturns500WithoutInternalDetails() {
        ResponseEntity<?> response = handler.handleUnexpected(new IllegalStateException("db password: secret123"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody().toString())
                .contains("InternalServerError")
                .doesNotContain("secret123")
                .doesNotContain("IllegalStateException");
    }

    @Test
    void errorBodyCarriesRequestIdFromLoggingContext() {
        ThreadContext.put("requestId", "req-42");
        try {
            ResponseEntity<?> response = handler.handleUnexpected(new RuntimeException("boom"));

            assertThat(response.getBody().toString()).contains("requestId=req-42").contains("timestamp=");
        } finally {
            ThreadContext.remove("requestId");
        }
    }

    @Test
    void requestIdIsNullOutsideARequest() {
        ResponseEntity<?> response = handler.handleInvalidRequest(new InvalidRequestException("Text payload is empty"));

        assertThat(response.getBody().toString())
                .contains("errorCode=", "message=", "details=")
                .contains("requestId=null");
    }
}
