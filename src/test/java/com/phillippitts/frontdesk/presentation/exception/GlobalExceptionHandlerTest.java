package com.phillippitts.frontdesk.presentation.exception;

import com.phillippitts.frontdesk.exception.InvalidAudioException;
import com.phillippitts.frontdesk.exception.KnowledgeBaseUnavailableException;
import com.phillippitts.frontdesk.exception.ProviderException;
import com.phillippitts.frontdesk.exception.ProviderTimeoutException;
import com.phillippitts.frontdesk.exception.UnknownSessionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class GlobalExceptionHandlerTest {

    private GlobalExceptionHandler handler;

    @BeforeEach
    void setUp() {
        handler = new GlobalExceptionHandler();
    }

    @Test
    void unknownSessionReturns404() {
        ResponseEntity<GlobalExceptionHandler.ApiError> response =
                handler.handleUnknownSession(new UnknownSessionException("abc-123"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(response.getBody()).isNotNull();
        assertThat(response.getBody().errorCode()).isEqualTo("UnknownSessionException");
        assertThat(response.getBody().details()).contains("abc-123");
    }

    @Test
    void invalidAudioReturns400() {
        ResponseEntity<GlobalExceptionHandler.ApiError> response =
                handler.handleInvalidAudio(new InvalidAudioException(3, "odd byte count"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody().message()).isEqualTo("Invalid audio format");
    }

    @Test
    void illegalArgumentReturns400() {
        ResponseEntity<GlobalExceptionHandler.ApiError> response =
                handler.handleIllegalArgument(new IllegalArgumentException("bad id"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody().errorCode()).isEqualTo("BadRequest");
    }

    @Test
    void providerFailureReturns503WithoutInternals() {
        ResponseEntity<GlobalExceptionHandler.ApiError> response =
                handler.handleProviderFailure(new ProviderTimeoutException("elevenlabs", Duration.ofSeconds(30)));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(response.getBody().errorCode()).isEqualTo("ProviderTimeoutException");
        assertThat(response.getBody().details()).doesNotContain("elevenlabs");
    }

    @Test
    void providerFailureKeepsProviderOutOfBody() {
        ResponseEntity<GlobalExceptionHandler.ApiError> response =
                handler.handleProviderFailure(new ProviderException("401 from upstream", "deepgram"));

        assertThat(response.getBody().toString()).doesNotContain("401").doesNotContain("deepgram");
    }

    @Test
    void knowledgeBaseUnavailableReturns503() {
        ResponseEntity<GlobalExceptionHandler.ApiError> response =
                handler.handleKnowledgeBase(new KnowledgeBaseUnavailableException("Index empty"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(response.getBody().message()).isEqualTo("Knowledge base unavailable");
    }

    @Test
    void unexpectedErrorReturns500AndHidesMessage() {
        ResponseEntity<GlobalExceptionHandler.ApiError> response =
                handler.handleUnexpected(new IllegalStateException("secret internal detail"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody().toString()).doesNotContain("secret internal detail");
        assertThat(response.getBody().timestamp()).isNotNull();
    }
}
