package com.subtrack.backend.exceptions;

import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.authentication.BadCredentialsException;

import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @Test
    void notFoundMapsTo404() {
        ResponseEntity<Map<String, Object>> response =
                handler.handleNotFound(new ResourceNotFoundException("Subscription not found"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(response.getBody())
                .containsEntry("success", false)
                .containsEntry("error", "NOT_FOUND")
                .containsEntry("message", "Subscription not found")
                .containsKey("timestamp");
    }

    @Test
    void badCredentialsMapTo401() {
        assertThat(handler.handleUnauthorized(new BadCredentialsException("Bad credentials")).getStatusCode())
                .isEqualTo(HttpStatus.UNAUTHORIZED);
    }

    @Test
    void foreignResourceMapsTo403() {
        assertThat(handler.handleAccessDenied(new AccessDeniedException("not yours")).getStatusCode())
                .isEqualTo(HttpStatus.FORBIDDEN);
    }

    @Test
    void duplicateMapsTo409() {
        assertThat(handler.handleDuplicate(new DuplicateResourceException("User already exists")).getStatusCode())
                .isEqualTo(HttpStatus.CONFLICT);
    }

    @Test
    void unexpectedErrorsHideDetails() {
        ResponseEntity<Map<String, Object>> response = handler.handleGenericException(new IllegalStateException("db password=..."));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody()).containsEntry("message", "An unexpected error occurred");
    }
}
