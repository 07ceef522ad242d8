package com.ivamare.eventsourcing.pipeline;

import com.ivamare.eventsourcing.exception.ValidationException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ResultTest {

    @Test
    void shouldCreateSuccess() {
        Result<String> result = Result.success("ok", "c-1", 5);

        assertTrue(result.success());
        assertFalse(result.isFailure());
        assertFalse(result.fromCache());
        assertEquals("ok", result.data());
        assertEquals("c-1", result.correlationId());
        assertNotNull(result.timestamp());
    }

    @Test
    void shouldMarkCachedResult() {
        assertTrue(Result.cached("ok", "c-1", 0).fromCache());
    }

    @Test
    void shouldCaptureFailureMessageAndType() {
        Result<Object> result = Result.failure(new ValidationException("bad input"), "c-1", 3);

        assertTrue(result.isFailure());
        assertEquals("bad input", result.error());
        assertEquals("ValidationException", result.errorType());
        assertNull(result.data());
    }

    @Test
    void shouldFallBackToTypeNameWithoutMessage() {
        Result<Object> result = Result.failure(new IllegalStateException(), "c-1", 3);

        assertEquals("IllegalStateException", result.error());
    }
}
