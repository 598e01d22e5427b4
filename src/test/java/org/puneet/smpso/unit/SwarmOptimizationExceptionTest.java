package org.puneet.smpso.unit;

import java.io.IOException;

import org.junit.jupiter.api.Test;
import org.puneet.smpso.exceptions.SwarmOptimizationException;
import org.puneet.smpso.exceptions.SwarmOptimizationException.ErrorCode;

import static org.junit.jupiter.api.Assertions.*;

class SwarmOptimizationExceptionTest {

    @Test
    void testMessageFormat() {
        SwarmOptimizationException e = new SwarmOptimizationException(
            ErrorCode.CONFIGURATION_NOT_FOUND, "missing file", "Resource: smpso.properties");

        assertEquals(ErrorCode.CONFIGURATION_NOT_FOUND, e.getErrorCode());
        assertEquals("Resource: smpso.properties", e.getContext());
        assertNotNull(e.getTimestamp());
        assertTrue(e.getMessage().startsWith("[SM002] "));
        assertTrue(e.getMessage().contains("missing file"));
        assertTrue(e.getMessage().endsWith(" | Context: Resource: smpso.properties"));
    }

    @Test
    void testMessageWithoutContext() {
        SwarmOptimizationException e = new SwarmOptimizationException(ErrorCode.UNKNOWN, "oops");
        assertEquals("[SM999] Unknown error: oops", e.getMessage());
        assertNull(e.getContext());
        assertNull(e.getCause());
    }

    @Test
    void testCauseIsKept() {
        IOException cause = new IOException("disk full");
        SwarmOptimizationException e = new SwarmOptimizationException(ErrorCode.OUTPUT_FAILURE, "write", cause);
        assertSame(cause, e.getCause());
        assertTrue(e.isRecoverable());
    }

    @Test
    void testInvalidParameterFactory() {
        NumberFormatException cause = new NumberFormatException("For input string: \"abc\"");
        SwarmOptimizationException e = SwarmOptimizationException.invalidParameter("smpso.swarm.size", "abc", cause);

        assertEquals(ErrorCode.INVALID_PARAMETER, e.getErrorCode());
        assertEquals("Parameter: smpso.swarm.size", e.getContext());
        assertTrue(e.getMessage().contains("'abc'"));
        assertSame(cause, e.getCause());
        assertFalse(e.isRecoverable());
    }

    @Test
    void testUnknownProblemFactory() {
        SwarmOptimizationException e = SwarmOptimizationException.unknownProblem("DTLZ9");
        assertEquals(ErrorCode.UNKNOWN_PROBLEM, e.getErrorCode());
        assertTrue(e.getMessage().contains("DTLZ9"));
    }

    @Test
    void testNullErrorCodeThrows() {
        assertThrows(NullPointerException.class, () -> new SwarmOptimizationException(null, "message"));
    }

    @Test
    void testErrorCodesAreUnique() {
        long distinct = java.util.Arrays.stream(ErrorCode.values()).map(ErrorCode::getCode).distinct().count();
        assertEquals(ErrorCode.values().length, distinct);
    }
}
