package com.splayrope;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ResultTest {

    @Test
    void testOk() {
        Result<String> result = Result.ok("value");
        assertFalse(result.isError());
        assertEquals("value", result.getValue());
        assertNull(result.getError());
        assertEquals("value", result.orElseThrow());
    }

    @Test
    void testErr() {
        RopeRangeException error = new RopeRangeException("Rank 3 out of range [0, 3)");
        Result<String> result = Result.err(error);
        assertTrue(result.isError());
        assertNull(result.getValue());
        assertSame(error, result.getError());
        assertSame(error, assertThrows(RopeRangeException.class, result::orElseThrow));
    }

    @Test
    void testExceptionHierarchy() {
        RopeResourceException error = new RopeResourceException("full", 10, new OutOfMemoryError());
        assertTrue(error instanceof RopeException);
        assertTrue(error instanceof RuntimeException);
        assertInstanceOf(OutOfMemoryError.class, error.getCause());
        assertEquals(10, error.getCapacity());
    }
}
