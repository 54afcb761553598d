package com.converge.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DeferredTest {

    @Test
    @DisplayName("pending value refuses get() but honours orElse")
    void pendingValue() {
        Deferred<Integer> value = Deferred.pending();
        assertTrue(value.isPending());
        assertThrows(IllegalStateException.class, value::get);
        assertEquals(7, value.orElse(7));
    }

    @Test
    @DisplayName("resolved values compare by content")
    void resolvedEquality() {
        assertEquals(Deferred.of(128), Deferred.of(128));
        assertNotEquals(Deferred.of(128), Deferred.pending());
        assertEquals(Deferred.pending(), Deferred.pending());
        assertEquals("x", Deferred.of("x").get());
    }

    @Test
    @DisplayName("of() rejects null")
    void rejectsNull() {
        assertThrows(NullPointerException.class, () -> Deferred.of(null));
    }
}
