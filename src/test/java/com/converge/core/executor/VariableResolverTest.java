package com.converge.core.executor;

import com.converge.core.model.Deferred;
import com.converge.core.plan.Variable;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class VariableResolverTest {

    private final VariableResolver resolver = new VariableResolver();

    @Test
    @DisplayName("literals pass through untouched")
    void literals() {
        assertEquals("x", resolver.resolve("k", "x", Map.of()));
        assertEquals(42, resolver.resolve("k", 42, Map.of()));
        assertNull(resolver.resolve("k", null, Map.of()));
    }

    @Test
    @DisplayName("resolved deferred values are unwrapped")
    void resolvedDeferred() {
        assertEquals(List.of("a"), resolver.resolve("k", Deferred.of(List.of(new Variable("v"))), Map.of("v", "a")));
    }

    @Test
    @DisplayName("a pending value nested in a map is reported under its own key")
    void nestedPending() {
        UnresolvedValueException e = assertThrows(UnresolvedValueException.class,
                () -> resolver.resolveParams(Map.of("outer", Map.of("inner", Deferred.pending())), Map.of()));
        assertEquals("inner", e.getKey());
        assertNull(e.getMethodName());
    }
}
