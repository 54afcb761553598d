package com.converge.core.plan;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PlanTest {

    @Test
    @DisplayName("equal instructions at different positions keep their own messages")
    void messagesKeyedByIdentity() {
        ApiCall first = new ApiCall("delete_rule", Map.of("rule_name", "nightly"));
        ApiCall second = new ApiCall("delete_rule", Map.of("rule_name", "nightly"));

        Plan plan = Plan.builder().add(first, "first").add(second).build();

        assertEquals(first, second);
        assertEquals("first", plan.messageFor(first).orElseThrow());
        assertTrue(plan.messageFor(second).isEmpty());
    }

    @Test
    @DisplayName("plans compare equal when messages sit at the same positions")
    void equalityByPosition() {
        Plan a = Plan.builder()
                .add(new StoreValue("x", 1), "storing")
                .add(new StoreValue("y", 2))
                .build();
        Plan b = Plan.builder()
                .add(new StoreValue("x", 1), "storing")
                .add(new StoreValue("y", 2))
                .build();
        Plan moved = Plan.builder()
                .add(new StoreValue("x", 1))
                .add(new StoreValue("y", 2), "storing")
                .build();

        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertNotEquals(a, moved);
    }

    @Test
    @DisplayName("toBuilder copies messages and leaves the source plan unchanged")
    void toBuilder() {
        StoreValue store = new StoreValue("x", 1);
        Plan plan = Plan.builder().add(store, "storing").build();

        ApiCall extra = new ApiCall("delete_role", Map.of("name", "myapp-dev"));
        Plan extended = plan.toBuilder().add(extra, "Deleting IAM role: myapp-dev").build();

        assertEquals(1, plan.size());
        assertEquals(2, extended.size());
        assertEquals("storing", extended.messageFor(store).orElseThrow());
        assertEquals(List.of(extra), extended.instructionsOf(ApiCall.class));
    }

    @Test
    void emptyPlan() {
        assertTrue(Plan.empty().isEmpty());
        assertEquals(Plan.empty(), Plan.builder().build());
        assertThrows(NullPointerException.class, () -> Plan.builder().add(null));
    }
}
