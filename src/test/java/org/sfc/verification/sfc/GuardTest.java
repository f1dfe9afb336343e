package org.sfc.verification.sfc;

import org.junit.jupiter.api.Test;
import org.sfc.verification.sfc.models.Guard;

import static org.junit.jupiter.api.Assertions.*;

class GuardTest {

    @Test
    void shouldTreatMissingTrueAndInitGuardsAsUnconditional() {
        assertInstanceOf(Guard.Always.class, Guard.of(null));
        assertInstanceOf(Guard.Always.class, Guard.of("   "));
        assertInstanceOf(Guard.Always.class, Guard.of("True"));
        assertInstanceOf(Guard.Always.class, Guard.of("TRUE"));
        assertInstanceOf(Guard.Always.class, Guard.of(" init "));
    }

    @Test
    void shouldKeepExpressionText() {
        Guard guard = Guard.of("  i <= n ");

        assertInstanceOf(Guard.Expression.class, guard);
        assertEquals("i <= n", guard.text());
    }

    @Test
    void shouldNotConfuseIdentifiersContainingInit() {
        assertInstanceOf(Guard.Expression.class, Guard.of("initialized"));
        assertInstanceOf(Guard.Expression.class, Guard.of("init and x > 0"));
    }
}
