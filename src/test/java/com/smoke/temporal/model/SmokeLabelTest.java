package com.smoke.temporal.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SmokeLabelTest {

    @Test
    void testYoloLine() {
        assertEquals("0 0.5 0.5 1.0 1.0", SmokeLabel.SMOKE.toYoloLine());
        assertEquals("1 0.5 0.5 1.0 1.0", SmokeLabel.NO_SMOKE.toYoloLine());
    }

    @Test
    void testParse() {
        assertEquals(SmokeLabel.SMOKE, SmokeLabel.parse("smoke"));
        assertEquals(SmokeLabel.SMOKE, SmokeLabel.parse(" SMOKE "));
        assertEquals(SmokeLabel.NO_SMOKE, SmokeLabel.parse("no_smoke"));
        assertEquals(SmokeLabel.NO_SMOKE, SmokeLabel.parse("No-Smoke"));
        assertEquals(SmokeLabel.NO_SMOKE, SmokeLabel.parse("1"));
        assertThrows(IllegalArgumentException.class, () -> SmokeLabel.parse("fire"));
    }

    @Test
    void testOf() {
        assertEquals(SmokeLabel.SMOKE, SmokeLabel.of(true));
        assertEquals(SmokeLabel.NO_SMOKE, SmokeLabel.of(false));
    }
}
