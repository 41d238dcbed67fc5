package com.smoke.temporal.config;

import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class TemporalGridConfigTest {

    @Test
    void testDefaults() {
        TemporalGridConfig config = TemporalGridConfig.defaults();

        assertEquals(1920, config.getFrameWidth());
        assertEquals(1080, config.getFrameHeight());
        assertEquals(9, config.getNumRegions());
        assertEquals(64, config.getNumBins());
        assertEquals(64, config.getTemporalLength());
        assertEquals(192, config.getGridWidth());
        assertEquals(192, config.getGridHeight());
    }

    @Test
    void testGridSizeFollowsBinsAndTemporalLength() {
        TemporalGridConfig config = TemporalGridConfig.builder().numBins(32).temporalLength(16).build();

        assertEquals(96, config.getGridWidth());
        assertEquals(48, config.getGridHeight());
    }

    @Test
    void testFromProperties() {
        Properties props = new Properties();
        props.setProperty("grid.frame.width", " 640 ");
        props.setProperty("grid.frame.height", "360");
        props.setProperty("grid.num.bins", "32");

        TemporalGridConfig config = TemporalGridConfig.fromProperties(props);

        assertEquals(640, config.getFrameWidth());
        assertEquals(360, config.getFrameHeight());
        assertEquals(32, config.getNumBins());
        // 缺省项
        assertEquals(9, config.getNumRegions());
        assertEquals(64, config.getTemporalLength());
    }

    @Test
    void testFromPropertiesRejectsNonNumeric() {
        Properties props = new Properties();
        props.setProperty("grid.temporal.length", "long");
        assertThrows(NumberFormatException.class, () -> TemporalGridConfig.fromProperties(props));
    }

    @Test
    void testValueSemantics() {
        assertEquals(TemporalGridConfig.defaults(), TemporalGridConfig.builder().numBins(64).build());
        assertNotEquals(TemporalGridConfig.defaults(), TemporalGridConfig.builder().numBins(32).build());
    }
}
