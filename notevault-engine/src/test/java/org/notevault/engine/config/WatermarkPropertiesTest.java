package org.notevault.engine.config;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class WatermarkPropertiesTest {

    @Test
    void validate_withDefaultValues_noException() {
        assertDoesNotThrow(new WatermarkProperties()::validate);
    }

    @Test
    void validate_withOpaqueLabels_throwsException() {
        WatermarkProperties props = new WatermarkProperties();
        props.setOpacity(1f);
        assertThrows(IllegalArgumentException.class, props::validate);
    }

    @Test
    void validate_reportsEveryInvalidValue() {
        WatermarkProperties props = new WatermarkProperties();
        props.setFontSize(4);
        props.getColor().setRed(2f);
        props.setRows(0);

        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, props::validate);
        assertTrue(ex.getMessage().contains("font-size"));
        assertTrue(ex.getMessage().contains("color.red"));
        assertTrue(ex.getMessage().contains("rows"));
    }
}
