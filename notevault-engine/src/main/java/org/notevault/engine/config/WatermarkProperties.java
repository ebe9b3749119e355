package org.notevault.engine.config;

import jakarta.annotation.PostConstruct;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * Appearance of the visible watermark.
 * Maps to notevault.watermark.* properties in application.yml
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "notevault.watermark")
public class WatermarkProperties {

    private float opacity = 0.3f;

    private float footerOpacity = 0.6f;

    private int fontSize = 24;

    private int smallFontSize = 12;

    private Color color = new Color();

    /**
     * Diagonal labels are repeated on a grid of columns x rows per page.
     */
    private int columns = 4;

    private int rows = 5;

    @Data
    public static class Color {
        private float red = 0.7f;
        private float green = 0.7f;
        private float blue = 0.7f;
    }

    @PostConstruct
    public void validate() {
        List<String> errors = new ArrayList<>();
        if (!(opacity > 0 && opacity < 1)) {
            errors.add("notevault.watermark.opacity must be between 0 and 1");
        }
        if (!(footerOpacity > 0 && footerOpacity <= 1)) {
            errors.add("notevault.watermark.footer-opacity must be in (0, 1]");
        }
        if (fontSize < 8 || fontSize > 72) {
            errors.add("notevault.watermark.font-size must be between 8 and 72");
        }
        if (smallFontSize < 6 || smallFontSize > 24) {
            errors.add("notevault.watermark.small-font-size must be between 6 and 24");
        }
        checkChannel("red", color.getRed(), errors);
        checkChannel("green", color.getGreen(), errors);
        checkChannel("blue", color.getBlue(), errors);
        if (columns < 1 || rows < 1) {
            errors.add("notevault.watermark.columns and rows must be >= 1");
        }
        if (!errors.isEmpty()) {
            throw new IllegalArgumentException("Invalid watermark configuration: " + String.join("; ", errors));
        }
    }

    private static void checkChannel(String name, float value, List<String> errors) {
        if (value < 0 || value > 1) {
            errors.add("notevault.watermark.color." + name + " must be between 0 and 1");
        }
    }
}
