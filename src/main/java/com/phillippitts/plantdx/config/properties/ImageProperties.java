package com.phillippitts.plantdx.config.properties;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Limits and encoding settings for image normalization.
 */
@ConfigurationProperties(prefix = "diagnosis.image")
@Validated
public class ImageProperties {

    /** Largest raw upload accepted, in bytes (default 10 MB). */
    @Positive
    private int maxInputBytes = 10 * 1024 * 1024;

    /** Longest edge after resizing, in pixels. */
    @Positive
    private int maxDimension = 512;

    @DecimalMin("0.1")
    @DecimalMax("1.0")
    private float jpegQuality = 0.85f;

    public int getMaxInputBytes() {
        return maxInputBytes;
    }

    public void setMaxInputBytes(int maxInputBytes) {
        this.maxInputBytes = maxInputBytes;
    }

    public int getMaxDimension() {
        return maxDimension;
    }

    public void setMaxDimension(int maxDimension) {
        this.maxDimension = maxDimension;
    }

    public float getJpegQuality() {
        return jpegQuality;
    }

    public void setJpegQuality(float jpegQuality) {
        this.jpegQuality = jpegQuality;
    }
}
