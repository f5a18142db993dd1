package com.phillippitts.plantdx.domain;

import java.util.Arrays;
import java.util.Base64;
import java.util.Objects;

/**
 * Provider-agnostic image payload produced by the preprocessor.
 *
 * <p>Immutable: the byte array is copied on the way in and on the way out.
 *
 * @param bytes   encoded image bytes
 * @param base64  base64 form of {@code bytes}
 * @param width   pixel width
 * @param height  pixel height
 * @param format  encoded format name, e.g. {@code "jpeg"}
 * @param quality encoder quality used, between 0.0 and 1.0
 */
public record NormalizedImage(
        byte[] bytes,
        String base64,
        int width,
        int height,
        String format,
        float quality
) {
    public NormalizedImage {
        Objects.requireNonNull(bytes, "bytes");
        if (bytes.length == 0) {
            throw new IllegalArgumentException("bytes must not be empty");
        }
        bytes = bytes.clone();
        base64 = base64 == null ? Base64.getEncoder().encodeToString(bytes) : base64;
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("dimensions must be positive: " + width + "x" + height);
        }
        Objects.requireNonNull(format, "format");
    }

    @Override
    public byte[] bytes() {
        return bytes.clone();
    }

    public int sizeBytes() {
        return bytes.length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof NormalizedImage other)) {
            return false;
        }
        return width == other.width && height == other.height
                && Float.compare(quality, other.quality) == 0
                && format.equals(other.format)
                && Arrays.equals(bytes, other.bytes);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(width, height, format, quality);
        return 31 * result + Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return "NormalizedImage[" + width + "x" + height + ", format=" + format + ", size=" + bytes.length + "]";
    }
}
