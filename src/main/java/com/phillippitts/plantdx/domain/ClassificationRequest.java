package com.phillippitts.plantdx.domain;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Input to a single provider call: the normalized images of one request plus an optional crop hint.
 */
public record ClassificationRequest(List<NormalizedImage> images, String cropHint) {

    public ClassificationRequest {
        Objects.requireNonNull(images, "images");
        if (images.isEmpty()) {
            throw new IllegalArgumentException("images must not be empty");
        }
        images = List.copyOf(images);
        cropHint = cropHint == null || cropHint.isBlank() ? null : cropHint.trim();
    }

    public Optional<String> findCropHint() {
        return Optional.ofNullable(cropHint);
    }

    public int imageCount() {
        return images.size();
    }
}
