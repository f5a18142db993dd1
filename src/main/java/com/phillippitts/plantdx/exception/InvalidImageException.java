package com.phillippitts.plantdx.exception;

/**
 * Thrown when image bytes are missing, oversized, or cannot be decoded as an image.
 * Never retried: the same bytes will fail the same way on every provider.
 */
public class InvalidImageException extends PlantDxException {

    private final int imageSize;
    private final String reason;

    public InvalidImageException(String reason) {
        super("Invalid image: " + reason);
        this.imageSize = 0;
        this.reason = reason;
    }

    public InvalidImageException(int imageSize, String reason) {
        super("Invalid image (" + imageSize + " bytes): " + reason);
        this.imageSize = imageSize;
        this.reason = reason;
    }

    public InvalidImageException(int imageSize, String reason, Throwable cause) {
        super("Invalid image (" + imageSize + " bytes): " + reason, cause);
        this.imageSize = imageSize;
        this.reason = reason;
    }

    public int getImageSize() {
        return imageSize;
    }

    public String getReason() {
        return reason;
    }
}
