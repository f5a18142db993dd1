package com.phillippitts.plantdx.service.provider.local;

/**
 * A loaded image classifier taking one RGB image as an NHWC float tensor.
 */
public interface ImageClassifierModel extends AutoCloseable {

    /** Input edge length in pixels; images are resized to a square of this size. */
    int inputSize();

    /**
     * Loads the model.
     *
     * @throws com.phillippitts.plantdx.exception.ProviderCallException if loading fails
     */
    void load();

    boolean isLoaded();

    /**
     * Runs the model on one image.
     *
     * @param pixels RGB values in [0, 1], laid out height-major then width then channel
     * @return raw output scores, one per class
     */
    float[] predict(float[] pixels);

    String version();

    @Override
    void close();
}
