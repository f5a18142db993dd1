package com.phillippitts.plantdx.service.image;

import com.phillippitts.plantdx.config.properties.ImageProperties;
import com.phillippitts.plantdx.domain.NormalizedImage;
import com.phillippitts.plantdx.exception.InvalidImageException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageOutputStream;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * Normalizes uploaded images into the provider-agnostic {@link NormalizedImage} form.
 *
 * <p>Validation rules:
 * <ul>
 *   <li>Input must be non-null, non-empty and at most {@code diagnosis.image.max-input-bytes}</li>
 *   <li>Input must be decodable by {@link ImageIO} (JPEG, PNG, BMP, GIF out of the box)</li>
 * </ul>
 *
 * <p>The decoded image is scaled to fit inside {@code max-dimension} pixels keeping its aspect
 * ratio (never enlarged), flattened onto white and encoded as JPEG at {@code jpeg-quality}.
 * Feeding the output back in keeps its dimensions and format.
 */
@Component
public class ImagePreprocessor {

    private static final Logger LOG = LogManager.getLogger(ImagePreprocessor.class);

    static final String FORMAT = "jpeg";

    private final ImageProperties props;

    public ImagePreprocessor(ImageProperties props) {
        this.props = Objects.requireNonNull(props, "props");
    }

    /**
     * Normalizes one image.
     *
     * @param raw encoded image bytes as uploaded
     * @return normalized JPEG image
     * @throws InvalidImageException if the input is empty, too large or undecodable
     */
    public NormalizedImage preprocess(byte[] raw) {
        validate(raw);
        BufferedImage decoded = decode(raw);

        int[] target = fitInside(decoded.getWidth(), decoded.getHeight(), props.getMaxDimension());
        BufferedImage rgb = new BufferedImage(target[0], target[1], BufferedImage.TYPE_INT_RGB);
        Graphics2D g = rgb.createGraphics();
        try {
            g.setColor(Color.WHITE);
            g.fillRect(0, 0, target[0], target[1]);
            g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
            g.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
            g.drawImage(decoded, 0, 0, target[0], target[1], null);
        } finally {
            g.dispose();
        }

        byte[] jpeg = encodeJpeg(rgb, props.getJpegQuality(), raw.length);
        LOG.debug("Normalized image {}x{} ({} bytes) -> {}x{} ({} bytes)",
                decoded.getWidth(), decoded.getHeight(), raw.length, target[0], target[1], jpeg.length);
        return new NormalizedImage(jpeg, null, target[0], target[1], FORMAT, props.getJpegQuality());
    }

    /**
     * Normalizes every image of a request, failing on the first invalid one.
     *
     * @throws InvalidImageException if the list is empty or any image is invalid
     */
    public List<NormalizedImage> preprocessAll(List<byte[]> images) {
        if (images == null || images.isEmpty()) {
            throw new InvalidImageException("At least one image is required");
        }
        List<NormalizedImage> out = new ArrayList<>(images.size());
        for (byte[] raw : images) {
            out.add(preprocess(raw));
        }
        return out;
    }

    /**
     * Computes dimensions that fit inside {@code max} x {@code max} preserving aspect ratio.
     * Images already inside the box keep their size.
     */
    static int[] fitInside(int width, int height, int max) {
        if (width <= max && height <= max) {
            return new int[] {width, height};
        }
        double scale = (double) max / Math.max(width, height);
        int w = Math.max(1, (int) Math.round(width * scale));
        int h = Math.max(1, (int) Math.round(height * scale));
        return new int[] {Math.min(w, max), Math.min(h, max)};
    }

    private void validate(byte[] raw) {
        if (raw == null || raw.length == 0) {
            throw new InvalidImageException(0, "Image data is empty");
        }
        if (raw.length > props.getMaxInputBytes()) {
            throw new InvalidImageException(raw.length,
                    "Image exceeds maximum size of " + props.getMaxInputBytes() + " bytes");
        }
    }

    private static BufferedImage decode(byte[] raw) {
        try {
            BufferedImage image = ImageIO.read(new ByteArrayInputStream(raw));
            if (image == null) {
                throw new InvalidImageException(raw.length, "Unsupported or corrupt image format");
            }
            return image;
        } catch (IOException e) {
            throw new InvalidImageException(raw.length, "Unable to decode image", e);
        }
    }

    private static byte[] encodeJpeg(BufferedImage image, float quality, int inputSize) {
        Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName(FORMAT);
        if (!writers.hasNext()) {
            throw new IllegalStateException("No JPEG encoder available");
        }
        ImageWriter writer = writers.next();
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (ImageOutputStream ios = ImageIO.createImageOutputStream(out)) {
            writer.setOutput(ios);
            ImageWriteParam param = writer.getDefaultWriteParam();
            param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
            param.setCompressionQuality(quality);
            writer.write(null, new IIOImage(image, null, null), param);
        } catch (IOException e) {
            throw new InvalidImageException(inputSize, "Unable to encode image", e);
        } finally {
            writer.dispose();
        }
        return out.toByteArray();
    }
}
