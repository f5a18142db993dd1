package com.phillippitts.plantdx.service.provider.local;

import com.phillippitts.plantdx.domain.ClassificationRequest;
import com.phillippitts.plantdx.domain.NormalizedImage;
import com.phillippitts.plantdx.domain.Prediction;
import com.phillippitts.plantdx.domain.ProviderResult;
import com.phillippitts.plantdx.domain.ProviderResultMetadata;
import com.phillippitts.plantdx.domain.Severity;
import com.phillippitts.plantdx.exception.ProviderCallException;
import com.phillippitts.plantdx.service.provider.AbstractDiagnosisProvider;
import com.phillippitts.plantdx.service.registry.ProviderConfig;
import com.phillippitts.plantdx.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.imageio.ImageIO;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.stream.IntStream;

/**
 * Locally hosted PlantVillage classifier. No network access.
 *
 * <p>Each image is resized to the model input size and scaled to [0, 1]. Class probabilities
 * are averaged across the request's images and the top five classes become predictions. A
 * crop hint matching a PlantVillage crop restricts the candidates to that crop's classes.
 */
public class LocalModelProvider extends AbstractDiagnosisProvider {

    private static final Logger LOG = LogManager.getLogger(LocalModelProvider.class);

    static final int MAX_PREDICTIONS = 5;

    private final ImageClassifierModel model;

    public LocalModelProvider(ProviderConfig config, ImageClassifierModel model) {
        super(config);
        this.model = Objects.requireNonNull(model, "model");
    }

    @Override
    protected void doInitialize() {
        model.load();
        LOG.info("Local model ready: {}", model.version());
    }

    @Override
    protected void doClose() {
        model.close();
    }

    /**
     * Loads the model if a previous attempt failed, then checks it is available.
     */
    @Override
    public void probe() {
        initialize();
        if (!model.isLoaded()) {
            throw new ProviderCallException("Model not loaded", getProviderName(), false);
        }
    }

    public boolean isModelLoaded() {
        return model.isLoaded();
    }

    @Override
    public ProviderResult classify(ClassificationRequest request) {
        ensureInitialized();
        long t0 = System.nanoTime();
        int classes = PlantVillageLabels.LABELS.size();
        double[] sum = new double[classes];
        for (NormalizedImage image : request.images()) {
            float[] probabilities = toProbabilities(model.predict(toTensor(image)));
            if (probabilities.length != classes) {
                throw new ProviderCallException("Model returned " + probabilities.length
                        + " scores, expected " + classes, getProviderName(), false);
            }
            for (int i = 0; i < classes; i++) {
                sum[i] += probabilities[i];
            }
        }
        int n = request.imageCount();
        double[] mean = new double[classes];
        for (int i = 0; i < classes; i++) {
            mean[i] = sum[i] / n;
        }

        List<Integer> candidates = request.findCropHint()
                .map(PlantVillageLabels::indicesForCrop)
                .filter(list -> !list.isEmpty())
                .orElseGet(() -> IntStream.range(0, classes).boxed().toList());

        List<Integer> top = new ArrayList<>(candidates);
        top.sort(Comparator.comparingDouble((Integer i) -> mean[i]).reversed());
        List<Prediction> predictions = new ArrayList<>();
        for (int i : top.subList(0, Math.min(MAX_PREDICTIONS, top.size()))) {
            String label = PlantVillageLabels.LABELS.get(i);
            double confidence = Math.max(0.0, Math.min(1.0, mean[i]));
            predictions.add(Prediction.builder(PlantVillageLabels.diseaseId(label),
                            PlantVillageLabels.displayName(label), confidence)
                    .severity(Severity.fromConfidence(confidence))
                    .description(PlantVillageLabels.crop(label) + ": " + PlantVillageLabels.disease(label))
                    .build());
        }
        boolean healthy = PlantVillageLabels.isHealthy(PlantVillageLabels.LABELS.get(top.get(0)));
        return ProviderResult.of(getProviderName(), predictions, healthy,
                new ProviderResultMetadata(TimeUtils.elapsedMillis(t0), n, model.version(), null));
    }

    /**
     * Decodes the image and lays it out as NHWC floats in [0, 1] at the model input size.
     */
    float[] toTensor(NormalizedImage image) {
        BufferedImage decoded;
        try {
            decoded = ImageIO.read(new ByteArrayInputStream(image.bytes()));
        } catch (IOException e) {
            throw new ProviderCallException("Cannot decode image", getProviderName(), false, e);
        }
        if (decoded == null) {
            throw new ProviderCallException("Cannot decode image", getProviderName(), false);
        }
        int size = model.inputSize();
        BufferedImage resized = new BufferedImage(size, size, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = resized.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_NEAREST_NEIGHBOR);
            g.drawImage(decoded, 0, 0, size, size, null);
        } finally {
            g.dispose();
        }
        float[] pixels = new float[size * size * 3];
        int k = 0;
        for (int y = 0; y < size; y++) {
            for (int x = 0; x < size; x++) {
                int rgb = resized.getRGB(x, y);
                pixels[k++] = ((rgb >> 16) & 0xFF) / 255f;
                pixels[k++] = ((rgb >> 8) & 0xFF) / 255f;
                pixels[k++] = (rgb & 0xFF) / 255f;
            }
        }
        return pixels;
    }

    /**
     * Returns the scores unchanged when they already form a distribution, otherwise applies softmax.
     */
    static float[] toProbabilities(float[] scores) {
        double total = 0;
        boolean inRange = true;
        for (float s : scores) {
            if (s < 0f || s > 1f) {
                inRange = false;
            }
            total += s;
        }
        if (inRange && Math.abs(total - 1.0) < 1e-3) {
            return scores;
        }
        float max = Float.NEGATIVE_INFINITY;
        for (float s : scores) {
            max = Math.max(max, s);
        }
        double expSum = 0;
        double[] exp = new double[scores.length];
        for (int i = 0; i < scores.length; i++) {
            exp[i] = Math.exp(scores[i] - max);
            expSum += exp[i];
        }
        float[] out = new float[scores.length];
        for (int i = 0; i < scores.length; i++) {
            out[i] = (float) (exp[i] / expSum);
        }
        return out;
    }
}
