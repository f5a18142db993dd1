package com.phillippitts.plantdx.service.provider.local;

import ai.onnxruntime.OnnxTensor;
import ai.onnxruntime.OnnxValue;
import ai.onnxruntime.OrtEnvironment;
import ai.onnxruntime.OrtException;
import ai.onnxruntime.OrtSession;
import com.phillippitts.plantdx.exception.ProviderCallException;
import com.phillippitts.plantdx.service.provider.ProviderNames;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.FloatBuffer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

/**
 * ONNX Runtime backed PlantVillage classifier.
 *
 * <p>Expects a model with a single float input of shape {@code [1, size, size, 3]} and a
 * single output of shape {@code [1, classes]}.
 */
public class OnnxImageClassifierModel implements ImageClassifierModel {

    private static final Logger LOG = LogManager.getLogger(OnnxImageClassifierModel.class);

    private final Path modelPath;
    private final int inputSize;
    private final Object lock = new Object();

    private OrtEnvironment env;
    private OrtSession session;
    private String inputName;

    public OnnxImageClassifierModel(Path modelPath, int inputSize) {
        this.modelPath = Objects.requireNonNull(modelPath, "modelPath");
        if (inputSize <= 0) {
            throw new IllegalArgumentException("inputSize must be positive");
        }
        this.inputSize = inputSize;
    }

    @Override
    public int inputSize() {
        return inputSize;
    }

    @Override
    public void load() {
        synchronized (lock) {
            if (session != null) {
                return;
            }
            if (!Files.isRegularFile(modelPath)) {
                throw new ProviderCallException("Model file not found: " + modelPath,
                        ProviderNames.LOCAL_MODEL, false);
            }
            try {
                env = OrtEnvironment.getEnvironment();
                session = env.createSession(modelPath.toString(), new OrtSession.SessionOptions());
                inputName = session.getInputNames().iterator().next();
                LOG.info("Loaded ONNX model {} (input={}, outputs={})", modelPath, inputName,
                        session.getOutputNames());
            } catch (OrtException e) {
                throw new ProviderCallException("Failed to load model " + modelPath,
                        ProviderNames.LOCAL_MODEL, false, e);
            }
        }
    }

    @Override
    public boolean isLoaded() {
        synchronized (lock) {
            return session != null;
        }
    }

    @Override
    public float[] predict(float[] pixels) {
        OrtSession s;
        synchronized (lock) {
            s = session;
        }
        if (s == null) {
            throw new ProviderCallException("Model not loaded", ProviderNames.LOCAL_MODEL, false);
        }
        long[] shape = {1, inputSize, inputSize, 3};
        try (OnnxTensor input = OnnxTensor.createTensor(env, FloatBuffer.wrap(pixels), shape);
             OrtSession.Result result = s.run(Map.of(inputName, input))) {
            OnnxValue output = result.get(0);
            Object value = output.getValue();
            if (value instanceof float[][] batch && batch.length > 0) {
                return batch[0];
            }
            if (value instanceof float[] flat) {
                return flat;
            }
            throw new ProviderCallException("Unexpected model output type " + value.getClass().getSimpleName(),
                    ProviderNames.LOCAL_MODEL, false);
        } catch (OrtException e) {
            throw new ProviderCallException("Inference failed", ProviderNames.LOCAL_MODEL, false, e);
        }
    }

    @Override
    public String version() {
        return "PlantVillage-onnx";
    }

    @Override
    public void close() {
        synchronized (lock) {
            if (session == null) {
                return;
            }
            try {
                session.close();
            } catch (OrtException e) {
                LOG.warn("Error closing ONNX session: {}", e.getMessage());
            } finally {
                session = null;
            }
        }
    }
}
