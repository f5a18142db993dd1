/**
 * Locally hosted PlantVillage classifier run through ONNX Runtime.
 *
 * <p>The model file is produced elsewhere and configured with
 * {@code diagnosis.providers.local_model.options.model-path}. {@link
 * com.phillippitts.plantdx.service.provider.local.ImageClassifierModel} isolates the runtime so
 * tests can substitute a fixed-output model.
 */
package com.phillippitts.plantdx.service.provider.local;
