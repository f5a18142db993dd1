/**
 * Immutable domain records shared across the diagnosis pipeline.
 *
 * <p>{@link com.phillippitts.plantdx.domain.Prediction} is the canonical per-candidate shape every
 * provider adapter produces; {@link com.phillippitts.plantdx.domain.DiagnosisResult} is the only
 * type exposed to the rest of the platform.
 */
package com.phillippitts.plantdx.domain;
