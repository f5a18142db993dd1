/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.plantdx.exception.PlantDxException} - Base exception
 *       for all application-specific errors</li>
 *   <li>{@link com.phillippitts.plantdx.exception.InvalidImageException} - Input bytes are
 *       missing, oversized, or not a decodable image</li>
 *   <li>{@link com.phillippitts.plantdx.exception.ProviderCallException} - One provider call
 *       failed; carries the retryable flag and HTTP status</li>
 *   <li>{@link com.phillippitts.plantdx.exception.NoPredictionException} - A provider or the
 *       consensus engine produced no predictions</li>
 *   <li>{@link com.phillippitts.plantdx.exception.AllProvidersFailedException} - No provider
 *       produced a usable result; aggregates every provider error</li>
 *   <li>{@link com.phillippitts.plantdx.exception.DiagnosisTimeoutException} - The request
 *       deadline elapsed before all provider calls settled</li>
 * </ul>
 *
 * <p>All exceptions are unchecked and support exception chaining via {@code cause}.
 *
 * @since 1.0
 */
package com.phillippitts.plantdx.exception;
