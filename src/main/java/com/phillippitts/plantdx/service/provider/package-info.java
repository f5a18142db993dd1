/**
 * Provider adapters behind the {@link com.phillippitts.plantdx.service.provider.DiagnosisProvider}
 * contract.
 *
 * <p>The set is closed: {@code plant_id}, {@code plantnet}, {@code google_vision},
 * {@code huggingface} and {@code local_model}. Each adapter converts its provider's response
 * into the canonical prediction shape and reports failures as
 * {@link com.phillippitts.plantdx.exception.ProviderCallException} with a retryable flag.
 */
package com.phillippitts.plantdx.service.provider;
