/**
 * Hugging Face Inference API adapter.
 */
package com.phillippitts.plantdx.service.provider.huggingface;
