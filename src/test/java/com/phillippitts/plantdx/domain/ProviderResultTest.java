package com.phillippitts.plantdx.domain;

import com.phillippitts.plantdx.exception.ProviderCallException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ProviderResultTest {

    private static final ProviderResultMetadata META = new ProviderResultMetadata(5, 1, "v1", null);

    @Test
    void shouldSortPredictionsByDescendingConfidence() {
        ProviderResult result = ProviderResult.of("plant_id", List.of(
                Prediction.builder("a", "A", 0.2).build(),
                Prediction.builder("b", "B", 0.9).build(),
                Prediction.builder("c", "C", 0.5).build()), false, META);

        assertThat(result.predictions()).extracting(Prediction::diseaseId).containsExactly("b", "c", "a");
        assertThat(result.topPrediction().diseaseId()).isEqualTo("b");
        assertThat(result.confidence()).isEqualTo(0.9);
    }

    @Test
    void shouldRejectEmptyPredictions() {
        assertThatThrownBy(() -> ProviderResult.of("plant_id", List.of(), false, META))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("predictions must not be empty");
    }

    @Test
    void metadataRejectsNegativeValues() {
        assertThatThrownBy(() -> new ProviderResultMetadata(-1, 1, null, null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ProviderResultMetadata(1, -1, null, null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void providerErrorKeepsRetryableFlag() {
        ProviderError retryable = ProviderError.from("plantnet",
                new ProviderCallException("HTTP 503", "plantnet", true));
        ProviderError other = ProviderError.from("local_model", new IllegalStateException("boom"));

        assertThat(retryable.retryable()).isTrue();
        assertThat(retryable.message()).contains("HTTP 503");
        assertThat(other.retryable()).isFalse();
        assertThat(other.message()).isEqualTo("boom");
        assertThat(ProviderError.from("x", null).message()).isEqualTo("unknown failure");
    }

    @Test
    void consensusValidatesRanges() {
        assertThatThrownBy(() -> new Consensus(1.2, false, 0.5)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new Consensus(0.5, false, -0.1)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void normalizedImageIsDefensivelyCopied() {
        byte[] bytes = {1, 2, 3};
        NormalizedImage image = new NormalizedImage(bytes, null, 1, 1, "jpeg", 0.85f);
        bytes[0] = 9;
        image.bytes()[1] = 9;

        assertThat(image.bytes()).containsExactly(1, 2, 3);
        assertThat(image.base64()).isEqualTo("AQID");
        assertThat(image.sizeBytes()).isEqualTo(3);
    }

    @Test
    void classificationRequestRequiresImages() {
        assertThatThrownBy(() -> new ClassificationRequest(List.of(), null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
