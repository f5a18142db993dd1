package com.phillippitts.plantdx.service.provider.huggingface;

import com.phillippitts.plantdx.domain.ClassificationRequest;
import com.phillippitts.plantdx.domain.Prediction;
import com.phillippitts.plantdx.domain.ProviderResult;
import com.phillippitts.plantdx.exception.NoPredictionException;
import com.phillippitts.plantdx.exception.ProviderCallException;
import com.phillippitts.plantdx.service.provider.http.ProviderHttpClient;
import com.phillippitts.plantdx.testutil.TestConfigs;
import com.phillippitts.plantdx.testutil.TestImages;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.ExpectedCount;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class HuggingFaceProviderTest {

    private static final String URL = "https://hf.test/models";

    private final RestTemplate restTemplate = new RestTemplate();
    private final MockRestServiceServer server = MockRestServiceServer.bindTo(restTemplate).build();
    private HuggingFaceProvider provider;

    @BeforeEach
    void setUp() {
        provider = new HuggingFaceProvider(
                TestConfigs.withUrl("huggingface", URL, Map.of("model", "acme/leaf-vit")),
                new ProviderHttpClient("huggingface", restTemplate));
        provider.initialize();
    }

    @Test
    void callsModelOncePerImageAndMergesLabels() {
        server.expect(ExpectedCount.once(), requestTo(URL + "/acme/leaf-vit"))
                .andExpect(header("Authorization", "Bearer test-key"))
                .andExpect(jsonPath("$.options.wait_for_model").value(true))
                .andRespond(withSuccess("""
                        [{"label": "Tomato___Early_blight", "score": 0.62},
                         {"label": "Tomato___healthy", "score": 0.30}]
                        """, MediaType.APPLICATION_JSON));
        server.expect(ExpectedCount.once(), requestTo(URL + "/acme/leaf-vit"))
                .andRespond(withSuccess("""
                        [{"label": "Tomato___Early_blight", "score": 0.74},
                         {"label": "Tomato___Late_blight", "score": 0.11}]
                        """, MediaType.APPLICATION_JSON));

        ProviderResult result = provider.classify(new ClassificationRequest(
                List.of(TestImages.normalized(), TestImages.normalized()), null));

        server.verify();
        assertThat(result.predictions()).extracting(Prediction::diseaseId)
                .containsExactly("tomato___early_blight", "tomato___healthy", "tomato___late_blight");
        assertThat(result.confidence()).isEqualTo(0.74);
        assertThat(result.healthy()).isFalse();
        assertThat(result.metadata().modelVersion()).isEqualTo("acme/leaf-vit");
    }

    @Test
    void healthyTopLabelMarksResultHealthy() {
        server.expect(requestTo(URL + "/acme/leaf-vit"))
                .andRespond(withSuccess("[{\"label\": \"Apple___healthy\", \"score\": 0.91}]",
                        MediaType.APPLICATION_JSON));

        ProviderResult result = provider.classify(new ClassificationRequest(List.of(TestImages.normalized()), null));

        assertThat(result.healthy()).isTrue();
    }

    @Test
    void emptyLabelListHasNoPrediction() {
        server.expect(requestTo(URL + "/acme/leaf-vit"))
                .andRespond(withSuccess("[]", MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> provider.classify(new ClassificationRequest(List.of(TestImages.normalized()), null)))
                .isInstanceOf(NoPredictionException.class);
    }

    @Test
    void objectInsteadOfArrayIsUnparseable() {
        server.expect(requestTo(URL + "/acme/leaf-vit"))
                .andRespond(withSuccess("{\"error\": \"Model is loading\"}", MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> provider.classify(new ClassificationRequest(List.of(TestImages.normalized()), null)))
                .isInstanceOfSatisfying(ProviderCallException.class, e -> assertThat(e.isRetryable()).isFalse());
    }

    @Test
    void defaultModelWhenNoneConfigured() {
        HuggingFaceProvider plain = new HuggingFaceProvider(TestConfigs.withUrl("huggingface", URL, Map.of()),
                new ProviderHttpClient("huggingface", restTemplate));

        assertThat(plain.model()).isEqualTo(HuggingFaceProvider.DEFAULT_MODEL);
    }
}
