package com.phillippitts.plantdx.service.provider.plantid;

import com.phillippitts.plantdx.domain.ClassificationRequest;
import com.phillippitts.plantdx.domain.Prediction;
import com.phillippitts.plantdx.domain.ProviderResult;
import com.phillippitts.plantdx.domain.Severity;
import com.phillippitts.plantdx.exception.NoPredictionException;
import com.phillippitts.plantdx.exception.ProviderCallException;
import com.phillippitts.plantdx.service.provider.http.ProviderHttpClient;
import com.phillippitts.plantdx.testutil.TestConfigs;
import com.phillippitts.plantdx.testutil.TestImages;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.util.Collections;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class PlantIdProviderTest {

    private static final String URL = "https://plant.id.test/api/v3";

    private MockRestServiceServer server;
    private PlantIdProvider provider;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        provider = new PlantIdProvider(TestConfigs.withUrl("plant_id", URL, Map.of()),
                new ProviderHttpClient("plant_id", restTemplate));
        provider.initialize();
    }

    @Test
    void postsAllImagesWithApiKeyAndParsesSuggestions() {
        server.expect(requestTo(URL + "/identification"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header("Api-Key", "test-key"))
                .andExpect(jsonPath("$.images.length()").value(2))
                .andExpect(jsonPath("$.crop").value(true))
                .andRespond(withSuccess("""
                        {"result": {"is_plant": {"binary": true, "probability": 0.99},
                          "disease": {"suggestions": [
                            {"id": "d1", "name": "Late blight", "probability": 0.83,
                             "details": {"description": "Water mould",
                                         "treatment": {"chemical": ["Copper fungicide"], "prevention": ["Rotate crops"]},
                                         "symptoms": ["Dark lesions"], "cause": ["Phytophthora infestans"]}},
                            {"name": "Septoria Leaf Spot", "probability": 0.12}
                          ]}}}
                        """, MediaType.APPLICATION_JSON));

        ProviderResult result = provider.classify(request(2));

        server.verify();
        assertThat(result.provider()).isEqualTo("plant_id");
        assertThat(result.confidence()).isEqualTo(0.83);
        assertThat(result.healthy()).isFalse();
        assertThat(result.metadata().imageCount()).isEqualTo(2);
        assertThat(result.metadata().modelVersion()).isEqualTo("3.0");
        Prediction top = result.topPrediction();
        assertThat(top.diseaseId()).isEqualTo("d1");
        assertThat(top.severity()).isEqualTo(Severity.MEDIUM);
        assertThat(top.treatment().chemical()).containsExactly("Copper fungicide");
        assertThat(top.treatment().prevention()).containsExactly("Rotate crops");
        assertThat(top.symptoms()).containsExactly("Dark lesions");
        assertThat(top.causes()).containsExactly("Phytophthora infestans");
        assertThat(result.predictions().get(1).diseaseId()).isEqualTo("septoria_leaf_spot");
    }

    @Test
    void plantWithoutSuggestionsIsReportedHealthy() {
        server.expect(requestTo(URL + "/identification"))
                .andRespond(withSuccess("{\"is_plant\": true, \"disease\": {\"suggestions\": []}}",
                        MediaType.APPLICATION_JSON));

        ProviderResult result = provider.classify(request(1));

        assertThat(result.healthy()).isTrue();
        assertThat(result.topPrediction().diseaseId()).isEqualTo("healthy");
        assertThat(result.confidence()).isEqualTo(0.9);
    }

    @Test
    void nonPlantWithoutSuggestionsHasNoPrediction() {
        server.expect(requestTo(URL + "/identification"))
                .andRespond(withSuccess("{\"is_plant\": false}", MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> provider.classify(request(1)))
                .isInstanceOf(NoPredictionException.class);
    }

    @Test
    void unauthorizedIsNonRetryableCredentialFailure() {
        server.expect(requestTo(URL + "/identification"))
                .andRespond(withStatus(HttpStatus.UNAUTHORIZED).body("{\"error\":\"bad key\"}"));

        assertThatThrownBy(() -> provider.classify(request(1)))
                .isInstanceOfSatisfying(ProviderCallException.class, e -> {
                    assertThat(e.isRetryable()).isFalse();
                    assertThat(e.isCredentialFailure()).isTrue();
                    assertThat(e.getStatusCode()).isEqualTo(401);
                });
    }

    @Test
    void probeHitsHealthEndpoint() {
        server.expect(requestTo(URL + "/health"))
                .andExpect(method(HttpMethod.GET))
                .andExpect(header("Api-Key", "test-key"))
                .andRespond(withSuccess());

        provider.probe();

        server.verify();
    }

    @Test
    void classifyBeforeInitializeFails() {
        provider.close();

        assertThatThrownBy(() -> provider.classify(request(1)))
                .isInstanceOf(ProviderCallException.class)
                .hasMessageContaining("not initialized");
    }

    private static ClassificationRequest request(int images) {
        return new ClassificationRequest(Collections.nCopies(images, TestImages.normalized()), null);
    }
}
