package com.phillippitts.plantdx.service.provider.http;

import com.phillippitts.plantdx.exception.ProviderCallException;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withException;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class ProviderHttpClientTest {

    private final RestTemplate restTemplate = new RestTemplate();
    private final MockRestServiceServer server = MockRestServiceServer.bindTo(restTemplate).build();
    private final ProviderHttpClient client = new ProviderHttpClient("plant_id", restTemplate);

    @ParameterizedTest
    @CsvSource({
            "500, true", "502, true", "503, true", "429, true", "408, true",
            "400, false", "401, false", "403, false", "404, false", "415, false"
    })
    void classifiesStatusCodes(int status, boolean retryable) {
        assertThat(ProviderHttpClient.isRetryableStatus(status)).isEqualTo(retryable);
    }

    @Test
    void postsJsonWithCallerHeaders() {
        HttpHeaders headers = new HttpHeaders();
        headers.set("Api-Key", "k");
        server.expect(requestTo("http://p.test/x"))
                .andExpect(header("Api-Key", "k"))
                .andExpect(content().contentType(MediaType.APPLICATION_JSON))
                .andExpect(content().json("{\"a\": 1}"))
                .andRespond(withSuccess("{\"ok\": true}", MediaType.APPLICATION_JSON));

        String body = client.postJson("http://p.test/x", new JSONObject().put("a", 1), headers);

        assertThat(client.parseObject(body).getBoolean("ok")).isTrue();
        server.verify();
    }

    @Test
    void ioFailureIsRetryable() {
        server.expect(requestTo("http://p.test/x")).andRespond(withException(new IOException("connection reset")));

        assertThatThrownBy(() -> client.get("http://p.test/x", null))
                .isInstanceOfSatisfying(ProviderCallException.class, e -> {
                    assertThat(e.isRetryable()).isTrue();
                    assertThat(e.getProvider()).isEqualTo("plant_id");
                });
    }

    @Test
    void malformedOrEmptyBodiesAreNonRetryable() {
        assertThatThrownBy(() -> client.parseObject("<html>oops</html>"))
                .isInstanceOfSatisfying(ProviderCallException.class, e -> assertThat(e.isRetryable()).isFalse())
                .hasMessageContaining("Unparseable");
        assertThatThrownBy(() -> client.parseArray(""))
                .isInstanceOf(ProviderCallException.class)
                .hasMessageContaining("Empty response body");
    }
}
