package com.phillippitts.plantdx.service.provider.http;

import com.phillippitts.plantdx.exception.ProviderCallException;
import com.phillippitts.plantdx.exception.ProviderCallExceptionBuilder;
import com.phillippitts.plantdx.util.LogSanitizer;
import com.phillippitts.plantdx.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Shared HTTP plumbing for provider adapters.
 *
 * <p>Adapters hold one instance each (composition); the client posts JSON or multipart bodies
 * and converts every transport or status failure into a {@link ProviderCallException} whose
 * retryable flag follows {@link #isRetryableStatus(int)}. Response bodies that are not valid
 * JSON are reported as non-retryable.
 */
public final class ProviderHttpClient {

    private static final Logger LOG = LogManager.getLogger(ProviderHttpClient.class);

    private static final int ERROR_BODY_PREVIEW = 200;

    private final String provider;
    private final RestTemplate restTemplate;

    public ProviderHttpClient(String provider, RestTemplate restTemplate) {
        this.provider = Objects.requireNonNull(provider, "provider");
        this.restTemplate = Objects.requireNonNull(restTemplate, "restTemplate");
    }

    /**
     * Builds a client whose connect and read timeouts match the provider's call timeout.
     */
    public static ProviderHttpClient create(String provider, RestTemplateBuilder builder, Duration timeout) {
        RestTemplate template = builder
                .setConnectTimeout(timeout)
                .setReadTimeout(timeout)
                .build();
        return new ProviderHttpClient(provider, template);
    }

    /**
     * Returns true for statuses worth retrying: 5xx, 429 (rate limited) and 408 (request timeout).
     */
    public static boolean isRetryableStatus(int status) {
        return status >= 500 || status == 429 || status == 408;
    }

    public String postJson(String url, JSONObject body, HttpHeaders headers) {
        HttpHeaders h = copy(headers);
        h.setContentType(MediaType.APPLICATION_JSON);
        h.setAccept(List.of(MediaType.APPLICATION_JSON));
        return exchange(url, HttpMethod.POST, new HttpEntity<>(body.toString(), h));
    }

    public String postMultipart(String url, MultiValueMap<String, Object> parts, HttpHeaders headers) {
        HttpHeaders h = copy(headers);
        h.setContentType(MediaType.MULTIPART_FORM_DATA);
        return exchange(url, HttpMethod.POST, new HttpEntity<>(parts, h));
    }

    public String get(String url, HttpHeaders headers) {
        return exchange(url, HttpMethod.GET, new HttpEntity<>(copy(headers)));
    }

    /**
     * Parses a JSON object response body.
     *
     * @throws ProviderCallException (non-retryable) if the body is not a JSON object
     */
    public JSONObject parseObject(String body) {
        try {
            return new JSONObject(requireBody(body));
        } catch (JSONException e) {
            throw unparseable(body, e);
        }
    }

    /**
     * Parses a JSON array response body.
     *
     * @throws ProviderCallException (non-retryable) if the body is not a JSON array
     */
    public JSONArray parseArray(String body) {
        try {
            return new JSONArray(requireBody(body));
        } catch (JSONException e) {
            throw unparseable(body, e);
        }
    }

    private String exchange(String url, HttpMethod method, HttpEntity<?> entity) {
        long t0 = System.nanoTime();
        String safeUrl = LogSanitizer.redactUrl(url);
        try {
            ResponseEntity<String> response = restTemplate.exchange(url, method, entity, String.class);
            LOG.debug("{} {} {} -> {} in {} ms", provider, method, safeUrl,
                    response.getStatusCode().value(), TimeUtils.elapsedMillis(t0));
            return response.getBody();
        } catch (HttpStatusCodeException e) {
            int status = e.getStatusCode().value();
            boolean retryable = isRetryableStatus(status);
            LOG.warn("{} {} {} returned HTTP {}: {}", provider, method, safeUrl, status,
                    LogSanitizer.truncate(e.getResponseBodyAsString(), ERROR_BODY_PREVIEW));
            throw ProviderCallExceptionBuilder.create(describe(status))
                    .provider(provider)
                    .statusCode(status)
                    .retryable(retryable)
                    .durationMs(TimeUtils.elapsedMillis(t0))
                    .cause(e)
                    .build();
        } catch (ResourceAccessException e) {
            LOG.warn("{} {} {} I/O failure: {}", provider, method, safeUrl, e.getMessage());
            throw ProviderCallExceptionBuilder.create("I/O error calling provider")
                    .provider(provider)
                    .retryable(true)
                    .durationMs(TimeUtils.elapsedMillis(t0))
                    .cause(e)
                    .build();
        } catch (RestClientException e) {
            LOG.warn("{} {} {} failed: {}", provider, method, safeUrl, e.getMessage());
            throw ProviderCallExceptionBuilder.create("Unreadable provider response")
                    .provider(provider)
                    .retryable(false)
                    .durationMs(TimeUtils.elapsedMillis(t0))
                    .cause(e)
                    .build();
        }
    }

    private String requireBody(String body) {
        if (body == null || body.isBlank()) {
            throw new ProviderCallException("Empty response body", provider, false);
        }
        return body;
    }

    private ProviderCallException unparseable(String body, JSONException e) {
        LOG.warn("{} returned unparseable body: {}", provider, LogSanitizer.truncate(body, ERROR_BODY_PREVIEW));
        return new ProviderCallException("Unparseable response body", provider, false, e);
    }

    private static String describe(int status) {
        if (status == 401 || status == 403) {
            return "Provider rejected credentials";
        }
        if (status == 429) {
            return "Provider rate limit hit";
        }
        if (status >= 500) {
            return "Provider server error";
        }
        return "Provider rejected request";
    }

    private static HttpHeaders copy(HttpHeaders headers) {
        HttpHeaders h = new HttpHeaders();
        if (headers != null) {
            h.putAll(headers);
        }
        return h;
    }
}
