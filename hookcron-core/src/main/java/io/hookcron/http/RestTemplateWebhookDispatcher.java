package io.hookcron.http;

import io.hookcron.WebhookDispatcher;
import io.hookcron.core.DispatchResult;
import io.hookcron.core.Job;
import io.hookcron.core.Target;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.ResponseErrorHandler;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.time.Duration;
import java.util.Collection;
import java.util.Map;
import java.util.Objects;

/**
 * {@link WebhookDispatcher} backed by Spring's {@link RestTemplate}.
 *
 * <p>Every HTTP status is returned to the caller as-is; only transport problems (connection
 * refused, timeout, malformed URL...) become {@link DispatchResult#transportError(String)}.
 */
public class RestTemplateWebhookDispatcher implements WebhookDispatcher {

    private final RestTemplate restTemplate;

    public RestTemplateWebhookDispatcher(Duration requestTimeout) {
        this(createRestTemplate(requestTimeout));
    }

    public RestTemplateWebhookDispatcher(RestTemplate restTemplate) {
        this.restTemplate = Objects.requireNonNull(restTemplate, "restTemplate must not be null");
        this.restTemplate.setErrorHandler(new PassThroughErrorHandler());
    }

    /**
     * RestTemplate with connect and read timeouts both bounded by {@code requestTimeout}.
     */
    public static RestTemplate createRestTemplate(Duration requestTimeout) {
        Objects.requireNonNull(requestTimeout, "requestTimeout must not be null");
        if (requestTimeout.isZero() || requestTimeout.isNegative()) {
            throw new IllegalArgumentException("requestTimeout must be a positive duration");
        }
        int timeoutMs = (int) Math.min(Integer.MAX_VALUE, requestTimeout.toMillis());

        SimpleClientHttpRequestFactory rf = new SimpleClientHttpRequestFactory();
        rf.setConnectTimeout(timeoutMs);
        rf.setReadTimeout(timeoutMs);
        return new RestTemplate(rf);
    }

    @Override
    public DispatchResult dispatch(Job job) {
        Objects.requireNonNull(job, "job must not be null");
        Target target = job.getTarget();
        try {
            URI uri = buildUri(target.url(), job.getQueryParams());
            HttpMethod method = HttpMethod.valueOf(target.method());
            HttpEntity<Object> entity = buildEntity(method, job.getHeaders(), job.getPayload());

            ResponseEntity<String> response = restTemplate.exchange(uri, method, entity, String.class);
            return DispatchResult.response(response.getStatusCode().value());
        } catch (RestClientException | IllegalArgumentException e) {
            return DispatchResult.transportError(describe(e));
        }
    }

    static URI buildUri(String url, Map<String, Object> queryParams) {
        UriComponentsBuilder builder = UriComponentsBuilder.fromUriString(url);
        if (queryParams != null) {
            queryParams.forEach((name, value) -> {
                if (value instanceof Collection<?> values) {
                    values.forEach(v -> builder.queryParam(name, v));
                } else if (value != null) {
                    builder.queryParam(name, value);
                }
            });
        }
        return builder.encode().build().toUri();
    }

    private static HttpEntity<Object> buildEntity(HttpMethod method, Map<String, String> headers, Object payload) {
        HttpHeaders httpHeaders = new HttpHeaders();
        if (headers != null) {
            headers.forEach(httpHeaders::set);
        }

        // HttpURLConnection turns a GET with a body into a POST
        boolean bodyAllowed = method != HttpMethod.GET && method != HttpMethod.HEAD;
        if (payload == null || !bodyAllowed) {
            return new HttpEntity<>(httpHeaders);
        }
        if (httpHeaders.getContentType() == null) {
            httpHeaders.setContentType(MediaType.APPLICATION_JSON);
        }
        return new HttpEntity<>(payload, httpHeaders);
    }

    private static String describe(Exception e) {
        Throwable root = e;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        String msg = e.getMessage();
        if (root != e && root.getMessage() != null) {
            msg = root.getClass().getSimpleName() + ": " + root.getMessage();
        }
        return msg != null ? msg : e.getClass().getSimpleName();
    }

    /**
     * Lets 4xx/5xx responses through so the executor classifies them.
     */
    private static final class PassThroughErrorHandler implements ResponseErrorHandler {
        @Override
        public boolean hasError(ClientHttpResponse response) {
            return false;
        }

        @Override
        public void handleError(ClientHttpResponse response) {
            // unreachable: hasError is always false
        }
    }
}
