package io.irontrade.infrastructure.live;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.irontrade.broker.exception.AlpacaApiException;
import io.irontrade.infrastructure.broker.common.RetryPolicy;
import io.irontrade.infrastructure.broker.metrics.BrokerMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.Instant;
import java.util.function.Supplier;

/**
 * JSON-over-HTTP transport shared by the Alpaca client and market.
 *
 * Adds the key/secret headers to every request. Rate limiting (429), server
 * errors (5xx) and I/O failures are retried with a fresh RetryPolicy per call;
 * any other non-2xx response fails at once with AlpacaApiException.
 */
public class AlpacaHttp {
    private static final Logger log = LoggerFactory.getLogger(AlpacaHttp.class);

    public static final String BROKER_CODE = "ALPACA";

    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(10);

    private final AlpacaCredentials credentials;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Supplier<RetryPolicy> retryPolicies;
    private final BrokerMetrics metrics;

    /**
     * @param retryPolicies Fresh policy per request
     * @param metrics Metrics collector (nullable)
     */
    public AlpacaHttp(AlpacaCredentials credentials, Supplier<RetryPolicy> retryPolicies, BrokerMetrics metrics) {
        this.credentials = credentials;
        this.retryPolicies = retryPolicies;
        this.metrics = metrics;
        this.httpClient = HttpClient.newBuilder()
            .version(HttpClient.Version.HTTP_1_1)
            .connectTimeout(Duration.ofSeconds(5))
            .build();
        this.objectMapper = new ObjectMapper()
            .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);
    }

    public AlpacaCredentials getCredentials() {
        return credentials;
    }

    public ObjectNode createObjectNode() {
        return objectMapper.createObjectNode();
    }

    public JsonNode get(String operation, String url) {
        return execute(operation, () -> baseRequest(url).GET().build());
    }

    public JsonNode post(String operation, String url, JsonNode body) {
        String payload;
        try {
            payload = objectMapper.writeValueAsString(body);
        } catch (IOException e) {
            throw new AlpacaApiException(operation, "Cannot serialize request body", e);
        }
        return execute(operation, () -> baseRequest(url)
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(payload))
            .build());
    }

    private HttpRequest.Builder baseRequest(String url) {
        return HttpRequest.newBuilder()
            .uri(URI.create(url))
            .timeout(REQUEST_TIMEOUT)
            .header("APCA-API-KEY-ID", credentials.apiKey())
            .header("APCA-API-SECRET-KEY", credentials.apiSecret())
            .header("Accept", "application/json");
    }

    private JsonNode execute(String operation, Supplier<HttpRequest> requests) {
        RetryPolicy retryPolicy = retryPolicies.get();
        while (true) {
            Instant startTime = Instant.now();
            HttpRequest request = requests.get();
            AlpacaApiException failure;
            try {
                HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
                int status = response.statusCode();
                if (status >= 200 && status < 300) {
                    recordRequest(operation, true, startTime);
                    retryPolicy.recordSuccess();
                    return readBody(operation, response.body());
                }
                recordRequest(operation, false, startTime);
                failure = new AlpacaApiException(operation, status, response.body());
                if (!isRetryable(status)) {
                    log.warn("[ALPACA] {} {} failed: HTTP {}", request.method(), request.uri(), status);
                    throw failure;
                }
            } catch (IOException e) {
                recordRequest(operation, false, startTime);
                failure = new AlpacaApiException(operation, e.getClass().getSimpleName() + ": " + e.getMessage(), e);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new AlpacaApiException(operation, "Interrupted", e);
            }

            if (!retryPolicy.shouldRetry()) {
                log.error("[ALPACA] {} giving up after {} retries: {}",
                    operation, retryPolicy.getRetryCount(), failure.getMessage());
                throw failure;
            }
            Duration delay = retryPolicy.recordFailure();
            log.warn("[ALPACA] {} failed ({}), retry {} in {}ms",
                operation, failure.getErrorCode(), retryPolicy.getRetryCount(), delay.toMillis());
            if (metrics != null) {
                metrics.recordRetry(BROKER_CODE, retryPolicy.getRetryCount(), failure.getErrorCode());
            }
            sleep(operation, delay);
        }
    }

    private JsonNode readBody(String operation, String body) {
        try {
            return objectMapper.readTree(body);
        } catch (IOException e) {
            throw new AlpacaApiException(operation, "Malformed JSON response", e);
        }
    }

    private void recordRequest(String operation, boolean success, Instant startTime) {
        if (metrics != null) {
            metrics.recordRequest(BROKER_CODE, operation, success, Duration.between(startTime, Instant.now()));
        }
    }

    private static boolean isRetryable(int status) {
        return status == 429 || status >= 500;
    }

    private static void sleep(String operation, Duration delay) {
        try {
            Thread.sleep(delay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AlpacaApiException(operation, "Interrupted during retry backoff", e);
        }
    }
}
