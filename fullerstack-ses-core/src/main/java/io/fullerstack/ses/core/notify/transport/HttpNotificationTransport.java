package io.fullerstack.ses.core.notify.transport;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.fullerstack.ses.core.config.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Objects;

/**
 * {@link NotificationTransport} posting JSON through {@link HttpClient}.
 * <p>
 * The client is supplied by the caller so one instance, with its connect timeout, can be shared
 * by every backend. The request timeout bounds each individual post.
 *
 * @author Fullerstack
 */
public class HttpNotificationTransport implements NotificationTransport {

    private static final Logger logger = LoggerFactory.getLogger(HttpNotificationTransport.class);

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final URI endpoint;
    private final Duration requestTimeout;

    /**
     * @param httpClient     shared HTTP client
     * @param objectMapper   mapper used to serialise payloads
     * @param endpoint       absolute http or https URL every payload is posted to
     * @param requestTimeout per-request timeout
     * @throws ConfigurationException if the endpoint is not an absolute http(s) URL
     */
    public HttpNotificationTransport(HttpClient httpClient, ObjectMapper objectMapper,
                                     URI endpoint, Duration requestTimeout) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient cannot be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper cannot be null");
        this.endpoint = validEndpoint(Objects.requireNonNull(endpoint, "endpoint cannot be null"));
        this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout cannot be null");
    }

    @Override
    public TransportResponse postJson(Object payload) throws IOException {
        Objects.requireNonNull(payload, "payload cannot be null");
        byte[] body = objectMapper.writeValueAsBytes(payload);

        HttpRequest request = HttpRequest.newBuilder(endpoint)
            .timeout(requestTimeout)
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofByteArray(body))
            .build();

        logger.debug("POST {} ({} bytes)", endpoint.getHost(), body.length);
        try {
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            logger.debug("POST {} returned {}", endpoint.getHost(), response.statusCode());
            return new TransportResponse(response.statusCode(), response.body());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            InterruptedIOException interrupted = new InterruptedIOException("Interrupted posting to " + endpoint.getHost());
            interrupted.initCause(e);
            throw interrupted;
        }
    }

    private static URI validEndpoint(URI endpoint) {
        String scheme = endpoint.getScheme();
        if (scheme == null || endpoint.getHost() == null
            || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))) {
            throw new ConfigurationException("Notification endpoint must be an absolute http or https URL: " + endpoint);
        }
        return endpoint;
    }

    @Override
    public String toString() {
        return "HttpNotificationTransport[" + endpoint.getHost() + "]";
    }
}
