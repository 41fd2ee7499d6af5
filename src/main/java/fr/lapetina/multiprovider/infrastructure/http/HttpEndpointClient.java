package fr.lapetina.multiprovider.infrastructure.http;

import fr.lapetina.multiprovider.domain.model.EndpointAddress;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

/**
 * {@link EndpointClient} over {@code java.net.http.HttpClient}.
 *
 * The underlying {@link HttpClient} is shared by every endpoint of a factory so that
 * connections are pooled per host; this class keeps no per-call state.
 */
public class HttpEndpointClient implements EndpointClient {

    private static final Logger log = LoggerFactory.getLogger(HttpEndpointClient.class);

    private final EndpointAddress address;
    private final HttpClient httpClient;
    private final Duration requestTimeout;

    public HttpEndpointClient(EndpointAddress address, HttpClient httpClient, Duration requestTimeout) {
        this.address = address;
        this.httpClient = httpClient;
        this.requestTimeout = requestTimeout;
    }

    /**
     * Creates the HTTP client shared by endpoint clients.
     */
    public static HttpClient newSharedClient(Duration connectTimeout) {
        return HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .version(HttpClient.Version.HTTP_1_1)
                .followRedirects(HttpClient.Redirect.NEVER)
                .build();
    }

    @Override
    public EndpointAddress address() {
        return address;
    }

    @Override
    public EndpointResponse execute(EndpointRequest request) throws IOException {
        HttpRequest httpRequest = buildHttpRequest(request);
        try {
            return toEndpointResponse(httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofByteArray()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted while waiting for provider " + address.getLabel());
        }
    }

    @Override
    public CompletableFuture<EndpointResponse> executeAsync(EndpointRequest request) {
        HttpRequest httpRequest = buildHttpRequest(request);
        return httpClient.sendAsync(httpRequest, HttpResponse.BodyHandlers.ofByteArray())
                .thenApply(this::toEndpointResponse);
    }

    private HttpRequest buildHttpRequest(EndpointRequest request) {
        URI uri = buildUri(request);
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(uri)
                .timeout(requestTimeout)
                .header("Accept", "application/json");

        if ("POST".equals(request.method())) {
            builder.header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofByteArray(request.body()));
        } else {
            builder.GET();
        }

        log.trace("Built request: provider={}, method={}, path={}", address.getLabel(), request.method(), request.path());
        return builder.build();
    }

    private URI buildUri(EndpointRequest request) {
        String base = address.getUri().toString();
        if (request.path().isEmpty()) {
            return URI.create(base + encodeQuery(request.query(), base.contains("?")));
        }
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return URI.create(base + request.path() + encodeQuery(request.query(), false));
    }

    private static String encodeQuery(Map<String, String> query, boolean append) {
        if (query.isEmpty()) {
            return "";
        }
        String encoded = query.entrySet().stream()
                .map(e -> URLEncoder.encode(e.getKey(), StandardCharsets.UTF_8)
                        + "=" + URLEncoder.encode(e.getValue(), StandardCharsets.UTF_8))
                .collect(Collectors.joining("&"));
        return (append ? "&" : "?") + encoded;
    }

    private EndpointResponse toEndpointResponse(HttpResponse<byte[]> response) {
        long contentLength = response.headers().firstValueAsLong("Content-Length").orElse(-1L);
        return new EndpointResponse(response.statusCode(), contentLength, response.body());
    }

    @Override
    public String toString() {
        return "HttpEndpointClient{" +
                "provider='" + address.getLabel() + '\'' +
                '}';
    }
}
