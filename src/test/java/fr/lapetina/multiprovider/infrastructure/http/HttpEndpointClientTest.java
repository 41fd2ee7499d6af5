package fr.lapetina.multiprovider.infrastructure.http;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import fr.lapetina.multiprovider.domain.model.EndpointAddress;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HttpEndpointClientTest {

    private HttpServer server;
    private HttpClient httpClient;
    private String baseUrl;
    private boolean stopped;

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/rpc", exchange -> {
            String body;
            try (InputStream is = exchange.getRequestBody()) {
                body = new String(is.readAllBytes(), StandardCharsets.UTF_8);
            }
            respond(exchange, 200, "{\"method\":\"" + exchange.getRequestMethod()
                    + "\",\"contentType\":\"" + exchange.getRequestHeaders().getFirst("Content-Type")
                    + "\",\"received\":" + body.length() + "}");
        });
        server.createContext("/eth/v1/beacon/headers", exchange ->
                respond(exchange, 200, "{\"query\":\"" + exchange.getRequestURI().getRawQuery() + "\"}"));
        server.createContext("/unavailable", exchange -> respond(exchange, 503, "busy"));
        server.start();

        baseUrl = "http://127.0.0.1:" + server.getAddress().getPort();
        httpClient = HttpEndpointClient.newSharedClient(Duration.ofSeconds(2));
    }

    @AfterEach
    void tearDown() {
        if (!stopped) {
            server.stop(0);
        }
    }

    private static void respond(HttpExchange exchange, int status, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    private HttpEndpointClient client(String address) {
        return new HttpEndpointClient(EndpointAddress.parse(address), httpClient, Duration.ofSeconds(5));
    }

    @Test
    @DisplayName("should POST JSON-RPC payload to the endpoint address")
    void shouldPostToAddress() throws Exception {
        byte[] payload = "{\"jsonrpc\":\"2.0\"}".getBytes(StandardCharsets.UTF_8);

        EndpointResponse response = client(baseUrl + "/rpc").execute(EndpointRequest.post("", payload));

        String body = new String(response.body(), StandardCharsets.UTF_8);
        assertThat(response.isSuccessful()).isTrue();
        assertThat(body).contains("\"method\":\"POST\"")
                .contains("\"contentType\":\"application/json\"")
                .contains("\"received\":" + payload.length);
        assertThat(response.contentLength()).isEqualTo(response.body().length);
        assertThat(response.payloadSize()).isEqualTo(response.body().length);
    }

    @Test
    @DisplayName("should GET REST path with encoded query")
    void shouldGetWithQuery() throws Exception {
        EndpointResponse response = client(baseUrl)
                .execute(EndpointRequest.get("/eth/v1/beacon/headers", Map.of("slot", "12 34")));

        assertThat(new String(response.body(), StandardCharsets.UTF_8)).contains("slot=12+34");
    }

    @Test
    @DisplayName("should return error status as a response")
    void shouldReturnErrorStatus() throws Exception {
        EndpointResponse response = client(baseUrl + "/").execute(EndpointRequest.get("/unavailable", null));

        assertThat(response.statusCode()).isEqualTo(503);
        assertThat(response.isSuccessful()).isFalse();
    }

    @Test
    @DisplayName("should complete asynchronously")
    void shouldCompleteAsync() throws Exception {
        EndpointResponse response = client(baseUrl + "/rpc")
                .executeAsync(EndpointRequest.post("", new byte[0]))
                .get(5, TimeUnit.SECONDS);

        assertThat(response.statusCode()).isEqualTo(200);
    }

    @Test
    @DisplayName("should report refused connections as IOException")
    void shouldReportConnectionFailure() {
        int port = server.getAddress().getPort();
        server.stop(0);
        stopped = true;

        HttpEndpointClient client = client("http://127.0.0.1:" + port);

        assertThatThrownBy(() -> client.execute(EndpointRequest.post("", new byte[0])))
                .isInstanceOf(IOException.class);
    }
}
