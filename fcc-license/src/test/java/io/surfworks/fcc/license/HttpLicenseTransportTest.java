package io.surfworks.fcc.license;

import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for {@link HttpLicenseTransport} against a local HTTP server.
 */
class HttpLicenseTransportTest {

    private HttpServer server;
    private final AtomicReference<String> receivedBody = new AtomicReference<>();
    private final AtomicReference<String> receivedContentType = new AtomicReference<>();
    private volatile int status = 200;
    private volatile String responseBody = "{\"ok\": true, \"license\": {}}";

    @BeforeEach
    void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/api/license/verify", exchange -> {
            receivedBody.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            receivedContentType.set(exchange.getRequestHeaders().getFirst("Content-Type"));
            byte[] bytes = responseBody.getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().set("Content-Type", "application/json");
            exchange.sendResponseHeaders(status, bytes.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(bytes);
            }
        });
        server.start();
    }

    @AfterEach
    void stopServer() {
        server.stop(0);
    }

    private String baseUrl() {
        return "http://127.0.0.1:" + server.getAddress().getPort();
    }

    @Test
    @DisplayName("posts JSON to the verify endpoint and returns status and body")
    void post_success() throws Exception {
        var transport = new HttpLicenseTransport(Duration.ofSeconds(5));

        var response = transport.post(new CandidateServers.Candidate(baseUrl(), false), "{\"license_key\": \"K\"}");

        assertEquals(200, response.statusCode());
        assertEquals("{\"ok\": true, \"license\": {}}", response.body());
        assertEquals("{\"license_key\": \"K\"}", receivedBody.get());
        assertEquals("application/json", receivedContentType.get());
    }

    @Test
    @DisplayName("error statuses are returned, not thrown")
    void post_errorStatus() throws Exception {
        status = 403;
        responseBody = "{\"ok\": false, \"error\": \"activation_limit_reached\"}";
        var transport = new HttpLicenseTransport(Duration.ofSeconds(5));

        var response = transport.post(new CandidateServers.Candidate(baseUrl(), false), "{}");

        assertEquals(403, response.statusCode());
        assertEquals(responseBody, response.body());
    }

    @Test
    @DisplayName("refused connection is an IOException")
    void post_refused() throws Exception {
        int port;
        try (ServerSocket socket = new ServerSocket(0)) {
            port = socket.getLocalPort();
        }
        var transport = new HttpLicenseTransport(Duration.ofSeconds(5));

        assertThrows(IOException.class,
            () -> transport.post(new CandidateServers.Candidate("http://127.0.0.1:" + port, false), "{}"));
    }

    @Test
    @DisplayName("verification through the real transport falls back from the dead HTTPS alternative")
    void verificationClient_endToEnd() throws Exception {
        responseBody = "{\"ok\": true, \"license\": {\"client_name\": \"Acme\"}}";
        var config = LicenseConfig.forServer(baseUrl(), java.nio.file.Path.of("unused"));
        var servers = new CandidateServers(config);
        var client = new VerificationClient(servers, new HttpLicenseTransport(Duration.ofSeconds(5)));

        VerificationResult result = client.verify(
            new VerificationClient.Request("K", "fp", null, "h", "p", null));

        assertEquals(true, result.ok());
        assertEquals("Acme", result.license().get("client_name"));
        assertEquals(baseUrl(), result.candidateUrl());
    }
}
