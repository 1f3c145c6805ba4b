package io.surfworks.fcc.license;

import java.io.IOException;
import java.net.Socket;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.security.cert.X509Certificate;
import java.time.Duration;

import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLEngine;
import javax.net.ssl.TrustManager;
import javax.net.ssl.X509ExtendedTrustManager;

/**
 * {@link LicenseTransport} over {@link HttpClient}.
 *
 * <p>Candidates with {@code verifyTls == false} are sent through a second client that
 * accepts any certificate and host name. That client is built on first use.
 */
public class HttpLicenseTransport implements LicenseTransport {

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(15);

    private final Duration timeout;
    private final HttpClient verifyingClient;
    private volatile HttpClient trustingClient;

    public HttpLicenseTransport() {
        this(DEFAULT_TIMEOUT);
    }

    public HttpLicenseTransport(Duration timeout) {
        this.timeout = timeout;
        this.verifyingClient = HttpClient.newBuilder()
            .connectTimeout(timeout)
            .followRedirects(HttpClient.Redirect.NORMAL)
            .build();
    }

    @Override
    public Response post(CandidateServers.Candidate candidate, String jsonBody)
            throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder()
            .uri(candidate.verifyUri())
            .header("Accept", "application/json")
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(jsonBody))
            .timeout(timeout)
            .build();

        HttpClient client = candidate.isHttps() && !candidate.verifyTls()
            ? trustingClient()
            : verifyingClient;

        HttpResponse<String> response = client.send(request, HttpResponse.BodyHandlers.ofString());
        return new Response(response.statusCode(), response.body());
    }

    private HttpClient trustingClient() throws IOException {
        HttpClient client = trustingClient;
        if (client == null) {
            synchronized (this) {
                client = trustingClient;
                if (client == null) {
                    client = HttpClient.newBuilder()
                        .connectTimeout(timeout)
                        .followRedirects(HttpClient.Redirect.NORMAL)
                        .sslContext(trustAllContext())
                        .build();
                    trustingClient = client;
                }
            }
        }
        return client;
    }

    private static SSLContext trustAllContext() throws IOException {
        try {
            SSLContext context = SSLContext.getInstance("TLS");
            context.init(null, new TrustManager[] {new TrustAllManager()}, new SecureRandom());
            return context;
        } catch (GeneralSecurityException e) {
            throw new IOException("Cannot create TLS context: " + e.getMessage(), e);
        }
    }

    /**
     * Accepts every certificate. Extending {@link X509ExtendedTrustManager} also
     * bypasses the JDK's host name check.
     */
    private static final class TrustAllManager extends X509ExtendedTrustManager {

        @Override
        public void checkClientTrusted(X509Certificate[] chain, String authType) {
        }

        @Override
        public void checkServerTrusted(X509Certificate[] chain, String authType) {
        }

        @Override
        public void checkClientTrusted(X509Certificate[] chain, String authType, Socket socket) {
        }

        @Override
        public void checkServerTrusted(X509Certificate[] chain, String authType, Socket socket) {
        }

        @Override
        public void checkClientTrusted(X509Certificate[] chain, String authType, SSLEngine engine) {
        }

        @Override
        public void checkServerTrusted(X509Certificate[] chain, String authType, SSLEngine engine) {
        }

        @Override
        public X509Certificate[] getAcceptedIssuers() {
            return new X509Certificate[0];
        }
    }
}
