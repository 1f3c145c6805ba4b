package io.surfworks.fcc.license;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link CandidateServers}.
 */
class CandidateServersTest {

    @TempDir
    Path tempDir;

    private LicenseConfig config(String url) {
        return LicenseConfig.forServer(url, tempDir);
    }

    private static List<String> urls(CandidateServers servers) {
        return servers.candidates().stream().map(CandidateServers.Candidate::baseUrl).toList();
    }

    @Test
    @DisplayName("remote HTTPS server is the only candidate and verifies TLS")
    void remoteHttps_singleCandidate() throws Exception {
        var servers = new CandidateServers(config("https://license.example.com/"));

        assertEquals(List.of("https://license.example.com"), urls(servers));
        assertTrue(servers.primary().verifyTls());
    }

    @Test
    @DisplayName("LICENSE_VERIFY_SSL=false turns off verification for HTTPS")
    void remoteHttps_verifyDisabled() throws Exception {
        var config = new LicenseConfig("https://license.example.com", false, false, false, false,
            72, 12, null, tempDir);

        assertFalse(new CandidateServers(config).primary().verifyTls());
    }

    @Test
    @DisplayName("unsupported scheme is a configuration error")
    void unsupportedScheme_rejected() {
        var e = assertThrows(LicenseConfigurationException.class,
            () -> new CandidateServers(config("ftp://license.example.com")));

        assertEquals(ErrorCode.CONFIGURATION_ERROR, e.errorCode());
        assertTrue(e.getMessage().contains("ftp"));
    }

    @Test
    @DisplayName("URL without host is a configuration error")
    void missingHost_rejected() {
        assertThrows(LicenseConfigurationException.class, () -> new CandidateServers(config("https:///verify")));
    }

    @Test
    @DisplayName("remote HTTP without override is a configuration error")
    void remoteHttp_withoutOverride_rejected() {
        var e = assertThrows(LicenseConfigurationException.class,
            () -> new CandidateServers(config("http://license.example.com")));

        assertTrue(e.getMessage().contains(LicenseConfig.ENV_ALLOW_INSECURE));
    }

    @Test
    @DisplayName("remote HTTP with override is accepted without TLS verification")
    void remoteHttp_withOverride_accepted() throws Exception {
        var servers = new CandidateServers(config("http://license.example.com").withAllowInsecureServer(true));

        assertEquals(List.of("http://license.example.com"), urls(servers));
        assertFalse(servers.primary().verifyTls());
    }

    @Test
    @DisplayName("HTTPS loopback gets an HTTP fallback in front")
    void httpsLoopback_httpFallbackFirst() throws Exception {
        var servers = new CandidateServers(config("https://localhost:8443"));

        assertEquals(List.of("http://localhost:8443", "https://localhost:8443"), urls(servers));
        assertTrue(servers.candidates().get(1).verifyTls());
    }

    @Test
    @DisplayName("HTTP fallback can be disabled")
    void httpsLoopback_fallbackDisabled() throws Exception {
        var servers = new CandidateServers(config("https://127.0.0.1:8443").withDisableHttpFallback(true));

        assertEquals(List.of("https://127.0.0.1:8443"), urls(servers));
    }

    @Test
    @DisplayName("HTTP loopback gets an HTTPS alternative behind it")
    void httpLoopback_httpsAlternativeSecond() throws Exception {
        var servers = new CandidateServers(config("http://[::1]:8000"));

        assertEquals(List.of("http://[::1]:8000", "https://[::1]:8000"), urls(servers));
        assertFalse(servers.candidates().get(1).verifyTls());
    }

    @Test
    @DisplayName("HTTPS alternative can be disabled")
    void httpLoopback_alternativeDisabled() throws Exception {
        var servers = new CandidateServers(config("http://localhost:8000").withDisableHttpsFallback(true));

        assertEquals(List.of("http://localhost:8000"), urls(servers));
    }

    @Test
    @DisplayName("promote moves a candidate to the front and keeps the rest in order")
    void promote_movesToFront() throws Exception {
        var servers = new CandidateServers(config("http://localhost:8000"));
        var second = servers.candidates().get(1);

        servers.promote(second);

        assertEquals(List.of("https://localhost:8000", "http://localhost:8000"), urls(servers));
        assertEquals(second, servers.primary());
    }

    @Test
    @DisplayName("promoting an unknown candidate changes nothing")
    void promote_unknownCandidate_noop() throws Exception {
        var servers = new CandidateServers(config("http://localhost:8000"));

        servers.promote(new CandidateServers.Candidate("https://elsewhere", true));

        assertEquals(List.of("http://localhost:8000", "https://localhost:8000"), urls(servers));
    }

    @Test
    @DisplayName("loopback detection covers names, IPv4 and bracketed IPv6")
    void isLoopback() {
        assertTrue(CandidateServers.isLoopback("LOCALHOST"));
        assertTrue(CandidateServers.isLoopback("127.0.0.1"));
        assertTrue(CandidateServers.isLoopback("[::1]"));
        assertFalse(CandidateServers.isLoopback("license.example.com"));
        assertFalse(CandidateServers.isLoopback(null));
    }

    @Test
    @DisplayName("verifyUri appends the verification path")
    void verifyUri() {
        var candidate = new CandidateServers.Candidate("https://license.example.com/v1", true);

        assertEquals("https://license.example.com/v1/api/license/verify", candidate.verifyUri().toString());
        assertTrue(candidate.isHttps());
    }
}
