package io.surfworks.fcc.license;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Ordered list of license server endpoints derived from one configured base URL.
 *
 * <p>Rules:
 * <ul>
 *   <li>Only {@code http} and {@code https} are accepted.</li>
 *   <li>{@code http} to a remote host needs {@link LicenseConfig#allowInsecureServer()}.</li>
 *   <li>{@code https} to a loopback host gets an {@code http} fallback in front of it.</li>
 *   <li>{@code http} to a loopback host gets an {@code https} alternative behind it.</li>
 * </ul>
 *
 * <p>A candidate that answers is moved to the front via {@link #promote(Candidate)}.
 * Not thread-safe; a resolver belongs to one verification flow.
 */
public final class CandidateServers {

    private static final Logger LOG = Logger.getLogger(CandidateServers.class.getName());

    private static final Set<String> LOOPBACK_HOSTS = Set.of("localhost", "127.0.0.1", "::1");

    /**
     * One endpoint to try.
     *
     * @param baseUrl   base URL without trailing slash
     * @param verifyTls whether the server certificate is verified
     */
    public record Candidate(String baseUrl, boolean verifyTls) {

        public boolean isHttps() {
            return baseUrl.regionMatches(true, 0, "https://", 0, 8);
        }

        /**
         * The verification endpoint on this candidate.
         */
        public URI verifyUri() {
            return URI.create(baseUrl + "/api/license/verify");
        }
    }

    private final List<Candidate> candidates = new ArrayList<>();

    /**
     * Build the candidate list for a configuration.
     *
     * @throws LicenseConfigurationException if the URL is malformed, uses an unsupported
     *         scheme, or uses plain HTTP to a remote host without the insecure override
     */
    public CandidateServers(LicenseConfig config) throws LicenseConfigurationException {
        String serverUrl = stripTrailingSlash(config.serverUrl());
        URI uri;
        try {
            uri = new URI(serverUrl);
        } catch (URISyntaxException e) {
            throw new LicenseConfigurationException("Malformed license server URL: " + serverUrl, e);
        }

        String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
        if (!scheme.equals("http") && !scheme.equals("https")) {
            throw new LicenseConfigurationException("Unsupported license server scheme: " + scheme);
        }
        if (uri.getHost() == null) {
            throw new LicenseConfigurationException("License server URL has no host: " + serverUrl);
        }

        boolean loopback = isLoopback(uri.getHost());
        if (scheme.equals("http") && !loopback && !config.allowInsecureServer()) {
            throw new LicenseConfigurationException(
                "License server must use HTTPS for remote servers. Set "
                    + LicenseConfig.ENV_ALLOW_INSECURE
                    + "=1 to permit HTTP or use localhost."
            );
        }

        if (scheme.equals("https")) {
            add(new Candidate(serverUrl, config.verifySsl()), false);
            if (loopback && !config.disableHttpFallback()) {
                add(new Candidate(withScheme(uri, "http"), false), true);
            }
        } else {
            add(new Candidate(serverUrl, false), false);
            if (loopback && !config.disableHttpsFallback()) {
                // local HTTPS uses a self-signed certificate
                add(new Candidate(withScheme(uri, "https"), false), false);
            }
        }

        LOG.fine("License server candidates: " + candidates);
    }

    /**
     * Snapshot of the candidates in current priority order.
     */
    public List<Candidate> candidates() {
        return List.copyOf(candidates);
    }

    /**
     * The first candidate in priority order.
     */
    public Candidate primary() {
        return candidates.get(0);
    }

    /**
     * Move a candidate that returned a response to the front of the list.
     */
    public void promote(Candidate candidate) {
        if (candidates.isEmpty() || candidates.get(0).equals(candidate)) {
            return;
        }
        if (candidates.remove(candidate)) {
            candidates.add(0, candidate);
            LOG.fine("Promoted license server candidate " + candidate.baseUrl());
        }
    }

    static boolean isLoopback(String host) {
        if (host == null) {
            return false;
        }
        String normalized = host.toLowerCase(Locale.ROOT);
        if (normalized.startsWith("[") && normalized.endsWith("]")) {
            normalized = normalized.substring(1, normalized.length() - 1);
        }
        return LOOPBACK_HOSTS.contains(normalized);
    }

    private void add(Candidate candidate, boolean priority) {
        for (Candidate existing : candidates) {
            if (existing.baseUrl().equals(candidate.baseUrl())) {
                return;
            }
        }
        if (priority) {
            candidates.add(0, candidate);
        } else {
            candidates.add(candidate);
        }
    }

    private static String withScheme(URI uri, String scheme) {
        String rest = uri.toString().substring(uri.getScheme().length());
        return stripTrailingSlash(scheme + rest);
    }

    private static String stripTrailingSlash(String url) {
        String result = url.strip();
        while (result.endsWith("/")) {
            result = result.substring(0, result.length() - 1);
        }
        return result;
    }

    @Override
    public String toString() {
        return "CandidateServers" + candidates;
    }
}
