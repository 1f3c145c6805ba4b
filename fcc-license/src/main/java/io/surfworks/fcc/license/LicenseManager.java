package io.surfworks.fcc.license;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Main entry point for license verification.
 *
 * <p>Usage:
 * <pre>{@code
 * LicenseManager license = new LicenseManager(LicenseConfig.load(), new ConsolePromptProvider());
 *
 * Optional<LicensePayload> payload = license.ensureValidLicense(VerifyOptions.defaults());
 * if (payload.isEmpty()) {
 *     System.exit(1);
 * }
 * }</pre>
 *
 * <p>Flow: the cached key (if any) is verified first; otherwise the prompt provider is
 * asked. A success is cached, published through {@link LicenseEnvironment} and
 * returned. When the server cannot be reached, or answers with something unreadable,
 * a cached license for the same key that is still valid is returned in offline mode.
 * Any other failure is shown to the user, who is prompted again, up to
 * {@value #MAX_ATTEMPTS} attempts.
 */
public class LicenseManager {

    private static final Logger LOG = Logger.getLogger(LicenseManager.class.getName());

    /** Verification attempts before giving up. */
    public static final int MAX_ATTEMPTS = 3;

    static final String VERIFICATION_REQUIRED = "License verification is required to continue.";

    private final LicenseConfig config;
    private final PromptProvider prompt;
    private final String machineFingerprint;
    private final CandidateServers servers;
    private final VerificationClient client;
    private final LicenseCache cache;
    private final LicenseEnvironment environment;
    private final Clock clock;

    private LicensePayload current;

    /**
     * Create a manager that talks HTTP to the configured server and publishes to the
     * JVM system properties.
     *
     * @throws LicenseConfigurationException if the server URL is not acceptable
     */
    public LicenseManager(LicenseConfig config, PromptProvider prompt) throws LicenseConfigurationException {
        this(config, prompt, new HttpLicenseTransport(), MachineFingerprint.generate(),
            LicenseEnvironment.process(), Clock.systemUTC());
    }

    /**
     * Create a manager with explicit collaborators.
     *
     * @throws LicenseConfigurationException if the server URL is not acceptable
     */
    public LicenseManager(
            LicenseConfig config,
            PromptProvider prompt,
            LicenseTransport transport,
            String machineFingerprint,
            LicenseEnvironment environment,
            Clock clock) throws LicenseConfigurationException {
        this.config = config;
        this.prompt = prompt;
        this.machineFingerprint = machineFingerprint;
        this.servers = new CandidateServers(config);
        this.client = new VerificationClient(servers, transport);
        this.cache = new LicenseCache(config.dataDir(), machineFingerprint, clock);
        this.environment = environment;
        this.clock = clock;
    }

    /**
     * Make sure this installation holds a verified license.
     *
     * @param options how to treat the cache and the user
     * @return the verified (or offline-accepted) license, or empty if verification failed
     */
    public Optional<LicensePayload> ensureValidLicense(VerifyOptions options) {
        if (current != null && !options.forcePrompt() && !options.skipCache()) {
            return Optional.of(current);
        }

        LicensePayload cached = options.forcePrompt() || options.skipCache()
            ? null
            : cache.load().orElse(null);
        String email = cached != null ? cached.email() : null;
        String licenseKey = cached != null ? cached.licenseKey() : null;

        if (!options.persistCache()) {
            cache.clear();
        }

        int attempts = 0;
        while (attempts < MAX_ATTEMPTS) {
            if (licenseKey == null || licenseKey.isBlank()) {
                Optional<PromptProvider.Credentials> credentials = prompt.prompt(email);
                if (credentials.isEmpty()) {
                    LOG.info("No license key provided; verification aborted.");
                    if (!options.quiet()) {
                        prompt.showError(VERIFICATION_REQUIRED);
                    }
                    return Optional.empty();
                }
                licenseKey = credentials.get().licenseKey();
                email = credentials.get().email();
            }

            VerificationResult result = client.verify(new VerificationClient.Request(
                licenseKey,
                machineFingerprint,
                email == null || email.isEmpty() ? null : email,
                MachineFingerprint.getHostname(),
                MachineFingerprint.getPlatform(),
                config.appVersion()
            ));

            if (result.ok()) {
                return Optional.of(accept(result, licenseKey, email, options));
            }

            ErrorCode error = result.errorCode();
            if (cached != null
                    && licenseKey.equals(cached.licenseKey())
                    && cached.isReusable(machineFingerprint, clock.instant())
                    && error.allowsOfflineFallback()) {
                LicensePayload offline = cached.withOfflineMode(true);
                environment.apply(offline, machineFingerprint);
                current = offline;
                LOG.warning("License server unreachable; proceeding in offline mode with cached activation.");
                return Optional.of(offline);
            }

            attempts++;
            LOG.info("License verification failed: " + result.error()
                + " (attempt " + attempts + "/" + MAX_ATTEMPTS + ")");
            if (!options.quiet()) {
                prompt.showError(ErrorCode.humanize(result.error()));
            }
            licenseKey = null;
        }

        LOG.warning("License verification failed after " + MAX_ATTEMPTS + " attempts.");
        return Optional.empty();
    }

    /**
     * The cached license, if it is valid for this machine. No network access.
     */
    public Optional<LicensePayload> loadCachedLicense() {
        return cache.load();
    }

    /**
     * Delete the cached license.
     */
    public void clearCachedLicense() {
        cache.clear();
    }

    public String getMachineFingerprint() {
        return machineFingerprint;
    }

    public CandidateServers getCandidateServers() {
        return servers;
    }

    public LicenseCache getCache() {
        return cache;
    }

    private LicensePayload accept(VerificationResult result, String licenseKey, String email, VerifyOptions options) {
        Instant now = clock.instant();
        LicensePayload payload = LicensePayload.fromServer(
            result.license(),
            licenseKey,
            email,
            machineFingerprint,
            now,
            now.plus(Duration.ofHours(config.cacheMaxHours()))
        );

        if (options.persistCache()) {
            cache.save(payload);
        } else {
            cache.clear();
        }
        environment.apply(payload, machineFingerprint);
        current = payload;

        LOG.info("License verified (" + payload.maskedKey() + ") [activation "
            + payload.activationCount() + "/" + payload.maxActivations() + "]");
        return payload;
    }
}
