package io.surfworks.fcc.license;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Trusted result of a successful (or accepted-offline) verification.
 *
 * @param licenseKey         the license key (use {@link #maskedKey()} for display)
 * @param email              registered email (may be null)
 * @param clientName         licensed client name (may be null)
 * @param activationCount    devices currently bound to the key, as reported by the server
 * @param maxActivations     activation limit, as reported by the server
 * @param machineFingerprint fingerprint of the device this payload is bound to
 * @param verifiedAt         last successful server contact
 * @param cacheExpiresAt     after this instant the payload is not trusted, even offline
 * @param offlineMode        true when accepted from cache without a fresh server contact
 * @param serverFields       other fields returned by the server, carried through untouched
 */
public record LicensePayload(
    String licenseKey,
    String email,
    String clientName,
    int activationCount,
    int maxActivations,
    String machineFingerprint,
    Instant verifiedAt,
    Instant cacheExpiresAt,
    boolean offlineMode,
    Map<String, Object> serverFields
) {

    /** JSON names of the fields modeled explicitly; everything else is a server field. */
    public static final Set<String> FIELD_NAMES = Set.of(
        "license_key", "email", "client_name", "activation_count", "max_activations",
        "machine_fingerprint", "verified_at", "cache_expires_at", "offline_mode"
    );

    public LicensePayload {
        serverFields = serverFields == null ? Map.of() : Map.copyOf(serverFields);
    }

    /**
     * Build a fresh payload from the server's {@code license} object.
     *
     * @param license            fields returned by the server
     * @param licenseKey         the key that was verified
     * @param email              email supplied by the user; the server's is used when blank
     * @param machineFingerprint this machine's fingerprint
     * @param verifiedAt         time of the successful round trip
     * @param cacheExpiresAt     end of the cache lifetime
     */
    public static LicensePayload fromServer(
            Map<String, Object> license,
            String licenseKey,
            String email,
            String machineFingerprint,
            Instant verifiedAt,
            Instant cacheExpiresAt) {
        Map<String, Object> extra = new LinkedHashMap<>(license);
        extra.keySet().removeAll(FIELD_NAMES);

        String resolvedEmail = email != null && !email.isBlank() ? email : asString(license.get("email"));
        return new LicensePayload(
            licenseKey,
            resolvedEmail,
            asString(license.get("client_name")),
            asInt(license.get("activation_count")),
            asInt(license.get("max_activations")),
            machineFingerprint,
            verifiedAt,
            cacheExpiresAt,
            false,
            extra
        );
    }

    /**
     * Whether the cache lifetime has run out. A payload without an expiry is expired.
     */
    public boolean isExpired(Instant now) {
        return cacheExpiresAt == null || !now.isBefore(cacheExpiresAt);
    }

    public boolean isBoundTo(String fingerprint) {
        return machineFingerprint != null && machineFingerprint.equals(fingerprint);
    }

    /**
     * Trustworthy for reuse: bound to this device and not expired.
     */
    public boolean isReusable(String fingerprint, Instant now) {
        return isBoundTo(fingerprint) && !isExpired(now);
    }

    public LicensePayload withOfflineMode(boolean offline) {
        return new LicensePayload(
            licenseKey, email, clientName, activationCount, maxActivations,
            machineFingerprint, verifiedAt, cacheExpiresAt, offline, serverFields
        );
    }

    /**
     * Masked key for display, e.g. {@code ABCD12…WXYZ}.
     */
    public String maskedKey() {
        return mask(licenseKey);
    }

    /**
     * Mask a license key: dashes removed, short keys shown as-is, long keys reduced
     * to the first six and last four characters.
     */
    public static String mask(String licenseKey) {
        if (licenseKey == null || licenseKey.isEmpty()) {
            return "unknown";
        }
        String key = licenseKey.replace("-", "");
        if (key.length() <= 8) {
            return key;
        }
        return key.substring(0, 6) + "…" + key.substring(key.length() - 4);
    }

    private static String asString(Object value) {
        return value == null ? null : value.toString();
    }

    private static int asInt(Object value) {
        if (value instanceof Number number) {
            return number.intValue();
        }
        if (value instanceof String text) {
            try {
                return Integer.parseInt(text.strip());
            } catch (NumberFormatException e) {
                return 0;
            }
        }
        return 0;
    }
}
