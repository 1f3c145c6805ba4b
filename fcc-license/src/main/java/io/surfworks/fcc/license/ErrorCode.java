package io.surfworks.fcc.license;

/**
 * Error kinds reported by the license server or raised locally during verification.
 *
 * <p>Each kind carries its wire code (as sent in {@code {"ok": false, "error": ...}})
 * and the message shown to the user when verification fails.
 */
public enum ErrorCode {
    INVALID_LICENSE(
        "invalid_license",
        "The license key you entered is not recognized. Please verify and try again."
    ),
    LICENSE_REVOKED(
        "license_revoked",
        "This license has been revoked. Contact support for assistance."
    ),
    LICENSE_EXPIRED(
        "license_expired",
        "Your license has expired. Contact support to renew your access."
    ),
    EMAIL_MISMATCH(
        "email_mismatch",
        "The license key does not match the provided email address."
    ),
    ACTIVATION_LIMIT_REACHED(
        "activation_limit_reached",
        "This license has reached the maximum number of activations. Contact support to reset it."
    ),
    NETWORK_ERROR(
        "network_error",
        "Could not reach the license server. Check your internet connection and try again."
    ),
    INVALID_SERVER_RESPONSE(
        "invalid_server_response",
        "Received an unexpected response from the license server. Try again later."
    ),
    MISSING_LICENSE_KEY(
        "missing_license_key",
        "License key missing from request."
    ),
    MISSING_MACHINE_FINGERPRINT(
        "missing_machine_fingerprint",
        "Machine fingerprint missing from request."
    ),
    CONFIGURATION_ERROR(
        "configuration_error",
        "The license server configuration is invalid. Contact support for assistance."
    ),
    UNKNOWN(
        "unknown",
        "Unable to verify your license. Please try again or contact support."
    );

    private final String wireCode;
    private final String message;

    ErrorCode(String wireCode, String message) {
        this.wireCode = wireCode;
        this.message = message;
    }

    /**
     * The code as it appears on the wire.
     */
    public String wireCode() {
        return wireCode;
    }

    /**
     * Human-readable message for display.
     */
    public String message() {
        return message;
    }

    /**
     * Whether a cached license may stand in for a failed verification with this error.
     */
    public boolean allowsOfflineFallback() {
        return this == NETWORK_ERROR || this == INVALID_SERVER_RESPONSE;
    }

    /**
     * Look up a kind by wire code.
     *
     * @param wireCode the server-supplied code (may be null)
     * @return the matching kind, or {@link #UNKNOWN}
     */
    public static ErrorCode fromWireCode(String wireCode) {
        if (wireCode == null || wireCode.isBlank()) {
            return UNKNOWN;
        }
        for (ErrorCode code : values()) {
            if (code.wireCode.equals(wireCode)) {
                return code;
            }
        }
        return UNKNOWN;
    }

    /**
     * Translate a raw wire code into the message shown to the user.
     */
    public static String humanize(String wireCode) {
        return fromWireCode(wireCode).message();
    }
}
