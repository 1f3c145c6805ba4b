package io.surfworks.fcc.license;

import java.util.Map;

/**
 * Normalized outcome of one verification round trip.
 *
 * @param ok            whether the server accepted the license
 * @param license       fields of the server's {@code license} object on success, empty otherwise
 * @param error         the wire error code on failure (may be a code this client does not know)
 * @param candidateUrl  base URL of the candidate that answered, null if none did
 */
public record VerificationResult(
    boolean ok,
    Map<String, Object> license,
    String error,
    String candidateUrl
) {

    public VerificationResult {
        license = license == null ? Map.of() : Map.copyOf(license);
    }

    public static VerificationResult success(Map<String, Object> license, String candidateUrl) {
        return new VerificationResult(true, license, null, candidateUrl);
    }

    public static VerificationResult failure(String error, String candidateUrl) {
        return new VerificationResult(false, Map.of(), error, candidateUrl);
    }

    public static VerificationResult failure(ErrorCode code) {
        return new VerificationResult(false, Map.of(), code.wireCode(), null);
    }

    /**
     * The error kind, {@link ErrorCode#UNKNOWN} for unrecognized codes.
     */
    public ErrorCode errorCode() {
        return ok ? null : ErrorCode.fromWireCode(error);
    }
}
