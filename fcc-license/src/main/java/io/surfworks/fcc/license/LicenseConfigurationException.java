package io.surfworks.fcc.license;

/**
 * Thrown when the license server configuration cannot be used.
 *
 * <p>This is fatal: no {@link LicenseManager} is created when it is raised.
 */
public class LicenseConfigurationException extends Exception {

    public LicenseConfigurationException(String message) {
        super(message);
    }

    public LicenseConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Always {@link ErrorCode#CONFIGURATION_ERROR}.
     */
    public ErrorCode errorCode() {
        return ErrorCode.CONFIGURATION_ERROR;
    }
}
