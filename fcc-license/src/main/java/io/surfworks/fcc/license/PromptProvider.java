package io.surfworks.fcc.license;

import java.util.Optional;
import java.util.logging.Logger;

/**
 * Collects a license key and email from the user.
 *
 * <p>The manager does not care how: a console prompt, a dialog, or nothing at all.
 */
@FunctionalInterface
public interface PromptProvider {

    /**
     * Key and email entered by the user.
     *
     * @param licenseKey the license key, never blank
     * @param email      registered email, may be empty
     */
    record Credentials(String licenseKey, String email) {

        public Credentials {
            if (licenseKey == null || licenseKey.isBlank()) {
                throw new IllegalArgumentException("licenseKey cannot be blank");
            }
            email = email == null ? "" : email;
        }
    }

    /**
     * Ask for credentials.
     *
     * @param defaultEmail email to offer as the default (may be null)
     * @return the credentials, or empty if the user cancelled or no one can be asked
     */
    Optional<Credentials> prompt(String defaultEmail);

    /**
     * Show a verification failure to the user. Logs it by default.
     */
    default void showError(String message) {
        Logger.getLogger(PromptProvider.class.getName()).warning(message);
    }

    /**
     * A provider that never yields credentials, for unattended runs.
     */
    static PromptProvider none() {
        return defaultEmail -> Optional.empty();
    }
}
