package io.surfworks.fcc.license;

import java.util.Optional;
import java.util.Properties;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Logger;

/**
 * Publishes the first verified license to the rest of the process, exactly once.
 *
 * <p>The first {@link #apply(LicensePayload, String)} wins; later payloads are ignored.
 * On that first call these properties are set unless already present:
 * <ul>
 *   <li>{@code fcc.license.key}</li>
 *   <li>{@code fcc.license.email} (when known)</li>
 *   <li>{@code fcc.license.client} (when known)</li>
 *   <li>{@code fcc.license.tag}: {@code <client or unknown>::<masked key>}</li>
 *   <li>{@code fcc.license.signature}: SHA-256 of {@code key|fingerprint|client}</li>
 * </ul>
 */
public final class LicenseEnvironment {

    private static final Logger LOG = Logger.getLogger(LicenseEnvironment.class.getName());

    public static final String PROP_KEY = "fcc.license.key";
    public static final String PROP_EMAIL = "fcc.license.email";
    public static final String PROP_CLIENT = "fcc.license.client";
    public static final String PROP_TAG = "fcc.license.tag";
    public static final String PROP_SIGNATURE = "fcc.license.signature";

    private static final LicenseEnvironment PROCESS = new LicenseEnvironment(System.getProperties());

    private final AtomicReference<LicensePayload> applied = new AtomicReference<>();
    private final Properties target;

    /**
     * Create an environment publishing into the given properties.
     */
    public LicenseEnvironment(Properties target) {
        this.target = target;
    }

    /**
     * The environment backed by the JVM system properties.
     */
    public static LicenseEnvironment process() {
        return PROCESS;
    }

    /**
     * Apply a payload if none has been applied yet.
     *
     * @param payload            the verified license
     * @param machineFingerprint fingerprint used in the signature
     * @return true if this call applied the payload
     */
    public boolean apply(LicensePayload payload, String machineFingerprint) {
        if (payload == null || !applied.compareAndSet(null, payload)) {
            return false;
        }

        String key = payload.licenseKey() == null ? "" : payload.licenseKey();
        String client = payload.clientName() == null ? "" : payload.clientName();

        setDefault(PROP_KEY, key);
        if (payload.email() != null && !payload.email().isEmpty()) {
            setDefault(PROP_EMAIL, payload.email());
        }
        if (!client.isEmpty()) {
            setDefault(PROP_CLIENT, client);
        }
        setDefault(PROP_TAG, (client.isEmpty() ? "unknown" : client) + "::" + payload.maskedKey());
        setDefault(PROP_SIGNATURE, MachineFingerprint.sha256Hex(key + "|" + machineFingerprint + "|" + client));

        LOG.fine("License " + payload.maskedKey() + " applied to process environment");
        return true;
    }

    /**
     * The payload applied first, if any.
     */
    public Optional<LicensePayload> applied() {
        return Optional.ofNullable(applied.get());
    }

    public String property(String name) {
        return target.getProperty(name);
    }

    private void setDefault(String name, String value) {
        synchronized (target) {
            if (target.getProperty(name) == null) {
                target.setProperty(name, value);
            }
        }
    }
}
