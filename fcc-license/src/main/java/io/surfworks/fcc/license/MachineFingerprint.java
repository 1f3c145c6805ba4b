package io.surfworks.fcc.license;

import java.net.InetAddress;
import java.net.NetworkInterface;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.util.ArrayList;
import java.util.Enumeration;
import java.util.HexFormat;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;

/**
 * Generates a stable machine fingerprint for license activation binding.
 *
 * <p>The fingerprint hashes host name, OS family, architecture, OS version, a
 * MAC-derived token and a best-effort hardware UUID. It survives reboots but not a
 * hardware swap or a reimage.
 */
public final class MachineFingerprint {

    private static final Logger LOG = Logger.getLogger(MachineFingerprint.class.getName());

    static final String MAC_UNKNOWN = "mac-unknown";
    static final String UUID_UNKNOWN = "uuid-unknown";

    private static final long PROBE_TIMEOUT_SECONDS = 3;

    private static volatile String cached;

    private MachineFingerprint() {}

    /**
     * Generate the fingerprint for this machine.
     *
     * <p>Computed once per process; later calls return the same value.
     *
     * @return SHA-256 hex digest (64 lowercase characters)
     */
    public static String generate() {
        String fingerprint = cached;
        if (fingerprint == null) {
            synchronized (MachineFingerprint.class) {
                fingerprint = cached;
                if (fingerprint == null) {
                    fingerprint = fromComponents(components());
                    cached = fingerprint;
                }
            }
        }
        return fingerprint;
    }

    /**
     * Hash an explicit list of components the same way {@link #generate()} does.
     *
     * <p>Blank components are skipped.
     */
    static String fromComponents(List<String> components) {
        List<String> present = new ArrayList<>();
        for (String component : components) {
            if (component != null && !component.isEmpty()) {
                present.add(component);
            }
        }
        return sha256Hex(String.join("|", present));
    }

    /**
     * Get a short, human-readable machine name for display.
     */
    public static String getMachineName() {
        String hostname = getHostname();
        String os = System.getProperty("os.name", "Unknown");

        if (os.toLowerCase().contains("mac")) {
            return hostname + " (macOS)";
        } else if (os.toLowerCase().contains("linux")) {
            return hostname + " (Linux)";
        } else {
            return hostname + " (" + os + ")";
        }
    }

    /**
     * Platform description sent to the license server, e.g. {@code Linux-6.8.0-amd64}.
     */
    public static String getPlatform() {
        return System.getProperty("os.name", "Unknown").replace(' ', '_')
            + "-" + System.getProperty("os.version", "unknown")
            + "-" + System.getProperty("os.arch", "unknown");
    }

    /**
     * Get the local host name, or {@code unknown}.
     */
    public static String getHostname() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (Exception e) {
            return "unknown";
        }
    }

    static List<String> components() {
        List<String> components = new ArrayList<>();
        components.add(getHostname());
        components.add(System.getProperty("os.name", ""));
        components.add(System.getProperty("os.arch", ""));
        components.add(System.getProperty("os.version", ""));
        components.add(getNetworkMac());
        components.add(getSystemUuid());
        return components;
    }

    private static String getSystemUuid() {
        String os = System.getProperty("os.name", "").toLowerCase();
        String uuid = null;
        try {
            if (os.contains("mac")) {
                uuid = getMacPlatformUuid();
            } else if (os.contains("linux")) {
                uuid = getLinuxMachineId();
            } else if (os.contains("windows")) {
                uuid = getWindowsProductUuid();
            }
        } catch (Exception e) {
            LOG.fine("System UUID probe failed: " + e.getMessage());
        }
        return uuid == null || uuid.isBlank() ? UUID_UNKNOWN : uuid;
    }

    private static String getMacPlatformUuid() throws Exception {
        for (String line : runProbe("ioreg", "-rd1", "-c", "IOPlatformExpertDevice")) {
            if (line.contains("IOPlatformUUID")) {
                int start = line.indexOf("\"", line.indexOf("=")) + 1;
                int end = line.lastIndexOf("\"");
                if (start > 0 && end > start) {
                    return line.substring(start, end);
                }
            }
        }
        return null;
    }

    private static String getWindowsProductUuid() throws Exception {
        for (String line : runProbe("wmic", "csproduct", "get", "uuid")) {
            String trimmed = line.trim();
            if (!trimmed.isEmpty() && !trimmed.contains("UUID")) {
                return trimmed;
            }
        }
        return null;
    }

    private static String getLinuxMachineId() {
        // DMI product UUID is root-only on many distributions
        for (String candidate : List.of("/sys/class/dmi/id/product_uuid", "/etc/machine-id")) {
            try {
                Path path = Path.of(candidate);
                if (Files.isReadable(path)) {
                    String value = Files.readString(path).trim();
                    if (!value.isEmpty()) {
                        return value;
                    }
                }
            } catch (Exception e) {
                LOG.fine("Cannot read " + candidate + ": " + e.getMessage());
            }
        }
        return null;
    }

    private static List<String> runProbe(String... command) throws Exception {
        return runProbe(PROBE_TIMEOUT_SECONDS, command);
    }

    /**
     * Run a command and return its output lines, or nothing if it does not finish in time.
     * Output goes to a temporary file so a hung process cannot block the reader.
     */
    static List<String> runProbe(long timeoutSeconds, String... command) throws Exception {
        Path output = Files.createTempFile("fcc-probe", ".out");
        try {
            Process p = new ProcessBuilder(command)
                .redirectErrorStream(true)
                .redirectOutput(output.toFile())
                .start();
            if (!p.waitFor(timeoutSeconds, TimeUnit.SECONDS)) {
                p.destroyForcibly();
                LOG.fine("Timed out running " + command[0]);
                return List.of();
            }
            return new String(Files.readAllBytes(output), StandardCharsets.UTF_8).lines().toList();
        } finally {
            Files.deleteIfExists(output);
        }
    }

    private static String getNetworkMac() {
        try {
            Enumeration<NetworkInterface> interfaces = NetworkInterface.getNetworkInterfaces();
            while (interfaces != null && interfaces.hasMoreElements()) {
                NetworkInterface ni = interfaces.nextElement();
                byte[] mac = ni.getHardwareAddress();
                if (mac != null && mac.length > 0 && !ni.isLoopback()) {
                    return HexFormat.of().formatHex(mac);
                }
            }
        } catch (Exception e) {
            LOG.fine("Cannot enumerate network interfaces: " + e.getMessage());
        }
        return MAC_UNKNOWN;
    }

    static String sha256Hex(String input) {
        return HexFormat.of().formatHex(sha256(input.getBytes(StandardCharsets.UTF_8)));
    }

    static byte[] sha256(byte[] input) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(input);
        } catch (Exception e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
