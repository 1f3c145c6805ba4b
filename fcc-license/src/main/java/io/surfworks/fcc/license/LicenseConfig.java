package io.surfworks.fcc.license;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Configuration for license verification.
 *
 * <p>Values come from environment variables. A {@code .env} file in the working
 * directory is read first; real environment variables take precedence over it.
 *
 * @param serverUrl            license server base URL
 * @param verifySsl            whether HTTPS candidates verify server certificates
 * @param allowInsecureServer  permit plain HTTP to a non-loopback server
 * @param disableHttpsFallback do not add an HTTPS alternative for an HTTP loopback server
 * @param disableHttpFallback  do not add an HTTP fallback for an HTTPS loopback server
 * @param cacheMaxHours        how long a verified license may be reused from cache
 * @param offlineGraceHours    reserved for a future offline grace window
 * @param appVersion           application version reported to the server (may be null)
 * @param dataDir              directory holding the license cache
 */
public record LicenseConfig(
    String serverUrl,
    boolean verifySsl,
    boolean allowInsecureServer,
    boolean disableHttpsFallback,
    boolean disableHttpFallback,
    int cacheMaxHours,
    int offlineGraceHours,
    String appVersion,
    Path dataDir
) {

    private static final Logger LOG = Logger.getLogger(LicenseConfig.class.getName());

    public static final String ENV_SERVER = "LICENSE_SERVER";
    public static final String ENV_VERIFY_SSL = "LICENSE_VERIFY_SSL";
    public static final String ENV_ALLOW_INSECURE = "ALLOW_INSECURE_LICENSE_SERVER";
    public static final String ENV_DISABLE_HTTPS_FALLBACK = "LICENSE_DISABLE_HTTPS_FALLBACK";
    public static final String ENV_DISABLE_HTTP_FALLBACK = "LICENSE_DISABLE_HTTP_FALLBACK";
    public static final String ENV_CACHE_MAX_HOURS = "LICENSE_CACHE_MAX_HOURS";
    public static final String ENV_OFFLINE_GRACE_HOURS = "LICENSE_OFFLINE_GRACE_HOURS";
    public static final String ENV_APP_VERSION = "APP_VERSION";
    public static final String ENV_DATA_DIR = "FCC_LICENSE_DIR";

    public static final String DEFAULT_SERVER = "https://license.daywinlabs.com";
    public static final int DEFAULT_CACHE_MAX_HOURS = 72;
    public static final int DEFAULT_OFFLINE_GRACE_HOURS = 12;

    /** Support contact shown by the CLI. */
    public static final String SUPPORT_EMAIL = "support@daywinlabs.com";

    private static final Set<String> FALSE_VALUES = Set.of("0", "false", "no");
    private static final Set<String> TRUE_VALUES = Set.of("1", "true", "yes");

    public LicenseConfig {
        Objects.requireNonNull(serverUrl, "serverUrl cannot be null");
        Objects.requireNonNull(dataDir, "dataDir cannot be null");
        if (serverUrl.isBlank()) {
            throw new IllegalArgumentException("serverUrl cannot be blank");
        }
        if (cacheMaxHours < 1) {
            throw new IllegalArgumentException("cacheMaxHours must be at least 1");
        }
        if (offlineGraceHours < 1) {
            throw new IllegalArgumentException("offlineGraceHours must be at least 1");
        }
    }

    /**
     * Defaults for the given server URL.
     */
    public static LicenseConfig forServer(String serverUrl, Path dataDir) {
        return new LicenseConfig(
            serverUrl, true, false, false, false,
            DEFAULT_CACHE_MAX_HOURS, DEFAULT_OFFLINE_GRACE_HOURS, null, dataDir
        );
    }

    /**
     * Load configuration from {@code ./.env} and the process environment.
     */
    public static LicenseConfig load() {
        return load(Path.of(".env"), System.getenv());
    }

    /**
     * Load configuration from a dotenv file overlaid by the given environment.
     *
     * @param dotEnv      dotenv file (ignored when missing or unreadable)
     * @param environment variables that take precedence over the file
     */
    public static LicenseConfig load(Path dotEnv, Map<String, String> environment) {
        Map<String, String> merged = new HashMap<>(readDotEnv(dotEnv));
        merged.putAll(environment);
        return fromEnvironment(merged);
    }

    /**
     * Build configuration from an environment-style map.
     */
    public static LicenseConfig fromEnvironment(Map<String, String> env) {
        String server = env.getOrDefault(ENV_SERVER, DEFAULT_SERVER).strip();
        while (server.endsWith("/")) {
            server = server.substring(0, server.length() - 1);
        }
        if (server.isEmpty()) {
            server = DEFAULT_SERVER;
        }

        String verify = env.getOrDefault(ENV_VERIFY_SSL, "true").strip().toLowerCase();
        String version = env.get(ENV_APP_VERSION);
        String dir = env.get(ENV_DATA_DIR);

        return new LicenseConfig(
            server,
            !FALSE_VALUES.contains(verify),
            isTrue(env.get(ENV_ALLOW_INSECURE)),
            isTrue(env.get(ENV_DISABLE_HTTPS_FALLBACK)),
            isTrue(env.get(ENV_DISABLE_HTTP_FALLBACK)),
            parseHours(env.get(ENV_CACHE_MAX_HOURS), DEFAULT_CACHE_MAX_HOURS),
            parseHours(env.get(ENV_OFFLINE_GRACE_HOURS), DEFAULT_OFFLINE_GRACE_HOURS),
            version == null || version.isBlank() ? null : version.strip(),
            dir == null || dir.isBlank() ? defaultDataDir(env) : Path.of(dir.strip())
        );
    }

    /**
     * Per-user application data directory.
     *
     * <p>{@code %APPDATA%\Financial Command Center} on Windows,
     * {@code ~/.local/share/financial-command-center} elsewhere.
     */
    public static Path defaultDataDir(Map<String, String> env) {
        String home = System.getProperty("user.home");
        String os = System.getProperty("os.name", "").toLowerCase();
        if (os.contains("windows")) {
            String appData = env.get("APPDATA");
            Path base = appData == null || appData.isBlank()
                ? Path.of(home, "AppData", "Roaming")
                : Path.of(appData);
            return base.resolve("Financial Command Center");
        }
        return Path.of(home, ".local", "share", "financial-command-center");
    }

    public LicenseConfig withAllowInsecureServer(boolean allow) {
        return new LicenseConfig(serverUrl, verifySsl, allow, disableHttpsFallback,
            disableHttpFallback, cacheMaxHours, offlineGraceHours, appVersion, dataDir);
    }

    public LicenseConfig withDisableHttpsFallback(boolean disable) {
        return new LicenseConfig(serverUrl, verifySsl, allowInsecureServer, disable,
            disableHttpFallback, cacheMaxHours, offlineGraceHours, appVersion, dataDir);
    }

    public LicenseConfig withDisableHttpFallback(boolean disable) {
        return new LicenseConfig(serverUrl, verifySsl, allowInsecureServer, disableHttpsFallback,
            disable, cacheMaxHours, offlineGraceHours, appVersion, dataDir);
    }

    public LicenseConfig withCacheMaxHours(int hours) {
        return new LicenseConfig(serverUrl, verifySsl, allowInsecureServer, disableHttpsFallback,
            disableHttpFallback, hours, offlineGraceHours, appVersion, dataDir);
    }

    public LicenseConfig withAppVersion(String version) {
        return new LicenseConfig(serverUrl, verifySsl, allowInsecureServer, disableHttpsFallback,
            disableHttpFallback, cacheMaxHours, offlineGraceHours, version, dataDir);
    }

    static Map<String, String> readDotEnv(Path file) {
        Map<String, String> values = new HashMap<>();
        if (file == null || !Files.isRegularFile(file)) {
            return values;
        }
        List<String> lines;
        try {
            lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            LOG.warning("Cannot read " + file + ": " + e.getMessage());
            return values;
        }
        for (String raw : lines) {
            String line = raw.strip();
            int eq = line.indexOf('=');
            if (line.startsWith("#") || eq < 0) {
                continue;
            }
            String key = line.substring(0, eq).strip();
            String value = stripQuotes(line.substring(eq + 1).strip());
            if (!key.isEmpty()) {
                values.putIfAbsent(key, value);
            }
        }
        return values;
    }

    private static String stripQuotes(String value) {
        int start = 0;
        int end = value.length();
        while (start < end && (value.charAt(start) == '"' || value.charAt(start) == '\'')) {
            start++;
        }
        while (end > start && (value.charAt(end - 1) == '"' || value.charAt(end - 1) == '\'')) {
            end--;
        }
        return value.substring(start, end);
    }

    private static boolean isTrue(String value) {
        return value != null && TRUE_VALUES.contains(value.strip().toLowerCase());
    }

    private static int parseHours(String value, int fallback) {
        if (value == null || value.isBlank()) {
            return fallback;
        }
        try {
            return Math.max(1, Integer.parseInt(value.strip()));
        } catch (NumberFormatException e) {
            LOG.warning("Ignoring malformed hour value '" + value + "', using " + fallback);
            return fallback;
        }
    }
}
