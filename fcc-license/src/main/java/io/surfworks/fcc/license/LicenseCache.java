package io.surfworks.fcc.license;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFilePermissions;
import java.time.Clock;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Caches the verified license locally for offline use.
 *
 * <p>Stores the encrypted envelope in {@code <dataDir>/license.json}. A cache that is
 * unreadable, tampered with, bound to another machine or expired is reported as
 * absent, never as an error.
 *
 * <p>Writes go to a temporary file in the same directory which is then moved over the
 * target, so readers never see a partial file. Concurrent writers from different
 * processes are not serialized; the last one wins.
 */
public class LicenseCache {

    private static final Logger LOG = Logger.getLogger(LicenseCache.class.getName());

    static final String LICENSE_FILE = "license.json";
    private static final String TEMP_SUFFIX = ".tmp";

    private final Path dataDir;
    private final Path licenseFile;
    private final String machineFingerprint;
    private final CacheCodec codec;
    private final Clock clock;

    public LicenseCache(Path dataDir, String machineFingerprint) {
        this(dataDir, machineFingerprint, Clock.systemUTC());
    }

    public LicenseCache(Path dataDir, String machineFingerprint, Clock clock) {
        this.dataDir = dataDir;
        this.licenseFile = dataDir.resolve(LICENSE_FILE);
        this.machineFingerprint = machineFingerprint;
        this.codec = new CacheCodec(machineFingerprint);
        this.clock = clock;
    }

    /**
     * Load the cached license if it is bound to this machine and not expired.
     */
    public Optional<LicensePayload> load() {
        if (!Files.exists(licenseFile)) {
            return Optional.empty();
        }

        LicensePayload payload;
        try {
            payload = codec.decode(Files.readString(licenseFile, StandardCharsets.UTF_8));
        } catch (IOException | CacheCodec.InvalidCacheException e) {
            LOG.warning("Existing license cache is invalid and will be ignored: " + e.getMessage());
            return Optional.empty();
        }

        if (!payload.isBoundTo(machineFingerprint)) {
            LOG.warning("Cached license belongs to a different machine; ignoring it.");
            return Optional.empty();
        }
        if (payload.isExpired(clock.instant())) {
            LOG.info("Cached license expired; re-verification required.");
            return Optional.empty();
        }
        return Optional.of(payload);
    }

    /**
     * Save a license to the cache, replacing any previous entry.
     *
     * <p>Best effort: failures are logged, not thrown.
     */
    public void save(LicensePayload license) {
        Path tempFile = null;
        try {
            Files.createDirectories(dataDir);
            // unique per writer
            tempFile = Files.createTempFile(dataDir, LICENSE_FILE, TEMP_SUFFIX);
            Files.writeString(tempFile, codec.encode(license), StandardCharsets.UTF_8);
            restrictPermissions(tempFile);
            try {
                Files.move(tempFile, licenseFile,
                    StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tempFile, licenseFile, StandardCopyOption.REPLACE_EXISTING);
            }
            LOG.fine("License cache written to " + licenseFile);
        } catch (IOException e) {
            LOG.warning("Failed to persist license cache: " + e.getMessage());
            if (tempFile != null) {
                deleteQuietly(tempFile);
            }
        }
    }

    /**
     * Delete the cached license.
     */
    public void clear() {
        try {
            Files.deleteIfExists(licenseFile);
        } catch (IOException e) {
            LOG.warning("Failed to delete cached license: " + e.getMessage());
        }
    }

    /**
     * Check if a cache file exists, valid or not.
     */
    public boolean exists() {
        return Files.exists(licenseFile);
    }

    public Path path() {
        return licenseFile;
    }

    private static void restrictPermissions(Path file) {
        try {
            Files.setPosixFilePermissions(file, PosixFilePermissions.fromString("rw-------"));
        } catch (UnsupportedOperationException e) {
            // not a POSIX file system; rely on the per-user data directory
            file.toFile().setReadable(false, false);
            file.toFile().setReadable(true, true);
            file.toFile().setWritable(true, true);
        } catch (IOException e) {
            LOG.fine("Cannot restrict permissions on " + file + ": " + e.getMessage());
        }
    }

    private static void deleteQuietly(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            LOG.fine("Cannot delete " + file + ": " + e.getMessage());
        }
    }
}
