package io.surfworks.fcc.license.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.surfworks.fcc.license.ConsolePromptProvider;
import io.surfworks.fcc.license.LicenseConfig;
import io.surfworks.fcc.license.LicenseConfigurationException;
import io.surfworks.fcc.license.LicenseManager;
import io.surfworks.fcc.license.LicensePayload;
import io.surfworks.fcc.license.MachineFingerprint;
import io.surfworks.fcc.license.PromptProvider;
import io.surfworks.fcc.license.VerifyOptions;

import java.io.IOException;
import java.io.PrintStream;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * FCC license command line tool.
 *
 * <p>Commands:
 * <ul>
 *   <li>verify - Verify the license, prompting when needed (default)</li>
 *   <li>status - Show the cached license</li>
 *   <li>fingerprint - Print this machine's fingerprint</li>
 * </ul>
 *
 * <p>Exit codes: 0 verified, 1 verification failed, 2 bad arguments,
 * 3 invalid license server configuration.
 */
public class LicenseCli {

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_USAGE = 2;
    static final int EXIT_CONFIG = 3;

    private static final String VERSION = "0.1.0";
    private static final ObjectMapper JSON = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);
    private static final DateTimeFormatter TIME_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss").withZone(ZoneId.systemDefault());

    private static final Set<String> VERIFY_FLAGS = Set.of(
            "--verify", "--force", "--quiet", "--no-cache", "--no-persist", "--stateless", "--verbose");
    private static final Set<String> STATUS_FLAGS = Set.of("--json", "--verbose");

    // held so the level survives logger garbage collection
    private static final Logger FCC_LOGGER = Logger.getLogger("io.surfworks.fcc");

    /**
     * Creates the manager; replaced in tests.
     */
    @FunctionalInterface
    interface ManagerFactory {
        LicenseManager create(LicenseConfig config, PromptProvider prompt) throws LicenseConfigurationException;
    }

    private final Supplier<LicenseConfig> configSupplier;
    private final ManagerFactory managerFactory;
    private final Supplier<PromptProvider> interactivePrompt;
    private final PrintStream out;
    private final PrintStream err;

    LicenseCli(Supplier<LicenseConfig> configSupplier,
               ManagerFactory managerFactory,
               Supplier<PromptProvider> interactivePrompt,
               PrintStream out,
               PrintStream err) {
        this.configSupplier = configSupplier;
        this.managerFactory = managerFactory;
        this.interactivePrompt = interactivePrompt;
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        LicenseCli cli = new LicenseCli(
                LicenseConfig::load,
                LicenseManager::new,
                ConsolePromptProvider::new,
                System.out,
                System.err);
        System.exit(cli.run(args));
    }

    int run(String[] args) {
        String command = args.length == 0 || args[0].startsWith("--") ? "verify" : args[0];
        String[] commandArgs = args.length > 0 && !args[0].startsWith("--")
                ? Arrays.copyOfRange(args, 1, args.length)
                : args;

        if (hasFlag(args, "--help") || hasFlag(args, "-h")) {
            printHelp();
            return EXIT_OK;
        }
        if (hasFlag(args, "--version") || hasFlag(args, "-v")) {
            out.println("fcc-license " + VERSION);
            return EXIT_OK;
        }
        if (hasFlag(commandArgs, "--verbose")) {
            enableVerboseLogging();
        }

        try {
            return switch (command) {
                case "verify" -> handleVerify(commandArgs);
                case "status" -> handleStatus(commandArgs);
                case "fingerprint" -> handleFingerprint(commandArgs);
                default -> {
                    err.println("Unknown command: " + command);
                    err.println("Run 'fcc-license --help' for usage.");
                    yield EXIT_USAGE;
                }
            };
        } catch (LicenseConfigurationException e) {
            err.println("Configuration error: " + e.getMessage());
            return EXIT_CONFIG;
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            return EXIT_USAGE;
        } catch (IOException e) {
            err.println("I/O error: " + e.getMessage());
            return EXIT_FAILED;
        }
    }

    private int handleVerify(String[] args) throws LicenseConfigurationException {
        requireKnownFlags(args, VERIFY_FLAGS);

        boolean stateless = hasFlag(args, "--stateless");
        boolean quiet = hasFlag(args, "--quiet");
        boolean noCache = stateless || hasFlag(args, "--no-cache");
        boolean noPersist = stateless || hasFlag(args, "--no-persist");

        VerifyOptions options = new VerifyOptions(
                hasFlag(args, "--force") || noCache,
                quiet,
                noCache,
                !noPersist);

        PromptProvider prompt = quiet ? PromptProvider.none() : interactivePrompt.get();
        LicenseManager manager = managerFactory.create(configSupplier.get(), prompt);

        Optional<LicensePayload> payload = manager.ensureValidLicense(options);
        if (payload.isEmpty()) {
            if (!quiet) {
                err.println("License verification failed. Contact " + LicenseConfig.SUPPORT_EMAIL
                        + " if the problem persists.");
            }
            return EXIT_FAILED;
        }

        LicensePayload license = payload.get();
        if (!quiet) {
            out.println("License verified: " + license.maskedKey()
                    + (license.offlineMode() ? " (offline mode)" : ""));
        }
        return EXIT_OK;
    }

    private int handleStatus(String[] args) throws LicenseConfigurationException, IOException {
        requireKnownFlags(args, STATUS_FLAGS);
        boolean json = hasFlag(args, "--json");

        LicenseManager manager = managerFactory.create(configSupplier.get(), PromptProvider.none());
        Optional<LicensePayload> cached = manager.loadCachedLicense();

        if (json) {
            ObjectNode root = JSON.createObjectNode();
            root.put("licensed", cached.isPresent());
            root.put("cacheFile", manager.getCache().path().toString());
            cached.ifPresent(license -> {
                ObjectNode node = root.putObject("license");
                node.put("key", license.maskedKey());
                node.put("email", license.email());
                node.put("clientName", license.clientName());
                node.put("activationCount", license.activationCount());
                node.put("maxActivations", license.maxActivations());
                node.put("verifiedAt", toIso(license.verifiedAt()));
                node.put("cacheExpiresAt", toIso(license.cacheExpiresAt()));
            });
            out.println(JSON.writeValueAsString(root));
            return cached.isPresent() ? EXIT_OK : EXIT_FAILED;
        }

        if (cached.isEmpty()) {
            out.println("No valid cached license (" + manager.getCache().path() + ")");
            return EXIT_FAILED;
        }

        LicensePayload license = cached.get();
        out.println("License:      " + license.maskedKey());
        if (license.clientName() != null) {
            out.println("Client:       " + license.clientName());
        }
        if (license.email() != null && !license.email().isEmpty()) {
            out.println("Email:        " + license.email());
        }
        out.println("Activations:  " + license.activationCount() + "/" + license.maxActivations());
        out.println("Verified:     " + formatTime(license.verifiedAt()));
        out.println("Expires:      " + formatTime(license.cacheExpiresAt()));
        return EXIT_OK;
    }

    private int handleFingerprint(String[] args) {
        requireKnownFlags(args, Set.of("--verbose"));
        out.println(MachineFingerprint.generate());
        out.println(MachineFingerprint.getMachineName());
        return EXIT_OK;
    }

    private static void enableVerboseLogging() {
        FCC_LOGGER.setLevel(Level.FINE);
        for (Handler handler : Logger.getLogger("").getHandlers()) {
            handler.setLevel(Level.FINE);
        }
    }

    private static void requireKnownFlags(String[] args, Set<String> allowed) {
        List<String> unknown = Arrays.stream(args).filter(arg -> !allowed.contains(arg)).toList();
        if (!unknown.isEmpty()) {
            throw new IllegalArgumentException("Unknown option(s): " + String.join(" ", unknown));
        }
    }

    private static boolean hasFlag(String[] args, String flag) {
        for (String arg : args) {
            if (arg.equals(flag)) {
                return true;
            }
        }
        return false;
    }

    private static String formatTime(Instant instant) {
        return instant == null ? "-" : TIME_FORMAT.format(instant);
    }

    private static String toIso(Instant instant) {
        return instant == null ? null : instant.toString();
    }

    private void printHelp() {
        out.println("""
            fcc-license - Financial Command Center license verification

            Usage: fcc-license [command] [options]

            Commands:
              verify        Verify the license, prompting when needed (default)
              status        Show the cached license
              fingerprint   Print this machine's fingerprint

            Verify options:
              --force       Prompt for a license even if a cached activation exists
              --quiet       Never prompt; fail when verification needs input
              --no-cache    Ignore the cached activation and verify online
              --no-persist  Do not write the verified license to the cache
              --stateless   Shortcut for --no-cache --no-persist

            Status options:
              --json        Print the cached license as JSON

            Global options:
              --verbose     Show detailed logging
              --help, -h    Show this help
              --version, -v Show version

            Exit codes: 0 verified, 1 verification failed, 2 bad arguments,
                        3 invalid license server configuration
            """);
    }
}
