package io.surfworks.fcc.license;

/**
 * Options for {@link LicenseManager#ensureValidLicense(VerifyOptions)}.
 *
 * @param forcePrompt  ignore the cached key and prompt again
 * @param quiet        do not show error messages to the user
 * @param skipCache    neither read the cache nor fall back to it
 * @param persistCache write the verified license to the cache; when false the cache is deleted
 */
public record VerifyOptions(
    boolean forcePrompt,
    boolean quiet,
    boolean skipCache,
    boolean persistCache
) {

    /**
     * Use and refresh the cache, prompt only when needed.
     */
    public static VerifyOptions defaults() {
        return new VerifyOptions(false, false, false, true);
    }

    /**
     * Fresh online verification that leaves nothing on disk.
     */
    public static VerifyOptions stateless() {
        return new VerifyOptions(false, false, true, false);
    }

    public VerifyOptions withForcePrompt(boolean force) {
        return new VerifyOptions(force, quiet, skipCache, persistCache);
    }

    public VerifyOptions withQuiet(boolean q) {
        return new VerifyOptions(forcePrompt, q, skipCache, persistCache);
    }

    public VerifyOptions withSkipCache(boolean skip) {
        return new VerifyOptions(forcePrompt, quiet, skip, persistCache);
    }

    public VerifyOptions withPersistCache(boolean persist) {
        return new VerifyOptions(forcePrompt, quiet, skipCache, persist);
    }
}
