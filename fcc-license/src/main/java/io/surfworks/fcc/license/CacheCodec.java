package io.surfworks.fcc.license;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;
import com.google.gson.ToNumberPolicy;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Base64;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Encodes license payloads into the encrypted cache envelope and back.
 *
 * <p>Envelope layout:
 * <pre>{@code
 * { "_format": "license-cache", "version": 2, "encrypted": true,
 *   "data": { "cipher": "<base64url>", "sig": "<hex-sha256>", "algo": "xor-sha256" } }
 * }</pre>
 *
 * <p>The key is the SHA-256 of the machine fingerprint. The payload is XORed with the
 * repeated key and signed with SHA-256(plaintext || key). This deters casual tampering
 * and copying between machines; it is not confidentiality against a local attacker,
 * who can derive the same key.
 *
 * <p>Plaintext payload JSON written by older clients is still accepted by
 * {@link #decode(String)}.
 */
public final class CacheCodec {

    public static final String FORMAT = "license-cache";
    public static final int VERSION = 2;
    public static final String ALGORITHM = "xor-sha256";

    /** Format tag written by clients before the rename. */
    static final String LEGACY_FORMAT = "fcc-license-cache";

    private static final Gson GSON = new GsonBuilder()
        .setPrettyPrinting()
        .disableHtmlEscaping()
        .setObjectToNumberStrategy(ToNumberPolicy.LONG_OR_DOUBLE)
        .create();

    private final byte[] key;

    /**
     * Create a codec keyed by a machine fingerprint.
     */
    public CacheCodec(String machineFingerprint) {
        this.key = MachineFingerprint.sha256(machineFingerprint.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Raised when cache content cannot be trusted or parsed.
     */
    public static class InvalidCacheException extends Exception {
        public InvalidCacheException(String message) {
            super(message);
        }

        public InvalidCacheException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /**
     * Encode a payload as an encrypted envelope.
     *
     * @return envelope JSON text
     */
    public String encode(LicensePayload payload) {
        JsonObject envelope = new JsonObject();
        envelope.addProperty("_format", FORMAT);
        envelope.addProperty("version", VERSION);
        envelope.addProperty("encrypted", true);
        envelope.add("data", encrypt(serialize(payload)));
        return GSON.toJson(envelope);
    }

    /**
     * Decode envelope (or legacy plaintext) JSON into a payload.
     *
     * <p>Binding and expiry are not checked here; see {@link LicensePayload#isReusable}.
     *
     * @throws InvalidCacheException if the content is malformed or fails the integrity check
     */
    public LicensePayload decode(String json) throws InvalidCacheException {
        try {
            return decodeObject(json);
        } catch (JsonParseException | IllegalStateException | UnsupportedOperationException e) {
            throw new InvalidCacheException("Malformed license cache: " + e.getMessage(), e);
        }
    }

    private LicensePayload decodeObject(String json) throws InvalidCacheException {
        JsonElement root;
        try {
            root = JsonParser.parseString(json);
        } catch (JsonParseException e) {
            throw new InvalidCacheException("Cache is not valid JSON", e);
        }
        if (root == null || !root.isJsonObject()) {
            throw new InvalidCacheException("Cache is not a JSON object");
        }

        JsonObject object = root.getAsJsonObject();
        String format = stringOrNull(object, "_format");
        if (FORMAT.equals(format) || LEGACY_FORMAT.equals(format)) {
            JsonElement data = object.get("data");
            if (data == null || !data.isJsonObject()) {
                throw new InvalidCacheException("Missing license payload");
            }
            String plaintext = decrypt(data.getAsJsonObject());
            try {
                JsonElement inner = JsonParser.parseString(plaintext);
                if (inner == null || !inner.isJsonObject()) {
                    throw new InvalidCacheException("Decrypted payload is not a JSON object");
                }
                return deserialize(inner.getAsJsonObject());
            } catch (JsonParseException e) {
                throw new InvalidCacheException("Decrypted payload is not valid JSON", e);
            }
        }
        return deserialize(object);
    }

    /**
     * Encrypt and sign plaintext.
     *
     * @return the {@code data} object of the envelope
     */
    JsonObject encrypt(String plaintext) {
        byte[] raw = plaintext.getBytes(StandardCharsets.UTF_8);
        JsonObject data = new JsonObject();
        data.addProperty("cipher", Base64.getUrlEncoder().encodeToString(xor(raw)));
        data.addProperty("sig", sign(raw));
        data.addProperty("algo", ALGORITHM);
        return data;
    }

    /**
     * Verify and decrypt the {@code data} object of an envelope.
     */
    String decrypt(JsonObject data) throws InvalidCacheException {
        String cipher = stringOrNull(data, "cipher");
        String signature = stringOrNull(data, "sig");
        if (cipher == null || cipher.isEmpty() || signature == null || signature.isEmpty()) {
            throw new InvalidCacheException("Incomplete license payload");
        }

        byte[] decoded;
        try {
            decoded = Base64.getUrlDecoder().decode(cipher);
        } catch (IllegalArgumentException e) {
            throw new InvalidCacheException("Cipher is not valid base64", e);
        }
        // the decoder ignores stray padding bits, so only the canonical encoding is accepted
        if (!Base64.getUrlEncoder().encodeToString(decoded).equals(cipher)) {
            throw new InvalidCacheException("Cipher is not canonical base64");
        }
        byte[] raw = xor(decoded);

        byte[] expected = sign(raw).getBytes(StandardCharsets.US_ASCII);
        if (!MessageDigest.isEqual(expected, signature.getBytes(StandardCharsets.US_ASCII))) {
            throw new InvalidCacheException("License payload integrity check failed");
        }

        try {
            return StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT)
                .decode(ByteBuffer.wrap(raw))
                .toString();
        } catch (CharacterCodingException e) {
            throw new InvalidCacheException("License payload is not UTF-8", e);
        }
    }

    /**
     * Serialize a payload to its plaintext JSON form.
     */
    static String serialize(LicensePayload payload) {
        JsonObject json = new JsonObject();
        for (Map.Entry<String, Object> field : payload.serverFields().entrySet()) {
            if (!LicensePayload.FIELD_NAMES.contains(field.getKey())) {
                json.add(field.getKey(), GSON.toJsonTree(field.getValue()));
            }
        }
        json.addProperty("license_key", payload.licenseKey());
        if (payload.email() != null) {
            json.addProperty("email", payload.email());
        }
        if (payload.clientName() != null) {
            json.addProperty("client_name", payload.clientName());
        }
        json.addProperty("activation_count", payload.activationCount());
        json.addProperty("max_activations", payload.maxActivations());
        json.addProperty("machine_fingerprint", payload.machineFingerprint());
        if (payload.verifiedAt() != null) {
            json.addProperty("verified_at", payload.verifiedAt().toString());
        }
        if (payload.cacheExpiresAt() != null) {
            json.addProperty("cache_expires_at", payload.cacheExpiresAt().toString());
        }
        if (payload.offlineMode()) {
            json.addProperty("offline_mode", true);
        }
        return GSON.toJson(json);
    }

    /**
     * Read a payload from its JSON form. Unknown fields land in
     * {@link LicensePayload#serverFields()}.
     */
    static LicensePayload deserialize(JsonObject json) throws InvalidCacheException {
        try {
            Map<String, Object> extra = new LinkedHashMap<>();
            for (Map.Entry<String, JsonElement> entry : json.entrySet()) {
                if (!LicensePayload.FIELD_NAMES.contains(entry.getKey()) && !entry.getValue().isJsonNull()) {
                    extra.put(entry.getKey(), GSON.fromJson(entry.getValue(), Object.class));
                }
            }
            return new LicensePayload(
                stringOrNull(json, "license_key"),
                stringOrNull(json, "email"),
                stringOrNull(json, "client_name"),
                intOrZero(json, "activation_count"),
                intOrZero(json, "max_activations"),
                stringOrNull(json, "machine_fingerprint"),
                parseInstant(stringOrNull(json, "verified_at")),
                parseInstant(stringOrNull(json, "cache_expires_at")),
                json.has("offline_mode") && json.get("offline_mode").isJsonPrimitive()
                    && json.get("offline_mode").getAsBoolean(),
                extra
            );
        } catch (RuntimeException e) {
            throw new InvalidCacheException("Malformed license payload: " + e.getMessage(), e);
        }
    }

    /**
     * Parse a timestamp written by this or an older client.
     *
     * <p>Accepts {@code 2024-05-01T10:00:00Z}, offset forms such as
     * {@code 2024-05-01T10:00:00.123456+00:00}, and naive local times (taken as UTC).
     *
     * @return the instant, or null when absent or unparseable
     */
    static Instant parseInstant(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return OffsetDateTime.parse(value).toInstant();
        } catch (DateTimeParseException e) {
            try {
                return LocalDateTime.parse(value).toInstant(ZoneOffset.UTC);
            } catch (DateTimeParseException ignored) {
                return null;
            }
        }
    }

    private byte[] xor(byte[] data) {
        byte[] out = new byte[data.length];
        for (int i = 0; i < data.length; i++) {
            out[i] = (byte) (data[i] ^ key[i % key.length]);
        }
        return out;
    }

    private String sign(byte[] raw) {
        byte[] input = new byte[raw.length + key.length];
        System.arraycopy(raw, 0, input, 0, raw.length);
        System.arraycopy(key, 0, input, raw.length, key.length);
        return HexFormat.of().formatHex(MachineFingerprint.sha256(input));
    }

    private static String stringOrNull(JsonObject json, String name) {
        JsonElement element = json.get(name);
        if (element == null || element.isJsonNull()) {
            return null;
        }
        if (!element.isJsonPrimitive()) {
            throw new JsonParseException(name + " is not a scalar");
        }
        return element.getAsString();
    }

    private static int intOrZero(JsonObject json, String name) {
        JsonElement element = json.get(name);
        if (element == null || element.isJsonNull()) {
            return 0;
        }
        JsonPrimitive primitive = element.getAsJsonPrimitive();
        return primitive.isNumber() ? primitive.getAsInt() : Integer.parseInt(primitive.getAsString());
    }
}
