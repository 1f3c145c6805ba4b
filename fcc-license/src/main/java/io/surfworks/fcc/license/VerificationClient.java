package io.surfworks.fcc.license;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.ToNumberPolicy;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Verifies a license key against the candidate servers.
 *
 * <p>Request: {@code POST <candidate>/api/license/verify} with
 * {@code {license_key, machine_fingerprint, email, hostname, platform, app_version}}.
 *
 * <p>Responses:
 * <ul>
 *   <li>{@code {"ok": true, "license": {...}}} is a success.</li>
 *   <li>{@code {"ok": false, "error": "<code>"}}, or any status of 400 and above with an
 *       {@code error} field, is a failure carrying that code.</li>
 *   <li>Anything else is {@code invalid_server_response}.</li>
 * </ul>
 *
 * <p>Candidates are tried in order. A transport failure moves on to the next
 * candidate; a well-formed answer ends the loop and promotes its candidate. When no
 * candidate answers the result is {@code network_error}.
 */
public class VerificationClient {

    private static final Logger LOG = Logger.getLogger(VerificationClient.class.getName());

    private static final Gson GSON = new GsonBuilder()
        .serializeNulls()
        .setObjectToNumberStrategy(ToNumberPolicy.LONG_OR_DOUBLE)
        .create();

    private final CandidateServers servers;
    private final LicenseTransport transport;

    public VerificationClient(CandidateServers servers, LicenseTransport transport) {
        this.servers = servers;
        this.transport = transport;
    }

    /**
     * Request body fields.
     *
     * @param licenseKey         key being verified
     * @param machineFingerprint this machine's fingerprint
     * @param email              registered email (may be null)
     * @param hostname           host name for the server's activation record
     * @param platform           platform description
     * @param appVersion         application version (may be null)
     */
    public record Request(
        String licenseKey,
        String machineFingerprint,
        String email,
        String hostname,
        String platform,
        String appVersion
    ) {

        String toJson() {
            JsonObject json = new JsonObject();
            json.addProperty("license_key", licenseKey);
            json.addProperty("machine_fingerprint", machineFingerprint);
            json.addProperty("email", email);
            json.addProperty("hostname", hostname);
            json.addProperty("platform", platform);
            json.addProperty("app_version", appVersion);
            return GSON.toJson(json);
        }
    }

    /**
     * Verify a license with the first candidate that answers.
     */
    public VerificationResult verify(Request request) {
        String body = request.toJson();
        Exception lastError = null;

        for (CandidateServers.Candidate candidate : servers.candidates()) {
            LOG.info("Attempting license verification via " + candidate.baseUrl());

            LicenseTransport.Response response;
            try {
                response = transport.post(candidate, body);
            } catch (IOException e) {
                LOG.fine("Transport failure for " + candidate.baseUrl() + ": " + e);
                lastError = e;
                continue;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                LOG.warning("License verification interrupted");
                return VerificationResult.failure(ErrorCode.NETWORK_ERROR);
            } catch (RuntimeException e) {
                // HttpClient reports some connection problems unchecked
                LOG.fine("Unexpected transport failure for " + candidate.baseUrl() + ": " + e);
                lastError = e;
                continue;
            }

            VerificationResult result = parse(response, candidate);
            if (result.candidateUrl() != null) {
                servers.promote(candidate);
            }
            return result;
        }

        if (lastError != null) {
            LOG.warning("Failed to reach license server: " + lastError.getMessage());
        }
        return VerificationResult.failure(ErrorCode.NETWORK_ERROR);
    }

    /**
     * Normalize one HTTP response. Results that do not name a candidate did not match
     * the response contract.
     */
    static VerificationResult parse(LicenseTransport.Response response, CandidateServers.Candidate candidate) {
        JsonObject json;
        try {
            JsonElement element = JsonParser.parseString(response.body() == null ? "" : response.body());
            if (element == null || !element.isJsonObject()) {
                return VerificationResult.failure(ErrorCode.INVALID_SERVER_RESPONSE);
            }
            json = element.getAsJsonObject();
        } catch (JsonParseException e) {
            LOG.fine("Unparseable response from " + candidate.baseUrl() + ": " + e.getMessage());
            return VerificationResult.failure(ErrorCode.INVALID_SERVER_RESPONSE);
        }

        String error = errorField(json);
        JsonElement ok = json.get("ok");
        boolean okTrue = ok != null && ok.isJsonPrimitive() && ok.getAsJsonPrimitive().isBoolean()
            && ok.getAsBoolean();

        if (okTrue && response.statusCode() < 400) {
            JsonElement license = json.get("license");
            if (license == null || !license.isJsonObject()) {
                return VerificationResult.failure(ErrorCode.INVALID_SERVER_RESPONSE);
            }
            return VerificationResult.success(toMap(license.getAsJsonObject()), candidate.baseUrl());
        }
        if (error != null) {
            return VerificationResult.failure(error, candidate.baseUrl());
        }
        return VerificationResult.failure(ErrorCode.INVALID_SERVER_RESPONSE);
    }

    private static String errorField(JsonObject json) {
        JsonElement error = json.get("error");
        if (error == null || !error.isJsonPrimitive()) {
            return null;
        }
        String value = error.getAsString();
        return value.isBlank() ? null : value;
    }

    private static Map<String, Object> toMap(JsonObject object) {
        Map<String, Object> map = new LinkedHashMap<>();
        for (Map.Entry<String, JsonElement> entry : object.entrySet()) {
            if (!entry.getValue().isJsonNull()) {
                map.put(entry.getKey(), GSON.fromJson(entry.getValue(), Object.class));
            }
        }
        return map;
    }
}
