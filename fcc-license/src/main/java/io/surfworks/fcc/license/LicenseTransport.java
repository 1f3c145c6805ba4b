package io.surfworks.fcc.license;

import java.io.IOException;

/**
 * Sends one verification request to one candidate server.
 *
 * <p>Implementations throw {@link IOException} for transport failures (timeouts,
 * refused connections, TLS errors). Any HTTP status, including 4xx and 5xx, is a
 * response and is returned rather than thrown.
 */
public interface LicenseTransport {

    /**
     * Raw HTTP response.
     *
     * @param statusCode HTTP status
     * @param body       response body (may be empty)
     */
    record Response(int statusCode, String body) {}

    /**
     * POST a JSON body to the candidate's verification endpoint.
     *
     * @param candidate the server to contact
     * @param jsonBody  request body
     * @return the server's response
     * @throws IOException on transport failure
     * @throws InterruptedException if the calling thread is interrupted while waiting
     */
    Response post(CandidateServers.Candidate candidate, String jsonBody)
        throws IOException, InterruptedException;
}
