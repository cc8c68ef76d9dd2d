package at.sv.securitas.api;

import java.net.URL;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

public interface GraphQlTransport {
    /**
     * Sends the given json body as POST request. The call does not block; cancelling the returned future cancels
     * the underlying request.
     *
     * @param headers additional request headers, sent in iteration order
     * @param body    the json payload of the post request
     * @return a future with the response body of the server. Not null. Completes exceptionally with
     * {@link AuthenticationFailure} if the server rejected the request as unauthorized (401, 403),
     * {@link ApiFailure} if the response code is 5xx or 429, or
     * {@link ConnectionFailure} if an IOException occurred or another unexpected code was returned.
     */
    CompletableFuture<String> post(URL url, Map<String, String> headers, String body);
}
