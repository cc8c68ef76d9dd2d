package at.sv.securitas.api;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Exception to signal a backend error of the API (5xx, 429), a GraphQL error response, or a response that could not
 * be parsed. Command polling treats ApiFailures as transient and retries the call.
 */
public class ApiFailure extends RuntimeException {

    private final transient JsonNode response;

    public ApiFailure(String message) {
        this(message, null);
    }

    public ApiFailure(String message, JsonNode response) {
        super(message);
        this.response = response;
    }

    /**
     * @return the parsed GraphQL response that carried the error, or null if the failure happened before a response
     * could be parsed.
     */
    public JsonNode getResponse() {
        return response;
    }
}
