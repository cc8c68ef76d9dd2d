package at.sv.securitas.api;

/**
 * Exception to signal that the server rejected the session token, either with HTTP 401/403 or with an invalid
 * session error in the GraphQL response.
 */
public final class AuthenticationFailure extends RuntimeException {
    public AuthenticationFailure() {
        super("Session token was rejected by the server");
    }

    public AuthenticationFailure(String message) {
        super(message);
    }
}
