package at.sv.securitas.session;

/**
 * The backend rejected the credentials, the one-time passcode or the session. Not retryable, a new login is
 * required.
 */
public final class AuthException extends RuntimeException {

    public AuthException(String message) {
        super(message);
    }

    public AuthException(String message, Throwable cause) {
        super(message, cause);
    }
}
