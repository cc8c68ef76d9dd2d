package at.sv.securitas.api;

/**
 * Exception to signal a connection failure to the API. Calls failing with it left no state behind and can be retried.
 */
public final class ConnectionFailure extends RuntimeException {

    public ConnectionFailure(String message) {
        super(message);
    }

    public ConnectionFailure(String message, Throwable cause) {
        super(message, cause);
    }
}
