package at.sv.securitas.command;

/**
 * The arm or disarm request was not accepted before a reference id was assigned, no command exists. Safe to retry.
 */
public final class DispatchException extends RuntimeException {

    public DispatchException(String message) {
        super(message);
    }

    public DispatchException(String message, Throwable cause) {
        super(message, cause);
    }
}
