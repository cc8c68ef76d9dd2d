package at.sv.securitas.command;

/**
 * The requested action is not supported by the installation. Not retryable.
 */
public final class CapabilityException extends RuntimeException {

    public CapabilityException(String message) {
        super(message);
    }
}
