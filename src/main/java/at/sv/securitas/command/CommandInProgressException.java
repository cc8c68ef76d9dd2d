package at.sv.securitas.command;

/**
 * Another command for the installation is still in progress.
 */
public final class CommandInProgressException extends RuntimeException {

    public CommandInProgressException(String message) {
        super(message);
    }
}
