package at.sv.securitas.command;

public enum CommandState {
    ISSUED,
    POLLING,
    CONFIRMED,
    FAILED,
    /**
     * The client gave up waiting. The backend may still complete the command, the alarm state is unknown.
     */
    TIMEOUT;

    public boolean isTerminal() {
        return this == CONFIRMED || this == FAILED || this == TIMEOUT;
    }
}
