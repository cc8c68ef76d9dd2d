package at.sv.securitas.command;

/**
 * The terminal result of polling a command.
 *
 * @param status  the alarm status reported with the result, null unless {@link CommandState#CONFIRMED}
 * @param message the message of the backend, or why the poller gave up
 * @param error   the error reported by the backend, may be null
 */
public record CommandOutcome(CommandState state, Command command, AlarmStatus status, String message,
                             ArmError error) {

    public CommandOutcome {
        if (!state.isTerminal()) {
            throw new IllegalArgumentException("Outcome state must be terminal: " + state);
        }
    }

    public boolean isConfirmed() {
        return state == CommandState.CONFIRMED;
    }
}
