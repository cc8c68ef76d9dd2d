package at.sv.securitas.command;

import at.sv.securitas.installation.Installation;

/**
 * One arm, disarm or status check request in progress. The reference id is assigned by the backend and never changes
 * for a Command; a forced re-issue creates a new Command.
 *
 * @param request       the request code, or null for a status check
 * @param currentStatus the panel state sent with the request, may be null
 * @param counter       the counter sent with the last poll, 0 before the first poll
 * @param forced        true if the command was re-issued with forcing
 * @param claim         the in-flight slot held by the command, null for status checks
 * @param lastResponse  the response of the last poll, may be null
 */
public record Command(AlarmRequest request, Installation installation, String currentStatus, String referenceId,
                      int counter, CommandState state, boolean forced, InFlightCommands.Claim claim,
                      PollResponse lastResponse) {

    static Command issued(AlarmRequest request, Installation installation, String currentStatus, String referenceId,
                          InFlightCommands.Claim claim) {
        return new Command(request, installation, currentStatus, referenceId, 0, CommandState.ISSUED, false, claim,
                null);
    }

    static Command statusCheck(Installation installation, String referenceId) {
        return new Command(null, installation, null, referenceId, 0, CommandState.ISSUED, false, null, null);
    }

    public boolean isStatusCheck() {
        return request == null;
    }

    public boolean isDisarm() {
        return request != null && request.isDisarm();
    }

    Command nextPoll() {
        return new Command(request, installation, currentStatus, referenceId, counter + 1, CommandState.POLLING, forced,
                claim, lastResponse);
    }

    Command withResponse(PollResponse response) {
        return new Command(request, installation, currentStatus, referenceId, counter, state, forced, claim, response);
    }

    Command terminal(CommandState terminalState) {
        return new Command(request, installation, currentStatus, referenceId, counter, terminalState, forced, claim,
                lastResponse);
    }

    Command forcedReissue(String newReferenceId) {
        return new Command(request, installation, currentStatus, newReferenceId, 0, CommandState.ISSUED, true, claim,
                null);
    }

    @Override
    public String toString() {
        return "Command{" + (isStatusCheck() ? "status check" : request) + ", installation=" + installation.number() +
               ", referenceId=" + referenceId + ", counter=" + counter + ", state=" + state +
               (forced ? ", forced" : "") + "}";
    }
}
