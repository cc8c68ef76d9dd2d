package at.sv.securitas.command;

/**
 * The alarm status of an installation as reported by the backend.
 *
 * @param protomResponse     the single letter panel state, e.g. {@code T} for armed away
 * @param protomResponseDate when the panel reported the state
 */
public record AlarmStatus(String installationNumber, String res, String msg, String status, String protomResponse,
                          String protomResponseDate) {

    public static AlarmStatus unknown(String installationNumber, String msg) {
        return new AlarmStatus(installationNumber, null, msg, null, null, null);
    }

    public AlarmState state() {
        return AlarmState.fromProtomResponse(protomResponse);
    }
}
