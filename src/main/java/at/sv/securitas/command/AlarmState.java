package at.sv.securitas.command;

import java.util.Set;

public enum AlarmState {
    DISARMED,
    ARMED_AWAY,
    ARMED_HOME,
    ARMED_NIGHT,
    ARMED_CUSTOM_BYPASS,
    UNKNOWN;

    private static final Set<String> CUSTOM_BYPASS_CODES = Set.of("E", "B", "C", "A");

    /**
     * @param protomResponse the single letter panel state reported by the backend, may be null
     */
    public static AlarmState fromProtomResponse(String protomResponse) {
        if (protomResponse == null) {
            return UNKNOWN;
        }
        switch (protomResponse) {
            case "D":
                return DISARMED;
            case "T":
                return ARMED_AWAY;
            case "Q":
                return ARMED_NIGHT;
            case "P":
                return ARMED_HOME;
            default:
                return CUSTOM_BYPASS_CODES.contains(protomResponse) ? ARMED_CUSTOM_BYPASS : UNKNOWN;
        }
    }
}
