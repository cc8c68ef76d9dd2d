package at.sv.securitas.command;

import lombok.Data;

/**
 * Result of {@code ArmStatus}, {@code DisarmStatus} and {@code CheckAlarmStatus}.
 */
@Data
public final class PollResponse {
    String res;
    String msg;
    String status;
    String protomResponse;
    String protomResponseDate;
    String numinst;
    String requestId;
    ArmError error;

    boolean isWait() {
        return "WAIT".equals(res) && error == null;
    }

    boolean isOk() {
        return "OK".equals(res);
    }

    boolean isFailure() {
        return "KO".equals(res) || error != null;
    }
}
