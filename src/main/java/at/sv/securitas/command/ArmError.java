package at.sv.securitas.command;

import lombok.Data;

/**
 * The error object of a status poll, e.g. an open door that blocks arming.
 */
@Data
public final class ArmError {
    String code;
    String type;
    Boolean allowForcing;
    Integer exceptionsNumber;
    /**
     * The reference to send as {@code forceArmingRemoteId} when forcing the command.
     */
    String referenceId;

    public boolean isForceable() {
        return Boolean.TRUE.equals(allowForcing);
    }
}
