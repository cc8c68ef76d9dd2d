package at.sv.securitas.command;

/**
 * The request codes accepted by {@code xSArmPanel} and {@code xSDisarmPanel}.
 */
public enum AlarmRequest {
    ARM1(false, false),
    ARMDAY1(false, false),
    ARMNIGHT1(false, false),
    PERI1(false, false),
    ARM1PERI1(false, true),
    DARM1(true, false),
    DARM1DARMPERI(true, true);

    private final boolean disarm;
    private final boolean perimetral;

    AlarmRequest(boolean disarm, boolean perimetral) {
        this.disarm = disarm;
        this.perimetral = perimetral;
    }

    public String code() {
        return name();
    }

    public boolean isDisarm() {
        return disarm;
    }

    /**
     * @return true if the request needs an installation with perimeter arming
     */
    public boolean isPerimetral() {
        return perimetral;
    }
}
