package at.sv.securitas.command;

/**
 * The alarm modes a host can select, mapped to request codes depending on the installation's perimeter support.
 */
public enum AlarmMode {
    ARMED_AWAY(AlarmRequest.ARM1, AlarmRequest.ARM1PERI1),
    ARMED_HOME(AlarmRequest.ARMDAY1, AlarmRequest.ARMDAY1),
    ARMED_NIGHT(AlarmRequest.ARMNIGHT1, AlarmRequest.ARMNIGHT1),
    ARMED_CUSTOM_BYPASS(AlarmRequest.PERI1, AlarmRequest.PERI1),
    DISARMED(AlarmRequest.DARM1, AlarmRequest.DARM1DARMPERI);

    private final AlarmRequest standard;
    private final AlarmRequest perimetral;

    AlarmMode(AlarmRequest standard, AlarmRequest perimetral) {
        this.standard = standard;
        this.perimetral = perimetral;
    }

    public AlarmRequest requestFor(boolean perimetralInstallation) {
        return perimetralInstallation ? perimetral : standard;
    }
}
