package at.sv.securitas.command;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class AlarmModeTest {

    @Test
    void requestFor_standardInstallation() {
        assertRequest(AlarmMode.ARMED_AWAY, false, AlarmRequest.ARM1);
        assertRequest(AlarmMode.ARMED_HOME, false, AlarmRequest.ARMDAY1);
        assertRequest(AlarmMode.ARMED_NIGHT, false, AlarmRequest.ARMNIGHT1);
        assertRequest(AlarmMode.ARMED_CUSTOM_BYPASS, false, AlarmRequest.PERI1);
        assertRequest(AlarmMode.DISARMED, false, AlarmRequest.DARM1);
    }

    @Test
    void requestFor_perimetralInstallation() {
        assertRequest(AlarmMode.ARMED_AWAY, true, AlarmRequest.ARM1PERI1);
        assertRequest(AlarmMode.ARMED_HOME, true, AlarmRequest.ARMDAY1);
        assertRequest(AlarmMode.DISARMED, true, AlarmRequest.DARM1DARMPERI);
    }

    @Test
    void requestFor_standardInstallation_neverPerimeterOnly() {
        for (AlarmMode mode : AlarmMode.values()) {
            assertThat(mode.requestFor(false).isPerimetral()).as(mode.name()).isFalse();
        }
    }

    @Test
    void request_codesAndDisarm() {
        assertThat(AlarmRequest.ARM1PERI1.code()).isEqualTo("ARM1PERI1");
        assertThat(AlarmRequest.DARM1DARMPERI.isDisarm()).isTrue();
        assertThat(AlarmRequest.DARM1.isDisarm()).isTrue();
        assertThat(AlarmRequest.PERI1.isDisarm()).isFalse();
    }

    private static void assertRequest(AlarmMode mode, boolean perimetral, AlarmRequest request) {
        assertThat(mode.requestFor(perimetral)).isEqualTo(request);
    }
}
