package at.sv.securitas;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PinGateTest {

    @Test
    void noPin_disabled_acceptsAnything() {
        PinGate gate = new PinGate(null);

        assertThat(gate.isEnabled()).isFalse();
        gate.check(null);
        gate.check("1234");
        assertThat(new PinGate("").isEnabled()).isFalse();
    }

    @Test
    void pin_matchingCode_accepted() {
        PinGate gate = new PinGate("1234");

        assertThat(gate.isEnabled()).isTrue();
        gate.check("1234");
    }

    @Test
    void pin_wrongOrMissingCode_invalidPinException() {
        PinGate gate = new PinGate("1234");

        assertThatThrownBy(() -> gate.check("4321")).isInstanceOf(InvalidPinException.class)
                                                    .hasMessage("The entered PIN is not correct");
        assertThatThrownBy(() -> gate.check("12345")).isInstanceOf(InvalidPinException.class);
        assertThatThrownBy(() -> gate.check(null)).isInstanceOf(InvalidPinException.class);
    }
}
