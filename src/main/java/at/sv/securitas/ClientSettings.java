package at.sv.securitas;

import at.sv.securitas.command.PollPolicy;
import lombok.Builder;
import lombok.Getter;

import java.time.Duration;

/**
 * The configuration a host passes to {@link AlarmService}.
 */
@Getter
@Builder(toBuilder = true)
public final class ClientSettings {
    /**
     * ISO code of the country the account belongs to. Countries without a dedicated endpoint use the generic one.
     */
    @Builder.Default
    private final String country = "ES";
    /**
     * Local PIN that has to be entered before arming or disarming. Null to disable. Never sent to the backend.
     */
    private final String pin;
    /**
     * Read the status from the panel itself, instead of the last status known to the backend.
     */
    @Builder.Default
    private final boolean verifyAgainstPanel = true;
    @Builder.Default
    private final boolean otpEnabled = true;
    /**
     * Treat all installations as supporting perimeter arming.
     */
    @Builder.Default
    private final boolean perimetral = false;
    @Builder.Default
    private final PollPolicy pollPolicy = PollPolicy.defaults();
    /**
     * How long Sentinel readings are reused.
     */
    @Builder.Default
    private final Duration scanInterval = Duration.ofSeconds(120);
    /**
     * The lifetime assumed for tokens without readable expiry.
     */
    @Builder.Default
    private final Duration fallbackTokenLifetime = Duration.ofMinutes(15);
}
