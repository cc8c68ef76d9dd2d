package at.sv.securitas.api;

import lombok.Builder;
import lombok.Data;
import lombok.Singular;

import java.util.Map;

/**
 * One request against a registered operation.
 */
@Data
@Builder
public final class GraphQlCall {
    String operationName;
    @Singular
    Map<String, Object> variables;
    /**
     * The authenticated session, or null before login.
     */
    SessionCredentials session;
    /**
     * The user name to identify with, if there is no session yet.
     */
    String user;
    InstallationRef installation;
    OtpAnswer otpAnswer;

    String getEffectiveUser() {
        if (session != null) {
            return session.user();
        }
        return user;
    }

    long getLoginTimestamp() {
        if (session == null) {
            return 0L;
        }
        return session.loginTimestamp();
    }
}
