package at.sv.securitas.api;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of the GraphQL operations known to the client. New vendor operations are added by placing a query
 * template on the classpath and registering it; existing call sites stay untouched.
 */
public final class OperationRegistry {

    public static final String LOGIN = "mkLoginToken";
    public static final String VALIDATE_DEVICE = "mkValidateDevice";
    public static final String REFRESH_LOGIN = "RefreshLogin";
    public static final String SEND_OTP = "mkSendOTP";
    public static final String LOGOUT = "Logout";
    public static final String INSTALLATION_LIST = "mkInstallationList";
    public static final String SERVICES = "Srv";
    public static final String CHECK_ALARM = "CheckAlarm";
    public static final String CHECK_ALARM_STATUS = "CheckAlarmStatus";
    public static final String ARM_PANEL = "xSArmPanel";
    public static final String ARM_STATUS = "ArmStatus";
    public static final String DISARM_PANEL = "xSDisarmPanel";
    public static final String DISARM_STATUS = "DisarmStatus";
    public static final String STATUS = "Status";
    public static final String SENTINEL = "Sentinel";
    public static final String AIR_QUALITY = "AirQualityGraph";

    private final Map<String, GraphQlOperation> operations = new ConcurrentHashMap<>();

    public static OperationRegistry defaults() {
        OperationRegistry registry = new OperationRegistry();
        registry.register(GraphQlOperation.load(LOGIN, "xSLoginToken", AuthMode.NONE));
        registry.register(GraphQlOperation.load(VALIDATE_DEVICE, "xSValidateDevice", AuthMode.DEVICE_VALIDATION));
        registry.register(GraphQlOperation.load(REFRESH_LOGIN, "xSRefreshLogin", AuthMode.DEVICE_VALIDATION));
        registry.register(GraphQlOperation.load(SEND_OTP, "xSSendOtp", AuthMode.DEVICE_VALIDATION));
        registry.register(GraphQlOperation.load(LOGOUT, "xSLogout", AuthMode.SESSION));
        registry.register(GraphQlOperation.load(INSTALLATION_LIST, "xSInstallations", AuthMode.SESSION));
        registry.register(GraphQlOperation.load(SERVICES, "xSSrv", AuthMode.SESSION));
        registry.register(GraphQlOperation.load(CHECK_ALARM, "xSCheckAlarm", AuthMode.SESSION));
        registry.register(GraphQlOperation.load(CHECK_ALARM_STATUS, "xSCheckAlarmStatus", AuthMode.SESSION));
        registry.register(GraphQlOperation.load(ARM_PANEL, "xSArmPanel", AuthMode.SESSION));
        registry.register(GraphQlOperation.load(ARM_STATUS, "xSArmStatus", AuthMode.SESSION));
        registry.register(GraphQlOperation.load(DISARM_PANEL, "xSDisarmPanel", AuthMode.SESSION));
        registry.register(GraphQlOperation.load(DISARM_STATUS, "xSDisarmStatus", AuthMode.SESSION));
        registry.register(GraphQlOperation.load(STATUS, "xSStatus", AuthMode.SESSION));
        registry.register(GraphQlOperation.load(SENTINEL, "xSAllConfort", AuthMode.SESSION));
        registry.register(GraphQlOperation.load(AIR_QUALITY, "xSAirQ", AuthMode.SESSION));
        return registry;
    }

    public void register(GraphQlOperation operation) {
        operations.put(operation.name(), operation);
    }

    /**
     * @throws IllegalArgumentException if no operation with the given name is registered
     */
    public GraphQlOperation get(String name) {
        GraphQlOperation operation = operations.get(name);
        if (operation == null) {
            throw new IllegalArgumentException("Unknown GraphQL operation '" + name + "'");
        }
        return operation;
    }

    public boolean contains(String name) {
        return operations.containsKey(name);
    }
}
