package at.sv.securitas.command;

import at.sv.securitas.api.ApiDomain;
import at.sv.securitas.api.ConnectionFailure;
import at.sv.securitas.api.DeviceIdentity;
import at.sv.securitas.api.GraphQlClient;
import at.sv.securitas.api.OperationRegistry;
import at.sv.securitas.api.ScriptedTransport;
import at.sv.securitas.installation.Installation;
import at.sv.securitas.session.Session;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.concurrent.CompletionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CommandDispatcherTest {

    private ScriptedTransport transport;
    private CommandDispatcher dispatcher;
    private Session session;
    private Installation installation;

    @BeforeEach
    void setUp() {
        ZonedDateTime now = ZonedDateTime.of(2024, 3, 10, 10, 0, 0, 0, ZoneOffset.UTC);
        transport = new ScriptedTransport();
        GraphQlClient client = new GraphQlClient(transport, OperationRegistry.defaults(), ApiDomain.forCountry("ES"),
                DeviceIdentity.generate(), () -> now);
        dispatcher = new CommandDispatcher(client);
        session = new Session("user", "token", null, 1L, now.toInstant(), now.plusMinutes(15).toInstant());
        installation = Installation.builder()
                                   .number("12345")
                                   .panel("SDVFAST")
                                   .capabilities("cap")
                                   .build();
    }

    private void replyArm(String referenceId) {
        transport.reply(OperationRegistry.ARM_PANEL, "xSArmPanel",
                "{\"res\":\"OK\",\"msg\":\"Request sent\",\"referenceId\":\"" + referenceId + "\"}");
    }

    @Test
    void issueCommand_sendsArmPanel_returnsIssuedCommand_holdsSlot() {
        replyArm("OWP_ABC");

        Command command = dispatcher.issueCommand(session, installation, AlarmRequest.ARM1, "D").join();

        assertThat(command.referenceId()).isEqualTo("OWP_ABC");
        assertThat(command.request()).isEqualTo(AlarmRequest.ARM1);
        assertThat(command.state()).isEqualTo(CommandState.ISSUED);
        assertThat(command.counter()).isZero();
        assertThat(command.forced()).isFalse();
        assertThat(dispatcher.isInProgress("12345")).isTrue();
        ScriptedTransport.SentRequest request = transport.getRequests(OperationRegistry.ARM_PANEL).get(0);
        assertThat(request.variable("request")).isEqualTo("ARM1");
        assertThat(request.variable("numinst")).isEqualTo("12345");
        assertThat(request.variable("panel")).isEqualTo("SDVFAST");
        assertThat(request.variable("currentStatus")).isEqualTo("D");
        assertThat(request.variables().has("forceArmingRemoteId")).isFalse();
        assertThat(request.headers()).containsEntry("X-Capabilities", "cap");
    }

    @Test
    void issueCommand_disarm_sendsDisarmPanel() {
        transport.reply(OperationRegistry.DISARM_PANEL, "xSDisarmPanel",
                "{\"res\":\"OK\",\"msg\":\"\",\"referenceId\":\"OWP_DIS\"}");

        Command command = dispatcher.issueCommand(session, installation, AlarmRequest.DARM1).join();

        assertThat(command.isDisarm()).isTrue();
        assertThat(transport.getRequests(OperationRegistry.DISARM_PANEL).get(0).variable("request")).isEqualTo("DARM1");
        assertThat(transport.getRequests(OperationRegistry.DISARM_PANEL).get(0).variables().has("currentStatus"))
                .isFalse();
    }

    @Test
    void issueCommand_commandInProgress_exception_noRequest() {
        replyArm("OWP_ABC");
        dispatcher.issueCommand(session, installation, AlarmRequest.ARM1).join();

        assertThatThrownBy(() -> dispatcher.issueCommand(session, installation, AlarmRequest.DARM1).join())
                .isInstanceOf(CompletionException.class)
                .cause()
                .isInstanceOf(CommandInProgressException.class);
        assertThat(transport.getRequests(OperationRegistry.DISARM_PANEL)).isEmpty();
    }

    @Test
    void issueCommand_perimeterRequestWithoutPerimeter_capabilityException_noRequest() {
        assertThatThrownBy(() -> dispatcher.issueCommand(session, installation, AlarmRequest.ARM1PERI1).join())
                .cause()
                .isInstanceOf(CapabilityException.class);
        assertThat(transport.getOperationNames()).isEmpty();
        assertThat(dispatcher.isInProgress("12345")).isFalse();
    }

    @Test
    void issueCommand_perimeterRequest_perimetralInstallation_sent() {
        replyArm("OWP_PERI");

        Command command = dispatcher.issueCommand(session, installation.toBuilder().perimetral(true).build(),
                AlarmRequest.ARM1PERI1).join();

        assertThat(command.referenceId()).isEqualTo("OWP_PERI");
        assertThat(transport.getRequests(OperationRegistry.ARM_PANEL).get(0).variable("request")).isEqualTo("ARM1PERI1");
    }

    @Test
    void issueCommand_rejected_dispatchException_releasesSlot() {
        transport.reply(OperationRegistry.ARM_PANEL, "xSArmPanel", "{\"res\":\"KO\",\"msg\":\"Panel busy\"}");

        assertThatThrownBy(() -> dispatcher.issueCommand(session, installation, AlarmRequest.ARM1).join())
                .cause()
                .isInstanceOf(DispatchException.class)
                .hasMessageContaining("Panel busy");
        assertThat(dispatcher.isInProgress("12345")).isFalse();
    }

    @Test
    void issueCommand_noReferenceId_dispatchException() {
        transport.reply(OperationRegistry.ARM_PANEL, "xSArmPanel", "{\"res\":\"OK\",\"msg\":\"\"}");

        assertThatThrownBy(() -> dispatcher.issueCommand(session, installation, AlarmRequest.ARM1).join())
                .cause()
                .isInstanceOf(DispatchException.class)
                .hasMessageContaining("no reference id");
        assertThat(dispatcher.isInProgress("12345")).isFalse();
    }

    @Test
    void issueCommand_connectionFailure_dispatchExceptionWithCause_releasesSlot() {
        transport.fail(OperationRegistry.ARM_PANEL, new ConnectionFailure("Failed"));

        assertThatThrownBy(() -> dispatcher.issueCommand(session, installation, AlarmRequest.ARM1).join())
                .cause()
                .isInstanceOf(DispatchException.class)
                .hasCauseInstanceOf(ConnectionFailure.class);
        assertThat(dispatcher.isInProgress("12345")).isFalse();
    }

    @Test
    void release_afterSupersede_keepsNewCommand() {
        replyArm("OWP_OLD");
        Command old = dispatcher.issueCommand(session, installation, AlarmRequest.ARM1).join();
        dispatcher.supersede("12345");
        replyArm("OWP_NEW");
        Command current = dispatcher.issueCommand(session, installation, AlarmRequest.ARM1).join();

        dispatcher.release(old);

        assertThat(dispatcher.isInProgress("12345")).isTrue();
        dispatcher.release(current);
        assertThat(dispatcher.isInProgress("12345")).isFalse();
    }

    @Test
    void reissueForced_sendsForceReference_keepsSlot() {
        replyArm("OWP_ABC");
        Command command = dispatcher.issueCommand(session, installation, AlarmRequest.ARM1).join();
        replyArm("OWP_DEF");

        Command forced = dispatcher.reissueForced(session, command, "OWP_FORCE").join();

        assertThat(forced.referenceId()).isEqualTo("OWP_DEF");
        assertThat(forced.forced()).isTrue();
        assertThat(forced.claim()).isEqualTo(command.claim());
        assertThat(transport.getRequests(OperationRegistry.ARM_PANEL).get(1).variable("forceArmingRemoteId"))
                .isEqualTo("OWP_FORCE");
        assertThat(dispatcher.isInProgress("12345")).isTrue();
    }

    @Test
    void queryLastKnownStatus_returnsBackendStatus() {
        transport.reply(OperationRegistry.STATUS, "xSStatus",
                "{\"status\":\"T\",\"timestampUpdate\":\"2024-03-10T09:58:00\"}");

        AlarmStatus status = dispatcher.queryLastKnownStatus(session, installation).join();

        assertThat(status.installationNumber()).isEqualTo("12345");
        assertThat(status.state()).isEqualTo(AlarmState.ARMED_AWAY);
        assertThat(status.protomResponseDate()).isEqualTo("2024-03-10T09:58:00");
    }

    @Test
    void checkAlarm_returnsStatusCheck_withoutSlot() {
        transport.reply(OperationRegistry.CHECK_ALARM, "xSCheckAlarm",
                "{\"res\":\"OK\",\"msg\":\"\",\"referenceId\":\"OWP_CHK\"}");

        Command check = dispatcher.checkAlarm(session, installation).join();

        assertThat(check.isStatusCheck()).isTrue();
        assertThat(check.referenceId()).isEqualTo("OWP_CHK");
        assertThat(check.claim()).isNull();
        assertThat(dispatcher.isInProgress("12345")).isFalse();
    }
}
