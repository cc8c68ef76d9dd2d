package at.sv.securitas.command;

import at.sv.securitas.api.Futures;
import at.sv.securitas.api.GraphQlCall;
import at.sv.securitas.api.GraphQlClient;
import at.sv.securitas.api.OperationRegistry;
import at.sv.securitas.installation.Installation;
import at.sv.securitas.session.Session;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Sends arm and disarm requests and simple status reads. Holds the in-flight slot of each installation from the
 * moment a command is issued until it is released.
 */
@Slf4j
public final class CommandDispatcher {

    private final GraphQlClient client;
    private final InFlightCommands inFlight;

    public CommandDispatcher(GraphQlClient client) {
        this(client, new InFlightCommands());
    }

    CommandDispatcher(GraphQlClient client, InFlightCommands inFlight) {
        this.client = client;
        this.inFlight = inFlight;
    }

    public CompletableFuture<Command> issueCommand(Session session, Installation installation, AlarmRequest request) {
        return issueCommand(session, installation, request, null);
    }

    /**
     * Sends the given request and returns the issued command, which holds the in-flight slot of the installation
     * until it is {@link #release(Command) released}.
     *
     * @param currentStatus the last known panel state, sent as {@code currentStatus}. Nullable.
     * @return a future with the issued command. Completes exceptionally with {@link CapabilityException} if the
     * installation does not support the request, {@link CommandInProgressException} if another command is in progress,
     * or {@link DispatchException} if the request was not accepted.
     */
    public CompletableFuture<Command> issueCommand(Session session, Installation installation, AlarmRequest request,
                                                   String currentStatus) {
        if (request.isPerimetral() && !installation.perimetral()) {
            return CompletableFuture.failedFuture(new CapabilityException(
                    "Installation " + installation.number() + " does not support perimeter request " + request));
        }
        Optional<InFlightCommands.Claim> claim = inFlight.tryClaim(installation.number());
        if (claim.isEmpty()) {
            return CompletableFuture.failedFuture(new CommandInProgressException(
                    "Installation " + installation.number() + " has a command in progress"));
        }
        log.info("Sending {} to installation {}", request, installation.number());
        return send(session, installation, request, currentStatus, null)
                .handle((referenceId, error) -> {
                    if (error != null) {
                        inFlight.release(claim.get());
                        throw toDispatchException(Futures.unwrap(error), request);
                    }
                    log.debug("{} accepted with reference {}", request, referenceId);
                    return Command.issued(request, installation, currentStatus, referenceId, claim.get());
                });
    }

    /**
     * Re-issues the given arm command with forcing. The returned command has a new reference id and keeps the
     * in-flight slot.
     *
     * @param forceReferenceId sent as {@code forceArmingRemoteId}
     */
    public CompletableFuture<Command> reissueForced(Session session, Command command, String forceReferenceId) {
        log.info("Re-issuing {} with forcing", command.request());
        return send(session, command.installation(), command.request(), command.currentStatus(), forceReferenceId)
                .handle((referenceId, error) -> {
                    if (error != null) {
                        throw toDispatchException(Futures.unwrap(error), command.request());
                    }
                    return command.forcedReissue(referenceId);
                });
    }

    /**
     * Reads the last status the backend knows, without asking the panel.
     */
    public CompletableFuture<AlarmStatus> queryLastKnownStatus(Session session, Installation installation) {
        GraphQlCall call = GraphQlCall.builder()
                                      .operationName(OperationRegistry.STATUS)
                                      .session(session)
                                      .installation(installation)
                                      .variable("numinst", installation.number())
                                      .build();
        return client.execute(call)
                     .thenApply(result -> {
                         String status = result.path("status").asText(null);
                         return new AlarmStatus(installation.number(), "OK", null, status, status,
                                 result.path("timestampUpdate").asText(null));
                     });
    }

    /**
     * Asks the backend to query the panel.
     *
     * @return a future with the status check to poll with {@code CheckAlarmStatus}. Status checks hold no in-flight
     * slot.
     */
    public CompletableFuture<Command> checkAlarm(Session session, Installation installation) {
        GraphQlCall call = GraphQlCall.builder()
                                      .operationName(OperationRegistry.CHECK_ALARM)
                                      .session(session)
                                      .installation(installation)
                                      .variable("numinst", installation.number())
                                      .variable("panel", installation.panel())
                                      .build();
        return client.execute(call)
                     .handle((result, error) -> {
                         if (error != null) {
                             throw toDispatchException(Futures.unwrap(error), null);
                         }
                         return Command.statusCheck(installation, readReferenceId(OperationRegistry.CHECK_ALARM, result));
                     });
    }

    /**
     * Frees the in-flight slot held by the given command. Has no effect if the slot was superseded.
     */
    public void release(Command command) {
        if (command.claim() != null && inFlight.release(command.claim())) {
            log.debug("Released installation {}", command.installation().number());
        }
    }

    /**
     * Drops the in-flight slot of the given installation, e.g. after a command was abandoned without releasing it.
     */
    public void supersede(String installationNumber) {
        if (inFlight.supersede(installationNumber)) {
            log.warn("Superseded command in progress for installation {}", installationNumber);
        }
    }

    public boolean isInProgress(String installationNumber) {
        return inFlight.isBusy(installationNumber);
    }

    private CompletableFuture<String> send(Session session, Installation installation, AlarmRequest request,
                                           String currentStatus, String forceReferenceId) {
        String operation = request.isDisarm() ? OperationRegistry.DISARM_PANEL : OperationRegistry.ARM_PANEL;
        GraphQlCall.GraphQlCallBuilder builder = GraphQlCall.builder()
                                                            .operationName(operation)
                                                            .session(session)
                                                            .installation(installation)
                                                            .variable("request", request.code())
                                                            .variable("numinst", installation.number())
                                                            .variable("panel", installation.panel());
        if (currentStatus != null) {
            builder.variable("currentStatus", currentStatus);
        }
        if (forceReferenceId != null) {
            builder.variable("forceArmingRemoteId", forceReferenceId);
        }
        return client.execute(builder.build())
                     .thenApply(result -> readReferenceId(operation, result));
    }

    private static String readReferenceId(String operation, JsonNode result) {
        String res = result.path("res").asText();
        if (!"OK".equals(res)) {
            throw new DispatchException(operation + " was rejected: " + result.path("msg").asText(res));
        }
        String referenceId = result.path("referenceId").asText(null);
        if (referenceId == null || referenceId.isBlank()) {
            throw new DispatchException(operation + " returned no reference id");
        }
        return referenceId;
    }

    private static DispatchException toDispatchException(Throwable cause, AlarmRequest request) {
        if (cause instanceof DispatchException dispatchException) {
            log.warn("{}", dispatchException.getLocalizedMessage());
            return dispatchException;
        }
        String action = request == null ? "Status check" : request.toString();
        log.warn("{} could not be sent: {}", action, cause.getLocalizedMessage());
        return new DispatchException(action + " could not be sent: " + cause.getLocalizedMessage(), cause);
    }
}
