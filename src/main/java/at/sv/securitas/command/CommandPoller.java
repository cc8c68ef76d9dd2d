package at.sv.securitas.command;

import at.sv.securitas.api.ApiFailure;
import at.sv.securitas.api.AuthenticationFailure;
import at.sv.securitas.api.ConnectionFailure;
import at.sv.securitas.api.Futures;
import at.sv.securitas.api.GraphQlCall;
import at.sv.securitas.api.GraphQlClient;
import at.sv.securitas.api.OperationRegistry;
import at.sv.securitas.session.Session;
import at.sv.securitas.session.SessionManager;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.time.Duration;
import java.time.ZonedDateTime;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Drives an issued command to {@link CommandState#CONFIRMED}, {@link CommandState#FAILED} or
 * {@link CommandState#TIMEOUT} by polling its status.
 * <p>
 * Polls are sequential: each poll is scheduled one interval after the previous response and sends the previous
 * counter plus one. Connection and backend failures of a poll are retried within the attempt and time budget of the
 * {@link PollPolicy}; a request still running at the end of the time budget is cancelled. A rejected session ends
 * polling and is marked invalid in the {@link SessionManager}. The in-flight slot of the command is released when
 * polling ends, including cancellation.
 */
@Slf4j
public final class CommandPoller {

    static final String CHECK_ALARM_SERVICE_ID = "11";

    private final CommandDispatcher dispatcher;
    private final GraphQlClient client;
    private final SessionManager sessions;
    private final ScheduledExecutorService scheduler;
    private final Supplier<ZonedDateTime> currentTime;

    public CommandPoller(CommandDispatcher dispatcher, GraphQlClient client, SessionManager sessions,
                         ScheduledExecutorService scheduler, Supplier<ZonedDateTime> currentTime) {
        this.dispatcher = dispatcher;
        this.client = client;
        this.sessions = sessions;
        this.scheduler = scheduler;
        this.currentTime = currentTime;
    }

    /**
     * Starts polling the given command.
     *
     * @return a future with the outcome. Completes exceptionally if the session was rejected. Cancelling the future
     * stops polling without an outcome.
     */
    public CompletableFuture<CommandOutcome> drive(Session session, Command command, PollPolicy policy) {
        PollRun run = new PollRun(session, command, policy);
        run.start();
        return run.outcome;
    }

    private final class PollRun {
        private final CompletableFuture<CommandOutcome> outcome = new CompletableFuture<>();
        private final PollPolicy policy;
        private final ZonedDateTime deadline;
        private final String context;
        private volatile Session session;
        private volatile Command command;
        private volatile int attempts;
        private volatile ScheduledFuture<?> scheduled;
        private volatile CompletableFuture<?> inFlight;

        private PollRun(Session session, Command command, PollPolicy policy) {
            this.session = session;
            this.command = command;
            this.policy = policy;
            deadline = currentTime.get().plus(policy.budget());
            context = "poll " + command.installation().number() + " " +
                      (command.isStatusCheck() ? "status" : command.request());
        }

        private void start() {
            outcome.whenComplete((result, error) -> {
                if (outcome.isCancelled()) {
                    cancel();
                }
            });
            log.debug("Polling {}", command);
            scheduleNext();
        }

        private void scheduleNext() {
            if (outcome.isDone()) {
                return;
            }
            try {
                scheduled = scheduler.schedule(this::poll, policy.interval().toMillis(), TimeUnit.MILLISECONDS);
            } catch (RejectedExecutionException e) {
                fail(e);
            }
        }

        private void poll() {
            MDC.put("context", context);
            try {
                if (outcome.isDone()) {
                    return;
                }
                if (attempts >= policy.maxAttempts()) {
                    timeout("No result after " + attempts + " polls");
                    return;
                }
                if (currentTime.get().isAfter(deadline)) {
                    timeout("No result within " + policy.budget());
                    return;
                }
                Command polling = command.nextPoll();
                command = polling;
                attempts++;
                log.trace("Poll {} of {}", polling.counter(), polling.referenceId());
                CompletableFuture<PollResponse> response = sessions.ensureValid(session).thenCompose(valid -> {
                    session = valid;
                    CompletableFuture<JsonNode> request = client.execute(createPollCall(valid, polling));
                    inFlight = request;
                    return request.thenApply(result -> client.readValue(result, PollResponse.class));
                });
                response.whenComplete(this::onResponse);
                watchDeadline(response);
            } catch (Exception e) {
                log.error("Uncaught exception: {}", e.getLocalizedMessage(), e);
                fail(e);
            }
        }

        private void onResponse(PollResponse response, Throwable error) {
            MDC.put("context", context);
            if (outcome.isDone()) {
                return;
            }
            if (error != null) {
                onFailure(Futures.unwrap(error));
                return;
            }
            command = command.withResponse(response);
            if (response.isOk()) {
                finish(CommandState.CONFIRMED, toAlarmStatus(response), response.getMsg(), null);
            } else if (response.isFailure()) {
                onRejected(response);
            } else if (response.isWait()) {
                log.trace("Command still pending");
                scheduleNext();
            } else {
                log.warn("Unexpected poll result '{}': {}", response.getRes(), response.getMsg());
                scheduleNext();
            }
        }

        private void onFailure(Throwable cause) {
            if (cause instanceof AuthenticationFailure) {
                sessions.invalidate(session);
                fail(cause);
            } else if (cause instanceof ConnectionFailure || cause instanceof ApiFailure) {
                log.warn("Poll {} failed, retrying: {}", command.counter(), cause.getLocalizedMessage());
                scheduleNext();
            } else {
                fail(cause);
            }
        }

        private void onRejected(PollResponse response) {
            ArmError error = response.getError();
            if (error != null && error.isForceable() && canForce()) {
                reissueForced(error);
            } else {
                finish(CommandState.FAILED, null, response.getMsg(), error);
            }
        }

        private boolean canForce() {
            return policy.forceOverride() && !command.forced() && !command.isStatusCheck() && !command.isDisarm();
        }

        private void reissueForced(ArmError error) {
            String forceReferenceId = error.getReferenceId() != null ? error.getReferenceId() : command.referenceId();
            log.info("Command blocked by '{}', forcing it", error.getType());
            Command blocked = command;
            CompletableFuture<Command> reissue = sessions.ensureValid(session)
                                                         .thenCompose(valid -> {
                                                             session = valid;
                                                             return dispatcher.reissueForced(valid, blocked, forceReferenceId);
                                                         });
            inFlight = reissue;
            watchDeadline(reissue);
            reissue.whenComplete((forced, reissueError) -> {
                MDC.put("context", context);
                if (outcome.isDone()) {
                    return;
                }
                if (reissueError != null) {
                    Throwable cause = Futures.unwrap(reissueError);
                    if (Futures.isCausedBy(cause, AuthenticationFailure.class)) {
                        sessions.invalidate(session);
                        fail(cause);
                        return;
                    }
                    finish(CommandState.FAILED, null, "Forced re-issue failed: " + cause.getLocalizedMessage(), error);
                    return;
                }
                command = forced;
                scheduleNext();
            });
        }

        /**
         * Ends polling with {@link CommandState#TIMEOUT} if the given step is still running at the deadline.
         */
        private void watchDeadline(CompletableFuture<?> step) {
            if (step.isDone()) {
                return;
            }
            long remaining = Math.max(0, Duration.between(currentTime.get(), deadline).toMillis());
            try {
                ScheduledFuture<?> watchdog = scheduler.schedule(() -> onDeadline(step), remaining, TimeUnit.MILLISECONDS);
                if (watchdog != null) {
                    step.whenComplete((result, error) -> watchdog.cancel(false));
                }
            } catch (RejectedExecutionException e) {
                log.warn("Failed to watch poll deadline: {}", e.getLocalizedMessage());
            }
        }

        private void onDeadline(CompletableFuture<?> step) {
            MDC.put("context", context);
            if (outcome.isDone() || step.isDone()) {
                return;
            }
            timeout("No response within " + policy.budget());
            CompletableFuture<?> request = inFlight;
            if (request != null) {
                request.cancel(true);
            }
        }

        private GraphQlCall createPollCall(Session valid, Command polling) {
            GraphQlCall.GraphQlCallBuilder builder = GraphQlCall.builder()
                                                                .operationName(getPollOperation(polling))
                                                                .session(valid)
                                                                .installation(polling.installation())
                                                                .variable("numinst", polling.installation().number())
                                                                .variable("panel", polling.installation().panel())
                                                                .variable("referenceId", polling.referenceId())
                                                                .variable("counter", polling.counter());
            if (polling.isStatusCheck()) {
                builder.variable("idService", CHECK_ALARM_SERVICE_ID);
            } else {
                builder.variable("request", polling.request().code());
            }
            if (polling.currentStatus() != null) {
                builder.variable("currentStatus", polling.currentStatus());
            }
            return builder.build();
        }

        private String getPollOperation(Command polling) {
            if (polling.isStatusCheck()) {
                return OperationRegistry.CHECK_ALARM_STATUS;
            }
            return polling.isDisarm() ? OperationRegistry.DISARM_STATUS : OperationRegistry.ARM_STATUS;
        }

        private AlarmStatus toAlarmStatus(PollResponse response) {
            String number = response.getNuminst() != null ? response.getNuminst() : command.installation().number();
            return new AlarmStatus(number, response.getRes(), response.getMsg(), response.getStatus(),
                    response.getProtomResponse(), response.getProtomResponseDate());
        }

        private void timeout(String message) {
            log.warn("Giving up: {}", message);
            finish(CommandState.TIMEOUT, null, message, null);
        }

        private void finish(CommandState state, AlarmStatus status, String message, ArmError error) {
            Command terminal = command.terminal(state);
            command = terminal;
            dispatcher.release(terminal);
            log.info("{} after {} polls: {}", state, attempts, message);
            outcome.complete(new CommandOutcome(state, terminal, status, message, error));
        }

        private void fail(Throwable cause) {
            log.warn("Polling aborted: {}", cause.getLocalizedMessage());
            dispatcher.release(command);
            outcome.completeExceptionally(cause);
        }

        private void cancel() {
            log.debug("Polling of {} cancelled", command.referenceId());
            ScheduledFuture<?> next = scheduled;
            if (next != null) {
                next.cancel(false);
            }
            CompletableFuture<?> request = inFlight;
            if (request != null) {
                request.cancel(true);
            }
            dispatcher.release(command);
        }
    }
}
