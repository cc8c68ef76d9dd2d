package at.sv.securitas.installation;

import at.sv.securitas.api.GraphQlCall;
import at.sv.securitas.api.GraphQlClient;
import at.sv.securitas.api.JwtExpiry;
import at.sv.securitas.api.OperationRegistry;
import at.sv.securitas.session.Session;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Resolves the installations of an account together with their services, capabilities token and perimeter support.
 * An installation is either resolved completely or the returned future fails with {@link ResolutionException}.
 */
@Slf4j
public final class InstallationResolver {

    /**
     * Capabilities tokens are renewed this long before they expire.
     */
    public static final Duration RENEWAL_MARGIN = Duration.ofMinutes(1);
    private static final String PERIMETER_REQUEST = "PERI";

    private final GraphQlClient client;
    private final Supplier<ZonedDateTime> currentTime;
    private final boolean forcePerimetral;
    private final Duration fallbackTokenLifetime;

    /**
     * @param forcePerimetral       treat every installation as supporting perimeter arming
     * @param fallbackTokenLifetime the lifetime assumed for a capabilities token without readable expiry
     */
    public InstallationResolver(GraphQlClient client, Supplier<ZonedDateTime> currentTime, boolean forcePerimetral,
                                Duration fallbackTokenLifetime) {
        this.client = client;
        this.currentTime = currentTime;
        this.forcePerimetral = forcePerimetral;
        this.fallbackTokenLifetime = fallbackTokenLifetime;
    }

    public CompletableFuture<List<Installation>> resolveInstallations(Session session) {
        GraphQlCall call = GraphQlCall.builder()
                                      .operationName(OperationRegistry.INSTALLATION_LIST)
                                      .session(session)
                                      .build();
        return client.execute(call)
                     .thenApply(this::readInstallationList)
                     .thenCompose(installations -> resolveAll(session, installations));
    }

    /**
     * @return the given installation if its capabilities token is still valid, otherwise a copy with a renewed token
     */
    public CompletableFuture<Installation> ensureCapabilities(Session session, Installation installation) {
        if (installation.hasValidCapabilities(currentTime.get().toInstant(), RENEWAL_MARGIN)) {
            return CompletableFuture.completedFuture(installation);
        }
        log.debug("Capabilities token of installation {} expired, requesting a new one", installation.number());
        return fetchServices(session, installation.number(), installation.panel())
                .thenApply(services -> {
                    String capabilities = requireCapabilities(installation.number(), services);
                    return installation.toBuilder()
                                       .capabilities(capabilities)
                                       .capabilitiesExpiry(readExpiry(capabilities))
                                       .build();
                });
    }

    private List<InstallationListResponse.InstallationData> readInstallationList(JsonNode result) {
        if (!result.path("installations").isArray()) {
            throw new ResolutionException("Malformed installation list: " + result);
        }
        InstallationListResponse response = client.readValue(result, InstallationListResponse.class);
        for (InstallationListResponse.InstallationData data : response.getInstallations()) {
            if (isBlank(data.getNuminst()) || isBlank(data.getPanel())) {
                throw new ResolutionException("Installation without number or panel: alias='" + data.getAlias() + "'");
            }
        }
        log.debug("Found {} installations", response.getInstallations().size());
        return response.getInstallations();
    }

    private CompletableFuture<List<Installation>> resolveAll(Session session,
                                                             List<InstallationListResponse.InstallationData> list) {
        List<CompletableFuture<Installation>> futures = new ArrayList<>();
        for (InstallationListResponse.InstallationData data : list) {
            futures.add(resolve(session, data));
        }
        return CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
                                .thenApply(ignored -> futures.stream()
                                                             .map(CompletableFuture::join)
                                                             .collect(Collectors.toList()));
    }

    private CompletableFuture<Installation> resolve(Session session, InstallationListResponse.InstallationData data) {
        return fetchServices(session, data.getNuminst(), data.getPanel())
                .thenApply(services -> createInstallation(data, services));
    }

    private CompletableFuture<ServicesResponse> fetchServices(Session session, String number, String panel) {
        GraphQlCall call = GraphQlCall.builder()
                                      .operationName(OperationRegistry.SERVICES)
                                      .session(session)
                                      .installation(Installation.builder().number(number).panel(panel).build())
                                      .variable("numinst", number)
                                      .variable("uuid", client.getDevice().uuid())
                                      .build();
        return client.execute(call)
                     .thenApply(result -> client.readValue(result, ServicesResponse.class));
    }

    private Installation createInstallation(InstallationListResponse.InstallationData data, ServicesResponse services) {
        String capabilities = requireCapabilities(data.getNuminst(), services);
        ServicesResponse.InstallationServices installation = services.getInstallation();
        Installation resolved = Installation.builder()
                                            .number(data.getNuminst())
                                            .alias(data.getAlias())
                                            .panel(data.getPanel())
                                            .type(data.getType())
                                            .name(data.getName())
                                            .lastName(data.getSurname())
                                            .address(data.getAddress())
                                            .city(data.getCity())
                                            .postcode(data.getPostcode())
                                            .country(client.getDomain().country())
                                            .capabilities(capabilities)
                                            .capabilitiesExpiry(readExpiry(capabilities))
                                            .perimetral(isPerimetral(installation))
                                            .devices(createDevices(data.getNuminst(), installation))
                                            .build();
        log.info("Resolved {}", resolved);
        return resolved;
    }

    private static String requireCapabilities(String number, ServicesResponse services) {
        if (services.getInstallation() == null) {
            throw new ResolutionException("No services returned for installation " + number);
        }
        String capabilities = services.getInstallation().getCapabilities();
        if (isBlank(capabilities)) {
            throw new ResolutionException("No capabilities token returned for installation " + number);
        }
        return capabilities;
    }

    private boolean isPerimetral(ServicesResponse.InstallationServices installation) {
        if (forcePerimetral) {
            return true;
        }
        if (installation.getPartitionCount() > 1) {
            return true;
        }
        return getServices(installation).stream()
                                        .anyMatch(service -> PERIMETER_REQUEST.equals(service.getRequest()));
    }

    private List<Device> createDevices(String number, ServicesResponse.InstallationServices installation) {
        String sentinelName = SentinelName.forLanguage(client.getDomain().language());
        List<Device> devices = new ArrayList<>();
        for (ServicesResponse.Service service : getServices(installation)) {
            if (service.getRequest() == null) {
                continue;
            }
            boolean sentinel = sentinelName.equals(service.getRequest());
            if (sentinel && isBlank(service.getZone())) {
                throw new ResolutionException("Sentinel service " + service.getId() + " of installation " + number +
                                              " has no zone");
            }
            devices.add(new Device(service.getId(), service.getZone(), service.getDescription(), service.getRequest(),
                    sentinel ? Device.Kind.SENTINEL : Device.Kind.OTHER));
        }
        return devices;
    }

    private static List<ServicesResponse.Service> getServices(ServicesResponse.InstallationServices installation) {
        if (installation.getServices() == null) {
            return List.of();
        }
        return installation.getServices();
    }

    private Instant readExpiry(String capabilities) {
        return JwtExpiry.read(capabilities)
                        .orElseGet(() -> currentTime.get().toInstant().plus(fallbackTokenLifetime));
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
