package at.sv.securitas.installation;

import lombok.Data;

import java.util.List;

/**
 * Result of the {@code Srv} query.
 */
@Data
final class ServicesResponse {
    String res;
    String msg;
    String language;
    InstallationServices installation;

    @Data
    static final class InstallationServices {
        String numinst;
        String alias;
        String status;
        String panel;
        String capabilities;
        List<Service> services;
        ConfigRepoUser configRepoUser;

        int getPartitionCount() {
            if (configRepoUser == null || configRepoUser.alarmPartitions == null) {
                return 0;
            }
            return configRepoUser.alarmPartitions.size();
        }
    }

    @Data
    static final class Service {
        String id;
        String idService;
        Boolean active;
        Boolean visible;
        String request;
        String description;
        Attributes attributes;

        String getZone() {
            if (attributes == null || attributes.attributes == null || attributes.attributes.isEmpty()) {
                return null;
            }
            return attributes.attributes.get(0).value;
        }
    }

    @Data
    static final class Attributes {
        String name;
        List<Attribute> attributes;
    }

    @Data
    static final class Attribute {
        String name;
        String value;
        Boolean active;
    }

    @Data
    static final class ConfigRepoUser {
        List<AlarmPartition> alarmPartitions;
    }

    @Data
    static final class AlarmPartition {
        String id;
    }
}
