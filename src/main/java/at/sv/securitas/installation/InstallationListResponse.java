package at.sv.securitas.installation;

import lombok.Data;

import java.util.List;

@Data
final class InstallationListResponse {
    List<InstallationData> installations;

    @Data
    static final class InstallationData {
        String numinst;
        String alias;
        String panel;
        String type;
        String name;
        String surname;
        String address;
        String city;
        String postcode;
        String province;
        String email;
        String phone;
    }
}
