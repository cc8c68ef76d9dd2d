package at.sv.securitas.session;

public record Credentials(String user, String password) {

    @Override
    public String toString() {
        return "Credentials{user=" + user + ", password=***}";
    }
}
