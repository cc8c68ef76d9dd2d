package at.sv.securitas.api;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * A named GraphQL operation template.
 *
 * @param name          the {@code operationName} sent to the backend
 * @param responseField the field below {@code data} that holds the result
 * @param authMode      how the request is authenticated
 * @param query         the query or mutation text
 */
public record GraphQlOperation(String name, String responseField, AuthMode authMode, String query) {

    private static final String RESOURCE_PATTERN = "/graphql/%s.graphql";

    /**
     * Loads the query text from {@code graphql/<name>.graphql} on the classpath.
     */
    public static GraphQlOperation load(String name, String responseField, AuthMode authMode) {
        String resource = String.format(RESOURCE_PATTERN, name);
        try (InputStream in = GraphQlOperation.class.getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalArgumentException("No query template found for operation '" + name + "' at " + resource);
            }
            return new GraphQlOperation(name, responseField, authMode,
                    new String(in.readAllBytes(), StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read query template " + resource, e);
        }
    }
}
