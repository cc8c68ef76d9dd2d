package at.sv.securitas.api;

import java.net.MalformedURLException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.URL;
import java.util.Arrays;
import java.util.Locale;

/**
 * The endpoint and language used for one country.
 *
 * @param country  upper case ISO country code
 * @param url      the GraphQL endpoint
 * @param language the language sent with every authenticated request
 */
public record ApiDomain(String country, String url, String language) {

    private static final String DEFAULT_URL = "https://customers.securitasdirect.%s/owa-api/graphql";
    private static final String DEFAULT_LANGUAGE = "en";

    public static ApiDomain forCountry(String countryCode) {
        String country = countryCode.toUpperCase(Locale.ROOT);
        return Arrays.stream(Country.values())
                     .filter(known -> known.name().equals(country))
                     .findFirst()
                     .map(known -> new ApiDomain(country, known.getUrl(), known.getLanguage()))
                     .orElseGet(() -> new ApiDomain(country, String.format(DEFAULT_URL, country), DEFAULT_LANGUAGE));
    }

    public URL toUrl() {
        try {
            return new URI(url).toURL();
        } catch (MalformedURLException | URISyntaxException e) {
            throw new IllegalArgumentException("Failed to construct API url for country " + country, e);
        }
    }
}
