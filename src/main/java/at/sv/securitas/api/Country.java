package at.sv.securitas.api;

/**
 * Countries with a dedicated customer API endpoint. Other country codes fall back to the generic Securitas Direct
 * domain, see {@link ApiDomain#forCountry(String)}.
 */
public enum Country {
    AR("https://customers.verisure.com.ar/owa-api/graphql", "ar"),
    BR("https://customers.verisure.com.br/owa-api/graphql", "br"),
    CL("https://customers.verisure.cl/owa-api/graphql", "es"),
    ES("https://customers.securitasdirect.es/owa-api/graphql", "es"),
    FR("https://customers.securitasdirect.fr/owa-api/graphql", "fr"),
    GB("https://customers.verisure.co.uk/owa-api/graphql", "en"),
    IE("https://customers.verisure.ie/owa-api/graphql", "en"),
    IT("https://customers.verisure.it/owa-api/graphql", "it");

    private final String url;
    private final String language;

    Country(String url, String language) {
        this.url = url;
        this.language = language;
    }

    public String getUrl() {
        return url;
    }

    public String getLanguage() {
        return language;
    }
}
