package at.sv.securitas.installation;

import java.util.Set;

final class SentinelName {

    private static final String DEFAULT_NAME = "CONFORT";
    private static final String PORTUGUESE_NAME = "COMFORTO";
    private static final Set<String> PORTUGUESE_LANGUAGES = Set.of("br", "pt");

    private SentinelName() {
    }

    /**
     * @return the request code Sentinel services use in the given language
     */
    static String forLanguage(String language) {
        if (language != null && PORTUGUESE_LANGUAGES.contains(language)) {
            return PORTUGUESE_NAME;
        }
        return DEFAULT_NAME;
    }
}
