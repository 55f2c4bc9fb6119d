package cloud.aclinspector;

import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;

/**
 * Immutable configuration container used to bootstrap {@link DriveClient} and
 * {@link cloud.aclinspector.auth.CredentialStore} instances.
 */
public final class Config {

    public static final String DEFAULT_GRAPH_BASE_URL = "https://graph.microsoft.com/v1.0";
    public static final String DEFAULT_AUTHORIZE_URL = "https://login.microsoftonline.com/common/oauth2/v2.0/authorize";
    public static final String DEFAULT_TOKEN_URL = "https://login.microsoftonline.com/common/oauth2/v2.0/token";
    public static final String DEFAULT_CLIENT_ID = "b15665d9-eda6-4092-8539-0eec376afd59";
    public static final String DEFAULT_SCOPE =
        "Files.Read Files.ReadWrite Files.ReadWrite.All Sites.Manage.All offline_access";
    public static final String DEFAULT_REDIRECT_URI = "http://localhost:53682/";
    public static final String DEFAULT_OWNED_TOKEN_FILE = "token.json";
    public static final Duration DEFAULT_HTTP_TIMEOUT = Duration.ofSeconds(30);

    private final String graphBaseUrl;
    private final String authorizeUrl;
    private final String tokenUrl;
    private final String clientId;
    private final String clientSecret;
    private final String scope;
    private final String redirectUri;
    private final Path ownedTokenPath;
    private final Path foreignConfigPath;
    private final HttpClient httpClient;
    private final Duration httpTimeout;

    private Config(Builder builder) {
        this.graphBaseUrl = builder.graphBaseUrl;
        this.authorizeUrl = builder.authorizeUrl;
        this.tokenUrl = builder.tokenUrl;
        this.clientId = builder.clientId;
        this.clientSecret = builder.clientSecret;
        this.scope = builder.scope;
        this.redirectUri = builder.redirectUri;
        this.ownedTokenPath = builder.ownedTokenPath;
        this.foreignConfigPath = builder.foreignConfigPath;
        this.httpClient = builder.httpClient;
        this.httpTimeout = builder.httpTimeout;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Config withDefaults() {
        String resolvedGraphUrl = sanitizeUrl(Optional.ofNullable(graphBaseUrl).orElse(DEFAULT_GRAPH_BASE_URL));
        String resolvedAuthorizeUrl = sanitizeUrl(Optional.ofNullable(authorizeUrl).orElse(DEFAULT_AUTHORIZE_URL));
        String resolvedTokenUrl = sanitizeUrl(Optional.ofNullable(tokenUrl).orElse(DEFAULT_TOKEN_URL));
        String resolvedRedirect = Optional.ofNullable(trimToNull(redirectUri)).orElse(DEFAULT_REDIRECT_URI);
        sanitizeUrl(resolvedRedirect);

        String resolvedClientId = Optional.ofNullable(trimToNull(clientId)).orElse(DEFAULT_CLIENT_ID);
        String resolvedScope = Optional.ofNullable(trimToNull(scope)).orElse(DEFAULT_SCOPE);

        Duration resolvedTimeout = Optional.ofNullable(httpTimeout).orElse(DEFAULT_HTTP_TIMEOUT);
        if (resolvedTimeout.isNegative() || resolvedTimeout.isZero()) {
            resolvedTimeout = DEFAULT_HTTP_TIMEOUT;
        }

        HttpClient resolvedClient = httpClient;
        if (resolvedClient == null) {
            resolvedClient = HttpClient.newBuilder()
                .connectTimeout(resolvedTimeout)
                .build();
        }

        Path resolvedOwned = Optional.ofNullable(ownedTokenPath).orElse(Paths.get(DEFAULT_OWNED_TOKEN_FILE));
        Path resolvedForeign = Optional.ofNullable(foreignConfigPath)
            .orElseGet(() -> defaultForeignConfigPath(System.getenv(), System.getProperty("os.name", "")));

        return new Builder()
            .graphBaseUrl(resolvedGraphUrl)
            .authorizeUrl(resolvedAuthorizeUrl)
            .tokenUrl(resolvedTokenUrl)
            .clientId(resolvedClientId)
            .clientSecret(trimToNull(clientSecret))
            .scope(resolvedScope)
            .redirectUri(resolvedRedirect)
            .ownedTokenPath(resolvedOwned)
            .foreignConfigPath(resolvedForeign)
            .httpClient(resolvedClient)
            .httpTimeout(resolvedTimeout)
            .buildInternal();
    }

    /**
     * Location of the rclone configuration file: {@code $RCLONE_CONFIG} when set, {@code %APPDATA%} on Windows,
     * {@code ~/.config/rclone/rclone.conf} elsewhere.
     */
    static Path defaultForeignConfigPath(Map<String, String> env, String osName) {
        String explicit = trimToNull(env.get("RCLONE_CONFIG"));
        if (explicit != null) {
            return Paths.get(explicit);
        }
        String appData = trimToNull(env.get("APPDATA"));
        if (osName.toLowerCase(Locale.ROOT).startsWith("windows") && appData != null) {
            return Paths.get(appData, "rclone", "rclone.conf");
        }
        String home = Optional.ofNullable(trimToNull(env.get("HOME"))).orElse(System.getProperty("user.home", "."));
        return Paths.get(home, ".config", "rclone", "rclone.conf");
    }

    private static String sanitizeUrl(String url) {
        String trimmed = Optional.ofNullable(url).map(String::trim).orElse("");
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("URL must be non-empty");
        }
        try {
            URI uri = new URI(trimmed);
            if (uri.getScheme() == null || uri.getHost() == null) {
                throw new IllegalArgumentException("URL must include scheme and host: " + trimmed);
            }
        } catch (URISyntaxException ex) {
            throw new IllegalArgumentException("Invalid URL: " + trimmed, ex);
        }
        if (trimmed.endsWith("/")) {
            return trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    public String getGraphBaseUrl() {
        return graphBaseUrl;
    }

    public String getAuthorizeUrl() {
        return authorizeUrl;
    }

    public String getTokenUrl() {
        return tokenUrl;
    }

    public String getClientId() {
        return clientId;
    }

    /**
     * @return the client secret, or {@code null} for public clients.
     */
    public String getClientSecret() {
        return clientSecret;
    }

    public String getScope() {
        return scope;
    }

    public String getRedirectUri() {
        return redirectUri;
    }

    public Path getOwnedTokenPath() {
        return ownedTokenPath;
    }

    public Path getForeignConfigPath() {
        return foreignConfigPath;
    }

    public HttpClient getHttpClient() {
        return httpClient;
    }

    public Duration getHttpTimeout() {
        return httpTimeout;
    }

    public static final class Builder {
        private String graphBaseUrl;
        private String authorizeUrl;
        private String tokenUrl;
        private String clientId;
        private String clientSecret;
        private String scope;
        private String redirectUri;
        private Path ownedTokenPath;
        private Path foreignConfigPath;
        private HttpClient httpClient;
        private Duration httpTimeout;

        public Builder graphBaseUrl(String graphBaseUrl) {
            this.graphBaseUrl = graphBaseUrl;
            return this;
        }

        public Builder authorizeUrl(String authorizeUrl) {
            this.authorizeUrl = authorizeUrl;
            return this;
        }

        public Builder tokenUrl(String tokenUrl) {
            this.tokenUrl = tokenUrl;
            return this;
        }

        public Builder clientId(String clientId) {
            this.clientId = clientId;
            return this;
        }

        public Builder clientSecret(String clientSecret) {
            this.clientSecret = clientSecret;
            return this;
        }

        public Builder scope(String scope) {
            this.scope = scope;
            return this;
        }

        public Builder redirectUri(String redirectUri) {
            this.redirectUri = redirectUri;
            return this;
        }

        public Builder ownedTokenPath(Path ownedTokenPath) {
            this.ownedTokenPath = ownedTokenPath;
            return this;
        }

        public Builder foreignConfigPath(Path foreignConfigPath) {
            this.foreignConfigPath = foreignConfigPath;
            return this;
        }

        public Builder httpClient(HttpClient httpClient) {
            this.httpClient = httpClient;
            return this;
        }

        public Builder httpTimeout(Duration httpTimeout) {
            this.httpTimeout = httpTimeout;
            return this;
        }

        /**
         * Applies the recognised keys of a properties file. Keys that are absent leave the builder untouched.
         */
        public Builder properties(Properties properties) {
            String value = properties.getProperty("graph.baseUrl");
            if (value != null) {
                graphBaseUrl(value);
            }
            value = properties.getProperty("oauth.authorizeUrl");
            if (value != null) {
                authorizeUrl(value);
            }
            value = properties.getProperty("oauth.tokenUrl");
            if (value != null) {
                tokenUrl(value);
            }
            value = properties.getProperty("oauth.clientId");
            if (value != null) {
                clientId(value);
            }
            value = properties.getProperty("oauth.clientSecret");
            if (value != null) {
                clientSecret(value);
            }
            value = properties.getProperty("oauth.scope");
            if (value != null) {
                scope(value);
            }
            value = properties.getProperty("oauth.redirectUri");
            if (value != null) {
                redirectUri(value);
            }
            value = trimToNull(properties.getProperty("token.ownedPath"));
            if (value != null) {
                ownedTokenPath(Paths.get(value));
            }
            value = trimToNull(properties.getProperty("token.foreignConfigPath"));
            if (value != null) {
                foreignConfigPath(Paths.get(value));
            }
            value = trimToNull(properties.getProperty("http.timeoutSeconds"));
            if (value != null) {
                try {
                    httpTimeout(Duration.ofSeconds(Long.parseLong(value)));
                } catch (NumberFormatException ex) {
                    throw new IllegalArgumentException("http.timeoutSeconds must be a number: " + value, ex);
                }
            }
            return this;
        }

        public Config build() {
            return new Config(this).withDefaults();
        }

        private Config buildInternal() {
            return new Config(this);
        }
    }
}
