package cloud.aclinspector.auth;

import java.time.Instant;

/**
 * Represents a resolved access token together with its capability and origin.
 */
public final class Token {
    private final String accessToken;
    private final String tokenType;
    private final String refreshToken;
    private final String scope;
    private final Instant expiry;
    private final Capability capability;
    private final TokenSource source;

    public Token(
        String accessToken,
        String tokenType,
        String refreshToken,
        String scope,
        Instant expiry,
        Capability capability,
        TokenSource source
    ) {
        this.accessToken = accessToken;
        this.tokenType = tokenType;
        this.refreshToken = refreshToken;
        this.scope = scope;
        this.expiry = expiry;
        this.capability = capability;
        this.source = source;
    }

    public String getAccessToken() {
        return accessToken;
    }

    public String getTokenType() {
        return tokenType;
    }

    public String getRefreshToken() {
        return refreshToken;
    }

    public boolean hasRefreshToken() {
        return refreshToken != null && !refreshToken.isBlank();
    }

    public String getScope() {
        return scope;
    }

    /**
     * @return expiry instant, or {@code null} when the source did not record one.
     */
    public Instant getExpiry() {
        return expiry;
    }

    public Capability getCapability() {
        return capability;
    }

    public TokenSource getSource() {
        return source;
    }

    public boolean isExpired(Instant now) {
        return expiry != null && !now.isBefore(expiry);
    }

    /**
     * Human readable expiry, {@code "unknown"} when not recorded.
     */
    public String expiryInfo() {
        return expiry == null ? "unknown" : expiry.toString();
    }
}
