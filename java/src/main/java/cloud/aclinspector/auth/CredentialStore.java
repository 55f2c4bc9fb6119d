package cloud.aclinspector.auth;

import cloud.aclinspector.AclInspectorException;
import cloud.aclinspector.Config;
import cloud.aclinspector.CredentialException;
import cloud.aclinspector.CredentialException.Reason;
import cloud.aclinspector.auth.ForeignTokenStore.ForeignCredential;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Resolves access tokens from the owned token file and, failing that, from a foreign rclone remote.
 *
 * <p>
 * Owned tokens are refreshed when expired and the refreshed token is persisted immediately. Foreign tokens are
 * refreshed once on every acquisition, in memory only: the foreign file is never written. Foreign tokens are always
 * treated as {@link Capability#READ_ONLY}.
 * </p>
 */
public final class CredentialStore {

    private static final Logger LOGGER = Logger.getLogger(CredentialStore.class.getName());

    static final String LOGIN_HINT = "run 'acl-inspector --login' to authorize with write access";

    private final OwnedTokenStore owned;
    private final ForeignTokenStore foreign;
    private final OAuthTokenClient oauth;
    private final Clock clock;

    public CredentialStore(Config config) {
        this(config, new OAuthTokenClient(config), Clock.systemUTC());
    }

    CredentialStore(Config config, OAuthTokenClient oauth, Clock clock) {
        Objects.requireNonNull(config, "config");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.owned = new OwnedTokenStore(config.getOwnedTokenPath(), clock);
        this.foreign = new ForeignTokenStore(config.getForeignConfigPath());
        this.oauth = Objects.requireNonNull(oauth, "oauth");
    }

    public OwnedTokenStore ownedStore() {
        return owned;
    }

    public ForeignTokenStore foreignStore() {
        return foreign;
    }

    public OAuthTokenClient oauthClient() {
        return oauth;
    }

    Clock clock() {
        return clock;
    }

    /**
     * Resolves a token able to satisfy {@code required}.
     *
     * @param remote      foreign remote name, {@code null} to auto-detect.
     * @param required    capability the caller needs, {@code null} for any.
     * @param preferOwned whether the owned token file is consulted first.
     * @throws CredentialException when no source yields a usable token.
     */
    public Token acquire(String remote, Capability required, boolean preferOwned) throws CredentialException {
        if (preferOwned) {
            Optional<Token> ownedToken = acquireOwned();
            if (ownedToken.isPresent()) {
                return requireCapability(ownedToken.get(), required);
            }
        }
        return acquireForeign(remote, required);
    }

    /**
     * Refreshes {@code token} with its refresh token. Owned tokens are persisted; foreign ones are not.
     */
    public Token refresh(Token token) throws CredentialException {
        Objects.requireNonNull(token, "token");
        if (!token.hasRefreshToken()) {
            throw new CredentialException(Reason.REFRESH_FAILED, "token has no refresh token", remediationFor(token));
        }
        try {
            TokenResponse response = oauth.refresh(token.getRefreshToken());
            if (token.getSource() == TokenSource.OWNED) {
                return owned.write(response, token);
            }
            return foreignRefreshed(response, token);
        } catch (AclInspectorException | IOException ex) {
            throw new CredentialException(
                Reason.REFRESH_FAILED,
                "token refresh failed: " + ex.getMessage(),
                remediationFor(token),
                ex
            );
        }
    }

    /**
     * Persists the result of an authorization-code exchange as the new owned token.
     */
    public Token storeAuthorized(TokenResponse response) throws AclInspectorException {
        Objects.requireNonNull(response, "response");
        try {
            return owned.write(response, owned.read().orElse(null));
        } catch (IOException ex) {
            throw AclInspectorException.io("save token to " + owned.path(), ex);
        }
    }

    /**
     * Returns a provider that acquires lazily, caches the token and refreshes it on demand.
     */
    public TokenProvider tokenProvider(String remote, Capability required, boolean preferOwned) {
        return new CachingTokenProvider(this, remote, required, preferOwned);
    }

    private Optional<Token> acquireOwned() {
        Optional<Token> stored = owned.read();
        if (stored.isEmpty()) {
            LOGGER.fine(() -> "[acl-inspector] no owned token at " + owned.path());
            return Optional.empty();
        }
        Token token = stored.get();
        if (!token.isExpired(clock.instant())) {
            LOGGER.fine(() -> "[acl-inspector] using owned token (" + token.getCapability().label()
                + ", expires " + token.expiryInfo() + ")");
            return stored;
        }
        if (!token.hasRefreshToken()) {
            LOGGER.warning(() -> "[acl-inspector] owned token expired at " + token.expiryInfo()
                + " and has no refresh token");
            return Optional.empty();
        }
        try {
            Token refreshed = refresh(token);
            LOGGER.info(() -> "[acl-inspector] refreshed owned token, expires " + refreshed.expiryInfo());
            return Optional.of(refreshed);
        } catch (CredentialException ex) {
            LOGGER.warning(() -> "[acl-inspector] owned token refresh failed: " + ex.getMessage());
            return Optional.empty();
        }
    }

    private Token acquireForeign(String remote, Capability required) throws CredentialException {
        Optional<ForeignCredential> found = foreign.read(remote);
        if (found.isEmpty()) {
            throw new CredentialException(
                Reason.MISSING,
                "no usable token found (owned: " + owned.path() + ", rclone: " + foreign.path() + ")",
                LOGIN_HINT + ", or configure a OneDrive remote with 'rclone config'"
            );
        }
        ForeignCredential credential = found.get();
        if (required == Capability.FULL) {
            throw new CredentialException(
                Reason.INSUFFICIENT_CAPABILITY,
                "the rclone token of remote '" + credential.remote() + "' is read-only",
                LOGIN_HINT
            );
        }

        Token token = credential.token();
        boolean expired = token.isExpired(clock.instant());
        if (!token.hasRefreshToken()) {
            if (expired) {
                throw expiredForeign(credential, null);
            }
            return token;
        }
        try {
            TokenResponse response = oauth.refresh(token.getRefreshToken());
            Token refreshed = foreignRefreshed(response, token);
            LOGGER.fine(() -> "[acl-inspector] refreshed token of rclone remote " + credential.remote() + " in memory");
            return refreshed;
        } catch (AclInspectorException ex) {
            if (expired) {
                throw expiredForeign(credential, ex);
            }
            LOGGER.warning(() -> "[acl-inspector] refresh of rclone remote " + credential.remote()
                + " failed, using stored token: " + ex.getMessage());
            return token;
        }
    }

    private Token foreignRefreshed(TokenResponse response, Token previous) {
        long lifetime = response.expiresIn() == null ? 3600 : response.expiresIn();
        Instant expiry = clock.instant().plusSeconds(lifetime);
        return new Token(
            response.accessToken(),
            response.tokenType() == null ? previous.getTokenType() : response.tokenType(),
            response.refreshToken() == null ? previous.getRefreshToken() : response.refreshToken(),
            response.scope() == null ? previous.getScope() : response.scope(),
            expiry,
            Capability.READ_ONLY,
            TokenSource.FOREIGN
        );
    }

    private static CredentialException expiredForeign(ForeignCredential credential, Throwable cause) {
        return new CredentialException(
            Reason.EXPIRED,
            "the rclone token of remote '" + credential.remote() + "' has expired",
            "run 'rclone config reconnect " + credential.remote() + ":'",
            cause
        );
    }

    private Token requireCapability(Token token, Capability required) throws CredentialException {
        if (token.getCapability().satisfies(required)) {
            return token;
        }
        throw new CredentialException(
            Reason.INSUFFICIENT_CAPABILITY,
            "token capability is " + token.getCapability().label() + " but " + required.label() + " is required",
            LOGIN_HINT
        );
    }

    private String remediationFor(Token token) {
        return token.getSource() == TokenSource.OWNED
            ? LOGIN_HINT
            : "run 'rclone config reconnect <remote>:' or " + LOGIN_HINT;
    }
}
