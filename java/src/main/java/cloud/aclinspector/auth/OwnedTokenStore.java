package cloud.aclinspector.auth;

import cloud.aclinspector.internal.Json;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.io.File;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFileAttributeView;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

/**
 * The token file this tool creates and may freely rewrite.
 *
 * <pre>
 * {"access_token":"...","token_type":"Bearer","expires_at":"2025-10-22T23:53:05Z",
 *  "scope":"Files.ReadWrite.All offline_access","expires_in":3600,"refresh_token":"..."}
 * </pre>
 */
public final class OwnedTokenStore {

    private static final Logger LOGGER = Logger.getLogger(OwnedTokenStore.class.getName());
    private static final Set<PosixFilePermission> OWNER_ONLY = PosixFilePermissions.fromString("rw-------");
    private static final long DEFAULT_LIFETIME_SECONDS = 3600;

    private final Path path;
    private final Clock clock;

    public OwnedTokenStore(Path path) {
        this(path, Clock.systemUTC());
    }

    OwnedTokenStore(Path path, Clock clock) {
        this.path = Objects.requireNonNull(path, "path");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public Path path() {
        return path;
    }

    public boolean exists() {
        return Files.isRegularFile(path);
    }

    /**
     * @return the stored token, empty when the file is absent, unreadable, or carries no access token.
     */
    public Optional<Token> read() {
        if (!exists()) {
            return Optional.empty();
        }
        try {
            JsonNode node = Json.mapper().readTree(path.toFile());
            String accessToken = Json.text(node, "access_token");
            if (accessToken == null) {
                LOGGER.warning(() -> "[acl-inspector] " + path + " has no access_token; ignoring it");
                return Optional.empty();
            }
            String scope = Json.text(node, "scope");
            Instant expiry = TokenExpiry.detect(node).orElse(null);
            return Optional.of(new Token(
                accessToken,
                Json.text(node, "token_type"),
                Json.text(node, "refresh_token"),
                scope,
                expiry,
                Capability.fromScope(scope),
                TokenSource.OWNED
            ));
        } catch (IOException ex) {
            LOGGER.warning(() -> "[acl-inspector] cannot parse " + path + ": " + ex.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Writes {@code response} with owner-only permissions. Scope and refresh token fall back to {@code previous}
     * when the endpoint did not return new ones.
     *
     * @return the token as it now exists on disk.
     */
    public Token write(TokenResponse response, Token previous) throws IOException {
        String scope = response.scope() != null ? response.scope() : previous == null ? null : previous.getScope();
        String refreshToken = response.refreshToken() != null
            ? response.refreshToken() : previous == null ? null : previous.getRefreshToken();
        long lifetime = response.expiresIn() == null ? DEFAULT_LIFETIME_SECONDS : response.expiresIn();
        Instant expiry = clock.instant().plusSeconds(lifetime);
        String tokenType = response.tokenType() == null ? "Bearer" : response.tokenType();

        StoredToken stored = new StoredToken(
            response.accessToken(),
            tokenType,
            TokenExpiry.formatOwned(expiry),
            scope,
            lifetime,
            refreshToken
        );

        Path parent = path.toAbsolutePath().getParent();
        Files.createDirectories(parent);
        Path temp = Files.createTempFile(parent, ".token", ".tmp");
        try {
            restrictToOwner(temp);
            Json.prettyWriter().writeValue(temp.toFile(), stored);
            try {
                Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException ex) {
                Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
        restrictToOwner(path);
        LOGGER.info(() -> "[acl-inspector] saved token to " + path + " (scope: " + scope + ")");

        return new Token(
            response.accessToken(),
            tokenType,
            refreshToken,
            scope,
            TokenExpiry.parseOwned(stored.expiresAt()).orElse(expiry),
            Capability.fromScope(scope),
            TokenSource.OWNED
        );
    }

    private static void restrictToOwner(Path file) throws IOException {
        PosixFileAttributeView view = Files.getFileAttributeView(file, PosixFileAttributeView.class);
        if (view != null) {
            view.setPermissions(OWNER_ONLY);
            return;
        }
        File handle = file.toFile();
        boolean restricted = handle.setReadable(false, false) && handle.setReadable(true, true)
            && handle.setWritable(false, false) && handle.setWritable(true, true);
        if (!restricted) {
            LOGGER.warning(() -> "[acl-inspector] could not restrict permissions of " + file);
        }
    }

    record StoredToken(
        @JsonProperty("access_token") String accessToken,
        @JsonProperty("token_type") String tokenType,
        @JsonProperty("expires_at") String expiresAt,
        @JsonProperty("scope") String scope,
        @JsonProperty("expires_in") Long expiresIn,
        @JsonProperty("refresh_token") String refreshToken
    ) {
    }
}
