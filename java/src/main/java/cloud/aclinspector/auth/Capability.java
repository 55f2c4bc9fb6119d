package cloud.aclinspector.auth;

import java.util.Arrays;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Privilege tier of a token, derived from its granted scopes.
 */
public enum Capability {
    FULL,
    READ_ONLY,
    UNKNOWN,
    INSUFFICIENT;

    private static final Set<String> WRITE_SCOPES = Set.of("files.readwrite", "files.readwrite.all");
    private static final Set<String> READ_SCOPES = Set.of("files.read", "files.read.all");

    /**
     * A write scope ({@code Files.ReadWrite[.All]}) is enough for sharing changes; {@code Sites.Manage.All} is often
     * not granted to personal accounts and is not required.
     */
    public static Capability fromScope(String scope) {
        if (scope == null || scope.isBlank()) {
            return UNKNOWN;
        }
        Set<String> granted = Arrays.stream(scope.trim().split("[\\s,]+"))
            .map(s -> s.toLowerCase(Locale.ROOT))
            .collect(Collectors.toSet());
        if (granted.stream().anyMatch(WRITE_SCOPES::contains)) {
            return FULL;
        }
        if (granted.stream().anyMatch(READ_SCOPES::contains)) {
            return READ_ONLY;
        }
        return UNKNOWN;
    }

    /**
     * @param required capability demanded by the caller, {@code null} meaning any.
     */
    public boolean satisfies(Capability required) {
        if (required == null || required == UNKNOWN || required == INSUFFICIENT) {
            return this != INSUFFICIENT;
        }
        if (required == READ_ONLY) {
            return this == FULL || this == READ_ONLY;
        }
        return this == FULL;
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT).replace('_', '-');
    }
}
