package cloud.aclinspector.auth;

import cloud.aclinspector.internal.Json;
import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Read-only view of an rclone configuration file. Tokens found here belong to another tool and are never written
 * back; refreshed copies live in memory only.
 */
public final class ForeignTokenStore {

    private static final Logger LOGGER = Logger.getLogger(ForeignTokenStore.class.getName());

    private final Path path;

    public ForeignTokenStore(Path path) {
        this.path = path;
    }

    public Path path() {
        return path;
    }

    public boolean exists() {
        return path != null && Files.isRegularFile(path);
    }

    /**
     * Reads the token of {@code remote}, or of the first OneDrive-like remote when {@code remote} is {@code null}.
     */
    public Optional<ForeignCredential> read(String remote) {
        if (!exists()) {
            return Optional.empty();
        }
        Map<String, Map<String, String>> sections;
        try {
            sections = parse(Files.readString(path, StandardCharsets.UTF_8));
        } catch (IOException ex) {
            LOGGER.warning(() -> "[acl-inspector] cannot read " + path + ": " + ex.getMessage());
            return Optional.empty();
        }

        String name = remote == null || remote.isBlank() ? detectRemote(sections).orElse(null) : stripColon(remote);
        if (name == null) {
            LOGGER.fine(() -> "[acl-inspector] no OneDrive remote in " + path);
            return Optional.empty();
        }
        Map<String, String> section = sections.get(name);
        if (section == null) {
            LOGGER.fine(() -> "[acl-inspector] remote " + name + " not present in " + path);
            return Optional.empty();
        }
        String blob = section.get("token");
        if (blob == null || blob.isBlank()) {
            return Optional.empty();
        }
        try {
            JsonNode node = Json.mapper().readTree(blob);
            String accessToken = node.path("access_token").asText("");
            if (accessToken.isBlank()) {
                return Optional.empty();
            }
            String refreshToken = node.path("refresh_token").asText("");
            Token token = new Token(
                accessToken,
                node.path("token_type").asText("Bearer"),
                refreshToken.isBlank() ? null : refreshToken,
                null,
                TokenExpiry.detect(node).orElse(null),
                Capability.READ_ONLY,
                TokenSource.FOREIGN
            );
            return Optional.of(new ForeignCredential(name, token));
        } catch (IOException ex) {
            LOGGER.warning(() -> "[acl-inspector] token of remote " + name + " is not valid JSON: " + ex.getMessage());
            return Optional.empty();
        }
    }

    static Optional<String> detectRemote(Map<String, Map<String, String>> sections) {
        for (Map.Entry<String, Map<String, String>> entry : sections.entrySet()) {
            String lower = entry.getKey().toLowerCase(Locale.ROOT);
            String type = entry.getValue().getOrDefault("type", "");
            if (lower.contains("onedrive") || lower.contains("sharepoint") || "onedrive".equalsIgnoreCase(type)) {
                return Optional.of(entry.getKey());
            }
        }
        return Optional.empty();
    }

    static Map<String, Map<String, String>> parse(String content) {
        Map<String, Map<String, String>> sections = new LinkedHashMap<>();
        Map<String, String> current = null;
        for (String raw : content.split("\\R")) {
            String line = raw.trim();
            if (line.isEmpty() || line.startsWith("#") || line.startsWith(";")) {
                continue;
            }
            if (line.startsWith("[") && line.endsWith("]")) {
                current = new LinkedHashMap<>();
                sections.put(line.substring(1, line.length() - 1).trim(), current);
                continue;
            }
            int eq = line.indexOf('=');
            if (current == null || eq < 0) {
                continue;
            }
            current.put(line.substring(0, eq).trim(), line.substring(eq + 1).trim());
        }
        return sections;
    }

    private static String stripColon(String remote) {
        String trimmed = remote.trim();
        return trimmed.endsWith(":") ? trimmed.substring(0, trimmed.length() - 1) : trimmed;
    }

    /**
     * A token borrowed from a named rclone remote.
     */
    public record ForeignCredential(String remote, Token token) {
        public ForeignCredential {
            Objects.requireNonNull(remote, "remote");
            Objects.requireNonNull(token, "token");
        }
    }
}
