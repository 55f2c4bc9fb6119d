package cloud.aclinspector.auth;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.time.Instant;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OwnedTokenStoreTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @TempDir
    Path dir;

    @Test
    void readsTokenAndDerivesCapability() throws Exception {
        Path file = dir.resolve("token.json");
        Files.writeString(file, "{\"access_token\":\"abc\",\"token_type\":\"Bearer\","
            + "\"expires_at\":\"2099-01-01T00:00:00Z\",\"scope\":\"Files.Read offline_access\","
            + "\"expires_in\":\"3600\",\"refresh_token\":\"r1\"}");

        Token token = new OwnedTokenStore(file).read().orElseThrow();

        assertEquals("abc", token.getAccessToken());
        assertEquals("r1", token.getRefreshToken());
        assertEquals(Instant.parse("2099-01-01T00:00:00Z"), token.getExpiry());
        assertEquals(Capability.READ_ONLY, token.getCapability());
        assertEquals(TokenSource.OWNED, token.getSource());
    }

    @Test
    void missingOrCorruptFilesReadAsEmpty() throws Exception {
        OwnedTokenStore missing = new OwnedTokenStore(dir.resolve("absent.json"));
        assertTrue(missing.read().isEmpty());

        Path corrupt = dir.resolve("corrupt.json");
        Files.writeString(corrupt, "{not json");
        assertTrue(new OwnedTokenStore(corrupt).read().isEmpty());

        Path empty = dir.resolve("empty.json");
        Files.writeString(empty, "{\"token_type\":\"Bearer\"}");
        assertTrue(new OwnedTokenStore(empty).read().isEmpty());
    }

    @Test
    void writePreservesScopeAndRefreshTokenWhenResponseOmitsThem() throws Exception {
        Path file = dir.resolve("token.json");
        OwnedTokenStore store = new OwnedTokenStore(file);
        Token previous = new Token("old", "Bearer", "r1", "Files.ReadWrite.All offline_access",
            Instant.now().minusSeconds(10), Capability.FULL, TokenSource.OWNED);

        Token written = store.write(new TokenResponse("new", "Bearer", 1800L, null, null), previous);

        assertEquals("new", written.getAccessToken());
        assertEquals("r1", written.getRefreshToken());
        assertEquals(Capability.FULL, written.getCapability());
        assertFalse(written.isExpired(Instant.now()));

        JsonNode stored = MAPPER.readTree(file.toFile());
        assertEquals("new", stored.path("access_token").asText());
        assertEquals("Files.ReadWrite.All offline_access", stored.path("scope").asText());
        assertEquals("r1", stored.path("refresh_token").asText());
        assertEquals(1800, stored.path("expires_in").asInt());
        assertTrue(stored.path("expires_at").asText().matches("\\d{4}-\\d{2}-\\d{2}T\\d{2}:\\d{2}:\\d{2}Z"));

        Token reread = store.read().orElseThrow();
        assertEquals("new", reread.getAccessToken());
    }

    @Test
    void writeDefaultsLifetimeAndRestrictsPermissions() throws Exception {
        Path file = dir.resolve("nested").resolve("token.json");
        OwnedTokenStore store = new OwnedTokenStore(file);

        Token written = store.write(new TokenResponse("abc", null, null, "Files.Read", null), null);

        assertEquals("Bearer", written.getTokenType());
        assertNull(written.getRefreshToken());
        assertEquals(3600, MAPPER.readTree(file.toFile()).path("expires_in").asInt());
        if (FileSystems.getDefault().supportedFileAttributeViews().contains("posix")) {
            assertEquals("rw-------", PosixFilePermissions.toString(Files.getPosixFilePermissions(file)));
        }
        try (Stream<Path> files = Files.list(file.getParent())) {
            assertEquals(1, files.count());
        }
    }
}
