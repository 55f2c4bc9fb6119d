package cloud.aclinspector.auth;

import cloud.aclinspector.auth.ForeignTokenStore.ForeignCredential;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ForeignTokenStoreTest {

    static final String CONF = "# rclone config\n"
        + "[photos]\n"
        + "type = s3\n"
        + "\n"
        + "[Work]\n"
        + "type = onedrive\n"
        + "token = {\"access_token\":\"work-access\",\"token_type\":\"Bearer\",\"refresh_token\":\"work-refresh\","
        + "\"expiry\":\"2099-10-31T01:22:03.598349702+10:00\"}\n"
        + "drive_type = business\n"
        + "\n"
        + "[OneDrive]\n"
        + "type = onedrive\n"
        + "token = {\"access_token\":\"personal-access\",\"expiry\":\"2020-01-01T00:00:00Z\"}\n";

    @TempDir
    Path dir;

    @Test
    void autoDetectsFirstOneDriveRemote() throws Exception {
        Path conf = dir.resolve("rclone.conf");
        Files.writeString(conf, CONF);

        ForeignCredential credential = new ForeignTokenStore(conf).read(null).orElseThrow();

        assertEquals("Work", credential.remote());
        Token token = credential.token();
        assertEquals("work-access", token.getAccessToken());
        assertEquals("work-refresh", token.getRefreshToken());
        assertEquals(Instant.parse("2099-10-30T15:22:03.598349702Z"), token.getExpiry());
        assertEquals(Capability.READ_ONLY, token.getCapability());
        assertEquals(TokenSource.FOREIGN, token.getSource());
    }

    @Test
    void readsNamedRemoteWithOrWithoutColon() throws Exception {
        Path conf = dir.resolve("rclone.conf");
        Files.writeString(conf, CONF);
        ForeignTokenStore store = new ForeignTokenStore(conf);

        assertEquals("personal-access", store.read("OneDrive:").orElseThrow().token().getAccessToken());
        assertTrue(store.read("OneDrive").orElseThrow().token().isExpired(Instant.now()));
        assertTrue(store.read("missing").isEmpty());
        assertTrue(store.read("photos").isEmpty());
    }

    @Test
    void detectionMatchesNameOrType() {
        Map<String, Map<String, String>> byName = ForeignTokenStore.parse("[my-sharepoint]\ntype = webdav\n");
        Map<String, Map<String, String>> none = ForeignTokenStore.parse("[disk]\ntype = local\n");

        assertEquals(Optional.of("my-sharepoint"), ForeignTokenStore.detectRemote(byName));
        assertTrue(ForeignTokenStore.detectRemote(none).isEmpty());
    }

    @Test
    void absentFileReadsAsEmpty() {
        assertTrue(new ForeignTokenStore(dir.resolve("none.conf")).read(null).isEmpty());
        assertTrue(new ForeignTokenStore(null).read(null).isEmpty());
    }
}
