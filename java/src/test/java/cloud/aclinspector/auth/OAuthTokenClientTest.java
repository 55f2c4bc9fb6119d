package cloud.aclinspector.auth;

import cloud.aclinspector.Config;
import cloud.aclinspector.RemoteApiException;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OAuthTokenClientTest {

    @Test
    void exchangeCodeAcceptsStringLifetime() throws Exception {
        try (FakeTokenEndpoint endpoint = FakeTokenEndpoint.start()) {
            endpoint.respond(200, Map.of("access_token", "new", "expires_in", "7200",
                "scope", "Files.ReadWrite.All", "refresh_token", "r1"));
            OAuthTokenClient client = new OAuthTokenClient(config(endpoint));

            TokenResponse response = client.exchangeCode("the-code");

            assertEquals("new", response.accessToken());
            assertEquals(Long.valueOf(7200), response.expiresIn());
            assertEquals("r1", response.refreshToken());
            Map<String, String> form = endpoint.forms().get(0);
            assertEquals("authorization_code", form.get("grant_type"));
            assertEquals("the-code", form.get("code"));
            assertEquals("http://localhost:53682/", form.get("redirect_uri"));
            assertFalse(form.containsKey("client_secret"));
        }
    }

    @Test
    void refreshWithoutLifetime() throws Exception {
        try (FakeTokenEndpoint endpoint = FakeTokenEndpoint.start()) {
            endpoint.respond(200, Map.of("access_token", "x"));

            TokenResponse response = new OAuthTokenClient(config(endpoint)).refresh("r");

            assertNull(response.expiresIn());
        }
    }

    @Test
    void endpointErrorIsRemoteApiException() throws Exception {
        try (FakeTokenEndpoint endpoint = FakeTokenEndpoint.start()) {
            endpoint.fail();

            RemoteApiException ex = assertThrows(RemoteApiException.class,
                () -> new OAuthTokenClient(config(endpoint)).refresh("r"));

            assertEquals(400, ex.getStatusCode());
        }
    }

    @Test
    void authorizationUrlCarriesState() {
        Config config = Config.builder().clientId("app-id").build();

        String url = new OAuthTokenClient(config).authorizationUrl("st4te");

        assertTrue(url.startsWith(Config.DEFAULT_AUTHORIZE_URL + "?client_id=app-id&response_type=code"));
        assertTrue(url.contains("redirect_uri=http%3A%2F%2Flocalhost%3A53682%2F"));
        assertTrue(url.endsWith("&state=st4te"));
    }

    private static Config config(FakeTokenEndpoint endpoint) {
        return Config.builder().tokenUrl(endpoint.url()).build();
    }
}
