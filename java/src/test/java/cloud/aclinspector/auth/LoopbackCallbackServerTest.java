package cloud.aclinspector.auth;

import cloud.aclinspector.AclInspectorException;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LoopbackCallbackServerTest {

    private final HttpClient http = HttpClient.newHttpClient();

    @Test
    void redirectWithCodeCompletesSession() throws Exception {
        AuthorizationSession session = new AuthorizationSession("s-123");
        try (LoopbackCallbackServer server = LoopbackCallbackServer.start(URI.create("http://localhost:0/"), session)) {
            HttpResponse<String> response = get(server, "/?code=M.abc%2Fdef&state=s-123");

            assertEquals(200, response.statusCode());
            assertEquals("M.abc/def", session.await(Duration.ofSeconds(5)));
        }
    }

    @Test
    void stateMismatchLeavesSessionOpen() throws Exception {
        AuthorizationSession session = new AuthorizationSession("expected");
        try (LoopbackCallbackServer server = LoopbackCallbackServer.start(URI.create("http://localhost:0/"), session)) {
            HttpResponse<String> response = get(server, "/?code=abc&state=forged");

            assertEquals(400, response.statusCode());
            assertFalse(session.isDone());
        }
    }

    @Test
    void errorRedirectFailsSession() throws Exception {
        AuthorizationSession session = new AuthorizationSession("s");
        try (LoopbackCallbackServer server = LoopbackCallbackServer.start(URI.create("http://localhost:0/"), session)) {
            get(server, "/?error=access_denied&error_description=user+declined&state=s");

            AclInspectorException ex = assertThrows(AclInspectorException.class,
                () -> session.await(Duration.ofSeconds(5)));
            assertTrue(ex.getMessage().contains("user declined"));
        }
    }

    @Test
    void sessionResolvesOnce() throws Exception {
        AuthorizationSession session = new AuthorizationSession();

        assertTrue(session.complete("first"));
        assertFalse(session.complete("second"));
        assertFalse(session.cancel());
        assertEquals("first", session.await(Duration.ofSeconds(1)));
        assertFalse(session.state().isBlank());
    }

    @Test
    void cancelledAndTimedOutSessionsFail() {
        AuthorizationSession cancelled = new AuthorizationSession();
        cancelled.cancel();
        AclInspectorException ex = assertThrows(AclInspectorException.class,
            () -> cancelled.await(Duration.ofSeconds(1)));
        assertTrue(ex.getMessage().contains("cancelled"));

        AuthorizationSession idle = new AuthorizationSession();
        assertThrows(AclInspectorException.class, () -> idle.await(Duration.ofMillis(50)));
    }

    @Test
    void queryParsingKeepsFirstValue() {
        Map<String, String> params = LoopbackCallbackServer.parseQuery("a=1&a=2&flag&b=x%20y");

        assertEquals("1", params.get("a"));
        assertEquals("", params.get("flag"));
        assertEquals("x y", params.get("b"));
    }

    private HttpResponse<String> get(LoopbackCallbackServer server, String pathAndQuery) throws Exception {
        HttpRequest request = HttpRequest.newBuilder(URI.create("http://127.0.0.1:" + server.port() + pathAndQuery))
            .GET()
            .build();
        return http.send(request, HttpResponse.BodyHandlers.ofString());
    }
}
