package cloud.aclinspector.auth;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Local HTTP listener receiving the OAuth redirect and resolving an {@link AuthorizationSession}.
 */
public final class LoopbackCallbackServer implements AutoCloseable {

    private static final Logger LOGGER = Logger.getLogger(LoopbackCallbackServer.class.getName());

    private final HttpServer server;
    private final AuthorizationSession session;

    private LoopbackCallbackServer(HttpServer server, AuthorizationSession session) {
        this.server = server;
        this.session = session;
    }

    /**
     * Starts listening on the loopback interface at the port of {@code redirectUri}; port 0 picks a free one.
     */
    public static LoopbackCallbackServer start(URI redirectUri, AuthorizationSession session) throws IOException {
        int port = redirectUri.getPort() < 0 ? 80 : redirectUri.getPort();
        String path = redirectUri.getPath() == null || redirectUri.getPath().isEmpty() ? "/" : redirectUri.getPath();
        HttpServer server = HttpServer.create(new InetSocketAddress(InetAddress.getLoopbackAddress(), port), 0);
        LoopbackCallbackServer callback = new LoopbackCallbackServer(server, session);
        server.createContext(path, callback::handle);
        server.start();
        LOGGER.fine(() -> "[acl-inspector] waiting for authorization redirect on port " + server.getAddress().getPort());
        return callback;
    }

    public int port() {
        return server.getAddress().getPort();
    }

    private void handle(HttpExchange exchange) throws IOException {
        Map<String, String> params = parseQuery(exchange.getRequestURI().getRawQuery());
        if (!session.state().equals(params.get("state"))) {
            respond(exchange, 400, "Authorization state mismatch. You can close this window.");
            return;
        }
        if (params.containsKey("error")) {
            String reason = params.getOrDefault("error_description", params.get("error"));
            session.fail(reason);
            respond(exchange, 400, "Authorization failed: " + reason);
            return;
        }
        String code = params.get("code");
        if (code == null || code.isBlank()) {
            respond(exchange, 400, "Missing authorization code.");
            return;
        }
        session.complete(code);
        respond(exchange, 200, "Authorization complete. You can close this window.");
    }

    static Map<String, String> parseQuery(String rawQuery) {
        Map<String, String> params = new HashMap<>();
        if (rawQuery == null || rawQuery.isEmpty()) {
            return params;
        }
        for (String pair : rawQuery.split("&")) {
            int eq = pair.indexOf('=');
            String key = eq < 0 ? pair : pair.substring(0, eq);
            String value = eq < 0 ? "" : pair.substring(eq + 1);
            params.putIfAbsent(
                URLDecoder.decode(key, StandardCharsets.UTF_8),
                URLDecoder.decode(value, StandardCharsets.UTF_8)
            );
        }
        return params;
    }

    private static void respond(HttpExchange exchange, int status, String text) throws IOException {
        byte[] bytes = ("<html><body><p>" + text + "</p></body></html>").getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "text/html; charset=utf-8");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    @Override
    public void close() {
        server.stop(0);
    }
}
