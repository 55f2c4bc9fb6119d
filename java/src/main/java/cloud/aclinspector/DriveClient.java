package cloud.aclinspector;

import cloud.aclinspector.auth.Capability;
import cloud.aclinspector.auth.Token;
import cloud.aclinspector.auth.TokenProvider;
import cloud.aclinspector.internal.ApiErrorDecoder;
import cloud.aclinspector.internal.HttpUtil;
import cloud.aclinspector.internal.Json;
import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.io.InputStream;
import java.net.http.HttpClient;
import java.net.http.HttpResponse;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Client for the drive endpoints used by the audit engine: item lookup, children, permissions, invite and
 * permission removal.
 *
 * <p>
 * Responses are decoded once into {@link DriveItem} and {@link Permission} records. Read calls recover once from a
 * token-expired 401 by forcing a token refresh; writes are never retried. Rate limiting (429) is reported as
 * {@link RemoteApiException.Kind#RATE_LIMITED} and never retried.
 * </p>
 */
public final class DriveClient implements AutoCloseable {

    private static final Logger LOGGER = Logger.getLogger(DriveClient.class.getName());

    static final String ROOT_REFERENCE_PATH = "/drive/root:";
    public static final String UNKNOWN_PATH = "Unknown";

    private final Config config;
    private final HttpClient httpClient;
    private final String baseUrl;
    private final TokenProvider tokenProvider;

    /**
     * @param config        configuration; defaults are applied to a copy.
     * @param tokenProvider source of bearer tokens, typically from
     *                      {@link cloud.aclinspector.auth.CredentialStore#tokenProvider}.
     */
    public DriveClient(Config config, TokenProvider tokenProvider) {
        Objects.requireNonNull(config, "config");
        this.config = config.withDefaults();
        this.httpClient = this.config.getHttpClient();
        this.baseUrl = this.config.getGraphBaseUrl();
        this.tokenProvider = Objects.requireNonNull(tokenProvider, "tokenProvider");
    }

    /**
     * The token the next call will use.
     */
    public Token token() throws AclInspectorException {
        return tokenProvider.token();
    }

    /**
     * The token the next call will use, provided it carries {@code required}.
     */
    public Token token(Capability required) throws AclInspectorException {
        return tokenProvider.require(required);
    }

    /**
     * Looks an item up by drive path; {@code ""} and {@code "/"} name the drive root.
     */
    public DriveItem itemByPath(String path) throws AclInspectorException {
        String trimmed = path == null ? "" : path.trim();
        while (trimmed.startsWith("/")) {
            trimmed = trimmed.substring(1);
        }
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        String url = trimmed.isEmpty()
            ? baseUrl + "/me/drive/root"
            : baseUrl + "/me/drive/root:/" + HttpUtil.encodePath(trimmed);
        return decodeItem(get(url, "look up " + (trimmed.isEmpty() ? "/" : "/" + trimmed)));
    }

    public DriveItem item(String itemId) throws AclInspectorException {
        return decodeItem(get(itemUrl(itemId), "look up item " + itemId));
    }

    /**
     * Lists all children of {@code itemId}, following {@code @odata.nextLink} pages.
     */
    public List<DriveItem> children(String itemId) throws AclInspectorException {
        List<DriveItem> results = new ArrayList<>();
        Set<String> fetched = new HashSet<>();
        String url = itemUrl(itemId) + "/children";
        while (url != null) {
            if (!fetched.add(url)) {
                String repeated = url;
                LOGGER.warning(() -> "[acl-inspector] next page of " + itemId + " repeats " + repeated
                    + "; stopping pagination");
                break;
            }
            JsonNode page = get(url, "list children of " + itemId);
            for (JsonNode child : page.path("value")) {
                results.add(decodeItem(child));
            }
            JsonNode next = page.path("@odata.nextLink");
            url = next.isTextual() && !next.asText().isBlank() ? next.asText() : null;
        }
        LOGGER.fine(() -> String.format(Locale.ROOT,
            "[acl-inspector] %s has %d children", itemId, results.size()));
        return results;
    }

    public List<Permission> permissions(String itemId) throws AclInspectorException {
        JsonNode root = get(itemUrl(itemId) + "/permissions", "fetch permissions of " + itemId);
        List<Permission> results = new ArrayList<>();
        for (JsonNode node : root.path("value")) {
            results.add(decodePermission(node));
        }
        return results;
    }

    /**
     * Grants {@code role} on {@code itemId} to {@code email}; sign-in is required to use the grant.
     *
     * @return the permissions the server created.
     */
    public List<Permission> invite(String itemId, String email, String role, String message)
        throws AclInspectorException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("requireSignIn", true);
        body.put("roles", List.of(role));
        body.put("recipients", List.of(Map.of("email", email)));
        body.put("message", message);

        LOGGER.info(() -> "[acl-inspector] inviting " + email + " as " + role + " on " + itemId);
        String action = "invite " + email;
        HttpResponse<InputStream> response = send("POST", itemUrl(itemId) + "/invite", body, action);
        try (InputStream bodyStream = response.body()) {
            if (response.statusCode() >= 400) {
                throw ApiErrorDecoder.decode(response.statusCode(), bodyStream);
            }
            JsonNode root = Json.mapper().readTree(bodyStream);
            List<Permission> created = new ArrayList<>();
            if (root != null) {
                for (JsonNode node : root.path("value")) {
                    created.add(decodePermission(node));
                }
            }
            return created;
        } catch (IOException ex) {
            throw RemoteApiException.malformed("decode invite response: " + ex.getMessage(), ex);
        }
    }

    /**
     * Deletes one permission. A connection that closes while the body of a successful status is being read counts
     * as success; a request that never received a status line does not.
     */
    public void deletePermission(String itemId, String permissionId) throws AclInspectorException {
        String url = itemUrl(itemId) + "/permissions/" + HttpUtil.encodePath(permissionId);
        String bearer = tokenProvider.token().getAccessToken();
        HttpResponse<InputStream> response;
        try {
            response = HttpUtil.sendJson(httpClient, "DELETE", url, null, bearer, config.getHttpTimeout());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new AclInspectorException("delete permission interrupted", ex);
        } catch (IOException ex) {
            throw RemoteApiException.transport("delete permission " + permissionId + ": " + ex.getMessage(), ex);
        }

        int status = response.statusCode();
        try (InputStream bodyStream = response.body()) {
            if (status >= 400) {
                throw ApiErrorDecoder.decode(status, bodyStream);
            }
        } catch (IOException ex) {
            if (status >= 400) {
                throw new RemoteApiException(status, null,
                    "delete permission " + permissionId + ": " + ex.getMessage());
            }
            if (!isConnectionClosed(ex)) {
                throw RemoteApiException.transport("delete permission " + permissionId + ": " + ex.getMessage(), ex);
            }
            LOGGER.fine(() -> "[acl-inspector] connection closed after status " + status
                + " for DELETE " + permissionId);
        }
        LOGGER.info(() -> "[acl-inspector] removed permission " + permissionId + " from " + itemId);
    }

    /**
     * Rebuilds the display path of an item by walking its parents up to the drive root.
     *
     * @return a path such as {@code /Documents/Finance}, or {@value #UNKNOWN_PATH} when it cannot be resolved.
     */
    public String resolvePath(String itemId) throws AclInspectorException {
        LinkedList<String> parts = new LinkedList<>();
        Set<String> seen = new HashSet<>();
        String currentId = itemId;
        try {
            while (currentId != null && seen.add(currentId)) {
                DriveItem current = item(currentId);
                parts.addFirst(current.name());
                if (ROOT_REFERENCE_PATH.equals(current.parentPath())) {
                    break;
                }
                currentId = current.parentId();
            }
        } catch (RemoteApiException ex) {
            LOGGER.fine(() -> "[acl-inspector] cannot resolve path of " + itemId + ": " + ex.getMessage());
            return UNKNOWN_PATH;
        }
        if (!parts.isEmpty() && "root".equalsIgnoreCase(parts.getFirst())) {
            parts.removeFirst();
        }
        return parts.isEmpty() ? UNKNOWN_PATH : "/" + String.join("/", parts);
    }

    @Override
    public void close() {
        // httpClient is managed externally; nothing to close.
    }

    private String itemUrl(String itemId) {
        return baseUrl + "/me/drive/items/" + HttpUtil.encodePath(Objects.requireNonNull(itemId, "itemId"));
    }

    private JsonNode get(String url, String action) throws AclInspectorException {
        try {
            return readJson(send("GET", url, null, action), action);
        } catch (RemoteApiException ex) {
            if (!ex.isTokenExpired()) {
                throw ex;
            }
            LOGGER.info(() -> "[acl-inspector] access token rejected as expired; refreshing once");
            tokenProvider.forceRefresh();
            return readJson(send("GET", url, null, action), action);
        }
    }

    private HttpResponse<InputStream> send(String method, String url, Object payload, String action)
        throws AclInspectorException {
        String bearer = tokenProvider.token().getAccessToken();
        LOGGER.fine(() -> "[acl-inspector] " + method + " " + url);
        try {
            return HttpUtil.sendJson(httpClient, method, url, payload, bearer, config.getHttpTimeout());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new AclInspectorException(action + " interrupted", ex);
        } catch (IOException ex) {
            throw RemoteApiException.transport(action + ": " + ex.getMessage(), ex);
        }
    }

    private static JsonNode readJson(HttpResponse<InputStream> response, String action) throws RemoteApiException {
        try (InputStream bodyStream = response.body()) {
            if (response.statusCode() >= 400) {
                throw ApiErrorDecoder.decode(response.statusCode(), bodyStream);
            }
            return Json.mapper().readTree(bodyStream);
        } catch (IOException ex) {
            throw RemoteApiException.malformed(action + ": " + ex.getMessage(), ex);
        }
    }

    static DriveItem decodeItem(JsonNode node) throws RemoteApiException {
        if (node == null || !node.path("id").isTextual()) {
            throw RemoteApiException.malformed("item without id", null);
        }
        JsonNode parent = node.path("parentReference");
        return new DriveItem(
            node.path("id").asText(),
            node.path("name").asText(""),
            node.has("folder") || node.has("root"),
            node.has("file"),
            Json.text(parent, "id"),
            Json.text(parent, "path")
        );
    }

    static Permission decodePermission(JsonNode node) {
        List<String> roles = new ArrayList<>();
        for (JsonNode role : node.path("roles")) {
            roles.add(role.asText());
        }

        List<Principal> principals = new ArrayList<>();
        addPrincipal(principals, node.path("grantedTo").path("user"));
        for (JsonNode identity : node.path("grantedToIdentities")) {
            addPrincipal(principals, identity.path("user"));
        }

        SharingLink link = null;
        JsonNode linkNode = node.path("link");
        if (linkNode.isObject()) {
            link = new SharingLink(Json.text(linkNode, "type"), Json.text(linkNode, "scope"));
        }

        String inheritedFrom = null;
        JsonNode inherited = node.path("inheritedFrom");
        if (!inherited.isMissingNode() && !inherited.isNull()) {
            String id = Json.text(inherited, "id");
            String path = Json.text(inherited, "path");
            inheritedFrom = id != null ? id : path != null ? path : inherited.toString();
        }

        return new Permission(
            Json.text(node, "id"),
            roles,
            principals,
            link,
            inheritedFrom,
            parseInstant(Json.text(node, "expirationDateTime"))
        );
    }

    private static void addPrincipal(List<Principal> principals, JsonNode user) {
        if (!user.isObject()) {
            return;
        }
        principals.add(new Principal(Json.text(user, "displayName"), Json.text(user, "email")));
    }

    private static Instant parseInstant(String value) {
        if (value == null) {
            return null;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException ex) {
            LOGGER.fine(() -> "[acl-inspector] unparseable expirationDateTime " + value);
            return null;
        }
    }

    private static boolean isConnectionClosed(IOException ex) {
        String message = ex.getMessage() == null ? "" : ex.getMessage().toLowerCase(Locale.ROOT);
        return message.contains("connection closed") || message.contains("connection reset")
            || message.contains("eof reached");
    }
}
