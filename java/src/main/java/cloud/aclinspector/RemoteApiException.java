package cloud.aclinspector;

import java.util.Locale;

/**
 * Failure reported by (or while talking to) the remote storage API or the OAuth token endpoint.
 *
 * <p>
 * The {@link Kind} classifies the failure for propagation decisions: the scanner recovers from a failure at a single
 * descendant node, while the same failure at the traversal root or during a single-item lookup aborts the operation.
 * </p>
 */
public final class RemoteApiException extends AclInspectorException {

    private static final long serialVersionUID = 1L;

    public enum Kind {
        NOT_FOUND,
        FORBIDDEN,
        UNAUTHORIZED,
        RATE_LIMITED,
        TRANSPORT,
        MALFORMED_RESPONSE,
        OTHER
    }

    private final Kind kind;
    private final int statusCode;
    private final String code;

    public RemoteApiException(int statusCode, String code, String message) {
        this(kindForStatus(statusCode), statusCode, code, message, null);
    }

    public RemoteApiException(Kind kind, int statusCode, String code, String message, Throwable cause) {
        super(message == null || message.isBlank() ? defaultMessage(statusCode, code) : message, cause);
        this.kind = kind;
        this.statusCode = statusCode;
        this.code = code;
    }

    public static RemoteApiException transport(String message, Throwable cause) {
        return new RemoteApiException(Kind.TRANSPORT, 0, null, message, cause);
    }

    public static RemoteApiException malformed(String message, Throwable cause) {
        return new RemoteApiException(Kind.MALFORMED_RESPONSE, 0, null, message, cause);
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * @return HTTP status code, or {@code 0} when no response was received.
     */
    public int getStatusCode() {
        return statusCode;
    }

    /**
     * @return provider-specific error code (nullable when the response body did not include one).
     */
    public String getCode() {
        return code;
    }

    /**
     * A 401 whose error code says the bearer token itself is expired or invalid, as opposed to a generic
     * authentication failure.
     */
    public boolean isTokenExpired() {
        if (statusCode != 401 || code == null) {
            return false;
        }
        return "InvalidAuthenticationToken".equals(code) || code.toLowerCase(Locale.ROOT).contains("expired");
    }

    /**
     * Malformed responses propagate exactly like transport failures.
     */
    public boolean isTransport() {
        return kind == Kind.TRANSPORT || kind == Kind.MALFORMED_RESPONSE;
    }

    static Kind kindForStatus(int status) {
        switch (status) {
            case 401:
                return Kind.UNAUTHORIZED;
            case 403:
                return Kind.FORBIDDEN;
            case 404:
                return Kind.NOT_FOUND;
            case 429:
                return Kind.RATE_LIMITED;
            default:
                return Kind.OTHER;
        }
    }

    private static String defaultMessage(int status, String code) {
        if (code == null || code.isBlank()) {
            return "request failed with status " + status;
        }
        return "request failed with status " + status + " (" + code + ")";
    }
}
