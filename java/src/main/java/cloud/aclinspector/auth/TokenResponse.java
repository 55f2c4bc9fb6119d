package cloud.aclinspector.auth;

/**
 * Successful reply of the OAuth token endpoint.
 *
 * @param expiresIn lifetime in seconds, or {@code null} when the endpoint omitted it.
 */
public record TokenResponse(
    String accessToken,
    String tokenType,
    Long expiresIn,
    String scope,
    String refreshToken
) {
}
