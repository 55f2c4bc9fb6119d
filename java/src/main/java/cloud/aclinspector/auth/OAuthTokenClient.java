package cloud.aclinspector.auth;

import cloud.aclinspector.AclInspectorException;
import cloud.aclinspector.Config;
import cloud.aclinspector.RemoteApiException;
import cloud.aclinspector.internal.ApiErrorDecoder;
import cloud.aclinspector.internal.HttpUtil;
import cloud.aclinspector.internal.Json;
import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.io.InputStream;
import java.net.http.HttpResponse;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Client for the OAuth token endpoint: refresh-token grants, authorization-code exchange and the matching
 * authorization URL.
 */
public final class OAuthTokenClient {

    private static final Logger LOGGER = Logger.getLogger(OAuthTokenClient.class.getName());

    private final Config config;

    public OAuthTokenClient(Config config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    public TokenResponse refresh(String refreshToken) throws AclInspectorException {
        if (refreshToken == null || refreshToken.isBlank()) {
            throw new AclInspectorException("refresh token is required");
        }
        Map<String, String> form = new LinkedHashMap<>();
        form.put("grant_type", "refresh_token");
        form.put("refresh_token", refreshToken);
        form.put("client_id", config.getClientId());
        form.put("client_secret", config.getClientSecret());
        form.put("scope", config.getScope());
        LOGGER.fine(() -> "[acl-inspector] requesting token refresh from " + config.getTokenUrl());
        return post(form, "refresh token");
    }

    public TokenResponse exchangeCode(String code) throws AclInspectorException {
        if (code == null || code.isBlank()) {
            throw new AclInspectorException("authorization code is required");
        }
        Map<String, String> form = new LinkedHashMap<>();
        form.put("grant_type", "authorization_code");
        form.put("code", code);
        form.put("client_id", config.getClientId());
        form.put("client_secret", config.getClientSecret());
        form.put("redirect_uri", config.getRedirectUri());
        form.put("scope", config.getScope());
        LOGGER.fine(() -> "[acl-inspector] exchanging authorization code at " + config.getTokenUrl());
        return post(form, "exchange authorization code");
    }

    /**
     * Builds the browser URL that starts an authorization-code flow redirecting to the configured loopback URI.
     */
    public String authorizationUrl(String state) {
        Map<String, String> query = new LinkedHashMap<>();
        query.put("client_id", config.getClientId());
        query.put("response_type", "code");
        query.put("redirect_uri", config.getRedirectUri());
        query.put("scope", config.getScope());
        query.put("response_mode", "query");
        query.put("prompt", "select_account");
        query.put("state", state);
        return config.getAuthorizeUrl() + "?" + HttpUtil.formEncode(query);
    }

    private TokenResponse post(Map<String, String> form, String action) throws AclInspectorException {
        HttpResponse<InputStream> response;
        try {
            response = HttpUtil.postForm(config.getHttpClient(), config.getTokenUrl(), form, config.getHttpTimeout());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new AclInspectorException(action + " interrupted", ex);
        } catch (IOException ex) {
            throw RemoteApiException.transport(action + ": " + ex.getMessage(), ex);
        }

        try (InputStream bodyStream = response.body()) {
            if (response.statusCode() >= 400) {
                throw ApiErrorDecoder.decode(response.statusCode(), bodyStream);
            }

            JsonNode node = Json.mapper().readTree(bodyStream);
            String accessToken = Json.text(node, "access_token");
            if (accessToken == null) {
                throw new AclInspectorException("token response missing access_token");
            }
            Long expiresIn = null;
            JsonNode expires = node.path("expires_in");
            if (expires.isNumber()) {
                expiresIn = expires.asLong();
            } else if (expires.isTextual() && expires.asText().matches("\\d+")) {
                expiresIn = Long.parseLong(expires.asText());
            }
            return new TokenResponse(
                accessToken,
                Json.text(node, "token_type"),
                expiresIn,
                Json.text(node, "scope"),
                Json.text(node, "refresh_token")
            );
        } catch (IOException ex) {
            throw RemoteApiException.malformed("decode token response: " + ex.getMessage(), ex);
        }
    }
}
