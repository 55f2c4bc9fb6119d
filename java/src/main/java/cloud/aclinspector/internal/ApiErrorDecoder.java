package cloud.aclinspector.internal;

import cloud.aclinspector.RemoteApiException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

/**
 * Utility for decoding error payloads from the drive API and the OAuth token endpoint.
 *
 * <p>
 * Graph errors look like {@code {"error":{"code":"itemNotFound","message":"..."}}}; OAuth errors look like
 * {@code {"error":"invalid_grant","error_description":"..."}}.
 * </p>
 */
public final class ApiErrorDecoder {

    private static final ObjectMapper MAPPER = Json.mapper();

    private ApiErrorDecoder() {
    }

    public static RemoteApiException decode(int statusCode, InputStream bodyStream) throws IOException {
        if (bodyStream == null) {
            return new RemoteApiException(statusCode, null, null);
        }

        byte[] bytes = bodyStream.readAllBytes();
        if (bytes.length == 0) {
            return new RemoteApiException(statusCode, null, null);
        }

        try {
            JsonNode node = MAPPER.readTree(bytes);
            JsonNode error = node.path("error");
            if (error.isObject()) {
                String code = error.hasNonNull("code") ? error.get("code").asText() : null;
                String message = error.hasNonNull("message") ? error.get("message").asText() : null;
                return new RemoteApiException(statusCode, code, message);
            }
            if (error.isTextual()) {
                String description = node.hasNonNull("error_description")
                    ? node.get("error_description").asText() : null;
                return new RemoteApiException(statusCode, error.asText(), description);
            }
            String code = node.hasNonNull("code") ? node.get("code").asText() : null;
            String message = node.hasNonNull("message") ? node.get("message").asText() : null;
            return new RemoteApiException(statusCode, code, message);
        } catch (IOException ex) {
            String fallback = new String(bytes, StandardCharsets.UTF_8);
            return new RemoteApiException(statusCode, null, fallback);
        }
    }
}
