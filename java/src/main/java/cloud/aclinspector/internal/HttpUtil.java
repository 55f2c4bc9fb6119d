package cloud.aclinspector.internal;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Helper methods for issuing HTTP requests with JSON or form payloads.
 */
public final class HttpUtil {

    private HttpUtil() {
    }

    public static HttpResponse<InputStream> sendJson(
        HttpClient client,
        String method,
        String url,
        Object payload,
        String bearerToken,
        Duration timeout
    ) throws IOException, InterruptedException {

        HttpRequest.Builder builder = HttpRequest.newBuilder()
            .uri(URI.create(url))
            .timeout(timeout);

        if (payload == null) {
            builder.method(method, HttpRequest.BodyPublishers.noBody());
        } else {
            byte[] body = Json.mapper().writeValueAsBytes(payload);
            builder.method(method, HttpRequest.BodyPublishers.ofByteArray(body));
            builder.header("Content-Type", "application/json");
        }

        if (bearerToken != null && !bearerToken.isBlank()) {
            builder.header("Authorization", "Bearer " + bearerToken);
        }

        builder.header("Accept", "application/json");

        return client.send(builder.build(), HttpResponse.BodyHandlers.ofInputStream());
    }

    public static HttpResponse<InputStream> postForm(
        HttpClient client,
        String url,
        Map<String, String> form,
        Duration timeout
    ) throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create(url))
            .POST(HttpRequest.BodyPublishers.ofString(formEncode(form)))
            .header("Content-Type", "application/x-www-form-urlencoded")
            .header("Accept", "application/json")
            .timeout(timeout)
            .build();
        return client.send(request, HttpResponse.BodyHandlers.ofInputStream());
    }

    /**
     * Encodes {@code form} as {@code application/x-www-form-urlencoded}, skipping null or blank values.
     */
    public static String formEncode(Map<String, String> form) {
        StringJoiner joiner = new StringJoiner("&");
        for (Map.Entry<String, String> entry : form.entrySet()) {
            String value = entry.getValue();
            if (value == null || value.isBlank()) {
                continue;
            }
            joiner.add(URLEncoder.encode(entry.getKey(), StandardCharsets.UTF_8)
                + "=" + URLEncoder.encode(value, StandardCharsets.UTF_8));
        }
        return joiner.toString();
    }

    /**
     * Percent-encodes a slash separated drive path segment by segment, keeping the slashes.
     */
    public static String encodePath(String path) {
        StringJoiner joiner = new StringJoiner("/");
        for (String segment : path.split("/", -1)) {
            joiner.add(URLEncoder.encode(segment, StandardCharsets.UTF_8).replace("+", "%20"));
        }
        return joiner.toString();
    }
}
