package cloud.aclinspector.auth;

import cloud.aclinspector.AclInspectorException;

import java.security.SecureRandom;
import java.time.Duration;
import java.util.Base64;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * One interactive authorization attempt. The session resolves exactly once: with an authorization code, a failure
 * reported by the authorization server, or a cancellation. Later resolutions are ignored.
 */
public final class AuthorizationSession {

    private static final SecureRandom RANDOM = new SecureRandom();

    private final String state;
    private final CompletableFuture<String> code = new CompletableFuture<>();

    public AuthorizationSession() {
        this(newState());
    }

    public AuthorizationSession(String state) {
        this.state = state;
    }

    public String state() {
        return state;
    }

    /**
     * @return {@code true} if this call resolved the session.
     */
    public boolean complete(String authorizationCode) {
        return code.complete(authorizationCode);
    }

    public boolean fail(String reason) {
        return code.completeExceptionally(new AclInspectorException("authorization failed: " + reason));
    }

    public boolean cancel() {
        return code.cancel(false);
    }

    public boolean isDone() {
        return code.isDone();
    }

    /**
     * Waits for the authorization code.
     *
     * @throws AclInspectorException on failure, cancellation, timeout or interruption.
     */
    public String await(Duration timeout) throws AclInspectorException {
        try {
            return code.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new AclInspectorException("authorization interrupted", ex);
        } catch (CancellationException ex) {
            throw new AclInspectorException("authorization cancelled", ex);
        } catch (TimeoutException ex) {
            throw new AclInspectorException("no authorization received within " + timeout.toSeconds() + "s", ex);
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause();
            if (cause instanceof AclInspectorException) {
                throw (AclInspectorException) cause;
            }
            throw new AclInspectorException("authorization failed: " + cause, cause);
        }
    }

    private static String newState() {
        byte[] bytes = new byte[16];
        RANDOM.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }
}
