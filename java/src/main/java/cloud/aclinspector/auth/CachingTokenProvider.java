package cloud.aclinspector.auth;

import cloud.aclinspector.CredentialException;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.locks.ReentrantLock;

/**
 * TokenProvider backed by a {@link CredentialStore}; the token is acquired on first use and kept until invalidated
 * or close to expiry.
 */
final class CachingTokenProvider implements TokenProvider {

    private static final Duration LEEWAY = Duration.ofSeconds(30);

    private final CredentialStore store;
    private final String remote;
    private final Capability required;
    private final boolean preferOwned;

    private final ReentrantLock lock = new ReentrantLock();
    private volatile Token cached;

    CachingTokenProvider(CredentialStore store, String remote, Capability required, boolean preferOwned) {
        this.store = store;
        this.remote = remote;
        this.required = required;
        this.preferOwned = preferOwned;
    }

    @Override
    public Token token() throws CredentialException {
        Token current = cached;
        if (current != null && isFresh(current)) {
            return current;
        }

        lock.lock();
        try {
            current = cached;
            if (current != null && isFresh(current)) {
                return current;
            }

            Token fresh = store.acquire(remote, required, preferOwned);
            cached = fresh;
            return fresh;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void invalidate() {
        cached = null;
    }

    @Override
    public Token forceRefresh() throws CredentialException {
        lock.lock();
        try {
            Token current = cached;
            Token fresh = current != null && current.hasRefreshToken()
                ? store.refresh(current)
                : store.acquire(remote, required, preferOwned);
            cached = fresh;
            return fresh;
        } finally {
            lock.unlock();
        }
    }

    private boolean isFresh(Token token) {
        Instant now = store.clock().instant();
        return token.getExpiry() == null || now.isBefore(token.getExpiry().minus(LEEWAY));
    }
}
