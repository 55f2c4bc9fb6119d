package cloud.aclinspector.auth;

import cloud.aclinspector.AclInspectorException;
import cloud.aclinspector.CredentialException;
import cloud.aclinspector.CredentialException.Reason;

/**
 * Source of bearer tokens for drive calls. Implementations may cache; {@link #forceRefresh()} is called once when
 * the server rejects a token as expired.
 */
public interface TokenProvider {

    Token token() throws AclInspectorException;

    /**
     * Drops any cached token so the next {@link #token()} resolves a fresh one.
     */
    default void invalidate() {
    }

    default Token forceRefresh() throws AclInspectorException {
        invalidate();
        return token();
    }

    /**
     * Returns the current token if its capability satisfies {@code required}.
     *
     * @throws CredentialException with {@link Reason#INSUFFICIENT_CAPABILITY} otherwise.
     */
    default Token require(Capability required) throws AclInspectorException {
        Token current = token();
        if (!current.getCapability().satisfies(required)) {
            throw new CredentialException(
                Reason.INSUFFICIENT_CAPABILITY,
                "token capability is " + current.getCapability().label() + " but " + required.label()
                    + " is required",
                "run 'acl-inspector --login' to authorize with Files.ReadWrite.All"
            );
        }
        return current;
    }
}
