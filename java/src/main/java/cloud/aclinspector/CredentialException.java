package cloud.aclinspector;

/**
 * Raised when no usable credential can be produced for an operation. Credentials are a precondition, so callers
 * abort the operation and show {@link #getRemediation()} to the user.
 */
public final class CredentialException extends AclInspectorException {

    private static final long serialVersionUID = 1L;

    public enum Reason {
        MISSING,
        EXPIRED,
        INSUFFICIENT_CAPABILITY,
        REFRESH_FAILED
    }

    private final Reason reason;
    private final String remediation;

    public CredentialException(Reason reason, String message, String remediation) {
        this(reason, message, remediation, null);
    }

    public CredentialException(Reason reason, String message, String remediation, Throwable cause) {
        super(message, cause);
        this.reason = reason;
        this.remediation = remediation;
    }

    public Reason getReason() {
        return reason;
    }

    /**
     * @return the re-authentication step that resolves this failure; never {@code null}.
     */
    public String getRemediation() {
        return remediation == null ? "" : remediation;
    }
}
