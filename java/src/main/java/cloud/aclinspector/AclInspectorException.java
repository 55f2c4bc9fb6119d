package cloud.aclinspector;

import java.io.IOException;

/**
 * Root of the checked failures of the inspector. {@link CredentialException} covers missing or unusable tokens,
 * {@link RemoteApiException} covers the drive API and the OAuth token endpoint; local file problems use this class
 * directly.
 */
public class AclInspectorException extends Exception {

    private static final long serialVersionUID = 1L;

    public AclInspectorException(String message) {
        super(message);
    }

    public AclInspectorException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Wraps a local I/O failure, for example while writing the owned token file.
     */
    public static AclInspectorException io(String action, IOException cause) {
        return new AclInspectorException(action + ": " + cause.getMessage(), cause);
    }
}
