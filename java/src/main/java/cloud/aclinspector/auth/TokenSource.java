package cloud.aclinspector.auth;

/**
 * Where a token came from, which decides whether a refreshed token may be written back.
 */
public enum TokenSource {
    /** Created by this tool and freely rewritten. */
    OWNED,
    /** Owned by an external tool (rclone); read and used, never overwritten. */
    FOREIGN
}
