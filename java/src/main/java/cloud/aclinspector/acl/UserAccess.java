package cloud.aclinspector.acl;

/**
 * A place where a user holds a role.
 */
public record UserAccess(String path, String role) {
}
