package cloud.aclinspector.acl;

import cloud.aclinspector.Permission;

import java.util.List;

/**
 * Permissions of one descendant node keyed by its display path.
 */
public record AclSnapshot(String path, List<Permission> permissions) {

    public AclSnapshot {
        permissions = permissions == null ? List.of() : List.copyOf(permissions);
    }
}
