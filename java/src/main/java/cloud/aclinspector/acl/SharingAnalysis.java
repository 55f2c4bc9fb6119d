package cloud.aclinspector.acl;

import java.util.List;

/**
 * Sharing summary of one node.
 *
 * @param permissionCount number of permissions on the node, owner entries included.
 * @param sharedUsers     distinct emails (display names when no email) of non-owner principals, in API order.
 */
public record SharingAnalysis(
    boolean linkSharing,
    boolean directSharing,
    int permissionCount,
    List<String> sharedUsers
) {

    public SharingAnalysis {
        sharedUsers = List.copyOf(sharedUsers);
    }

    public boolean isShared() {
        return linkSharing || directSharing;
    }
}
