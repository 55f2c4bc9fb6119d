package cloud.aclinspector.scan;

import cloud.aclinspector.Permission;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A node reported by {@link SharingFilterVisitor}.
 *
 * @param matchedPermissions explicit permissions granted to the searched user here; empty without a searched user.
 */
public record SharedItem(
    Node node,
    String symbol,
    String shareType,
    boolean linkSharing,
    boolean directSharing,
    int permissionCount,
    List<String> sharedUsers,
    List<Permission> matchedPermissions
) {

    public static final String LINK_SYMBOL = "[link]";
    public static final String DIRECT_SYMBOL = "[users]";
    public static final String LINK_SHARING = "Link sharing";
    public static final String DIRECT_PERMISSIONS = "Direct permissions";

    public SharedItem {
        sharedUsers = List.copyOf(sharedUsers);
        matchedPermissions = List.copyOf(matchedPermissions);
    }

    /**
     * Distinct roles of the matched permissions.
     */
    public List<String> matchedRoles() {
        Set<String> roles = new LinkedHashSet<>();
        for (Permission permission : matchedPermissions) {
            roles.add(permission.effectiveRole());
        }
        return new ArrayList<>(roles);
    }
}
