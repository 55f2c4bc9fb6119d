package cloud.aclinspector;

import java.time.Instant;
import java.util.List;

/**
 * One entry of an item's access list, decoded from the drive API.
 *
 * @param inheritedFrom opaque reference to the ancestor the entry comes from; {@code null} for entries attached
 *                      directly to the item.
 */
public record Permission(
    String id,
    List<String> roles,
    List<Principal> principals,
    SharingLink link,
    String inheritedFrom,
    Instant expiresAt
) {

    public static final String ROLE_OWNER = "owner";
    public static final String ROLE_WRITE = "write";
    public static final String ROLE_READ = "read";

    public Permission {
        roles = roles == null ? List.of() : List.copyOf(roles);
        principals = principals == null ? List.of() : List.copyOf(principals);
    }

    public boolean isOwner() {
        return roles.contains(ROLE_OWNER);
    }

    public boolean isInherited() {
        return inheritedFrom != null;
    }

    /**
     * Attached directly to the item and removable there.
     */
    public boolean isExplicit() {
        return !isOwner() && !isInherited();
    }

    public boolean isLink() {
        return link != null && link.type() != null;
    }

    /**
     * {@code write} when granted, otherwise the first role, otherwise {@code read}.
     */
    public String effectiveRole() {
        if (roles.contains(ROLE_WRITE)) {
            return ROLE_WRITE;
        }
        return roles.isEmpty() ? ROLE_READ : roles.get(0);
    }
}
