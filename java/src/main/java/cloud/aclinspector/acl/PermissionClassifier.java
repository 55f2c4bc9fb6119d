package cloud.aclinspector.acl;

import cloud.aclinspector.Permission;
import cloud.aclinspector.Principal;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Pure functions over permission lists. Owner permissions never contribute to any result.
 */
public final class PermissionClassifier {

    private PermissionClassifier() {
    }

    /**
     * Maps every principal of the non-owner, non-link permissions to its role. A permission granting {@code write}
     * reports {@code write}; otherwise its first role is used.
     *
     * @return principal key to role, sorted by key.
     */
    public static Map<String, String> extractUsers(List<Permission> permissions) {
        Map<String, String> users = new TreeMap<>();
        for (Permission permission : permissions) {
            if (permission.isOwner() || permission.isLink()) {
                continue;
            }
            String role = permission.effectiveRole();
            for (Principal principal : permission.principals()) {
                String key = principal.key();
                if (!key.isEmpty()) {
                    users.put(key, role);
                }
            }
        }
        return users;
    }

    /**
     * Compares the principals of {@code child} with those of {@code parent}. Roles are not compared.
     */
    public static Inheritance classify(Map<String, String> child, Map<String, String> parent) {
        if (child.isEmpty() && parent.isEmpty()) {
            return Inheritance.INHERITED;
        }
        if (child.isEmpty()) {
            return Inheritance.RESTRICTED;
        }
        boolean gained = !parent.keySet().containsAll(child.keySet());
        boolean lost = !child.keySet().containsAll(parent.keySet());
        if (!gained && !lost) {
            return Inheritance.INHERITED;
        }
        if (!gained) {
            return Inheritance.RESTRICTED;
        }
        if (!lost) {
            return Inheritance.EXTENDED;
        }
        return Inheritance.DIFFERENT;
    }

    /**
     * For each user absent from {@code rootUsers}, the descendants where the user holds a role, in traversal order.
     */
    public static Map<String, List<UserAccess>> buildUserFolderMap(
        Map<String, String> rootUsers,
        List<AclSnapshot> descendants
    ) {
        Map<String, List<UserAccess>> map = new TreeMap<>();
        for (AclSnapshot descendant : descendants) {
            extractUsers(descendant.permissions()).forEach((user, role) -> {
                if (!rootUsers.containsKey(user)) {
                    map.computeIfAbsent(user, k -> new ArrayList<>()).add(new UserAccess(descendant.path(), role));
                }
            });
        }
        return map;
    }

    /**
     * Descendants whose classification against {@code rootUsers} is not {@link Inheritance#INHERITED}.
     */
    public static List<SpecialFolder> detectSpecialFolders(
        Map<String, String> rootUsers,
        List<AclSnapshot> descendants
    ) {
        List<SpecialFolder> special = new ArrayList<>();
        for (AclSnapshot descendant : descendants) {
            Map<String, String> users = extractUsers(descendant.permissions());
            Inheritance inheritance = classify(users, rootUsers);
            if (inheritance == Inheritance.INHERITED) {
                continue;
            }
            List<String> lost = new ArrayList<>();
            if (inheritance == Inheritance.RESTRICTED) {
                for (String user : new TreeMap<>(rootUsers).keySet()) {
                    if (!users.containsKey(user)) {
                        lost.add(user);
                    }
                }
            }
            special.add(new SpecialFolder(descendant.path(), users, inheritance, lost));
        }
        return special;
    }

    /**
     * Summarises link and direct sharing on one node.
     */
    public static SharingAnalysis analyze(List<Permission> permissions) {
        boolean link = false;
        boolean direct = false;
        Set<String> shared = new LinkedHashSet<>();
        for (Permission permission : permissions) {
            if (permission.isOwner()) {
                continue;
            }
            if (permission.isLink()) {
                link = true;
            }
            if (!permission.principals().isEmpty()) {
                direct = true;
                for (Principal principal : permission.principals()) {
                    String name = principal.email() != null && !principal.email().isBlank()
                        ? principal.email() : principal.displayName();
                    if (name != null && !name.isBlank()) {
                        shared.add(name);
                    }
                }
            }
        }
        return new SharingAnalysis(link, direct, permissions.size(), new ArrayList<>(shared));
    }

    /**
     * Explicit (non-owner, non-inherited) permissions granted to {@code targetUser}.
     */
    public static List<Permission> explicitMatches(List<Permission> permissions, String targetUser, UserMatch match) {
        List<Permission> matches = new ArrayList<>();
        for (Permission permission : permissions) {
            if (!permission.isExplicit()) {
                continue;
            }
            for (Principal principal : permission.principals()) {
                if (match.matches(principal.email(), targetUser)) {
                    matches.add(permission);
                    break;
                }
            }
        }
        return matches;
    }
}
