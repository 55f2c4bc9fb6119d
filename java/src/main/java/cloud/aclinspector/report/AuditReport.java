package cloud.aclinspector.report;

import cloud.aclinspector.acl.AclSnapshot;
import cloud.aclinspector.acl.PermissionClassifier;
import cloud.aclinspector.acl.SpecialFolder;
import cloud.aclinspector.acl.UserAccess;
import cloud.aclinspector.scan.CollectedNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * User-centric access report of a collected subtree.
 *
 * @param rootUsers        principal key to role on the scan root, sorted by key.
 * @param additionalUsers  users absent from the root and where they appear; empty for non-recursive scans.
 * @param specialFolders   descendants not inheriting the root's access list; empty for non-recursive scans.
 * @param subfolderCount   collected descendants.
 * @param totalUsers       distinct principals across root and descendants.
 */
public record AuditReport(
    String rootPath,
    int maxDepth,
    Map<String, String> rootUsers,
    Map<String, List<UserAccess>> additionalUsers,
    List<SpecialFolder> specialFolders,
    int subfolderCount,
    int totalUsers
) {

    public AuditReport {
        rootUsers = Collections.unmodifiableMap(new TreeMap<>(rootUsers));
        additionalUsers = Collections.unmodifiableMap(new TreeMap<>(additionalUsers));
        specialFolders = List.copyOf(specialFolders);
    }

    public boolean recursive() {
        return maxDepth > 0;
    }

    /**
     * Builds the report from the nodes of one collecting scan.
     *
     * @throws IllegalArgumentException when {@code collected} holds no root node.
     */
    public static AuditReport build(String rootPath, List<CollectedNode> collected, int maxDepth) {
        Objects.requireNonNull(collected, "collected");
        CollectedNode root = collected.stream()
            .filter(CollectedNode::root)
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("no root node collected"));

        Map<String, String> rootUsers = PermissionClassifier.extractUsers(root.permissions());
        List<AclSnapshot> descendants = new ArrayList<>();
        Set<String> allUsers = new TreeSet<>(rootUsers.keySet());
        for (CollectedNode node : collected) {
            if (node.root()) {
                continue;
            }
            descendants.add(node.snapshot());
            allUsers.addAll(PermissionClassifier.extractUsers(node.permissions()).keySet());
        }

        boolean recursive = maxDepth > 0;
        return new AuditReport(
            rootPath,
            maxDepth,
            rootUsers,
            recursive ? PermissionClassifier.buildUserFolderMap(rootUsers, descendants) : Map.of(),
            recursive ? PermissionClassifier.detectSpecialFolders(rootUsers, descendants) : List.of(),
            descendants.size(),
            allUsers.size()
        );
    }
}
