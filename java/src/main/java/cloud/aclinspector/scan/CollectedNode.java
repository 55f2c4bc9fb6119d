package cloud.aclinspector.scan;

import cloud.aclinspector.Permission;
import cloud.aclinspector.acl.AclSnapshot;

import java.util.List;

/**
 * A node and its full permission list, as gathered by {@link CollectingVisitor}.
 */
public record CollectedNode(Node node, List<Permission> permissions, boolean root) {

    public CollectedNode {
        permissions = List.copyOf(permissions);
    }

    public AclSnapshot snapshot() {
        return new AclSnapshot(node.path(), permissions);
    }
}
