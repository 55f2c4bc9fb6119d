package cloud.aclinspector.scan;

import cloud.aclinspector.Permission;
import cloud.aclinspector.acl.AclSnapshot;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Records every visited node with its permissions and never prunes.
 */
public final class CollectingVisitor implements ScanVisitor {

    private final List<CollectedNode> collected = new ArrayList<>();

    @Override
    public VisitDecision visit(Node node, List<Permission> permissions) {
        collected.add(new CollectedNode(node, permissions, node.isRoot()));
        return VisitDecision.CONTINUE;
    }

    public List<CollectedNode> collected() {
        return Collections.unmodifiableList(collected);
    }

    public Optional<CollectedNode> root() {
        return collected.stream().filter(CollectedNode::root).findFirst();
    }

    public List<AclSnapshot> descendants() {
        return collected.stream()
            .filter(c -> !c.root())
            .map(CollectedNode::snapshot)
            .collect(Collectors.toList());
    }
}
