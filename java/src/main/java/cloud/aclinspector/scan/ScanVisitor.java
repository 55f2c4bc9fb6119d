package cloud.aclinspector.scan;

import cloud.aclinspector.AclInspectorException;
import cloud.aclinspector.Permission;

import java.util.List;

/**
 * Per-node behaviour of a traversal. Called once for every node whose permissions could be read, parents before
 * children.
 */
@FunctionalInterface
public interface ScanVisitor {

    VisitDecision visit(Node node, List<Permission> permissions) throws AclInspectorException;
}
