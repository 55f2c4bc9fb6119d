package cloud.aclinspector.scan;

import cloud.aclinspector.AclInspectorException;
import cloud.aclinspector.DriveClient;
import cloud.aclinspector.DriveItem;
import cloud.aclinspector.Permission;
import cloud.aclinspector.RemoteApiException;

import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Depth-first traversal of a drive subtree, one remote call at a time.
 *
 * <p>
 * Every node is visited at most once per scan, even when the API returns duplicate or cyclic children. A remote
 * failure while reading a descendant's permissions omits that node from the visitor but still lists its children;
 * the same failure at the start node aborts the scan. Credential failures always abort.
 * </p>
 */
public final class HierarchyScanner {

    private static final Logger LOGGER = Logger.getLogger(HierarchyScanner.class.getName());
    private static final int PROGRESS_INTERVAL = 10;

    private final DriveClient client;

    public HierarchyScanner(DriveClient client) {
        this.client = Objects.requireNonNull(client, "client");
    }

    /**
     * Scans {@code start} and its descendants down to {@link ScanOptions#maxDepth()}.
     *
     * @param startPath display path of {@code start}; may be empty and resolved later by the visitor.
     */
    public ScanStatistics scan(DriveItem start, String startPath, ScanOptions options, ScanVisitor visitor)
        throws AclInspectorException {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(options, "options");
        Objects.requireNonNull(visitor, "visitor");

        Traversal traversal = new Traversal(options, visitor);
        Node root = new Node(start.id(), start.name(), startPath == null ? "" : startPath, start.folder(), 0,
            start.parentId());
        visit(root, traversal);

        ScanStatistics statistics = traversal.statistics();
        LOGGER.info(() -> "[acl-inspector] scan finished: " + statistics.visited() + " item(s) visited, "
            + statistics.failedNodes() + " inaccessible, " + statistics.pruned() + " pruned");
        return statistics;
    }

    private void visit(Node node, Traversal traversal) throws AclInspectorException {
        ScanOptions options = traversal.options();
        if (node.depth() > options.maxDepth() || !traversal.markVisited(node.id(), node.depth())) {
            return;
        }
        if (traversal.visitedCount() % PROGRESS_INTERVAL == 0) {
            int count = traversal.visitedCount();
            LOGGER.info(() -> "[acl-inspector] scanned " + count + " items...");
        }

        List<Permission> permissions = null;
        try {
            permissions = client.permissions(node.id());
        } catch (RemoteApiException ex) {
            if (node.isRoot()) {
                throw ex;
            }
            traversal.nodeFailed();
            LOGGER.warning(() -> "[acl-inspector] skipping " + describe(node) + ": " + ex.getMessage());
        }

        if (permissions != null
            && traversal.visitor().visit(node, permissions) == VisitDecision.PRUNE) {
            traversal.pruned();
            LOGGER.fine(() -> "[acl-inspector] pruning below " + describe(node));
            return;
        }

        if (!node.folder() || node.depth() >= options.maxDepth()) {
            return;
        }

        List<DriveItem> children;
        try {
            children = client.children(node.id());
        } catch (RemoteApiException ex) {
            if (node.isRoot()) {
                throw ex;
            }
            traversal.listingFailed();
            LOGGER.warning(() -> "[acl-inspector] cannot list children of " + describe(node) + ": " + ex.getMessage());
            return;
        }

        for (DriveItem child : children) {
            if (!options.itemType().includes(child)) {
                continue;
            }
            Node childNode = new Node(
                child.id(),
                child.name(),
                Node.childPath(node.path(), child.name()),
                child.folder(),
                node.depth() + 1,
                node.id()
            );
            visit(childNode, traversal);
        }
    }

    private static String describe(Node node) {
        return node.path().isEmpty() ? node.id() : node.path();
    }
}
