package cloud.aclinspector.scan;

import cloud.aclinspector.AclInspectorException;
import cloud.aclinspector.DriveClient;
import cloud.aclinspector.Permission;
import cloud.aclinspector.acl.PermissionClassifier;
import cloud.aclinspector.acl.SharingAnalysis;
import cloud.aclinspector.acl.UserMatch;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Reports shared nodes. Without a searched user every node with link or direct sharing is reported. With a searched
 * user only nodes granting that user an explicit permission are reported, and their descendants are pruned.
 */
public final class SharingFilterVisitor implements ScanVisitor {

    private static final Logger LOGGER = Logger.getLogger(SharingFilterVisitor.class.getName());

    private final DriveClient client;
    private final String targetUser;
    private final UserMatch match;
    private final List<SharedItem> hits = new ArrayList<>();

    /**
     * @param client     used to resolve the display path of reported nodes scanned without one.
     * @param targetUser searched user, {@code null} or blank to report all shared nodes.
     */
    public SharingFilterVisitor(DriveClient client, String targetUser, UserMatch match) {
        this.client = client;
        this.targetUser = targetUser == null || targetUser.isBlank() ? null : targetUser.trim();
        this.match = Objects.requireNonNull(match, "match");
    }

    @Override
    public VisitDecision visit(Node node, List<Permission> permissions) throws AclInspectorException {
        SharingAnalysis analysis = PermissionClassifier.analyze(permissions);
        List<Permission> explicit = targetUser == null
            ? List.of()
            : PermissionClassifier.explicitMatches(permissions, targetUser, match);

        boolean include = targetUser == null ? analysis.isShared() : !explicit.isEmpty();
        if (include) {
            Node reported = node;
            if (node.path().isEmpty() && client != null) {
                reported = node.withPath(client.resolvePath(node.id()));
            }
            hits.add(toItem(reported, analysis, explicit));
            Node logged = reported;
            LOGGER.fine(() -> "[acl-inspector] " + (targetUser == null ? "shared: " : "explicit permission: ")
                + logged.path());
        }

        if (targetUser != null && !explicit.isEmpty()) {
            return VisitDecision.PRUNE;
        }
        return VisitDecision.CONTINUE;
    }

    public List<SharedItem> hits() {
        return Collections.unmodifiableList(hits);
    }

    public String targetUser() {
        return targetUser;
    }

    private static SharedItem toItem(Node node, SharingAnalysis analysis, List<Permission> explicit) {
        boolean link = analysis.linkSharing();
        return new SharedItem(
            node,
            link ? SharedItem.LINK_SYMBOL : SharedItem.DIRECT_SYMBOL,
            link ? SharedItem.LINK_SHARING : SharedItem.DIRECT_PERMISSIONS,
            link,
            analysis.directSharing(),
            analysis.permissionCount(),
            analysis.sharedUsers(),
            explicit
        );
    }
}
