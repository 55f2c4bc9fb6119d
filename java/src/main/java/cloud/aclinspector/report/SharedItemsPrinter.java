package cloud.aclinspector.report;

import cloud.aclinspector.Permission;
import cloud.aclinspector.scan.ScanStatistics;
import cloud.aclinspector.scan.SharedItem;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Renders the hits of a sharing scan and single-item user checks.
 */
public final class SharedItemsPrinter {

    private static final int LISTED_USERS = 3;

    private final PrintStream out;

    public SharedItemsPrinter(PrintStream out) {
        this.out = out;
    }

    public void printStatistics(ScanStatistics statistics) {
        out.println();
        out.println("Item count by level:");
        statistics.nodesPerDepth().forEach((depth, count) ->
            out.printf(Locale.ROOT, "   Level %d: %d item(s)%n", depth, count));
        if (statistics.failedNodes() > 0) {
            out.printf(Locale.ROOT, "   Inaccessible: %d item(s)%n", statistics.failedNodes());
        }
    }

    /**
     * @param searchedUser listed first among shared users when present; may be {@code null}.
     */
    public void printHits(List<SharedItem> hits, String searchedUser) {
        out.println();
        if (hits.isEmpty()) {
            if (searchedUser == null) {
                out.println("No shared items found");
            } else {
                out.println("No items found with explicit permissions for " + searchedUser);
            }
            return;
        }
        out.println(AuditReportPrinter.RULE);
        out.printf(Locale.ROOT, "Found %d shared item(s):%n", hits.size());
        out.println(AuditReportPrinter.RULE);
        for (SharedItem hit : hits) {
            out.println(hit.symbol() + " " + hit.node().path());
            out.printf(Locale.ROOT, "   `- %s (%d permission(s))%n", hit.shareType(), hit.permissionCount());
            if (!hit.sharedUsers().isEmpty()) {
                out.println("   `- Shared with: " + formatUsers(hit.sharedUsers(), searchedUser));
            }
            if (!hit.matchedRoles().isEmpty()) {
                out.println("   `- Roles: " + String.join(", ", hit.matchedRoles()));
            }
            if (hit.linkSharing() && hit.directSharing()) {
                out.println("   `- Has both link sharing and direct permissions");
            }
            out.println();
        }
    }

    /**
     * Result of checking one item for a user's explicit permissions.
     */
    public void printUserCheck(String user, String path, List<Permission> matches) {
        if (matches.isEmpty()) {
            out.println("User " + user + " does not have explicit access to: " + path);
            return;
        }
        out.println("User " + user + " has access to: " + path);
        for (Permission permission : matches) {
            out.println("   `- Roles: " + String.join(", ", permission.roles()));
        }
    }

    static String formatUsers(List<String> users, String searchedUser) {
        List<String> ordered = new ArrayList<>(users);
        if (searchedUser != null) {
            for (int i = 0; i < ordered.size(); i++) {
                if (ordered.get(i).equalsIgnoreCase(searchedUser)) {
                    ordered.add(0, ordered.remove(i));
                    break;
                }
            }
        }
        String listed = String.join(", ", ordered.subList(0, Math.min(LISTED_USERS, ordered.size())));
        if (ordered.size() > LISTED_USERS) {
            listed = listed + " and " + (ordered.size() - LISTED_USERS) + " more";
        }
        return listed;
    }
}
