package cloud.aclinspector.report;

import cloud.aclinspector.acl.SpecialFolder;
import cloud.aclinspector.acl.UserAccess;
import cloud.aclinspector.internal.Json;
import cloud.aclinspector.scan.ScanStatistics;
import cloud.aclinspector.scan.SharedItem;

import java.io.IOException;
import java.io.OutputStream;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Writes reports as JSON documents for scripting.
 */
public final class JsonReportWriter {

    private final OutputStream out;

    public JsonReportWriter(OutputStream out) {
        this.out = out;
    }

    public void write(AuditReport report) throws IOException {
        List<SpecialEntry> special = new ArrayList<>();
        for (SpecialFolder folder : report.specialFolders()) {
            special.add(new SpecialEntry(
                folder.path(),
                folder.inheritance().label(),
                folder.users(),
                folder.lostAccess().isEmpty() ? null : folder.lostAccess()
            ));
        }
        AuditDocument document = new AuditDocument(
            Instant.now(),
            report.rootPath(),
            report.maxDepth(),
            report.rootUsers(),
            report.recursive() ? report.additionalUsers() : null,
            report.recursive() ? special : null,
            report.subfolderCount(),
            report.totalUsers()
        );
        writeDocument(document);
    }

    public void write(List<SharedItem> hits, String searchedUser, ScanStatistics statistics) throws IOException {
        List<HitEntry> entries = new ArrayList<>();
        for (SharedItem hit : hits) {
            entries.add(new HitEntry(
                hit.node().id(),
                hit.node().path(),
                hit.node().folder(),
                hit.shareType(),
                hit.linkSharing(),
                hit.directSharing(),
                hit.permissionCount(),
                hit.sharedUsers(),
                hit.matchedRoles().isEmpty() ? null : hit.matchedRoles()
            ));
        }
        writeDocument(new HitsDocument(Instant.now(), searchedUser, statistics.visited(),
            statistics.nodesPerDepth(), entries));
    }

    private void writeDocument(Object document) throws IOException {
        out.write(Json.prettyWriter().writeValueAsBytes(document));
        out.write('\n');
        out.flush();
    }

    record AuditDocument(
        Instant generatedAt,
        String rootPath,
        int maxDepth,
        Map<String, String> rootUsers,
        Map<String, List<UserAccess>> additionalUsers,
        List<SpecialEntry> specialFolders,
        int subfolderCount,
        int totalUsers
    ) {
    }

    record SpecialEntry(String path, String type, Map<String, String> users, List<String> accessRemoved) {
    }

    record HitsDocument(
        Instant generatedAt,
        String user,
        int visited,
        Map<Integer, Integer> itemsPerLevel,
        List<HitEntry> items
    ) {
    }

    record HitEntry(
        String id,
        String path,
        boolean folder,
        String shareType,
        boolean linkSharing,
        boolean directSharing,
        int permissionCount,
        List<String> sharedUsers,
        List<String> roles
    ) {
    }
}
