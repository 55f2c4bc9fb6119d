package cloud.aclinspector.report;

import cloud.aclinspector.Permission;
import cloud.aclinspector.Principal;
import cloud.aclinspector.acl.Inheritance;
import cloud.aclinspector.acl.UserAccess;
import cloud.aclinspector.scan.CollectedNode;
import cloud.aclinspector.scan.Node;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AuditReportTest {

    static final Permission OWNER = grant("o", "owner", "me@example.com", null);
    static final Permission ALICE = grant("p1", "write", "alice@example.com", null);
    static final Permission BOB = grant("p2", "read", "bob@example.com", null);
    static final Permission CAROL = grant("p3", "read", "carol@example.com", null);

    static List<CollectedNode> sampleTree() {
        return List.of(
            collected("root", "/Projects", 0, List.of(OWNER, ALICE, BOB)),
            collected("x", "/Projects/X", 1, List.of(OWNER, inherited(ALICE), inherited(BOB))),
            collected("y", "/Projects/Y", 1, List.of(OWNER, ALICE)),
            collected("z", "/Projects/Y/Z", 2, List.of(ALICE, BOB, CAROL))
        );
    }

    @Test
    void buildsUserCentricReport() {
        AuditReport report = AuditReport.build("/Projects", sampleTree(), 3);

        assertTrue(report.recursive());
        assertEquals(Map.of("alice@example.com", "write", "bob@example.com", "read"), report.rootUsers());
        assertEquals(Map.of("carol@example.com", List.of(new UserAccess("/Projects/Y/Z", "read"))),
            report.additionalUsers());
        assertEquals(2, report.specialFolders().size());
        assertEquals(Inheritance.RESTRICTED, report.specialFolders().get(0).inheritance());
        assertEquals(List.of("bob@example.com"), report.specialFolders().get(0).lostAccess());
        assertEquals(Inheritance.EXTENDED, report.specialFolders().get(1).inheritance());
        assertEquals(3, report.subfolderCount());
        assertEquals(3, report.totalUsers());
    }

    @Test
    void nonRecursiveReportSkipsSubfolderSections() {
        AuditReport report = AuditReport.build("/Projects", sampleTree().subList(0, 1), 0);

        assertFalse(report.recursive());
        assertTrue(report.additionalUsers().isEmpty());
        assertTrue(report.specialFolders().isEmpty());
        assertEquals(2, report.totalUsers());
    }

    @Test
    void rootIsRequired() {
        assertThrows(IllegalArgumentException.class,
            () -> AuditReport.build("/", sampleTree().subList(1, 2), 3));
    }

    @Test
    void printsRecursiveReport() {
        String text = render(AuditReport.build("/Projects", sampleTree(), 3));

        assertTrue(text.contains("=== ACL for \"/Projects\" (recursive scan, max depth: 3) ==="));
        assertTrue(text.contains("Root Folder Permissions:"));
        assertTrue(text.contains("   * alice@example.com"));
        assertTrue(text.contains("(write)"));
        assertTrue(text.contains("Additional Users in Subfolders:\n   carol@example.com\n      `- /Projects/Y/Z (read)"));
        assertTrue(text.contains("   [RESTRICTED] /Projects/Y"));
        assertTrue(text.contains("      ! Access removed: bob@example.com"));
        assertTrue(text.contains("   [EXTENDED] /Projects/Y/Z"));
        assertTrue(text.contains("Summary: 3 unique user(s) across 1 root folder + 3 subfolder(s)"));
        assertFalse(text.contains("me@example.com"));
    }

    @Test
    void printsFlatReport() {
        String text = render(AuditReport.build("/Projects", List.of(collected("root", "/Projects", 0, List.of(OWNER))), 0));

        assertTrue(text.contains("=== ACL for \"/Projects\" ==="));
        assertTrue(text.contains("(No non-owner permissions found)"));
        assertTrue(text.contains("Summary: 0 user(s) with access"));
        assertFalse(text.contains("Special Folders"));
    }

    private static String render(AuditReport report) {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        new AuditReportPrinter(new PrintStream(buffer, true, StandardCharsets.UTF_8)).print(report);
        return buffer.toString(StandardCharsets.UTF_8).replace("\r\n", "\n");
    }

    static CollectedNode collected(String id, String path, int depth, List<Permission> permissions) {
        return new CollectedNode(new Node(id, id, path, true, depth, null), permissions, depth == 0);
    }

    static Permission grant(String id, String role, String email, String inheritedFrom) {
        return new Permission(id, List.of(role), List.of(new Principal(email, email)), null, inheritedFrom, null);
    }

    static Permission inherited(Permission permission) {
        return new Permission(permission.id() + "-i", permission.roles(), permission.principals(), null, "root", null);
    }
}
