package cloud.aclinspector.report;

import cloud.aclinspector.acl.Inheritance;
import cloud.aclinspector.acl.SpecialFolder;
import cloud.aclinspector.acl.UserAccess;

import java.io.PrintStream;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Renders an {@link AuditReport} as plain text.
 */
public final class AuditReportPrinter {

    static final String RULE = "=".repeat(80);
    static final String THIN_RULE = "-".repeat(80);

    private final PrintStream out;

    public AuditReportPrinter(PrintStream out) {
        this.out = out;
    }

    public void print(AuditReport report) {
        out.println();
        out.println(RULE);
        if (report.recursive()) {
            out.printf(Locale.ROOT, "=== ACL for \"%s\" (recursive scan, max depth: %d) ===%n",
                report.rootPath(), report.maxDepth());
        } else {
            out.printf(Locale.ROOT, "=== ACL for \"%s\" ===%n", report.rootPath());
        }
        out.println(RULE);
        out.println();

        printRootPermissions(report.rootUsers());
        if (report.recursive()) {
            printAdditionalUsers(report.additionalUsers());
            printSpecialFolders(report.specialFolders());
        }

        out.println(THIN_RULE);
        if (report.recursive()) {
            out.printf(Locale.ROOT, "Summary: %d unique user(s) across 1 root folder + %d subfolder(s)%n",
                report.totalUsers(), report.subfolderCount());
        } else {
            out.printf(Locale.ROOT, "Summary: %d user(s) with access%n", report.totalUsers());
        }
        out.println(THIN_RULE);
        out.println();
    }

    private void printRootPermissions(Map<String, String> rootUsers) {
        out.println("Root Folder Permissions:");
        if (rootUsers.isEmpty()) {
            out.println("   (No non-owner permissions found)");
        } else {
            rootUsers.forEach((user, role) -> out.printf(Locale.ROOT, "   * %-50s (%s)%n", user, role));
        }
        out.println();
    }

    private void printAdditionalUsers(Map<String, List<UserAccess>> additional) {
        if (additional.isEmpty()) {
            return;
        }
        out.println("Additional Users in Subfolders:");
        additional.forEach((user, places) -> {
            out.println("   " + user);
            for (UserAccess place : places) {
                out.printf(Locale.ROOT, "      `- %s (%s)%n", place.path(), place.role());
            }
            out.println();
        });
    }

    private void printSpecialFolders(List<SpecialFolder> special) {
        if (special.isEmpty()) {
            return;
        }
        out.println("Special Folders (Non-Inherited Permissions):");
        for (SpecialFolder folder : special) {
            out.printf(Locale.ROOT, "   [%s] %s%n", folder.inheritance().label(), folder.path());
            if (folder.users().isEmpty()) {
                out.println("      (No users with direct permissions)");
            } else {
                folder.users().forEach((user, role) -> out.printf(Locale.ROOT, "      * %-46s (%s)%n", user, role));
            }
            if (folder.inheritance() == Inheritance.RESTRICTED && !folder.lostAccess().isEmpty()) {
                out.println("      ! Access removed: " + String.join(", ", folder.lostAccess()));
            }
            out.println();
        }
    }
}
