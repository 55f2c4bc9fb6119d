package cloud.aclinspector.report;

import cloud.aclinspector.Permission;
import cloud.aclinspector.scan.Node;
import cloud.aclinspector.scan.ScanStatistics;
import cloud.aclinspector.scan.SharedItem;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SharedItemsPrinterTest {

    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    private final SharedItemsPrinter printer =
        new SharedItemsPrinter(new PrintStream(buffer, true, StandardCharsets.UTF_8));

    @Test
    void searchedUserIsListedFirst() {
        List<String> users = List.of("a@x.com", "b@x.com", "c@x.com", "bob@x.com", "d@x.com");

        assertEquals("bob@x.com, a@x.com, b@x.com and 2 more", SharedItemsPrinter.formatUsers(users, "BOB@x.com"));
        assertEquals("a@x.com, b@x.com", SharedItemsPrinter.formatUsers(users.subList(0, 2), null));
    }

    @Test
    void printsHitsWithRoles() {
        Permission write = AuditReportTest.grant("p1", "write", "bob@x.com", null);
        SharedItem hit = new SharedItem(new Node("a", "A", "/Docs/A", true, 1, "docs"), SharedItem.LINK_SYMBOL,
            SharedItem.LINK_SHARING, true, true, 3, List.of("bob@x.com"), List.of(write));

        printer.printHits(List.of(hit), "bob@x.com");

        String text = output();
        assertTrue(text.contains("Found 1 shared item(s):"));
        assertTrue(text.contains("[link] /Docs/A"));
        assertTrue(text.contains("`- Link sharing (3 permission(s))"));
        assertTrue(text.contains("`- Shared with: bob@x.com"));
        assertTrue(text.contains("`- Roles: write"));
        assertTrue(text.contains("Has both link sharing and direct permissions"));
    }

    @Test
    void printsEmptyResults() {
        printer.printHits(List.of(), "bob@x.com");
        printer.printHits(List.of(), null);

        String text = output();
        assertTrue(text.contains("No items found with explicit permissions for bob@x.com"));
        assertTrue(text.contains("No shared items found"));
    }

    @Test
    void printsLevelCountsAndUserCheck() {
        printer.printStatistics(new ScanStatistics(4, Map.of(1, 3, 0, 1), 0, 0, 0));
        printer.printUserCheck("bob@x.com", "/Docs", List.of());

        String text = output();
        assertTrue(text.indexOf("   Level 0: 1 item(s)") < text.indexOf("   Level 1: 3 item(s)"));
        assertTrue(text.contains("User bob@x.com does not have explicit access to: /Docs"));
    }

    private String output() {
        return buffer.toString(StandardCharsets.UTF_8).replace("\r\n", "\n");
    }
}
