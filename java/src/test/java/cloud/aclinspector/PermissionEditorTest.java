package cloud.aclinspector;

import cloud.aclinspector.CredentialException.Reason;
import cloud.aclinspector.auth.Capability;
import cloud.aclinspector.scan.ItemType;
import cloud.aclinspector.scan.ScanOptions;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PermissionEditorTest {

    private FakeGraphServer graph;

    @BeforeEach
    void setUp() throws Exception {
        graph = FakeGraphServer.start()
            .root("root-id")
            .folder("docs", "Docs", "root-id")
            .folder("x", "X", "docs")
            .folder("y", "Y", "docs")
            .permission("docs", FakeGraphServer.owner("o1", "me@example.com"))
            .permission("docs", FakeGraphServer.grant("p1", "write", "Bob", "bob@example.com"))
            .permission("docs", FakeGraphServer.grant("p2", "read", "Bobby", "bobby@example.com"))
            .permission("docs", FakeGraphServer.link("l1", "view", "organization"))
            .permission("docs", FakeGraphServer.inheritedGrant("i1", "read", "Carol", "carol@example.com"))
            .permission("y", FakeGraphServer.grant("p3", "read", "Bob", "bob@example.com"));
    }

    @AfterEach
    void tearDown() {
        graph.close();
    }

    @Test
    void readOnlyTokenIsRejectedBeforeAnyRequest() {
        PermissionEditor editor = new PermissionEditor(graph.client(Capability.READ_ONLY));

        CredentialException invite = assertThrows(CredentialException.class,
            () -> editor.invite("docs", "new@example.com", "read"));
        assertThrows(CredentialException.class, () -> editor.stripExplicit("docs"));
        assertThrows(CredentialException.class, () -> editor.removePermission("docs", "p1"));

        assertEquals(Reason.INSUFFICIENT_CAPABILITY, invite.getReason());
        assertTrue(graph.requests().isEmpty());
    }

    @Test
    void inviteReportsSuccessAndFailure() throws Exception {
        PermissionEditor editor = new PermissionEditor(graph.client(Capability.FULL));

        MutationResult ok = editor.invite("docs", "new@example.com", "write");
        graph.inviteStatus(403);
        MutationResult denied = editor.invite("docs", "new@example.com", "read");

        assertTrue(ok.success());
        assertEquals("Successfully invited new@example.com with write permission", ok.message());
        assertFalse(denied.success());
        assertEquals("Insufficient permissions to invite users", denied.message());
        assertEquals(RemoteApiException.Kind.FORBIDDEN, denied.failure().getKind());
        assertThrows(IllegalArgumentException.class, () -> editor.invite("docs", "new@example.com", "owner"));
    }

    @Test
    void ownerAndInheritedPermissionsAreNotRemoved() throws Exception {
        DriveClient client = graph.client(Capability.FULL);
        PermissionEditor editor = new PermissionEditor(client);
        List<Permission> permissions = client.permissions("docs");
        int before = graph.requests().size();

        MutationResult owner = editor.removeExplicit("docs", permissions.get(0));
        MutationResult inherited = editor.removeExplicit("docs", permissions.get(4));

        assertFalse(owner.success());
        assertFalse(inherited.success());
        assertEquals(0, graph.count("DELETE", "/permissions/o1"));
        assertEquals(0, graph.count("DELETE", "/permissions/i1"));
        assertEquals(before, graph.requests().size());
    }

    @Test
    void removingMissingPermissionIsReported() throws Exception {
        PermissionEditor editor = new PermissionEditor(graph.client(Capability.FULL));

        assertTrue(editor.removePermission("docs", "p1").success());
        MutationResult again = editor.removePermission("docs", "p1");

        assertFalse(again.success());
        assertEquals("Permission not found (may already be removed)", again.message());
    }

    @Test
    void stripRemovesOnlyExplicitPermissions() throws Exception {
        graph.failDelete("p2", 403);
        PermissionEditor editor = new PermissionEditor(graph.client(Capability.FULL));

        StripResult result = editor.stripExplicit("docs");

        assertEquals(2, result.removedCount());
        assertEquals(1, result.failedCount());
        assertFalse(result.complete());
        assertTrue(graph.hasPermission("docs", "o1"));
        assertTrue(graph.hasPermission("docs", "i1"));
        assertTrue(graph.hasPermission("docs", "p2"));
        assertFalse(graph.hasPermission("docs", "p1"));
        assertFalse(graph.hasPermission("docs", "l1"));
    }

    @Test
    void userRemovalMatchesExactEmailOnly() throws Exception {
        DriveClient client = graph.client(Capability.FULL);
        PermissionEditor editor = new PermissionEditor(client);
        DriveItem docs = client.itemByPath("/Docs");

        RemovalPlan plan = editor.planUserRemoval(docs, "/Docs", "BOB@example.com",
            new ScanOptions(3, ItemType.FOLDERS));

        assertEquals(1, plan.candidates().size());
        RemovalPlan.Candidate candidate = plan.candidates().get(0);
        assertEquals("docs", candidate.itemId());
        assertEquals("p1", candidate.permissionId());
        assertEquals("write", candidate.role());
        assertEquals(0, graph.count("GET", "/items/y/permissions"));

        List<RemovalPlan.Outcome> outcomes = editor.applyRemoval(plan);

        assertTrue(outcomes.get(0).result().success());
        assertFalse(graph.hasPermission("docs", "p1"));
        assertTrue(graph.hasPermission("docs", "p2"));
        assertTrue(graph.hasPermission("y", "p3"));
    }

    @Test
    void serverThatNeverAnswersIsNotARemoval() throws Exception {
        try (ServerSocket socket = new ServerSocket(0, 0, InetAddress.getLoopbackAddress())) {
            Thread acceptor = new Thread(() -> hangUpWithoutReply(socket), "hang-up");
            acceptor.setDaemon(true);
            acceptor.start();
            Config config = Config.builder()
                .graphBaseUrl("http://127.0.0.1:" + socket.getLocalPort() + "/v1.0")
                .httpTimeout(Duration.ofSeconds(5))
                .build();
            PermissionEditor editor = new PermissionEditor(
                new DriveClient(config, FakeGraphServer.fixedToken(Capability.FULL)));

            MutationResult result = editor.removePermission("docs", "p1");

            assertFalse(result.success());
            assertEquals(RemoteApiException.Kind.TRANSPORT, result.failure().getKind());
        }
    }

    private static void hangUpWithoutReply(ServerSocket server) {
        while (!server.isClosed()) {
            try (Socket connection = server.accept()) {
                BufferedReader reader = new BufferedReader(
                    new InputStreamReader(connection.getInputStream(), StandardCharsets.US_ASCII));
                String line = reader.readLine();
                while (line != null && !line.isEmpty()) {
                    line = reader.readLine();
                }
            } catch (IOException ex) {
                return;
            }
        }
    }
}
