package cloud.aclinspector;

import cloud.aclinspector.acl.UserMatch;
import cloud.aclinspector.auth.Capability;
import cloud.aclinspector.scan.HierarchyScanner;
import cloud.aclinspector.scan.ScanOptions;
import cloud.aclinspector.scan.SharedItem;
import cloud.aclinspector.scan.SharingFilterVisitor;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Invite and removal operations. Every operation checks that the client's token carries
 * {@link Capability#FULL} before any remote call, and none is retried.
 */
public final class PermissionEditor {

    private static final Logger LOGGER = Logger.getLogger(PermissionEditor.class.getName());

    private final DriveClient client;

    public PermissionEditor(DriveClient client) {
        this.client = Objects.requireNonNull(client, "client");
    }

    /**
     * Grants {@code role} ({@code read} or {@code write}) on an item. The grant is inherited by the item's children.
     */
    public MutationResult invite(String itemId, String email, String role) throws AclInspectorException {
        if (!Permission.ROLE_READ.equals(role) && !Permission.ROLE_WRITE.equals(role)) {
            throw new IllegalArgumentException("role must be read or write: " + role);
        }
        if (email == null || email.isBlank()) {
            throw new IllegalArgumentException("email is required");
        }
        requireFull();
        try {
            client.invite(itemId, email.trim(), role, "You have been granted " + role + " access to this item.");
            return MutationResult.ok("Successfully invited " + email.trim() + " with " + role + " permission");
        } catch (RemoteApiException ex) {
            return MutationResult.failed(describeInviteFailure(ex), ex);
        }
    }

    public MutationResult removePermission(String itemId, String permissionId) throws AclInspectorException {
        requireFull();
        return delete(itemId, permissionId);
    }

    /**
     * Removes {@code permission} unless it is an owner or inherited permission, which are refused without a remote
     * call.
     */
    public MutationResult removeExplicit(String itemId, Permission permission) throws AclInspectorException {
        if (permission.isOwner()) {
            return MutationResult.failed("Owner permissions cannot be removed");
        }
        if (permission.isInherited()) {
            return MutationResult.failed("Permission is inherited from a parent item and cannot be removed here");
        }
        return removePermission(itemId, permission.id());
    }

    /**
     * Removes every explicit permission of an item, continuing past individual failures.
     */
    public StripResult stripExplicit(String itemId) throws AclInspectorException {
        requireFull();
        int removed = 0;
        int failed = 0;
        for (Permission permission : client.permissions(itemId)) {
            if (!permission.isExplicit()) {
                continue;
            }
            if (delete(itemId, permission.id()).success()) {
                removed++;
            } else {
                failed++;
            }
        }
        int removedCount = removed;
        int failedCount = failed;
        LOGGER.info(() -> String.format(Locale.ROOT,
            "[acl-inspector] stripped %d explicit permission(s) from %s, %d failed", removedCount, itemId, failedCount));
        return new StripResult(removed, failed);
    }

    /**
     * Finds the explicit permissions of {@code email} on {@code start} and below. The email is matched exactly.
     */
    public RemovalPlan planUserRemoval(DriveItem start, String startPath, String email, ScanOptions options)
        throws AclInspectorException {
        requireFull();
        SharingFilterVisitor visitor = new SharingFilterVisitor(client, email, UserMatch.EXACT);
        new HierarchyScanner(client).scan(start, startPath, options, visitor);

        List<RemovalPlan.Candidate> candidates = new ArrayList<>();
        for (SharedItem hit : visitor.hits()) {
            for (Permission permission : hit.matchedPermissions()) {
                candidates.add(new RemovalPlan.Candidate(
                    hit.node().id(),
                    hit.node().path(),
                    permission.id(),
                    permission.effectiveRole()
                ));
            }
        }
        return new RemovalPlan(email, candidates);
    }

    public List<RemovalPlan.Outcome> applyRemoval(RemovalPlan plan) throws AclInspectorException {
        requireFull();
        List<RemovalPlan.Outcome> outcomes = new ArrayList<>();
        for (RemovalPlan.Candidate candidate : plan.candidates()) {
            outcomes.add(new RemovalPlan.Outcome(candidate, delete(candidate.itemId(), candidate.permissionId())));
        }
        return outcomes;
    }

    private MutationResult delete(String itemId, String permissionId) throws AclInspectorException {
        try {
            client.deletePermission(itemId, permissionId);
            return MutationResult.ok("Permission removed successfully");
        } catch (RemoteApiException ex) {
            LOGGER.warning(() -> "[acl-inspector] removing " + permissionId + " from " + itemId + " failed: "
                + ex.getMessage());
            return MutationResult.failed(describeRemoveFailure(ex), ex);
        }
    }

    private void requireFull() throws AclInspectorException {
        client.token(Capability.FULL);
    }

    private static String describeInviteFailure(RemoteApiException ex) {
        switch (ex.getKind()) {
            case FORBIDDEN:
                return "Insufficient permissions to invite users";
            case NOT_FOUND:
                return "Item not found";
            case RATE_LIMITED:
                return "Rate limited by the server; try again later";
            default:
                return "Failed to invite user: " + ex.getMessage();
        }
    }

    private static String describeRemoveFailure(RemoteApiException ex) {
        switch (ex.getKind()) {
            case FORBIDDEN:
                return "Insufficient permissions to remove this permission";
            case NOT_FOUND:
                return "Permission not found (may already be removed)";
            case UNAUTHORIZED:
                return "Token expired or invalid";
            case RATE_LIMITED:
                return "Rate limited by the server; try again later";
            default:
                return "Failed to remove permission: " + ex.getMessage();
        }
    }
}
