package cloud.aclinspector;

import java.util.List;

/**
 * Explicit permissions of one user found below a start item, ready to be removed.
 */
public record RemovalPlan(String email, List<Candidate> candidates) {

    public RemovalPlan {
        candidates = List.copyOf(candidates);
    }

    public boolean isEmpty() {
        return candidates.isEmpty();
    }

    /**
     * One permission to delete.
     */
    public record Candidate(String itemId, String path, String permissionId, String role) {
    }

    /**
     * What happened to one candidate.
     */
    public record Outcome(Candidate candidate, MutationResult result) {
    }
}
