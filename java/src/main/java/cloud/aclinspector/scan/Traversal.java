package cloud.aclinspector.scan;

import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Mutable state of one traversal, passed explicitly through the recursion.
 */
final class Traversal {

    private final ScanOptions options;
    private final ScanVisitor visitor;
    private final Set<String> visited = new HashSet<>();
    private final Map<Integer, Integer> perDepth = new TreeMap<>();
    private int pruned;
    private int failedNodes;
    private int failedListings;

    Traversal(ScanOptions options, ScanVisitor visitor) {
        this.options = options;
        this.visitor = visitor;
    }

    ScanOptions options() {
        return options;
    }

    ScanVisitor visitor() {
        return visitor;
    }

    /**
     * @return {@code false} when the node was already visited.
     */
    boolean markVisited(String id, int depth) {
        if (!visited.add(id)) {
            return false;
        }
        perDepth.merge(depth, 1, Integer::sum);
        return true;
    }

    int visitedCount() {
        return visited.size();
    }

    void pruned() {
        pruned++;
    }

    void nodeFailed() {
        failedNodes++;
    }

    void listingFailed() {
        failedListings++;
    }

    ScanStatistics statistics() {
        return new ScanStatistics(visited.size(), perDepth, pruned, failedNodes, failedListings);
    }
}
