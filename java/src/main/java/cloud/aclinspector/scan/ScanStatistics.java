package cloud.aclinspector.scan;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Counters of a finished traversal.
 *
 * @param nodesPerDepth visited nodes per depth, ordered by depth.
 * @param failedNodes   nodes whose permissions could not be read.
 * @param failedListings folders whose children could not be listed.
 */
public record ScanStatistics(
    int visited,
    Map<Integer, Integer> nodesPerDepth,
    int pruned,
    int failedNodes,
    int failedListings
) {

    public ScanStatistics {
        nodesPerDepth = Collections.unmodifiableMap(new TreeMap<>(nodesPerDepth));
    }
}
