package cloud.aclinspector.scan;

import java.util.Objects;

/**
 * @param maxDepth deepest level visited; the start node is depth 0, so {@code 0} visits only the start node.
 */
public record ScanOptions(int maxDepth, ItemType itemType) {

    public static final int DEFAULT_RECURSIVE_DEPTH = 3;

    public ScanOptions {
        if (maxDepth < 0) {
            throw new IllegalArgumentException("maxDepth must be >= 0");
        }
        Objects.requireNonNull(itemType, "itemType");
    }

    public static ScanOptions singleItem() {
        return new ScanOptions(0, ItemType.FOLDERS);
    }
}
