package cloud.aclinspector;

/**
 * Counts of a strip of all explicit permissions from one item.
 */
public record StripResult(int removedCount, int failedCount) {

    public boolean complete() {
        return failedCount == 0;
    }
}
