package cloud.aclinspector.scan;

/**
 * Whether the scanner descends below a visited node.
 */
public enum VisitDecision {
    CONTINUE,
    /** Skip the node's children. */
    PRUNE
}
