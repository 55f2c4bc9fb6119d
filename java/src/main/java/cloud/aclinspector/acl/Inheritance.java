package cloud.aclinspector.acl;

/**
 * How a node's access list relates to the access list it is compared with.
 */
public enum Inheritance {
    /** Same principals as the reference. */
    INHERITED("INHERITED"),
    /** Only principals of the reference, some missing. */
    RESTRICTED("RESTRICTED"),
    /** Every principal of the reference plus others. */
    EXTENDED("EXTENDED"),
    /** Principals both gained and lost. */
    DIFFERENT("DIFFERENT");

    private final String label;

    Inheritance(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
