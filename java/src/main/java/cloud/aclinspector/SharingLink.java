package cloud.aclinspector;

/**
 * Sharing-link facet of a permission ({@code view}/{@code edit} link, {@code anonymous}/{@code organization} scope).
 */
public record SharingLink(String type, String scope) {
}
