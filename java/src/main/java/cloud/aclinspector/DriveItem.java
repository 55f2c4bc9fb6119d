package cloud.aclinspector;

/**
 * Folder or file as returned by the item and children endpoints.
 *
 * @param parentPath drive-relative path of the parent as reported by the API (for example {@code /drive/root:/Docs}),
 *                   {@code null} when not provided.
 */
public record DriveItem(
    String id,
    String name,
    boolean folder,
    boolean file,
    String parentId,
    String parentPath
) {
}
