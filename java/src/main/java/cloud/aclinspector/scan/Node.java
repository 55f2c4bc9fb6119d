package cloud.aclinspector.scan;

/**
 * A visited item. {@code id} is the identity; {@code path} is for display only and may be empty.
 */
public record Node(String id, String name, String path, boolean folder, int depth, String parentId) {

    public boolean isRoot() {
        return depth == 0;
    }

    Node withPath(String resolved) {
        return new Node(id, name, resolved, folder, depth, parentId);
    }

    static String childPath(String parentPath, String name) {
        if (parentPath == null || parentPath.isEmpty()) {
            return name;
        }
        return parentPath.endsWith("/") ? parentPath + name : parentPath + "/" + name;
    }
}
