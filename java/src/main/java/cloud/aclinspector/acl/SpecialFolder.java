package cloud.aclinspector.acl;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * A descendant whose access list is not inherited from the scan root.
 *
 * @param users      principal key to role on this node, sorted by key.
 * @param lostAccess root principals without access here; only filled for {@link Inheritance#RESTRICTED}.
 */
public record SpecialFolder(
    String path,
    Map<String, String> users,
    Inheritance inheritance,
    List<String> lostAccess
) {

    public SpecialFolder {
        users = Collections.unmodifiableMap(new TreeMap<>(users));
        lostAccess = List.copyOf(lostAccess);
    }
}
