package cloud.aclinspector.scan;

import cloud.aclinspector.DriveItem;

import java.util.Locale;

/**
 * Which children a traversal visits. Folders are the only items ever descended into.
 */
public enum ItemType {
    FOLDERS,
    FILES,
    BOTH;

    public boolean includes(DriveItem item) {
        switch (this) {
            case FOLDERS:
                return item.folder();
            case FILES:
                return item.file();
            default:
                return true;
        }
    }

    /**
     * Parses {@code folders}, {@code files} or {@code both}, ignoring case.
     *
     * @throws IllegalArgumentException for any other value.
     */
    public static ItemType parse(String value) {
        if (value == null) {
            throw new IllegalArgumentException("item type is required");
        }
        switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "folders":
                return FOLDERS;
            case "files":
                return FILES;
            case "both":
                return BOTH;
            default:
                throw new IllegalArgumentException("item type must be folders, files or both: " + value);
        }
    }
}
