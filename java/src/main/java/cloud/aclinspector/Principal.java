package cloud.aclinspector;

import java.util.Locale;

/**
 * A user a permission is granted to.
 */
public record Principal(String displayName, String email) {

    /**
     * Identity used for comparisons: the lower-cased email, or the display name when the email is absent.
     */
    public String key() {
        if (email != null && !email.isBlank()) {
            return email.trim().toLowerCase(Locale.ROOT);
        }
        return displayName == null ? "" : displayName.trim();
    }

    /**
     * @return the lower-cased email, or an empty string when absent.
     */
    public String normalizedEmail() {
        return email == null ? "" : email.trim().toLowerCase(Locale.ROOT);
    }
}
