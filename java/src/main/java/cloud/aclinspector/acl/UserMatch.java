package cloud.aclinspector.acl;

import java.util.Locale;

/**
 * How a searched user is compared with a principal's email.
 */
public enum UserMatch {
    /** The searched text occurs anywhere in the email, ignoring case. Matches {@code bob@x.com} for {@code bob}. */
    SUBSTRING,
    /** Case-insensitive equality. */
    EXACT;

    public boolean matches(String email, String target) {
        if (email == null || email.isBlank() || target == null || target.isBlank()) {
            return false;
        }
        String candidate = email.trim().toLowerCase(Locale.ROOT);
        String wanted = target.trim().toLowerCase(Locale.ROOT);
        return this == EXACT ? candidate.equals(wanted) : candidate.contains(wanted);
    }
}
