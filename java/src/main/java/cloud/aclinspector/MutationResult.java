package cloud.aclinspector;

/**
 * Outcome of a single invite or removal.
 */
public record MutationResult(boolean success, String message, RemoteApiException failure) {

    public static MutationResult ok(String message) {
        return new MutationResult(true, message, null);
    }

    public static MutationResult failed(String message) {
        return new MutationResult(false, message, null);
    }

    public static MutationResult failed(String message, RemoteApiException failure) {
        return new MutationResult(false, message, failure);
    }
}
