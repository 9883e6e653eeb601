package kosukeroku.steam.qualification.checker.exception;

import lombok.Getter;

/**
 * Raised when no trustworthy games data could be collected for an account.
 * Per-game achievement failures never end up here.
 */
@Getter
public class CollectionException extends RuntimeException {

    private final CollectionErrorKind kind;
    private final String steamId;

    public CollectionException(CollectionErrorKind kind, String steamId, Throwable cause) {
        super(messageFor(kind, steamId), cause);
        this.kind = kind;
        this.steamId = steamId;
    }

    public static CollectionException privateOrEmpty(String steamId) {
        return new CollectionException(CollectionErrorKind.PRIVATE_OR_EMPTY_PROFILE, steamId, null);
    }

    public boolean isRetryable() {
        return kind == CollectionErrorKind.UPSTREAM;
    }

    private static String messageFor(CollectionErrorKind kind, String steamId) {
        return switch (kind) {
            case PRIVATE_OR_EMPTY_PROFILE -> "Could not access games of profile " + steamId
                    + ". Make sure your Game Details are set to Public "
                    + "(Steam → Settings → Privacy → Game Details → Public) and try again.";
            case UPSTREAM -> "Steam did not respond for profile " + steamId
                    + ". This is usually temporary, please try again in a few minutes.";
        };
    }
}
