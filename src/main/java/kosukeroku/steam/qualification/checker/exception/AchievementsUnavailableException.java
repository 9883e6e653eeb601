package kosukeroku.steam.qualification.checker.exception;

/**
 * Steam has no achievement data for the game: the app has no stats, or the
 * player's game details are hidden for it.
 */
public class AchievementsUnavailableException extends RuntimeException {

    public AchievementsUnavailableException(long appId, String reason) {
        super("No achievements for appId " + appId + ": " + reason);
    }
}
