package kosukeroku.steam.qualification.checker.exception;

public class SteamPrivateProfileException extends RuntimeException {

    public SteamPrivateProfileException(String steamId) {
        super("Game library of profile " + steamId + " is not accessible.");
    }
}
