package kosukeroku.steam.qualification.checker.exception;

public class SteamApiException extends RuntimeException {

    public SteamApiException(String message) {
        super("Steam API error: " + message);
    }

    public SteamApiException(String message, Throwable cause) {
        super("Steam API error: " + message, cause);
    }
}
