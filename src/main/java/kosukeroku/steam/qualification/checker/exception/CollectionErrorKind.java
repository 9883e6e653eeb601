package kosukeroku.steam.qualification.checker.exception;

public enum CollectionErrorKind {

    // the owned games list is hidden, forbidden or empty; the user has to change settings
    PRIVATE_OR_EMPTY_PROFILE,

    // network error, timeout or a broken response; retrying may help
    UPSTREAM
}
