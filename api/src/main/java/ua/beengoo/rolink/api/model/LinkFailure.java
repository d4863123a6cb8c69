package ua.beengoo.rolink.api.model;

/**
 * Fatal outcomes of an OAuth callback. None of them is retried: the session is already gone.
 */
public enum LinkFailure {
    MISSING_PARAMETERS(400),
    /** Unknown, expired and already consumed states all land here. */
    SESSION_INVALID_OR_EXPIRED(400),
    TOKEN_EXCHANGE_FAILURE(500),
    PROFILE_FETCH_FAILURE(500);

    private final int httpStatus;

    LinkFailure(int httpStatus) {
        this.httpStatus = httpStatus;
    }

    public int httpStatus() {
        return httpStatus;
    }
}
