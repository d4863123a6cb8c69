package ua.beengoo.rolink.core.service;

import ua.beengoo.rolink.api.model.Linkage;

import java.time.Instant;

/** Result of {@link LinkService#beginLink(long, long)}. */
public interface LinkStart {

    /** The user is linked already; no session was created. */
    record AlreadyLinked(Linkage linkage) implements LinkStart {}

    /** Send the user to {@code authorizationUrl} before {@code expiresAt}. */
    record AuthorizationRequired(String authorizationUrl, String state, Instant expiresAt) implements LinkStart {}
}
