package ua.beengoo.rolink.api.ports;

import ua.beengoo.rolink.api.model.LinkSession;

import java.util.Optional;

/**
 * Short-lived correlation state between a link request and its OAuth callback.
 * <p>
 * Implementations must make {@link #consume(String)} atomic: when several callers race on
 * the same state, exactly one of them receives the session. Entries older than the TTL are
 * never returned, and an expired entry looks exactly like one that was never issued.
 */
public interface SessionStore {

    /** Stores a new pending session. State values are random enough that overwrites are not expected. */
    void create(String state, long requesterId, long tenantId, String codeVerifier);

    /** Retrieves and deletes the session in one step. */
    Optional<LinkSession> consume(String state);
}
