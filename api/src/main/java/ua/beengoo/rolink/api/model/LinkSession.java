package ua.beengoo.rolink.api.model;

import java.time.Duration;
import java.time.Instant;

/**
 * Pending link attempt, keyed by its OAuth {@code state}.
 */
public record LinkSession(String state, long requesterId, long tenantId, String codeVerifier, Instant createdAt) {
    public static final int MIN_VERIFIER_LENGTH = 43;
    public static final int MAX_VERIFIER_LENGTH = 128;

    public LinkSession {
        if (state == null || state.isBlank()) throw new IllegalArgumentException("state is required");
        if (codeVerifier == null
                || codeVerifier.length() < MIN_VERIFIER_LENGTH
                || codeVerifier.length() > MAX_VERIFIER_LENGTH) {
            throw new IllegalArgumentException("code verifier must be 43..128 characters");
        }
        if (createdAt == null) throw new IllegalArgumentException("createdAt is required");
    }

    public Instant expiresAt(Duration ttl) {
        return createdAt.plus(ttl);
    }

    public boolean isExpired(Instant now, Duration ttl) {
        return !now.isBefore(expiresAt(ttl));
    }
}
