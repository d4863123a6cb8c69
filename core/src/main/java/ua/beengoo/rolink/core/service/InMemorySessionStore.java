package ua.beengoo.rolink.core.service;

import ua.beengoo.rolink.api.model.LinkSession;
import ua.beengoo.rolink.api.ports.SessionStore;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local session store for deployments without Redis.
 * <p>
 * {@link ConcurrentHashMap#remove(Object)} is the single point of mutual exclusion: whichever
 * caller removes the entry owns it, every other caller gets nothing.
 */
public class InMemorySessionStore implements SessionStore {
    public static final Duration DEFAULT_TTL = Duration.ofMinutes(10);

    private final Map<String, LinkSession> sessions = new ConcurrentHashMap<>();
    private final Duration ttl;
    private final Clock clock;

    public InMemorySessionStore() {
        this(DEFAULT_TTL, Clock.systemUTC());
    }

    public InMemorySessionStore(Duration ttl, Clock clock) {
        this.ttl = ttl;
        this.clock = clock;
    }

    @Override
    public void create(String state, long requesterId, long tenantId, String codeVerifier) {
        pruneExpired();
        sessions.put(state, new LinkSession(state, requesterId, tenantId, codeVerifier, clock.instant()));
    }

    @Override
    public Optional<LinkSession> consume(String state) {
        if (state == null) return Optional.empty();
        pruneExpired();
        LinkSession st = sessions.remove(state);
        // expired between prune and remove
        if (st == null || st.isExpired(clock.instant(), ttl)) return Optional.empty();
        return Optional.of(st);
    }

    /** @return number of removed entries */
    public int pruneExpired() {
        Instant now = clock.instant();
        int removed = 0;
        for (var e : sessions.entrySet()) {
            if (e.getValue().isExpired(now, ttl) && sessions.remove(e.getKey(), e.getValue())) removed++;
        }
        return removed;
    }

    public int size() {
        return sessions.size();
    }

    public Duration ttl() {
        return ttl;
    }
}
