package ua.beengoo.rolink.bot.adapters.redis;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.lettuce.core.ScriptOutputType;
import io.lettuce.core.api.sync.RedisCommands;
import lombok.extern.slf4j.Slf4j;
import ua.beengoo.rolink.api.model.LinkSession;
import ua.beengoo.rolink.api.ports.SessionStore;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Shared session store for multi-instance deployments.
 * <p>
 * Entries carry a Redis TTL, and {@link #consume(String)} reads and deletes in one Lua script
 * so two instances can never both obtain the same session.
 */
@Slf4j
public class RedisSessionStore implements SessionStore {
    public static final String KEY_PREFIX = "rolink:session:";

    static final String CONSUME_SCRIPT =
            "local v = redis.call('GET', KEYS[1]) " +
            "if v then redis.call('DEL', KEYS[1]) end " +
            "return v";

    private final RedisCommands<String, String> redis;
    private final ObjectMapper om;
    private final Duration ttl;
    private final Clock clock;

    public RedisSessionStore(RedisCommands<String, String> redis, ObjectMapper om, Duration ttl, Clock clock) {
        this.redis = redis;
        this.om = om;
        this.ttl = ttl;
        this.clock = clock;
    }

    @Override
    public void create(String state, long requesterId, long tenantId, String codeVerifier) {
        // validates before anything is written
        LinkSession session = new LinkSession(state, requesterId, tenantId, codeVerifier, clock.instant());
        Payload payload = new Payload(session.requesterId(), session.tenantId(), session.codeVerifier(),
                session.createdAt().toEpochMilli());
        try {
            redis.setex(key(state), Math.max(1, ttl.toSeconds()), om.writeValueAsString(payload));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize session", e);
        }
    }

    @Override
    public Optional<LinkSession> consume(String state) {
        if (state == null || state.isBlank()) return Optional.empty();
        String raw = redis.eval(CONSUME_SCRIPT, ScriptOutputType.VALUE, key(state));
        if (raw == null) return Optional.empty();

        LinkSession session;
        try {
            Payload p = om.readValue(raw, Payload.class);
            session = new LinkSession(state, p.requesterId(), p.tenantId(), p.codeVerifier(),
                    Instant.ofEpochMilli(p.createdAt()));
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.warn("Dropping unreadable session {}: {}", state, e.getMessage());
            return Optional.empty();
        }
        // Redis expiry has second granularity
        if (session.isExpired(clock.instant(), ttl)) return Optional.empty();
        return Optional.of(session);
    }

    static String key(String state) {
        return KEY_PREFIX + state;
    }

    record Payload(long requesterId, long tenantId, String codeVerifier, long createdAt) {
    }
}
