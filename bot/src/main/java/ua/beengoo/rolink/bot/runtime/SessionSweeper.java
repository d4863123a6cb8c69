package ua.beengoo.rolink.bot.runtime;

import lombok.extern.slf4j.Slf4j;
import ua.beengoo.rolink.core.service.InMemorySessionStore;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/** Periodically drops expired sessions from the in-memory store. Redis expires its own keys. */
@Slf4j
public class SessionSweeper {
    private final InMemorySessionStore store;
    private final Duration period;
    private ScheduledExecutorService scheduler;

    public SessionSweeper(InMemorySessionStore store, Duration period) {
        this.store = store;
        this.period = period;
    }

    public synchronized void start() {
        if (scheduler != null) return;
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "rolink-session-sweeper");
            t.setDaemon(true);
            return t;
        });
        long millis = Math.max(1, period.toMillis());
        scheduler.scheduleAtFixedRate(this::tick, millis, millis, TimeUnit.MILLISECONDS);
    }

    public synchronized void stop() {
        if (scheduler != null) {
            scheduler.shutdownNow();
            scheduler = null;
        }
    }

    void tick() {
        try {
            int removed = store.pruneExpired();
            if (removed > 0) log.debug("Swept {} expired link sessions", removed);
        } catch (RuntimeException e) {
            // keep the schedule alive
            log.warn("Session sweep failed: {}", e.getMessage());
        }
    }
}
