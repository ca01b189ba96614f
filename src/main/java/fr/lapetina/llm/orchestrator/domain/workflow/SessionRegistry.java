package fr.lapetina.llm.orchestrator.domain.workflow;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Process-local session store with idle expiry.
 *
 * Sessions are only reachable through their id, so the store can be moved
 * behind a shared backend without changing its callers.
 */
public final class SessionRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SessionRegistry.class);

    private final Map<String, Session> sessions = new ConcurrentHashMap<>();
    private final Duration idleTimeout;
    private final Clock clock;
    private ScheduledExecutorService sweeper;

    public SessionRegistry(Duration idleTimeout, Clock clock) {
        if (idleTimeout.isNegative() || idleTimeout.isZero()) {
            throw new IllegalArgumentException("Idle timeout must be positive");
        }
        this.idleTimeout = idleTimeout;
        this.clock = clock;
    }

    public SessionRegistry(Duration idleTimeout) {
        this(idleTimeout, Clock.systemUTC());
    }

    Clock getClock() {
        return clock;
    }

    /**
     * @return the replaced session, if any
     */
    Optional<Session> put(Session session) {
        return Optional.ofNullable(sessions.put(session.getSessionId(), session));
    }

    Optional<Session> find(String sessionId) {
        return Optional.ofNullable(sessions.get(sessionId));
    }

    Optional<Session> remove(String sessionId) {
        return Optional.ofNullable(sessions.remove(sessionId));
    }

    public int size() {
        return sessions.size();
    }

    /**
     * Starts the periodic idle sweep. {@code onExpire} receives the id of each
     * expired session and is responsible for closing it.
     */
    public synchronized void startSweeper(Duration interval, Consumer<String> onExpire) {
        if (sweeper != null) {
            return;
        }
        sweeper = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "session-sweeper");
            t.setDaemon(true);
            return t;
        });
        sweeper.scheduleAtFixedRate(() -> sweepIdle(onExpire),
                interval.toMillis(), interval.toMillis(), TimeUnit.MILLISECONDS);
        log.info("Session sweeper started: idleTimeoutMs={}, intervalMs={}",
                idleTimeout.toMillis(), interval.toMillis());
    }

    /**
     * Expires every session untouched for the idle timeout.
     *
     * @return number of sessions expired
     */
    public int sweepIdle(Consumer<String> onExpire) {
        long now = clock.millis();
        List<String> expired = new ArrayList<>();
        for (Session session : sessions.values()) {
            if (now - session.getLastTouchedMillis() >= idleTimeout.toMillis()) {
                expired.add(session.getSessionId());
            }
        }
        for (String sessionId : expired) {
            try {
                onExpire.accept(sessionId);
            } catch (RuntimeException e) {
                // Keep sweeping; a scheduled task that throws is never run again
                log.warn("Session expiry failed: sessionId={}", sessionId, e);
            }
        }
        if (!expired.isEmpty()) {
            log.info("Idle sessions expired: count={}, remaining={}", expired.size(), sessions.size());
        }
        return expired.size();
    }

    @Override
    public synchronized void close() {
        if (sweeper != null) {
            sweeper.shutdownNow();
            sweeper = null;
        }
    }
}
