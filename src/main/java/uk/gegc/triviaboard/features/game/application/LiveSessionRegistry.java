package uk.gegc.triviaboard.features.game.application;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.triviaboard.features.game.domain.model.LiveGameSession;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Owns the live state of every running session and the lock that serialises actions on it.
 *
 * <p>A session's lock exists only while some thread holds or waits for it. Every caller joins the entry
 * before locking and leaves it after unlocking; the last one to leave removes it, so ids that never
 * belonged to a session leave nothing behind. Callers only read or replace a session's live state
 * while holding that session's lock.</p>
 */
@Slf4j
@Component
public class LiveSessionRegistry {

    private final ConcurrentMap<Long, LockEntry> locks = new ConcurrentHashMap<>();
    private final ConcurrentMap<Long, LiveGameSession> sessions = new ConcurrentHashMap<>();

    public <T> T withLock(Long sessionId, Supplier<T> action) {
        LockEntry entry = locks.compute(sessionId, (id, existing) -> {
            LockEntry joined = existing != null ? existing : new LockEntry();
            joined.holders++;
            return joined;
        });
        entry.lock.lock();
        try {
            return action.get();
        } finally {
            entry.lock.unlock();
            locks.computeIfPresent(sessionId, (id, existing) -> --existing.holders == 0 ? null : existing);
        }
    }

    public void runWithLock(Long sessionId, Runnable action) {
        withLock(sessionId, () -> {
            action.run();
            return null;
        });
    }

    public Optional<LiveGameSession> find(Long sessionId) {
        return Optional.ofNullable(sessions.get(sessionId));
    }

    public void register(LiveGameSession session) {
        LiveGameSession previous = sessions.put(session.getSessionId(), session);
        if (previous != null && previous != session) {
            previous.close();
        }
        log.debug("Live state registered for session {}", session.getSessionId());
    }

    public void discard(Long sessionId) {
        LiveGameSession removed = sessions.remove(sessionId);
        if (removed != null) {
            removed.close();
            log.debug("Live state discarded for session {}", sessionId);
        }
    }

    /**
     * Drops live state not touched since {@code cutoff}. Each candidate is re-checked under its lock.
     *
     * @return number of sessions evicted
     */
    public int evictIdle(Instant cutoff) {
        List<Long> candidates = sessions.values().stream()
                .filter(session -> session.getLastActivity().isBefore(cutoff))
                .map(LiveGameSession::getSessionId)
                .toList();
        int evicted = 0;
        for (Long sessionId : candidates) {
            boolean removed = withLock(sessionId, () -> {
                LiveGameSession session = sessions.get(sessionId);
                if (session == null || !session.getLastActivity().isBefore(cutoff)) {
                    return false;
                }
                discard(sessionId);
                return true;
            });
            if (removed) {
                evicted++;
            }
        }
        return evicted;
    }

    public int size() {
        return sessions.size();
    }

    public int lockCount() {
        return locks.size();
    }

    // holders is only touched inside compute on the entry's key
    private static final class LockEntry {
        private final ReentrantLock lock = new ReentrantLock();
        private int holders;
    }
}
