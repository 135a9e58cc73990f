package com.aquiferai.session;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One fair lock per session id, so at most one pipeline run per session is in flight. Callers
 * queue in arrival order up to a timeout. Locks are dropped once nobody holds or waits for them.
 */
@Component
@Slf4j
public class SessionLockRegistry {

    private final Map<String, LockEntry> locks = new ConcurrentHashMap<>();

    /**
     * Waits up to {@code timeout} for the session lock.
     *
     * @throws SessionBusyException when the lock is not obtained in time
     */
    public SessionLease acquire(String sessionId, Duration timeout) {
        LockEntry entry = locks.compute(sessionId, (key, existing) -> {
            LockEntry target = existing != null ? existing : new LockEntry();
            target.users++;
            return target;
        });
        boolean acquired = false;
        try {
            acquired = entry.lock.tryLock(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
        }
        if (!acquired) {
            release(sessionId);
            log.info("Session {} busy, rejecting message after {} ms.", sessionId, timeout.toMillis());
            throw new SessionBusyException(sessionId);
        }
        return new SessionLease(this, sessionId, entry.lock);
    }

    boolean isHeld(String sessionId) {
        LockEntry entry = locks.get(sessionId);
        return entry != null && entry.lock.isLocked();
    }

    int trackedSessions() {
        return locks.size();
    }

    private void release(String sessionId) {
        locks.computeIfPresent(sessionId, (key, existing) -> --existing.users == 0 ? null : existing);
    }

    private static final class LockEntry {
        private final ReentrantLock lock = new ReentrantLock(true);
        private int users;
    }

    /**
     * Held session lock; closing it lets the next queued caller in.
     */
    public static final class SessionLease implements AutoCloseable {
        private final SessionLockRegistry registry;
        private final String sessionId;
        private final ReentrantLock lock;
        private boolean closed;

        private SessionLease(SessionLockRegistry registry, String sessionId, ReentrantLock lock) {
            this.registry = registry;
            this.sessionId = sessionId;
            this.lock = lock;
        }

        public String sessionId() {
            return sessionId;
        }

        @Override
        public void close() {
            if (closed) {
                return;
            }
            closed = true;
            lock.unlock();
            registry.release(sessionId);
        }
    }
}
