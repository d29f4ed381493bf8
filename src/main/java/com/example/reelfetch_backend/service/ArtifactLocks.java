package com.example.reelfetch_backend.service;

import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One lock per artifact directory, shared by writers and the reclaimer. Different posts never contend.
 * <p>
 * Entries live only as long as their directory: the reclaimer {@link #release releases} the entry after deleting
 * the directory. A lock taken is only valid while it is still the mapped one, so both acquire methods re-check
 * the mapping after locking and retry against the fresh entry when it was released meanwhile.
 */
@Component
public class ArtifactLocks {
    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    /** Blocks until the post's lock is held. */
    public ReentrantLock acquire(String postId) {
        while (true) {
            ReentrantLock lock = locks.computeIfAbsent(postId, ignored -> new ReentrantLock());
            lock.lock();
            if (locks.get(postId) == lock) {
                return lock;
            }
            lock.unlock();
        }
    }

    /** @return the held lock, or {@code null} when another thread holds it right now */
    public ReentrantLock tryAcquire(String postId) {
        while (true) {
            ReentrantLock lock = locks.computeIfAbsent(postId, ignored -> new ReentrantLock());
            if (!lock.tryLock()) {
                return null;
            }
            if (locks.get(postId) == lock) {
                return lock;
            }
            lock.unlock();
        }
    }

    /**
     * Drops the entry of a post whose directory is gone. Must be called while holding {@code lock}.
     */
    public void release(String postId, ReentrantLock lock) {
        locks.remove(postId, lock);
    }

    int size() {
        return locks.size();
    }
}
