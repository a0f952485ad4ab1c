package io.graphlite.storage;

import java.lang.ref.Cleaner;
import java.lang.ref.WeakReference;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Locks arbitrary string keys (canonical ids, identity keys).
 * <p>
 * Locks are reentrant, so a thread that already holds a key inside an outer
 * transaction can lock it again. Lock objects are weakly referenced and
 * dropped from the table once no thread holds or waits on them.
 */
public final class KeyLocker {
    private static final Cleaner CLEANER = Cleaner.create();

    private final ConcurrentHashMap<String, WeakReference<ReentrantLock>> locks = new ConcurrentHashMap<>();

    /** Unlocks on close; never throws. */
    @FunctionalInterface
    public interface Held extends AutoCloseable {
        @Override
        void close();
    }

    private ReentrantLock lockFor(String key) {
        ReentrantLock fresh = new ReentrantLock();
        WeakReference<ReentrantLock> freshRef = new WeakReference<>(fresh);

        while (true) {
            WeakReference<ReentrantLock> oldRef = locks.putIfAbsent(key, freshRef);
            ReentrantLock old = oldRef != null ? oldRef.get() : null;

            if (old == null && oldRef != null) {
                // collected but not yet cleaned
                locks.remove(key, oldRef);
                continue;
            }
            if (old != null) return old;

            CLEANER.register(fresh, () -> locks.remove(key, freshRef));
            return fresh;
        }
    }

    /** Blocks until the key is locked by the calling thread. */
    public Held lock(String key) {
        ReentrantLock lock = lockFor(key);
        lock.lock();
        return lock::unlock;
    }
}
