package io.graphlite.storage;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.List;
import java.util.TreeSet;

/**
 * An open unit of work on the calling thread.
 * <p>
 * Collects staged inserts (committed as one log record), the key locks held
 * until the transaction ends, and callbacks to run once the commit is
 * durable. A transaction is confined to the thread that opened it.
 */
public final class Transaction {
    private final KeyLocker locker;
    private final List<Mutation> staged = new ArrayList<>();
    private final StoreState pending = new StoreState();
    private final StagedView view;
    private final Deque<KeyLocker.Held> held = new ArrayDeque<>();
    private final List<Runnable> afterCommit = new ArrayList<>();

    Transaction(StoreView committed, KeyLocker locker) {
        this.locker = locker;
        this.view = new StagedView(committed, pending);
    }

    /** Committed state plus everything staged so far in this transaction. */
    public StoreView view() {
        return view;
    }

    public void stage(Mutation mutation) {
        staged.add(mutation);
        pending.apply(mutation);
    }

    /** Lock a key until the transaction ends. Reentrant. */
    public void lock(String key) {
        held.push(locker.lock(key));
    }

    /** Lock several keys in sorted order, so concurrent callers cannot deadlock. */
    public void lockAll(Collection<String> keys) {
        for (String key : new TreeSet<>(keys)) lock(key);
    }

    /** Run after a successful commit, after locks are released. Never runs on rollback. */
    public void afterCommit(Runnable callback) {
        afterCommit.add(callback);
    }

    List<Mutation> staged() {
        return staged;
    }

    List<Runnable> afterCommitCallbacks() {
        return afterCommit;
    }

    void releaseLocks() {
        while (!held.isEmpty()) held.pop().close();
    }
}
