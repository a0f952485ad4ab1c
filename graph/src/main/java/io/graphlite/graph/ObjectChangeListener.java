package io.graphlite.graph;

/**
 * Receives object change events on the committing thread, after the commit
 * is durable and the key locks are released. Exceptions are logged and
 * dropped.
 */
@FunctionalInterface
public interface ObjectChangeListener {
    void onObjectChanged(ObjectChangedEvent event);
}
