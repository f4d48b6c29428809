package com.keyhive.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Synchronous, in-process fan-out of {@link KeyChange} events.
 * <p>
 * Registration and delivery share one lock, so deliveries are serialized across the
 * process and every listener sees events in publication order. A failing listener is
 * logged and skipped; the publisher never sees the failure.
 */
public class KeyChangeBus {
    private static final Logger logger = LoggerFactory.getLogger(KeyChangeBus.class);

    private final ReentrantLock lock = new ReentrantLock();
    private final List<KeyChangeListener> listeners = new ArrayList<>();

    public void subscribe(KeyChangeListener listener) {
        Objects.requireNonNull(listener, "listener");
        lock.lock();
        try {
            listeners.add(listener);
        } finally {
            lock.unlock();
        }
    }

    public void publish(KeyChange change) {
        lock.lock();
        try {
            // a listener may subscribe another while we deliver
            for (KeyChangeListener listener : List.copyOf(listeners)) {
                try {
                    listener.onKeyChange(change);
                } catch (Exception e) {
                    logger.warn("Listener {} failed on {}: {}", listener, change, e.getMessage(), e);
                }
            }
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return listeners.size();
        } finally {
            lock.unlock();
        }
    }
}
