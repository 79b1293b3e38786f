package com.phillippitts.tapguard.service.terminal;

import java.util.function.Consumer;

/**
 * Subscription point for online/offline transitions.
 *
 * <p>Listeners are notified on the thread that observed the change and must hand off
 * any blocking work.
 */
public interface ConnectivityMonitor {

    void addListener(Consumer<ConnectivityChange> listener);

    void removeListener(Consumer<ConnectivityChange> listener);
}
