package com.phillippitts.tapguard.service.terminal;

import java.util.List;

/**
 * Receives the full list of readers seen so far each time discovery reports an update.
 */
@FunctionalInterface
public interface DiscoveryListener {

    void onReadersDiscovered(List<DiscoveredReader> readers);
}
