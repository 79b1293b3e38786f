package com.phillippitts.tapguard.service.terminal;

import java.util.Objects;

/**
 * Reader reported by a discovery update.
 */
public record DiscoveredReader(String id, String deviceType, String label) {

    public DiscoveredReader {
        Objects.requireNonNull(id, "id");
    }
}
