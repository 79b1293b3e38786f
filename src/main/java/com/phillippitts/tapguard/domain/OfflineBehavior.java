package com.phillippitts.tapguard.domain;

/**
 * Offline preference passed when creating a payment intent.
 */
public enum OfflineBehavior {
    PREFER_ONLINE,
    REQUIRE_ONLINE,
    FORCE_OFFLINE;

    /**
     * Derives the preference from the current connectivity and offline-mode combination.
     * Unknown readings fall back to the online variants.
     */
    public static OfflineBehavior from(Signal offlineModeEnabled, Signal sdkNetworkOnline) {
        if (!offlineModeEnabled.isTrue()) {
            return REQUIRE_ONLINE;
        }
        return sdkNetworkOnline.isFalse() ? FORCE_OFFLINE : PREFER_ONLINE;
    }
}
