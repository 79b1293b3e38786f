package com.phillippitts.tapguard.service.recovery;

import java.util.Locale;

/**
 * Reason a transaction is cancelled (and possibly recreated) outside the user's control.
 */
public enum LifecycleAction {
    /** Transaction reached the backend's expiry window. */
    HARD_TIMEOUT(true),
    /** Transaction is close to expiry; replaced before it can race its own timeout. */
    PROACTIVE_REFRESH(true),
    /** Reader has been awaiting a card for too long. */
    STUCK_AWAITING_INPUT(false),
    /** Reader came back after a reconnect; zero-touch needs a fresh collect. */
    POST_RECONNECT(true),
    /** Connectivity flipped while awaiting a card. */
    NETWORK_BLIP(true),
    NONE(false);

    private final boolean recreates;

    LifecycleAction(boolean recreates) {
        this.recreates = recreates;
    }

    /**
     * Whether the action asks for a replacement transaction. Honoured only in the zero-touch layout.
     */
    public boolean recreates() {
        return recreates;
    }

    public String tag() {
        return name().toLowerCase(Locale.ROOT).replace('_', '-');
    }
}
