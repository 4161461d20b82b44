package com.armada.core.quota;

/**
 * Usage level of a provider's current window, in ascending severity.
 */
public enum QuotaState {
    OK(null),
    WARNING("quota.warning"),
    CRITICAL("quota.critical"),
    EXCEEDED("quota.exceeded");

    private final String eventType;

    QuotaState(String eventType) {
        this.eventType = eventType;
    }

    /**
     * Event emitted when usage rises into this state; null for OK.
     */
    public String eventType() {
        return eventType;
    }

    public boolean isAbove(QuotaState other) {
        return ordinal() > other.ordinal();
    }
}
