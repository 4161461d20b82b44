package com.armada.core.merge;

/**
 * How a conflict was (or is to be) resolved, in cascade order.
 */
public enum MergeStrategy {
    AUTO("auto"),
    AI_ASSISTED("ai_assisted"),
    MANUAL("manual");

    private final String code;

    MergeStrategy(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
