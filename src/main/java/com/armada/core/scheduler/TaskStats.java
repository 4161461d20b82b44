package com.armada.core.scheduler;

/**
 * Task counts by status across every mission the scheduler still holds.
 */
public record TaskStats(
    int total,
    int pending,
    int blocked,
    int running,
    int completed,
    int failed,
    int cancelled
) {
}
