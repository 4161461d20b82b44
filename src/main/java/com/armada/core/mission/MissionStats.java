package com.armada.core.mission;

public record MissionStats(
    int total,
    int pending,
    int active,
    int paused,
    int completed,
    int failed,
    int cancelled
) {
}
