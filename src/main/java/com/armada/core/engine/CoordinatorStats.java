package com.armada.core.engine;

public record CoordinatorStats(int running, long completed, long failed, long cancelled) {
}
