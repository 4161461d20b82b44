package com.armada.core.mission;

import com.armada.core.model.MissionPhase;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Allowed mission phase transitions. Backward edges model recovery; COMPLETION is terminal.
 */
public final class PhaseGraph {

    private static final Map<MissionPhase, Set<MissionPhase>> EDGES = new EnumMap<>(MissionPhase.class);

    static {
        EDGES.put(MissionPhase.PLANNING, EnumSet.of(MissionPhase.VALIDATION, MissionPhase.COMPLETION));
        EDGES.put(MissionPhase.VALIDATION, EnumSet.of(MissionPhase.EXECUTION, MissionPhase.PLANNING));
        EDGES.put(MissionPhase.EXECUTION, EnumSet.of(MissionPhase.VERIFICATION, MissionPhase.PLANNING));
        EDGES.put(MissionPhase.VERIFICATION, EnumSet.of(MissionPhase.COMPLETION, MissionPhase.EXECUTION));
        EDGES.put(MissionPhase.COMPLETION, EnumSet.noneOf(MissionPhase.class));
    }

    private PhaseGraph() {}

    public static boolean isAllowed(MissionPhase from, MissionPhase to) {
        return EDGES.get(from).contains(to);
    }

    public static Set<MissionPhase> successors(MissionPhase from) {
        return Set.copyOf(EDGES.get(from));
    }

    /**
     * Next phase in canonical order, empty at COMPLETION.
     */
    public static Optional<MissionPhase> next(MissionPhase from) {
        MissionPhase[] order = MissionPhase.values();
        int index = from.ordinal();
        return index + 1 < order.length ? Optional.of(order[index + 1]) : Optional.empty();
    }

    /**
     * Overall progress when a mission enters the phase: {@code index / phaseCount * 100}.
     */
    public static double overallProgressAt(MissionPhase phase) {
        return (double) phase.ordinal() / MissionPhase.values().length * 100.0;
    }
}
