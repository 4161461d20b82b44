package com.armada.core.capability;

import java.util.Collection;
import java.util.List;

/**
 * Backup and restore of workspace files around a mission.
 */
public interface RollbackCapability {

    RollbackPoint backup(Collection<String> paths, String missionId);

    /**
     * Restores every file of the point.
     *
     * @return restored paths
     * @throws com.armada.core.error.ArmadaException NOT_FOUND for an unknown point
     */
    List<String> rollback(String pointId);

    /**
     * Points of a mission, newest first.
     */
    List<RollbackPoint> getHistory(String missionId);
}
