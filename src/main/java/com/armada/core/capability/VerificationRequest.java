package com.armada.core.capability;

import com.armada.core.model.FileChange;

import java.util.List;

/**
 * @param missionId mission being verified
 * @param changes   every change merged during the run
 */
public record VerificationRequest(String missionId, List<FileChange> changes) {

    public VerificationRequest {
        changes = List.copyOf(changes);
    }
}
