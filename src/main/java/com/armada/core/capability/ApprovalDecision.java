package com.armada.core.capability;

import com.armada.core.model.FileChange;

import java.util.List;

/**
 * @param approved      whether the changes may proceed
 * @param modifications replacement change set chosen by the approver (nullable)
 * @param reason        why the changes were rejected (nullable)
 */
public record ApprovalDecision(boolean approved, List<FileChange> modifications, String reason) {

    public static ApprovalDecision approve() {
        return new ApprovalDecision(true, null, null);
    }

    public static ApprovalDecision approveWith(List<FileChange> modifications) {
        return new ApprovalDecision(true, List.copyOf(modifications), null);
    }

    public static ApprovalDecision reject(String reason) {
        return new ApprovalDecision(false, null, reason);
    }
}
