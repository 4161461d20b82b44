package com.armada.core.capability;

import com.armada.core.model.FileChange;
import com.armada.core.model.Task;

import java.util.List;

/**
 * Gate between a task's proposed changes and its virtual branch.
 */
@FunctionalInterface
public interface ApprovalCapability {

    ApprovalCapability AUTO_APPROVE = (task, changes) -> ApprovalDecision.approve();

    ApprovalDecision requestApproval(Task task, List<FileChange> changes);
}
