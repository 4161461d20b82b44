package com.armada.core.engine;

import com.armada.core.capability.ApprovalCapability;
import com.armada.core.capability.PreflightCapability;
import com.armada.core.capability.RollbackCapability;
import com.armada.core.capability.VerificationCapability;

/**
 * Capabilities consulted between phases. Missing gates fall back to their pass-through
 * variants; rollback has no such variant and is required.
 */
public record SafetyGates(
    PreflightCapability preflight,
    ApprovalCapability approval,
    VerificationCapability verification,
    RollbackCapability rollback
) {

    public SafetyGates {
        if (rollback == null) {
            throw new IllegalArgumentException("A rollback capability is required");
        }
        preflight = preflight != null ? preflight : PreflightCapability.PASS_THROUGH;
        approval = approval != null ? approval : ApprovalCapability.AUTO_APPROVE;
        verification = verification != null ? verification : VerificationCapability.ACCEPT_ALL;
    }

    public static SafetyGates defaults(RollbackCapability rollback) {
        return new SafetyGates(null, null, null, rollback);
    }
}
