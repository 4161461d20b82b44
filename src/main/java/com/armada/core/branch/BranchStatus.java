package com.armada.core.branch;

public enum BranchStatus {
    ACTIVE,
    MERGED,
    ABANDONED
}
