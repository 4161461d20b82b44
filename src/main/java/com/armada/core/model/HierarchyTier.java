package com.armada.core.model;

/**
 * Level of the agent hierarchy a call is made on behalf of. Used for quota breakdowns.
 */
public enum HierarchyTier {
    SOVEREIGN,
    LORD,
    OVERLORD,
    WORKER
}
