package com.armada.core.model;

public enum ChangeType {
    CREATE,
    MODIFY,
    DELETE
}
