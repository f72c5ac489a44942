package com.di.querybench.exception;

import com.di.querybench.load.EntityType;

/**
 * A generator asked for keys of an entity that has not been loaded yet, or that loaded
 * empty. Always a programming or configuration defect; the load is aborted.
 */
public class MissingReferenceException extends IllegalStateException {

    private final EntityType entityType;

    public MissingReferenceException(EntityType entityType, String message) {
        super(message);
        this.entityType = entityType;
    }

    public EntityType getEntityType() {
        return entityType;
    }
}
