package com.di.querybench.load;

import lombok.Value;

/** Key of an already-inserted row plus the ancillary field dependents copy (skill code). */
@Value
public class EntityRef {
    long   id;
    /** {@code null} for entities without a natural code. */
    String code;

    public static EntityRef of(long id) {
        return new EntityRef(id, null);
    }
}
