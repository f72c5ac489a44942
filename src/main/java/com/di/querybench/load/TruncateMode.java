package com.di.querybench.load;

/** How the loader clears the dataset before writing it again. */
public enum TruncateMode {
    /** One {@code TRUNCATE ... RESTART IDENTITY CASCADE} over all tables (PostgreSQL). */
    CASCADE,
    /** One {@code TRUNCATE TABLE x RESTART IDENTITY} per table, dependents first. */
    PER_TABLE
}
