package com.di.querybench.load.generator;

/**
 * Maps a zero-based row index to exactly one row payload. Implementations are pure: the
 * same index always yields the same row.
 */
public interface RowGenerator<T> {

    /** Number of rows this generator produces; valid indexes are {@code [0, count)}. */
    long count();

    T generate(long index);

    default void checkIndex(long index) {
        if (index < 0 || index >= count()) {
            throw new IndexOutOfBoundsException("index " + index + " outside [0, " + count() + ")");
        }
    }
}
