package com.di.querybench.load;

import java.util.List;

/**
 * Materializes the rows of one batch: logical indexes {@code [fromIndex, fromIndex + size)}.
 * A logical index may yield several rows (account memberships).
 */
@FunctionalInterface
public interface BatchProducer<T> {

    List<T> produce(long fromIndex, int size);
}
