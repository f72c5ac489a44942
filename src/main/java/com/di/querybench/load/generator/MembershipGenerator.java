package com.di.querybench.load.generator;

import java.util.List;
import java.util.Random;

/**
 * Produces the link rows of one account. Selection is random, so the caller threads a
 * single seeded {@link Random} through every call of a load.
 */
public interface MembershipGenerator<T> {

    /** Number of accounts; valid indexes are {@code [0, accountCount)}. */
    long accountCount();

    List<T> generate(long accountIndex, Random random);
}
