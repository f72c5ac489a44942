package com.di.querybench.load;

import org.springframework.stereotype.Component;

import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Keeps reloads and measurements apart: a reload holds the write lock, a benchmark the
 * read lock, so latencies are never taken against a dataset that is being rewritten.
 */
@Component
public class DatasetGuard {

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock(true);

    public Lock reloadLock() {
        return lock.writeLock();
    }

    public Lock benchmarkLock() {
        return lock.readLock();
    }
}
