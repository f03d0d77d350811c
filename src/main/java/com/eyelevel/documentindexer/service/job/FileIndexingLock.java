package com.eyelevel.documentindexer.service.job;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Serializes indexing runs of the same file within this process. Locks are striped by file id, so
 * two different files may occasionally wait for each other but one file never runs twice at once.
 */
@Component
public class FileIndexingLock {

    private final ReentrantLock[] stripes;

    public FileIndexingLock(@Value("${app.indexing.lock-stripes:64}") int stripeCount) {
        if (stripeCount <= 0) {
            throw new IllegalArgumentException("lock-stripes must be positive, got " + stripeCount);
        }
        this.stripes = new ReentrantLock[stripeCount];
        for (int i = 0; i < stripeCount; i++) {
            stripes[i] = new ReentrantLock(true);
        }
    }

    public <T> T withLock(UUID fileId, Supplier<T> action) {
        ReentrantLock lock = stripeFor(fileId);
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    ReentrantLock stripeFor(UUID fileId) {
        return stripes[Math.floorMod(fileId.hashCode(), stripes.length)];
    }
}
