package com.docproof.executioncontext;

import java.util.concurrent.atomic.AtomicLong;

/** {@code <prefix>_<n>} with a shared counter starting at 1. Deterministic; for replays and tests. */
public final class SequentialIdGenerator implements IdGenerator {

    private final AtomicLong counter = new AtomicLong();

    @Override
    public String newId(String prefix) {
        return prefix + "_" + counter.incrementAndGet();
    }
}
