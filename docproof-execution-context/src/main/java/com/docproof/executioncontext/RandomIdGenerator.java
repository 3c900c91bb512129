package com.docproof.executioncontext;

import java.util.UUID;

/** {@code <prefix>_<uuid without dashes>}. */
public final class RandomIdGenerator implements IdGenerator {

    public static final RandomIdGenerator INSTANCE = new RandomIdGenerator();

    private RandomIdGenerator() {
    }

    @Override
    public String newId(String prefix) {
        return prefix + "_" + UUID.randomUUID().toString().replace("-", "");
    }
}
