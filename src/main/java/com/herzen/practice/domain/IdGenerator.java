package com.herzen.practice.domain;

import java.util.UUID;

public final class IdGenerator {

    private IdGenerator() {
    }

    public static String shortUuid() {
        return UUID.randomUUID().toString().replace("-", "");
    }

    /**
     * Prefixed id such as {@code open-questions-3f9c0a1b2d4e}.
     */
    public static String withPrefix(String prefix) {
        return prefix + "-" + shortUuid().substring(0, 12);
    }
}
