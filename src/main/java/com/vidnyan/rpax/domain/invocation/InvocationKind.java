package com.vidnyan.rpax.domain.invocation;

import java.util.Arrays;

/**
 * Classification of a workflow invocation target.
 */
public enum InvocationKind {
    STATIC("invoke"),
    DYNAMIC("invoke-dynamic"),
    MISSING("invoke-missing"),
    CODED("invoke-coded");

    private final String wireName;

    InvocationKind(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Parse a serialized kind.
     * @throws IllegalArgumentException for names outside the four kinds
     */
    public static InvocationKind fromWireName(String name) {
        return Arrays.stream(values())
                .filter(k -> k.wireName.equals(name))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown invocation kind: " + name));
    }

    public static boolean isKnown(String name) {
        return Arrays.stream(values()).anyMatch(k -> k.wireName.equals(name));
    }
}
