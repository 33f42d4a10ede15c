package com.vidnyan.rpax.domain.model;

/**
 * Direction of a workflow argument.
 */
public enum ArgumentDirection {
    IN("in"),
    OUT("out"),
    INOUT("inout");

    private final String wireName;

    ArgumentDirection(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Derive the direction from a .NET type signature such as
     * {@code InOutArgument(x:String)}. Unknown signatures are treated as input.
     */
    public static ArgumentDirection fromTypeSignature(String type) {
        if (type == null) {
            return IN;
        }
        if (type.contains("InOutArgument")) {
            return INOUT;
        }
        if (type.contains("OutArgument")) {
            return OUT;
        }
        return IN;
    }

    public static ArgumentDirection fromWireName(String name) {
        for (ArgumentDirection direction : values()) {
            if (direction.wireName.equalsIgnoreCase(name)) {
                return direction;
            }
        }
        return IN;
    }
}
