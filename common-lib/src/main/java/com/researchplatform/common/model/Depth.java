package com.researchplatform.common.model;

/**
 * Quality tier shared by search depth and extraction depth. {@link #ADVANCED}
 * yields richer content and costs more credits.
 */
public enum Depth {
    BASIC("basic"),
    ADVANCED("advanced");

    private final String wireValue;

    Depth(String wireValue) {
        this.wireValue = wireValue;
    }

    public String wireValue() {
        return wireValue;
    }

    public static Depth orBasic(Depth depth) {
        return depth != null ? depth : BASIC;
    }
}
