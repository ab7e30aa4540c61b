package com.vidnyan.pde.domain.pattern;

/**
 * Family a design idiom belongs to.
 */
public enum PatternCategory {
    CREATIONAL,
    STRUCTURAL,
    BEHAVIORAL,
    FUNCTIONAL,
    CUSTOM;

    public static PatternCategory parse(String value) {
        if (value == null) return CUSTOM;
        return switch (value.trim().toUpperCase()) {
            case "CREATIONAL" -> CREATIONAL;
            case "STRUCTURAL" -> STRUCTURAL;
            case "BEHAVIORAL", "BEHAVIOURAL" -> BEHAVIORAL;
            case "FUNCTIONAL" -> FUNCTIONAL;
            default -> CUSTOM;
        };
    }
}
