package com.vidnyan.pde.domain.tree;

/**
 * Declared visibility of a node, when the source language has one.
 */
public enum Visibility {
    PUBLIC,
    PROTECTED,
    PACKAGE,
    PRIVATE;

    public static Visibility parse(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return switch (value.trim().toUpperCase()) {
            case "PUBLIC", "EXPORTED" -> PUBLIC;
            case "PROTECTED" -> PROTECTED;
            case "PACKAGE", "DEFAULT", "INTERNAL" -> PACKAGE;
            case "PRIVATE" -> PRIVATE;
            default -> null;
        };
    }
}
