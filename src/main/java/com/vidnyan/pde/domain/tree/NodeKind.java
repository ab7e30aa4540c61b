package com.vidnyan.pde.domain.tree;

/**
 * Closed set of node kinds every parser adapter maps its own syntax onto.
 * The engine is written against these tags only, never against a concrete grammar.
 */
public enum NodeKind {
    COMPILATION_UNIT,
    TYPE_DECL,
    FIELD,
    PROCEDURE,
    CONSTRUCTOR,
    PARAMETER,
    BLOCK,
    IF,
    SWITCH,
    LOOP,
    RETURN,
    CALL,
    NEW,
    ASSIGN,
    IDENTIFIER,
    LITERAL,
    LAMBDA,
    TRY,
    THROW,
    PLACEHOLDER,
    OTHER;

    /**
     * Kinds whose nodes carry a meaningful name.
     */
    public boolean isNameBearing() {
        return switch (this) {
            case TYPE_DECL, FIELD, PROCEDURE, CONSTRUCTOR, PARAMETER,
                 CALL, NEW, IDENTIFIER, PLACEHOLDER -> true;
            default -> false;
        };
    }

    /**
     * Kinds that dispatch on a condition (if/switch equivalents).
     */
    public boolean isConditionalDispatch() {
        return this == IF || this == SWITCH;
    }

    /**
     * Lenient lookup used by adapters reading external documents.
     */
    public static NodeKind parse(String value) {
        if (value == null || value.isBlank()) {
            return OTHER;
        }
        String normalized = value.trim().toUpperCase().replace('-', '_').replace(' ', '_');
        for (NodeKind kind : values()) {
            if (kind.name().equals(normalized)) {
                return kind;
            }
        }
        return OTHER;
    }
}
