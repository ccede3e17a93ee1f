package com.vidnyan.wdllint.domain.model;

/**
 * A lint finding: where, which rule, and what.
 * Immutable value object.
 */
public record Diagnostic(
    SourcePosition position,
    String rule,
    String message
) {

    /**
     * Format for display, e.g. {@code wf.wdl:12:5 [UnusedDeclaration] nothing references Int x}.
     */
    public String format() {
        return position.format() + " [" + rule + "] " + message;
    }
}
