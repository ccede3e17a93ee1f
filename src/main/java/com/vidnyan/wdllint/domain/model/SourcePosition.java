package com.vidnyan.wdllint.domain.model;

/**
 * Source span of a node, as assigned by the parser. Lines and columns are 1-based.
 */
public record SourcePosition(
    String filename,
    int line,
    int column,
    int endLine,
    int endColumn
) {

    /**
     * Create a zero-width position.
     */
    public static SourcePosition at(String filename, int line, int column) {
        return new SourcePosition(filename, line, column, line, column);
    }

    /**
     * Format as readable string.
     */
    public String format() {
        return filename + ":" + line + ":" + column;
    }
}
