package org.pragmatica.grol.token;

/**
 * Where a token starts in the source: 1-based line and column, 0-based character offset.
 * Only carried for diagnostics; printing never looks at it.
 */
public record SourceLocation(int line, int column, int offset) {

    public static final SourceLocation START = new SourceLocation(1, 1, 0);

    public SourceLocation {
        if (line < 1 || column < 1 || offset < 0) {
            throw new IllegalArgumentException("Invalid source location " + line + ":" + column + " (offset " + offset + ")");
        }
    }

    public static SourceLocation at(int line, int column, int offset) {
        return new SourceLocation(line, column, offset);
    }

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
