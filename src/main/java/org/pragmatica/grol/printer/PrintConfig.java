package org.pragmatica.grol.printer;

/**
 * Printer output profile.
 *
 * @param compact   single line, no comments, minimal separators
 * @param allParens parenthesize every operator expression
 */
public record PrintConfig(
    boolean compact,
    boolean allParens
) {
    /**
     * Canonical multi-line, tab-indented output with minimal parentheses.
     */
    public static final PrintConfig DEFAULT = new PrintConfig(false, false);

    public static final PrintConfig COMPACT = new PrintConfig(true, false);

    /**
     * Compact and fully parenthesized: an unambiguous structural fingerprint of a tree.
     */
    public static final PrintConfig DEBUG = new PrintConfig(true, true);

    public PrintConfig withAllParens(boolean allParens) {
        return new PrintConfig(compact, allParens);
    }
}
