package org.pragmatica.grol;

import org.pragmatica.grol.ast.Node;
import org.pragmatica.grol.printer.AstPrinter;
import org.pragmatica.grol.printer.PrintConfig;
import org.pragmatica.grol.printer.PrintState;

/**
 * Entry point for turning syntax trees back into source text.
 *
 * <p>Example usage:
 * <pre>{@code
 * var program = Statements.of(
 *     InfixExpression.of(TokenType.DEFINE, Identifier.of("x"),
 *                        InfixExpression.of(TokenType.PLUS, IntegerLiteral.of(1), IntegerLiteral.of(2))));
 *
 * Printer.print(program);       // "x := 1 + 2\n"
 * Printer.compact(program);     // "x:=1+2"
 * Printer.debugString(program); // "(x:=(1+2))"
 * }</pre>
 *
 * <p>Every call uses its own {@link PrintState}, so printing is safe from any number of threads.
 */
public final class Printer {
    private Printer() {}

    /**
     * Canonical multi-line rendering.
     */
    public static String print(Node node) {
        return print(node, PrintConfig.DEFAULT);
    }

    public static String print(Node node, PrintConfig config) {
        return AstPrinter.print(node, PrintState.create(config))
                         .output();
    }

    /**
     * Render into a caller-supplied sink.
     *
     * @throws java.io.UncheckedIOException if the sink fails
     */
    public static void print(Node node, PrintConfig config, Appendable out) {
        AstPrinter.print(node, PrintState.create(out, config));
    }

    /**
     * Single-line rendering without comments.
     */
    public static String compact(Node node) {
        return print(node, PrintConfig.COMPACT);
    }

    /**
     * Compact, fully parenthesized rendering. Two trees with the same structure give the same string.
     */
    public static String debugString(Node node) {
        return print(node, PrintConfig.DEBUG);
    }
}
