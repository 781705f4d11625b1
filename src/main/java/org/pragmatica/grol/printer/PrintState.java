package org.pragmatica.grol.printer;

import org.pragmatica.grol.ast.Node;
import org.pragmatica.grol.ast.Priority;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Optional;

/**
 * Mutable cursor of one print run: output sink, indentation, ambient precedence and the
 * lookback used for spacing decisions. Not shared between threads; create one per run.
 */
public final class PrintState {
    private final Appendable out;
    private final boolean compact;
    private final boolean allParens;

    private int indentLevel;
    private boolean indentationDone;
    private Priority ambient = Priority.LOWEST;
    private Node previous;
    private String last = "";

    private PrintState(Appendable out, PrintConfig config) {
        this.out = out;
        this.compact = config.compact();
        this.allParens = config.allParens();
    }

    public static PrintState create(PrintConfig config) {
        return new PrintState(new StringBuilder(), config);
    }

    public static PrintState create(Appendable out, PrintConfig config) {
        return new PrintState(out, config);
    }

    /**
     * Write fragments, preceded by the indentation tabs when this is the first output on the line.
     * Top-level blocks are not indented; compact mode never is.
     */
    public PrintState print(String... fragments) {
        if (fragments.length == 0) {
            return this;
        }
        if (!compact && !indentationDone && indentLevel > 1) {
            write("\t".repeat(indentLevel - 1));
            indentationDone = true;
        }
        for (var fragment : fragments) {
            write(fragment);
            last = fragment;
        }
        return this;
    }

    /**
     * {@link #print} then end the line; compact mode writes no newline.
     */
    public PrintState println(String... fragments) {
        print(fragments);
        if (!compact) {
            write("\n");
        }
        indentationDone = false;
        return this;
    }

    /**
     * Separator space between statements. Does not count as a fragment for lookback and keeps
     * the rest of the line unindented.
     */
    public PrintState space() {
        write(" ");
        indentationDone = true;
        return this;
    }

    public void indent() {
        indentLevel++;
    }

    public void outdent() {
        indentLevel--;
    }

    public int indentLevel() {
        return indentLevel;
    }

    public Priority ambient() {
        return ambient;
    }

    /**
     * Replace the ambient precedence, returning the one to restore afterwards.
     */
    public Priority enter(Priority priority) {
        var saved = ambient;
        ambient = priority;
        return saved;
    }

    public void restore(Priority saved) {
        ambient = saved;
    }

    public boolean compact() {
        return compact;
    }

    public boolean allParens() {
        return allParens;
    }

    public Optional<Node> previous() {
        return Optional.ofNullable(previous);
    }

    public void previous(Node node) {
        previous = node;
    }

    /**
     * Forget the lookback node; a block's first statement has no previous statement.
     */
    public void clearPrevious() {
        previous = null;
    }

    /**
     * Last fragment written through {@link #print}.
     */
    public String last() {
        return last;
    }

    /**
     * Text written so far, when the sink is a {@link StringBuilder} or another buffering {@link Appendable}.
     */
    public String output() {
        return out.toString();
    }

    @Override
    public String toString() {
        return output();
    }

    private void write(String text) {
        try {
            out.append(text);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write printer output", e);
        }
    }
}
