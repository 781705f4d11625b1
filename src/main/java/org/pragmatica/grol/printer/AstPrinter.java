package org.pragmatica.grol.printer;

import org.pragmatica.grol.ast.Node;
import org.pragmatica.grol.ast.Node.ArrayLiteral;
import org.pragmatica.grol.ast.Node.BooleanLiteral;
import org.pragmatica.grol.ast.Node.Builtin;
import org.pragmatica.grol.ast.Node.CallExpression;
import org.pragmatica.grol.ast.Node.Comment;
import org.pragmatica.grol.ast.Node.ControlExpression;
import org.pragmatica.grol.ast.Node.FloatLiteral;
import org.pragmatica.grol.ast.Node.ForExpression;
import org.pragmatica.grol.ast.Node.FunctionLiteral;
import org.pragmatica.grol.ast.Node.Identifier;
import org.pragmatica.grol.ast.Node.IfExpression;
import org.pragmatica.grol.ast.Node.IndexExpression;
import org.pragmatica.grol.ast.Node.InfixExpression;
import org.pragmatica.grol.ast.Node.IntegerLiteral;
import org.pragmatica.grol.ast.Node.MacroLiteral;
import org.pragmatica.grol.ast.Node.MapLiteral;
import org.pragmatica.grol.ast.Node.PostfixExpression;
import org.pragmatica.grol.ast.Node.PrefixExpression;
import org.pragmatica.grol.ast.Node.ReturnStatement;
import org.pragmatica.grol.ast.Node.Statements;
import org.pragmatica.grol.ast.Node.StringLiteral;
import org.pragmatica.grol.ast.NodeVisitor;
import org.pragmatica.grol.ast.Precedence;
import org.pragmatica.grol.ast.Priority;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Regenerates source text from a syntax tree into a {@link PrintState}.
 *
 * <p>Operator nodes compare their own priority with the ambient one to decide on parentheses,
 * print their operands with their own priority as ambient, and restore the caller's on return.
 * Blocks reset the ambient priority to {@link Priority#LOWEST}.
 */
public final class AstPrinter implements NodeVisitor<PrintState> {
    private static final Logger log = LoggerFactory.getLogger(AstPrinter.class);

    private final PrintState out;

    private AstPrinter(PrintState out) {
        this.out = out;
    }

    public static PrintState print(Node node, PrintState out) {
        return node.accept(new AstPrinter(out));
    }

    // === Blocks ===

    @Override
    public PrintState visitStatements(Statements block) {
        var saved = out.ambient();
        if (out.indentLevel() > 0) {
            // emitted before the first statement so a leading comment can share the line
            out.print("{");
        }
        out.indent();
        out.clearPrevious();
        int index = 0;
        for (var statement : block.statements()) {
            if (out.compact()) {
                if (statement instanceof Comment) {
                    continue;
                }
                compactSeparator(statement, index);
            } else {
                canonicalSeparator(statement, index);
            }
            out.enter(Priority.LOWEST);
            statement.accept(this);
            out.previous(statement);
            index++;
        }
        out.println();
        out.outdent();
        out.restore(saved);
        if (out.indentLevel() > 0) {
            out.print("}");
        }
        return out;
    }

    private void compactSeparator(Node statement, int index) {
        if (index == 0) {
            return;
        }
        var previous = out.previous().orElse(null);
        var afterInfix = previous instanceof InfixExpression
                         && !"}".equals(out.last())
                         && !"]".equals(out.last());
        if (statement instanceof ArrayLiteral || afterInfix) {
            out.space();
            return;
        }
        if (isIdentifierLike(statement) && isIdentifierLike(previous)) {
            out.space();
        }
    }

    private static boolean isIdentifierLike(Node node) {
        return node instanceof Identifier || node instanceof Builtin || node instanceof CallExpression;
    }

    private void canonicalSeparator(Node statement, int index) {
        if (index == 0 && out.indentLevel() <= 1) {
            return;
        }
        var previous = out.previous().orElse(null);
        if (keepsSameLineAsPrevious(statement) || !needsNewLineAfter(previous)) {
            log.debug("Separating {} from previous statement with a space", statement.token());
            out.space();
        } else {
            log.debug("Separating {} from previous statement with a newline", statement.token());
            out.println();
        }
    }

    private static boolean keepsSameLineAsPrevious(Node node) {
        return node instanceof Comment comment && comment.sameLineAsPrevious();
    }

    private static boolean needsNewLineAfter(Node node) {
        return !(node instanceof Comment comment) || !comment.sameLineAsNext();
    }

    // === Leaf terminals ===

    @Override
    public PrintState visitIdentifier(Identifier node) {
        return out.print(node.literal());
    }

    @Override
    public PrintState visitIntegerLiteral(IntegerLiteral node) {
        return out.print(node.literal());
    }

    @Override
    public PrintState visitFloatLiteral(FloatLiteral node) {
        return out.print(node.literal());
    }

    @Override
    public PrintState visitStringLiteral(StringLiteral node) {
        return out.print(Quoting.quote(node.value()));
    }

    @Override
    public PrintState visitBooleanLiteral(BooleanLiteral node) {
        return out.print(node.literal());
    }

    @Override
    public PrintState visitComment(Comment node) {
        return out.print(node.literal());
    }

    @Override
    public PrintState visitControlExpression(ControlExpression node) {
        return out.print(node.literal());
    }

    @Override
    public PrintState visitReturnStatement(ReturnStatement node) {
        out.print(node.literal());
        node.value()
            .ifPresent(value -> {
                out.print(" ");
                value.accept(this);
            });
        return out;
    }

    // === Operators ===

    @Override
    public PrintState visitPrefixExpression(PrefixExpression node) {
        var saved = out.enter(Priority.PREFIX);
        // equal priority too: -(-a) must not become --a
        var parens = out.allParens() || Priority.PREFIX.isAtMost(saved);
        open(parens);
        out.print(node.literal());
        node.operand().accept(this);
        close(parens);
        out.restore(saved);
        return out;
    }

    @Override
    public PrintState visitPostfixExpression(PostfixExpression node) {
        var own = Precedence.of(node.token());
        var saved = out.enter(own);
        var parens = out.allParens() || own.isLowerThan(saved);
        open(parens);
        out.print(node.previous().literal());
        out.print(node.literal());
        close(parens);
        out.restore(saved);
        return out;
    }

    @Override
    public PrintState visitInfixExpression(InfixExpression node) {
        var own = Precedence.of(node.token());
        var saved = out.enter(own);
        var parens = out.allParens() || own.isLowerThan(saved);
        open(parens);
        node.left().accept(this);
        node.right()
            .ifPresentOrElse(right -> {
                                 if (out.compact()) {
                                     out.print(node.literal());
                                 } else {
                                     out.print(" ", node.literal(), " ");
                                 }
                                 right.accept(this);
                             },
                             () -> out.print(node.literal()));
        close(parens);
        out.restore(saved);
        return out;
    }

    // === Access ===

    @Override
    public PrintState visitIndexExpression(IndexExpression node) {
        var own = Precedence.of(node.token());
        var saved = out.enter(own);
        var parens = out.allParens() || own.isLowerThan(saved);
        open(parens);
        node.collection().accept(this);
        out.print(node.literal());
        out.enter(Priority.LOWEST);
        node.index().accept(this);
        if (node.isBracket()) {
            out.print("]");
        }
        close(parens);
        out.restore(saved);
        return out;
    }

    @Override
    public PrintState visitCallExpression(CallExpression node) {
        var saved = out.enter(Priority.CALL);
        node.function().accept(this);
        out.print("(");
        out.enter(Priority.LOWEST);
        commaList(node.arguments());
        out.restore(saved);
        return out.print(")");
    }

    @Override
    public PrintState visitBuiltin(Builtin node) {
        out.print(node.literal());
        out.print("(");
        var saved = out.enter(Priority.LOWEST);
        commaList(node.arguments());
        out.restore(saved);
        return out.print(")");
    }

    // === Collections ===

    @Override
    public PrintState visitArrayLiteral(ArrayLiteral node) {
        out.print("[");
        var saved = out.enter(Priority.LOWEST);
        commaList(node.elements());
        out.restore(saved);
        return out.print("]");
    }

    @Override
    public PrintState visitMapLiteral(MapLiteral node) {
        out.print("{");
        var saved = out.enter(Priority.LOWEST);
        var separator = out.compact() ? "," : ", ";
        var first = true;
        for (var entry : node.entries()) {
            if (!first) {
                out.print(separator);
            }
            first = false;
            entry.key().accept(this);
            out.print(":");
            entry.value().accept(this);
        }
        out.restore(saved);
        return out.print("}");
    }

    // === Control forms ===

    @Override
    public PrintState visitIfExpression(IfExpression node) {
        out.print("if ");
        node.condition().accept(this);
        if (!out.compact()) {
            out.print(" ");
        }
        node.consequence().accept(this);
        node.alternative()
            .ifPresent(alternative -> printElse(node, alternative));
        return out;
    }

    private void printElse(IfExpression node, Statements alternative) {
        out.print(out.compact() ? "else" : " else ");
        node.elseIf()
            .ifPresentOrElse(nested -> {
                                 if (out.compact()) {
                                     out.print(" ");
                                 }
                                 nested.accept(this);
                             },
                             () -> alternative.accept(this));
    }

    @Override
    public PrintState visitForExpression(ForExpression node) {
        out.print("for ");
        node.condition().accept(this);
        if (!out.compact()) {
            out.print(" ");
        }
        return node.body().accept(this);
    }

    // === Functions ===

    @Override
    public PrintState visitFunctionLiteral(FunctionLiteral node) {
        if (node.lambda()) {
            return printLambda(node);
        }
        out.print(node.literal());
        node.name()
            .ifPresent(name -> {
                out.print(" ");
                out.print(name.literal());
            });
        printParameters(node.parameters());
        return node.body().accept(this);
    }

    private PrintState printLambda(FunctionLiteral node) {
        var parens = node.parameters().size() != 1;
        if (parens) {
            out.print("(");
        }
        commaList(node.parameters());
        if (parens) {
            out.print(")");
        }
        out.print(out.compact() ? "=>" : " => ");
        return node.body().accept(this);
    }

    @Override
    public PrintState visitMacroLiteral(MacroLiteral node) {
        out.print(node.literal());
        printParameters(node.parameters());
        return node.body().accept(this);
    }

    private void printParameters(List<Node> parameters) {
        out.print("(");
        commaList(parameters);
        out.print(out.compact() ? ")" : ") ");
    }

    // === Helpers ===

    private void commaList(List<Node> nodes) {
        var separator = out.compact() ? "," : ", ";
        for (int i = 0; i < nodes.size(); i++) {
            if (i > 0) {
                out.print(separator);
            }
            nodes.get(i).accept(this);
        }
    }

    private void open(boolean parens) {
        if (parens) {
            out.print("(");
        }
    }

    private void close(boolean parens) {
        if (parens) {
            out.print(")");
        }
    }
}
