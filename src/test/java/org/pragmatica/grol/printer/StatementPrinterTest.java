package org.pragmatica.grol.printer;

import org.junit.jupiter.api.Test;
import org.pragmatica.grol.ast.Node;
import org.pragmatica.grol.ast.Node.Builtin;
import org.pragmatica.grol.ast.Node.Comment;
import org.pragmatica.grol.ast.Node.ControlExpression;
import org.pragmatica.grol.ast.Node.ForExpression;
import org.pragmatica.grol.ast.Node.FunctionLiteral;
import org.pragmatica.grol.ast.Node.Identifier;
import org.pragmatica.grol.ast.Node.IfExpression;
import org.pragmatica.grol.ast.Node.InfixExpression;
import org.pragmatica.grol.ast.Node.IntegerLiteral;
import org.pragmatica.grol.ast.Node.MacroLiteral;
import org.pragmatica.grol.ast.Node.ReturnStatement;
import org.pragmatica.grol.ast.Node.Statements;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.pragmatica.grol.token.TokenType.*;

/**
 * Canonical rendering of blocks, control forms, functions and comments.
 */
class StatementPrinterTest {

    private static String canonical(Node node) {
        return AstPrinter.print(node, PrintState.create(PrintConfig.DEFAULT)).output();
    }

    private static Identifier id(String name) {
        return Identifier.of(name);
    }

    private static Node number(long value) {
        return IntegerLiteral.of(value);
    }

    // === Blocks ===

    @Test
    void rootStatements_areNewlineTerminatedWithoutBraces() {
        var program = Statements.of(InfixExpression.of(DEFINE, id("x"), number(1)), id("x"));

        assertThat(canonical(program)).isEqualTo("x := 1\nx\n");
    }

    @Test
    void emptyProgram_isSingleNewline() {
        assertThat(canonical(Statements.of())).isEqualTo("\n");
    }

    @Test
    void emptyNestedBlock_keepsBracesOnSeparateLines() {
        var program = Statements.of(IfExpression.of(id("c"), Statements.of()));

        assertThat(canonical(program)).isEqualTo("if c {\n}\n");
    }

    @Test
    void nestedBlocks_areTabIndented() {
        var program = Statements.of(
            ForExpression.of(id("c"), Statements.of(
                IfExpression.of(id("d"), Statements.of(id("x"))),
                id("y"))));

        assertThat(canonical(program)).isEqualTo("""
            for c {
            \tif d {
            \t\tx
            \t}
            \ty
            }
            """);
    }

    // === Control forms ===

    @Test
    void ifWithoutElse() {
        var program = Statements.of(IfExpression.of(InfixExpression.of(GT, id("x"), number(1)), Statements.of(id("y"))));

        assertThat(canonical(program)).isEqualTo("if x > 1 {\n\ty\n}\n");
    }

    @Test
    void ifWithElse() {
        var program = Statements.of(IfExpression.of(id("c"), Statements.of(id("a")), Statements.of(id("b"))));

        assertThat(canonical(program)).isEqualTo("if c {\n\ta\n} else {\n\tb\n}\n");
    }

    @Test
    void elseIfChain_isCollapsedAtEveryLevel() {
        var innermost = IfExpression.of(id("c3"), Statements.of(id("x")), Statements.of(id("y")));
        var middle = IfExpression.of(id("c2"), Statements.of(id("b")), Statements.of(innermost));
        var program = Statements.of(IfExpression.of(id("c1"), Statements.of(id("a")), Statements.of(middle)));

        assertThat(canonical(program)).isEqualTo("""
            if c1 {
            \ta
            } else if c2 {
            \tb
            } else if c3 {
            \tx
            } else {
            \ty
            }
            """);
    }

    @Test
    void elseBlockWithMoreThanTheIf_isNotCollapsed() {
        var nested = IfExpression.of(id("c2"), Statements.of(id("b")));
        var program = Statements.of(IfExpression.of(id("c1"), Statements.of(id("a")), Statements.of(nested, id("d"))));

        assertThat(canonical(program)).isEqualTo("""
            if c1 {
            \ta
            } else {
            \tif c2 {
            \t\tb
            \t}
            \td
            }
            """);
    }

    @Test
    void forLoop_withControlStatements() {
        var body = Statements.of(
            IfExpression.of(InfixExpression.of(EQ, id("i"), number(3)), Statements.of(ControlExpression.of(CONTINUE))),
            InfixExpression.of(ASSIGN, id("i"), InfixExpression.of(PLUS, id("i"), number(1))),
            ControlExpression.of(BREAK));
        var program = Statements.of(ForExpression.of(InfixExpression.of(LT, id("i"), number(10)), body));

        assertThat(canonical(program)).isEqualTo("""
            for i < 10 {
            \tif i == 3 {
            \t\tcontinue
            \t}
            \ti = i + 1
            \tbreak
            }
            """);
    }

    @Test
    void returnStatement_withAndWithoutValue() {
        var program = Statements.of(ReturnStatement.of(InfixExpression.of(PLUS, id("a"), number(1))), ReturnStatement.empty());

        assertThat(canonical(program)).isEqualTo("return a + 1\nreturn\n");
    }

    // === Functions ===

    @Test
    void namedFunction() {
        var add = FunctionLiteral.named("add", List.of(id("a"), id("b")),
                                        Statements.of(ReturnStatement.of(InfixExpression.of(PLUS, id("a"), id("b")))));

        assertThat(canonical(Statements.of(add))).isEqualTo("func add(a, b) {\n\treturn a + b\n}\n");
    }

    @Test
    void anonymousFunction_assigned() {
        var function = FunctionLiteral.anonymous(List.of(id("a")), Statements.of(id("a")));
        var program = Statements.of(InfixExpression.of(ASSIGN, id("f"), function));

        assertThat(canonical(program)).isEqualTo("f = func(a) {\n\ta\n}\n");
    }

    @Test
    void variadicFunction_keepsMarker() {
        var function = FunctionLiteral.named("f", List.of(id("a"), id("..")), Statements.of(id("a")));

        assertThat(canonical(Statements.of(function))).isEqualTo("func f(a, ..) {\n\ta\n}\n");
    }

    @Test
    void lambda_singleParameterHasNoParens() {
        var lambda = FunctionLiteral.lambda(List.of(id("x")), Statements.of(InfixExpression.of(ASTERISK, id("x"), number(2))));

        assertThat(canonical(Statements.of(lambda))).isEqualTo("x => {\n\tx * 2\n}\n");
    }

    @Test
    void lambda_otherArities_areParenthesized() {
        var none = FunctionLiteral.lambda(List.of(), Statements.of(number(1)));
        var two = FunctionLiteral.lambda(List.of(id("a"), id("b")), Statements.of(InfixExpression.of(PLUS, id("a"), id("b"))));

        assertThat(canonical(Statements.of(none))).isEqualTo("() => {\n\t1\n}\n");
        assertThat(canonical(Statements.of(two))).isEqualTo("(a, b) => {\n\ta + b\n}\n");
    }

    @Test
    void macro() {
        var macro = MacroLiteral.of(List.of(id("x")), Statements.of(Builtin.of(QUOTE, id("x"))));

        assertThat(canonical(Statements.of(macro))).isEqualTo("macro(x) {\n\tquote(x)\n}\n");
    }

    // === Comments ===

    @Test
    void trailingComment_staysOnStatementLine() {
        var program = Statements.of(id("x"), Comment.trailing("// note"), id("y"));

        assertThat(canonical(program)).isEqualTo("x // note\ny\n");
    }

    @Test
    void leadingComment_sharesLineWithNextStatement() {
        var program = Statements.of(Comment.leading("/* why */"), id("x"));

        assertThat(canonical(program)).isEqualTo("/* why */ x\n");
    }

    @Test
    void ownLineComment_getsItsOwnLine() {
        var program = Statements.of(id("x"), Comment.line("// next"), id("y"));

        assertThat(canonical(program)).isEqualTo("x\n// next\ny\n");
    }

    @Test
    void commentAfterOpeningBrace_sharesTheBraceLine() {
        var program = Statements.of(IfExpression.of(id("c"), Statements.of(Comment.trailing("// why"), id("a"))));

        assertThat(canonical(program)).isEqualTo("if c { // why\n\ta\n}\n");
    }

    @Test
    void leadingCommentBeforeBlock_doesNotPullFirstInnerStatementOntoBraceLine() {
        var program = Statements.of(Comment.leading("/* c */"), IfExpression.of(id("c"), Statements.of(id("a"))));

        assertThat(canonical(program)).isEqualTo("/* c */ if c {\n\ta\n}\n");
    }
}
