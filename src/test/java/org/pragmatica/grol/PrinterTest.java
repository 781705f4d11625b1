package org.pragmatica.grol;

import org.junit.jupiter.api.Test;
import org.pragmatica.grol.ast.Node;
import org.pragmatica.grol.ast.Node.Comment;
import org.pragmatica.grol.ast.Node.Identifier;
import org.pragmatica.grol.ast.Node.IfExpression;
import org.pragmatica.grol.ast.Node.InfixExpression;
import org.pragmatica.grol.ast.Node.IntegerLiteral;
import org.pragmatica.grol.ast.Node.MapLiteral;
import org.pragmatica.grol.ast.Node.Statements;
import org.pragmatica.grol.printer.PrintConfig;
import org.pragmatica.grol.token.SourceLocation;
import org.pragmatica.grol.token.Token;

import java.io.StringWriter;
import java.util.ArrayList;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.pragmatica.grol.ast.Node.MapLiteral.entry;
import static org.pragmatica.grol.token.TokenType.*;

class PrinterTest {

    private static Node program() {
        // x := 1 + 2 // three
        // if x > 2 { y = {b:2, a:1} }
        return Statements.of(
            InfixExpression.of(DEFINE, Identifier.of("x"),
                               InfixExpression.of(PLUS, IntegerLiteral.of(1), IntegerLiteral.of(2))),
            Comment.trailing("// three"),
            IfExpression.of(InfixExpression.of(GT, Identifier.of("x"), IntegerLiteral.of(2)),
                            Statements.of(InfixExpression.of(ASSIGN, Identifier.of("y"),
                                                             MapLiteral.of(entry(Identifier.of("b"), IntegerLiteral.of(2)),
                                                                           entry(Identifier.of("a"), IntegerLiteral.of(1)))))));
    }

    @Test
    void print_canonicalProfile() {
        assertThat(Printer.print(program())).isEqualTo("""
            x := 1 + 2 // three
            if x > 2 {
            \ty = {b:2, a:1}
            }
            """);
    }

    @Test
    void compact_dropsCommentsAndLayout() {
        assertThat(Printer.compact(program())).isEqualTo("x:=1+2 if x>2{y={b:2,a:1}}");
    }

    @Test
    void debugString_fullyParenthesizes() {
        assertThat(Printer.debugString(program())).isEqualTo("(x:=(1+2)) if (x>2){(y={b:2,a:1})}");
    }

    @Test
    void debugString_isIndependentOfSourcePositions() {
        var left = InfixExpression.of(PLUS, Identifier.of("a"), IntegerLiteral.of(1));
        var right = new InfixExpression(
            Token.at(PLUS, "+", SourceLocation.at(4, 2, 30)),
            Identifier.of("a"),
            Optional.of(IntegerLiteral.of(1)));

        assertThat(left).isNotEqualTo(right);
        assertThat(Printer.debugString(left)).isEqualTo(Printer.debugString(right));
    }

    @Test
    void print_intoWriter() {
        var writer = new StringWriter();

        Printer.print(program(), PrintConfig.COMPACT, writer);

        assertThat(writer.toString()).isEqualTo(Printer.compact(program()));
    }

    @Test
    void print_mapOrderIsStableAcrossCalls() {
        var map = MapLiteral.of(entry(Identifier.of("b"), IntegerLiteral.of(2)),
                                entry(Identifier.of("a"), IntegerLiteral.of(1)));

        for (int i = 0; i < 100; i++) {
            assertThat(Printer.print(map)).isEqualTo("{b:2, a:1}");
        }
    }

    @Test
    void print_concurrentCallsDoNotInterfere() throws InterruptedException, ExecutionException {
        var executor = Executors.newFixedThreadPool(8);
        try {
            var tasks = new ArrayList<Callable<String>>();
            for (int i = 0; i < 64; i++) {
                var config = i % 2 == 0 ? PrintConfig.DEFAULT : PrintConfig.DEBUG;
                tasks.add(() -> Printer.print(program(), config));
            }
            var futures = executor.invokeAll(tasks);
            for (int i = 0; i < futures.size(); i++) {
                Future<String> future = futures.get(i);
                var expected = i % 2 == 0 ? Printer.print(program()) : Printer.debugString(program());
                assertThat(future.get()).isEqualTo(expected);
            }
        } finally {
            executor.shutdown();
            executor.awaitTermination(10, TimeUnit.SECONDS);
        }
    }
}
