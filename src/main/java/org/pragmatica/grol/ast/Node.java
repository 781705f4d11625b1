package org.pragmatica.grol.ast;

import org.pragmatica.grol.error.PrintError;
import org.pragmatica.grol.error.PrintException;
import org.pragmatica.grol.token.Token;
import org.pragmatica.grol.token.TokenType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Syntax tree node. Every node carries exactly one token, used for its literal text and position.
 * Nodes are immutable and own their children.
 */
public sealed interface Node {
    /**
     * The token this node was built from.
     */
    Token token();

    <R> R accept(NodeVisitor<R> visitor);

    default String literal() {
        return token().literal();
    }

    // === Leaf terminals ===

    record Identifier(Token token) implements Node {
        public Identifier {
            Objects.requireNonNull(token, "token");
        }

        public static Identifier of(String name) {
            return new Identifier(Token.of(TokenType.IDENT, name));
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitIdentifier(this);
        }
    }

    record IntegerLiteral(Token token, long value) implements Node {
        public IntegerLiteral {
            Objects.requireNonNull(token, "token");
        }

        public static IntegerLiteral of(long value) {
            return new IntegerLiteral(Token.of(TokenType.INT, Long.toString(value)), value);
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitIntegerLiteral(this);
        }
    }

    /**
     * Prints the source text of the literal, not a reformatted {@code value}.
     */
    record FloatLiteral(Token token, double value) implements Node {
        public FloatLiteral {
            Objects.requireNonNull(token, "token");
        }

        public static FloatLiteral of(String text) {
            return new FloatLiteral(Token.of(TokenType.FLOAT, text), Double.parseDouble(text));
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitFloatLiteral(this);
        }
    }

    /**
     * String literal; the token literal holds the unquoted value.
     */
    record StringLiteral(Token token) implements Node {
        public StringLiteral {
            Objects.requireNonNull(token, "token");
        }

        public static StringLiteral of(String value) {
            return new StringLiteral(Token.of(TokenType.STRING, value));
        }

        public String value() {
            return token.literal();
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitStringLiteral(this);
        }
    }

    record BooleanLiteral(Token token, boolean value) implements Node {
        public BooleanLiteral {
            Objects.requireNonNull(token, "token");
        }

        public static BooleanLiteral of(boolean value) {
            return new BooleanLiteral(Token.of(value ? TokenType.TRUE : TokenType.FALSE), value);
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitBooleanLiteral(this);
        }
    }

    /**
     * Comment with its placement relative to the neighbouring statements.
     * The literal includes the comment markers.
     */
    record Comment(Token token, boolean sameLineAsPrevious, boolean sameLineAsNext) implements Node {
        public Comment {
            Objects.requireNonNull(token, "token");
        }

        public static Comment line(String text) {
            return new Comment(Token.of(TokenType.LINECOMMENT, text), false, false);
        }

        public static Comment trailing(String text) {
            return new Comment(Token.of(TokenType.LINECOMMENT, text), true, false);
        }

        public static Comment leading(String text) {
            return new Comment(Token.of(TokenType.BLOCKCOMMENT, text), false, true);
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitComment(this);
        }
    }

    /**
     * {@code break} or {@code continue}.
     */
    record ControlExpression(Token token) implements Node {
        public ControlExpression {
            Objects.requireNonNull(token, "token");
        }

        public static ControlExpression of(TokenType type) {
            return new ControlExpression(Token.of(type));
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitControlExpression(this);
        }
    }

    record ReturnStatement(Token token, Optional<Node> value) implements Node {
        public ReturnStatement {
            Objects.requireNonNull(token, "token");
            Objects.requireNonNull(value, "value");
        }

        public static ReturnStatement of(Node value) {
            return new ReturnStatement(Token.of(TokenType.RETURN), Optional.of(value));
        }

        public static ReturnStatement empty() {
            return new ReturnStatement(Token.of(TokenType.RETURN), Optional.empty());
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitReturnStatement(this);
        }
    }

    // === Operators ===

    record PrefixExpression(Token token, Node operand) implements Node {
        public PrefixExpression {
            Objects.requireNonNull(token, "token");
            Objects.requireNonNull(operand, "operand");
        }

        public static PrefixExpression of(TokenType operator, Node operand) {
            return new PrefixExpression(Token.of(operator), operand);
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitPrefixExpression(this);
        }
    }

    /**
     * {@code x++} or {@code x--}; {@code previous} is the token the operator applies to.
     */
    record PostfixExpression(Token token, Token previous) implements Node {
        public PostfixExpression {
            Objects.requireNonNull(token, "token");
            Objects.requireNonNull(previous, "previous");
        }

        public static PostfixExpression of(TokenType operator, Token previous) {
            return new PostfixExpression(Token.of(operator), previous);
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitPostfixExpression(this);
        }
    }

    /**
     * Binary operator. The right operand is absent only for one-sided slices such as {@code a[2:]}.
     */
    record InfixExpression(Token token, Node left, Optional<Node> right) implements Node {
        public InfixExpression {
            Objects.requireNonNull(token, "token");
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(right, "right");
        }

        public static InfixExpression of(TokenType operator, Node left, Node right) {
            return new InfixExpression(Token.of(operator), left, Optional.of(right));
        }

        public static InfixExpression leftOnly(TokenType operator, Node left) {
            return new InfixExpression(Token.of(operator), left, Optional.empty());
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitInfixExpression(this);
        }
    }

    // === Access ===

    /**
     * {@code a[i]} when the token is {@code [}, {@code m.key} when it is {@code .}.
     */
    record IndexExpression(Token token, Node collection, Node index) implements Node {
        public IndexExpression {
            Objects.requireNonNull(token, "token");
            Objects.requireNonNull(collection, "collection");
            Objects.requireNonNull(index, "index");
        }

        public static IndexExpression bracket(Node collection, Node index) {
            return new IndexExpression(Token.of(TokenType.LBRACKET), collection, index);
        }

        public static IndexExpression dot(Node collection, Node index) {
            return new IndexExpression(Token.of(TokenType.DOT), collection, index);
        }

        public boolean isBracket() {
            return token.type() == TokenType.LBRACKET;
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitIndexExpression(this);
        }
    }

    record CallExpression(Token token, Node function, List<Node> arguments) implements Node {
        public CallExpression {
            Objects.requireNonNull(token, "token");
            Objects.requireNonNull(function, "function");
            arguments = List.copyOf(arguments);
        }

        public static CallExpression of(Node function, Node... arguments) {
            return new CallExpression(Token.of(TokenType.LPAREN), function, List.of(arguments));
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitCallExpression(this);
        }
    }

    /**
     * Call of a reserved builtin such as {@code len}; the token is the builtin name.
     */
    record Builtin(Token token, List<Node> arguments) implements Node {
        public Builtin {
            Objects.requireNonNull(token, "token");
            arguments = List.copyOf(arguments);
        }

        public static Builtin of(TokenType name, Node... arguments) {
            return new Builtin(Token.of(name), List.of(arguments));
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitBuiltin(this);
        }
    }

    // === Collections ===

    record ArrayLiteral(Token token, List<Node> elements) implements Node {
        public ArrayLiteral {
            Objects.requireNonNull(token, "token");
            elements = List.copyOf(elements);
        }

        public static ArrayLiteral of(Node... elements) {
            return new ArrayLiteral(Token.of(TokenType.LBRACKET), List.of(elements));
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitArrayLiteral(this);
        }
    }

    /**
     * Map literal as an ordered list of entries, in source order.
     */
    record MapLiteral(Token token, List<Entry> entries) implements Node {
        private static final Logger log = LoggerFactory.getLogger(MapLiteral.class);

        public MapLiteral {
            Objects.requireNonNull(token, "token");
            entries = List.copyOf(entries);
        }

        public record Entry(Node key, Node value) {
            public Entry {
                Objects.requireNonNull(key, "key");
                Objects.requireNonNull(value, "value");
            }
        }

        public static Entry entry(Node key, Node value) {
            return new Entry(key, value);
        }

        public static MapLiteral of(Entry... entries) {
            return new MapLiteral(Token.of(TokenType.LBRACE), List.of(entries));
        }

        /**
         * Build from a key/value mapping plus the order the keys appeared in.
         *
         * @throws org.pragmatica.grol.error.PrintException if {@code order} is not a permutation of the mapping keys
         */
        public static MapLiteral fromMapping(Token token, Map<Node, Node> pairs, List<Node> order) {
            var seen = new HashSet<Node>();
            var entries = new ArrayList<Entry>(order.size());
            for (var key : order) {
                if (!seen.add(key)) {
                    throw inconsistent("key " + key.literal() + " listed twice in order");
                }
                var value = pairs.get(key);
                if (value == null) {
                    throw inconsistent("key " + key.literal() + " has no value");
                }
                entries.add(new Entry(key, value));
            }
            if (seen.size() != pairs.size()) {
                throw inconsistent((pairs.size() - seen.size()) + " key(s) missing from order");
            }
            return new MapLiteral(token, entries);
        }

        private static PrintException inconsistent(String reason) {
            var error = new PrintError.InconsistentMap(reason);
            log.debug(error.message());
            return error.exception();
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitMapLiteral(this);
        }
    }

    // === Control forms ===

    record IfExpression(Token token, Node condition, Statements consequence, Optional<Statements> alternative)
        implements Node {
        public IfExpression {
            Objects.requireNonNull(token, "token");
            Objects.requireNonNull(condition, "condition");
            Objects.requireNonNull(consequence, "consequence");
            Objects.requireNonNull(alternative, "alternative");
        }

        public static IfExpression of(Node condition, Statements consequence) {
            return new IfExpression(Token.of(TokenType.IF), condition, consequence, Optional.empty());
        }

        public static IfExpression of(Node condition, Statements consequence, Statements alternative) {
            return new IfExpression(Token.of(TokenType.IF), condition, consequence, Optional.of(alternative));
        }

        /**
         * The nested if when the alternative is exactly one if expression, printed as {@code else if}.
         */
        public Optional<IfExpression> elseIf() {
            return alternative.filter(block -> block.statements().size() == 1)
                              .map(block -> block.statements().get(0))
                              .filter(IfExpression.class::isInstance)
                              .map(IfExpression.class::cast);
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitIfExpression(this);
        }
    }

    record ForExpression(Token token, Node condition, Statements body) implements Node {
        public ForExpression {
            Objects.requireNonNull(token, "token");
            Objects.requireNonNull(condition, "condition");
            Objects.requireNonNull(body, "body");
        }

        public static ForExpression of(Node condition, Statements body) {
            return new ForExpression(Token.of(TokenType.FOR), condition, body);
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitForExpression(this);
        }
    }

    // === Functions ===

    /**
     * Function in keyword form ({@code func name(a, b) {...}}) or lambda form ({@code (a, b) => {...}}).
     * The last parameter may be the {@code ..} variadic marker.
     */
    record FunctionLiteral(Token token,
                           Optional<Identifier> name,
                           List<Node> parameters,
                           Statements body,
                           boolean variadic,
                           boolean lambda) implements Node {
        public FunctionLiteral {
            Objects.requireNonNull(token, "token");
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(body, "body");
            parameters = List.copyOf(parameters);
        }

        public static FunctionLiteral named(String name, List<Node> parameters, Statements body) {
            return new FunctionLiteral(Token.of(TokenType.FUNC), Optional.of(Identifier.of(name)), parameters, body,
                                       isVariadic(parameters), false);
        }

        public static FunctionLiteral anonymous(List<Node> parameters, Statements body) {
            return new FunctionLiteral(Token.of(TokenType.FUNC), Optional.empty(), parameters, body,
                                       isVariadic(parameters), false);
        }

        public static FunctionLiteral lambda(List<Node> parameters, Statements body) {
            return new FunctionLiteral(Token.of(TokenType.LAMBDA), Optional.empty(), parameters, body,
                                       isVariadic(parameters), true);
        }

        private static boolean isVariadic(List<Node> parameters) {
            return !parameters.isEmpty()
                   && parameters.get(parameters.size() - 1).literal().equals(TokenType.DOTDOT.text());
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitFunctionLiteral(this);
        }
    }

    record MacroLiteral(Token token, List<Node> parameters, Statements body) implements Node {
        public MacroLiteral {
            Objects.requireNonNull(token, "token");
            Objects.requireNonNull(body, "body");
            parameters = List.copyOf(parameters);
        }

        public static MacroLiteral of(List<Node> parameters, Statements body) {
            return new MacroLiteral(Token.of(TokenType.MACRO), parameters, body);
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitMacroLiteral(this);
        }
    }

    // === Blocks ===

    /**
     * Ordered statement sequence: the program root, or the body of if/for/function forms.
     */
    record Statements(Token token, List<Node> statements) implements Node {
        public Statements {
            Objects.requireNonNull(token, "token");
            statements = List.copyOf(statements);
        }

        public static Statements of(Node... statements) {
            return new Statements(Token.of(TokenType.LBRACE), List.of(statements));
        }

        public static Statements of(List<Node> statements) {
            return new Statements(Token.of(TokenType.LBRACE), statements);
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitStatements(this);
        }
    }
}
