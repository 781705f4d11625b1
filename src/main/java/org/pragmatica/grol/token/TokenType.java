package org.pragmatica.grol.token;

/**
 * Lexical categories of the language. Types with fixed text carry it, the others
 * (identifiers, literals, comments) take their text from the token literal.
 */
public enum TokenType {
    // Variable text
    IDENT(null),
    INT(null),
    FLOAT(null),
    STRING(null),
    LINECOMMENT(null),
    BLOCKCOMMENT(null),

    // Assignment
    DEFINE(":="),
    ASSIGN("="),

    // Logical
    OR("||"),
    AND("&&"),
    BANG("!"),

    // Comparison
    EQ("=="),
    NOTEQ("!="),
    LT("<"),
    GT(">"),
    LTEQ("<="),
    GTEQ(">="),

    // Arithmetic and bitwise
    PLUS("+"),
    MINUS("-"),
    ASTERISK("*"),
    SLASH("/"),
    PERCENT("%"),
    BITOR("|"),
    BITXOR("^"),
    BITAND("&"),
    BITNOT("~"),
    LEFTSHIFT("<<"),
    RIGHTSHIFT(">>"),
    INCR("++"),
    DECR("--"),

    // Structure
    LAMBDA("=>"),
    COLON(":"),
    DOT("."),
    DOTDOT(".."),
    COMMA(","),
    LPAREN("("),
    RPAREN(")"),
    LBRACKET("["),
    RBRACKET("]"),
    LBRACE("{"),
    RBRACE("}"),

    // Keywords
    FUNC("func"),
    MACRO("macro"),
    TRUE("true"),
    FALSE("false"),
    IF("if"),
    ELSE("else"),
    FOR("for"),
    RETURN("return"),
    BREAK("break"),
    CONTINUE("continue"),

    // Builtins
    LEN("len"),
    FIRST("first"),
    REST("rest"),
    PRINT("print"),
    PRINTLN("println"),
    LOG("log"),
    ERROR("error"),
    QUOTE("quote"),
    UNQUOTE("unquote");

    private final String text;

    TokenType(String text) {
        this.text = text;
    }

    public boolean hasFixedText() {
        return text != null;
    }

    /**
     * Canonical text, or {@code null} for variable-text types.
     */
    public String text() {
        return text;
    }
}
