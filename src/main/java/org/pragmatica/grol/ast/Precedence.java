package org.pragmatica.grol.ast;

import org.pragmatica.grol.error.PrintError;
import org.pragmatica.grol.error.PrintException;
import org.pragmatica.grol.token.Token;
import org.pragmatica.grol.token.TokenType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Static precedence table. The switch is exhaustive over {@link TokenType}, so adding a token
 * type without deciding whether it is an operator does not compile.
 */
public final class Precedence {
    private static final Logger log = LoggerFactory.getLogger(Precedence.class);

    private Precedence() {}

    /**
     * Priority of an operator token.
     *
     * @throws org.pragmatica.grol.error.PrintException if the token type is not an operator
     */
    public static Priority of(Token token) {
        return switch (token.type()) {
            case DEFINE, ASSIGN -> Priority.ASSIGN;
            case OR -> Priority.OR;
            case AND, COLON -> Priority.AND;
            case LAMBDA -> Priority.LAMBDA;
            case EQ, NOTEQ -> Priority.EQUALS;
            case LT, GT, LTEQ, GTEQ -> Priority.LESSGREATER;
            case PLUS, MINUS, BITOR, BITXOR -> Priority.SUM;
            case ASTERISK, PERCENT, BITAND, LEFTSHIFT, RIGHTSHIFT -> Priority.PRODUCT;
            case SLASH -> Priority.DIVIDE;
            case INCR, DECR -> Priority.PREFIX;
            case LPAREN -> Priority.CALL;
            case LBRACKET -> Priority.INDEX;
            case DOT -> Priority.DOTINDEX;
            case IDENT, INT, FLOAT, STRING, LINECOMMENT, BLOCKCOMMENT,
                 BANG, BITNOT, DOTDOT, COMMA, RPAREN, RBRACKET, LBRACE, RBRACE,
                 FUNC, MACRO, TRUE, FALSE, IF, ELSE, FOR, RETURN, BREAK, CONTINUE,
                 LEN, FIRST, REST, PRINT, PRINTLN, LOG, ERROR, QUOTE, UNQUOTE ->
                throw unknown(token);
        };
    }

    private static PrintException unknown(Token token) {
        var error = new PrintError.UnknownPrecedence(token);
        log.debug(error.message());
        return error.exception();
    }
}
