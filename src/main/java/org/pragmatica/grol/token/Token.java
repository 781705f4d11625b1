package org.pragmatica.grol.token;

import java.util.Objects;

/**
 * Lexical unit embedded in every syntax tree node. Immutable.
 */
public record Token(TokenType type, String literal, SourceLocation location) {

    public Token {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(literal, "literal");
        Objects.requireNonNull(location, "location");
    }

    /**
     * Token with the canonical text of a fixed-text type, e.g. {@code +} or {@code if}.
     */
    public static Token of(TokenType type) {
        if (!type.hasFixedText()) {
            throw new IllegalArgumentException("Token type " + type + " needs an explicit literal");
        }
        return new Token(type, type.text(), SourceLocation.START);
    }

    public static Token of(TokenType type, String literal) {
        return new Token(type, literal, SourceLocation.START);
    }

    public static Token at(TokenType type, String literal, SourceLocation location) {
        return new Token(type, literal, location);
    }

    @Override
    public String toString() {
        return type + "(" + literal + ")@" + location;
    }
}
