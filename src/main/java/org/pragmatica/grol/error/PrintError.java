package org.pragmatica.grol.error;

import org.pragmatica.grol.token.Token;

/**
 * Invariant violations detected while printing a tree.
 * None of them is recoverable: the tree or the precedence table has to be fixed.
 */
public sealed interface PrintError {
    String message();

    /**
     * Operator node whose token type has no priority level.
     */
    record UnknownPrecedence(Token token) implements PrintError {
        @Override
        public String message() {
            return "No precedence for '" + token.literal() + "' (" + token.type() + ") at " + token.location();
        }
    }

    /**
     * Map literal whose key order does not match its key set.
     */
    record InconsistentMap(String reason) implements PrintError {
        @Override
        public String message() {
            return "Inconsistent map literal: " + reason;
        }
    }

    default PrintException exception() {
        return new PrintException(this);
    }
}
