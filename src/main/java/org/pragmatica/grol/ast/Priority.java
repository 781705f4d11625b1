package org.pragmatica.grol.ast;

/**
 * Binding strength of operators, lowest first. Declaration order is the ordering.
 */
public enum Priority {
    LOWEST,
    ASSIGN,      // = :=
    OR,          // ||
    AND,         // && and :
    LAMBDA,      // =>
    EQUALS,      // == !=
    LESSGREATER, // < > <= >=
    SUM,         // + - | ^
    PRODUCT,     // * % & << >>
    DIVIDE,      // /
    PREFIX,      // -x !x x++
    CALL,        // f(x)
    INDEX,       // a[i]
    DOTINDEX;    // m.key

    public boolean isLowerThan(Priority other) {
        return compareTo(other) < 0;
    }

    public boolean isAtMost(Priority other) {
        return compareTo(other) <= 0;
    }
}
