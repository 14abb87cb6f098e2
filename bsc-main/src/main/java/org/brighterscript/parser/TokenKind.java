package org.brighterscript.parser;

import java.util.EnumSet;
import java.util.Set;

public enum TokenKind {
    // literals
    IDENTIFIER,
    STRING_LITERAL,
    INTEGER_LITERAL,
    LONG_INTEGER_LITERAL,
    FLOAT_LITERAL,
    DOUBLE_LITERAL,
    TRUE,
    FALSE,
    INVALID,
    COMMENT,

    // punctuation
    LEFT_PAREN,
    RIGHT_PAREN,
    LEFT_SQUARE,
    RIGHT_SQUARE,
    COMMA,
    SEMICOLON,
    COLON,
    DOT,
    AT,

    // operators
    EQUAL,
    PLUS,
    MINUS,
    STAR,
    FORWARDSLASH,
    BACKSLASH,
    CARET,
    MOD,
    LEFT_SHIFT,
    RIGHT_SHIFT,
    LESS,
    LESS_EQUAL,
    GREATER,
    GREATER_EQUAL,
    LESS_GREATER,
    AND,
    OR,
    NOT,
    PLUS_PLUS,
    MINUS_MINUS,
    PLUS_EQUAL,
    MINUS_EQUAL,
    STAR_EQUAL,
    FORWARDSLASH_EQUAL,
    BACKSLASH_EQUAL,
    LEFT_SHIFT_EQUAL,
    RIGHT_SHIFT_EQUAL,

    // keywords
    FUNCTION,
    SUB,
    END_FUNCTION,
    END_SUB,
    AS,
    IF,
    THEN,
    ELSE,
    END_IF,
    FOR,
    FOR_EACH,
    TO,
    STEP,
    IN,
    END_FOR,
    WHILE,
    END_WHILE,
    EXIT_FOR,
    EXIT_WHILE,
    CONTINUE,
    RETURN,
    END,
    STOP,
    PRINT,
    DIM,
    GOTO,
    LIBRARY,
    IMPORT,
    NAMESPACE,
    END_NAMESPACE,
    CLASS,
    END_CLASS,
    EXTENDS,
    PUBLIC,
    PROTECTED,
    PRIVATE,
    OVERRIDE,
    NEW,
    INTERFACE,
    END_INTERFACE,
    ENUM,
    END_ENUM,
    CONST,
    TRY,
    CATCH,
    END_TRY,
    THROW,
    EOF;

    private static final Set<TokenKind> COMPOUND_ASSIGNMENT_OPERATORS = EnumSet.of(
            PLUS_EQUAL, MINUS_EQUAL, STAR_EQUAL, FORWARDSLASH_EQUAL,
            BACKSLASH_EQUAL, LEFT_SHIFT_EQUAL, RIGHT_SHIFT_EQUAL);

    private static final Set<TokenKind> ACCESS_MODIFIERS = EnumSet.of(PUBLIC, PROTECTED, PRIVATE);

    public boolean isCompoundAssignment() {
        return COMPOUND_ASSIGNMENT_OPERATORS.contains(this);
    }

    public boolean isAccessModifier() {
        return ACCESS_MODIFIERS.contains(this);
    }
}
