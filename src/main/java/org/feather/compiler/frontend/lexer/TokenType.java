package org.feather.compiler.frontend.lexer;

/**
 * Defines the closed set of token kinds that the {@link Lexer} can emit.
 * The end of the stream is implicit; no token marks it.
 */
public enum TokenType {
    // Logical keywords.
    /** The keyword {@code and}. */
    AND,
    /** The keyword {@code or}. */
    OR,
    /** The keyword {@code xor}. */
    XOR,
    /** The keyword {@code not}. */
    NOT,

    // Comparison operators.
    /** {@code ==} */
    EQUALS,
    /** {@code !=} */
    NOT_EQUALS,
    /** {@code <} */
    LESS_THAN,
    /** {@code >} */
    GREATER_THAN,
    /** {@code <=} */
    LESS_EQUAL,
    /** {@code >=} */
    GREATER_EQUAL,

    /** {@code >-} */
    FEATHER,
    /** {@code ->} */
    ARROW,

    // Bitwise operators.
    /** {@code &} */
    AMPERSAND,
    /** {@code |} */
    PIPE,
    /** {@code ^} */
    CARET,
    /** {@code ~} */
    TILDE,
    /** {@code <<} */
    L_SHIFT,
    /** {@code >>} */
    R_SHIFT,

    // Arithmetic operators.
    /** {@code ++} */
    INCR,
    /** {@code --} */
    DECR,
    /** {@code +} */
    PLUS,
    /** {@code -} */
    MINUS,
    /** {@code *} */
    MUL,
    /** {@code /} */
    DIV,
    /** {@code **} */
    POW,
    /** {@code %} */
    MODULO,

    // Declaration keywords.
    PUB,
    PACKED,
    STRUCT,
    ENUM,
    UNION,

    // Control-flow keywords.
    FN,
    DEFER,
    IF,
    THEN,
    ELSE,
    WHILE,
    DO,
    LOOP,
    CONTINUE,
    BREAK,

    // Punctuation.
    /** {@code =} */
    EQUAL,
    /** {@code ;} */
    SEMI,
    /** {@code :} */
    COLON,
    /** {@code ,} */
    COMMA,
    /** {@code .} */
    DOT,
    /** {@code (} */
    L_PARENS,
    /** {@code )} */
    R_PARENS,
    /** {@code [} */
    L_BRACKET,
    /** {@code ]} */
    R_BRACKET,
    /** <code>&#123;</code> */
    L_BRACE,
    /** <code>&#125;</code> */
    R_BRACE,

    // Literals.
    /** A complete string literal, including its prefix and quotes. */
    STRING,
    /** The text of an interpolated string before its first embedded expression. */
    STRING_INTERP_BEG,
    /** The text of an interpolated string between two embedded expressions. */
    STRING_INTERP_MID,
    /** The text of an interpolated string after its last embedded expression. */
    STRING_INTERP_END,
    /** A character literal such as {@code 'a'}. */
    CHAR,
    /** An identifier that is not a keyword. */
    IDENT,
    /** An integer or floating-point literal in any radix. */
    NUM
}
