package org.tessera.compiler.frontend.lexer;

/**
 * Defines the different types of tokens that the {@link Lexer} can recognize.
 * <p>
 * Fixed-text types carry their canonical spelling, which {@link TokenRenderer} emits.
 * Payload types carry no spelling; their text comes from the decoded value.
 */
public enum TokenType {
    // Punctuation.
    /** The '(' character. */
    OPEN_PAREN("("),
    /** The ')' character. */
    CLOSE_PAREN(")"),
    /** The '{' character. */
    OPEN_BRACE("{"),
    /** The '}' character. */
    CLOSE_BRACE("}"),
    /** The '{{' sequence. */
    DOUBLE_OPEN_BRACE("{{"),
    /** The '}}' sequence. */
    DOUBLE_CLOSE_BRACE("}}"),
    /** The '[' character. */
    OPEN_BRACKET("["),
    /** The ']' character. */
    CLOSE_BRACKET("]"),
    /** The ':' character, used for type annotations. */
    COLON(":"),
    /** The ',' character. */
    COMMA(","),
    /** The '.' character, used for field access. */
    DOT("."),
    /** The '=' character, used in let bindings and records. */
    EQUALS("="),

    // Operators.
    /** Logical conjunction. */
    AND("&&"),
    /** Logical disjunction. */
    OR("||"),
    /** Boolean equality. */
    DOUBLE_EQUALS("=="),
    /** Boolean inequality. */
    SLASH_EQUALS("/="),
    /** Natural addition. */
    PLUS("+"),
    /** Text or list concatenation. */
    DOUBLE_PLUS("++"),
    MINUS("-"),
    STAR("*"),
    /** Function arrow, also written '→'. */
    ARROW("->"),
    /** Lambda, also written 'λ'. */
    LAMBDA("\\"),
    AT("@"),

    // Keywords.
    LET("let"),
    IN("in"),
    TYPE("Type"),
    KIND("Kind"),
    /** Universal quantifier, also written '∀'. */
    FORALL("forall"),
    BOOL("Bool"),
    TRUE("True"),
    FALSE("False"),
    IF("if"),
    THEN("then"),
    ELSE("else"),
    NATURAL("Natural"),
    NATURAL_FOLD("Natural/fold"),
    INTEGER("Integer"),
    TEXT("Text"),
    DOUBLE("Double"),
    MAYBE("Maybe"),
    NOTHING("Nothing"),
    JUST("Just"),
    LIST_BUILD("List/build"),
    LIST_FOLD("List/fold"),

    // Literals.
    /** A text literal; the value is the decoded {@link String}. */
    TEXT_LIT(null),
    /** A natural literal such as {@code +42}; the value is a {@link java.math.BigInteger}. */
    NATURAL_LIT(null),
    /** A double literal; the value is a {@link Double}. */
    DOUBLE_LIT(null),
    /** An unsigned integer literal; the value is a {@link java.math.BigInteger}. */
    NUMBER(null),
    /** An identifier or a parenthesized operator; the value is its {@link String} text. */
    LABEL(null),
    /** A file path; the value is its {@link String} text, {@code ./} prefix removed. */
    FILE(null),
    /** A URL; the value is its raw {@link String} text. */
    URL(null),

    // Miscellaneous.
    /** Represents the end of the input. Requested again, it is returned again. */
    END_OF_INPUT(null);

    private final String spelling;

    TokenType(String spelling) {
        this.spelling = spelling;
    }

    /**
     * @return The canonical source spelling of a fixed-text type, or {@code null} for payload types.
     */
    public String spelling() {
        return spelling;
    }

    /**
     * @return {@code true} if tokens of this type always have the same text and no payload.
     */
    public boolean isFixedText() {
        return spelling != null;
    }
}
