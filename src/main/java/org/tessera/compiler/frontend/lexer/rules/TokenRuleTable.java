package org.tessera.compiler.frontend.lexer.rules;

import org.tessera.compiler.frontend.lexer.TokenType;
import org.tessera.compiler.frontend.lexer.decode.NumericLiteralDecoder;
import org.tessera.compiler.frontend.lexer.decode.PathLiteralDecoder;
import org.tessera.compiler.frontend.lexer.decode.TextLiteralDecoder;
import org.tessera.compiler.frontend.lexer.decode.VerbatimLiteralDecoder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.tessera.compiler.frontend.lexer.rules.Patterns.anyOf;
import static org.tessera.compiler.frontend.lexer.rules.Patterns.literal;
import static org.tessera.compiler.frontend.lexer.rules.Patterns.optional;
import static org.tessera.compiler.frontend.lexer.rules.Patterns.optionalRun;
import static org.tessera.compiler.frontend.lexer.rules.Patterns.run;
import static org.tessera.compiler.frontend.lexer.rules.Patterns.sequence;
import static org.tessera.compiler.frontend.lexer.rules.Patterns.single;
import static org.tessera.compiler.frontend.lexer.rules.Patterns.zeroOrMore;

/**
 * The ordered list of token rules.
 * <p>
 * The lexer picks the rule with the longest match and, among equally long matches, the rule
 * registered first. Registration order therefore encodes precedence: fixed text (keywords,
 * punctuation) is registered before the generic label and path rules, so {@code let} is a
 * keyword and {@code /=} an operator even though a label or a path matches the same span.
 */
public final class TokenRuleTable {

    /** Space, tab, newline, carriage return, form feed and vertical tab. */
    public static final ByteClass WHITESPACE = ByteClass.of(" \t\n\r\f\u000B");
    public static final ByteClass DIGIT = ByteClass.range('0', '9');
    public static final ByteClass LABEL_START = ByteClass.range('a', 'z').or(ByteClass.range('A', 'Z')).or(ByteClass.of("_"));
    public static final ByteClass LABEL_CHAR = LABEL_START.or(DIGIT).or(ByteClass.of("/"));
    /** Characters of an operator written as a label, e.g. {@code (+)}. */
    public static final ByteClass OPERATOR_CHAR = ByteClass.of("!#$%&*+./<=>?@^|~-");
    /** Anything but control characters, space, DEL, quotes and the grouping punctuation. */
    public static final ByteClass URL_CHAR = ByteClass.range(0x21, 0xFF)
            .except(ByteClass.of("\u007F\"()[]{},"));
    /** As {@link #URL_CHAR}, minus the colon so that {@code ./a:T} splits at the annotation. */
    public static final ByteClass PATH_CHAR = URL_CHAR.except(ByteClass.of(":"));
    private static final ByteClass TEXT_CHAR = ByteClass.ANY.except(ByteClass.of("\"\\"));
    private static final ByteClass NOT_NEWLINE = ByteClass.of("\n").negate();

    private final List<TokenRule> rules = new ArrayList<>();

    /**
     * Appends a rule. Rules registered later lose ties against rules registered earlier.
     * @param rule The rule to register.
     */
    public void register(TokenRule rule) {
        rules.add(rule);
    }

    /**
     * @return The registered rules in declaration order.
     */
    public List<TokenRule> rules() {
        return Collections.unmodifiableList(rules);
    }

    /**
     * Initializes a new rule table with the rules of the language.
     * @return A new table with all default rules registered.
     */
    public static TokenRuleTable initializeWithDefaults() {
        TokenRuleTable table = new TokenRuleTable();

        // Trivia
        table.register(TokenRule.trivia("whitespace", run(WHITESPACE)));
        table.register(TokenRule.trivia("line-comment", sequence(literal("--"), optionalRun(NOT_NEWLINE))));

        // Punctuation
        table.register(TokenRule.fixed(TokenType.OPEN_PAREN, "("));
        table.register(TokenRule.fixed(TokenType.CLOSE_PAREN, ")"));
        table.register(TokenRule.fixed(TokenType.OPEN_BRACE, "{"));
        table.register(TokenRule.fixed(TokenType.CLOSE_BRACE, "}"));
        table.register(TokenRule.fixed(TokenType.DOUBLE_OPEN_BRACE, "{{"));
        table.register(TokenRule.fixed(TokenType.DOUBLE_CLOSE_BRACE, "}}"));
        table.register(TokenRule.fixed(TokenType.OPEN_BRACKET, "["));
        table.register(TokenRule.fixed(TokenType.CLOSE_BRACKET, "]"));
        table.register(TokenRule.fixed(TokenType.COLON, ":"));
        table.register(TokenRule.fixed(TokenType.COMMA, ","));
        table.register(TokenRule.fixed(TokenType.DOT, "."));
        table.register(TokenRule.fixed(TokenType.EQUALS, "="));

        // Operators
        table.register(TokenRule.fixed(TokenType.AND, "&&"));
        table.register(TokenRule.fixed(TokenType.OR, "||"));
        table.register(TokenRule.fixed(TokenType.DOUBLE_EQUALS, "=="));
        table.register(TokenRule.fixed(TokenType.SLASH_EQUALS, "/="));
        table.register(TokenRule.fixed(TokenType.PLUS, "+"));
        table.register(TokenRule.fixed(TokenType.DOUBLE_PLUS, "++"));
        table.register(TokenRule.fixed(TokenType.MINUS, "-"));
        table.register(TokenRule.fixed(TokenType.STAR, "*"));
        table.register(TokenRule.fixed(TokenType.ARROW, "->", "→"));
        table.register(TokenRule.fixed(TokenType.LAMBDA, "\\", "λ"));
        table.register(TokenRule.fixed(TokenType.AT, "@"));

        // Keywords
        table.register(TokenRule.fixed(TokenType.LET, "let"));
        table.register(TokenRule.fixed(TokenType.IN, "in"));
        table.register(TokenRule.fixed(TokenType.TYPE, "Type"));
        table.register(TokenRule.fixed(TokenType.KIND, "Kind"));
        table.register(TokenRule.fixed(TokenType.FORALL, "forall", "∀"));
        table.register(TokenRule.fixed(TokenType.BOOL, "Bool"));
        table.register(TokenRule.fixed(TokenType.TRUE, "True"));
        table.register(TokenRule.fixed(TokenType.FALSE, "False"));
        table.register(TokenRule.fixed(TokenType.IF, "if"));
        table.register(TokenRule.fixed(TokenType.THEN, "then"));
        table.register(TokenRule.fixed(TokenType.ELSE, "else"));
        table.register(TokenRule.fixed(TokenType.NATURAL, "Natural"));
        table.register(TokenRule.fixed(TokenType.NATURAL_FOLD, "Natural/fold"));
        table.register(TokenRule.fixed(TokenType.INTEGER, "Integer"));
        table.register(TokenRule.fixed(TokenType.TEXT, "Text"));
        table.register(TokenRule.fixed(TokenType.DOUBLE, "Double"));
        table.register(TokenRule.fixed(TokenType.MAYBE, "Maybe"));
        table.register(TokenRule.fixed(TokenType.NOTHING, "Nothing"));
        table.register(TokenRule.fixed(TokenType.JUST, "Just"));
        table.register(TokenRule.fixed(TokenType.LIST_BUILD, "List/build"));
        table.register(TokenRule.fixed(TokenType.LIST_FOLD, "List/fold"));

        // Literals
        table.register(TokenRule.literal(TokenType.TEXT_LIT,
                sequence(literal("\""),
                        zeroOrMore(anyOf(run(TEXT_CHAR), sequence(literal("\\"), single(ByteClass.ANY)))),
                        literal("\"")),
                TextLiteralDecoder::decode));
        table.register(TokenRule.literal(TokenType.NATURAL_LIT,
                sequence(literal("+"), run(DIGIT)),
                NumericLiteralDecoder::decodeNatural));
        // Must stay ahead of DOUBLE_LIT: a bare digit run is a NUMBER.
        table.register(TokenRule.literal(TokenType.NUMBER, run(DIGIT), NumericLiteralDecoder::decodeNumber));
        table.register(TokenRule.literal(TokenType.DOUBLE_LIT,
                sequence(run(DIGIT),
                        optional(sequence(literal("."), run(DIGIT))),
                        optional(sequence(single(ByteClass.of("eE")), optional(single(ByteClass.of("+-"))), run(DIGIT)))),
                NumericLiteralDecoder::decodeDouble));
        table.register(TokenRule.literal(TokenType.LABEL,
                anyOf(sequence(single(LABEL_START), optionalRun(LABEL_CHAR)),
                        sequence(literal("("), run(OPERATOR_CHAR), literal(")"))),
                VerbatimLiteralDecoder::decodeLabel));
        table.register(TokenRule.literal(TokenType.FILE,
                anyOf(sequence(literal("/"), run(PATH_CHAR)),
                        sequence(literal("./"), run(PATH_CHAR)),
                        sequence(literal("../"), run(PATH_CHAR))),
                PathLiteralDecoder::decode));
        table.register(TokenRule.literal(TokenType.URL,
                sequence(anyOf(literal("https://"), literal("http://")), run(URL_CHAR)),
                VerbatimLiteralDecoder::decodeUrl));

        return table;
    }
}
