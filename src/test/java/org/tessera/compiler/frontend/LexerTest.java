package org.tessera.compiler.frontend;

import org.tessera.compiler.api.LexerErrorCode;
import org.tessera.compiler.api.LexicalException;
import org.tessera.compiler.diagnostics.Diagnostic;
import org.tessera.compiler.diagnostics.DiagnosticsEngine;
import org.tessera.compiler.frontend.lexer.Lexer;
import org.tessera.compiler.frontend.lexer.SourceBuffer;
import org.tessera.compiler.frontend.lexer.Token;
import org.tessera.compiler.frontend.lexer.TokenType;
import org.tessera.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.assertj.core.api.Assertions.tuple;

/**
 * Contains unit tests for the {@link Lexer}.
 * These tests verify that the lexer converts source text into a stream of tokens with exact
 * positions, decodes literals and reports lexical errors at the offending character.
 */
@Tag("unit")
@ExtendWith(LogWatchExtension.class)
public class LexerTest {

    private static List<Token> scan(String source) throws LexicalException {
        return new Lexer(source, new DiagnosticsEngine()).scanTokens();
    }

    private static List<TokenType> types(String source) throws LexicalException {
        return scan(source).stream().map(Token::type).toList();
    }

    /**
     * Verifies token types, texts, payloads and positions of a small let expression.
     */
    @Test
    void testLetExpressionTokenization() throws LexicalException {
        // Arrange
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        Lexer lexer = new Lexer("let x = +42 in x", diagnostics);

        // Act
        List<Token> tokens = lexer.scanTokens();

        // Assert
        assertThat(diagnostics.hasErrors()).isFalse();
        assertThat(tokens)
                .extracting(Token::type, Token::text, Token::line, Token::column)
                .containsExactly(
                        tuple(TokenType.LET, "let", 1, 1),
                        tuple(TokenType.LABEL, "x", 1, 5),
                        tuple(TokenType.EQUALS, "=", 1, 7),
                        tuple(TokenType.NATURAL_LIT, "+42", 1, 9),
                        tuple(TokenType.IN, "in", 1, 13),
                        tuple(TokenType.LABEL, "x", 1, 16),
                        tuple(TokenType.END_OF_INPUT, "", 1, 17));
        assertThat(tokens.get(3).value()).isEqualTo(BigInteger.valueOf(42));
        assertThat(tokens.get(3)).extracting(Token::start, Token::end).containsExactly(8, 11);
    }

    @Test
    void keywordWinsOverLabelOfEqualLength() throws LexicalException {
        assertThat(types("let")).containsExactly(TokenType.LET, TokenType.END_OF_INPUT);
        assertThat(types("Natural/fold")).containsExactly(TokenType.NATURAL_FOLD, TokenType.END_OF_INPUT);
        assertThat(types("List/build List/fold")).containsExactly(TokenType.LIST_BUILD, TokenType.LIST_FOLD, TokenType.END_OF_INPUT);
        assertThat(types("Type Kind Bool True False Integer Text Double Maybe Nothing Just"))
                .containsExactly(TokenType.TYPE, TokenType.KIND, TokenType.BOOL, TokenType.TRUE, TokenType.FALSE,
                        TokenType.INTEGER, TokenType.TEXT, TokenType.DOUBLE, TokenType.MAYBE, TokenType.NOTHING,
                        TokenType.JUST, TokenType.END_OF_INPUT);
    }

    @Test
    void longerLabelWinsOverKeywordPrefix() throws LexicalException {
        List<Token> tokens = scan("letter Natural/folds Naturals iff");

        assertThat(tokens)
                .extracting(Token::type, Token::value)
                .containsExactly(
                        tuple(TokenType.LABEL, "letter"),
                        tuple(TokenType.LABEL, "Natural/folds"),
                        tuple(TokenType.LABEL, "Naturals"),
                        tuple(TokenType.LABEL, "iff"),
                        tuple(TokenType.END_OF_INPUT, null));
    }

    @Test
    void ifThenElse() throws LexicalException {
        assertThat(types("if True then +1 else +0"))
                .containsExactly(TokenType.IF, TokenType.TRUE, TokenType.THEN, TokenType.NATURAL_LIT,
                        TokenType.ELSE, TokenType.NATURAL_LIT, TokenType.END_OF_INPUT);
    }

    @Test
    void punctuationAndOperators() throws LexicalException {
        assertThat(types("( ) { } {{ }} [ ] : , . = && || == /= + ++ - * -> \\ @"))
                .containsExactly(
                        TokenType.OPEN_PAREN, TokenType.CLOSE_PAREN, TokenType.OPEN_BRACE, TokenType.CLOSE_BRACE,
                        TokenType.DOUBLE_OPEN_BRACE, TokenType.DOUBLE_CLOSE_BRACE, TokenType.OPEN_BRACKET,
                        TokenType.CLOSE_BRACKET, TokenType.COLON, TokenType.COMMA, TokenType.DOT, TokenType.EQUALS,
                        TokenType.AND, TokenType.OR, TokenType.DOUBLE_EQUALS, TokenType.SLASH_EQUALS, TokenType.PLUS,
                        TokenType.DOUBLE_PLUS, TokenType.MINUS, TokenType.STAR, TokenType.ARROW, TokenType.LAMBDA,
                        TokenType.AT, TokenType.END_OF_INPUT);
    }

    @Test
    void adjacentPunctuationIsSplitByLongestMatch() throws LexicalException {
        assertThat(types("{{}}{}")).containsExactly(TokenType.DOUBLE_OPEN_BRACE, TokenType.DOUBLE_CLOSE_BRACE,
                TokenType.OPEN_BRACE, TokenType.CLOSE_BRACE, TokenType.END_OF_INPUT);
        assertThat(types("+++")).containsExactly(TokenType.DOUBLE_PLUS, TokenType.PLUS, TokenType.END_OF_INPUT);
        assertThat(types("a->b")).containsExactly(TokenType.LABEL, TokenType.ARROW, TokenType.LABEL, TokenType.END_OF_INPUT);
    }

    @Test
    void unicodeSpellingsAndCharacterColumns() throws LexicalException {
        List<Token> tokens = scan("λ(x : Bool) → x");

        assertThat(tokens)
                .extracting(Token::type, Token::column, Token::start)
                .containsExactly(
                        tuple(TokenType.LAMBDA, 1, 0),
                        tuple(TokenType.OPEN_PAREN, 2, 2),
                        tuple(TokenType.LABEL, 3, 3),
                        tuple(TokenType.COLON, 5, 5),
                        tuple(TokenType.BOOL, 7, 7),
                        tuple(TokenType.CLOSE_PAREN, 11, 11),
                        tuple(TokenType.ARROW, 13, 13),
                        tuple(TokenType.LABEL, 15, 17),
                        tuple(TokenType.END_OF_INPUT, 16, 18));
        assertThat(tokens.get(6).text()).isEqualTo("→");
        assertThat(tokens.get(6).end()).isEqualTo(16);
        assertThat(types("∀(a : Type) → a")).first().isEqualTo(TokenType.FORALL);
    }

    @Test
    void commentsAndWhitespaceAreInvisible() throws LexicalException {
        List<Token> withComment = scan("-- comment\nlet");
        List<Token> plain = scan("let");

        assertThat(withComment).extracting(Token::type).isEqualTo(plain.stream().map(Token::type).toList());
        assertThat(withComment.get(0)).extracting(Token::line, Token::column).containsExactly(2, 1);
        assertThat(types(" \t\r\n\f -- only a comment")).containsExactly(TokenType.END_OF_INPUT);
        assertThat(types("a -- trailing -> comment\n-b")).containsExactly(TokenType.LABEL, TokenType.MINUS, TokenType.LABEL, TokenType.END_OF_INPUT);
    }

    @Test
    void parenthesizedOperatorIsALabel() throws LexicalException {
        List<Token> tokens = scan("(+) (&&) (x)");

        assertThat(tokens)
                .extracting(Token::type, Token::value)
                .containsExactly(
                        tuple(TokenType.LABEL, "(+)"),
                        tuple(TokenType.LABEL, "(&&)"),
                        tuple(TokenType.OPEN_PAREN, null),
                        tuple(TokenType.LABEL, "x"),
                        tuple(TokenType.CLOSE_PAREN, null),
                        tuple(TokenType.END_OF_INPUT, null));
    }

    @Test
    void numericLiterals() throws LexicalException {
        List<Token> tokens = scan("42 +42 3.14e2 2.5 1e3 7E-1 123456789012345678901234567890");

        assertThat(tokens)
                .extracting(Token::type, Token::value)
                .containsExactly(
                        tuple(TokenType.NUMBER, BigInteger.valueOf(42)),
                        tuple(TokenType.NATURAL_LIT, BigInteger.valueOf(42)),
                        tuple(TokenType.DOUBLE_LIT, 314.0),
                        tuple(TokenType.DOUBLE_LIT, 2.5),
                        tuple(TokenType.DOUBLE_LIT, 1000.0),
                        tuple(TokenType.DOUBLE_LIT, 0.7),
                        tuple(TokenType.NUMBER, new BigInteger("123456789012345678901234567890")),
                        tuple(TokenType.END_OF_INPUT, null));
    }

    @Test
    void incompleteFractionFallsBackToNumberAndDot() throws LexicalException {
        assertThat(types("1.x")).containsExactly(TokenType.NUMBER, TokenType.DOT, TokenType.LABEL, TokenType.END_OF_INPUT);
        assertThat(types("1e")).containsExactly(TokenType.NUMBER, TokenType.LABEL, TokenType.END_OF_INPUT);
    }

    @Test
    void outOfRangeDoubleIsRejected() {
        LexicalException e = catchThrowableOfType(() -> scan("x = 1e999"), LexicalException.class);

        assertThat(e.getErrorCode()).isEqualTo(LexerErrorCode.INVALID_NUMERIC_LITERAL);
        assertThat(e.getSourceInfo().columnNumber()).isEqualTo(5);
        assertThat(e.getSourceInfo().fragment()).isEqualTo("1e999");
    }

    @Test
    void textLiteralWithEscapedQuote() throws LexicalException {
        List<Token> tokens = scan("\"a\\\"b\"");

        assertThat(tokens.get(0).type()).isEqualTo(TokenType.TEXT_LIT);
        assertThat(tokens.get(0).value()).isEqualTo("a\"b");
        assertThat((String) tokens.get(0).value()).hasSize(3);
        assertThat(tokens.get(0).text()).isEqualTo("\"a\\\"b\"");
    }

    @Test
    void textLiteralsSpanLinesAndDecodeUnicode() throws LexicalException {
        List<Token> tokens = scan("\"λ\\u0041\nb\" x");

        assertThat(tokens.get(0).value()).isEqualTo("λA\nb");
        assertThat(tokens.get(1)).extracting(Token::type, Token::line, Token::column).containsExactly(TokenType.LABEL, 2, 4);
    }

    @Test
    void invalidEscapeIsReportedAtTheBackslash() {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        Lexer lexer = new Lexer("x = \"bad \\q\"", diagnostics);

        LexicalException e = catchThrowableOfType(lexer::scanTokens, LexicalException.class);

        assertThat(e.getErrorCode()).isEqualTo(LexerErrorCode.INVALID_ESCAPE);
        assertThat(e.getSourceInfo().lineNumber()).isEqualTo(1);
        assertThat(e.getSourceInfo().columnNumber()).isEqualTo(10);
        assertThat(e.getSourceInfo().fragment()).isEqualTo("\\q");
        assertThat(diagnostics.getDiagnostics())
                .extracting(Diagnostic::fileName, Diagnostic::lineNumber, Diagnostic::columnNumber)
                .containsExactly(tuple("<memory>", 1, 10));
    }

    @Test
    void invalidEscapeOnLaterLineOfText() {
        LexicalException e = catchThrowableOfType(() -> scan("\"ok\n  \\z\""), LexicalException.class);

        assertThat(e.getErrorCode()).isEqualTo(LexerErrorCode.INVALID_ESCAPE);
        assertThat(e.getSourceInfo().lineNumber()).isEqualTo(2);
        assertThat(e.getSourceInfo().columnNumber()).isEqualTo(3);
    }

    @Test
    void malformedUnicodeEscape() {
        LexicalException e = catchThrowableOfType(() -> scan("\"\\u12G4\""), LexicalException.class);

        assertThat(e.getErrorCode()).isEqualTo(LexerErrorCode.INVALID_ESCAPE);
        assertThat(e.getSourceInfo().columnNumber()).isEqualTo(2);
    }

    @Test
    void unterminatedTextIsAnUnmatchedQuote() {
        LexicalException e = catchThrowableOfType(() -> scan("x \"open"), LexicalException.class);

        assertThat(e.getErrorCode()).isEqualTo(LexerErrorCode.UNMATCHED_CHARACTER);
        assertThat(e.getSourceInfo().columnNumber()).isEqualTo(3);
        assertThat(e.getSourceInfo().fragment()).isEqualTo("\"");
    }

    @Test
    void pathPrefixHandling() throws LexicalException {
        List<Token> tokens = scan("./foo/bar /foo/bar ../up/x.tsr");

        assertThat(tokens)
                .extracting(Token::type, Token::value)
                .containsExactly(
                        tuple(TokenType.FILE, "foo/bar"),
                        tuple(TokenType.FILE, "/foo/bar"),
                        tuple(TokenType.FILE, "../up/x.tsr"),
                        tuple(TokenType.END_OF_INPUT, null));
        assertThat(tokens.get(0).text()).isEqualTo("./foo/bar");
    }

    @Test
    void pathsAreNotNormalized() throws LexicalException {
        List<Token> tokens = scan("/foo//bar/ ../a//b/ ./x/./y//");

        assertThat(tokens)
                .extracting(Token::type, Token::value)
                .containsExactly(
                        tuple(TokenType.FILE, "/foo//bar/"),
                        tuple(TokenType.FILE, "../a//b/"),
                        tuple(TokenType.FILE, "x/./y//"),
                        tuple(TokenType.END_OF_INPUT, null));
    }

    @Test
    void pathStopsAtAnnotationAndGrouping() throws LexicalException {
        assertThat(types("[./a, ./b]"))
                .containsExactly(TokenType.OPEN_BRACKET, TokenType.FILE, TokenType.COMMA, TokenType.FILE,
                        TokenType.CLOSE_BRACKET, TokenType.END_OF_INPUT);
        assertThat(types("./config:Text")).containsExactly(TokenType.FILE, TokenType.COLON, TokenType.TEXT, TokenType.END_OF_INPUT);
    }

    @Test
    void slashEqualsBeatsPathOfSameLength() throws LexicalException {
        assertThat(types("/=")).containsExactly(TokenType.SLASH_EQUALS, TokenType.END_OF_INPUT);
        assertThat(scan("/=x").get(0)).extracting(Token::type, Token::value).containsExactly(TokenType.FILE, "/=x");
    }

    @Test
    void urls() throws LexicalException {
        List<Token> tokens = scan("http://example.com/a.tsr https://host:8080/b");

        assertThat(tokens)
                .extracting(Token::type, Token::value)
                .containsExactly(
                        tuple(TokenType.URL, "http://example.com/a.tsr"),
                        tuple(TokenType.URL, "https://host:8080/b"),
                        tuple(TokenType.END_OF_INPUT, null));
    }

    @Test
    void unmatchedCharacterReportsExactPosition() {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        Lexer lexer = new Lexer("let x =\n  `oops`", diagnostics, "main.tsr");

        LexicalException e = catchThrowableOfType(lexer::scanTokens, LexicalException.class);

        assertThat(e.getErrorCode()).isEqualTo(LexerErrorCode.UNMATCHED_CHARACTER);
        assertThat(e.getSourceInfo().fileName()).isEqualTo("main.tsr");
        assertThat(e.getSourceInfo().lineNumber()).isEqualTo(2);
        assertThat(e.getSourceInfo().columnNumber()).isEqualTo(3);
        assertThat(e.getSourceInfo().fragment()).isEqualTo("`");
        assertThat(e.getSourceInfo().lineContent()).isEqualTo("  `oops`");
        assertThat(e.getReason()).contains("0x60");
        assertThat(diagnostics.hasErrors()).isTrue();
    }

    @Test
    void errorsAreFinal() throws LexicalException {
        Lexer lexer = new Lexer("x ` y", null);
        assertThat(lexer.nextToken().type()).isEqualTo(TokenType.LABEL);

        LexicalException first = catchThrowableOfType(lexer::nextToken, LexicalException.class);
        LexicalException second = catchThrowableOfType(lexer::nextToken, LexicalException.class);

        assertThat(first).isNotNull();
        assertThat(second).isSameAs(first);
    }

    @Test
    void endOfInputIsRepeatable() throws LexicalException {
        Lexer lexer = new Lexer("x", null);
        assertThat(lexer.nextToken().type()).isEqualTo(TokenType.LABEL);

        Token end1 = lexer.nextToken();
        Token end2 = lexer.nextToken();
        Token end3 = lexer.nextToken();

        assertThat(List.of(end1, end2, end3)).extracting(Token::type).containsOnly(TokenType.END_OF_INPUT);
        assertThat(end3).isEqualTo(end1);
        assertThat(end1).extracting(Token::start, Token::end, Token::column).containsExactly(1, 1, 2);
        assertThat(new Lexer("", null).nextToken().type()).isEqualTo(TokenType.END_OF_INPUT);
    }

    @Test
    void invalidUtf8() {
        byte[] insideText = {'"', 'a', (byte) 0xFF, '"'};
        LexicalException e1 = catchThrowableOfType(
                () -> new Lexer(SourceBuffer.of(insideText, "bin"), null).scanTokens(), LexicalException.class);
        assertThat(e1.getErrorCode()).isEqualTo(LexerErrorCode.INVALID_ENCODING);
        assertThat(e1.getSourceInfo().columnNumber()).isEqualTo(3);

        byte[] bare = {'x', ' ', (byte) 0xFF};
        LexicalException e2 = catchThrowableOfType(
                () -> new Lexer(SourceBuffer.of(bare, "bin"), null).scanTokens(), LexicalException.class);
        assertThat(e2.getErrorCode()).isEqualTo(LexerErrorCode.UNMATCHED_CHARACTER);
        assertThat(e2.getSourceInfo().columnNumber()).isEqualTo(3);
        assertThat(e2.getReason()).contains("0xFF");

        byte[] inPath = {'/', 'a', (byte) 0xC3};
        LexicalException e3 = catchThrowableOfType(
                () -> new Lexer(SourceBuffer.of(inPath, "bin"), null).scanTokens(), LexicalException.class);
        assertThat(e3.getErrorCode()).isEqualTo(LexerErrorCode.INVALID_ENCODING);
    }

    @Test
    void independentLexersShareOneBuffer() throws LexicalException {
        SourceBuffer buffer = SourceBuffer.of("a b c", "shared.tsr");
        Lexer first = new Lexer(buffer, null);
        Lexer second = new Lexer(buffer, null);

        first.nextToken();
        first.nextToken();

        assertThat(second.nextToken().value()).isEqualTo("a");
        assertThat(first.nextToken().value()).isEqualTo("c");
        assertThat(second.position().offset()).isEqualTo(1);
    }

    @Test
    void payloadsDoNotAliasTheCallerArray() throws LexicalException {
        byte[] bytes = "\"abc\"".getBytes(StandardCharsets.UTF_8);
        Lexer lexer = new Lexer(SourceBuffer.of(bytes, "copy"), null);
        bytes[1] = 'z';

        assertThat(lexer.nextToken().value()).isEqualTo("abc");
    }
}
