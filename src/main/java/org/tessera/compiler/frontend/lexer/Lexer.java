package org.tessera.compiler.frontend.lexer;

import org.tessera.compiler.api.LexerErrorCode;
import org.tessera.compiler.api.LexicalException;
import org.tessera.compiler.api.SourceInfo;
import org.tessera.compiler.diagnostics.CompilerLogger;
import org.tessera.compiler.diagnostics.DiagnosticsEngine;
import org.tessera.compiler.frontend.lexer.rules.TokenRule;
import org.tessera.compiler.frontend.lexer.rules.TokenRuleTable;
import org.tessera.compiler.internal.i18n.Messages;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * The Lexer (also known as Tokenizer or Scanner) is responsible for converting
 * a sequence of bytes (source code) into a sequence of tokens.
 * <p>
 * At every position all rules of the {@link TokenRuleTable} are tried; the longest match wins
 * and ties go to the rule declared first. Whitespace and comments are matched like any other
 * rule and then dropped.
 * <p>
 * A lexer owns one cursor over an immutable {@link SourceBuffer} and is not thread-safe.
 * To scan the same source twice, create a second lexer over the same buffer.
 * A lexical error is final: every later call to {@link #nextToken()} rethrows it.
 */
public class Lexer implements ITokenSource {

    /** Receives one TRACE event per token when {@link LexerOptions#traceTokens()} is set. */
    public static final String TOKEN_LOGGER = "org.tessera.compiler.frontend.lexer.tokens";
    private static final Logger TOKEN_LOG = LoggerFactory.getLogger(TOKEN_LOGGER);

    private final SourceBuffer source;
    private final DiagnosticsEngine diagnostics;
    private final LexerOptions options;
    private final List<TokenRule> rules;
    private final Cursor cursor = new Cursor();
    private LexicalException failure;
    private int tokenCount = 0;
    private boolean endReached = false;

    /**
     * Creates a new Lexer.
     * @param source The source code as a single string.
     * @param diagnostics The engine for reporting errors, may be null.
     */
    public Lexer(String source, DiagnosticsEngine diagnostics) {
        this(source, diagnostics, LexerOptions.defaults().defaultFileName());
    }

    /**
     * Creates a new Lexer with an explicit logical file name.
     * @param source The source code as a single string.
     * @param diagnostics The engine for reporting errors, may be null.
     * @param logicalFileName The name of the file being tokenized, for error reporting.
     */
    public Lexer(String source, DiagnosticsEngine diagnostics, String logicalFileName) {
        this(SourceBuffer.of(source, logicalFileName), diagnostics);
    }

    /**
     * Creates a new Lexer over a shared buffer with the default options.
     * @param source The source buffer.
     * @param diagnostics The engine for reporting errors, may be null.
     */
    public Lexer(SourceBuffer source, DiagnosticsEngine diagnostics) {
        this(source, diagnostics, LexerOptions.defaults());
    }

    /**
     * Creates a new Lexer over a shared buffer.
     * @param source The source buffer.
     * @param diagnostics The engine for reporting errors, may be null.
     * @param options The lexer options.
     */
    public Lexer(SourceBuffer source, DiagnosticsEngine diagnostics, LexerOptions options) {
        this(source, diagnostics, options, TokenRuleTable.initializeWithDefaults());
    }

    /**
     * Creates a new Lexer with a custom rule table.
     * @param source The source buffer.
     * @param diagnostics The engine for reporting errors, may be null.
     * @param options The lexer options.
     * @param ruleTable The rules, in precedence order.
     */
    public Lexer(SourceBuffer source, DiagnosticsEngine diagnostics, LexerOptions options, TokenRuleTable ruleTable) {
        this.source = source;
        this.diagnostics = diagnostics;
        this.options = options;
        this.rules = List.copyOf(ruleTable.rules());
    }

    /**
     * Performs the tokenization of the remaining source code.
     * @return The recognized tokens, ending with {@link TokenType#END_OF_INPUT}.
     * @throws LexicalException if the source cannot be tokenized.
     */
    public List<Token> scanTokens() throws LexicalException {
        List<Token> tokens = new ArrayList<>();
        Token token;
        do {
            token = nextToken();
            tokens.add(token);
        } while (token.type() != TokenType.END_OF_INPUT);
        return tokens;
    }

    @Override
    public Token nextToken() throws LexicalException {
        if (failure != null) {
            throw failure;
        }
        byte[] bytes = source.bytes();
        while (true) {
            int offset = cursor.offset();
            if (offset >= bytes.length) {
                return endOfInput();
            }

            TokenRule best = null;
            int bestLength = 0;
            for (TokenRule rule : rules) {
                int length = rule.pattern().match(bytes, offset);
                // Strictly greater: on a tie the earlier rule stays selected.
                if (length > bestLength) {
                    best = rule;
                    bestLength = length;
                }
            }
            if (best == null) {
                throw fail(unmatchedCharacter(bytes, cursor.snapshot()));
            }

            SourcePosition start = cursor.snapshot();
            cursor.advance(bytes, bestLength);
            if (best.isTrivia()) {
                continue;
            }

            Lexeme lexeme = new Lexeme(source, offset, offset + bestLength, start);
            try {
                return emit(best, lexeme);
            } catch (LexicalException e) {
                throw fail(e);
            }
        }
    }

    /**
     * @return The position of the next unread byte.
     */
    public SourcePosition position() {
        return cursor.snapshot();
    }

    private Token emit(TokenRule rule, Lexeme lexeme) throws LexicalException {
        Object value = rule.decoder() == null ? null : rule.decoder().decode(lexeme);
        String text = new String(lexeme.bytes(), StandardCharsets.UTF_8);
        SourcePosition start = lexeme.position();
        Token token = new Token(rule.type(), text, value, lexeme.start(), lexeme.end(),
                start.line(), start.column(), source.fileName());
        tokenCount++;
        if (options.traceTokens()) {
            TOKEN_LOG.trace("{}: {}", source.fileName(), token);
        }
        return token;
    }

    private Token endOfInput() {
        SourcePosition end = cursor.snapshot();
        if (!endReached) {
            endReached = true;
            CompilerLogger.debug("Lexer: " + source.fileName() + " produced " + tokenCount + " tokens");
        }
        return new Token(TokenType.END_OF_INPUT, "", null, end.offset(), end.offset(),
                end.line(), end.column(), source.fileName());
    }

    private LexicalException unmatchedCharacter(byte[] bytes, SourcePosition at) {
        int b = bytes[at.offset()] & 0xFF;
        String fragment = characterAt(bytes, at.offset());
        String message = Messages.get("lexer.unmatchedCharacter", fragment, String.format("0x%02X", b));
        SourceInfo info = new SourceInfo(source.fileName(), at.line(), at.column(), fragment, source.lineContent(at.line()));
        return new LexicalException(LexerErrorCode.UNMATCHED_CHARACTER, message, info);
    }

    /**
     * Returns the character starting at {@code offset}, decoding a multi-byte UTF-8 sequence
     * if there is one. Malformed sequences yield the replacement character.
     */
    private static String characterAt(byte[] bytes, int offset) {
        int b = bytes[offset] & 0xFF;
        int length;
        if (b < 0x80) {
            length = 1;
        } else if (b >= 0xF0) {
            length = 4;
        } else if (b >= 0xE0) {
            length = 3;
        } else if (b >= 0xC0) {
            length = 2;
        } else {
            length = 1;
        }
        length = Math.min(length, bytes.length - offset);
        return new String(bytes, offset, length, StandardCharsets.UTF_8);
    }

    private LexicalException fail(LexicalException e) {
        failure = e;
        if (diagnostics != null) {
            SourceInfo info = e.getSourceInfo();
            if (info != null) {
                diagnostics.reportError(e.getReason(), info.fileName(), info.lineNumber(), info.columnNumber());
            } else {
                diagnostics.reportError(e.getReason(), source.fileName(), 0, 0);
            }
        }
        CompilerLogger.debug("Lexer: " + e.getMessage());
        return e;
    }
}
