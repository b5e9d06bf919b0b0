package org.feather.compiler.frontend.lexer;

import org.feather.compiler.diagnostics.DiagnosticsEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The Lexer (also known as Tokenizer or Scanner) converts the text of one source
 * file into a {@link TokenStream}.
 * <p>
 * Scanning is recursive: {@link #consumeToken} emits one token per call, except for
 * brackets and interpolated strings, where it re-enters itself for the nested content.
 * Every nested call shares the same {@link Cursor} and {@link TokenStream.Builder}, so
 * positions only move forward and tokens are appended in source order.
 * <p>
 * The first malformed construct aborts the scan with a {@link LexicalException};
 * no partial stream is returned. A lexer instance is meant to be used once.
 */
public class Lexer {

    private static final Logger LOG = LoggerFactory.getLogger(Lexer.class);

    private final String source;
    private final DiagnosticsEngine diagnostics;
    private final String logicalFileName;
    private final LexerOptions options;

    /**
     * Creates a new Lexer with default options.
     * @param source The source code as a single string.
     * @param diagnostics The engine for reporting errors.
     */
    public Lexer(String source, DiagnosticsEngine diagnostics) {
        this(source, diagnostics, "<memory>", LexerOptions.DEFAULTS);
    }

    /**
     * Creates a new Lexer.
     * @param source The source code as a single string.
     * @param diagnostics The engine for reporting errors.
     * @param logicalFileName The name of the file being scanned, for error reporting.
     * @param options The lexer options.
     */
    public Lexer(String source, DiagnosticsEngine diagnostics, String logicalFileName, LexerOptions options) {
        this.source = source;
        this.diagnostics = diagnostics;
        this.logicalFileName = logicalFileName;
        this.options = options;
    }

    /**
     * Tokenizes the entire source.
     * @return The complete token stream.
     * @throws LexicalException at the first construct that cannot be tokenized. The error
     *         is also reported to the diagnostics engine.
     */
    public TokenStream scanTokens() throws LexicalException {
        TokenStream.Builder sink = TokenStream.builder(source, logicalFileName, options.capacityHint());
        Cursor cursor = new Cursor(source);
        int emitted = 0;
        try {
            while (!cursor.isAtEnd()) {
                emitted += consumeToken(cursor, sink);
            }
        } catch (LexicalException e) {
            diagnostics.reportError(e.getKind().message(), logicalFileName, e.getLine(), e.getColumn() + 1);
            throw e;
        }
        TokenStream tokens = sink.build();
        LOG.debug("Scanned {}: {} tokens on {} lines", logicalFileName, emitted, tokens.lineCount());
        return tokens;
    }

    /**
     * Consumes one unit of input: leading whitespace and comments, then in most cases a
     * single token. Brackets and interpolated strings recurse and may emit many tokens.
     * @return The number of tokens emitted.
     */
    private int consumeToken(Cursor cursor, TokenStream.Builder sink) throws LexicalException {
        skipTrivia(cursor, sink);
        if (cursor.isAtEnd()) {
            return 0;
        }

        OperatorTable.Match operator = OperatorTable.match(source, cursor.offset());
        if (operator != null) {
            return operator(cursor, sink, operator);
        }

        if (cursor.startsWith("$\"")) {
            return interpolatedString(cursor, sink);
        }
        if (cursor.startsWith("b\"") || cursor.startsWith("c\"")) {
            return quoted(cursor, sink, 2, '"', TokenType.STRING, LexicalErrorKind.UNTERMINATED_STRING);
        }
        if (cursor.peek() == '"') {
            return quoted(cursor, sink, 1, '"', TokenType.STRING, LexicalErrorKind.UNTERMINATED_STRING);
        }
        if (cursor.startsWith("b'")) {
            return quoted(cursor, sink, 2, '\'', TokenType.CHAR, LexicalErrorKind.UNTERMINATED_CHAR);
        }
        if (cursor.peek() == '\'') {
            return quoted(cursor, sink, 1, '\'', TokenType.CHAR, LexicalErrorKind.UNTERMINATED_CHAR);
        }

        char c = cursor.peek();
        if (isAlpha(c)) {
            return identifier(cursor, sink);
        }
        if (isDigit(c)) {
            return number(cursor, sink);
        }

        throw error(LexicalErrorKind.UNRECOGNIZED_TOKEN, cursor.line(), cursor.column());
    }

    /** Skips whitespace and line comments, recording every newline passed. */
    private void skipTrivia(Cursor cursor, TokenStream.Builder sink) {
        while (!cursor.isAtEnd()) {
            char c = cursor.peek();
            if (c == '\n') {
                cursor.newline(sink);
            } else if (isWhitespace(c)) {
                cursor.advance(1);
            } else if (cursor.startsWith("//")) {
                // the newline ending the comment is left for the next iteration
                while (!cursor.isAtEnd() && cursor.peek() != '\n') {
                    cursor.advance(1);
                }
            } else {
                return;
            }
        }
    }

    private int operator(Cursor cursor, TokenStream.Builder sink, OperatorTable.Match match) throws LexicalException {
        int line = cursor.line();
        int column = cursor.column();
        emit(sink, match.type(), cursor.offset(), match.length(), line, column);
        cursor.advance(match.length());

        return switch (match.type()) {
            case L_PARENS -> 1 + group(cursor, sink, ')', LexicalErrorKind.UNCLOSED_PARENTHESIS, line, column);
            case L_BRACKET -> 1 + group(cursor, sink, ']', LexicalErrorKind.UNCLOSED_BRACKET, line, column);
            case L_BRACE -> 1 + group(cursor, sink, '}', LexicalErrorKind.UNCLOSED_BRACE, line, column);
            default -> 1;
        };
    }

    /**
     * Scans the content of a bracket group up to and including its closing character.
     * The opening character has already been emitted.
     */
    private int group(Cursor cursor, TokenStream.Builder sink, char closer, LexicalErrorKind unclosed,
                      int openLine, int openColumn) throws LexicalException {
        int emitted = 0;
        while (true) {
            skipTrivia(cursor, sink);
            if (cursor.isAtEnd()) {
                throw error(unclosed, openLine, openColumn);
            }
            if (cursor.peek() == closer) {
                break;
            }
            emitted += consumeToken(cursor, sink);
        }
        OperatorTable.Match close = OperatorTable.match(source, cursor.offset());
        emit(sink, close.type(), cursor.offset(), 1, cursor.line(), cursor.column());
        cursor.advance(1);
        return emitted + 1;
    }

    /**
     * Scans {@code $"..."}. Without embedded expressions the whole literal is one
     * {@link TokenType#STRING}. Otherwise the text segments become
     * {@code STRING_INTERP_BEG}, {@code STRING_INTERP_MID}... and {@code STRING_INTERP_END},
     * and the tokens of each embedded expression are emitted between them.
     */
    private int interpolatedString(Cursor cursor, TokenStream.Builder sink) throws LexicalException {
        int startOffset = cursor.offset();
        int startLine = cursor.line();
        int startColumn = cursor.column();
        cursor.advance(2);

        int segmentOffset = cursor.offset();
        int segmentLine = cursor.line();
        int segmentColumn = cursor.column();
        boolean interpolated = false;
        int emitted = 0;

        while (!cursor.isAtEnd()) {
            if (cursor.startsWith("\\\"") || cursor.startsWith("\\{")) {
                cursor.advance(2);
                continue;
            }

            char c = cursor.peek();
            if (c == '"') {
                if (interpolated) {
                    emit(sink, TokenType.STRING_INTERP_END, segmentOffset, cursor.offset() - segmentOffset,
                            segmentLine, segmentColumn);
                } else {
                    emit(sink, TokenType.STRING, startOffset, cursor.offset() + 1 - startOffset,
                            startLine, startColumn);
                }
                cursor.advance(1);
                return emitted + 1;
            } else if (c == '{') {
                emit(sink, interpolated ? TokenType.STRING_INTERP_MID : TokenType.STRING_INTERP_BEG,
                        segmentOffset, cursor.offset() - segmentOffset, segmentLine, segmentColumn);
                emitted++;
                interpolated = true;
                cursor.advance(1);

                while (true) {
                    skipTrivia(cursor, sink);
                    if (cursor.isAtEnd()) {
                        throw error(LexicalErrorKind.UNTERMINATED_INTERPOLATED_STRING, startLine, startColumn);
                    }
                    if (cursor.peek() == '}') {
                        break;
                    }
                    emitted += consumeToken(cursor, sink);
                }
                cursor.advance(1);

                segmentOffset = cursor.offset();
                segmentLine = cursor.line();
                segmentColumn = cursor.column();
            } else if (c == '\n') {
                cursor.newline(sink);
            } else {
                cursor.advance(1);
            }
        }

        throw error(LexicalErrorKind.UNTERMINATED_INTERPOLATED_STRING, startLine, startColumn);
    }

    /**
     * Scans a string or character literal with a one or two character prefix. The
     * escape {@code \<quote>} never terminates the literal; newlines do not either.
     */
    private int quoted(Cursor cursor, TokenStream.Builder sink, int prefixLength, char quote,
                       TokenType type, LexicalErrorKind unterminated) throws LexicalException {
        int startOffset = cursor.offset();
        int startLine = cursor.line();
        int startColumn = cursor.column();
        String escapedQuote = "\\" + quote;
        cursor.advance(prefixLength);

        while (!cursor.isAtEnd()) {
            if (cursor.startsWith(escapedQuote)) {
                cursor.advance(2);
                continue;
            }

            char c = cursor.peek();
            if (c == quote) {
                cursor.advance(1);
                emit(sink, type, startOffset, cursor.offset() - startOffset, startLine, startColumn);
                return 1;
            }
            if (c == '\n') {
                cursor.newline(sink);
            } else {
                cursor.advance(1);
            }
        }

        throw error(unterminated, startLine, startColumn);
    }

    private int identifier(Cursor cursor, TokenStream.Builder sink) {
        int startOffset = cursor.offset();
        int column = cursor.column();
        cursor.advance(1);
        while (isAlphaNumeric(cursor.peek())) {
            cursor.advance(1);
        }

        String text = source.substring(startOffset, cursor.offset());
        TokenType type = KeywordTable.lookup(text, options.keywordMatching());
        emit(sink, type != null ? type : TokenType.IDENT, startOffset, text.length(), cursor.line(), column);
        return 1;
    }

    /**
     * Scans a numeric literal. Integers and floats both become {@link TokenType#NUM};
     * neither digit grouping nor range is validated here.
     */
    private int number(Cursor cursor, TokenStream.Builder sink) {
        int startOffset = cursor.offset();
        int column = cursor.column();

        if (cursor.startsWith("0x")) {
            cursor.advance(2);
            while (isHexDigit(cursor.peek()) || cursor.peek() == '_') cursor.advance(1);
        } else if (cursor.startsWith("0o")) {
            cursor.advance(2);
            while ((cursor.peek() >= '0' && cursor.peek() <= '7') || cursor.peek() == '_') cursor.advance(1);
        } else if (cursor.startsWith("0b")) {
            cursor.advance(2);
            while (cursor.peek() == '0' || cursor.peek() == '1' || cursor.peek() == '_') cursor.advance(1);
        } else {
            // whole part
            cursor.advance(1);
            skipDecimalDigits(cursor);

            // fractional part
            if (cursor.peek() == '.') {
                cursor.advance(1);
                skipDecimalDigits(cursor);
            }

            // exponent
            if (cursor.peek() == 'e' || cursor.peek() == 'E') {
                cursor.advance(1);
                if (cursor.peek() == '+' || cursor.peek() == '-') {
                    cursor.advance(1);
                }
                skipDecimalDigits(cursor);
            }
        }

        emit(sink, TokenType.NUM, startOffset, cursor.offset() - startOffset, cursor.line(), column);
        return 1;
    }

    private void skipDecimalDigits(Cursor cursor) {
        while (isDigit(cursor.peek()) || cursor.peek() == '_') {
            cursor.advance(1);
        }
    }

    private void emit(TokenStream.Builder sink, TokenType type, int offset, int length, int line, int column) {
        TokenSpan span = new TokenSpan(source, offset, length, line, column);
        sink.emit(type, span);
        if (LOG.isTraceEnabled()) {
            LOG.trace("{}:{}:{} {} '{}'", logicalFileName, line, column, type, span.text());
        }
    }

    private LexicalException error(LexicalErrorKind kind, int line, int column) {
        return new LexicalException(kind, logicalFileName, line, column);
    }

    private boolean isWhitespace(char c) {
        return c == ' ' || c == '\t' || c == '\r' || c == '\f';
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isHexDigit(char c) {
        return isDigit(c) || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }

    private boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') ||
                (c >= 'A' && c <= 'Z') ||
                c == '_';
    }

    private boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }
}
