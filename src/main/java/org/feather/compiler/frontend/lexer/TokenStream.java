package org.feather.compiler.frontend.lexer;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;
import org.feather.compiler.util.AppendOnlyList;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * The result of scanning one source file: the source text, the offsets of all
 * line breaks and two index-aligned sequences holding the span and type of every
 * token. {@code span(i)} and {@code type(i)} always describe the same token.
 * <p>
 * A stream is populated once through its {@link Builder} and is immutable afterwards.
 */
public final class TokenStream {

    private final String source;
    private final String fileName;
    private final IntArrayList lineBreaks;
    private final AppendOnlyList<TokenSpan> spans;
    private final AppendOnlyList<TokenType> types;

    private TokenStream(Builder builder) {
        this.source = builder.source;
        this.fileName = builder.fileName;
        this.lineBreaks = builder.lineBreaks;
        this.spans = builder.spans;
        this.types = builder.types;
    }

    /**
     * Creates a builder for the stream of the given source.
     *
     * @param source       The complete source text.
     * @param fileName     The logical file name, used in diagnostics.
     * @param capacityHint The number of tokens to reserve room for.
     * @return A new, empty builder.
     */
    public static Builder builder(String source, String fileName, int capacityHint) {
        return new Builder(source, fileName, capacityHint);
    }

    public String source() {
        return source;
    }

    public String fileName() {
        return fileName;
    }

    /**
     * @return The number of tokens in the stream.
     */
    public int size() {
        return types.size();
    }

    public boolean isEmpty() {
        return types.isEmpty();
    }

    public TokenType type(int index) {
        return types.get(index);
    }

    public TokenSpan span(int index) {
        return spans.get(index);
    }

    public String text(int index) {
        return spans.get(index).text();
    }

    /**
     * @param index The token index.
     * @return The token at {@code index} as a single object.
     */
    public Token get(int index) {
        TokenSpan span = spans.get(index);
        return new Token(types.get(index), span.text(), span.line(), span.column(), fileName);
    }

    /**
     * @return All tokens in source order.
     */
    public List<Token> tokens() {
        List<Token> result = new ArrayList<>(size());
        for (int i = 0; i < size(); i++) {
            result.add(get(i));
        }
        return Collections.unmodifiableList(result);
    }

    public List<TokenType> types() {
        return types.asList();
    }

    public List<TokenSpan> spans() {
        return spans.asList();
    }

    /**
     * @return The strictly increasing offsets of every {@code '\n'} in the source.
     */
    public IntList lineBreaks() {
        return IntLists.unmodifiable(lineBreaks);
    }

    /**
     * @return The number of lines in the source; a source without line breaks has one.
     */
    public int lineCount() {
        return lineBreaks.size() + 1;
    }

    /**
     * Finds the line containing an offset. A line break belongs to the line it ends.
     *
     * @param offset An offset in {@code [0, source.length()]}.
     * @return The 1-based line number.
     */
    public int lineOf(int offset) {
        if (offset < 0 || offset > source.length()) {
            throw new IndexOutOfBoundsException("Offset " + offset + " outside source of length " + source.length());
        }
        int index = Arrays.binarySearch(lineBreaks.elements(), 0, lineBreaks.size(), offset);
        return index >= 0 ? index + 1 : -index;
    }

    /**
     * Returns the text of a line without its terminating newline.
     *
     * @param line A 1-based line number.
     * @return The line's text.
     */
    public String lineContent(int line) {
        if (line < 1 || line > lineCount()) {
            throw new IndexOutOfBoundsException("Line " + line + " outside 1.." + lineCount());
        }
        int start = line == 1 ? 0 : lineBreaks.getInt(line - 2) + 1;
        int end = line - 1 < lineBreaks.size() ? lineBreaks.getInt(line - 1) : source.length();
        return source.substring(start, end);
    }

    /**
     * Renders one line per token as {@code <line>:<col>   <TYPE>   <text>}, with each
     * field padded to the widest value in the stream. Meant for debugging, not for machines.
     *
     * @return The formatted table, empty for an empty stream.
     */
    public String format() {
        int lineWidth = 1;
        int columnWidth = 1;
        int typeWidth = 1;
        for (int i = 0; i < size(); i++) {
            TokenSpan span = spans.get(i);
            lineWidth = Math.max(lineWidth, String.valueOf(span.line()).length());
            columnWidth = Math.max(columnWidth, String.valueOf(span.column()).length());
            typeWidth = Math.max(typeWidth, types.get(i).name().length());
        }

        String pattern = "%" + lineWidth + "d:%-" + columnWidth + "d   %-" + typeWidth + "s   %s\n";
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < size(); i++) {
            TokenSpan span = spans.get(i);
            sb.append(String.format(pattern, span.line(), span.column(), types.get(i).name(), span.text()));
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return format();
    }

    /**
     * The append-only sink the {@link Lexer} writes into while scanning. Shared by
     * every nested scan of one file.
     */
    public static final class Builder {

        private final String source;
        private final String fileName;
        private final IntArrayList lineBreaks;
        private final AppendOnlyList<TokenSpan> spans;
        private final AppendOnlyList<TokenType> types;
        private boolean built = false;

        private Builder(String source, String fileName, int capacityHint) {
            this.source = source;
            this.fileName = fileName;
            this.lineBreaks = new IntArrayList(Math.max(16, capacityHint / 8));
            this.spans = new AppendOnlyList<>(capacityHint);
            this.types = new AppendOnlyList<>(capacityHint);
        }

        /**
         * Records the offset of a {@code '\n'}. Offsets must be strictly increasing.
         *
         * @param offset The offset of the newline character.
         */
        public void lineBreak(int offset) {
            checkOpen();
            if (source.charAt(offset) != '\n') {
                throw new IllegalArgumentException("No newline at offset " + offset);
            }
            if (!lineBreaks.isEmpty() && lineBreaks.getInt(lineBreaks.size() - 1) >= offset) {
                throw new IllegalArgumentException("Line break at " + offset + " is not after the previous one");
            }
            lineBreaks.add(offset);
        }

        /**
         * Appends a token.
         *
         * @param type The token type.
         * @param span The token's span; must point into this builder's source.
         */
        public void emit(TokenType type, TokenSpan span) {
            checkOpen();
            if (span.source() != source) {
                throw new IllegalArgumentException("Span does not point into the source being scanned");
            }
            types.add(type);
            spans.add(span);
        }

        /**
         * Completes the stream. The builder cannot be used afterwards.
         *
         * @return The finished stream.
         */
        public TokenStream build() {
            checkOpen();
            built = true;
            return new TokenStream(this);
        }

        private void checkOpen() {
            if (built) {
                throw new IllegalStateException("TokenStream for " + fileName + " has already been built");
            }
        }
    }
}
