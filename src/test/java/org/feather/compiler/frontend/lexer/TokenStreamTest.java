package org.feather.compiler.frontend.lexer;

import org.feather.compiler.diagnostics.DiagnosticsEngine;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link TokenStream} and its builder.
 */
@Tag("unit")
class TokenStreamTest {

    @Test
    void format_alignsEveryColumn() throws LexicalException {
        // Arrange
        TokenStream tokens = new Lexer("fn main() {\n    x -> 10\n}", new DiagnosticsEngine()).scanTokens();

        // Act
        String table = tokens.format();

        // Assert
        assertThat(table.split("\n")).containsExactly(
                "1:0    FN         fn",
                "1:3    IDENT      main",
                "1:7    L_PARENS   (",
                "1:8    R_PARENS   )",
                "1:10   L_BRACE    {",
                "2:4    IDENT      x",
                "2:6    ARROW      ->",
                "2:9    NUM        10",
                "3:0    R_BRACE    }");
        assertThat(tokens.toString()).isEqualTo(table);
    }

    @Test
    void format_ofEmptyStreamIsEmpty() {
        TokenStream tokens = TokenStream.builder("", "empty.fe", 0).build();

        assertThat(tokens.format()).isEmpty();
        assertThat(tokens.lineCount()).isEqualTo(1);
    }

    @Test
    void lineOf_assignsLineBreaksToTheLineTheyEnd() throws LexicalException {
        TokenStream tokens = new Lexer("ab\ncd\n", new DiagnosticsEngine()).scanTokens();

        assertThat(tokens.lineCount()).isEqualTo(3);
        assertThat(tokens.lineOf(0)).isEqualTo(1);
        assertThat(tokens.lineOf(2)).isEqualTo(1);
        assertThat(tokens.lineOf(3)).isEqualTo(2);
        assertThat(tokens.lineOf(5)).isEqualTo(2);
        assertThat(tokens.lineOf(6)).isEqualTo(3);
        assertThatThrownBy(() -> tokens.lineOf(7)).isInstanceOf(IndexOutOfBoundsException.class);
    }

    @Test
    void lineContent_returnsLinesWithoutNewline() throws LexicalException {
        TokenStream tokens = new Lexer("ab\ncd\n", new DiagnosticsEngine()).scanTokens();

        assertThat(tokens.lineContent(1)).isEqualTo("ab");
        assertThat(tokens.lineContent(2)).isEqualTo("cd");
        assertThat(tokens.lineContent(3)).isEmpty();
        assertThatThrownBy(() -> tokens.lineContent(4)).isInstanceOf(IndexOutOfBoundsException.class);
    }

    @Test
    void get_combinesTypeAndSpan() throws LexicalException {
        TokenStream tokens = new Lexer("  while", new DiagnosticsEngine()).scanTokens();

        assertThat(tokens.get(0)).isEqualTo(new Token(TokenType.WHILE, "while", 1, 2, "<memory>"));
        assertThat(tokens.spans()).hasSize(1);
        assertThat(tokens.types()).hasSize(1);
    }

    @Test
    void views_areReadOnly() throws LexicalException {
        TokenStream tokens = new Lexer("a\nb", new DiagnosticsEngine()).scanTokens();

        assertThatThrownBy(() -> tokens.types().add(TokenType.NUM)).isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> tokens.tokens().clear()).isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> tokens.lineBreaks().add(9)).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void builder_rejectsOutOfOrderLineBreaks() {
        TokenStream.Builder builder = TokenStream.builder("a\nb\n", "x.fe", 4);
        builder.lineBreak(3);

        assertThatThrownBy(() -> builder.lineBreak(1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> builder.lineBreak(2)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void builder_rejectsSpansOfAnotherSource() {
        String source = "abc";
        TokenStream.Builder builder = TokenStream.builder(source, "x.fe", 4);
        TokenSpan foreign = new TokenSpan(new String("abc"), 0, 1, 1, 0);

        assertThatThrownBy(() -> builder.emit(TokenType.IDENT, foreign)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void builder_cannotBeUsedAfterBuild() {
        String source = "abc";
        TokenStream.Builder builder = TokenStream.builder(source, "x.fe", 4);
        builder.emit(TokenType.IDENT, new TokenSpan(source, 0, 3, 1, 0));
        TokenStream tokens = builder.build();

        assertThat(tokens.size()).isEqualTo(1);
        assertThatThrownBy(builder::build).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> builder.emit(TokenType.IDENT, new TokenSpan(source, 0, 1, 1, 0)))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void span_rejectsRangesOutsideTheSource() {
        assertThatThrownBy(() -> new TokenSpan("abc", 2, 2, 1, 2)).isInstanceOf(IllegalArgumentException.class);
        assertThat(new TokenSpan("abc", 1, 2, 1, 1).text()).isEqualTo("bc");
    }
}
