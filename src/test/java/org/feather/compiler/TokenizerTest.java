package org.feather.compiler;

import com.typesafe.config.ConfigFactory;
import org.feather.compiler.api.CompilationException;
import org.feather.compiler.api.CompilerErrorCode;
import org.feather.compiler.api.SourceInfo;
import org.feather.compiler.frontend.lexer.KeywordMatching;
import org.feather.compiler.frontend.lexer.TokenStream;
import org.feather.compiler.frontend.lexer.TokenType;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

/**
 * Tests the public {@link Tokenizer} entry point: successful runs, the translation of
 * lexical errors into {@link CompilationException}s and file handling.
 */
class TokenizerTest {

    @Test
    @Tag("unit")
    void tokenize_returnsCompleteStream() throws CompilationException {
        Tokenizer tokenizer = new Tokenizer();

        TokenStream tokens = tokenizer.tokenize("loop { break }", "main.fe");

        assertThat(tokens.types()).containsExactly(TokenType.LOOP, TokenType.L_BRACE, TokenType.BREAK, TokenType.R_BRACE);
        assertThat(tokens.fileName()).isEqualTo("main.fe");
        assertThat(tokenizer.getDiagnostics().hasErrors()).isFalse();
    }

    /**
     * Verifies that a lexical error carries its error code and the position and text of
     * the offending line, and that it is recorded in the diagnostics.
     */
    @Test
    @Tag("unit")
    void tokenize_translatesLexicalErrors() {
        // Arrange
        Tokenizer tokenizer = new Tokenizer();

        // Act
        CompilationException e = catchThrowableOfType(
                () -> tokenizer.tokenize("a = 1\nb = 'x", "main.fe"), CompilationException.class);

        // Assert
        assertThat(e.getErrorCode()).isEqualTo(CompilerErrorCode.UNTERMINATED_CHAR);
        assertThat(e.getSourceInfo()).isEqualTo(new SourceInfo("main.fe", 2, 5, "b = 'x"));
        assertThat(e.getMessage()).isEqualTo("main.fe:2:5: Unfinished char");
        assertThat(tokenizer.getDiagnostics().summary()).isEqualTo("main.fe:2:5: Unfinished char");
    }

    @Test
    @Tag("unit")
    void fromConfig_appliesLexerBlock() throws CompilationException {
        Tokenizer tokenizer = Tokenizer.fromConfig(ConfigFactory.parseString("feather.lexer.keyword-matching = PREFIX"));

        assertThat(tokenizer.getOptions().keywordMatching()).isEqualTo(KeywordMatching.PREFIX);
        assertThat(tokenizer.tokenize("ifx", "p.fe").type(0)).isEqualTo(TokenType.IF);
    }

    @Test
    @Tag("unit")
    void fromConfig_withoutLexerBlockUsesDefaults() {
        Tokenizer tokenizer = Tokenizer.fromConfig(ConfigFactory.empty());

        assertThat(tokenizer.getOptions().keywordMatching()).isEqualTo(KeywordMatching.EXACT);
    }

    @Test
    @Tag("integration")
    void tokenize_readsUtf8Files(@TempDir Path dir) throws IOException, CompilationException {
        Path file = dir.resolve("greet.fe");
        Files.writeString(file, "print(\"grüße\")\n", StandardCharsets.UTF_8);

        TokenStream tokens = new Tokenizer().tokenize(file);

        assertThat(tokens.types()).containsExactly(
                TokenType.IDENT, TokenType.L_PARENS, TokenType.STRING, TokenType.R_PARENS);
        assertThat(tokens.text(2)).isEqualTo("\"grüße\"");
        assertThat(tokens.lineBreaks().toIntArray()).containsExactly(14);
    }

    @Test
    @Tag("integration")
    void tokenize_reportsUnreadableFiles(@TempDir Path dir) {
        Tokenizer tokenizer = new Tokenizer();

        CompilationException e = catchThrowableOfType(
                () -> tokenizer.tokenize(dir.resolve("missing.fe")), CompilationException.class);

        assertThat(e.getErrorCode()).isEqualTo(CompilerErrorCode.IO_ERROR_READING_FILE);
        assertThat(e.getSourceInfo()).isNull();
        assertThat(tokenizer.getDiagnostics().hasErrors()).isTrue();
    }
}
