package org.feather.compiler;

import com.typesafe.config.Config;
import org.feather.compiler.api.CompilationException;
import org.feather.compiler.api.CompilerErrorCode;
import org.feather.compiler.api.ITokenizer;
import org.feather.compiler.api.SourceInfo;
import org.feather.compiler.diagnostics.DiagnosticsEngine;
import org.feather.compiler.frontend.lexer.Lexer;
import org.feather.compiler.frontend.lexer.LexerOptions;
import org.feather.compiler.frontend.lexer.LexicalException;
import org.feather.compiler.frontend.lexer.TokenStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * The front-end implementation. Runs the {@link Lexer} over one file at a time and
 * translates lexical failures into {@link CompilationException}s. It is not thread-safe:
 * the diagnostics of all files tokenized by one instance accumulate in one engine.
 */
public class Tokenizer implements ITokenizer {

    private static final Logger LOG = LoggerFactory.getLogger(Tokenizer.class);
    private static final String LEXER_CONFIG_PATH = "feather.lexer";

    private final DiagnosticsEngine diagnostics = new DiagnosticsEngine();
    private final LexerOptions options;

    public Tokenizer() {
        this(LexerOptions.DEFAULTS);
    }

    public Tokenizer(LexerOptions options) {
        this.options = options;
    }

    /**
     * Creates a tokenizer configured from the {@code feather.lexer} block of the given config.
     * @param config The application configuration.
     * @return The tokenizer.
     */
    public static Tokenizer fromConfig(Config config) {
        if (!config.hasPath(LEXER_CONFIG_PATH)) {
            return new Tokenizer();
        }
        return new Tokenizer(LexerOptions.fromConfig(config.getConfig(LEXER_CONFIG_PATH)));
    }

    @Override
    public TokenStream tokenize(String source, String fileName) throws CompilationException {
        Lexer lexer = new Lexer(source, diagnostics, fileName, options);
        try {
            return lexer.scanTokens();
        } catch (LexicalException e) {
            LOG.debug("Tokenization of {} failed: {}", fileName, e.getMessage());
            String lineContent = lineContent(source, e.getLine());
            SourceInfo sourceInfo = new SourceInfo(fileName, e.getLine(), e.getColumn() + 1, lineContent);
            throw new CompilationException(
                    CompilerErrorCode.valueOf(e.getKind().name()), e.getMessage(), sourceInfo, e);
        }
    }

    @Override
    public TokenStream tokenize(Path file) throws CompilationException {
        String fileName = file.toString().replace('\\', '/');
        String source;
        try {
            source = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            String message = fileName + ": cannot read file: " + e.getMessage();
            diagnostics.reportError("cannot read file: " + e.getMessage(), fileName, 0, 0);
            throw new CompilationException(CompilerErrorCode.IO_ERROR_READING_FILE, message, null, e);
        }
        return tokenize(source, fileName);
    }

    /**
     * @return The engine holding the diagnostics of every file tokenized so far.
     */
    public DiagnosticsEngine getDiagnostics() {
        return diagnostics;
    }

    public LexerOptions getOptions() {
        return options;
    }

    private static String lineContent(String source, int line) {
        int start = 0;
        for (int i = 1; i < line; i++) {
            int next = source.indexOf('\n', start);
            if (next < 0) {
                return "";
            }
            start = next + 1;
        }
        int end = source.indexOf('\n', start);
        return source.substring(start, end < 0 ? source.length() : end);
    }
}
