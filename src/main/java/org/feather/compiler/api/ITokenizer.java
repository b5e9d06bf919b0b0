package org.feather.compiler.api;

import org.feather.compiler.frontend.lexer.TokenStream;

import java.nio.file.Path;

/**
 * The public entry point of the lexical front end.
 */
public interface ITokenizer {

    /**
     * Tokenizes a source text.
     *
     * @param source The complete source text.
     * @param fileName The logical file name, used in diagnostics.
     * @return The complete token stream.
     * @throws CompilationException if the source contains a lexical error.
     */
    TokenStream tokenize(String source, String fileName) throws CompilationException;

    /**
     * Reads a UTF-8 file and tokenizes it.
     *
     * @param file The file to read.
     * @return The complete token stream.
     * @throws CompilationException if the file cannot be read or contains a lexical error.
     */
    TokenStream tokenize(Path file) throws CompilationException;
}
