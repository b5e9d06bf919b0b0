package org.feather.cli.commands;

import org.feather.cli.CommandLineInterface;
import org.feather.compiler.Tokenizer;
import org.feather.compiler.api.CompilationException;
import org.feather.compiler.api.CompilerErrorCode;
import org.feather.compiler.frontend.lexer.TokenStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Tokenizes source files and prints their token tables.
 * <p>
 * Exit codes: 0 on success, 1 if any file has a lexical error, 2 if any file cannot be read.
 */
@Command(
    name = "tokenize",
    description = "Tokenize source files and print one line per token"
)
public class TokenizeCommand implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(TokenizeCommand.class);

    static final int EXIT_LEXICAL_ERROR = 1;
    static final int EXIT_IO_ERROR = 2;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Parameters(arity = "1..*", paramLabel = "FILE", description = "Source files to tokenize")
    private List<Path> files;

    @Option(names = {"-s", "--summary"}, description = "Print only the token and line counts per file")
    private boolean summary;

    @Override
    public Integer call() {
        final Tokenizer tokenizer = Tokenizer.fromConfig(parent.getConfig());
        final PrintWriter out = spec.commandLine().getOut();
        final PrintWriter err = spec.commandLine().getErr();
        int exitCode = 0;

        for (final Path file : files) {
            try {
                final TokenStream tokens = tokenizer.tokenize(file);
                if (summary) {
                    out.printf("%s: %d tokens, %d lines%n", tokens.fileName(), tokens.size(), tokens.lineCount());
                } else {
                    out.print(tokens.format());
                }
            } catch (CompilationException e) {
                err.println(e.getMessage());
                final int code = e.getErrorCode() == CompilerErrorCode.IO_ERROR_READING_FILE
                        ? EXIT_IO_ERROR
                        : EXIT_LEXICAL_ERROR;
                exitCode = Math.max(exitCode, code);
            }
        }
        out.flush();
        err.flush();
        LOG.debug("Tokenized {} file(s), exit code {}", files.size(), exitCode);
        return exitCode;
    }
}
