package org.feather.compiler.frontend.lexer;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.feather.compiler.diagnostics.DiagnosticsEngine;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Verifies what the {@link Lexer} logs at DEBUG and TRACE level.
 */
@Tag("unit")
class LexerLoggingTest {

    private final Logger lexerLogger = (Logger) LoggerFactory.getLogger(Lexer.class);
    private final ListAppender<ILoggingEvent> appender = new ListAppender<>();
    private Level previousLevel;

    @BeforeEach
    void attachAppender() {
        previousLevel = lexerLogger.getLevel();
        appender.start();
        lexerLogger.addAppender(appender);
    }

    @AfterEach
    void detachAppender() {
        lexerLogger.detachAppender(appender);
        lexerLogger.setLevel(previousLevel);
        appender.stop();
    }

    @Test
    void logsSummaryAtDebug() throws LexicalException {
        lexerLogger.setLevel(Level.DEBUG);

        new Lexer("a + b\nc", new DiagnosticsEngine()).scanTokens();

        assertThat(appender.list).extracting(ILoggingEvent::getFormattedMessage)
                .containsExactly("Scanned <memory>: 4 tokens on 2 lines");
    }

    /**
     * The summary counts tokens emitted inside nested groups as well.
     */
    @Test
    void summaryCountsTokensOfNestedGroups() throws LexicalException {
        lexerLogger.setLevel(Level.DEBUG);

        new Lexer("f(a, [b])", new DiagnosticsEngine()).scanTokens();

        assertThat(appender.list).extracting(ILoggingEvent::getFormattedMessage)
                .containsExactly("Scanned <memory>: 8 tokens on 1 lines");
    }

    @Test
    void logsEveryTokenAtTrace() throws LexicalException {
        lexerLogger.setLevel(Level.TRACE);

        new Lexer("x->", new DiagnosticsEngine()).scanTokens();

        assertThat(appender.list).extracting(ILoggingEvent::getFormattedMessage)
                .containsExactly("<memory>:1:0 IDENT 'x'", "<memory>:1:1 ARROW '->'", "Scanned <memory>: 2 tokens on 1 lines");
    }

    @Test
    void staysSilentAtWarn() throws LexicalException {
        lexerLogger.setLevel(Level.WARN);

        new Lexer("x", new DiagnosticsEngine()).scanTokens();

        assertThat(appender.list).isEmpty();
    }
}
