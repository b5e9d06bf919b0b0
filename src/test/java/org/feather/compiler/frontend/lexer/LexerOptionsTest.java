package org.feather.compiler.frontend.lexer;

import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class LexerOptionsTest {

    @Test
    void fromConfig_readsAllKeys() {
        LexerOptions options = LexerOptions.fromConfig(ConfigFactory.parseString("""
                keyword-matching = "PREFIX"
                capacity-hint = 64
                """));

        assertThat(options).isEqualTo(new LexerOptions(KeywordMatching.PREFIX, 64));
    }

    @Test
    void fromConfig_fallsBackToDefaults() {
        assertThat(LexerOptions.fromConfig(ConfigFactory.empty())).isEqualTo(LexerOptions.DEFAULTS);
    }

    @Test
    void fromConfig_rejectsUnknownPolicy() {
        assertThatThrownBy(() -> LexerOptions.fromConfig(ConfigFactory.parseString("keyword-matching = FUZZY")))
                .isInstanceOf(ConfigException.BadValue.class);
    }

    @Test
    void referenceConfigMatchesDefaults() {
        LexerOptions options = LexerOptions.fromConfig(ConfigFactory.load().getConfig("feather.lexer"));

        assertThat(options).isEqualTo(LexerOptions.DEFAULTS);
    }

    @Test
    void rejectsNegativeCapacity() {
        assertThatThrownBy(() -> new LexerOptions(KeywordMatching.EXACT, -1))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
