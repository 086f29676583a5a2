package io.sentex.core;

import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SentexConfigurationPropertiesTest {

    @Test
    void bindsRecognisedKeys() {
        Properties properties = new Properties();
        properties.setProperty("sentex.min-match-count", " 2 ");
        properties.setProperty("sentex.case-sensitive", "TRUE");
        properties.setProperty("sentex.strict-tokens", "false");
        properties.setProperty("sentex.unknown", "ignored");

        SentexConfiguration config = SentexConfigurationProperties.fromProperties(properties).toConfiguration();

        assertThat(config.minMatchCount()).isEqualTo(2);
        assertThat(config.caseSensitive()).isTrue();
        assertThat(config.strictTokens()).isFalse();
    }

    @Test
    void missingKeysKeepDefaults() {
        SentexConfigurationProperties bound = SentexConfigurationProperties.fromProperties(new Properties());

        assertThat(bound.getMinMatchCount()).isEqualTo(SentexConfiguration.DEFAULT_MIN_MATCH_COUNT);
        assertThat(bound.isCaseSensitive()).isFalse();
        assertThat(bound.isStrictTokens()).isFalse();
    }

    @Test
    void rejectsNonIntegerMinMatchCount() {
        Properties properties = new Properties();
        properties.setProperty("sentex.min-match-count", "many");

        assertThatThrownBy(() -> SentexConfigurationProperties.fromProperties(properties))
                .isInstanceOf(InvalidInputException.class)
                .hasMessageContaining("sentex.min-match-count")
                .hasCauseInstanceOf(NumberFormatException.class);
    }

    @Test
    void rejectsNonBooleanFlag() {
        Properties properties = new Properties();
        properties.setProperty("sentex.strict-tokens", "yes");

        assertThatThrownBy(() -> SentexConfigurationProperties.fromProperties(properties))
                .isInstanceOf(InvalidInputException.class)
                .hasMessageContaining("sentex.strict-tokens");
    }

    @Test
    void toConfigurationValidatesMinMatchCount() {
        SentexConfigurationProperties bound = new SentexConfigurationProperties();
        bound.setMinMatchCount(0);

        assertThatThrownBy(bound::toConfiguration).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void loadsClasspathResource() {
        SentexConfiguration config = SentexConfigurationProperties.load("sentex-test.properties").toConfiguration();

        assertThat(config.minMatchCount()).isEqualTo(2);
        assertThat(config.strictTokens()).isTrue();
        assertThat(config.caseSensitive()).isFalse();
    }

    @Test
    void missingResourceYieldsDefaults() {
        SentexConfiguration config = SentexConfigurationProperties.load("no-such-sentex.properties").toConfiguration();

        assertThat(config.minMatchCount()).isEqualTo(1);
        assertThat(config.strictTokens()).isFalse();
    }
}
