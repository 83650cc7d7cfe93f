package com.urdfix.core.util;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class NamingConventionsTest {

    @ParameterizedTest
    @ValueSource(strings = {"base_link", "_private", "Link2", "a"})
    void isValidName_conventionalNames_returnsTrue(String name) {
        assertThat(NamingConventions.isValidName(name)).isTrue();
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "2nd", "upper-arm", "has space", "café"})
    void isValidName_otherNames_returnsFalse(String name) {
        assertThat(NamingConventions.isValidName(name)).isFalse();
    }

    @ParameterizedTest
    @CsvSource({
        "Upper-Arm, upper_arm",
        "'Base Link', base_link",
        "2nd.link, _2ndlink",
        "'!!!', unnamed",
        "already_valid, already_valid"
    })
    void fixName_rewritesToValidName(String input, String expected) {
        String fixed = NamingConventions.fixName(input);

        assertThat(fixed).isEqualTo(expected);
        assertThat(NamingConventions.isValidName(fixed)).isTrue();
        assertThat(NamingConventions.fixName(fixed)).isEqualTo(fixed);
    }
}
