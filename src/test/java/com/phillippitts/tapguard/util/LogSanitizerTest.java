package com.phillippitts.tapguard.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LogSanitizerTest {

    @Test
    void masksAllButLastFourCharacters() {
        assertThat(LogSanitizer.maskIdentifier("pi_3NkLs2ABC1234")).isEqualTo("****1234");
        assertThat(LogSanitizer.maskIdentifier("abcd")).isEqualTo("****");
        assertThat(LogSanitizer.maskIdentifier(null)).isEqualTo("-");
    }

    @Test
    void truncatesLongValues() {
        assertThat(LogSanitizer.truncate("short", 10)).isEqualTo("short");
        assertThat(LogSanitizer.truncate("0123456789abcdef", 10)).isEqualTo("0123456789");
        assertThat(LogSanitizer.truncate(null, 10)).isEmpty();
    }
}
