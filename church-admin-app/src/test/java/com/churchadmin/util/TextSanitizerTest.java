package com.churchadmin.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TextSanitizerTest {

    @Test
    void stripsTags() {
        assertThat(TextSanitizer.sanitizeText("<script>alert(1)</script>Thank <b>you</b>")).isEqualTo("Thank you");
    }

    @Test
    void decodesEntities() {
        assertThat(TextSanitizer.sanitizeText("Tom &amp; Jerry")).isEqualTo("Tom & Jerry");
    }

    @Test
    void blankBecomesNull() {
        assertThat(TextSanitizer.sanitizeText("  ")).isNull();
        assertThat(TextSanitizer.sanitizeText("<br>")).isNull();
        assertThat(TextSanitizer.sanitizeText(null)).isNull();
    }

    @Test
    void emailsAreLowerCased() {
        assertThat(TextSanitizer.sanitizeEmail(" Ann.Lee@Example.COM ")).isEqualTo("ann.lee@example.com");
    }
}
