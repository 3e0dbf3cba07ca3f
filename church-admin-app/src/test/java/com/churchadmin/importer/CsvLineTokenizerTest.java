package com.churchadmin.importer;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CsvLineTokenizerTest {

    @Test
    void commaInsideQuotesIsPartOfTheField() {
        assertThat(CsvLineTokenizer.tokenize("a,\"b,c\",d")).containsExactly("a", "b,c", "d");
    }

    @Test
    void doubledQuoteInsideQuotesIsALiteralQuote() {
        assertThat(CsvLineTokenizer.tokenize("\"say \"\"hi\"\"\",x")).containsExactly("say \"hi\"", "x");
    }

    @Test
    void trailingSeparatorYieldsEmptyLastField() {
        assertThat(CsvLineTokenizer.tokenize("a,b,")).containsExactly("a", "b", "");
    }

    @Test
    void emptyLineIsOneEmptyField() {
        assertThat(CsvLineTokenizer.tokenize("")).containsExactly("");
    }

    @Test
    void whitespaceIsKept() {
        assertThat(CsvLineTokenizer.tokenize(" 12 , 50.00")).containsExactly(" 12 ", " 50.00");
    }
}
