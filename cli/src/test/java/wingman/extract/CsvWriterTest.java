package wingman.extract;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.io.StringWriter;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

@DisplayName("CsvWriter")
class CsvWriterTest {

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "plain|plain",
            "a,b|\"a,b\"",
            "say \"hi\"|\"say \"\"hi\"\"\""
    })
    @DisplayName("should quote only fields that need it")
    void shouldQuoteWhenNeeded(String field, String expected) {
        assertEquals(expected, CsvWriter.escape(field));
    }

    @Test
    @DisplayName("should quote fields spanning lines")
    void shouldQuoteMultiline() {
        assertEquals("\"IF(A,\n  B)\"", CsvWriter.escape("IF(A,\n  B)"));
        assertEquals("\"x\ry\"", CsvWriter.escape("x\ry"));
    }

    @Test
    @DisplayName("should terminate rows with CRLF and write null as empty")
    void shouldWriteRows() throws Exception {
        StringWriter out = new StringWriter();
        try (CsvWriter csv = new CsvWriter(out)) {
            csv.writeRow(List.of("Object", "Label"));
            csv.writeRow(Arrays.asList("Account", null));
        }

        assertThat(out.toString()).isEqualTo("Object,Label\r\nAccount,\r\n");
    }
}
