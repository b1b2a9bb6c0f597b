package com.eventwatch.core.form;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("FormUrlEncodedParser")
class FormUrlEncodedParserTest {

    @Test
    @DisplayName("should decode fields in arrival order")
    void shouldDecodeInOrder() {
        Map<String, List<String>> fields = FormUrlEncodedParser.parse(
                "title=Hello+World&comment=%3Cb%3Ehi%3C%2Fb%3E&tag=a&tag=b", StandardCharsets.UTF_8);

        assertEquals(List.of("title", "comment", "tag"), List.copyOf(fields.keySet()));
        assertEquals(List.of("Hello World"), fields.get("title"));
        assertEquals(List.of("<b>hi</b>"), fields.get("comment"));
        assertEquals(List.of("a", "b"), fields.get("tag"));
    }

    @Test
    @DisplayName("should keep malformed escapes verbatim")
    void shouldKeepMalformedEscapes() {
        Map<String, List<String>> fields = FormUrlEncodedParser.parse("discount=100%", StandardCharsets.UTF_8);

        assertEquals(List.of("100%"), fields.get("discount"));
    }

    @Test
    @DisplayName("should still decode the valid escapes around a malformed one")
    void shouldDecodeAroundMalformedEscape() {
        Map<String, List<String>> fields = FormUrlEncodedParser.parse(
                "comment=%3Cscript%3Ealert(1)%3C%2Fscript%3E%&note=caf%C3%A9+%ZZ+50%25", StandardCharsets.UTF_8);

        assertEquals(List.of("<script>alert(1)</script>%"), fields.get("comment"));
        assertEquals(List.of("caf\u00e9 %ZZ 50%"), fields.get("note"));
    }

    @Test
    @DisplayName("should treat a bare name as an empty value and skip nameless pairs")
    void shouldHandleEdgeCases() {
        Map<String, List<String>> fields = FormUrlEncodedParser.parse("flag&=orphan&&x=1", StandardCharsets.UTF_8);

        assertEquals(List.of(""), fields.get("flag"));
        assertEquals(2, fields.size());
    }

    @Test
    @DisplayName("should return an empty map for empty input")
    void shouldHandleEmptyInput() {
        assertTrue(FormUrlEncodedParser.parse("", StandardCharsets.UTF_8).isEmpty());
        assertTrue(FormUrlEncodedParser.parse(null, StandardCharsets.UTF_8).isEmpty());
    }
}
