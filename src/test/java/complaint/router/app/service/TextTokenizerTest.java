package complaint.router.app.service;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TextTokenizerTest {

    @Test
    void cleanStripsHtmlAndCollapsesWhitespace() {
        String cleaned = TextTokenizer.clean("<p>Hello&nbsp;<b>World</b></p>\n\n  Again");

        assertEquals("hello world again", cleaned);
    }

    @Test
    void tokenizeSplitsOnPunctuationAndKeepsContractions() {
        List<String> tokens = TextTokenizer.tokenize("Don't do that! The service, again?");

        assertEquals(List.of("don't", "do", "that", "the", "service", "again"), tokens);
    }

    @Test
    void tokenizeHandlesNullAndBlank() {
        assertTrue(TextTokenizer.tokenize(null).isEmpty());
        assertTrue(TextTokenizer.tokenize("   ").isEmpty());
    }

    @Test
    void normalizeTermMatchesTokenizerForm() {
        assertEquals("not working", TextTokenizer.normalizeTerm("  Not   Working "));
        assertEquals("", TextTokenizer.normalizeTerm("   "));
    }
}
