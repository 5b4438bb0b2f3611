package com.llmrouter.cache;

import com.llmrouter.model.MediaType;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;

class FingerprintTest {

    @Test
    void sameInputsGiveSameKey() {
        String key = Fingerprint.of("Claude 4 is out", MediaType.TEXT, "Summarize: {content}");

        assertEquals(32, key.length());
        assertEquals(key, Fingerprint.of("Claude 4 is out", MediaType.TEXT, "Summarize: {content}"));
    }

    @Test
    void whitespaceDifferencesInContentShareKey() {
        assertEquals(
                Fingerprint.of("Claude 4\n\nis out", MediaType.TEXT, "t"),
                Fingerprint.of("  Claude 4 is   out ", MediaType.TEXT, "t"));
    }

    @Test
    void mediaTypeAndTemplateArePartOfKey() {
        String base = Fingerprint.of("post", MediaType.TEXT, "t1");

        assertNotEquals(base, Fingerprint.of("post", MediaType.IMAGE, "t1"));
        assertNotEquals(base, Fingerprint.of("post", MediaType.TEXT, "t2"));
    }

    @Test
    void separatorCharactersCannotMovePartBoundaries() {
        assertNotEquals(
                Fingerprint.of("a|text|b", MediaType.TEXT, "T"),
                Fingerprint.of("a", MediaType.TEXT, "b|text|T"));
        assertNotEquals(
                Fingerprint.of("post:", MediaType.TEXT, "5:t"),
                Fingerprint.of("post", MediaType.TEXT, ":5:t"));
    }
}
