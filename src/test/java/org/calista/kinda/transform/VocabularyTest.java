package org.calista.kinda.transform;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class VocabularyTest {

    @Test
    @DisplayName("close misspellings get a suggestion")
    void suggestions() {
        assertEquals("sometimes", Vocabulary.suggest("sometime"));
        assertEquals("maybe_for", Vocabulary.suggest("maybefor"));
        assertEquals("rarely", Vocabulary.suggest("rarley"));
        assertEquals("kinda", Vocabulary.suggest("kind"));
    }

    @Test
    @DisplayName("unrelated words get none")
    void noSuggestion() {
        assertNull(Vocabulary.suggest("banana_split"));
        assertNull(Vocabulary.suggest(""));
        assertNull(Vocabulary.suggest("str", Vocabulary.KINDA_TYPES));
    }

    @Test
    @DisplayName("edit distance")
    void distance() {
        assertEquals(0, Vocabulary.levenshtein("ish", "ish"));
        assertEquals(3, Vocabulary.levenshtein("", "ish"));
        assertEquals(2, Vocabulary.levenshtein("flaot", "float"));
    }

    @Test
    @DisplayName("keyword membership")
    void keywords() {
        assertTrue(Vocabulary.isKeyword("eventually_until"));
        assertFalse(Vocabulary.isKeyword("mask"));
        assertEquals(13, Vocabulary.KEYWORDS.size());
    }
}
