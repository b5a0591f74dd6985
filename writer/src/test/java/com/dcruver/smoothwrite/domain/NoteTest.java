package com.dcruver.smoothwrite.domain;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for note creation and title derivation.
 */
class NoteTest {

    private static final Instant T0 = Instant.parse("2025-01-15T10:00:00Z");

    @Test
    void testCreateDefaults() {
        Note note = Note.create(T0);

        assertNotNull(note.getId());
        assertEquals("Untitled", note.getTitle());
        assertEquals("", note.getContent());
        assertEquals(T0, note.getCreatedAt());
        assertEquals(T0, note.getModifiedAt());
        assertFalse(note.isFavorite());
        assertNotEquals(note.getId(), Note.create(T0).getId());
    }

    @Test
    void testEmptyContentIsUntitled() {
        assertEquals("Untitled", Note.deriveTitle(""));
        assertEquals("Untitled", Note.deriveTitle("   \n  "));
        assertEquals("Untitled", Note.deriveTitle(null));
        assertEquals("Untitled", Note.deriveTitle("<p> </p><br/>"));
        assertEquals("Untitled", Note.deriveTitle("<html><head><title>x</title></head><body></body></html>"));
    }

    @Test
    void testTitleIsFirstLine() {
        assertEquals("Hello", Note.deriveTitle("Hello\nworld"));
        assertEquals("Hello", Note.deriveTitle("<p>Hello</p><p>world</p>"));
        assertEquals("Hello", Note.deriveTitle("<h1>Hello</h1>\n<p>world</p>"));
        assertEquals("Hello world", Note.deriveTitle("<p>Hello <b>world</b></p>"));
        assertEquals("First", Note.deriveTitle("\n\n   First   \nSecond"));
    }

    @Test
    void testLongTitleIsTruncated() {
        String fifty = "a".repeat(50);
        assertEquals(fifty, Note.deriveTitle(fifty));
        assertEquals(fifty + "...", Note.deriveTitle("a".repeat(60)));
        assertEquals(fifty + "...", Note.deriveTitle("<p>" + "a".repeat(51) + "</p><p>short</p>"));
    }

    @Test
    void testTruncationKeepsSurrogatePairsWhole() {
        String title = Note.deriveTitle("a".repeat(49) + "\uD83D\uDE00 more words here");

        assertEquals("a".repeat(49) + "\uD83D\uDE00...", title);
        assertEquals(50, title.codePointCount(0, title.length() - 3));
        assertFalse(Character.isHighSurrogate(title.charAt(title.length() - 4)));
    }

    @Test
    void testUpdateContentDerivesTitleAndTimestamp() {
        Note note = Note.create(T0);
        Instant later = T0.plusSeconds(30);

        note.updateContent("<h1>Groceries</h1><ul><li>milk</li></ul>", later);

        assertEquals("Groceries", note.getTitle());
        assertEquals(later, note.getModifiedAt());
        assertEquals(T0, note.getCreatedAt());
    }

    @Test
    void testTitleDerivationIsIdempotent() {
        Note note = Note.create(T0);
        String content = "<p>Meeting notes &amp; actions</p><p>1. ship it</p>";

        note.updateContent(content, T0.plusSeconds(1));
        String first = note.getTitle();
        note.updateContent(content, T0.plusSeconds(2));

        assertEquals("Meeting notes & actions", first);
        assertEquals(first, note.getTitle());
    }

    @Test
    void testModifiedAtNeverMovesBackwards() {
        Note note = Note.create(T0);
        note.updateContent("new", T0.plusSeconds(60));

        note.updateContent("older clock", T0.plusSeconds(10));

        assertEquals(T0.plusSeconds(60), note.getModifiedAt());
        assertEquals("older clock", note.getTitle());
    }

    @Test
    void testNullContentStoredAsEmpty() {
        Note note = Note.create(T0);
        note.updateContent("something", T0);
        note.updateContent(null, T0);

        assertEquals("", note.getContent());
        assertEquals("Untitled", note.getTitle());
    }

    @Test
    void testFavoriteIsIndependentOfContent() {
        Note note = Note.create(T0);
        note.updateContent("Keep me", T0.plusSeconds(5));

        note.setFavorite(true);

        assertTrue(note.isFavorite());
        assertEquals(T0.plusSeconds(5), note.getModifiedAt());
        assertEquals("Keep me", note.getTitle());

        note.updateContent("Changed", T0.plusSeconds(6));
        assertTrue(note.isFavorite());
    }
}
