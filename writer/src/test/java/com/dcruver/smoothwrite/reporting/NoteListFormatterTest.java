package com.dcruver.smoothwrite.reporting;

import com.dcruver.smoothwrite.autosave.ManualClock;
import com.dcruver.smoothwrite.domain.Note;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class NoteListFormatterTest {

    private static final Instant NOW = Instant.parse("2025-06-20T12:00:00Z");

    private ManualClock clock;
    private NoteListFormatter formatter;

    @BeforeEach
    void setUp() {
        clock = new ManualClock(NOW);
        formatter = new NoteListFormatter(clock);
    }

    @Test
    void testPreviewSkipsTitleLine() {
        Note note = note("<h1>Groceries</h1><p>milk, eggs</p>");
        assertEquals("milk, eggs", formatter.preview(note));
    }

    @Test
    void testPreviewTruncatesLongText() {
        Note note = note("Title\n" + "x".repeat(80));
        assertEquals("x".repeat(60) + "...", formatter.preview(note));
    }

    @Test
    void testPreviewKeepsSurrogatePairsWhole() {
        Note note = note("Title\n" + "x".repeat(59) + "\uD83D\uDE00tail");
        assertEquals("x".repeat(59) + "\uD83D\uDE00...", formatter.preview(note));
    }

    @Test
    void testPreviewWithoutBody() {
        assertEquals("No additional text", formatter.preview(note("<p>Only a title</p>")));
        assertEquals("No additional text", formatter.preview(note("")));
    }

    @Test
    void testRelativeTime() {
        assertEquals("Just now", formatter.relativeTime(NOW.minusSeconds(30)));
        assertEquals("1 min ago", formatter.relativeTime(NOW.minus(Duration.ofMinutes(1))));
        assertEquals("45 mins ago", formatter.relativeTime(NOW.minus(Duration.ofMinutes(45))));
        assertEquals("1 hour ago", formatter.relativeTime(NOW.minus(Duration.ofMinutes(90))));
        assertEquals("23 hours ago", formatter.relativeTime(NOW.minus(Duration.ofHours(23))));
        assertEquals("3 days ago", formatter.relativeTime(NOW.minus(Duration.ofDays(3))));
    }

    @Test
    void testOldNotesShowDate() {
        // Noon UTC stays on the same calendar day in every zone within +-11h
        String formatted = formatter.relativeTime(Instant.parse("2025-03-05T12:00:00Z"));
        assertTrue(formatted.startsWith("Mar 0"), formatted);
        assertTrue(formatted.endsWith(", 2025"), formatted);
    }

    @Test
    void testFormatListMarksSelectionAndFavorites() {
        Note first = note("<p>First</p><p>body one</p>");
        Note second = note("Second");
        second.setFavorite(true);

        String out = formatter.formatList(List.of(first, second), second.getId());
        String[] lines = out.split("\n");

        assertEquals(6, lines.length);
        assertTrue(lines[0].startsWith("    " + NoteListFormatter.shortId(first.getId())), lines[0]);
        assertTrue(lines[0].endsWith("First"));
        assertEquals("body one", lines[1].strip());
        assertTrue(lines[3].startsWith("> * "), lines[3]);
        assertEquals("No additional text", lines[4].strip());
        assertEquals("Just now", lines[5].strip());
    }

    @Test
    void testFormatEmptyList() {
        assertEquals("No notes.\n", formatter.formatList(List.of(), null));
    }

    @Test
    void testShortId() {
        assertEquals("12345678", NoteListFormatter.shortId("1234567890"));
        assertEquals("abc", NoteListFormatter.shortId("abc"));
    }

    private Note note(String content) {
        Note note = Note.create(NOW);
        note.updateContent(content, NOW);
        return note;
    }
}
