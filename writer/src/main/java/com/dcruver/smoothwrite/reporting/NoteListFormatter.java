package com.dcruver.smoothwrite.reporting;

import com.dcruver.smoothwrite.domain.HtmlText;
import com.dcruver.smoothwrite.domain.Note;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;

/**
 * Renders notes as list entries: title, a preview line and a relative
 * modification time.
 */
@Component
public class NoteListFormatter {

    static final int PREVIEW_LENGTH = 60;
    static final String NO_PREVIEW = "No additional text";

    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("MMM dd, yyyy", Locale.ENGLISH);

    private final Clock clock;

    public NoteListFormatter(Clock clock) {
        this.clock = clock;
    }

    /**
     * Format a list of notes, marking the selected and favorite ones.
     */
    public String formatList(List<Note> notes, String selectedId) {
        if (notes.isEmpty()) {
            return "No notes.\n";
        }
        StringBuilder sb = new StringBuilder();
        for (Note note : notes) {
            sb.append(note.getId().equals(selectedId) ? "> " : "  ");
            sb.append(note.isFavorite() ? "* " : "  ");
            sb.append(shortId(note.getId())).append("  ");
            sb.append(note.getTitle()).append("\n");
            sb.append("      ").append(preview(note)).append("\n");
            sb.append("      ").append(relativeTime(note.getModifiedAt())).append("\n");
        }
        return sb.toString();
    }

    /**
     * First plain-text line that is not the title, capped at 60 code points.
     */
    public String preview(Note note) {
        String plain = HtmlText.toPlainText(note.getContent());
        for (String line : plain.split("\n")) {
            String trimmed = line.strip();
            if (!trimmed.isEmpty() && !trimmed.equals(note.getTitle())) {
                return Note.truncate(trimmed, PREVIEW_LENGTH);
            }
        }
        return NO_PREVIEW;
    }

    /**
     * Age of a timestamp in words: "Just now", "5 mins ago", "1 hour ago",
     * "3 days ago", or the date after a week.
     */
    public String relativeTime(Instant time) {
        Duration age = Duration.between(time, clock.instant());
        if (age.compareTo(Duration.ofMinutes(1)) < 0) {
            return "Just now";
        }
        if (age.compareTo(Duration.ofHours(1)) < 0) {
            return plural(age.toMinutes(), "min");
        }
        if (age.compareTo(Duration.ofDays(1)) < 0) {
            return plural(age.toHours(), "hour");
        }
        if (age.compareTo(Duration.ofDays(7)) < 0) {
            return plural(age.toDays(), "day");
        }
        return DATE_FORMAT.format(time.atZone(ZoneId.systemDefault()));
    }

    public static String shortId(String id) {
        return id.length() > 8 ? id.substring(0, 8) : id;
    }

    private static String plural(long n, String unit) {
        return n + " " + unit + (n > 1 ? "s" : "") + " ago";
    }
}
