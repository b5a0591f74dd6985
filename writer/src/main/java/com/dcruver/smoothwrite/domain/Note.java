package com.dcruver.smoothwrite.domain;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * A single user-authored note.
 *
 * The title is always derived from the content. Callers change content only
 * through {@link #updateContent(String)} so that title and modification time
 * stay consistent with it.
 */
@Getter
@EqualsAndHashCode
@ToString(exclude = "content")
public class Note {

    public static final String UNTITLED = "Untitled";
    public static final int MAX_TITLE_LENGTH = 50;
    public static final String ELLIPSIS = "...";

    private final String id;
    private String title;
    private String content;
    private final Instant createdAt;
    private Instant modifiedAt;
    private boolean favorite;

    /**
     * Restore a note with every field given, as read back from storage.
     * The title is taken as stored.
     */
    @Builder
    private Note(String id, String title, String content, Instant createdAt, Instant modifiedAt, boolean favorite) {
        this.id = Objects.requireNonNull(id, "id");
        this.title = title == null ? UNTITLED : title;
        this.content = content == null ? "" : content;
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
        this.modifiedAt = modifiedAt == null ? createdAt : modifiedAt;
        this.favorite = favorite;
    }

    /**
     * Create an empty note stamped with the current time.
     */
    public static Note create() {
        return create(Instant.now());
    }

    public static Note create(Instant now) {
        return new Note(UUID.randomUUID().toString(), UNTITLED, "", now, now, false);
    }

    public void updateContent(String content) {
        updateContent(content, Instant.now());
    }

    /**
     * Replace the content and refresh title and modification time.
     * The modification time never moves backwards.
     */
    public void updateContent(String content, Instant now) {
        this.content = content == null ? "" : content;
        if (now.isAfter(modifiedAt)) {
            this.modifiedAt = now;
        }
        this.title = deriveTitle(this.content);
    }

    public void setFavorite(boolean favorite) {
        this.favorite = favorite;
    }

    /**
     * Title for the given content: its first plain-text line, capped at
     * {@value #MAX_TITLE_LENGTH} code points, or {@value #UNTITLED}.
     */
    public static String deriveTitle(String content) {
        String firstLine = HtmlText.firstLine(content);
        if (firstLine.isEmpty()) {
            return UNTITLED;
        }
        return truncate(firstLine, MAX_TITLE_LENGTH);
    }

    /**
     * Cap text at the given number of code points, adding {@value #ELLIPSIS}
     * when cut. Surrogate pairs are never split.
     */
    public static String truncate(String text, int maxCodePoints) {
        if (text.codePointCount(0, text.length()) <= maxCodePoints) {
            return text;
        }
        return text.substring(0, text.offsetByCodePoints(0, maxCodePoints)) + ELLIPSIS;
    }
}
