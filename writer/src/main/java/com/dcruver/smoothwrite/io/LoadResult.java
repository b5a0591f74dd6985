package com.dcruver.smoothwrite.io;

import com.dcruver.smoothwrite.domain.Note;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.Optional;

/**
 * Outcome of loading a single note: found, absent, or present but unreadable.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class LoadResult {

    public enum Status {
        FOUND,
        NOT_FOUND,
        CORRUPT
    }

    Status status;
    Note note;

    public static LoadResult found(Note note) {
        return new LoadResult(Status.FOUND, note);
    }

    public static LoadResult notFound() {
        return new LoadResult(Status.NOT_FOUND, null);
    }

    public static LoadResult corrupt() {
        return new LoadResult(Status.CORRUPT, null);
    }

    /**
     * The note if found; corrupt and missing records both read as absent.
     */
    public Optional<Note> asOptional() {
        return Optional.ofNullable(note);
    }
}
