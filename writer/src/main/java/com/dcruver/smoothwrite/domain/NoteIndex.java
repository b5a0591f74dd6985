package com.dcruver.smoothwrite.domain;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * In-memory working set of notes, most recent first.
 *
 * Order is established by whoever supplies the list to {@link #load(List)}
 * and maintained incrementally afterwards: new notes go to the front and
 * edited notes keep their position. Search is a projection over the list and
 * never changes it.
 */
@Component
@Slf4j
public class NoteIndex {

    private final List<Note> notes = new ArrayList<>();
    private String selectedId;

    /**
     * Replace the whole working set. The list is expected to be sorted
     * by modification time, newest first.
     */
    public void load(List<Note> sortedNotes) {
        notes.clear();
        notes.addAll(sortedNotes);
        if (selectedId != null && indexOf(selectedId) < 0) {
            selectedId = null;
        }
        log.info("Note index loaded with {} notes", notes.size());
    }

    public void insertNew(Note note) {
        notes.add(0, note);
        log.debug("Note added to index: {}", note.getId());
    }

    /**
     * Swap in the given instance for the record with the same id,
     * keeping its position.
     */
    public void replace(Note note) {
        int i = indexOf(note.getId());
        if (i < 0) {
            log.debug("Ignoring replace of unknown note: {}", note.getId());
            return;
        }
        notes.set(i, note);
        log.debug("Note updated in index: {}", note.getId());
    }

    public void remove(String id) {
        int i = indexOf(id);
        if (i < 0) {
            return;
        }
        notes.remove(i);
        if (id.equals(selectedId)) {
            selectedId = null;
        }
        log.debug("Note removed from index: {}", id);
    }

    /**
     * Mark a note as the active selection. Unknown ids are ignored.
     *
     * @return true if the selection changed to the given id
     */
    public boolean select(String id) {
        if (id == null || indexOf(id) < 0) {
            return false;
        }
        selectedId = id;
        return true;
    }

    public Optional<Note> findSelected() {
        return selectedId == null ? Optional.empty() : find(selectedId);
    }

    public Optional<Note> find(String id) {
        int i = indexOf(id);
        return i < 0 ? Optional.empty() : Optional.of(notes.get(i));
    }

    /**
     * Find a note by full id or by a prefix that matches exactly one id.
     */
    public Optional<Note> resolve(String idOrPrefix) {
        if (idOrPrefix == null || idOrPrefix.isBlank()) {
            return Optional.empty();
        }
        Optional<Note> exact = find(idOrPrefix);
        if (exact.isPresent()) {
            return exact;
        }
        List<Note> matches = notes.stream()
            .filter(n -> n.getId().startsWith(idOrPrefix))
            .toList();
        return matches.size() == 1 ? Optional.of(matches.get(0)) : Optional.empty();
    }

    /**
     * Notes whose title or plain-text content contains the query, ignoring
     * case. A blank query matches every note.
     */
    public List<Note> search(String query) {
        String q = query == null ? "" : query.strip().toLowerCase(Locale.ROOT);
        if (q.isEmpty()) {
            return List.copyOf(notes);
        }
        return notes.stream()
            .filter(n -> matches(n, q))
            .toList();
    }

    public List<Note> favorites() {
        return notes.stream()
            .filter(Note::isFavorite)
            .toList();
    }

    public List<Note> notes() {
        return Collections.unmodifiableList(notes);
    }

    public int size() {
        return notes.size();
    }

    private static boolean matches(Note note, String loweredQuery) {
        return note.getTitle().toLowerCase(Locale.ROOT).contains(loweredQuery)
            || HtmlText.toPlainText(note.getContent()).toLowerCase(Locale.ROOT).contains(loweredQuery);
    }

    private int indexOf(String id) {
        if (id == null) {
            return -1;
        }
        for (int i = 0; i < notes.size(); i++) {
            if (notes.get(i).getId().equals(id)) {
                return i;
            }
        }
        return -1;
    }
}
