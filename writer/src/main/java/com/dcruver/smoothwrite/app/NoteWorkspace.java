package com.dcruver.smoothwrite.app;

import com.dcruver.smoothwrite.autosave.AutoSaveScheduler;
import com.dcruver.smoothwrite.domain.HtmlText;
import com.dcruver.smoothwrite.domain.Note;
import com.dcruver.smoothwrite.domain.NoteIndex;
import com.dcruver.smoothwrite.io.DeleteResult;
import com.dcruver.smoothwrite.io.NoteStorage;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Ties the editing surface, auto-save, storage and the note index together.
 *
 * Holds the single open note. Edits on the surface mark it dirty and
 * trigger auto-save; when auto-save fires, the surface content is committed
 * into the note, written to storage and reflected in the index. All public
 * operations run under this object's monitor, so a timer-fired save never
 * interleaves with a command.
 */
@Service
@Slf4j
public class NoteWorkspace {

    static final String WELCOME_CONTENT = """
        <h1>Welcome to Smooth Write!</h1>
        <p>A quiet place to write. Notes are kept as plain JSON files on your disk.</p>
        <h2>Features:</h2>
        <ul>
            <li><b>Rich text</b> - write with HTML formatting</li>
            <li><b>Auto-save</b> - your work is saved a moment after you stop typing</li>
            <li><b>Search</b> - find notes by title or text</li>
            <li><b>Favorites</b> - star the notes you come back to</li>
        </ul>
        <p>Type 'new' to start a note, or 'help' to see every command.</p>
        """;

    private final NoteStorage storage;
    private final NoteIndex index;
    private final ContentSurface surface;
    private final AutoSaveScheduler autoSave;
    private final Clock clock;
    private final boolean welcomeNoteEnabled;

    private Note currentNote;
    private boolean dirty;
    private boolean loadingContent;

    public NoteWorkspace(
        NoteStorage storage,
        NoteIndex index,
        ContentSurface surface,
        TaskScheduler autoSaveTaskScheduler,
        Clock clock,
        @Value("${smoothwrite.autosave.delay-ms:1000}") long autoSaveDelayMs,
        @Value("${smoothwrite.autosave.enabled:true}") boolean autoSaveEnabled,
        @Value("${smoothwrite.welcome-note:true}") boolean welcomeNoteEnabled
    ) {
        this.storage = storage;
        this.index = index;
        this.surface = surface;
        this.clock = clock;
        this.welcomeNoteEnabled = welcomeNoteEnabled;
        this.autoSave = new AutoSaveScheduler(autoSaveTaskScheduler, this::autoSaveCurrent,
            Duration.ofMillis(autoSaveDelayMs));
        if (!autoSaveEnabled) {
            autoSave.disable();
        }
        surface.addContentChangeListener(this::onContentChanged);
    }

    /**
     * Load every stored note and open the most recent one. Creates the
     * welcome note when the store is empty.
     */
    @PostConstruct
    public synchronized void start() {
        List<Note> notes = storage.loadAll();

        if (notes.isEmpty() && welcomeNoteEnabled) {
            Note welcome = Note.create(clock.instant());
            welcome.updateContent(WELCOME_CONTENT, clock.instant());
            if (storage.save(welcome)) {
                log.info("Created welcome note");
                notes = List.of(welcome);
            } else {
                log.error("Failed to create welcome note in {}", storage.getRoot());
            }
        }

        index.load(notes);
        if (!notes.isEmpty()) {
            open(notes.get(0).getId());
        }
        log.info("Workspace started with {} notes from {}", notes.size(), storage.getRoot());
    }

    /**
     * Switch to another note, saving unsaved edits of the current one first.
     *
     * @return the opened note, or empty if the id is not in the index
     */
    public synchronized Optional<Note> open(String id) {
        Optional<Note> found = index.find(id);
        if (found.isEmpty()) {
            log.warn("Cannot open unknown note: {}", id);
            return Optional.empty();
        }

        flushCurrent();

        Note note = found.get();
        index.select(note.getId());
        currentNote = note;
        showInSurface(note.getContent());
        dirty = false;
        log.info("Opened note: {}", note.getId());
        return found;
    }

    /**
     * Create an empty note, persist it right away and open it.
     *
     * @return the new note, or empty if it could not be written
     */
    public synchronized Optional<Note> createNote() {
        flushCurrent();

        Note note = Note.create(clock.instant());
        if (!storage.save(note)) {
            log.error("Failed to create new note");
            return Optional.empty();
        }
        index.insertNew(note);
        open(note.getId());
        log.info("Created new note: {}", note.getId());
        return Optional.of(note);
    }

    /**
     * Replace the content of the open note as if typed into the surface.
     *
     * @return false if no note is open
     */
    public synchronized boolean edit(String html) {
        if (currentNote == null) {
            return false;
        }
        surface.setContent(html);
        return true;
    }

    /**
     * Add a paragraph to the end of the open note.
     *
     * @return false if no note is open
     */
    public synchronized boolean append(String text) {
        if (currentNote == null) {
            return false;
        }
        String existing = surface.getContent();
        String paragraph = existing.isEmpty() || !HtmlText.looksLikeMarkup(existing)
            ? text
            : "<p>" + escape(text) + "</p>";
        surface.setContent(existing.isEmpty() ? paragraph : existing + "\n" + paragraph);
        return true;
    }

    /**
     * Explicit save of the open note. Unlike auto-save the result goes back
     * to the caller so a failure can be shown.
     *
     * @return true if the note is on disk; false on failure or if nothing is open
     */
    public synchronized boolean saveCurrent() {
        if (currentNote == null) {
            return false;
        }
        return commitCurrent();
    }

    /**
     * Delete a note from disk and from the index. Closes it if it is open.
     */
    public synchronized DeleteResult deleteNote(String id) {
        DeleteResult result = storage.delete(id);
        if (result == DeleteResult.FAILED) {
            return result;
        }

        // A file removed behind our back still leaves the index entry to drop.
        index.remove(id);
        if (currentNote != null && currentNote.getId().equals(id)) {
            currentNote = null;
            dirty = false;
            showInSurface("");
        }
        if (result.isDeleted()) {
            log.info("Deleted note: {}", id);
        }
        return result;
    }

    /**
     * Flip the favorite flag and persist it. Content and modification time
     * are left alone.
     *
     * @return the note with its new flag, or empty if unknown or not saved
     */
    public synchronized Optional<Note> toggleFavorite(String id) {
        Optional<Note> found = index.find(id);
        if (found.isEmpty()) {
            return Optional.empty();
        }
        Note note = found.get();
        note.setFavorite(!note.isFavorite());
        if (!storage.save(note)) {
            note.setFavorite(!note.isFavorite());
            log.error("Failed to save favorite flag for note: {}", id);
            return Optional.empty();
        }
        index.replace(note);
        return found;
    }

    public synchronized List<Note> search(String query) {
        return index.search(query);
    }

    public synchronized List<Note> favorites() {
        return index.favorites();
    }

    public synchronized Optional<Note> resolve(String idOrPrefix) {
        return index.resolve(idOrPrefix);
    }

    public synchronized Optional<Note> getCurrentNote() {
        return Optional.ofNullable(currentNote);
    }

    public synchronized String getCurrentContent() {
        return currentNote == null ? "" : surface.getContent();
    }

    public synchronized boolean isDirty() {
        return dirty;
    }

    public synchronized int storedNoteCount() {
        return storage.count();
    }

    public synchronized int indexedNoteCount() {
        return index.size();
    }

    public Path getNotesRoot() {
        return storage.getRoot();
    }

    public AutoSaveScheduler getAutoSave() {
        return autoSave;
    }

    /**
     * Write pending edits and release the auto-save timer.
     */
    @PreDestroy
    public synchronized void shutdown() {
        flushCurrent();
        autoSave.shutdown();
        log.info("Workspace closed");
    }

    private synchronized void onContentChanged() {
        if (loadingContent || currentNote == null) {
            return;
        }
        dirty = true;
        autoSave.trigger();
    }

    private synchronized void autoSaveCurrent() {
        if (currentNote == null || !dirty) {
            return;
        }
        if (!commitCurrent()) {
            log.warn("Auto-save of note {} failed, will retry on the next edit", currentNote.getId());
        }
    }

    private void flushCurrent() {
        if (currentNote != null && dirty) {
            autoSave.saveNow();
        }
    }

    private boolean commitCurrent() {
        String content = surface.getContent();
        if (!content.equals(currentNote.getContent())) {
            currentNote.updateContent(content, clock.instant());
        }
        if (!storage.save(currentNote)) {
            log.error("Failed to save note: {}", currentNote.getId());
            return false;
        }
        index.replace(currentNote);
        dirty = false;
        log.debug("Saved note: {}", currentNote.getId());
        return true;
    }

    private void showInSurface(String content) {
        loadingContent = true;
        try {
            surface.setContent(content);
        } finally {
            loadingContent = false;
        }
    }

    private static String escape(String text) {
        return text.replace("&", "&amp;").replace("<", "&lt;").replace(">", "&gt;");
    }
}
