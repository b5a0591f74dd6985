package com.dcruver.smoothwrite.app;

import com.dcruver.smoothwrite.autosave.AutoSaveScheduler;
import com.dcruver.smoothwrite.domain.HtmlText;
import com.dcruver.smoothwrite.domain.Note;
import com.dcruver.smoothwrite.io.DeleteResult;
import com.dcruver.smoothwrite.reporting.NoteListFormatter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.shell.standard.ShellComponent;
import org.springframework.shell.standard.ShellMethod;
import org.springframework.shell.standard.ShellOption;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Spring Shell commands for browsing and editing notes.
 */
@ShellComponent
@Slf4j
@RequiredArgsConstructor
public class NotesShellCommands {

    private final NoteWorkspace workspace;
    private final NoteListFormatter formatter;

    @ShellMethod(key = {"list", "ls"}, value = "List notes, most recently edited first")
    public String list(@ShellOption(defaultValue = "false", help = "Only favorites") boolean favorites) {
        List<Note> notes = favorites ? workspace.favorites() : workspace.search("");
        return formatter.formatList(notes, selectedId());
    }

    @ShellMethod(key = {"search", "find"}, value = "Show notes whose title or text contains the query")
    public String search(@ShellOption(defaultValue = "") String query) {
        List<Note> matches = workspace.search(query);
        if (matches.isEmpty()) {
            return "No notes match '" + query + "'.\n";
        }
        return formatter.formatList(matches, selectedId());
    }

    @ShellMethod(key = {"new", "new-note"}, value = "Create a new note and open it")
    public String newNote() {
        Optional<Note> created = workspace.createNote();
        if (created.isEmpty()) {
            return "Failed to create new note. Check that " + workspace.getNotesRoot() + " is writable and try again.";
        }
        return "Created note " + NoteListFormatter.shortId(created.get().getId()) + ".";
    }

    @ShellMethod(key = "open", value = "Open a note by id or unique id prefix")
    public String open(String id) {
        Optional<Note> note = workspace.resolve(id).flatMap(n -> workspace.open(n.getId()));
        if (note.isEmpty()) {
            return "No single note matches '" + id + "'.";
        }
        return show();
    }

    @ShellMethod(key = {"show", "cat"}, value = "Show the open note")
    public String show() {
        Optional<Note> current = workspace.getCurrentNote();
        if (current.isEmpty()) {
            return "No note is open.";
        }
        Note note = current.get();
        StringBuilder sb = new StringBuilder();
        sb.append(note.getTitle());
        if (note.isFavorite()) {
            sb.append("  *");
        }
        sb.append("\n");
        sb.append("id: ").append(note.getId()).append("\n");
        sb.append("modified: ").append(formatter.relativeTime(note.getModifiedAt()));
        if (workspace.isDirty()) {
            sb.append(" (unsaved changes)");
        }
        sb.append("\n\n");
        sb.append(HtmlText.toPlainText(workspace.getCurrentContent())).append("\n");
        return sb.toString();
    }

    @ShellMethod(key = "write", value = "Replace the content of the open note (HTML allowed)")
    public String write(String content) {
        if (!workspace.edit(content)) {
            return "No note is open. Use 'new' or 'open' first.";
        }
        return autoSaveHint();
    }

    @ShellMethod(key = "append", value = "Add a paragraph to the open note")
    public String append(String text) {
        if (!workspace.append(text)) {
            return "No note is open. Use 'new' or 'open' first.";
        }
        return autoSaveHint();
    }

    @ShellMethod(key = "save", value = "Save the open note now")
    public String save() {
        if (workspace.getCurrentNote().isEmpty()) {
            return "No note is open.";
        }
        if (!workspace.saveCurrent()) {
            return "Save failed. Your text is still here; check that " + workspace.getNotesRoot()
                + " is writable and run 'save' again.";
        }
        return "Saved.";
    }

    @ShellMethod(key = {"delete", "rm"}, value = "Delete a note (defaults to the open note)")
    public String delete(@ShellOption(defaultValue = ShellOption.NULL) String id) {
        Optional<String> target = id == null
            ? workspace.getCurrentNote().map(Note::getId)
            : workspace.resolve(id).map(Note::getId);
        if (target.isEmpty()) {
            return id == null ? "No note is open." : "No single note matches '" + id + "'.";
        }

        DeleteResult result = workspace.deleteNote(target.get());
        return switch (result) {
            case DELETED -> "Deleted note " + NoteListFormatter.shortId(target.get()) + ".";
            case NOT_FOUND -> "Note " + NoteListFormatter.shortId(target.get()) + " was already gone.";
            case FAILED -> "Failed to delete note. Check permissions on " + workspace.getNotesRoot() + " and try again.";
        };
    }

    @ShellMethod(key = {"favorite", "star"}, value = "Toggle the favorite flag (defaults to the open note)")
    public String favorite(@ShellOption(defaultValue = ShellOption.NULL) String id) {
        Optional<Note> target = id == null ? workspace.getCurrentNote() : workspace.resolve(id);
        if (target.isEmpty()) {
            return id == null ? "No note is open." : "No single note matches '" + id + "'.";
        }
        Optional<Note> toggled = workspace.toggleFavorite(target.get().getId());
        if (toggled.isEmpty()) {
            return "Failed to update favorite. Check that " + workspace.getNotesRoot() + " is writable.";
        }
        return toggled.get().isFavorite() ? "Marked as favorite." : "Removed from favorites.";
    }

    @ShellMethod(key = "autosave", value = "Show or change auto-save settings")
    public String autosave(
        @ShellOption(defaultValue = "false") boolean enable,
        @ShellOption(defaultValue = "false") boolean disable,
        @ShellOption(defaultValue = "-1", help = "Debounce delay in milliseconds") long delay
    ) {
        if (enable && disable) {
            return "Choose either --enable or --disable.";
        }
        AutoSaveScheduler autoSave = workspace.getAutoSave();
        if (disable) {
            // Disabling drops a pending save, so write it out first.
            if (workspace.isDirty()) {
                autoSave.saveNow();
            }
            autoSave.disable();
        }
        if (enable) {
            autoSave.enable();
        }
        if (delay >= 0) {
            autoSave.setDelay(Duration.ofMillis(delay));
        }
        return String.format("Auto-save is %s, delay %d ms.",
            autoSave.isEnabled() ? "on" : "off", autoSave.getDelay().toMillis());
    }

    @ShellMethod(key = "status", value = "Show storage and auto-save status")
    public String status() {
        AutoSaveScheduler autoSave = workspace.getAutoSave();
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("Notes directory: %s\n", workspace.getNotesRoot()));
        sb.append(String.format("- Stored notes: %d\n", workspace.storedNoteCount()));
        sb.append(String.format("- Indexed notes: %d\n", workspace.indexedNoteCount()));
        sb.append(String.format("- Open note: %s\n", workspace.getCurrentNote()
            .map(n -> n.getTitle() + " (" + NoteListFormatter.shortId(n.getId()) + ")")
            .orElse("none")));
        sb.append(String.format("- Unsaved changes: %s\n", workspace.isDirty() ? "yes" : "no"));
        sb.append(String.format("- Auto-save: %s, delay %d ms%s\n",
            autoSave.isEnabled() ? "on" : "off",
            autoSave.getDelay().toMillis(),
            autoSave.isPending() ? ", save pending" : ""));
        return sb.toString();
    }

    private String autoSaveHint() {
        return workspace.getAutoSave().isEnabled()
            ? "Updated. Auto-save will write it shortly."
            : "Updated. Auto-save is off; run 'save' to keep it.";
    }

    private String selectedId() {
        return workspace.getCurrentNote().map(Note::getId).orElse(null);
    }
}
