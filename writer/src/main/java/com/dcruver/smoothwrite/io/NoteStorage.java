package com.dcruver.smoothwrite.io;

import com.dcruver.smoothwrite.domain.Note;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * One-file-per-note persistence under a root directory.
 *
 * Each note lives in {@code <root>/<id>.json}. The directory listing is the
 * index; there is no manifest. Expected failures never escape: callers get
 * a boolean, a {@link LoadResult} or a {@link DeleteResult} and the cause is
 * logged here.
 */
@Slf4j
public class NoteStorage {

    public static final String EXTENSION = ".json";
    private static final String TEMP_SUFFIX = ".tmp";

    private final Path root;
    private final NoteCodec codec;

    public NoteStorage(Path root, NoteCodec codec) {
        this.root = root.toAbsolutePath().normalize();
        this.codec = codec;
    }

    public Path getRoot() {
        return root;
    }

    /**
     * Write the note, replacing any previous version.
     * The new content is written to a temp file and renamed over the old one,
     * so a failed write leaves the previous version intact.
     *
     * @return true if the note is on disk
     */
    public boolean save(Note note) {
        Path target = resolve(note.getId());
        if (target == null) {
            log.error("Refusing to save note with invalid id: {}", note.getId());
            return false;
        }

        Path temp = null;
        try {
            Files.createDirectories(root);
            String json = codec.serialize(note);
            temp = Files.createTempFile(root, note.getId() + ".", TEMP_SUFFIX);
            Files.writeString(temp, json, StandardCharsets.UTF_8);
            moveIntoPlace(temp, target);
            temp = null;
            log.debug("Saved note {}", note.getId());
            return true;
        } catch (IOException | RuntimeException e) {
            log.error("Failed to save note {}: {}", note.getId(), e.getMessage(), e);
            return false;
        } finally {
            if (temp != null) {
                deleteQuietly(temp);
            }
        }
    }

    /**
     * Read one note by id.
     */
    public LoadResult load(String id) {
        Path file = resolve(id);
        if (file == null || !Files.isRegularFile(file)) {
            log.warn("Note {} not found", id);
            return LoadResult.notFound();
        }
        try {
            return LoadResult.found(read(file));
        } catch (NoSuchFileException e) {
            log.warn("Note {} disappeared while loading", id);
            return LoadResult.notFound();
        } catch (IOException e) {
            log.warn("Failed to load note {}: {}", id, e.getMessage());
            return LoadResult.corrupt();
        }
    }

    /**
     * Read every stored note, skipping the ones that fail, newest first.
     */
    public List<Note> loadAll() {
        List<Note> notes = new ArrayList<>();
        for (Path file : listNoteFiles()) {
            try {
                notes.add(read(file));
            } catch (IOException e) {
                log.error("Failed to load note from {}: {}", file.getFileName(), e.getMessage());
            }
        }
        notes.sort(Comparator.comparing(Note::getModifiedAt).reversed());
        log.info("Loaded {} notes from {}", notes.size(), root);
        return notes;
    }

    public DeleteResult delete(String id) {
        Path file = resolve(id);
        if (file == null) {
            log.warn("Note {} not found for deletion", id);
            return DeleteResult.NOT_FOUND;
        }
        try {
            if (Files.deleteIfExists(file)) {
                log.info("Deleted note {}", id);
                return DeleteResult.DELETED;
            }
            log.warn("Note {} not found for deletion", id);
            return DeleteResult.NOT_FOUND;
        } catch (IOException e) {
            log.error("Failed to delete note {}: {}", id, e.getMessage(), e);
            return DeleteResult.FAILED;
        }
    }

    /**
     * Number of stored notes, counted from the directory listing alone.
     */
    public int count() {
        return listNoteFiles().size();
    }

    private Note read(Path file) throws IOException {
        String json = Files.readString(file, StandardCharsets.UTF_8);
        String fileId = idOf(file);
        Note note = codec.deserialize(json, fileId);
        if (!note.getId().equals(fileId)) {
            log.warn("Note file {} carries id {}, using the file name", file.getFileName(), note.getId());
            note = Note.builder()
                .id(fileId)
                .title(note.getTitle())
                .content(note.getContent())
                .createdAt(note.getCreatedAt())
                .modifiedAt(note.getModifiedAt())
                .favorite(note.isFavorite())
                .build();
        }
        return note;
    }

    private List<Path> listNoteFiles() {
        List<Path> files = new ArrayList<>();
        if (!Files.isDirectory(root)) {
            return files;
        }
        try (DirectoryStream<Path> ds = Files.newDirectoryStream(root, "*" + EXTENSION)) {
            for (Path p : ds) {
                if (Files.isRegularFile(p)) {
                    files.add(p);
                }
            }
        } catch (IOException e) {
            log.error("Failed to list notes in {}: {}", root, e.getMessage(), e);
        }
        return files;
    }

    private void moveIntoPlace(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("Atomic move not supported in {}, replacing {}", root, target.getFileName());
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private void deleteQuietly(Path temp) {
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("Could not remove temp file {}: {}", temp, e.getMessage());
        }
    }

    /**
     * File for the given id, or null if the id is not a plain file name.
     */
    private Path resolve(String id) {
        if (id == null || id.isBlank() || id.contains("/") || id.contains("\\")
            || id.equals(".") || id.equals("..")) {
            return null;
        }
        Path file = root.resolve(id + EXTENSION).normalize();
        return root.equals(file.getParent()) ? file : null;
    }

    private static String idOf(Path file) {
        String name = file.getFileName().toString();
        return name.substring(0, name.length() - EXTENSION.length());
    }
}
