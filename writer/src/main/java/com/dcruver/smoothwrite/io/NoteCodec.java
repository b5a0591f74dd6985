package com.dcruver.smoothwrite.io;

import com.dcruver.smoothwrite.domain.Note;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

/**
 * Converts notes to and from their JSON form.
 *
 * Reading is forgiving: missing fields fall back to defaults so a damaged
 * record still loads. Only input that is not a JSON object, or that was
 * written by a newer schema, is rejected.
 */
@Slf4j
public class NoteCodec {

    public static final int SCHEMA_VERSION = 1;

    private final ObjectMapper objectMapper;
    private final Clock clock;

    public NoteCodec() {
        this(Clock.systemUTC());
    }

    public NoteCodec(Clock clock) {
        this.clock = clock;
        this.objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .enable(SerializationFeature.INDENT_OUTPUT);
    }

    public String serialize(Note note) throws JsonProcessingException {
        NoteDocument doc = new NoteDocument();
        doc.setSchemaVersion(SCHEMA_VERSION);
        doc.setId(note.getId());
        doc.setTitle(note.getTitle());
        doc.setContent(note.getContent());
        doc.setCreatedAt(note.getCreatedAt());
        doc.setModifiedAt(note.getModifiedAt());
        doc.setIsFavorite(note.isFavorite());
        return objectMapper.writeValueAsString(doc);
    }

    public Note deserialize(String json) throws CorruptNoteException {
        return deserialize(json, null);
    }

    /**
     * Parse a stored note.
     *
     * @param json       serialized note
     * @param fallbackId id to use when the record carries none; a random id if null
     * @throws CorruptNoteException if the input cannot be read as a note
     */
    public Note deserialize(String json, String fallbackId) throws CorruptNoteException {
        NoteDocument doc;
        try {
            doc = objectMapper.readValue(json, NoteDocument.class);
        } catch (JsonProcessingException e) {
            throw new CorruptNoteException("Unreadable note JSON: " + e.getOriginalMessage(), e);
        }
        if (doc == null) {
            throw new CorruptNoteException("Note JSON is null");
        }

        int version = doc.getSchemaVersion() == null ? 0 : doc.getSchemaVersion();
        if (version > SCHEMA_VERSION) {
            throw new CorruptNoteException("Unsupported schema version " + version
                + " (newest supported is " + SCHEMA_VERSION + ")");
        }

        String id = doc.getId();
        if (id == null || id.isBlank()) {
            id = fallbackId != null ? fallbackId : UUID.randomUUID().toString();
            log.warn("Note record has no id, using {}", id);
        }

        Instant now = clock.instant();
        Instant createdAt = doc.getCreatedAt() != null ? doc.getCreatedAt() : now;
        Instant modifiedAt = doc.getModifiedAt() != null ? doc.getModifiedAt() : now;

        return Note.builder()
            .id(id)
            .title(doc.getTitle() != null ? doc.getTitle() : Note.UNTITLED)
            .content(doc.getContent() != null ? doc.getContent() : "")
            .createdAt(createdAt)
            .modifiedAt(modifiedAt)
            .favorite(Boolean.TRUE.equals(doc.getIsFavorite()))
            .build();
    }
}
