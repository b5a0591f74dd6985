package com.dcruver.smoothwrite.io;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;

import java.time.Instant;

/**
 * On-disk shape of a note. Every field is optional on read.
 */
@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonPropertyOrder({"schema_version", "id", "title", "content", "created_at", "modified_at", "is_favorite"})
public class NoteDocument {
    private Integer schemaVersion;
    private String id;
    private String title;
    private String content;

    @JsonDeserialize(using = LenientInstantDeserializer.class)
    private Instant createdAt;

    @JsonDeserialize(using = LenientInstantDeserializer.class)
    private Instant modifiedAt;

    private Boolean isFavorite;
}
