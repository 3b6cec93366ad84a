package com.acme.notesapp.notes;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public class NoteDtos {
    public record NoteRequest(
            @NotBlank(message = "Title and content are required") String title,
            @NotBlank(message = "Title and content are required") String content
    ) {}

    public record NoteResponse(
            UUID id,
            String title,
            String content,
            @JsonProperty("created_at") Instant createdAt,
            @JsonProperty("updated_at") Instant updatedAt
    ) {}

    public record NoteListResponse(List<NoteResponse> notes) {}

    public record MessageResponse(String message) {}
}
