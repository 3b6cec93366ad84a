package com.acme.notesapp.notes;

import com.acme.notesapp.common.StoreException;
import com.acme.notesapp.domain.entity.Note;
import com.acme.notesapp.domain.repo.NoteRepository;
import jakarta.persistence.EntityNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

@Service
public class NoteService {
    private static final Logger log = LoggerFactory.getLogger(NoteService.class);

    static final String NOT_FOUND = "Note not found";
    static final int MAX_TITLE_LENGTH = 255;

    private final NoteRepository noteRepo;

    public NoteService(NoteRepository noteRepo) {
        this.noteRepo = noteRepo;
    }

    @Transactional(readOnly = true)
    public NoteDtos.NoteListResponse list() {
        try {
            return new NoteDtos.NoteListResponse(noteRepo.findAllByOrderByCreatedAtDesc().stream().map(this::toResponse).toList());
        } catch (DataAccessException e) {
            throw new StoreException("Failed to fetch notes", e);
        }
    }

    @Transactional(readOnly = true)
    public NoteDtos.NoteResponse get(UUID id) {
        return toResponse(findNote(id, "Failed to fetch note"));
    }

    @Transactional
    public NoteDtos.NoteResponse create(NoteDtos.NoteRequest request) {
        Note note = new Note();
        note.setTitle(title(request.title()));
        note.setContent(required(request.content()));
        try {
            noteRepo.saveAndFlush(note);
        } catch (DataAccessException e) {
            throw new StoreException("Failed to create note", e);
        }
        log.debug("Created note {}", note.getId());
        return toResponse(note);
    }

    @Transactional
    public NoteDtos.NoteResponse update(UUID id, NoteDtos.NoteRequest request) {
        String title = title(request.title());
        String content = required(request.content());
        int updated;
        try {
            updated = noteRepo.replaceContent(id, title, content, Note.timestamp());
        } catch (DataAccessException e) {
            throw new StoreException("Failed to update note", e);
        }
        if (updated == 0) throw new EntityNotFoundException(NOT_FOUND);
        log.debug("Updated note {}", id);
        return toResponse(findNote(id, "Failed to update note"));
    }

    @Transactional
    public void delete(UUID id) {
        int deleted;
        try {
            deleted = noteRepo.deleteNoteById(id);
        } catch (DataAccessException e) {
            throw new StoreException("Failed to delete note", e);
        }
        if (deleted == 0) throw new EntityNotFoundException(NOT_FOUND);
        log.debug("Deleted note {}", id);
    }

    private Note findNote(UUID id, String failureMessage) {
        try {
            return noteRepo.findById(id).orElseThrow(() -> new EntityNotFoundException(NOT_FOUND));
        } catch (DataAccessException e) {
            throw new StoreException(failureMessage, e);
        }
    }

    private String title(String value) {
        String title = required(value);
        if (title.length() > MAX_TITLE_LENGTH) {
            throw new IllegalArgumentException("Title must be at most " + MAX_TITLE_LENGTH + " characters");
        }
        return title;
    }

    private String required(String value) {
        if (value == null || value.isBlank()) throw new IllegalArgumentException("Title and content are required");
        return value.trim();
    }

    private NoteDtos.NoteResponse toResponse(Note note) {
        return new NoteDtos.NoteResponse(note.getId(), note.getTitle(), note.getContent(), note.getCreatedAt(), note.getUpdatedAt());
    }
}
