package com.acme.notesapp.notes;

import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

@RestController
@RequestMapping("/api/notes")
public class NoteController {
    private final NoteService noteService;

    public NoteController(NoteService noteService) {
        this.noteService = noteService;
    }

    @GetMapping
    public NoteDtos.NoteListResponse list() {
        return noteService.list();
    }

    @GetMapping("/{id}")
    public NoteDtos.NoteResponse get(@PathVariable UUID id) {
        return noteService.get(id);
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public NoteDtos.NoteResponse create(@RequestBody @Valid NoteDtos.NoteRequest request) {
        return noteService.create(request);
    }

    @PutMapping("/{id}")
    public NoteDtos.NoteResponse update(@PathVariable UUID id, @RequestBody @Valid NoteDtos.NoteRequest request) {
        return noteService.update(id, request);
    }

    @DeleteMapping("/{id}")
    public NoteDtos.MessageResponse delete(@PathVariable UUID id) {
        noteService.delete(id);
        return new NoteDtos.MessageResponse("Note deleted successfully");
    }
}
