package com.acme.notesapp.domain.repo;

import com.acme.notesapp.domain.entity.Note;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public interface NoteRepository extends JpaRepository<Note, UUID> {
    List<Note> findAllByOrderByCreatedAtDesc();

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update Note n set n.title = :title, n.content = :content, n.updatedAt = :updatedAt where n.id = :id")
    int replaceContent(@Param("id") UUID id, @Param("title") String title, @Param("content") String content, @Param("updatedAt") Instant updatedAt);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("delete from Note n where n.id = :id")
    int deleteNoteById(@Param("id") UUID id);
}
