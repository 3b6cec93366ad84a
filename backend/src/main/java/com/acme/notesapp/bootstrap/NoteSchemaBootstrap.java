package com.acme.notesapp.bootstrap;

import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

@Component
public class NoteSchemaBootstrap {
    private static final Logger log = LoggerFactory.getLogger(NoteSchemaBootstrap.class);

    static final String CREATE_NOTES_TABLE = """
            CREATE TABLE IF NOT EXISTS notes (
                id UUID PRIMARY KEY,
                title VARCHAR(255) NOT NULL,
                content TEXT NOT NULL,
                created_at TIMESTAMP WITH TIME ZONE DEFAULT CURRENT_TIMESTAMP NOT NULL,
                updated_at TIMESTAMP WITH TIME ZONE DEFAULT CURRENT_TIMESTAMP NOT NULL
            )
            """;

    private final JdbcTemplate jdbc;

    public NoteSchemaBootstrap(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @PostConstruct
    public void createSchema() {
        jdbc.execute(CREATE_NOTES_TABLE);
        log.info("Notes table ready");
    }
}
