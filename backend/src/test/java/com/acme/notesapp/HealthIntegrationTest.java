package com.acme.notesapp;

import com.acme.notesapp.bootstrap.NoteSchemaBootstrap;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.test.web.servlet.MockMvc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

public class HealthIntegrationTest extends IntegrationTestBase {
    @Autowired
    MockMvc mvc;

    @Autowired
    NoteSchemaBootstrap schemaBootstrap;

    @Test
    void livenessReportsVersion() throws Exception {
        mvc.perform(get("/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("ok"))
                .andExpect(jsonPath("$.version").value("test-version"))
                .andExpect(jsonPath("$.timestamp").exists());
    }

    @Test
    void databaseProbeSeesStore() throws Exception {
        mvc.perform(get("/api/health/db"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("ok"))
                .andExpect(jsonPath("$.database").value("connected"))
                .andExpect(jsonPath("$.error").doesNotExist());
    }

    @Test
    void actuatorHealthIsExposed() throws Exception {
        mvc.perform(get("/actuator/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"));
    }

    @Test
    void schemaBootstrapCanRunAgain() {
        createNoteRow();
        assertThatCode(() -> schemaBootstrap.createSchema()).doesNotThrowAnyException();
        assertThat(noteCount()).isEqualTo(1);
    }

    private void createNoteRow() {
        jdbc.update("INSERT INTO notes (id, title, content) VALUES (RANDOM_UUID(), 'kept', 'across bootstrap')");
    }
}
