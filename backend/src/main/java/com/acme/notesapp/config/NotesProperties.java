package com.acme.notesapp.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

@ConfigurationProperties(prefix = "app.notes")
public record NotesProperties(@DefaultValue("1.0.0") String version, boolean exposeErrorDetails) {
}
