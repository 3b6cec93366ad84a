package com.acme.notesapp.health;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

public class HealthDtos {
    public record LivenessResponse(String status, Instant timestamp, String version) {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record DatabaseResponse(String status, String database, String error) {}
}
