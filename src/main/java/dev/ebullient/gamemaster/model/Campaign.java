package dev.ebullient.gamemaster.model;

import java.nio.file.Path;

import com.fasterxml.jackson.annotation.JsonIgnore;

public record Campaign(
        String id,
        String name,
        long version,
        @JsonIgnore Path statePath) {
}
