package com.pibridge.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Result of one query execution: samples ordered newest first with ids 1..N, plus metadata.
 */
public class ExecutionResult {

    @JsonProperty("data")
    private final List<Sample> data;

    @JsonProperty("metadata")
    private final ExecutionMetadata metadata;

    public ExecutionResult(List<Sample> data, ExecutionMetadata metadata) {
        this.data = data != null ? Collections.unmodifiableList(new ArrayList<>(data)) : List.of();
        this.metadata = metadata != null ? metadata : new ExecutionMetadata();
    }

    public List<Sample> getData() {
        return data;
    }

    public ExecutionMetadata getMetadata() {
        return metadata;
    }

    @JsonIgnore
    public boolean isEmpty() {
        return data.isEmpty();
    }
}
