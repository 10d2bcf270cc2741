package com.task.formfill.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record ClassifyRequest(
        @JsonProperty("candidates")
        List<Candidate> candidates
) {}
