package com.task.formfill.service.classify;

import com.task.formfill.model.Candidate;

import java.util.List;

/**
 * Semantic classification backend. Receives one batch of candidates (with their nearby-text
 * context) and returns one entry per candidate it could classify.
 */
public interface ClassificationProvider {

    String name();

    List<ClassificationEntry> classify(List<Candidate> batch) throws Exception;
}
