package com.task.formfill.service;

import com.task.formfill.model.BoundingBox;
import com.task.formfill.model.Candidate;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class CandidateGrouperTest {

    private final CandidateGrouper grouper = new CandidateGrouper();

    private static Candidate cand(String id, String text, double conf, int page, double x, double y, double w, double h) {
        return new Candidate(id, text, conf, new BoundingBox(page, x, y, w, h), List.of());
    }

    @Test
    public void mergesAdjacentWordsOnSameLine() {
        Candidate john = cand("a", "John", 0.9, 1, 0.10, 0.20, 0.05, 0.02);
        Candidate smith = cand("b", "Smith", 0.8, 1, 0.16, 0.20, 0.05, 0.02);

        List<Candidate> out = grouper.group(List.of(smith, john));

        assertEquals(1, out.size());
        Candidate merged = out.get(0);
        assertEquals("John Smith", merged.rawText());
        assertEquals(0.8, merged.confidence(), 1e-9);
        assertEquals(0.10, merged.bbox().x(), 1e-9);
        assertEquals(0.21, merged.bbox().right(), 1e-9);
        assertEquals(0.20, merged.bbox().y(), 1e-9);
    }

    @Test
    public void doesNotMergeDistantOrOtherLineCandidates() {
        Candidate left = cand("a", "Name", 0.9, 1, 0.10, 0.20, 0.05, 0.02);
        Candidate far = cand("b", "Date", 0.9, 1, 0.50, 0.20, 0.05, 0.02);
        Candidate below = cand("c", "Address", 0.9, 1, 0.16, 0.30, 0.05, 0.02);
        Candidate otherPage = cand("d", "Smith", 0.9, 2, 0.16, 0.20, 0.05, 0.02);

        List<Candidate> out = grouper.group(List.of(left, far, below, otherPage));

        assertEquals(4, out.size());
        assertEquals(List.of("Name", "Date", "Address", "Smith"),
                out.stream().map(Candidate::rawText).collect(Collectors.toList()));
    }

    @Test
    public void chainsMergeAcrossSeveralWords() {
        Candidate a = cand("a", "Date", 0.9, 1, 0.10, 0.50, 0.04, 0.02);
        Candidate b = cand("b", "of", 0.7, 1, 0.15, 0.50, 0.02, 0.02);
        Candidate c = cand("c", "Birth", 0.95, 1, 0.18, 0.50, 0.05, 0.02);

        List<Candidate> out = grouper.group(List.of(c, a, b));

        assertEquals(1, out.size());
        assertEquals("Date of Birth", out.get(0).rawText());
        assertEquals(0.7, out.get(0).confidence(), 1e-9);
    }

    @Test
    public void annotatesNearbyTextWithinDistance() {
        Candidate label = cand("a", "Email", 0.9, 1, 0.10, 0.40, 0.05, 0.02);
        Candidate near = cand("b", "Phone", 0.9, 1, 0.10, 0.45, 0.05, 0.02);
        Candidate far = cand("c", "Signature", 0.9, 1, 0.10, 0.80, 0.05, 0.02);

        Map<String, Candidate> byText = grouper.group(List.of(label, near, far)).stream()
                .collect(Collectors.toMap(Candidate::rawText, c -> c));

        assertEquals(List.of("Phone"), byText.get("Email").nearbyText());
        assertEquals(List.of("Email"), byText.get("Phone").nearbyText());
        assertTrue(byText.get("Signature").nearbyText().isEmpty());
    }

    @Test
    public void ordersByPageThenLineThenX() {
        Candidate p2 = cand("a", "second page", 0.9, 2, 0.10, 0.10, 0.05, 0.02);
        Candidate lineTwo = cand("b", "line two", 0.9, 1, 0.10, 0.30, 0.05, 0.02);
        Candidate right = cand("c", "right", 0.9, 1, 0.60, 0.105, 0.05, 0.02);
        Candidate left = cand("d", "left", 0.9, 1, 0.10, 0.11, 0.05, 0.02);

        List<String> texts = grouper.group(List.of(p2, lineTwo, right, left)).stream()
                .map(Candidate::rawText).collect(Collectors.toList());

        assertEquals(List.of("left", "right", "line two", "second page"), texts);
    }

    @Test
    public void groupingIsIdempotentForShuffledInput() {
        List<Candidate> input = new ArrayList<>(List.of(
                cand("a", "John", 0.9, 1, 0.10, 0.20, 0.05, 0.02),
                cand("b", "Smith", 0.8, 1, 0.16, 0.20, 0.05, 0.02),
                cand("c", "DOB", 0.9, 1, 0.10, 0.25, 0.05, 0.02),
                cand("d", "Sign", 0.9, 1, 0.70, 0.90, 0.05, 0.02)
        ));

        List<Candidate> first = grouper.group(input);
        Collections.reverse(input);
        List<Candidate> second = grouper.group(input);

        assertEquals(first.size(), second.size());
        for (int i = 0; i < first.size(); i++) {
            assertEquals(first.get(i).rawText(), second.get(i).rawText());
            assertEquals(new HashSet<>(first.get(i).nearbyText()), new HashSet<>(second.get(i).nearbyText()));
        }
        assertEquals(first, grouper.group(first));
    }

    @Test
    public void emptyInputYieldsEmptyOutput() {
        assertTrue(grouper.group(List.of()).isEmpty());
        assertTrue(grouper.group(null).isEmpty());
    }
}
