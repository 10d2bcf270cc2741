package com.task.formfill.service;

import com.task.formfill.model.BoundingBox;
import com.task.formfill.model.Candidate;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Merges same-line neighbours into single candidates and annotates every candidate with the text
 * around it. Purely local and deterministic: identical input always yields identical output.
 */
@Service
public class CandidateGrouper {

    static final double SAME_LINE_TOLERANCE = 0.01;
    static final double ADJACENT_GAP = 0.03;
    static final double NEARBY_DISTANCE = 0.10;
    static final double LINE_BREAK = 0.02;

    public List<Candidate> group(List<Candidate> candidates) {
        if (candidates == null || candidates.isEmpty()) return List.of();
        List<Candidate> merged = merge(candidates);
        return readingOrder(annotate(merged));
    }

    /**
     * One greedy left-to-right sweep. Each unconsumed candidate anchors a run and absorbs the
     * candidates that continue its line within the gap tolerance; absorbed members are marked
     * consumed and never anchor or join another run.
     */
    List<Candidate> merge(List<Candidate> candidates) {
        List<Candidate> ordered = readingOrder(candidates);
        boolean[] consumed = new boolean[ordered.size()];
        List<Candidate> out = new ArrayList<>();

        for (int i = 0; i < ordered.size(); i++) {
            if (consumed[i]) continue;
            consumed[i] = true;
            Candidate anchor = ordered.get(i);

            List<Candidate> run = new ArrayList<>();
            run.add(anchor);
            double rightEdge = anchor.bbox().right();

            for (int j = i + 1; j < ordered.size(); j++) {
                if (consumed[j]) continue;
                Candidate other = ordered.get(j);
                if (other.bbox().page() != anchor.bbox().page()) break;
                if (Math.abs(other.bbox().centerY() - anchor.bbox().centerY()) >= SAME_LINE_TOLERANCE) continue;
                if (other.bbox().x() < anchor.bbox().x()) continue;
                if (Math.abs(other.bbox().x() - rightEdge) >= ADJACENT_GAP) continue;

                consumed[j] = true;
                run.add(other);
                rightEdge = Math.max(rightEdge, other.bbox().right());
            }

            out.add(run.size() == 1 ? anchor : combine(run));
        }
        return out;
    }

    private static Candidate combine(List<Candidate> run) {
        List<Candidate> sorted = new ArrayList<>(run);
        sorted.sort(Comparator.comparingDouble(c -> c.bbox().x()));

        StringBuilder text = new StringBuilder();
        double confidence = 1.0;
        BoundingBox box = sorted.get(0).bbox();
        for (Candidate c : sorted) {
            if (text.length() > 0) text.append(' ');
            text.append(c.rawText());
            confidence = Math.min(confidence, c.confidence());
            box = box.union(c.bbox());
        }
        return new Candidate("merged-" + sorted.get(0).id(), text.toString(), confidence, box, List.of());
    }

    List<Candidate> annotate(List<Candidate> candidates) {
        List<Candidate> ordered = readingOrder(candidates);
        List<Candidate> out = new ArrayList<>(ordered.size());
        for (int i = 0; i < ordered.size(); i++) {
            Candidate c = ordered.get(i);
            List<String> nearby = new ArrayList<>();
            for (int j = 0; j < ordered.size(); j++) {
                if (i == j) continue;
                Candidate other = ordered.get(j);
                if (other.bbox().page() != c.bbox().page()) continue;
                if (c.bbox().distanceTo(other.bbox()) < NEARBY_DISTANCE) {
                    nearby.add(other.rawText());
                }
            }
            out.add(c.withNearbyText(nearby));
        }
        return out;
    }

    /**
     * Page, then line, then left to right. Lines are formed by walking candidates top-down and
     * starting a new line whenever the top edge moves more than {@link #LINE_BREAK} below the
     * line's first member.
     */
    static List<Candidate> readingOrder(List<Candidate> candidates) {
        List<Candidate> byTop = new ArrayList<>(candidates);
        byTop.sort(Comparator
                .comparingInt((Candidate c) -> c.bbox().page())
                .thenComparingDouble(c -> c.bbox().y())
                .thenComparingDouble(c -> c.bbox().x())
                .thenComparing(Candidate::id));

        List<Candidate> out = new ArrayList<>(byTop.size());
        List<Candidate> line = new ArrayList<>();
        Candidate lineStart = null;
        for (Candidate c : byTop) {
            boolean newLine = lineStart == null
                    || c.bbox().page() != lineStart.bbox().page()
                    || c.bbox().y() - lineStart.bbox().y() > LINE_BREAK;
            if (newLine) {
                flushLine(line, out);
                lineStart = c;
            }
            line.add(c);
        }
        flushLine(line, out);
        return out;
    }

    private static void flushLine(List<Candidate> line, List<Candidate> out) {
        line.sort(Comparator.comparingDouble((Candidate c) -> c.bbox().x()).thenComparing(Candidate::id));
        out.addAll(line);
        line.clear();
    }
}
