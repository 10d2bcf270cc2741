package com.task.formfill.service;

import com.task.formfill.model.AutoFillResult;
import com.task.formfill.model.Candidate;
import com.task.formfill.model.ClassificationResult;
import com.task.formfill.model.ExtractionResult;
import com.task.formfill.model.PipelineResult;
import com.task.formfill.service.autofill.AutoFillService;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Runs Extract, Group, Classify and Resolve for one document, strictly in that order. Nothing
 * is written anywhere until the caller takes the result.
 */
@Service
public class FormFillPipeline {

    private static final Logger log = LoggerFactory.getLogger(FormFillPipeline.class);

    private final CandidateExtractor extractor;
    private final CandidateGrouper grouper;
    private final FieldClassifier classifier;
    private final AutoFillService autoFill;
    private final Tracer tracer;

    public FormFillPipeline(
            CandidateExtractor extractor,
            CandidateGrouper grouper,
            FieldClassifier classifier,
            AutoFillService autoFill,
            Tracer tracer
    ) {
        this.extractor = extractor;
        this.grouper = grouper;
        this.classifier = classifier;
        this.autoFill = autoFill;
        this.tracer = tracer;
    }

    public PipelineResult process(byte[] document, String mimeType, String userId, String householdMemberId) {
        if (userId == null || userId.isBlank()) {
            throw ProcessingException.validation("userId is required");
        }
        long t0 = System.currentTimeMillis();

        Span root = tracer.spanBuilder("pipeline.process")
                .setAttribute("langfuse.trace.name", "form-fill")
                .setAttribute("langfuse.user.id", userId)
                .setAttribute("mime.type", String.valueOf(mimeType))
                .startSpan();

        try (Scope ignored = root.makeCurrent()) {
            ExtractionResult extraction = extractor.extract(document, mimeType);
            if (!extraction.success()) {
                throw new ProcessingException(ErrorKind.fromName(extraction.errorKind()), extraction.error());
            }

            List<Candidate> candidates = grouper.group(extraction.candidates());

            ClassificationResult classification = classifier.classify(candidates);
            if (!classification.success()) {
                throw ProcessingException.provider(classification.error(), null);
            }

            AutoFillResult mappings = autoFill.autoFill(classification.fields(), userId, householdMemberId);

            long elapsed = System.currentTimeMillis() - t0;
            root.setAttribute("candidates.count", candidates.size());
            root.setAttribute("fields.count", classification.fields().size());
            root.setAttribute("fields.filled", mappings.autoFilledCount());
            log.info("Processed document for user {}: {} candidates, {} fields, {} auto-filled in {} ms",
                    userId, candidates.size(), classification.fields().size(), mappings.autoFilledCount(), elapsed);

            return new PipelineResult(candidates, classification.fields(), mappings, classification.warnings(), elapsed);
        } catch (ProcessingException ex) {
            root.setAttribute("error", true);
            root.setAttribute("error.kind", ex.getKind().name());
            root.setAttribute("error.message", String.valueOf(ex.getMessage()));
            throw ex;
        } finally {
            root.end();
        }
    }
}
