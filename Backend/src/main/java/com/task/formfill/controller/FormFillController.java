package com.task.formfill.controller;

import com.task.formfill.model.AutoFillRequest;
import com.task.formfill.model.AutoFillResult;
import com.task.formfill.model.ClassificationResult;
import com.task.formfill.model.ClassifyRequest;
import com.task.formfill.model.ExtractionResult;
import com.task.formfill.model.FieldMapping;
import com.task.formfill.model.ManualMappingRequest;
import com.task.formfill.model.PipelineResult;
import com.task.formfill.model.RenderRequest;
import com.task.formfill.model.RenderResult;
import com.task.formfill.service.CandidateExtractor;
import com.task.formfill.service.CandidateGrouper;
import com.task.formfill.service.ErrorKind;
import com.task.formfill.service.FieldClassifier;
import com.task.formfill.service.FormFillPipeline;
import com.task.formfill.service.ProcessingException;
import com.task.formfill.service.autofill.AutoFillService;
import com.task.formfill.service.render.DocumentRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.Map;

@RestController
@RequestMapping("/v1/forms")
@CrossOrigin(origins = "*")
public class FormFillController {

    private static final Logger log = LoggerFactory.getLogger(FormFillController.class);

    private final CandidateExtractor extractor;
    private final CandidateGrouper grouper;
    private final FieldClassifier classifier;
    private final AutoFillService autoFillService;
    private final DocumentRenderer renderer;
    private final FormFillPipeline pipeline;

    public FormFillController(
            CandidateExtractor extractor,
            CandidateGrouper grouper,
            FieldClassifier classifier,
            AutoFillService autoFillService,
            DocumentRenderer renderer,
            FormFillPipeline pipeline
    ) {
        this.extractor = extractor;
        this.grouper = grouper;
        this.classifier = classifier;
        this.autoFillService = autoFillService;
        this.renderer = renderer;
        this.pipeline = pipeline;
    }

    @PostMapping(value = "/extract", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<?> extract(@RequestParam("file") MultipartFile file) {
        try {
            ExtractionResult result = extractor.extract(file.getBytes(), file.getContentType());
            if (!result.success()) {
                return failure(ErrorKind.fromName(result.errorKind()), result.error());
            }
            ExtractionResult grouped = result.withCandidates(grouper.group(result.candidates()));
            return ResponseEntity.ok(Map.of(
                    "success", true,
                    "data", grouped
            ));
        } catch (IOException e) {
            return failure(ErrorKind.VALIDATION_FAILURE, "Could not read uploaded file: " + e.getMessage());
        }
    }

    @PostMapping("/classify")
    public ResponseEntity<?> classify(@RequestBody ClassifyRequest request) {
        if (request == null || request.candidates() == null) {
            return failure(ErrorKind.VALIDATION_FAILURE, "candidates are required");
        }
        ClassificationResult result = classifier.classify(request.candidates());
        if (!result.success()) {
            return failure(ErrorKind.PROVIDER_FAILURE, result.error());
        }
        return ResponseEntity.ok(Map.of(
                "success", true,
                "data", result
        ));
    }

    @PostMapping("/autofill")
    public ResponseEntity<?> autofill(@RequestBody AutoFillRequest request) {
        try {
            if (request.fields() == null) {
                return failure(ErrorKind.VALIDATION_FAILURE, "fields are required");
            }
            AutoFillResult result = autoFillService.autoFill(request.fields(), request.userId(), request.householdMemberId());
            return ResponseEntity.ok(Map.of(
                    "success", true,
                    "data", result
            ));
        } catch (ProcessingException e) {
            return failure(e.getKind(), e.getMessage());
        }
    }

    @PostMapping("/mappings/manual")
    public ResponseEntity<?> manualMapping(@RequestBody ManualMappingRequest request) {
        try {
            FieldMapping mapping = autoFillService.applyManualEdit(
                    request.userId(), request.field(), request.value(), request.saveToProfile());
            return ResponseEntity.ok(Map.of(
                    "success", true,
                    "data", mapping,
                    "saved_to_profile", request.saveToProfile()
            ));
        } catch (ProcessingException e) {
            return failure(e.getKind(), e.getMessage());
        }
    }

    @PostMapping(value = "/process", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<?> process(
            @RequestParam("file") MultipartFile file,
            @RequestParam(value = "userId", required = false) String userId,
            @RequestParam(value = "householdMemberId", required = false) String householdMemberId
    ) {
        try {
            PipelineResult result = pipeline.process(file.getBytes(), file.getContentType(), userId, householdMemberId);
            return ResponseEntity.ok(Map.of(
                    "success", true,
                    "data", result
            ));
        } catch (ProcessingException e) {
            return failure(e.getKind(), e.getMessage());
        } catch (IOException e) {
            return failure(ErrorKind.VALIDATION_FAILURE, "Could not read uploaded file: " + e.getMessage());
        }
    }

    @PostMapping("/render")
    public ResponseEntity<?> render(@RequestBody RenderRequest request) {
        try {
            RenderResult result = renderer.render(request);
            return ResponseEntity.ok()
                    .contentType(MediaType.APPLICATION_PDF)
                    .header("X-Page-Count", String.valueOf(result.pageCount()))
                    .header("X-Skipped-Fields", String.join(",", result.skippedFieldIds()))
                    .body(result.document());
        } catch (ProcessingException e) {
            return failure(e.getKind(), e.getMessage());
        }
    }

    @GetMapping("/health")
    public ResponseEntity<?> health() {
        return ResponseEntity.ok(Map.of(
                "status", "healthy",
                "features", new String[]{
                        "candidate_extraction",
                        "field_classification",
                        "auto_fill",
                        "manual_mapping",
                        "pdf_rendering"
                }
        ));
    }

    private ResponseEntity<?> failure(ErrorKind kind, String message) {
        log.warn("Request failed ({}): {}", kind, message);
        return ResponseEntity.status(statusOf(kind)).body(Map.of(
                "success", false,
                "error", "Processing failed",
                "kind", kind.name(),
                "detail", String.valueOf(message)
        ));
    }

    static HttpStatus statusOf(ErrorKind kind) {
        switch (kind) {
            case VALIDATION_FAILURE:
            case UNSUPPORTED_INPUT:
                return HttpStatus.BAD_REQUEST;
            case PROVIDER_FAILURE:
                return HttpStatus.BAD_GATEWAY;
            default:
                return HttpStatus.INTERNAL_SERVER_ERROR;
        }
    }
}
