package com.cario.exam.app.api;

import com.cario.exam.app.exception.ResourceNotFoundException;
import com.cario.exam.app.model.BoundingBox;
import com.cario.exam.app.model.DocumentStatistics;
import com.cario.exam.app.model.ExamDocument;
import com.cario.exam.app.model.ExtractedQuestion;
import com.cario.exam.app.model.JobStatusSnapshot;
import com.cario.exam.app.model.OcrResult;
import com.cario.exam.app.model.ProcessingJob;
import com.cario.exam.app.model.RegionCorrection;
import com.cario.exam.app.model.RegionType;
import com.cario.exam.app.repository.DocumentStore;
import com.cario.exam.app.service.correct.CorrectionResult;
import com.cario.exam.app.service.correct.RegionCorrectionService;
import com.cario.exam.app.service.correct.SplitAxis;
import com.cario.exam.app.service.diagnostics.ErrorRecorder;
import com.cario.exam.app.service.ocr.OcrEnsemble;
import com.cario.exam.app.service.ocr.OcrStatsCollector;
import com.cario.exam.app.service.pipeline.JobProgressBroker;
import com.cario.exam.app.service.pipeline.JobRunner;
import com.cario.exam.app.service.pipeline.ProcessingJobService;
import com.cario.exam.app.service.stats.StatisticsAggregator;
import com.cario.exam.app.util.ImageUtils;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.apache.commons.io.FilenameUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

@Log4j2
@Validated
@RestController
@RequestMapping("/extraction")
@RequiredArgsConstructor
public class ExtractionController {

  private final JobRunner jobRunner;
  private final ProcessingJobService jobService;
  private final JobProgressBroker broker;
  private final DocumentStore documents;
  private final RegionCorrectionService corrections;
  private final StatisticsAggregator aggregator;
  private final OcrEnsemble ensemble;
  private final ErrorRecorder errorRecorder;

  @Value("${extraction.api.sse-timeout-ms:600000}")
  private long sseTimeoutMs;

  // ------------------------------------------------------------
  // /extraction/documents
  // ------------------------------------------------------------
  @PostMapping(
      path = "/documents",
      consumes = MediaType.MULTIPART_FORM_DATA_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<JobStatusSnapshot> upload(@RequestPart("file") @NotNull MultipartFile file)
      throws IOException {
    String filename = file.getOriginalFilename();
    if (file.isEmpty()) {
      throw new IllegalArgumentException("uploaded file is empty");
    }
    ExamDocument document =
        ExamDocument.builder()
            .filename(filename)
            .contentType(file.getContentType())
            .extension(extensionOf(filename))
            .content(file.getBytes())
            .build();
    ProcessingJob job = jobRunner.submit(document);
    log.info(
        "extraction.upload docId={} jobId={} filename={} bytes={}",
        document.getId(),
        job.getId(),
        filename,
        file.getSize());
    return ResponseEntity.status(HttpStatus.ACCEPTED).body(JobStatusSnapshot.of(job, null));
  }

  // ------------------------------------------------------------
  // /extraction/jobs
  // ------------------------------------------------------------
  @GetMapping(path = "/jobs/{jobId}", produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<JobStatusSnapshot> getJob(@PathVariable("jobId") String jobId) {
    return ResponseEntity.ok(jobService.snapshot(jobId));
  }

  /** Streams snapshots until the job reaches a terminal state. */
  @GetMapping(path = "/jobs/{jobId}/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
  public SseEmitter events(@PathVariable("jobId") String jobId) {
    JobStatusSnapshot current = jobService.snapshot(jobId);
    SseEmitter emitter = new SseEmitter(sseTimeoutMs);
    AtomicBoolean done = new AtomicBoolean(false);
    Consumer<JobStatusSnapshot> push =
        snapshot -> {
          synchronized (emitter) {
            if (done.get()) {
              return;
            }
            try {
              emitter.send(SseEmitter.event().name("progress").data(snapshot));
            } catch (IOException e) {
              done.set(true);
              throw new UncheckedIOException(e);
            }
            if (snapshot.getStatus().isTerminal()) {
              done.set(true);
              emitter.complete();
            }
          }
        };

    push.accept(current);
    if (done.get()) {
      return emitter;
    }
    JobProgressBroker.Subscription sub = broker.subscribe(jobId, push);
    emitter.onCompletion(sub::close);
    emitter.onTimeout(sub::close);
    emitter.onError(t -> sub.close());

    // the job may have finished between the first snapshot and the subscription
    push.accept(jobService.snapshot(jobId));
    return emitter;
  }

  // ------------------------------------------------------------
  // /extraction/documents/{id}/questions|statistics
  // ------------------------------------------------------------
  @GetMapping(
      path = "/documents/{documentId}/questions",
      produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<List<ExtractedQuestion>> questions(
      @PathVariable("documentId") String documentId) {
    requireDocument(documentId);
    return ResponseEntity.ok(documents.findQuestions(documentId));
  }

  @GetMapping(
      path = "/documents/{documentId}/statistics",
      produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<DocumentStatistics> statistics(
      @PathVariable("documentId") String documentId) {
    requireDocument(documentId);
    return ResponseEntity.ok(aggregator.aggregate(documents.findQuestions(documentId)));
  }

  // ------------------------------------------------------------
  // /extraction/documents/{id}/regions
  // ------------------------------------------------------------
  @GetMapping(path = "/documents/{documentId}/regions", produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<List<RegionView>> regions(
      @PathVariable("documentId") String documentId,
      @RequestParam(name = "page", required = false) @Min(1) Integer page) {
    return ResponseEntity.ok(RegionView.of(corrections.regions(documentId, page)));
  }

  @PostMapping(
      path = "/documents/{documentId}/regions",
      consumes = MediaType.APPLICATION_JSON_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<CorrectionResponse> create(
      @PathVariable("documentId") String documentId, @RequestBody @Valid CreateRequest req) {
    CorrectionResult result =
        corrections.create(
            documentId,
            req.getCoordinates().toBox(),
            req.getPageNumber(),
            RegionType.fromValue(req.getType()),
            req.getActor());
    return ResponseEntity.status(HttpStatus.CREATED).body(CorrectionResponse.of(result));
  }

  @PostMapping(
      path = "/documents/{documentId}/regions/{regionId}/resize",
      consumes = MediaType.APPLICATION_JSON_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<CorrectionResponse> resize(
      @PathVariable("documentId") String documentId,
      @PathVariable("regionId") String regionId,
      @RequestBody @Valid ResizeRequest req) {
    CorrectionResult result =
        corrections.resize(documentId, regionId, req.getCoordinates().toBox(), req.getActor());
    return ResponseEntity.ok(CorrectionResponse.of(result));
  }

  @PostMapping(
      path = "/documents/{documentId}/regions/{regionId}/move",
      consumes = MediaType.APPLICATION_JSON_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<CorrectionResponse> move(
      @PathVariable("documentId") String documentId,
      @PathVariable("regionId") String regionId,
      @RequestBody @Valid MoveRequest req) {
    CorrectionResult result =
        corrections.move(documentId, regionId, req.getDx(), req.getDy(), req.getActor());
    return ResponseEntity.ok(CorrectionResponse.of(result));
  }

  @PostMapping(
      path = "/documents/{documentId}/regions/{regionId}/split",
      consumes = MediaType.APPLICATION_JSON_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<CorrectionResponse> split(
      @PathVariable("documentId") String documentId,
      @PathVariable("regionId") String regionId,
      @RequestBody @Valid SplitRequest req) {
    CorrectionResult result =
        corrections.split(
            documentId,
            regionId,
            req.getSplitAt(),
            SplitAxis.fromValue(req.getAxis()),
            req.getActor());
    return ResponseEntity.ok(CorrectionResponse.of(result));
  }

  @PostMapping(
      path = "/documents/{documentId}/regions/merge",
      consumes = MediaType.APPLICATION_JSON_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<CorrectionResponse> merge(
      @PathVariable("documentId") String documentId, @RequestBody @Valid MergeRequest req) {
    CorrectionResult result = corrections.merge(documentId, req.getRegionIds(), req.getActor());
    return ResponseEntity.ok(CorrectionResponse.of(result));
  }

  @PostMapping(
      path = "/documents/{documentId}/regions/{regionId}/retype",
      consumes = MediaType.APPLICATION_JSON_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<CorrectionResponse> retype(
      @PathVariable("documentId") String documentId,
      @PathVariable("regionId") String regionId,
      @RequestBody @Valid RetypeRequest req) {
    CorrectionResult result =
        corrections.retype(
            documentId, regionId, RegionType.fromValue(req.getType()), req.getActor());
    return ResponseEntity.ok(CorrectionResponse.of(result));
  }

  @DeleteMapping(
      path = "/documents/{documentId}/regions/{regionId}",
      produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<CorrectionResponse> delete(
      @PathVariable("documentId") String documentId,
      @PathVariable("regionId") String regionId,
      @RequestParam(name = "actor", required = false) String actor) {
    return ResponseEntity.ok(
        CorrectionResponse.of(corrections.delete(documentId, regionId, actor)));
  }

  @GetMapping(
      path = "/documents/{documentId}/corrections",
      produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<Map<String, Object>> corrections(
      @PathVariable("documentId") String documentId) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("document_id", documentId);
    body.put("corrections", corrections.corrections(documentId));
    body.put("statistics", corrections.correctionStats(documentId));
    return ResponseEntity.ok(body);
  }

  // ------------------------------------------------------------
  // /extraction/ocr
  // ------------------------------------------------------------
  @PostMapping(
      path = "/ocr",
      consumes = MediaType.MULTIPART_FORM_DATA_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<OcrResult> ocr(
      @RequestPart("file") @NotNull MultipartFile file,
      @RequestParam(name = "engines", required = false) List<String> engines,
      @RequestParam(name = "preprocess", defaultValue = "true") boolean preprocess)
      throws IOException {
    BufferedImage image = ImageUtils.read(file.getBytes());
    if (image == null) {
      throw new IllegalArgumentException("not a readable image: " + file.getOriginalFilename());
    }
    OcrResult result = ensemble.extract(image, engines, preprocess);
    log.info(
        "extraction.ocr filename={} engine={} confidence={}",
        file.getOriginalFilename(),
        result.getEngineId(),
        result.getConfidence());
    return ResponseEntity.ok(result);
  }

  @GetMapping(path = "/ocr/stats", produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<OcrStatsCollector.Snapshot> ocrStats() {
    return ResponseEntity.ok(ensemble.stats().snapshot());
  }

  // ------------------------------------------------------------
  // /extraction/diagnostics
  // ------------------------------------------------------------
  @GetMapping(path = "/diagnostics/errors", produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<List<ErrorRecorder.Entry>> recentErrors(
      @RequestParam(name = "limit", defaultValue = "20") @Min(1) @Max(100) int limit) {
    return ResponseEntity.ok(errorRecorder.recent(limit));
  }

  // ============================================================
  // DTOs
  // ============================================================
  @Data
  public static class Coordinates {
    @Min(0)
    private int x;

    @Min(0)
    private int y;

    @Min(1)
    private int width;

    @Min(1)
    private int height;

    BoundingBox toBox() {
      return BoundingBox.of(x, y, width, height);
    }
  }

  @Data
  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public static class CreateRequest {
    @NotNull @Valid private Coordinates coordinates;

    @Min(1)
    private int pageNumber = 1;

    @NotBlank private String type;
    private String actor;
  }

  @Data
  public static class ResizeRequest {
    @NotNull @Valid private Coordinates coordinates;
    private String actor;
  }

  @Data
  public static class MoveRequest {
    private int dx;
    private int dy;
    private String actor;
  }

  @Data
  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public static class SplitRequest {
    @Min(1)
    private int splitAt;

    /** horizontal or vertical. */
    @NotBlank private String axis;

    private String actor;
  }

  @Data
  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public static class MergeRequest {
    @NotNull
    @Size(min = 2)
    private List<@NotBlank String> regionIds;

    private String actor;
  }

  @Data
  public static class RetypeRequest {
    @NotBlank private String type;
    private String actor;
  }

  @lombok.Value
  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public static class CorrectionResponse {
    List<RegionView> regions;
    List<String> replacedIds;
    RegionCorrection correction;

    static CorrectionResponse of(CorrectionResult result) {
      return new CorrectionResponse(
          RegionView.of(result.getRegions()), result.getReplacedIds(), result.getCorrection());
    }
  }

  // ============================================================
  // Helpers
  // ============================================================
  private static String extensionOf(String filename) {
    return filename == null ? "" : FilenameUtils.getExtension(filename).toLowerCase(Locale.ROOT);
  }

  private void requireDocument(String documentId) {
    if (!documents.exists(documentId)) {
      throw new ResourceNotFoundException("document", documentId);
    }
  }
}
