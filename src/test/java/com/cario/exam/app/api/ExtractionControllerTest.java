package com.cario.exam.app.api;

import static org.hamcrest.Matchers.hasSize;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.cario.exam.app.exception.ResourceNotFoundException;
import com.cario.exam.app.model.BoundingBox;
import com.cario.exam.app.model.CorrectionType;
import com.cario.exam.app.model.ExamDocument;
import com.cario.exam.app.model.ProcessingJob;
import com.cario.exam.app.model.Region;
import com.cario.exam.app.model.RegionCorrection;
import com.cario.exam.app.model.RegionType;
import com.cario.exam.app.repository.DocumentStore;
import com.cario.exam.app.service.correct.CorrectionResult;
import com.cario.exam.app.service.correct.RegionCorrectionService;
import com.cario.exam.app.service.diagnostics.ErrorRecorder;
import com.cario.exam.app.service.ocr.OcrEnsemble;
import com.cario.exam.app.service.pipeline.JobProgressBroker;
import com.cario.exam.app.service.pipeline.JobRunner;
import com.cario.exam.app.service.pipeline.ProcessingJobService;
import com.cario.exam.app.service.stats.StatisticsAggregator;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(ExtractionController.class)
class ExtractionControllerTest {

  @Autowired private MockMvc mvc;

  @MockBean private JobRunner jobRunner;
  @MockBean private ProcessingJobService jobService;
  @MockBean private JobProgressBroker broker;
  @MockBean private DocumentStore documents;
  @MockBean private RegionCorrectionService corrections;
  @MockBean private StatisticsAggregator aggregator;
  @MockBean private OcrEnsemble ensemble;
  @MockBean private ErrorRecorder errorRecorder;

  private static MockMultipartFile pdf(byte[] content) {
    return new MockMultipartFile("file", "paper.pdf", "application/pdf", content);
  }

  @Test
  void uploadQueuesAJob() throws Exception {
    when(jobRunner.submit(any(ExamDocument.class)))
        .thenReturn(ProcessingJob.newJob("job-1", "doc-1"));

    mvc.perform(multipart("/extraction/documents").file(pdf("%PDF-1.7".getBytes())))
        .andExpect(status().isAccepted())
        .andExpect(jsonPath("$.job_id").value("job-1"))
        .andExpect(jsonPath("$.document_id").value("doc-1"))
        .andExpect(jsonPath("$.status").value("pending"))
        .andExpect(jsonPath("$.progress_percentage").value(0));
  }

  @Test
  void emptyUploadIsABadRequest() throws Exception {
    mvc.perform(multipart("/extraction/documents").file(pdf(new byte[0])))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.error_code").value("BAD_REQUEST"));

    verify(jobRunner, never()).submit(any());
  }

  @Test
  void saturatedPoolAnswersBusy() throws Exception {
    when(jobRunner.submit(any(ExamDocument.class))).thenThrow(new TaskRejectedException("full"));

    mvc.perform(multipart("/extraction/documents").file(pdf("%PDF-1.7".getBytes())))
        .andExpect(status().isServiceUnavailable())
        .andExpect(jsonPath("$.error_code").value("BUSY"));
  }

  @Test
  void unknownJobIsNotFound() throws Exception {
    when(jobService.snapshot("nope")).thenThrow(new ResourceNotFoundException("job", "nope"));

    mvc.perform(get("/extraction/jobs/nope"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.error_code").value("NOT_FOUND"))
        .andExpect(jsonPath("$.error").value("job not found: nope"));
  }

  @Test
  void questionsOfAnUnknownDocumentAreNotFound() throws Exception {
    mvc.perform(get("/extraction/documents/missing/questions")).andExpect(status().isNotFound());
  }

  @Test
  void questionsAreListed() throws Exception {
    when(documents.exists("doc-1")).thenReturn(true);
    when(documents.findQuestions("doc-1")).thenReturn(List.of());

    mvc.perform(get("/extraction/documents/doc-1/questions"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$", hasSize(0)));
  }

  @Test
  void regionsAreShownWithAPreviewAndReviewFlag() throws Exception {
    Region region =
        Region.of(BoundingBox.of(10, 20, 300, 80), 1, RegionType.QUESTION, 0.65, "x".repeat(150));
    when(corrections.regions("doc-1", 1)).thenReturn(List.of(region));

    mvc.perform(get("/extraction/documents/doc-1/regions").param("page", "1"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[0].id").value(region.getId()))
        .andExpect(jsonPath("$[0].type").value("question"))
        .andExpect(jsonPath("$[0].needs_review").value(true))
        .andExpect(jsonPath("$[0].page_number").value(1))
        .andExpect(jsonPath("$[0].coordinates.width").value(300));
  }

  @Test
  void pageNumbersStartAtOne() throws Exception {
    mvc.perform(get("/extraction/documents/doc-1/regions").param("page", "0"))
        .andExpect(status().isBadRequest());

    verify(corrections, never()).regions(any(), any());
  }

  @Test
  void createdRegionAnswersCreated() throws Exception {
    Region created =
        Region.of(BoundingBox.of(5, 5, 50, 40), 2, RegionType.DIAGRAM, 1.0, "");
    RegionCorrection record =
        RegionCorrection.builder()
            .id("c1")
            .documentId("doc-1")
            .regionId(created.getId())
            .correctionType(CorrectionType.CREATE)
            .actor("ann")
            .build();
    when(corrections.create(
            eq("doc-1"), any(BoundingBox.class), eq(2), eq(RegionType.DIAGRAM), eq("ann")))
        .thenReturn(new CorrectionResult(List.of(created), List.of(), record));

    mvc.perform(
            post("/extraction/documents/doc-1/regions")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    "{\"coordinates\":{\"x\":5,\"y\":5,\"width\":50,\"height\":40},"
                        + "\"page_number\":2,\"type\":\"diagram\",\"actor\":\"ann\"}"))
        .andExpect(status().isCreated())
        .andExpect(jsonPath("$.regions[0].type").value("diagram"))
        .andExpect(jsonPath("$.correction.correction_type").value("create"))
        .andExpect(jsonPath("$.replaced_ids", hasSize(0)));
  }

  @Test
  void invalidCoordinatesFailValidation() throws Exception {
    mvc.perform(
            post("/extraction/documents/doc-1/regions")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    "{\"coordinates\":{\"x\":-1,\"y\":5,\"width\":0,\"height\":40},"
                        + "\"type\":\"diagram\"}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.error_code").value("VALIDATION_ERROR"));
  }

  @Test
  void mergeNeedsTwoRegions() throws Exception {
    mvc.perform(
            post("/extraction/documents/doc-1/regions/merge")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"region_ids\":[\"r1\"]}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.error_code").value("VALIDATION_ERROR"));
  }

  @Test
  void unknownSplitAxisIsABadRequest() throws Exception {
    mvc.perform(
            post("/extraction/documents/doc-1/regions/r1/split")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"split_at\":40,\"axis\":\"diagonal\"}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.error_code").value("BAD_REQUEST"));

    verify(corrections, never()).split(any(), any(), anyInt(), any(), isNull());
  }

  @Test
  void diagnosticsLimitIsBounded() throws Exception {
    when(errorRecorder.recent(5)).thenReturn(List.of());

    mvc.perform(get("/extraction/diagnostics/errors").param("limit", "5"))
        .andExpect(status().isOk());
    mvc.perform(get("/extraction/diagnostics/errors").param("limit", "500"))
        .andExpect(status().isBadRequest());
  }
}
