package com.cario.exam.app.service.correct;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.cario.exam.app.exception.ResourceNotFoundException;
import com.cario.exam.app.model.BoundingBox;
import com.cario.exam.app.model.CorrectionStats;
import com.cario.exam.app.model.ExamDocument;
import com.cario.exam.app.model.Region;
import com.cario.exam.app.model.RegionType;
import com.cario.exam.app.repository.InMemoryDocumentStore;
import com.cario.exam.app.repository.RegionStore;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class RegionCorrectionServiceTest {

  private static final String DOC = "doc-1";

  private RegionStore store;
  private RegionCorrectionService service;
  private Region region;

  @BeforeEach
  void setUp() {
    InMemoryDocumentStore documents = new InMemoryDocumentStore();
    documents.save(ExamDocument.builder().id(DOC).filename("paper.pdf").build());
    store = new RegionStore();
    service = new RegionCorrectionService(documents, store, new RegionCorrector());
    region = Region.of(BoundingBox.of(0, 0, 100, 100), 1, RegionType.QUESTION, 0.9, "q");
    store.replacePage(DOC, 1, List.of(region));
  }

  @Test
  void splitReplacesTheStoredRegion() {
    service.split(DOC, region.getId(), 40, SplitAxis.VERTICAL, "ann");

    List<Region> stored = service.regions(DOC, 1);
    assertEquals(2, stored.size());
    assertFalse(stored.stream().anyMatch(r -> r.getId().equals(region.getId())));
    assertTrue(stored.stream().allMatch(r -> r.getConfidence() <= 0.9));
  }

  @Test
  void editsOnUnknownDocumentsOrRegionsAreNotFound() {
    assertThrows(
        ResourceNotFoundException.class, () -> service.delete("missing", region.getId(), "a"));
    assertThrows(ResourceNotFoundException.class, () -> service.delete(DOC, "nope", "a"));
    assertThrows(
        ResourceNotFoundException.class,
        () -> service.merge(DOC, List.of(region.getId(), "nope"), "a"));
    assertEquals(1, service.regions(DOC, null).size());
  }

  @Test
  void correctionLogFeedsTheStatistics() {
    Region created =
        service.create(DOC, BoundingBox.of(0, 200, 100, 50), 1, RegionType.DIAGRAM, "bob").single();
    service.move(DOC, region.getId(), 5, 5, "ann");
    service.move(DOC, created.getId(), 0, 10, "ann");
    service.merge(DOC, List.of(region.getId(), created.getId()), "ann");

    CorrectionStats stats = service.correctionStats(DOC);

    assertEquals(4, stats.getTotal());
    assertEquals(2L, stats.getByType().get("move"));
    assertEquals(2, stats.getUniqueActors());
    assertEquals("move", stats.getMostCommonType());
    assertEquals(1, service.regions(DOC, 1).size());
    assertEquals(4, service.corrections(DOC).size());
  }
}
