package com.cario.exam.app.service.correct;

import com.cario.exam.app.exception.ResourceNotFoundException;
import com.cario.exam.app.model.BoundingBox;
import com.cario.exam.app.model.CorrectionStats;
import com.cario.exam.app.model.Region;
import com.cario.exam.app.model.RegionCorrection;
import com.cario.exam.app.model.RegionType;
import com.cario.exam.app.repository.DocumentStore;
import com.cario.exam.app.repository.RegionStore;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Service;

/**
 * Applies manual edits to a document's saved regions.
 *
 * <p>Each edit reads the current region, computes the result and writes both the regions and the
 * audit entry while holding the document's lock, so an edit never works from a stale region.
 */
@Log4j2
@Service
@RequiredArgsConstructor
public class RegionCorrectionService {

  private final DocumentStore documents;
  private final RegionStore regions;
  private final RegionCorrector corrector;

  public List<Region> regions(String documentId, Integer page) {
    requireDocument(documentId);
    return page == null ? regions.list(documentId) : regions.list(documentId, page);
  }

  public CorrectionResult resize(
      String documentId, String regionId, BoundingBox box, String actor) {
    return apply(documentId, regionId, r -> corrector.resize(documentId, r, box, actor));
  }

  public CorrectionResult move(String documentId, String regionId, int dx, int dy, String actor) {
    return apply(documentId, regionId, r -> corrector.move(documentId, r, dx, dy, actor));
  }

  public CorrectionResult split(
      String documentId, String regionId, int at, SplitAxis axis, String actor) {
    return apply(documentId, regionId, r -> corrector.split(documentId, r, at, axis, actor));
  }

  public CorrectionResult retype(
      String documentId, String regionId, RegionType type, String actor) {
    return apply(documentId, regionId, r -> corrector.retype(documentId, r, type, actor));
  }

  public CorrectionResult delete(String documentId, String regionId, String actor) {
    return apply(documentId, regionId, r -> corrector.delete(documentId, r, actor));
  }

  public CorrectionResult merge(String documentId, List<String> regionIds, String actor) {
    requireDocument(documentId);
    return regions.withLock(
        documentId,
        () -> {
          List<Region> sources = new ArrayList<>();
          for (String id : regionIds) {
            sources.add(requireRegion(documentId, id));
          }
          return commit(documentId, corrector.merge(documentId, sources, actor));
        });
  }

  public CorrectionResult create(
      String documentId, BoundingBox box, int pageNumber, RegionType type, String actor) {
    requireDocument(documentId);
    return regions.withLock(
        documentId,
        () -> commit(documentId, corrector.create(documentId, box, pageNumber, type, actor)));
  }

  // -------------------- AUDIT --------------------

  public List<RegionCorrection> corrections(String documentId) {
    requireDocument(documentId);
    return regions.corrections(documentId);
  }

  public CorrectionStats correctionStats(String documentId) {
    List<RegionCorrection> entries = corrections(documentId);
    Map<String, Long> byType =
        entries.stream()
            .collect(
                Collectors.groupingBy(
                    c -> c.getCorrectionType().value(), TreeMap::new, Collectors.counting()));
    String mostCommon =
        byType.entrySet().stream()
            .max(Map.Entry.comparingByValue())
            .map(Map.Entry::getKey)
            .orElse(null);
    long actors = entries.stream().map(RegionCorrection::getActor).distinct().count();
    return CorrectionStats.builder()
        .total(entries.size())
        .byType(byType)
        .uniqueActors(actors)
        .mostCommonType(mostCommon)
        .build();
  }

  // -------------------- INTERNALS --------------------

  private CorrectionResult apply(
      String documentId, String regionId, Function<Region, CorrectionResult> edit) {
    requireDocument(documentId);
    return regions.withLock(
        documentId, () -> commit(documentId, edit.apply(requireRegion(documentId, regionId))));
  }

  private CorrectionResult commit(String documentId, CorrectionResult result) {
    RegionCorrection c = result.getCorrection();
    regions.applyCorrection(documentId, result.getReplacedIds(), result.getRegions(), c);
    log.info(
        "region.correction docId={} regionId={} type={} actor={} produced={}",
        documentId,
        c.getRegionId(),
        c.getCorrectionType().value(),
        c.getActor(),
        result.getRegions().size());
    return result;
  }

  private void requireDocument(String documentId) {
    Objects.requireNonNull(documentId, "documentId must not be null");
    if (!documents.exists(documentId)) {
      throw new ResourceNotFoundException("document", documentId);
    }
  }

  private Region requireRegion(String documentId, String regionId) {
    return regions
        .find(documentId, regionId)
        .orElseThrow(() -> new ResourceNotFoundException("region", regionId));
  }
}
