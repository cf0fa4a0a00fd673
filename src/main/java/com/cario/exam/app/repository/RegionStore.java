package com.cario.exam.app.repository;

import com.cario.exam.app.model.Region;
import com.cario.exam.app.model.RegionCorrection;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Repository;

/**
 * Saved regions and the correction log, per document.
 *
 * <p>Detection and manual correction can write the same page at the same time, so every mutation
 * of a document runs under that document's lock. The lock is reentrant: a caller holding it through
 * {@link #withLock} can read and write freely.
 */
@Log4j2
@Repository
public class RegionStore {

  private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();
  private final Map<String, Map<String, Region>> regions = new ConcurrentHashMap<>();
  private final Map<String, List<RegionCorrection>> corrections = new ConcurrentHashMap<>();

  public <T> T withLock(String documentId, Supplier<T> action) {
    ReentrantLock lock = locks.computeIfAbsent(documentId, k -> new ReentrantLock());
    lock.lock();
    try {
      return action.get();
    } finally {
      lock.unlock();
    }
  }

  /** Regions of a document ordered by page, then top to bottom. */
  public List<Region> list(String documentId) {
    return withLock(
        documentId,
        () ->
            regions.getOrDefault(documentId, Map.of()).values().stream()
                .sorted(
                    Comparator.comparingInt(Region::getPageNumber)
                        .thenComparingInt(Region::getY)
                        .thenComparingInt(Region::getX))
                .collect(Collectors.toList()));
  }

  public List<Region> list(String documentId, int pageNumber) {
    return list(documentId).stream()
        .filter(r -> r.getPageNumber() == pageNumber)
        .collect(Collectors.toList());
  }

  public Optional<Region> find(String documentId, String regionId) {
    return withLock(
        documentId,
        () -> Optional.ofNullable(regions.getOrDefault(documentId, Map.of()).get(regionId)));
  }

  /** Replaces every region of one page, as automatic detection does. */
  public void replacePage(String documentId, int pageNumber, Collection<Region> pageRegions) {
    withLock(
        documentId,
        () -> {
          Map<String, Region> byId = regionsOf(documentId);
          byId.values().removeIf(r -> r.getPageNumber() == pageNumber);
          pageRegions.forEach(r -> byId.put(r.getId(), r));
          log.debug(
              "regions.replacePage docId={} page={} count={}",
              documentId,
              pageNumber,
              pageRegions.size());
          return null;
        });
  }

  /** Removes {@code removedIds}, adds {@code added} and appends {@code correction}, atomically. */
  public void applyCorrection(
      String documentId,
      Collection<String> removedIds,
      Collection<Region> added,
      RegionCorrection correction) {
    withLock(
        documentId,
        () -> {
          Map<String, Region> byId = regionsOf(documentId);
          removedIds.forEach(byId::remove);
          added.forEach(r -> byId.put(r.getId(), r));
          corrections.computeIfAbsent(documentId, k -> new ArrayList<>()).add(correction);
          return null;
        });
  }

  public List<RegionCorrection> corrections(String documentId) {
    return withLock(
        documentId, () -> List.copyOf(corrections.getOrDefault(documentId, List.of())));
  }

  private Map<String, Region> regionsOf(String documentId) {
    return regions.computeIfAbsent(documentId, k -> new LinkedHashMap<>());
  }
}
