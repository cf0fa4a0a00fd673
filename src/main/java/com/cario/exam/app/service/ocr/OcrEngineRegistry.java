package com.cario.exam.app.service.ocr;

import com.cario.exam.app.exception.OcrProcessingException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import lombok.extern.log4j.Log4j2;

/**
 * The engines this deployment can use. Engines that are unavailable at construction are left out;
 * engines that become unavailable later (e.g. a native library that fails to link) are skipped at
 * selection time.
 */
@Log4j2
public class OcrEngineRegistry {

  private final Map<String, OcrEngine> engines = new LinkedHashMap<>();
  private final List<String> defaultEngines;

  public OcrEngineRegistry(
      Collection<? extends OcrEngine> candidates, List<String> defaultEngines) {
    Objects.requireNonNull(candidates, "candidates must not be null");
    for (OcrEngine e : candidates) {
      if (e.isAvailable()) {
        engines.put(e.id(), e);
      } else {
        log.info("ocr.engine.unavailable id={}", e.id());
      }
    }
    this.defaultEngines = defaultEngines == null ? List.of() : List.copyOf(defaultEngines);
    log.info("ocr.registry.init engines={} defaults={}", engines.keySet(), this.defaultEngines);
  }

  public Set<String> availableIds() {
    return Set.copyOf(engines.keySet());
  }

  /**
   * Resolves the engines for one call. With no request the configured defaults are used, or every
   * available engine when none of the defaults is present.
   *
   * @throws OcrProcessingException when nothing usable remains
   */
  public List<OcrEngine> select(Collection<String> requested) {
    List<OcrEngine> selected = new ArrayList<>();
    if (requested == null || requested.isEmpty()) {
      defaultEngines.forEach(id -> addIfUsable(id, selected));
      if (selected.isEmpty()) {
        engines.values().stream().filter(OcrEngine::isAvailable).forEach(selected::add);
      }
    } else {
      for (String id : requested) {
        if (!engines.containsKey(id)) {
          log.warn("ocr.engine.unknown id={} available={}", id, engines.keySet());
        }
        addIfUsable(id, selected);
      }
    }
    if (selected.isEmpty()) {
      throw new OcrProcessingException(
          "No OCR engines available",
          Map.of("requested", requested == null ? List.of() : List.copyOf(requested)),
          null);
    }
    return selected;
  }

  private void addIfUsable(String id, List<OcrEngine> into) {
    OcrEngine e = engines.get(id);
    if (e != null && e.isAvailable() && !into.contains(e)) {
      into.add(e);
    }
  }
}
