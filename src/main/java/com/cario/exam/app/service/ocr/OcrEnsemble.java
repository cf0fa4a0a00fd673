package com.cario.exam.app.service.ocr;

import com.cario.exam.app.exception.OcrProcessingException;
import com.cario.exam.app.model.OcrResult;
import com.cario.exam.app.service.preprocess.ImagePreprocessor;
import com.cario.exam.app.service.preprocess.PreprocessingResult;
import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.extern.log4j.Log4j2;

/**
 * Runs the selected OCR engines over one image and picks the best answer.
 *
 * <p>Engines run concurrently on a pool sized to the number of engines selected for the call. A
 * failing or timed-out engine is logged and counted; the call only fails when no engine produced a
 * result. The best result maximizes confidence first, then trimmed text length.
 */
@Log4j2
public class OcrEnsemble {

  static final Comparator<OcrResult> BEST =
      Comparator.comparingDouble(OcrResult::getConfidence).thenComparingInt(OcrResult::textLength);

  private static final AtomicInteger POOL_SEQ = new AtomicInteger();

  private final OcrEngineRegistry registry;
  private final ImagePreprocessor preprocessor;
  private final OcrStatsCollector stats;
  private final long engineTimeoutSeconds;

  public OcrEnsemble(
      OcrEngineRegistry registry,
      ImagePreprocessor preprocessor,
      OcrStatsCollector stats,
      long engineTimeoutSeconds) {
    this.registry = Objects.requireNonNull(registry, "registry must not be null");
    this.preprocessor = Objects.requireNonNull(preprocessor, "preprocessor must not be null");
    this.stats = Objects.requireNonNull(stats, "stats must not be null");
    this.engineTimeoutSeconds = engineTimeoutSeconds;
  }

  /** Best result from the default engines over the preprocessed image. */
  public OcrResult extract(BufferedImage image) {
    return extract(image, null, true);
  }

  public OcrResult extract(BufferedImage image, Collection<String> engines, boolean preprocess) {
    List<OcrResult> results = extractAll(image, engines, preprocess);
    OcrResult best = results.stream().max(BEST).orElseThrow();
    log.debug(
        "ocr.ensemble.best engine={} confidence={} chars={}",
        best.getEngineId(),
        best.getConfidence(),
        best.textLength());
    return best;
  }

  /**
   * Every successful engine result, in selection order.
   *
   * @throws OcrProcessingException when no engine is available or every engine failed
   */
  public List<OcrResult> extractAll(
      BufferedImage image, Collection<String> engines, boolean preprocess) {
    Objects.requireNonNull(image, "image must not be null");
    List<OcrEngine> selected = registry.select(engines);
    stats.recordRequest();

    long t0 = System.nanoTime();
    PreprocessingResult prep =
        preprocess ? preprocessor.enhance(image) : PreprocessingResult.unchanged(image);

    ExecutorService pool =
        Executors.newFixedThreadPool(
            selected.size(),
            r -> {
              Thread t = new Thread(r, "ocr-ensemble-" + POOL_SEQ.incrementAndGet());
              t.setDaemon(true);
              return t;
            });
    Map<String, Future<OcrResult>> futures = new LinkedHashMap<>();
    try {
      for (OcrEngine engine : selected) {
        futures.put(engine.id(), pool.submit(() -> runEngine(engine, prep)));
      }

      List<OcrResult> results = new ArrayList<>();
      Map<String, String> failures = new LinkedHashMap<>();
      for (Map.Entry<String, Future<OcrResult>> e : futures.entrySet()) {
        String id = e.getKey();
        try {
          results.add(e.getValue().get(engineTimeoutSeconds, TimeUnit.SECONDS));
        } catch (ExecutionException ex) {
          Throwable cause = ex.getCause() == null ? ex : ex.getCause();
          failures.put(id, String.valueOf(cause.getMessage()));
          stats.recordEngineFailure(id);
          log.warn("ocr.engine.failed id={} msg={}", id, cause.getMessage());
        } catch (TimeoutException ex) {
          e.getValue().cancel(true);
          failures.put(id, "timed out after " + engineTimeoutSeconds + "s");
          stats.recordEngineFailure(id);
          log.warn("ocr.engine.timeout id={} seconds={}", id, engineTimeoutSeconds);
        } catch (InterruptedException ex) {
          Thread.currentThread().interrupt();
          throw new OcrProcessingException("OCR interrupted", ex);
        }
      }

      long durationMs = (System.nanoTime() - t0) / 1_000_000;
      if (results.isEmpty()) {
        log.error("ocr.ensemble.error engines={} failures={}", futures.keySet(), failures);
        throw new OcrProcessingException(
            "All OCR engines failed", Map.of("failures", failures), null);
      }
      log.info(
          "ocr.ensemble.success engines={} succeeded={} failed={} preprocessing={} durationMs={}",
          futures.keySet(),
          results.size(),
          failures.keySet(),
          prep.getAppliedSteps(),
          durationMs);
      return results;
    } finally {
      pool.shutdownNow();
    }
  }

  public OcrStatsCollector stats() {
    return stats;
  }

  private OcrResult runEngine(OcrEngine engine, PreprocessingResult prep) {
    long t0 = System.nanoTime();
    OcrResult raw = engine.recognize(prep.getImage());
    double seconds = (System.nanoTime() - t0) / 1e9;
    OcrResult result =
        raw.transformed(prep.toInputFrame()).toBuilder()
            .engineId(engine.id())
            .processingTimeSeconds(seconds)
            .clearPreprocessingApplied()
            .preprocessingApplied(prep.getAppliedSteps())
            .build();
    stats.recordEngineCall(engine.id(), seconds, result.getConfidence());
    return result;
  }
}
