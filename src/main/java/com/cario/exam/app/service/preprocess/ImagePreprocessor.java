package com.cario.exam.app.service.preprocess;

import com.cario.exam.app.config.ExtractionProperties;
import com.cario.exam.app.util.ImageUtils;
import java.awt.geom.AffineTransform;
import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.extern.log4j.Log4j2;

/**
 * Normalizes a page raster for OCR.
 *
 * <p>Steps always run in the order denoise, deskew, contrast, sharpen, morphology, binarize,
 * resize; callers only choose which of them run. Strategies whose libraries are missing are
 * dropped when the preprocessor is built, so a missing capability shrinks the set of steps instead
 * of failing at call time.
 *
 * <p>Preprocessing never aborts the caller: any unexpected exception yields the original image with
 * {@code ["error"]} as the applied steps.
 */
@Log4j2
public class ImagePreprocessor {

  public static final List<String> STEP_ORDER =
      List.of("denoise", "deskew", "contrast", "sharpen", "morphology", "binarize", "resize");

  private final Map<String, List<PreprocessingStep>> registry;
  private final List<String> defaultSteps;

  public ImagePreprocessor(List<PreprocessingStep> steps, List<String> defaultSteps) {
    Objects.requireNonNull(steps, "steps must not be null");
    this.defaultSteps = List.copyOf(Objects.requireNonNull(defaultSteps, "defaultSteps"));
    this.registry = new LinkedHashMap<>();
    for (PreprocessingStep step : steps) {
      if (!step.isAvailable()) {
        log.info(
            "preprocess.strategy.unavailable step={} strategy={}",
            step.name(),
            step.getClass().getSimpleName());
        continue;
      }
      registry.computeIfAbsent(step.name(), k -> new ArrayList<>()).add(step);
    }
    registry
        .values()
        .forEach(l -> l.sort(Comparator.comparingInt(PreprocessingStep::priority).reversed()));
    log.info("preprocess.init steps={} defaults={}", registry.keySet(), this.defaultSteps);
  }

  /** The standard strategy set configured from {@code extraction.preprocess}. */
  public static ImagePreprocessor standard(ExtractionProperties.Preprocess cfg) {
    List<PreprocessingStep> steps =
        List.of(
            new OpenCvDenoiseStep(),
            new MedianDenoiseStep(cfg.getAdvancedDenoiseMaxPixels()),
            new BoxBlurDenoiseStep(),
            new DeskewStep(),
            new OpenCvClaheStep(2.0, 8),
            new ClaheContrastStep(2.0, 8),
            new SharpenStep(),
            new OpenCvMorphologyCloseStep(),
            new MorphologyCloseStep(),
            new OpenCvAdaptiveBinarizeStep(11, 2),
            new AdaptiveBinarizeStep(11, 2),
            new UpscaleStep(cfg.getMinDimension()));
    return new ImagePreprocessor(steps, cfg.getDefaultSteps());
  }

  public PreprocessingResult enhance(BufferedImage image) {
    return enhance(image, defaultSteps);
  }

  public PreprocessingResult enhance(BufferedImage image, Collection<String> steps) {
    Objects.requireNonNull(image, "image must not be null");
    Collection<String> requested = steps == null ? defaultSteps : steps;
    long t0 = System.nanoTime();
    try {
      BufferedImage current = ImageUtils.toGray(image);
      List<String> applied = new ArrayList<>();
      AffineTransform transform = new AffineTransform();
      for (String name : STEP_ORDER) {
        if (!requested.contains(name)) {
          continue;
        }
        List<PreprocessingStep> candidates = registry.get(name);
        if (candidates == null || candidates.isEmpty()) {
          log.debug("preprocess.step.unavailable step={}", name);
          continue;
        }
        PreprocessingStep.Result r = runWithFallback(name, candidates, current);
        current = r.getImage();
        transform.preConcatenate(r.getTransform());
        if (r.getLabel() != null) {
          applied.add(r.getLabel());
        }
      }
      log.debug(
          "preprocess.success steps={} durationMs={}",
          applied,
          (System.nanoTime() - t0) / 1_000_000);
      return new PreprocessingResult(current, List.copyOf(applied), transform);
    } catch (RuntimeException ex) {
      log.error("preprocess.error msg={}", ex.getMessage(), ex);
      return PreprocessingResult.failed(image);
    }
  }

  public Set<String> availableSteps() {
    return registry.keySet().stream().collect(Collectors.toUnmodifiableSet());
  }

  private PreprocessingStep.Result runWithFallback(
      String name, List<PreprocessingStep> candidates, BufferedImage image) {
    RuntimeException last = null;
    for (PreprocessingStep step : candidates) {
      if (!step.supports(image)) {
        continue;
      }
      try {
        return step.apply(image);
      } catch (RuntimeException ex) {
        log.warn(
            "preprocess.strategy.failed step={} strategy={} msg={}",
            name,
            step.getClass().getSimpleName(),
            ex.getMessage());
        last = ex;
      }
    }
    if (last != null) {
      throw last;
    }
    return PreprocessingStep.Result.skipped(image);
  }
}
