package com.cario.exam.app.config;

import java.util.ArrayList;
import java.util.List;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/** Tunables for the extraction pipeline, bound from {@code extraction.*}. */
@Data
@ConfigurationProperties(prefix = "extraction")
public class ExtractionProperties {

  private Pipeline pipeline = new Pipeline();
  private Upload upload = new Upload();
  private Render render = new Render();
  private Preprocess preprocess = new Preprocess();
  private Ocr ocr = new Ocr();
  private Detection detection = new Detection();

  @Data
  public static class Pipeline {
    /** Wall-clock budget per step. */
    private long stepTimeoutSeconds = 300;

    /** Concurrent documents. */
    private int workers = 2;

    private int queueCapacity = 100;

    /** Region confidence weight in the question score; OCR confidence takes the rest. */
    private double structureWeight = 0.6;
  }

  @Data
  public static class Upload {
    private long maxFileSizeBytes = 50L * 1024 * 1024;
    private int maxPages = 200;
    private List<String> allowedExtensions =
        new ArrayList<>(List.of("pdf", "png", "jpg", "jpeg", "tif", "tiff"));

    /** Minimum non-whitespace characters per page for a PDF to count as searchable. */
    private int searchableMinCharsPerPage = 50;
  }

  @Data
  public static class Render {
    private float detectionDpi = 150f;
    private float ocrDpi = 300f;
  }

  @Data
  public static class Preprocess {
    private List<String> defaultSteps =
        new ArrayList<>(List.of("denoise", "deskew", "contrast", "sharpen", "binarize"));

    /** Images above this many pixels use the basic denoiser. */
    private long advancedDenoiseMaxPixels = 12_000_000L;

    private int minDimension = 300;
  }

  @Data
  public static class Ocr {
    /** Engine ids used when a caller does not name any. */
    private List<String> defaultEngines = new ArrayList<>(List.of("tesseract"));

    private long engineTimeoutSeconds = 120;

    /** Recent confidence scores kept by the stats collector. */
    private int statsWindow = 500;
  }

  @Data
  public static class Detection {
    private int minWordConfidence = 30;
    private int minColumnGap = 80;
    private int columnSignificance = 80;
    private int columnTolerance = 60;
    private int maxContinuationLines = 8;
    private int padding = 8;
    private int minOptions = 2;
    private int verticalMergeGap = 50;
    private double overlapRatio = 0.5;
  }
}
