package com.cario.exam.app.service.pipeline;

import com.cario.exam.app.model.DocumentStatistics;
import com.cario.exam.app.model.ExamDocument;
import com.cario.exam.app.model.ExtractedQuestion;
import com.cario.exam.app.model.OcrResult;
import com.cario.exam.app.model.OcrWord;
import com.cario.exam.app.model.PageImage;
import com.cario.exam.app.model.ProcessingJob;
import com.cario.exam.app.model.Region;
import com.cario.exam.app.service.layout.PageLayout;
import com.cario.exam.app.service.pdf.PageSource;
import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;
import lombok.extern.log4j.Log4j2;

/**
 * Working state of one job run, passed from step to step.
 *
 * <p>Steps run one at a time on step executor threads, so the maps and lists here are not
 * synchronized. A step that overruns its budget is abandoned but may keep running after the
 * orchestrator has moved on and closed the context. Page access is therefore guarded: {@link
 * #close()} waits for any page read in flight, and later reads throw {@link
 * ContextClosedException}.
 */
@Log4j2
@Getter
public class ProcessingContext implements AutoCloseable {

  private final ProcessingJob job;
  private final ExamDocument document;

  /** Opened by text type detection. */
  @Getter(AccessLevel.NONE)
  private PageSource pages;

  @Getter(AccessLevel.NONE)
  private final ReadWriteLock pagesLock = new ReentrantReadWriteLock();

  private volatile boolean closed;

  private final Map<Integer, OcrResult> ocrResults = new TreeMap<>();
  private final Map<Integer, PageLayout> layouts = new TreeMap<>();
  private final Map<Integer, String> pageTexts = new TreeMap<>();
  private final Map<Integer, List<Region>> regions = new TreeMap<>();

  /** Region each question was read from, keyed by region id. */
  private final Map<String, Region> questionRegions = new HashMap<>();

  private final List<ExtractedQuestion> questions = new ArrayList<>();

  @Setter private DocumentStatistics statistics;

  public ProcessingContext(ProcessingJob job, ExamDocument document) {
    this.job = Objects.requireNonNull(job, "job must not be null");
    this.document = Objects.requireNonNull(document, "document must not be null");
  }

  public String jobId() {
    return job.getId();
  }

  public String documentId() {
    return document.getId();
  }

  /** Hands the opened pages to the context, which closes them with the run. */
  public void setPages(PageSource opened) {
    Lock lock = pagesLock.writeLock();
    lock.lock();
    try {
      if (closed) {
        opened.close();
        throw new ContextClosedException(jobId());
      }
      this.pages = opened;
    } finally {
      lock.unlock();
    }
  }

  /** Pages of the document; every read fails with {@link ContextClosedException} after close. */
  public PageSource requirePages() {
    if (closed) {
      throw new ContextClosedException(jobId());
    }
    if (pages == null) {
      throw new IllegalStateException("pages not opened for document " + document.getId());
    }
    return new GuardedPages();
  }

  public int regionCount() {
    return regions.values().stream().mapToInt(List::size).sum();
  }

  @Override
  public void close() {
    Lock lock = pagesLock.writeLock();
    lock.lock();
    try {
      closed = true;
      if (pages != null) {
        pages.close();
        pages = null;
      }
    } finally {
      lock.unlock();
    }
  }

  private <T> T readPages(String operation, Supplier<T> read) {
    Lock lock = pagesLock.readLock();
    lock.lock();
    try {
      if (closed) {
        log.debug("pipeline.context.closed_read job={} op={}", jobId(), operation);
        throw new ContextClosedException(jobId());
      }
      return read.get();
    } finally {
      lock.unlock();
    }
  }

  /** View of {@link #pages} that refuses reads once the run is over. Closing it does nothing. */
  private final class GuardedPages implements PageSource {

    @Override
    public int pageCount() {
      return readPages("pageCount", () -> pages.pageCount());
    }

    @Override
    public PageImage page(int pageNumber) {
      return readPages("page", () -> pages.page(pageNumber));
    }

    @Override
    public BufferedImage detectionImage(int pageNumber) {
      return readPages("detectionImage", () -> pages.detectionImage(pageNumber));
    }

    @Override
    public String pageText(int pageNumber) {
      return readPages("pageText", () -> pages.pageText(pageNumber));
    }

    @Override
    public List<OcrWord> textLayerWords(int pageNumber) {
      return readPages("textLayerWords", () -> pages.textLayerWords(pageNumber));
    }

    @Override
    public void close() {}
  }
}
