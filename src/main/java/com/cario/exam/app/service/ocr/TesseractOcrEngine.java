package com.cario.exam.app.service.ocr;

import com.cario.exam.app.exception.OcrProcessingException;
import com.cario.exam.app.model.OcrResult;
import com.cario.exam.app.model.OcrWord;
import java.awt.Rectangle;
import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.extern.log4j.Log4j2;
import net.sourceforge.tess4j.ITessAPI;
import net.sourceforge.tess4j.ITesseract;
import net.sourceforge.tess4j.Word;

/**
 * Local Tesseract through tess4j, word level. Tesseract reports 0-100 already; words at or below 0
 * are discarded.
 *
 * <p>The native library is loaded lazily by tess4j. If it cannot be linked the engine marks itself
 * unavailable so later ensemble calls skip it.
 */
@Log4j2
public class TesseractOcrEngine implements OcrEngine {

  public static final String ID = "tesseract";

  private final ITesseract tesseract;
  private final AtomicBoolean available;

  public TesseractOcrEngine(ITesseract tesseract, boolean enabled) {
    this.tesseract = Objects.requireNonNull(tesseract, "tesseract must not be null");
    this.available = new AtomicBoolean(enabled);
  }

  @Override
  public String id() {
    return ID;
  }

  @Override
  public boolean isAvailable() {
    return available.get();
  }

  @Override
  public OcrResult recognize(BufferedImage image) {
    long t0 = System.nanoTime();
    List<Word> raw;
    try {
      // a Tesseract handle is not safe for concurrent use
      synchronized (tesseract) {
        raw = tesseract.getWords(image, ITessAPI.TessPageIteratorLevel.RIL_WORD);
      }
    } catch (UnsatisfiedLinkError | NoClassDefFoundError e) {
      available.set(false);
      log.error("ocr.tesseract.unavailable msg={}", e.getMessage());
      throw new OcrProcessingException("Tesseract native library not available", e);
    } catch (RuntimeException e) {
      throw new OcrProcessingException("Tesseract failed: " + e.getMessage(), e);
    }

    List<OcrWord> words = new ArrayList<>();
    for (Word w : raw) {
      String text = w.getText() == null ? "" : w.getText().strip();
      if (text.isEmpty() || w.getConfidence() <= 0) {
        continue;
      }
      Rectangle r = w.getBoundingBox();
      words.add(
          OcrWord.builder()
              .text(text)
              .confidence(Math.min(100.0, w.getConfidence()))
              .x(r.x)
              .y(r.y)
              .width(r.width)
              .height(r.height)
              .build());
    }
    double seconds = (System.nanoTime() - t0) / 1e9;
    log.debug(
        "ocr.tesseract.success words={} kept={} seconds={}", raw.size(), words.size(), seconds);
    return OcrResult.fromWords(ID, words, seconds);
  }
}
