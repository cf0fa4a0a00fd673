package com.cario.exam.app.config;

import com.cario.exam.app.service.ocr.OcrEngine;
import com.cario.exam.app.service.ocr.OcrEngineRegistry;
import com.cario.exam.app.service.ocr.OcrEnsemble;
import com.cario.exam.app.service.ocr.OcrStatsCollector;
import com.cario.exam.app.service.ocr.TesseractOcrEngine;
import com.cario.exam.app.service.ocr.TextractOcrEngine;
import com.cario.exam.app.service.preprocess.ImagePreprocessor;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.log4j.Log4j2;
import net.sourceforge.tess4j.Tesseract;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.services.textract.TextractClient;

/**
 * OCR engines and the ensemble over them.
 *
 * <p>Tesseract is always registered. Textract joins when an AWS profile provides a {@link
 * TextractClient}; Google Vision joins when {@link GoogleVisionConfig} is active.
 */
@Log4j2
@Configuration
public class OcrConfig {

  @Value("${ocr.tesseract.enabled:true}")
  private boolean tesseractEnabled;

  /** Leave blank to use the TESSDATA_PREFIX of the host. */
  @Value("${ocr.tesseract.datapath:}")
  private String tessdataPath;

  @Value("${ocr.tesseract.language:eng}")
  private String language;

  @Value("${ocr.textract.enabled:true}")
  private boolean textractEnabled;

  @Value("${ocr.textract.min-word-confidence:10}")
  private float textractMinWordConfidence;

  @Bean
  public Tesseract tesseract() {
    Tesseract t = new Tesseract();
    if (!tessdataPath.isBlank()) {
      t.setDatapath(tessdataPath);
    }
    t.setLanguage(language);
    t.setVariable("user_defined_dpi", "300");
    return t;
  }

  @Bean
  public TesseractOcrEngine tesseractOcrEngine(Tesseract tesseract) {
    return new TesseractOcrEngine(tesseract, tesseractEnabled);
  }

  @Bean
  public ImagePreprocessor imagePreprocessor(ExtractionProperties props) {
    return ImagePreprocessor.standard(props.getPreprocess());
  }

  @Bean
  public OcrStatsCollector ocrStatsCollector(ExtractionProperties props) {
    return new OcrStatsCollector(props.getOcr().getStatsWindow());
  }

  @Bean
  public OcrEngineRegistry ocrEngineRegistry(
      List<OcrEngine> engines,
      ObjectProvider<TextractClient> textract,
      ExtractionProperties props) {
    List<OcrEngine> candidates = new ArrayList<>(engines);
    textract.ifAvailable(
        client ->
            candidates.add(
                new TextractOcrEngine(client, textractEnabled, textractMinWordConfidence)));
    log.info("ocr.config candidates={}", candidates.size());
    return new OcrEngineRegistry(candidates, props.getOcr().getDefaultEngines());
  }

  @Bean
  public OcrEnsemble ocrEnsemble(
      OcrEngineRegistry registry,
      ImagePreprocessor preprocessor,
      OcrStatsCollector stats,
      ExtractionProperties props) {
    return new OcrEnsemble(registry, preprocessor, stats, props.getOcr().getEngineTimeoutSeconds());
  }
}
