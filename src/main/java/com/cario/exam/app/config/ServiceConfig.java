package com.cario.exam.app.config;

import com.cario.exam.app.repository.DocumentStore;
import com.cario.exam.app.repository.RegionStore;
import com.cario.exam.app.service.correct.RegionCorrector;
import com.cario.exam.app.service.detect.GeometricRegionDetector;
import com.cario.exam.app.service.detect.RegionDetector;
import com.cario.exam.app.service.detect.RegionMerger;
import com.cario.exam.app.service.detect.StructuralRegionDetector;
import com.cario.exam.app.service.diagnostics.ErrorRecorder;
import com.cario.exam.app.service.diagnostics.LoggingOperatorNotifier;
import com.cario.exam.app.service.diagnostics.OperatorNotifier;
import com.cario.exam.app.service.diagnostics.ProcessingLogger;
import com.cario.exam.app.service.layout.ColumnDetector;
import com.cario.exam.app.service.layout.LayoutAnalyzer;
import com.cario.exam.app.service.layout.LineAssembler;
import com.cario.exam.app.service.ocr.OcrEnsemble;
import com.cario.exam.app.service.parse.AnswerKeyExtractor;
import com.cario.exam.app.service.parse.QuestionTypeClassifier;
import com.cario.exam.app.service.parse.TextBlockParser;
import com.cario.exam.app.service.pdf.FileSecurityValidator;
import com.cario.exam.app.service.pdf.PageSourceFactory;
import com.cario.exam.app.service.pdf.PdfTextLayerReader;
import com.cario.exam.app.service.pdf.TextTypeDetector;
import com.cario.exam.app.service.pipeline.JobProgressBroker;
import com.cario.exam.app.service.pipeline.JobRunner;
import com.cario.exam.app.service.pipeline.PipelineStep;
import com.cario.exam.app.service.pipeline.ProcessingJobService;
import com.cario.exam.app.service.pipeline.ProcessingOrchestrator;
import com.cario.exam.app.service.pipeline.steps.AnswerExtractionStep;
import com.cario.exam.app.service.pipeline.steps.ConfidenceScoringStep;
import com.cario.exam.app.service.pipeline.steps.DetectTextTypeStep;
import com.cario.exam.app.service.pipeline.steps.FinalizationStep;
import com.cario.exam.app.service.pipeline.steps.LayoutAnalysisStep;
import com.cario.exam.app.service.pipeline.steps.OcrProcessingStep;
import com.cario.exam.app.service.pipeline.steps.QaDetectionStep;
import com.cario.exam.app.service.pipeline.steps.TextExtractionStep;
import com.cario.exam.app.service.pipeline.steps.ValidateUploadStep;
import com.cario.exam.app.service.stats.ConfidenceScorer;
import com.cario.exam.app.service.stats.StatisticsAggregator;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/** Wires the extraction services that carry no Spring stereotype of their own. */
@Configuration
@RequiredArgsConstructor
public class ServiceConfig {

  private final ExtractionProperties props;

  // -------------------
  // Layout & detection
  // -------------------

  @Bean
  public LayoutAnalyzer layoutAnalyzer() {
    ExtractionProperties.Detection d = props.getDetection();
    return new LayoutAnalyzer(
        new LineAssembler(d.getMinWordConfidence(), d.getMinColumnGap()),
        new ColumnDetector(d.getMinColumnGap(), d.getColumnSignificance()));
  }

  @Bean
  public RegionDetector regionDetector(LayoutAnalyzer layoutAnalyzer, OcrEnsemble ensemble) {
    ExtractionProperties.Detection d = props.getDetection();
    RegionMerger merger = new RegionMerger(d.getOverlapRatio(), d.getVerticalMergeGap());
    return new RegionDetector(
        new GeometricRegionDetector(merger),
        new StructuralRegionDetector(d),
        layoutAnalyzer,
        ensemble,
        d.getOverlapRatio());
  }

  @Bean
  public RegionCorrector regionCorrector() {
    return new RegionCorrector();
  }

  // -------------------
  // Parsing & scoring
  // -------------------

  @Bean
  public TextBlockParser textBlockParser() {
    return new TextBlockParser();
  }

  @Bean
  public QuestionTypeClassifier questionTypeClassifier() {
    return new QuestionTypeClassifier();
  }

  @Bean
  public AnswerKeyExtractor answerKeyExtractor() {
    return new AnswerKeyExtractor();
  }

  @Bean
  public ConfidenceScorer confidenceScorer() {
    return new ConfidenceScorer(props.getPipeline().getStructureWeight());
  }

  @Bean
  public StatisticsAggregator statisticsAggregator() {
    return new StatisticsAggregator();
  }

  // -------------------
  // Documents
  // -------------------

  @Bean
  public FileSecurityValidator fileSecurityValidator() {
    return new FileSecurityValidator(props.getUpload());
  }

  @Bean
  public PageSourceFactory pageSourceFactory() {
    return new PageSourceFactory(new PdfTextLayerReader(), props.getRender());
  }

  @Bean
  public TextTypeDetector textTypeDetector() {
    return new TextTypeDetector(props.getUpload().getSearchableMinCharsPerPage());
  }

  // -------------------
  // Diagnostics
  // -------------------

  @Bean
  public ErrorRecorder errorRecorder() {
    return new ErrorRecorder();
  }

  @Bean
  public OperatorNotifier operatorNotifier() {
    return new LoggingOperatorNotifier();
  }

  @Bean
  public ProcessingLogger processingLogger(ObjectMapper om) {
    return new ProcessingLogger(om);
  }

  // -------------------
  // Pipeline
  // -------------------

  @Bean
  public JobProgressBroker jobProgressBroker() {
    return new JobProgressBroker();
  }

  /** The nine steps are listed in execution order; the orchestrator rejects any other order. */
  @Bean
  public ProcessingOrchestrator processingOrchestrator(
      FileSecurityValidator validator,
      PageSourceFactory pageSources,
      TextTypeDetector textTypes,
      OcrEnsemble ensemble,
      LayoutAnalyzer layoutAnalyzer,
      RegionDetector detector,
      RegionStore regionStore,
      TextBlockParser parser,
      QuestionTypeClassifier classifier,
      AnswerKeyExtractor answers,
      ConfidenceScorer scorer,
      StatisticsAggregator aggregator,
      ProcessingJobService jobs,
      DocumentStore documents,
      @Qualifier("stepExecutor") ThreadPoolTaskExecutor stepExecutor,
      ErrorRecorder errors,
      OperatorNotifier notifier,
      ProcessingLogger processingLog) {
    List<PipelineStep> steps =
        List.of(
            new ValidateUploadStep(validator),
            new DetectTextTypeStep(pageSources, textTypes),
            new OcrProcessingStep(ensemble, processingLog),
            new LayoutAnalysisStep(layoutAnalyzer),
            new TextExtractionStep(),
            new QaDetectionStep(
                detector, regionStore, parser, classifier, props.getDetection().getMinOptions()),
            new AnswerExtractionStep(answers),
            new ConfidenceScoringStep(scorer, processingLog),
            new FinalizationStep(documents, aggregator));
    return new ProcessingOrchestrator(
        steps,
        jobs,
        documents,
        stepExecutor,
        props.getPipeline().getStepTimeoutSeconds(),
        errors,
        notifier,
        processingLog);
  }

  @Bean
  public JobRunner jobRunner(
      ProcessingOrchestrator orchestrator,
      ProcessingJobService jobs,
      DocumentStore documents,
      @Qualifier("jobExecutor") ThreadPoolTaskExecutor jobExecutor,
      ErrorRecorder errors) {
    return new JobRunner(orchestrator, jobs, documents, jobExecutor, errors);
  }
}
