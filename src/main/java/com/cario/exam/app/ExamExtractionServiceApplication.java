package com.cario.exam.app;

import com.cario.exam.app.config.ExtractionProperties;
import lombok.extern.log4j.Log4j2;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Entry point for the Exam Extraction Service.
 *
 * <p>The service takes scanned or digital exam papers, finds question and answer regions, runs OCR
 * over them and exposes the parsed questions for review and correction.
 *
 * <pre>
 *   mvn spring-boot:run -Dspring-boot.run.profiles=local
 * </pre>
 */
@Log4j2
@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties(ExtractionProperties.class)
public class ExamExtractionServiceApplication {

  public static void main(String[] args) {
    log.info("Starting Exam Extraction Service...");
    SpringApplication.run(ExamExtractionServiceApplication.class, args);
    log.info("Exam Extraction Service started.");
  }
}
