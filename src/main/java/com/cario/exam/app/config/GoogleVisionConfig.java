package com.cario.exam.app.config;

import com.cario.exam.app.service.ocr.GoogleVisionOcrEngine;
import com.google.auth.oauth2.GoogleCredentials;
import com.google.cloud.vision.v1.ImageAnnotatorClient;
import com.google.cloud.vision.v1.ImageAnnotatorSettings;
import java.io.InputStream;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ClassPathResource;

@Configuration
@ConditionalOnProperty(
    prefix = "gcv",
    name = "enabled",
    havingValue = "true",
    matchIfMissing = false)
public class GoogleVisionConfig {

  @Value("${gcv.credentials-resource:gcp/sa-json}")
  private String credentialsResource;

  @Value("${gcv.min-word-confidence:10}")
  private double minWordConfidence;

  @Bean(destroyMethod = "close")
  public ImageAnnotatorClient imageAnnotatorClient() throws Exception {
    // service account key from the classpath
    ClassPathResource resource = new ClassPathResource(credentialsResource);
    try (InputStream in = resource.getInputStream()) {
      GoogleCredentials credentials = GoogleCredentials.fromStream(in);
      ImageAnnotatorSettings settings =
          ImageAnnotatorSettings.newBuilder().setCredentialsProvider(() -> credentials).build();
      return ImageAnnotatorClient.create(settings);
    }
  }

  @Bean
  public GoogleVisionOcrEngine googleVisionOcrEngine(ImageAnnotatorClient client) {
    return new GoogleVisionOcrEngine(client, minWordConfidence);
  }
}
