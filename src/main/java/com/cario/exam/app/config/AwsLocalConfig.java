package com.cario.exam.app.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.textract.TextractClient;

/**
 * AWS clients for the local environment, built from static credentials in the application
 * properties:
 *
 * <ul>
 *   <li>{@link S3Client} for the ingest sweep
 *   <li>{@link TextractClient} for the Textract OCR engine
 *   <li>{@link DynamoDbClient} for the job table
 * </ul>
 *
 * <p>Active only when the {@code local} Spring profile is enabled.
 */
@Configuration
@Profile("local")
public class AwsLocalConfig {

  @Value("${aws.region}")
  private String region;

  @Value("${aws.accessKeyId}")
  private String accessKeyId;

  @Value("${aws.secretAccessKey}")
  private String secretAccessKey;

  @Bean
  StaticCredentialsProvider awsCreds() {
    return StaticCredentialsProvider.create(
        AwsBasicCredentials.create(accessKeyId, secretAccessKey));
  }

  @Bean
  public S3Client s3Client(StaticCredentialsProvider creds) {
    return S3Client.builder().region(Region.of(region)).credentialsProvider(creds).build();
  }

  @Bean
  public TextractClient textractClient(StaticCredentialsProvider creds) {
    return TextractClient.builder().region(Region.of(region)).credentialsProvider(creds).build();
  }

  @Bean
  public DynamoDbClient dynamoDbClient(StaticCredentialsProvider creds) {
    return DynamoDbClient.builder().region(Region.of(region)).credentialsProvider(creds).build();
  }
}
