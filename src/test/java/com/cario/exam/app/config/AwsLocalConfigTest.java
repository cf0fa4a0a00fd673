package com.cario.exam.app.config;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.textract.TextractClient;

class AwsLocalConfigTest {

  private final ApplicationContextRunner runner =
      new ApplicationContextRunner()
          .withUserConfiguration(AwsLocalConfig.class)
          .withPropertyValues(
              "aws.region=eu-west-2", "aws.accessKeyId=AKIDEXAMPLE", "aws.secretAccessKey=secret");

  @Test
  void localProfileBuildsEveryClientInTheConfiguredRegion() {
    runner
        .withInitializer(ctx -> ctx.getEnvironment().setActiveProfiles("local"))
        .run(
            ctx -> {
              assertThat(ctx).hasSingleBean(S3Client.class);
              assertThat(ctx).hasSingleBean(TextractClient.class);
              assertThat(ctx).hasSingleBean(DynamoDbClient.class);
              assertThat(ctx.getBean(S3Client.class).serviceClientConfiguration().region())
                  .isEqualTo(Region.EU_WEST_2);
            });
  }

  @Test
  void otherProfilesGetNoLocalClients() {
    runner.run(ctx -> assertThat(ctx).doesNotHaveBean(S3Client.class));
  }
}
