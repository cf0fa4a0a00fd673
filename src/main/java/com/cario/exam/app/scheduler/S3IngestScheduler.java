package com.cario.exam.app.scheduler;

import com.cario.exam.app.model.ExamDocument;
import com.cario.exam.app.model.ProcessingJob;
import com.cario.exam.app.repository.DocumentStore;
import com.cario.exam.app.service.pipeline.JobRunner;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.apache.commons.io.FilenameUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.annotation.Scheduled;
import software.amazon.awssdk.core.ResponseBytes;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Response;
import software.amazon.awssdk.services.s3.model.S3Object;

/**
 * Periodic sweep of an S3 prefix that starts an extraction job for every exam file not seen
 * before. The document id is derived from bucket and key, so a file is picked up once per process
 * lifetime.
 */
@Log4j2
@RequiredArgsConstructor
public class S3IngestScheduler {

  private final S3Client s3;
  private final JobRunner jobRunner;
  private final DocumentStore documents;
  private final List<String> allowedExtensions;

  @Value("${aws.s3.bucket}")
  private String bucket;

  @Value("${aws.s3.input-prefix:exams/incoming/}")
  private String inputPrefix;

  @Value("${scheduled.ingest.max-per-run:25}")
  private int maxPerRun;

  @Value("${scheduled.ingest.dry-run:false}")
  private boolean dryRun;

  @Scheduled(cron = "${scheduled.ingest.cron:0 * * * * *}")
  public void sweep() {
    final String prefix = normalizePrefix(inputPrefix);
    log.info(
        "ingest.start bucket={} prefix={} maxPerRun={} dryRun={}",
        bucket,
        prefix,
        maxPerRun,
        dryRun);

    int submitted = 0;
    String continuation = null;
    do {
      ListObjectsV2Response page =
          s3.listObjectsV2(
              ListObjectsV2Request.builder()
                  .bucket(bucket)
                  .prefix(prefix)
                  .continuationToken(continuation)
                  .maxKeys(1000)
                  .build());

      for (S3Object obj : page.contents()) {
        if (submitted >= maxPerRun) {
          log.info("ingest.limit reached maxPerRun={}", maxPerRun);
          break;
        }
        String key = obj.key();
        if (key.endsWith("/") || obj.size() <= 0 || !isExamFile(key)) {
          continue;
        }
        String docId = documentId(bucket, key);
        if (documents.exists(docId)) {
          log.debug("ingest.skip known docId={} key={}", docId, key);
          continue;
        }
        if (dryRun) {
          log.info("ingest.dryRun would submit docId={} key={}", docId, key);
          submitted++;
          continue;
        }
        try {
          ProcessingJob job = jobRunner.submit(fetch(docId, key));
          log.info("ingest.submitted docId={} key={} jobId={}", docId, key, job.getId());
          submitted++;
        } catch (TaskRejectedException ex) {
          log.warn("ingest.saturated docId={} key={}; retrying next cycle", docId, key);
          return;
        } catch (RuntimeException ex) {
          log.error("ingest.error docId={} key={} msg={}", docId, key, ex.getMessage(), ex);
        }
      }

      if (submitted >= maxPerRun) {
        break;
      }
      continuation = page.nextContinuationToken();
    } while (continuation != null);

    log.info("ingest.finish submitted={} bucket={} prefix={}", submitted, bucket, prefix);
  }

  // ---------- helpers ----------

  private ExamDocument fetch(String docId, String key) {
    ResponseBytes<GetObjectResponse> bytes =
        s3.getObjectAsBytes(GetObjectRequest.builder().bucket(bucket).key(key).build());
    return ExamDocument.builder()
        .id(docId)
        .filename(FilenameUtils.getName(key))
        .contentType(bytes.response().contentType())
        .extension(extension(key))
        .content(bytes.asByteArray())
        .sourceUri("s3://" + bucket + "/" + key)
        .build();
  }

  private boolean isExamFile(String key) {
    return allowedExtensions.contains(extension(key));
  }

  static String documentId(String bucket, String key) {
    return UUID.nameUUIDFromBytes((bucket + "/" + key).getBytes(StandardCharsets.UTF_8))
        .toString();
  }

  private static String extension(String key) {
    return FilenameUtils.getExtension(key).toLowerCase(Locale.ROOT);
  }

  private static String normalizePrefix(String p) {
    if (p == null || p.isBlank()) return "";
    return p.endsWith("/") ? p : p + "/";
  }
}
