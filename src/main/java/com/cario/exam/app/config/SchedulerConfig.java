package com.cario.exam.app.config;

import com.cario.exam.app.repository.DocumentStore;
import com.cario.exam.app.scheduler.S3IngestScheduler;
import com.cario.exam.app.service.pipeline.JobRunner;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadPoolExecutor;
import lombok.extern.log4j.Log4j2;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import software.amazon.awssdk.services.s3.S3Client;

/** Thread pools for scheduled sweeps, job workers and step execution. */
@Log4j2
@Configuration
public class SchedulerConfig {

  @Value("${scheduled.threadpool.size:2}")
  private int poolSize;

  @Value("${scheduled.threadpool.await-termination-seconds:30}")
  private int awaitTerminationSeconds;

  /** Dedicated scheduler pool for @Scheduled jobs with graceful shutdown and error logging. */
  @Bean
  public ThreadPoolTaskScheduler taskScheduler() {
    ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
    scheduler.setPoolSize(poolSize);
    scheduler.setThreadNamePrefix("exam-scheduler-");
    scheduler.setErrorHandler(t -> log.error("scheduler.uncaught", t));
    scheduler.setWaitForTasksToCompleteOnShutdown(true);
    scheduler.setAwaitTerminationSeconds(awaitTerminationSeconds);
    RejectedExecutionHandler reh = new ThreadPoolExecutor.CallerRunsPolicy();
    scheduler.setRejectedExecutionHandler(reh);
    scheduler.initialize();
    log.info(
        "scheduler.init poolSize={} awaitTerminationSeconds={}", poolSize, awaitTerminationSeconds);
    return scheduler;
  }

  /**
   * One worker per document. A full queue rejects new submissions instead of running them on the
   * caller, so uploads get an immediate answer.
   */
  @Bean
  public ThreadPoolTaskExecutor jobExecutor(ExtractionProperties props) {
    ExtractionProperties.Pipeline p = props.getPipeline();
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(p.getWorkers());
    executor.setMaxPoolSize(p.getWorkers());
    executor.setQueueCapacity(p.getQueueCapacity());
    executor.setThreadNamePrefix("exam-job-");
    executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationSeconds(awaitTerminationSeconds);
    executor.initialize();
    log.info("jobs.executor.init workers={} queue={}", p.getWorkers(), p.getQueueCapacity());
    return executor;
  }

  /** Runs individual steps so a job worker can enforce the per-step budget. */
  @Bean
  public ThreadPoolTaskExecutor stepExecutor(ExtractionProperties props) {
    int workers = props.getPipeline().getWorkers();
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(workers);
    executor.setMaxPoolSize(workers * 2);
    executor.setQueueCapacity(workers * 2);
    executor.setThreadNamePrefix("exam-step-");
    executor.initialize();
    return executor;
  }

  @Bean
  @ConditionalOnProperty(
      prefix = "scheduled.ingest",
      name = "enabled",
      havingValue = "true",
      matchIfMissing = false)
  public S3IngestScheduler s3IngestScheduler(
      S3Client s3, JobRunner jobRunner, DocumentStore documents, ExtractionProperties props) {
    return new S3IngestScheduler(
        s3, jobRunner, documents, props.getUpload().getAllowedExtensions());
  }
}
