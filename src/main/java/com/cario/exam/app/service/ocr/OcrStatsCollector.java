package com.cario.exam.app.service.ocr;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;
import lombok.Builder;
import lombok.Value;

/**
 * Counters for the OCR ensemble: requests, per-engine calls and failures, running mean processing
 * time and a window of recent confidences. Updates are counter bumps plus one short synchronized
 * section, so recording never holds up recognition.
 */
public class OcrStatsCollector {

  private final AtomicLong totalRequests = new AtomicLong();
  private final Map<String, LongAdder> engineRequests = new ConcurrentHashMap<>();
  private final Map<String, LongAdder> engineFailures = new ConcurrentHashMap<>();

  private final int window;
  private final Deque<Double> recentConfidences;
  private long timedCalls;
  private double averageProcessingSeconds;

  public OcrStatsCollector(int window) {
    if (window <= 0) {
      throw new IllegalArgumentException("window must be positive");
    }
    this.window = window;
    this.recentConfidences = new ArrayDeque<>(Math.min(window, 1024));
  }

  public void recordRequest() {
    totalRequests.incrementAndGet();
  }

  public void recordEngineCall(String engineId, double seconds, double confidence) {
    engineRequests.computeIfAbsent(engineId, k -> new LongAdder()).increment();
    synchronized (this) {
      timedCalls++;
      averageProcessingSeconds += (seconds - averageProcessingSeconds) / timedCalls;
      if (recentConfidences.size() == window) {
        recentConfidences.removeFirst();
      }
      recentConfidences.addLast(confidence);
    }
  }

  public void recordEngineFailure(String engineId) {
    engineRequests.computeIfAbsent(engineId, k -> new LongAdder()).increment();
    engineFailures.computeIfAbsent(engineId, k -> new LongAdder()).increment();
  }

  public Snapshot snapshot() {
    Map<String, Long> requests = new LinkedHashMap<>();
    engineRequests.forEach((k, v) -> requests.put(k, v.sum()));
    Map<String, Long> failures = new LinkedHashMap<>();
    engineFailures.forEach((k, v) -> failures.put(k, v.sum()));
    synchronized (this) {
      double meanConfidence =
          recentConfidences.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
      return Snapshot.builder()
          .totalRequests(totalRequests.get())
          .engineRequests(requests)
          .engineFailures(failures)
          .averageProcessingSeconds(averageProcessingSeconds)
          .recentConfidenceCount(recentConfidences.size())
          .recentAverageConfidence(meanConfidence)
          .build();
    }
  }

  @Value
  @Builder
  public static class Snapshot {
    long totalRequests;
    Map<String, Long> engineRequests;
    Map<String, Long> engineFailures;
    double averageProcessingSeconds;
    int recentConfidenceCount;
    double recentAverageConfidence;
  }
}
