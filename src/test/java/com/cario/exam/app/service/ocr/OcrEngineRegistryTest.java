package com.cario.exam.app.service.ocr;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import com.cario.exam.app.exception.OcrProcessingException;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

class OcrEngineRegistryTest {

  private static OcrEngine engine(String id, boolean available) {
    OcrEngine e = mock(OcrEngine.class);
    when(e.id()).thenReturn(id);
    when(e.isAvailable()).thenReturn(available);
    return e;
  }

  private static List<String> ids(List<OcrEngine> engines) {
    return engines.stream().map(OcrEngine::id).collect(Collectors.toList());
  }

  @Test
  void noEnginesIsAnOcrErrorNotACrash() {
    OcrEngineRegistry registry = new OcrEngineRegistry(List.of(), List.of("tesseract"));
    assertThrows(OcrProcessingException.class, () -> registry.select(null));
  }

  @Test
  void unavailableEnginesAreLeftOut() {
    OcrEngineRegistry registry =
        new OcrEngineRegistry(
            List.of(engine("tesseract", false), engine("textract", true)), List.of("tesseract"));

    assertEquals(Set.of("textract"), registry.availableIds());
    // defaults unusable: every available engine is used instead
    assertEquals(List.of("textract"), ids(registry.select(List.of())));
  }

  @Test
  void requestedEnginesKeepOrderAndSkipUnknown() {
    OcrEngineRegistry registry =
        new OcrEngineRegistry(
            List.of(engine("a", true), engine("b", true), engine("c", true)), List.of("a"));

    assertEquals(List.of("c", "a"), ids(registry.select(List.of("c", "nope", "a", "c"))));
    assertEquals(List.of("a"), ids(registry.select(null)));
  }

  @Test
  void statsKeepBoundedConfidenceWindow() {
    OcrStatsCollector stats = new OcrStatsCollector(2);
    stats.recordEngineCall("a", 1.0, 10);
    stats.recordEngineCall("a", 3.0, 20);
    stats.recordEngineCall("a", 2.0, 60);

    OcrStatsCollector.Snapshot snap = stats.snapshot();
    assertEquals(2, snap.getRecentConfidenceCount());
    assertEquals(40.0, snap.getRecentAverageConfidence(), 1e-9);
    assertEquals(2.0, snap.getAverageProcessingSeconds(), 1e-9);
    assertEquals(3L, snap.getEngineRequests().get("a"));
  }
}
