package com.cario.exam.app.service.ocr;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.cario.exam.app.TestImages;
import com.cario.exam.app.exception.OcrProcessingException;
import com.cario.exam.app.model.OcrResult;
import com.cario.exam.app.model.OcrWord;
import org.junit.jupiter.api.Test;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.services.textract.TextractClient;
import software.amazon.awssdk.services.textract.model.Block;
import software.amazon.awssdk.services.textract.model.BlockType;
import software.amazon.awssdk.services.textract.model.BoundingBox;
import software.amazon.awssdk.services.textract.model.DetectDocumentTextRequest;
import software.amazon.awssdk.services.textract.model.DetectDocumentTextResponse;
import software.amazon.awssdk.services.textract.model.Geometry;

class TextractOcrEngineTest {

  private static Block word(String text, float confidence) {
    return Block.builder()
        .blockType(BlockType.WORD)
        .text(text)
        .confidence(confidence)
        .geometry(
            Geometry.builder()
                .boundingBox(
                    BoundingBox.builder().left(0.1f).top(0.2f).width(0.3f).height(0.05f).build())
                .build())
        .build();
  }

  @Test
  void dropsOnlyWordsBelowTenPercent() {
    TextractClient client = mock(TextractClient.class);
    when(client.detectDocumentText(any(DetectDocumentTextRequest.class)))
        .thenReturn(
            DetectDocumentTextResponse.builder()
                .blocks(
                    Block.builder().blockType(BlockType.LINE).text("line").confidence(99f).build(),
                    word("noise", 9.5f),
                    word("faint", 12f),
                    word("clear", 97f))
                .build());
    TextractOcrEngine engine = new TextractOcrEngine(client, true, 10f);

    OcrResult r = engine.recognize(TestImages.blank(200, 100));

    assertEquals(2, r.getWords().size());
    assertEquals("faint", r.getWords().get(0).getText());
    OcrWord w = r.getWords().get(1);
    assertEquals(20, w.getX());
    assertEquals(20, w.getY());
    assertEquals(60, w.getWidth());
    assertEquals(54.5, r.getConfidence(), 1e-6);
  }

  @Test
  void backendFailureBecomesOcrError() {
    TextractClient client = mock(TextractClient.class);
    when(client.detectDocumentText(any(DetectDocumentTextRequest.class)))
        .thenThrow(SdkClientException.create("unreachable"));
    TextractOcrEngine engine = new TextractOcrEngine(client, true, 10f);

    assertThrows(OcrProcessingException.class, () -> engine.recognize(TestImages.blank(10, 10)));
  }
}
