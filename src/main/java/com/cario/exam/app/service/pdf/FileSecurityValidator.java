package com.cario.exam.app.service.pdf;

import com.cario.exam.app.config.ExtractionProperties;
import com.cario.exam.app.exception.FileSecurityException;
import java.io.IOException;
import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import lombok.Value;
import lombok.extern.log4j.Log4j2;
import org.apache.commons.io.FilenameUtils;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;

/**
 * Gatekeeper for uploads. Rejects files that are too large, have an unexpected extension, whose
 * leading bytes do not match the extension, or PDFs that are encrypted or too long.
 */
@Log4j2
public class FileSecurityValidator {

  private static final byte[] PDF_MAGIC = {'%', 'P', 'D', 'F'};
  private static final byte[] PNG_MAGIC = {(byte) 0x89, 'P', 'N', 'G'};
  private static final byte[] JPEG_MAGIC = {(byte) 0xFF, (byte) 0xD8, (byte) 0xFF};
  private static final byte[] TIFF_LE_MAGIC = {'I', 'I', 42, 0};
  private static final byte[] TIFF_BE_MAGIC = {'M', 'M', 0, 42};

  private final ExtractionProperties.Upload cfg;

  public FileSecurityValidator(ExtractionProperties.Upload cfg) {
    this.cfg = Objects.requireNonNull(cfg, "cfg must not be null");
  }

  /**
   * Validates the upload.
   *
   * @return the lower-case extension and the page count, 1 for images
   * @throws FileSecurityException on any violation
   */
  public Validated validate(String filename, byte[] content) {
    if (content == null || content.length == 0) {
      throw reject("Empty file", filename, "empty");
    }
    if (content.length > cfg.getMaxFileSizeBytes()) {
      throw new FileSecurityException(
          "File exceeds maximum size of " + cfg.getMaxFileSizeBytes() + " bytes",
          Map.of("filename", String.valueOf(filename), "size", content.length),
          null);
    }
    String ext =
        FilenameUtils.getExtension(filename == null ? "" : filename).toLowerCase(Locale.ROOT);
    if (!cfg.getAllowedExtensions().contains(ext)) {
      throw reject("File type not allowed: ." + ext, filename, "extension");
    }
    if (!magicMatches(ext, content)) {
      throw reject("File content does not match extension ." + ext, filename, "magic");
    }
    int pages = "pdf".equals(ext) ? checkPdf(filename, content) : 1;
    log.info(
        "upload.validated file={} ext={} size={} pages={}", filename, ext, content.length, pages);
    return new Validated(ext, pages);
  }

  private int checkPdf(String filename, byte[] content) {
    try (PDDocument doc = Loader.loadPDF(content)) {
      if (doc.isEncrypted()) {
        throw reject("Encrypted PDFs are not supported", filename, "encrypted");
      }
      int pages = doc.getNumberOfPages();
      if (pages > cfg.getMaxPages()) {
        throw new FileSecurityException(
            "PDF has " + pages + " pages, maximum is " + cfg.getMaxPages(),
            Map.of("filename", String.valueOf(filename), "pages", pages),
            null);
      }
      if (pages == 0) {
        throw reject("PDF has no pages", filename, "empty");
      }
      return pages;
    } catch (IOException e) {
      // password-protected files fail to open at all
      throw new FileSecurityException(
          "Unreadable or protected PDF: " + e.getMessage(),
          Map.of("filename", String.valueOf(filename), "reason", "unreadable"),
          e);
    }
  }

  static boolean magicMatches(String ext, byte[] content) {
    switch (ext) {
      case "pdf":
        return startsWith(content, PDF_MAGIC);
      case "png":
        return startsWith(content, PNG_MAGIC);
      case "jpg":
      case "jpeg":
        return startsWith(content, JPEG_MAGIC);
      case "tif":
      case "tiff":
        return startsWith(content, TIFF_LE_MAGIC) || startsWith(content, TIFF_BE_MAGIC);
      default:
        return false;
    }
  }

  private static boolean startsWith(byte[] content, byte[] magic) {
    return content.length >= magic.length
        && Arrays.equals(Arrays.copyOf(content, magic.length), magic);
  }

  private static FileSecurityException reject(String message, String filename, String reason) {
    return new FileSecurityException(
        message, Map.of("filename", String.valueOf(filename), "reason", reason), null);
  }

  /** Outcome of a successful validation. */
  @Value
  public static class Validated {
    String extension;
    int pageCount;
  }
}
