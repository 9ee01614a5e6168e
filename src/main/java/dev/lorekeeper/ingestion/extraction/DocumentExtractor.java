package dev.lorekeeper.ingestion.extraction;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.cos.COSName;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDDocumentInformation;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDResources;
import org.apache.pdfbox.pdmodel.encryption.InvalidPasswordException;
import org.apache.pdfbox.text.PDFTextStripper;
import org.apache.poi.UnsupportedFileFormatException;
import org.apache.poi.ooxml.POIXMLException;
import org.apache.poi.ooxml.POIXMLProperties;
import org.apache.poi.xwpf.extractor.XWPFWordExtractor;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Converts an uploaded file into ordered pages of plain text plus document properties.
 *
 * <p>Supported formats:
 *
 * <ul>
 *   <li>{@code .pdf} via PDFBox, one {@link ExtractedPage} per physical page
 *   <li>{@code .docx} via Apache POI, flattened to a single page
 *   <li>{@code .txt} and {@code .md}, read as UTF-8 into a single page
 * </ul>
 *
 * <p>Legacy binary {@code .doc} and every other extension fail with {@link
 * FormatUnsupportedException}. A PDF with more than one page but fewer than {@value
 * #SCANNED_TEXT_THRESHOLD} characters of text is rejected as a likely scan.
 */
@Component
public class DocumentExtractor {

  private static final Logger log = LoggerFactory.getLogger(DocumentExtractor.class);

  static final int SCANNED_TEXT_THRESHOLD = 100;

  /**
   * Extracts the given file, dispatching on its extension.
   *
   * @param file path to a readable file
   * @return the extracted pages and metadata
   * @throws ExtractionException or one of its subtypes when the file cannot be turned into text
   */
  public ExtractionResult extract(Path file) {
    String filename = file.getFileName().toString();
    String extension = extensionOf(filename);
    log.info("Extracting {} ({})", filename, extension.isEmpty() ? "no extension" : extension);

    return switch (extension) {
      case "pdf" -> extractPdf(file, filename);
      case "docx" -> extractDocx(file, filename);
      case "txt", "md" -> extractPlainText(file, filename);
      case "doc" ->
          throw new FormatUnsupportedException(
              extension, "Legacy .doc (binary) format is not supported. Convert to .docx or .pdf.");
      default ->
          throw new FormatUnsupportedException(
              extension, "Unsupported file extension: ." + extension);
    };
  }

  /** Returns the lower-cased extension without the dot, or an empty string. */
  public static String extensionOf(String filename) {
    int dot = filename.lastIndexOf('.');
    if (dot < 0 || dot == filename.length() - 1) {
      return "";
    }
    return filename.substring(dot + 1).toLowerCase(Locale.ROOT);
  }

  private ExtractionResult extractPdf(Path file, String filename) {
    try (PDDocument document = Loader.loadPDF(file.toFile())) {
      int pageCount = document.getNumberOfPages();
      PDFTextStripper stripper = new PDFTextStripper();
      List<ExtractedPage> pages = new ArrayList<>(pageCount);

      for (int pageNumber = 1; pageNumber <= pageCount; pageNumber++) {
        stripper.setStartPage(pageNumber);
        stripper.setEndPage(pageNumber);
        String text = stripper.getText(document);
        pages.add(
            new ExtractedPage(
                pageNumber,
                text.trim(),
                hasImages(document.getPage(pageNumber - 1)),
                TableDetector.containsTable(text)));
      }

      ExtractionResult result =
          new ExtractionResult(pages, pageCount, pdfMetadata(document.getDocumentInformation()));
      if (result.characterCount() < SCANNED_TEXT_THRESHOLD && pageCount > 1) {
        throw new LikelyScannedDocumentException(
            "PDF appears to be scanned or image-based (%d characters across %d pages). "
                    .formatted(result.characterCount(), pageCount)
                + "OCR is not supported.");
      }
      log.debug(
          "Extracted {} pages, {} characters from {}",
          pageCount,
          result.characterCount(),
          filename);
      return result;
    } catch (InvalidPasswordException e) {
      throw new PasswordProtectedException("PDF is password-protected: " + filename, e);
    } catch (IOException e) {
      throw new ExtractionException("Failed to read PDF " + filename + ": " + e.getMessage(), e);
    }
  }

  private static boolean hasImages(PDPage page) {
    PDResources resources = page.getResources();
    if (resources == null) {
      return false;
    }
    for (COSName name : resources.getXObjectNames()) {
      if (resources.isImageXObject(name)) {
        return true;
      }
    }
    return false;
  }

  private static DocumentMetadata pdfMetadata(PDDocumentInformation info) {
    return new DocumentMetadata(
        blankToNull(info.getTitle()),
        blankToNull(info.getAuthor()),
        blankToNull(info.getSubject()),
        blankToNull(info.getCreator()),
        blankToNull(info.getProducer()));
  }

  private ExtractionResult extractDocx(Path file, String filename) {
    try (InputStream in = Files.newInputStream(file);
        XWPFWordExtractor extractor = new XWPFWordExtractor(new XWPFDocument(in))) {
      XWPFDocument document = extractor.getDocument();
      String text = extractor.getText();
      boolean hasImages = !document.getAllPictures().isEmpty();
      boolean hasTables = !document.getTables().isEmpty() || TableDetector.containsTable(text);

      POIXMLProperties.CoreProperties core = document.getProperties().getCoreProperties();
      String title = blankToNull(core.getTitle());
      DocumentMetadata metadata =
          new DocumentMetadata(
              title != null ? title : stripExtension(filename),
              blankToNull(core.getCreator()),
              blankToNull(core.getSubject()),
              null,
              null);

      return new ExtractionResult(
          List.of(new ExtractedPage(1, text.trim(), hasImages, hasTables)), 1, metadata);
    } catch (IOException | POIXMLException | UnsupportedFileFormatException e) {
      throw new ExtractionException("Failed to read DOCX " + filename + ": " + e.getMessage(), e);
    }
  }

  private ExtractionResult extractPlainText(Path file, String filename) {
    String text;
    try {
      text = Files.readString(file, StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new ExtractionException("Failed to read " + filename + ": " + e.getMessage(), e);
    }
    return new ExtractionResult(
        List.of(new ExtractedPage(1, text.trim(), false, TableDetector.containsTable(text))),
        1,
        DocumentMetadata.titled(filename));
  }

  private static String stripExtension(String filename) {
    int dot = filename.lastIndexOf('.');
    return dot > 0 ? filename.substring(0, dot) : filename;
  }

  private static @Nullable String blankToNull(@Nullable String value) {
    return value == null || value.isBlank() ? null : value.trim();
  }
}
