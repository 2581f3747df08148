package com.scholary.followalong.document;

import com.scholary.followalong.config.AlignmentProperties;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.text.PDFTextStripper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Extracts per-page text and sentences from PDF documents.
 *
 * <p>A document whose pages hold fewer letters and digits than the configured minimum is reported
 * as having no text, which is how scanned documents are recognized.
 */
@Component
public class TextExtractor {

  private static final Logger LOGGER = LoggerFactory.getLogger(TextExtractor.class);

  private final SentenceTokenizer tokenizer;
  private final int minDocumentCharacters;

  public TextExtractor(SentenceTokenizer tokenizer, AlignmentProperties properties) {
    this.tokenizer = tokenizer;
    this.minDocumentCharacters = properties.minDocumentCharacters();
  }

  /**
   * Extract a document.
   *
   * @throws IOException if the file cannot be read or is not a PDF
   */
  public ExtractedDocument extract(Path path) throws IOException {
    LOGGER.info("Extracting text from {}", path.getFileName());

    try (PDDocument document = Loader.loadPDF(path.toFile())) {
      int pageCount = document.getNumberOfPages();
      PDFTextStripper stripper = new PDFTextStripper();

      List<String> pageTexts = new ArrayList<>(pageCount);
      long alphanumeric = 0;
      for (int page = 1; page <= pageCount; page++) {
        stripper.setStartPage(page);
        stripper.setEndPage(page);
        String text = stripper.getText(document);
        pageTexts.add(text);
        alphanumeric += text.chars().filter(Character::isLetterOrDigit).count();
      }

      if (alphanumeric < minDocumentCharacters) {
        LOGGER.warn(
            "Document {} has {} alphanumeric characters across {} pages; treating as image-only",
            path.getFileName(),
            alphanumeric,
            pageCount);
        return new ExtractedDocument(pageCount, false, List.of());
      }

      List<DocumentPage> pages = new ArrayList<>(pageCount);
      int sentenceCount = 0;
      for (int i = 0; i < pageCount; i++) {
        int pageNumber = i + 1;
        List<String> texts = tokenizer.tokenize(pageTexts.get(i));
        List<DocumentSentence> sentences = new ArrayList<>(texts.size());
        for (int j = 0; j < texts.size(); j++) {
          sentences.add(new DocumentSentence(pageNumber, j, texts.get(j)));
        }
        sentenceCount += sentences.size();

        PDRectangle box = document.getPage(i).getMediaBox();
        double width = box == null ? DocumentPage.LETTER_WIDTH : box.getWidth();
        double height = box == null ? DocumentPage.LETTER_HEIGHT : box.getHeight();
        pages.add(new DocumentPage(pageNumber, width, height, sentences));
      }

      LOGGER.info(
          "Extracted {} sentences from {} pages of {}",
          sentenceCount,
          pageCount,
          path.getFileName());
      return new ExtractedDocument(pageCount, true, pages);
    }
  }
}
