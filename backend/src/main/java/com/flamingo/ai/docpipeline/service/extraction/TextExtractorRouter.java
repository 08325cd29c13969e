package com.flamingo.ai.docpipeline.service.extraction;

import com.flamingo.ai.docpipeline.exception.ExtractionException;
import io.micrometer.core.annotation.Timed;
import java.util.List;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Routes a document to the highest-priority {@link TextExtractor} that supports its content type.
 *
 * <p>Extractors are injected by Spring in {@code @Order} order (ascending). A content type nothing
 * supports, {@code application/octet-stream} included, fails with {@code UNSUPPORTED_FORMAT}; text
 * that is blank after extraction fails with {@code EMPTY_RESULT}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TextExtractorRouter {

  private final List<TextExtractor> extractors;

  /**
   * Extracts the text of a document.
   *
   * @param bytes raw document content
   * @param contentType declared MIME type, parameters such as {@code charset} allowed
   * @return non-blank extracted text
   * @throws ExtractionException if no extractor applies, parsing fails, or the text is blank
   */
  @Timed(value = "document.extract", description = "Time to extract text from a document")
  public String extract(byte[] bytes, String contentType) {
    String normalized = normalize(contentType);
    TextExtractor extractor =
        extractors.stream()
            .filter(e -> e.supports(normalized))
            .findFirst()
            .orElseThrow(() -> ExtractionException.unsupportedFormat(contentType));

    log.debug("Extracting {} using {}", normalized, extractor.getClass().getSimpleName());
    String text = extractor.extract(bytes, normalized);
    if (text == null || text.isBlank()) {
      throw ExtractionException.emptyResult(normalized);
    }
    return text;
  }

  /** Returns {@code true} if some extractor handles the content type. */
  public boolean supports(String contentType) {
    String normalized = normalize(contentType);
    return extractors.stream().anyMatch(e -> e.supports(normalized));
  }

  /** Lower-cases a MIME type and strips its parameters. */
  static String normalize(String contentType) {
    if (contentType == null) {
      return "";
    }
    int semicolon = contentType.indexOf(';');
    String base = semicolon >= 0 ? contentType.substring(0, semicolon) : contentType;
    return base.trim().toLowerCase(Locale.ROOT);
  }
}
