package com.flamingo.ai.docpipeline.service.extraction;

import com.flamingo.ai.docpipeline.exception.ExtractionException;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.apache.tika.exception.TikaException;
import org.apache.tika.metadata.Metadata;
import org.apache.tika.parser.AutoDetectParser;
import org.apache.tika.parser.ParseContext;
import org.apache.tika.sax.BodyContentHandler;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;
import org.xml.sax.SAXException;

/**
 * {@link TextExtractor} for Office, OpenDocument and text-like formats (DOCX, PPTX, XLSX, ODF, RTF,
 * HTML, EPUB, plain text, Markdown).
 *
 * <p>Uses Apache Tika's {@link AutoDetectParser} with an unbounded {@link BodyContentHandler}.
 */
@Service
@Order(2)
@Slf4j
public class TikaTextExtractor implements TextExtractor {

  private static final Set<String> SUPPORTED_PREFIXES =
      Set.of(
          "application/vnd.openxmlformats",
          "application/vnd.ms-",
          "application/vnd.oasis",
          "text/");

  private static final Set<String> SUPPORTED_TYPES =
      Set.of(
          "application/msword",
          "application/rtf",
          "application/epub+zip",
          "application/xhtml+xml");

  @Override
  public String extract(byte[] bytes, String contentType) {
    AutoDetectParser parser = new AutoDetectParser();
    BodyContentHandler handler = new BodyContentHandler(-1);
    Metadata metadata = new Metadata();
    metadata.set(Metadata.CONTENT_TYPE, contentType);
    try (InputStream in = new ByteArrayInputStream(bytes)) {
      parser.parse(in, handler, metadata, new ParseContext());
      String text = handler.toString();
      log.debug("Tika extracted {} chars from {} document", text.length(), contentType);
      return text;
    } catch (IOException | SAXException | TikaException e) {
      log.error("Tika parsing failed for contentType={}: {}", contentType, e.getMessage());
      throw ExtractionException.corruptInput(contentType, e);
    }
  }

  @Override
  public boolean supports(String contentType) {
    if (contentType == null) {
      return false;
    }
    return SUPPORTED_TYPES.contains(contentType)
        || SUPPORTED_PREFIXES.stream().anyMatch(contentType::startsWith);
  }
}
