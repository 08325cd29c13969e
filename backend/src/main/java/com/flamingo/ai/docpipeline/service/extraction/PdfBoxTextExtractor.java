package com.flamingo.ai.docpipeline.service.extraction;

import com.flamingo.ai.docpipeline.exception.ExtractionException;
import java.io.IOException;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.encryption.InvalidPasswordException;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/** {@link TextExtractor} for PDF documents using Apache PDFBox 3.x. Pages are emitted in order. */
@Service
@Order(1)
@Slf4j
public class PdfBoxTextExtractor implements TextExtractor {

  static final String PDF = "application/pdf";

  @Override
  public String extract(byte[] bytes, String contentType) {
    try (PDDocument pdfDoc = Loader.loadPDF(bytes)) {
      PDFTextStripper stripper = new PDFTextStripper();
      String text = stripper.getText(pdfDoc);
      log.debug(
          "PDFBox extracted {} chars from {} pages", text.length(), pdfDoc.getNumberOfPages());
      return text;
    } catch (InvalidPasswordException e) {
      log.warn("PDF is password protected: {}", e.getMessage());
      throw ExtractionException.corruptInput(contentType, e);
    } catch (IOException e) {
      log.error("PDFBox parsing failed: {}", e.getMessage());
      throw ExtractionException.corruptInput(contentType, e);
    }
  }

  @Override
  public boolean supports(String contentType) {
    return PDF.equals(contentType);
  }
}
