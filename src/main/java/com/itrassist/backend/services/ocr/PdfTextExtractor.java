package com.itrassist.backend.services.ocr;

import java.io.IOException;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.stereotype.Service;

import lombok.extern.slf4j.Slf4j;

@Slf4j
@Service
public class PdfTextExtractor {

    /**
     * Text layer of a PDF. Unparseable, encrypted or image-only files yield an empty string.
     */
    public String extractText(byte[] pdfBytes) {
        if (pdfBytes == null || pdfBytes.length == 0) return "";

        try (PDDocument document = PDDocument.load(pdfBytes)) {
            return extractText(document);
        } catch (IOException | RuntimeException e) {
            log.warn("[PdfTextExtractor] Could not read PDF ({} bytes): {}", pdfBytes.length, e.toString());
            return "";
        }
    }

    public String extractText(PDDocument document) throws IOException {
        PDFTextStripper stripper = new PDFTextStripper();
        stripper.setSortByPosition(true);
        String text = stripper.getText(document);
        return text == null ? "" : text;
    }
}
