package uk.gegc.manuscript.features.conversion.infra;

import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.stereotype.Component;
import uk.gegc.manuscript.features.conversion.domain.ConversionException;
import uk.gegc.manuscript.features.conversion.domain.ConversionResult;
import uk.gegc.manuscript.features.conversion.domain.DocumentConverter;
import uk.gegc.manuscript.features.conversion.domain.DocumentImportOptions;
import uk.gegc.manuscript.shared.dto.ImportWarning;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * PDF document converter using Apache PDFBox.
 * Extracts plain text page by page; pages are separated by a blank line.
 */
@Component
@Slf4j
public class PdfBoxDocumentConverter implements DocumentConverter {

    static final String FORMATTING_LOST_MESSAGE = "PDF formatting cannot be fully preserved. Imported as plain text.";

    @Override
    public boolean supports(String filenameOrMime) {
        if (filenameOrMime == null) return false;
        String lower = filenameOrMime.toLowerCase(Locale.ROOT);
        return lower.endsWith(".pdf") || lower.equals("application/pdf");
    }

    @Override
    public ConversionResult convert(byte[] bytes, DocumentImportOptions options) throws ConversionException {
        try (PDDocument document = PDDocument.load(new ByteArrayInputStream(bytes))) {
            PDFTextStripper stripper = new PDFTextStripper();
            stripper.setSortByPosition(true);

            List<String> pages = new ArrayList<>();
            List<ImportWarning> warnings = new ArrayList<>();
            for (int page = 1; page <= document.getNumberOfPages(); page++) {
                stripper.setStartPage(page);
                stripper.setEndPage(page);
                String text = stripper.getText(document).strip();
                if (text.isEmpty()) {
                    warnings.add(ImportWarning.info("Page " + page + " contained no extractable text.", null));
                } else {
                    pages.add(text.replace("\r\n", "\n"));
                }
            }
            if (options.preserveFormatting()) {
                warnings.add(ImportWarning.info(FORMATTING_LOST_MESSAGE, null));
            }

            String text = String.join("\n\n", pages);
            log.debug("Converted PDF document: {} bytes -> {} characters", bytes.length, text.length());
            return new ConversionResult(text, warnings);
        } catch (IOException e) {
            throw new ConversionException("Failed to convert PDF document: " + e.getMessage(), e);
        }
    }
}
