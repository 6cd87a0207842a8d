package uk.gegc.manuscript.features.conversion.infra;

import lombok.extern.slf4j.Slf4j;
import org.apache.poi.hwpf.extractor.WordExtractor;
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
 * Binary Word 97-2003 (.doc) converter using POI HWPF. Only paragraph text is recovered.
 */
@Component
@Slf4j
public class LegacyWordDocumentConverter implements DocumentConverter {

    static final String LIMITED_SUPPORT_MESSAGE = "Older .doc format has limited formatting support. Imported as plain text.";

    @Override
    public boolean supports(String filenameOrMime) {
        if (filenameOrMime == null) return false;
        String lower = filenameOrMime.toLowerCase(Locale.ROOT);
        return lower.endsWith(".doc") || lower.equals("application/msword");
    }

    @Override
    public ConversionResult convert(byte[] bytes, DocumentImportOptions options) throws ConversionException {
        try (WordExtractor extractor = new WordExtractor(new ByteArrayInputStream(bytes))) {
            List<String> paragraphs = new ArrayList<>();
            for (String paragraph : extractor.getParagraphText()) {
                String text = WordExtractor.stripFields(paragraph).replace("\r", "").strip();
                if (!text.isEmpty()) {
                    paragraphs.add(text);
                }
            }
            String content = String.join("\n\n", paragraphs);
            log.debug("Converted DOC document: {} bytes -> {} paragraphs", bytes.length, paragraphs.size());
            List<ImportWarning> warnings = options.preserveFormatting()
                    ? List.of(ImportWarning.warning(LIMITED_SUPPORT_MESSAGE, null))
                    : List.of();
            return new ConversionResult(content, warnings);
        } catch (IOException | RuntimeException e) {
            throw new ConversionException("Failed to convert DOC document: " + e.getMessage(), e);
        }
    }
}
