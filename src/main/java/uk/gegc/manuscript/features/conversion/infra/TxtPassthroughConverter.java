package uk.gegc.manuscript.features.conversion.infra;

import org.springframework.stereotype.Component;
import uk.gegc.manuscript.features.conversion.domain.ConversionResult;
import uk.gegc.manuscript.features.conversion.domain.DocumentConverter;
import uk.gegc.manuscript.features.conversion.domain.DocumentImportOptions;

import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * Passthrough converter for plain text files.
 * Assumes UTF-8 encoding; a leading byte order mark is dropped and line endings become LF.
 */
@Component
public class TxtPassthroughConverter implements DocumentConverter {

    @Override
    public boolean supports(String filenameOrMime) {
        if (filenameOrMime == null) return false;
        String lower = filenameOrMime.toLowerCase(Locale.ROOT);
        return lower.endsWith(".txt") || lower.equals("text/plain");
    }

    @Override
    public ConversionResult convert(byte[] bytes, DocumentImportOptions options) {
        return new ConversionResult(decode(bytes));
    }

    static String decode(byte[] bytes) {
        String text = new String(bytes, StandardCharsets.UTF_8);
        if (text.startsWith("\uFEFF")) {
            text = text.substring(1);
        }
        return text.replace("\r\n", "\n").replace('\r', '\n');
    }
}
