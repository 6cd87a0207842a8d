package uk.gegc.manuscript.features.conversion.infra;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import uk.gegc.manuscript.features.conversion.domain.ConversionResult;
import uk.gegc.manuscript.features.conversion.domain.DocumentConverter;
import uk.gegc.manuscript.features.conversion.domain.DocumentImportOptions;
import uk.gegc.manuscript.features.richtext.application.RichTextMarkdownBridge;
import uk.gegc.manuscript.shared.dto.ImportWarning;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Markdown files are already in the document content format and are kept as written. Without
 * formatting, markup is flattened to the text it wraps.
 */
@Component
@RequiredArgsConstructor
public class MarkdownDocumentConverter implements DocumentConverter {

    static final String PRESERVED_MESSAGE = "Markdown syntax is preserved as editable text content.";
    private static final Pattern HEADING_MARKER = Pattern.compile("(?m)^#{1,6}[ \\t]+");

    private final RichTextMarkdownBridge bridge;

    @Override
    public boolean supports(String filenameOrMime) {
        if (filenameOrMime == null) return false;
        String lower = filenameOrMime.toLowerCase(Locale.ROOT);
        return lower.endsWith(".md") || lower.endsWith(".markdown") || lower.equals("text/markdown");
    }

    @Override
    public ConversionResult convert(byte[] bytes, DocumentImportOptions options) {
        String markdown = TxtPassthroughConverter.decode(bytes);
        if (options.preserveFormatting()) {
            return new ConversionResult(markdown, List.of(ImportWarning.info(PRESERVED_MESSAGE, null)));
        }
        String withoutHeadings = HEADING_MARKER.matcher(markdown).replaceAll("");
        return new ConversionResult(bridge.toRichText(withoutHeadings).plainText());
    }
}
