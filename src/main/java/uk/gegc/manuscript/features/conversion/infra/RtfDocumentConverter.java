package uk.gegc.manuscript.features.conversion.infra;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.manuscript.features.conversion.domain.ConversionResult;
import uk.gegc.manuscript.features.conversion.domain.DocumentConverter;
import uk.gegc.manuscript.features.conversion.domain.DocumentImportOptions;
import uk.gegc.manuscript.features.richtext.application.RichTextMarkdownBridge;
import uk.gegc.manuscript.features.richtext.domain.RtfConversion;
import uk.gegc.manuscript.shared.dto.ImportWarning;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

@Component
@RequiredArgsConstructor
@Slf4j
public class RtfDocumentConverter implements DocumentConverter {

    private final RichTextMarkdownBridge bridge;

    @Override
    public boolean supports(String filenameOrMime) {
        if (filenameOrMime == null) return false;
        String lower = filenameOrMime.toLowerCase(Locale.ROOT);
        return lower.endsWith(".rtf") || lower.equals("application/rtf") || lower.equals("text/rtf");
    }

    @Override
    public ConversionResult convert(byte[] bytes, DocumentImportOptions options) {
        RtfConversion conversion = bridge.rtfToMarkdown(bytes);
        List<ImportWarning> warnings = new ArrayList<>();
        if (conversion.fellBack()) {
            log.warn("RTF parsing failed, imported raw text: {}", conversion.failureReason());
            warnings.add(ImportWarning.warning(
                    "RTF formatting could not be read and was imported as plain text: " + conversion.failureReason(),
                    null));
        }
        String content = options.preserveFormatting()
                ? conversion.markdown()
                : bridge.toRichText(conversion.markdown()).plainText();
        return new ConversionResult(content, warnings);
    }
}
