package uk.gegc.manuscript.features.compile.application.impl;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import uk.gegc.manuscript.features.compile.application.ExportRenderer;
import uk.gegc.manuscript.features.compile.domain.CompilableDocument;
import uk.gegc.manuscript.features.compile.domain.CompilePayload;
import uk.gegc.manuscript.features.compile.domain.CompileProgress;
import uk.gegc.manuscript.features.compile.domain.CompileSettings;
import uk.gegc.manuscript.features.compile.domain.ExportFile;
import uk.gegc.manuscript.features.compile.domain.ExportFormat;
import uk.gegc.manuscript.features.richtext.application.RichTextMarkdownBridge;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

@Component
@RequiredArgsConstructor
public class PlainTextExportRenderer implements ExportRenderer {

    private static final String RULE = "-".repeat(40);
    private static final Pattern HEADING_MARKER = Pattern.compile("(?m)^#{1,6}[ \\t]+");
    private static final Pattern INLINE_CODE = Pattern.compile("`");

    private final RichTextMarkdownBridge bridge;

    @Override
    public boolean supports(ExportFormat format) {
        return format == ExportFormat.PLAIN_TEXT;
    }

    @Override
    public ExportFile render(CompilePayload payload) {
        CompileSettings settings = payload.settings();
        List<CompilableDocument> documents = payload.documents();
        StringBuilder text = new StringBuilder();

        text.append(payload.title().toUpperCase(Locale.ROOT)).append('\n')
                .append(underline(payload.title(), '=')).append("\n\n");
        if (payload.hasAuthor()) {
            text.append("by ").append(payload.author()).append("\n\n");
        }

        if (settings.isIncludeTableOfContents()) {
            text.append("TABLE OF CONTENTS\n").append("-----------------\n\n");
            for (CompilableDocument doc : documents) {
                text.append("  ".repeat(doc.depth())).append("• ").append(doc.title()).append('\n');
            }
            text.append('\n').append(RULE).append("\n\n");
        }

        for (int index = 0; index < documents.size(); index++) {
            CompilableDocument doc = documents.get(index);
            payload.report(CompileProgress.processing(index + 1, documents.size()));

            if (settings.isIncludeChapterTitles() && !doc.title().isBlank()) {
                text.append(doc.title().toUpperCase(Locale.ROOT)).append('\n')
                        .append(underline(doc.title(), '-')).append("\n\n");
            }
            String content = stripMarkdown(doc.content().strip());
            if (!content.isEmpty()) {
                text.append(content).append('\n');
            }
            if (index < documents.size() - 1) {
                text.append(switch (settings.getDocumentSeparator()) {
                    case NONE, CHAPTER_HEADING -> "\n\n";
                    case BLANK_LINE -> "\n\n\n";
                    case THREE_ASTERISKS -> "\n\n* * *\n\n";
                    case PAGE_BREAK -> "\n\n" + RULE + "\n\n";
                });
            }
        }

        payload.report(CompileProgress.generating(documents.size()));
        byte[] bytes = text.toString().getBytes(StandardCharsets.UTF_8);
        return ExportFile.ofBytes(payload.filename(ExportFormat.PLAIN_TEXT), ExportFormat.PLAIN_TEXT.contentType(), bytes);
    }

    /**
     * Drops Markdown markup but keeps the text it wraps; links keep their label.
     */
    String stripMarkdown(String markdown) {
        if (markdown.isEmpty()) {
            return markdown;
        }
        String withoutHeadings = HEADING_MARKER.matcher(markdown).replaceAll("");
        String plain = bridge.toRichText(withoutHeadings).plainText();
        return INLINE_CODE.matcher(plain).replaceAll("");
    }

    private static String underline(String text, char c) {
        return String.valueOf(c).repeat(text.codePointCount(0, text.length()));
    }
}
