package uk.gegc.manuscript.features.compile.application.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.manuscript.features.compile.application.ExportRenderer;
import uk.gegc.manuscript.features.compile.domain.CompilableDocument;
import uk.gegc.manuscript.features.compile.domain.CompilePayload;
import uk.gegc.manuscript.features.compile.domain.CompileProgress;
import uk.gegc.manuscript.features.compile.domain.CompileSettings;
import uk.gegc.manuscript.features.compile.domain.DocumentSeparator;
import uk.gegc.manuscript.features.compile.domain.ExportFile;
import uk.gegc.manuscript.features.compile.domain.ExportFormat;
import uk.gegc.manuscript.features.compile.domain.ExportRenderingException;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Concatenates documents into one Markdown file, optionally preceded by YAML front matter and a
 * linked table of contents. Document headings start at {@code ##} and go one level deeper per
 * folder, capped at {@code ######}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MarkdownExportRenderer implements ExportRenderer {

    private static final ObjectMapper YAML = new ObjectMapper(
            YAMLFactory.builder()
                    .disable(YAMLGenerator.Feature.MINIMIZE_QUOTES)
                    .build());

    private final Clock clock;

    @Override
    public boolean supports(ExportFormat format) {
        return format == ExportFormat.MARKDOWN;
    }

    @Override
    public ExportFile render(CompilePayload payload) {
        byte[] bytes = renderMarkdown(payload).getBytes(StandardCharsets.UTF_8);
        return ExportFile.ofBytes(payload.filename(ExportFormat.MARKDOWN), ExportFormat.MARKDOWN.contentType(), bytes);
    }

    /**
     * Builds the Markdown text. Also the source the HTML renderer converts.
     */
    public String renderMarkdown(CompilePayload payload) {
        CompileSettings settings = payload.settings();
        List<CompilableDocument> documents = payload.documents();
        StringBuilder md = new StringBuilder();

        if (settings.isIncludeFrontMatter()) {
            md.append(frontMatter(payload)).append("---\n\n");
        }

        md.append("# ").append(payload.title()).append("\n\n");
        if (payload.hasAuthor()) {
            md.append("*by ").append(payload.author()).append("*\n\n");
        }

        if (settings.isIncludeTableOfContents()) {
            md.append("## Table of Contents\n\n");
            for (CompilableDocument doc : documents) {
                md.append("  ".repeat(doc.depth()))
                        .append("- [").append(doc.title()).append("](#").append(anchor(doc.title())).append(")\n");
            }
            md.append("\n---\n\n");
        }

        DocumentSeparator separator = settings.getDocumentSeparator();
        for (int index = 0; index < documents.size(); index++) {
            CompilableDocument doc = documents.get(index);
            payload.report(CompileProgress.processing(index + 1, documents.size()));

            if (settings.isIncludeChapterTitles() && !doc.title().isBlank()) {
                md.append("#".repeat(headingLevel(doc.depth()))).append(' ').append(doc.title()).append("\n\n");
            }
            String content = doc.content().strip();
            if (!content.isEmpty()) {
                md.append(content).append('\n');
            }
            if (index < documents.size() - 1) {
                md.append(separator.markdownSeparator());
                if (separator == DocumentSeparator.CHAPTER_HEADING) {
                    md.append('\n');
                }
            }
        }

        payload.report(CompileProgress.generating(documents.size()));
        return md.toString();
    }

    static int headingLevel(int depth) {
        return Math.min(depth + 2, 6);
    }

    /**
     * GitHub-style heading anchor: lowercase, spaces to hyphens, everything but letters, digits
     * and hyphens dropped.
     */
    static String anchor(String title) {
        StringBuilder sb = new StringBuilder();
        title.toLowerCase(Locale.ROOT).replace(' ', '-').codePoints()
                .filter(cp -> Character.isLetterOrDigit(cp) || cp == '-')
                .forEach(sb::appendCodePoint);
        return sb.toString();
    }

    private String frontMatter(CompilePayload payload) {
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put("title", payload.title());
        if (payload.hasAuthor()) {
            fields.put("author", payload.author());
        }
        fields.put("date", LocalDate.now(clock).toString());
        try {
            String yaml = YAML.writeValueAsString(fields);
            return yaml.endsWith("\n") ? yaml : yaml + "\n";
        } catch (JsonProcessingException e) {
            throw new ExportRenderingException("Failed to write Markdown front matter", e);
        }
    }
}
