package uk.gegc.manuscript.features.compile.application.impl;

import lombok.RequiredArgsConstructor;
import org.jsoup.nodes.DataNode;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.DocumentType;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;
import uk.gegc.manuscript.features.compile.application.ContentBlockParser;
import uk.gegc.manuscript.features.compile.application.ExportRenderer;
import uk.gegc.manuscript.features.compile.domain.CompilePayload;
import uk.gegc.manuscript.features.compile.domain.ContentBlock;
import uk.gegc.manuscript.features.compile.domain.ExportFile;
import uk.gegc.manuscript.features.compile.domain.ExportFormat;
import uk.gegc.manuscript.features.richtext.domain.FormattedRun;
import uk.gegc.manuscript.features.richtext.domain.RichText;
import uk.gegc.manuscript.features.richtext.domain.TextAttributes;

import java.nio.charset.StandardCharsets;

/**
 * Renders the compiled Markdown (without front matter) as a standalone HTML page. Headings get ids
 * matching the Markdown contents links.
 */
@Component
@RequiredArgsConstructor
public class HtmlExportRenderer implements ExportRenderer {

    private static final String STYLE = """
            body{font-family:%s;line-height:1.6;margin:40px;color:#111;}
            h1,h2,h3,h4,h5,h6{margin-top:1.6em;}
            h1 + p em{color:#555;}
            hr{margin:2em 0;}
            mark{background:#fff3a3;}
            """;

    private final MarkdownExportRenderer markdownRenderer;
    private final ContentBlockParser blockParser;

    @Override
    public boolean supports(ExportFormat format) {
        return format == ExportFormat.HTML;
    }

    @Override
    public ExportFile render(CompilePayload payload) {
        CompilePayload withoutFrontMatter = new CompilePayload(
                payload.documents(),
                payload.title(),
                payload.author(),
                payload.settings().toBuilder().includeFrontMatter(false).build(),
                payload.filenamePrefix(),
                payload.listener());
        String markdown = markdownRenderer.renderMarkdown(withoutFrontMatter);

        Document html = Document.createShell("");
        html.outputSettings().charset(StandardCharsets.UTF_8).prettyPrint(true);
        html.prependChild(new DocumentType("html", "", ""));
        html.body().parent().attr("lang", "en");

        Element head = html.head();
        head.appendElement("meta").attr("charset", "utf-8");
        head.appendElement("meta").attr("name", "viewport").attr("content", "width=device-width, initial-scale=1");
        html.title(payload.title());
        head.appendElement("style").appendChild(
                new DataNode(STYLE.formatted(payload.settings().getFontStyle().cssFontFamily())));

        Element body = html.body();
        for (ContentBlock block : blockParser.parse(markdown)) {
            switch (block.kind()) {
                case HEADING -> {
                    Element heading = body.appendElement("h" + block.level())
                            .attr("id", MarkdownExportRenderer.anchor(block.plainText()));
                    appendRuns(heading, block.text());
                }
                case SCENE_BREAK -> body.appendElement("hr");
                case PARAGRAPH -> appendRuns(body.appendElement("p"), block.text());
            }
        }

        byte[] bytes = html.outerHtml().getBytes(StandardCharsets.UTF_8);
        return ExportFile.ofBytes(payload.filename(ExportFormat.HTML), ExportFormat.HTML.contentType(), bytes);
    }

    private static void appendRuns(Element parent, RichText text) {
        for (FormattedRun run : text.runs()) {
            TextAttributes a = run.attributes();
            Element target = parent;
            if (a.link() != null) {
                target = target.appendElement("a").attr("href", a.link());
            }
            if (a.bold()) {
                target = target.appendElement("strong");
            }
            if (a.italic()) {
                target = target.appendElement("em");
            }
            if (a.strikethrough()) {
                target = target.appendElement("del");
            }
            if (a.underline()) {
                target = target.appendElement("u");
            }
            if (a.highlight()) {
                target = target.appendElement("mark");
            }
            String[] lines = run.text().split("\n", -1);
            for (int i = 0; i < lines.length; i++) {
                if (i > 0) {
                    target.appendElement("br");
                }
                if (!lines[i].isEmpty()) {
                    target.appendText(lines[i]);
                }
            }
        }
    }
}
