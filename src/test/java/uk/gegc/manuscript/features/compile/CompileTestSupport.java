package uk.gegc.manuscript.features.compile;

import uk.gegc.manuscript.features.compile.application.ContentBlockParser;
import uk.gegc.manuscript.features.compile.domain.CompilableDocument;
import uk.gegc.manuscript.features.compile.domain.CompilePayload;
import uk.gegc.manuscript.features.compile.domain.CompileSettings;
import uk.gegc.manuscript.features.richtext.application.MarkdownInlineParser;
import uk.gegc.manuscript.features.richtext.application.MarkdownRunRenderer;
import uk.gegc.manuscript.features.richtext.application.RichTextMarkdownBridge;
import uk.gegc.manuscript.features.richtext.infra.RtfReader;
import uk.gegc.manuscript.features.richtext.infra.RtfWriter;
import uk.gegc.manuscript.shared.progress.ProgressListener;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

/**
 * Shared collaborators and sample payloads for renderer tests.
 */
final class CompileTestSupport {

    static final Clock CLOCK = Clock.fixed(Instant.parse("2024-05-01T12:00:00Z"), ZoneOffset.UTC);

    private CompileTestSupport() {
    }

    static RichTextMarkdownBridge bridge() {
        return new RichTextMarkdownBridge(new MarkdownRunRenderer(), new MarkdownInlineParser(),
                new RtfReader(), new RtfWriter());
    }

    static ContentBlockParser blockParser() {
        return new ContentBlockParser(bridge());
    }

    static CompilableDocument doc(String title, String content, int depth) {
        return new CompilableDocument(UUID.randomUUID(), title, content, 0, depth, "Draft");
    }

    static CompilePayload payload(CompileSettings settings, CompilableDocument... documents) {
        return new CompilePayload(List.of(documents), "The Long Road", "Ann Writer", settings,
                "the-long-road", ProgressListener.NONE);
    }

    static List<CompilableDocument> sampleDocuments() {
        return List.of(
                doc("Opening", "It was a **bold** start.\n\nThe second paragraph.", 0),
                doc("Arrival", "She arrived *late*.", 1),
                doc("Departure", "See [the map](https://example.com/map).", 1));
    }

    static CompilePayload samplePayload(CompileSettings settings) {
        return new CompilePayload(sampleDocuments(), "The Long Road", "Ann Writer", settings,
                "the-long-road", ProgressListener.NONE);
    }
}
