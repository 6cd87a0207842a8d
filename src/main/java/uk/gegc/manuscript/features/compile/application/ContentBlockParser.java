package uk.gegc.manuscript.features.compile.application;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import uk.gegc.manuscript.features.compile.domain.ContentBlock;
import uk.gegc.manuscript.features.richtext.application.RichTextMarkdownBridge;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits Markdown document content into blocks for the structured renderers.
 * <p>
 * Blocks are separated by blank lines. A block consisting of a single {@code #} line is a heading,
 * a block of three or more {@code *}, {@code -} or {@code _} is a scene break, anything else is a
 * paragraph whose single line breaks are kept as {@code \n} inside its runs.
 */
@Component
@RequiredArgsConstructor
public class ContentBlockParser {

    private static final Pattern BLOCK_SEPARATOR = Pattern.compile("\\n[ \\t]*\\n");
    private static final Pattern HEADING = Pattern.compile("^(#{1,6})[ \\t]+(.+)$");
    private static final Pattern SCENE_BREAK =
            Pattern.compile("^(?:(?:\\*[ \\t]*){3,}|(?:-[ \\t]*){3,}|(?:_[ \\t]*){3,})$");

    private final RichTextMarkdownBridge bridge;

    public List<ContentBlock> parse(String markdown) {
        if (markdown == null || markdown.isBlank()) {
            return List.of();
        }
        String normalized = markdown.replace("\r\n", "\n").replace('\r', '\n');
        List<ContentBlock> blocks = new ArrayList<>();
        for (String chunk : BLOCK_SEPARATOR.split(normalized)) {
            String trimmed = chunk.strip();
            if (trimmed.isEmpty()) {
                continue;
            }
            if (SCENE_BREAK.matcher(trimmed).matches()) {
                blocks.add(ContentBlock.sceneBreak());
                continue;
            }
            Matcher heading = HEADING.matcher(trimmed);
            if (!trimmed.contains("\n") && heading.matches()) {
                String text = heading.group(2).strip().replaceFirst("[ \\t]+#+$", "");
                blocks.add(ContentBlock.heading(heading.group(1).length(), bridge.toRichText(text)));
                continue;
            }
            blocks.add(ContentBlock.paragraph(bridge.toRichText(trimmed)));
        }
        return blocks;
    }
}
