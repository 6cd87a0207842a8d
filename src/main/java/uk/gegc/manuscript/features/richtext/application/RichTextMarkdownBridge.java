package uk.gegc.manuscript.features.richtext.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.manuscript.features.richtext.domain.RichText;
import uk.gegc.manuscript.features.richtext.domain.RtfConversion;
import uk.gegc.manuscript.features.richtext.domain.RtfParseException;
import uk.gegc.manuscript.features.richtext.infra.RtfReader;
import uk.gegc.manuscript.features.richtext.infra.RtfWriter;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * Converts between formatting runs, Markdown and RTF.
 * <p>
 * RTF to Markdown never throws: unparseable RTF falls back to the bytes decoded as UTF-8, and
 * bytes that are not valid UTF-8 either give empty content. Callers turn
 * {@link RtfConversion#failureReason()} into a per-item warning.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RichTextMarkdownBridge {

    private final MarkdownRunRenderer renderer;
    private final MarkdownInlineParser parser;
    private final RtfReader rtfReader;
    private final RtfWriter rtfWriter;

    public String toMarkdown(RichText richText) {
        if (richText == null || richText.isEmpty()) {
            return "";
        }
        return renderer.render(richText);
    }

    public RichText toRichText(String markdown) {
        return parser.parse(markdown);
    }

    public String cleanup(String markdown) {
        return MarkdownCleanup.clean(markdown);
    }

    public RtfConversion rtfToMarkdown(byte[] rtf) {
        if (rtf == null || rtf.length == 0) {
            return new RtfConversion("", null);
        }
        try {
            return new RtfConversion(toMarkdown(rtfReader.read(rtf)), null);
        } catch (RtfParseException e) {
            log.debug("RTF parsing failed, falling back to UTF-8 text: {}", e.getMessage());
            return new RtfConversion(cleanup(decodeUtf8OrEmpty(rtf)), e.getMessage());
        } catch (RuntimeException e) {
            log.warn("RTF reader failed unexpectedly, falling back to UTF-8 text", e);
            return new RtfConversion(cleanup(decodeUtf8OrEmpty(rtf)), "Unreadable RTF: " + e);
        }
    }

    public String markdownToRtf(String markdown) {
        return rtfWriter.write(toRichText(markdown));
    }

    /**
     * RTF as bytes. The writer only emits 7-bit characters.
     */
    public byte[] markdownToRtfBytes(String markdown) {
        return markdownToRtf(markdown).getBytes(StandardCharsets.US_ASCII);
    }

    private static String decodeUtf8OrEmpty(byte[] bytes) {
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
        } catch (CharacterCodingException e) {
            log.debug("Content is not valid UTF-8 either, using empty content");
            return "";
        }
    }
}
