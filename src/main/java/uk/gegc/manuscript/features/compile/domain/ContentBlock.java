package uk.gegc.manuscript.features.compile.domain;

import uk.gegc.manuscript.features.richtext.domain.RichText;

/**
 * One block of a document's body: a paragraph, a heading line or a scene break.
 *
 * @param level heading level 1 to 6 for headings, 0 otherwise
 */
public record ContentBlock(Kind kind, int level, RichText text) {

    public enum Kind {
        PARAGRAPH,
        HEADING,
        SCENE_BREAK
    }

    public ContentBlock {
        text = text == null ? RichText.EMPTY : text;
    }

    public static ContentBlock paragraph(RichText text) {
        return new ContentBlock(Kind.PARAGRAPH, 0, text);
    }

    public static ContentBlock heading(int level, RichText text) {
        return new ContentBlock(Kind.HEADING, level, text);
    }

    public static ContentBlock sceneBreak() {
        return new ContentBlock(Kind.SCENE_BREAK, 0, RichText.EMPTY);
    }

    public String plainText() {
        return text.plainText();
    }
}
