package uk.gegc.manuscript.shared.util;

/**
 * Escaping for text and attribute values in hand-built XML.
 */
public final class XmlText {

    private XmlText() {
    }

    public static String escape(String value) {
        if (value == null) {
            return "";
        }
        return value.replace("&", "&amp;")
                .replace("<", "&lt;")
                .replace(">", "&gt;")
                .replace("\"", "&quot;")
                .replace("'", "&apos;");
    }
}
