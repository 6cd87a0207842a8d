package uk.gegc.manuscript.features.scrivener.application;

import uk.gegc.manuscript.features.project.domain.model.Label;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Picks the document color name for an imported label. Keywords in the label name win over
 * the hex value; anything unrecognised is "Brown".
 */
public final class LabelColorNamer {

    public static final String DEFAULT_COLOR = "Brown";

    private static final List<Map.Entry<String, List<String>>> NAME_KEYWORDS = List.of(
            Map.entry("Red", List.of("red", "urgent", "critical")),
            Map.entry("Orange", List.of("orange", "important")),
            Map.entry("Yellow", List.of("yellow", "review")),
            Map.entry("Green", List.of("green", "done", "complete")),
            Map.entry("Blue", List.of("blue", "info")),
            Map.entry("Purple", List.of("purple", "violet")),
            Map.entry("Pink", List.of("pink"))
    );

    private LabelColorNamer() {
    }

    public static String colorName(Label label) {
        if (label == null) {
            return DEFAULT_COLOR;
        }
        String name = label.name() == null ? "" : label.name().toLowerCase(Locale.ROOT);
        for (Map.Entry<String, List<String>> entry : NAME_KEYWORDS) {
            if (entry.getValue().stream().anyMatch(name::contains)) {
                return entry.getKey();
            }
        }

        String hex = label.color() == null ? "" : label.color().toLowerCase(Locale.ROOT);
        if (hex.startsWith("#ff") && !hex.startsWith("#ff0") && !hex.startsWith("#fff")) {
            return "Red";
        }
        if (hex.startsWith("#00ff") || hex.startsWith("#0f0")) {
            return "Green";
        }
        if (hex.startsWith("#0000ff") || hex.startsWith("#00f")) {
            return "Blue";
        }
        return DEFAULT_COLOR;
    }
}
