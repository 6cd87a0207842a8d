package uk.gegc.manuscript.features.richtext.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Text as an ordered list of runs that together cover the whole string with no gaps.
 * Adjacent runs with equal attributes are coalesced on construction.
 */
public record RichText(List<FormattedRun> runs) {

    public static final RichText EMPTY = new RichText(List.of());

    public RichText {
        runs = coalesce(runs == null ? List.of() : runs);
    }

    public static RichText plain(String text) {
        return text == null || text.isEmpty() ? EMPTY : new RichText(List.of(FormattedRun.plain(text)));
    }

    public String plainText() {
        StringBuilder sb = new StringBuilder();
        for (FormattedRun run : runs) {
            sb.append(run.text());
        }
        return sb.toString();
    }

    public boolean isEmpty() {
        return runs.isEmpty();
    }

    private static List<FormattedRun> coalesce(List<FormattedRun> input) {
        List<FormattedRun> merged = new ArrayList<>(input.size());
        for (FormattedRun run : input) {
            if (run == null || run.text().isEmpty()) {
                continue;
            }
            int last = merged.size() - 1;
            if (last >= 0 && merged.get(last).attributes().equals(run.attributes())) {
                merged.set(last, new FormattedRun(merged.get(last).text() + run.text(), run.attributes()));
            } else {
                merged.add(run);
            }
        }
        return Collections.unmodifiableList(merged);
    }
}
