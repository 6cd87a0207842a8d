package uk.gegc.manuscript.features.richtext;

import org.junit.jupiter.api.Test;
import uk.gegc.manuscript.features.richtext.application.MarkdownCleanup;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class MarkdownCleanupTest {

    @Test
    void clean_mixedLineEndings_normalizesToLineFeed() {
        assertThat(MarkdownCleanup.clean("a\r\nb\rc\n")).isEqualTo("a\nb\nc\n");
    }

    @Test
    void clean_manyBlankLines_collapsesToTwoNewlines() {
        assertThat(MarkdownCleanup.clean("one\n\n\n\n\ntwo")).isEqualTo("one\n\ntwo");
    }

    @Test
    void clean_trailingWhitespace_strippedPerLine() {
        assertThat(MarkdownCleanup.clean("first  \nsecond\t\nthird")).isEqualTo("first\nsecond\nthird");
    }

    @Test
    void clean_adjacentIdenticalMarkers_merged() {
        assertThat(MarkdownCleanup.clean("**a****b**")).isEqualTo("**ab**");
        assertThat(MarkdownCleanup.clean("~~x~~ ~~y~~")).isEqualTo("~~x y~~");
        assertThat(MarkdownCleanup.clean("*one* *two* *three*")).isEqualTo("*one two three*");
    }

    @Test
    void clean_emptyMarkerPairs_removed() {
        assertThat(MarkdownCleanup.clean("before **** after ~~~~ end")).isEqualTo("before  after  end");
    }

    @Test
    void clean_sceneBreaks_leftUntouched() {
        assertThat(MarkdownCleanup.clean("end.\n\n* * *\n\n***\n\nstart")).isEqualTo("end.\n\n* * *\n\n***\n\nstart");
    }

    @Test
    void clean_appliedTwice_equalsAppliedOnce() {
        List<String> samples = List.of(
                "**a** **b** **c**  \r\n\r\n\r\n\r\n*x*",
                "***bold italic*** ***more***\n\n\n",
                "~~~~ ====  <u>a</u> <u>b</u>",
                "plain text with * stars * and _underscores_ \t",
                "**a****b****c**\r\r\rend");

        for (String sample : samples) {
            String once = MarkdownCleanup.clean(sample);
            assertThat(MarkdownCleanup.clean(once)).as(sample).isEqualTo(once);
        }
    }

    @Test
    void clean_boldFollowedByPunctuation_keepsClosingMarker() {
        assertThat(MarkdownCleanup.clean("**Note**: read this")).isEqualTo("**Note**: read this");
        assertThat(MarkdownCleanup.clean("Some **bold**, *italic* and more.")).isEqualTo("Some **bold**, *italic* and more.");
    }

    @Test
    void clean_literalDoubleAsteriskInProse_isKept() {
        assertThat(MarkdownCleanup.clean("x**2 + y**2")).isEqualTo("x**2 + y**2");
        assertThat(MarkdownCleanup.clean("Python: 2**3 = 8")).isEqualTo("Python: 2**3 = 8");
    }
}
