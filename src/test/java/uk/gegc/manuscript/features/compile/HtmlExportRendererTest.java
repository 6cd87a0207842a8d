package uk.gegc.manuscript.features.compile;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import uk.gegc.manuscript.features.compile.application.impl.HtmlExportRenderer;
import uk.gegc.manuscript.features.compile.application.impl.MarkdownExportRenderer;
import uk.gegc.manuscript.features.compile.domain.CompilePayload;
import uk.gegc.manuscript.features.compile.domain.CompileSettings;
import uk.gegc.manuscript.features.compile.domain.DocumentSeparator;
import uk.gegc.manuscript.features.compile.domain.ExportFile;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

class HtmlExportRendererTest {

    private HtmlExportRenderer renderer;

    @BeforeEach
    void setUp() {
        renderer = new HtmlExportRenderer(new MarkdownExportRenderer(CompileTestSupport.CLOCK),
                CompileTestSupport.blockParser());
    }

    @Test
    void render_defaultSettings_producesStandalonePage() {
        // When
        ExportFile file = renderer.render(CompileTestSupport.samplePayload(CompileSettings.defaults()));

        // Then
        String html = new String(file.readAllBytes(), StandardCharsets.UTF_8);
        assertThat(file.filename()).isEqualTo("the-long-road.html");
        assertThat(html).startsWithIgnoringCase("<!doctype html>");
        Document document = Jsoup.parse(html);
        assertThat(document.title()).isEqualTo("The Long Road");
        assertThat(document.selectFirst("html").attr("lang")).isEqualTo("en");
        assertThat(document.select("meta[charset]")).hasSize(1);
        assertThat(document.select("style").html()).contains("font-family:");
        assertThat(html).doesNotContain("date:");
    }

    @Test
    void render_documentsAndInlineMarkup_becomeElements() {
        // When
        ExportFile file = renderer.render(CompileTestSupport.samplePayload(CompileSettings.defaults()));

        // Then
        Document document = Jsoup.parse(new String(file.readAllBytes(), StandardCharsets.UTF_8));
        assertThat(document.select("h1")).hasSize(1);
        assertThat(document.selectFirst("h1").text()).isEqualTo("The Long Road");
        assertThat(document.selectFirst("h1").id()).isEqualTo("the-long-road");
        assertThat(document.select("h2").eachText()).containsExactly("Opening");
        assertThat(document.select("h3").eachText()).containsExactly("Arrival", "Departure");
        assertThat(document.selectFirst("h3").id()).isEqualTo("arrival");
        assertThat(document.select("p > em").first().text()).isEqualTo("by Ann Writer");
        assertThat(document.select("p > strong").eachText()).containsExactly("bold");
        Element link = document.selectFirst("a[href]");
        assertThat(link.attr("href")).isEqualTo("https://example.com/map");
        assertThat(link.text()).isEqualTo("the map");
    }

    @Test
    void render_pageBreakSeparator_becomesHorizontalRule() {
        // Given
        CompileSettings settings = CompileSettings.builder()
                .documentSeparator(DocumentSeparator.PAGE_BREAK)
                .build();

        // When
        ExportFile file = renderer.render(CompileTestSupport.samplePayload(settings));

        // Then
        Document document = Jsoup.parse(new String(file.readAllBytes(), StandardCharsets.UTF_8));
        assertThat(document.select("hr")).hasSize(2);
    }

    @Test
    void render_markupInTitle_isEscaped() {
        // Given
        CompilePayload payload = new CompilePayload(CompileTestSupport.sampleDocuments(), "<script>x</script>", "",
                CompileSettings.defaults(), "x", null);

        // When
        ExportFile file = renderer.render(payload);

        // Then
        Document document = Jsoup.parse(new String(file.readAllBytes(), StandardCharsets.UTF_8));
        assertThat(document.select("script")).isEmpty();
        assertThat(document.title()).isEqualTo("<script>x</script>");
    }
}
