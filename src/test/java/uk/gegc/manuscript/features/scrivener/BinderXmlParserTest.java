package uk.gegc.manuscript.features.scrivener;

import org.junit.jupiter.api.Test;
import uk.gegc.manuscript.features.scrivener.application.BinderXmlParser;
import uk.gegc.manuscript.features.scrivener.domain.ImportError;
import uk.gegc.manuscript.features.scrivener.domain.ImportException;
import uk.gegc.manuscript.features.scrivener.domain.model.BinderItem;
import uk.gegc.manuscript.features.scrivener.domain.model.BinderItemType;
import uk.gegc.manuscript.features.scrivener.domain.model.RgbColor;
import uk.gegc.manuscript.features.scrivener.domain.model.ScrivenerKeyword;
import uk.gegc.manuscript.features.scrivener.domain.model.ScrivenerLabel;
import uk.gegc.manuscript.features.scrivener.domain.model.ScrivenerProject;
import uk.gegc.manuscript.features.scrivener.domain.model.ScrivenerStatus;

import java.nio.charset.StandardCharsets;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

class BinderXmlParserTest {

    private final BinderXmlParser parser = new BinderXmlParser();

    private ScrivenerProject parse(String xml) throws ImportException {
        return parser.parse(xml.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void parse_nestedBinderItems_rebuildsTreeInDocumentOrder() throws Exception {
        // Given
        String xml = """
                <?xml version="1.0" encoding="UTF-8"?>
                <ScrivenerProject Version="2.0">
                    <ProjectTitle>The Long Road</ProjectTitle>
                    <Binder>
                        <BinderItem UUID="D-1" Type="DraftFolder" Created="2024-01-15 10:30:00 +0000">
                            <Title>Draft</Title>
                            <Children>
                                <BinderItem UUID="C-1" Type="Folder">
                                    <Title>Chapter One</Title>
                                    <Children>
                                        <BinderItem UUID="S-1" Type="Text">
                                            <Title>Arrival</Title>
                                            <MetaData>
                                                <IncludeInCompile>No</IncludeInCompile>
                                            </MetaData>
                                            <Synopsis>They arrive at dusk.</Synopsis>
                                        </BinderItem>
                                        <BinderItem UUID="S-2" Type="Text">
                                            <Title>Departure</Title>
                                        </BinderItem>
                                    </Children>
                                </BinderItem>
                                <BinderItem UUID="C-2" Type="Folder">
                                    <Title>Chapter Two</Title>
                                </BinderItem>
                            </Children>
                        </BinderItem>
                        <BinderItem UUID="R-1" Type="ResearchFolder">
                            <Title>Research</Title>
                        </BinderItem>
                    </Binder>
                </ScrivenerProject>
                """;

        // When
        ScrivenerProject project = parse(xml);

        // Then
        assertThat(project.getTitle()).isEqualTo("The Long Road");
        assertThat(project.getBinderItems()).extracting(BinderItem::getUuid, BinderItem::getType)
                .containsExactly(tuple("D-1", BinderItemType.DRAFT_FOLDER), tuple("R-1", BinderItemType.RESEARCH_FOLDER));
        assertThat(project.totalItemCount()).isEqualTo(6);

        BinderItem draft = project.getBinderItems().get(0);
        assertThat(draft.getCreated()).isEqualTo(Instant.parse("2024-01-15T10:30:00Z"));
        assertThat(draft.getChildren()).extracting(BinderItem::getTitle)
                .containsExactly("Chapter One", "Chapter Two");

        BinderItem chapterOne = draft.getChildren().get(0);
        assertThat(chapterOne.getChildren()).extracting(BinderItem::getTitle)
                .containsExactly("Arrival", "Departure");
        BinderItem arrival = chapterOne.getChildren().get(0);
        assertThat(arrival.isIncludeInCompile()).isFalse();
        assertThat(arrival.getSynopsis()).isEqualTo("They arrive at dusk.");
        assertThat(chapterOne.getChildren().get(1).isIncludeInCompile()).isTrue();
    }

    @Test
    void parse_labelsDirectlyUnderSettings_areRead() throws Exception {
        // Given
        String xml = """
                <ScrivenerProject>
                    <LabelSettings>
                        <Title>Label</Title>
                        <Label ID="3" Color="0.0 0.0 1.0">Blue Thing</Label>
                    </LabelSettings>
                    <StatusSettings>
                        <Status ID="1">First Draft</Status>
                    </StatusSettings>
                </ScrivenerProject>
                """;

        // When
        ScrivenerProject project = parse(xml);

        // Then
        assertThat(project.getLabels()).containsExactly(new ScrivenerLabel(3, "Blue Thing", new RgbColor(0, 0, 1)));
        assertThat(project.getStatuses()).containsExactly(new ScrivenerStatus(1, "First Draft"));
    }

    @Test
    void parse_labelsNestedInLabelsElement_areRead() throws Exception {
        // Given
        String xml = """
                <ScrivenerProject>
                    <LabelSettings>
                        <Title>Label</Title>
                        <DefaultLabelID>-1</DefaultLabelID>
                        <Labels>
                            <Label ID="-1">No Label</Label>
                            <Label ID="0" Color="1.000000 0.000000 0.000000">Urgent Red</Label>
                        </Labels>
                    </LabelSettings>
                    <StatusSettings>
                        <Title>Status</Title>
                        <StatusItems>
                            <Status ID="-1">No Status</Status>
                            <Status ID="0">To Do</Status>
                        </StatusItems>
                    </StatusSettings>
                </ScrivenerProject>
                """;

        // When
        ScrivenerProject project = parse(xml);

        // Then
        assertThat(project.getLabels()).extracting(ScrivenerLabel::id, ScrivenerLabel::name)
                .containsExactly(tuple(-1, "No Label"), tuple(0, "Urgent Red"));
        assertThat(project.getLabels().get(1).color()).isEqualTo(new RgbColor(1, 0, 0));
        assertThat(project.getLabels().get(0).color()).isEqualTo(RgbColor.GRAY);
        assertThat(project.getStatuses()).extracting(ScrivenerStatus::name).containsExactly("No Status", "To Do");
    }

    @Test
    void parse_keywordDefinitionsAndItemReferences_areKeptApart() throws Exception {
        // Given
        String xml = """
                <ScrivenerProject>
                    <Binder>
                        <BinderItem UUID="T-1" Type="Text">
                            <Title>Scene</Title>
                            <MetaData>
                                <LabelID>0</LabelID>
                                <StatusID>2</StatusID>
                                <Keywords>
                                    <KeywordID>1</KeywordID>
                                    <KeywordID>0</KeywordID>
                                </Keywords>
                            </MetaData>
                        </BinderItem>
                    </Binder>
                    <Keywords>
                        <Keyword ID="0">
                            <Title>plot</Title>
                            <Color>0.5 0.25 1.0</Color>
                        </Keyword>
                        <Keyword ID="1" Color="1.0 1.0 1.0">villain</Keyword>
                    </Keywords>
                </ScrivenerProject>
                """;

        // When
        ScrivenerProject project = parse(xml);

        // Then
        BinderItem scene = project.getBinderItems().get(0);
        assertThat(scene.getTitle()).isEqualTo("Scene");
        assertThat(scene.getLabelId()).isEqualTo(0);
        assertThat(scene.getStatusId()).isEqualTo(2);
        assertThat(scene.getKeywordIds()).containsExactly(1, 0);
        assertThat(project.getKeywords()).containsExactly(
                new ScrivenerKeyword(0, "plot", new RgbColor(0.5, 0.25, 1.0)),
                new ScrivenerKeyword(1, "villain", new RgbColor(1, 1, 1)));
    }

    @Test
    void parse_projectTargets_readsAttributesAndCounts() throws Exception {
        // Given
        String xml = """
                <ScrivenerProject>
                    <ProjectTargets Notify="No">
                        <DraftTarget Type="Words" CountIncludedOnly="No" Deadline="2025-06-01 00:00:00 +0000" IgnoreDeadline="Yes">80000</DraftTarget>
                        <SessionTarget Type="Words" AllowNegatives="Yes" ResetType="Time" ResetTime="06:00">1500</SessionTarget>
                    </ProjectTargets>
                </ScrivenerProject>
                """;

        // When
        ScrivenerProject project = parse(xml);

        // Then
        assertThat(project.getTargets()).isNotNull();
        assertThat(project.getTargets().getDraftWordCount()).isEqualTo(80000);
        assertThat(project.getTargets().getDraftDeadline()).isEqualTo(Instant.parse("2025-06-01T00:00:00Z"));
        assertThat(project.getTargets().isIgnoreDeadline()).isTrue();
        assertThat(project.getTargets().isCountIncludedOnly()).isFalse();
        assertThat(project.getTargets().getSessionWordCount()).isEqualTo(1500);
        assertThat(project.getTargets().getSessionResetType()).isEqualTo("Time");
        assertThat(project.getTargets().getSessionResetTime()).isEqualTo("06:00");
        assertThat(project.getTargets().isAllowNegatives()).isTrue();
    }

    @Test
    void parse_missingTitlesAndIds_fallBackToDefaults() throws Exception {
        // Given
        String xml = """
                <ScrivenerProject>
                    <Binder>
                        <BinderItem Type="Mystery" Created="not a date">
                            <Title></Title>
                        </BinderItem>
                    </Binder>
                </ScrivenerProject>
                """;

        // When
        ScrivenerProject project = parse(xml);

        // Then
        assertThat(project.getTitle()).isEqualTo("Untitled Project");
        BinderItem item = project.getBinderItems().get(0);
        assertThat(item.getTitle()).isEqualTo("Untitled");
        assertThat(item.getId()).isNotBlank();
        assertThat(item.getType()).isEqualTo(BinderItemType.OTHER);
        assertThat(item.getCreated()).isNull();
    }

    @Test
    void parse_unclosedElement_throwsXmlParsingFailed() {
        // Given
        String xml = "<ScrivenerProject><Binder><BinderItem Type=\"Text\"><Title>Oops</Title></Binder>";

        // When / Then
        assertThatThrownBy(() -> parse(xml))
                .isInstanceOf(ImportException.class)
                .satisfies(e -> assertThat(((ImportException) e).getError()).isEqualTo(ImportError.XML_PARSING_FAILED))
                .hasMessageStartingWith("Failed to parse project file: line 1");
    }

    @Test
    void parse_doctypeDeclaration_isRejected() {
        // Given
        String xml = """
                <?xml version="1.0"?>
                <!DOCTYPE foo [<!ENTITY xxe SYSTEM "file:///etc/passwd">]>
                <ScrivenerProject><ProjectTitle>&xxe;</ProjectTitle></ScrivenerProject>
                """;

        // When / Then
        assertThatThrownBy(() -> parse(xml)).isInstanceOf(ImportException.class);
    }
}
