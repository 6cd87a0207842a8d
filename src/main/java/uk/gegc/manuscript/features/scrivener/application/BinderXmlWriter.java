package uk.gegc.manuscript.features.scrivener.application;

import uk.gegc.manuscript.features.project.domain.model.Document;
import uk.gegc.manuscript.features.project.domain.model.Folder;
import uk.gegc.manuscript.features.project.domain.model.Label;
import uk.gegc.manuscript.features.project.domain.model.ManuscriptProject;
import uk.gegc.manuscript.features.project.domain.model.ManuscriptTargets;
import uk.gegc.manuscript.features.project.domain.model.Status;
import uk.gegc.manuscript.features.scrivener.config.ScrivenerProperties;
import uk.gegc.manuscript.features.scrivener.domain.model.RgbColor;
import uk.gegc.manuscript.shared.util.XmlText;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.temporal.ChronoUnit;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;

/**
 * Assembles a {@code .scrivx} manifest as text. Sections after the binder are written in the fixed
 * order Scrivener expects: Collections, Keywords, SectionTypes, LabelSettings, StatusSettings,
 * ProjectTargets, RecentWritingHistory, PrintSettings.
 * <p>
 * One instance per export. Every label, status and keyword reference is resolved through
 * {@link ExportMappings}; an unregistered one fails with
 * {@link uk.gegc.manuscript.features.scrivener.domain.UnmappedIdentifierException}.
 */
public class BinderXmlWriter {

    static final List<String> KEYWORD_PALETTE = List.of(
            "0.993495 0.701227 0.732594",
            "0.995418 0.790968 0.65239",
            "0.99772 0.892753 0.652574",
            "0.715848 0.948734 0.697698",
            "0.702312 0.888297 0.97426",
            "0.957564 0.766768 0.999625",
            "0.943039 0.654989 0.986895",
            "0.584909 0.947715 0.802964"
    );

    private static final String DEFAULT_LABEL_COLOR = "0.5 0.5 0.5";
    private static final String INDENT = "    ";

    private final ManuscriptProject project;
    private final ExportMappings mappings;
    private final ScrivenerProperties properties;
    private final Clock clock;
    private final ZoneId zone;

    public BinderXmlWriter(ManuscriptProject project, ExportMappings mappings,
                           ScrivenerProperties properties, Clock clock) {
        this.project = project;
        this.mappings = mappings;
        this.properties = properties;
        this.clock = clock;
        this.zone = clock.getZone();
    }

    public String write() {
        String now = date(clock.instant());
        StringBuilder xml = new StringBuilder("<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n");
        xml.append("<ScrivenerProject Identifier=\"").append(newId())
                .append("\" Version=\"").append(escape(properties.getProjectVersion()))
                .append("\" Creator=\"").append(escape(properties.getCreator()))
                .append("\" Device=\"").append(escape(properties.getDevice()))
                .append("\" Modified=\"").append(now)
                .append("\" ModID=\"").append(newId()).append("\">\n");

        xml.append(INDENT).append("<Binder>\n");
        writeFolder(xml, project.getRootFolder(), "DraftFolder", 2, true);
        Folder research = project.getResearchFolder();
        if (research != null && !research.isEmpty()) {
            writeFolder(xml, research, "ResearchFolder", 2, true);
        }
        Folder trash = project.getTrashFolder();
        if (trash != null && !trash.isEmpty()) {
            writeFolder(xml, trash, "TrashFolder", 2, false);
        }
        xml.append(INDENT).append("</Binder>\n");

        writeCollections(xml);
        writeKeywords(xml);
        writeSectionTypes(xml);
        writeLabelSettings(xml);
        writeStatusSettings(xml);
        writeProjectTargets(xml, now);
        writeRecentWritingHistory(xml, now);
        writePrintSettings(xml);

        xml.append("</ScrivenerProject>\n");
        return xml.toString();
    }

    private void writeFolder(StringBuilder xml, Folder folder, String type, int depth, boolean keywordsMapped) {
        String pad = INDENT.repeat(depth);
        boolean special = !"Folder".equals(type);

        xml.append(pad).append("<BinderItem UUID=\"").append(mappings.uuidFor(folder.getId()))
                .append("\" Type=\"").append(type)
                .append("\" Created=\"").append(date(folder.getCreationDate()))
                .append("\" Modified=\"").append(date(clock.instant())).append("\">\n");
        xml.append(pad).append(INDENT).append("<Title>").append(escape(folder.getTitle())).append("</Title>\n");
        xml.append(pad).append(INDENT).append("<MetaData>\n");
        xml.append(pad).append(INDENT).append(INDENT).append("<IncludeInCompile>Yes</IncludeInCompile>\n");
        xml.append(pad).append(INDENT).append("</MetaData>\n");
        if (!special) {
            writeTextSettings(xml, pad);
        }

        List<Document> documents = folder.getDocuments().stream()
                .sorted(Comparator.comparingInt(Document::getOrder))
                .toList();
        List<Folder> subfolders = folder.getSubfolders().stream()
                .sorted(Comparator.comparingInt(Folder::getOrder))
                .toList();
        if (!documents.isEmpty() || !subfolders.isEmpty()) {
            xml.append(pad).append(INDENT).append("<Children>\n");
            for (Document document : documents) {
                writeDocument(xml, document, depth + 2, keywordsMapped);
            }
            for (Folder subfolder : subfolders) {
                writeFolder(xml, subfolder, "Folder", depth + 2, keywordsMapped);
            }
            xml.append(pad).append(INDENT).append("</Children>\n");
        }
        xml.append(pad).append("</BinderItem>\n");
    }

    private void writeDocument(StringBuilder xml, Document document, int depth, boolean keywordsMapped) {
        String pad = INDENT.repeat(depth);
        String inner = pad + INDENT + INDENT;

        xml.append(pad).append("<BinderItem UUID=\"").append(mappings.uuidFor(document.getId()))
                .append("\" Type=\"Text\" Created=\"").append(date(document.getCreationDate()))
                .append("\" Modified=\"").append(date(clock.instant())).append("\">\n");
        xml.append(pad).append(INDENT).append("<Title>").append(escape(document.getTitle())).append("</Title>\n");
        xml.append(pad).append(INDENT).append("<MetaData>\n");
        xml.append(inner).append("<IncludeInCompile>").append(document.isIncludeInCompile() ? "Yes" : "No")
                .append("</IncludeInCompile>\n");
        if (document.getLabelId() != null) {
            xml.append(inner).append("<LabelID>").append(mappings.labelIdFor(document.getLabelId())).append("</LabelID>\n");
        }
        if (document.getStatusId() != null) {
            xml.append(inner).append("<StatusID>").append(mappings.statusIdFor(document.getStatusId())).append("</StatusID>\n");
        }
        // trash keywords are not part of the keyword table
        if (keywordsMapped && !document.getKeywords().isEmpty()) {
            xml.append(inner).append("<Keywords>\n");
            for (String keyword : document.getKeywords()) {
                xml.append(inner).append(INDENT).append("<KeywordID>").append(mappings.keywordIdFor(keyword))
                        .append("</KeywordID>\n");
            }
            xml.append(inner).append("</Keywords>\n");
        }
        xml.append(pad).append(INDENT).append("</MetaData>\n");
        writeTextSettings(xml, pad);
        if (document.getSynopsis() != null && !document.getSynopsis().isEmpty()) {
            xml.append(pad).append(INDENT).append("<Synopsis>").append(escape(document.getSynopsis()))
                    .append("</Synopsis>\n");
        }
        xml.append(pad).append("</BinderItem>\n");
    }

    private static void writeTextSettings(StringBuilder xml, String pad) {
        xml.append(pad).append(INDENT).append("<TextSettings>\n");
        xml.append(pad).append(INDENT).append(INDENT).append("<TextSelection>0,0</TextSelection>\n");
        xml.append(pad).append(INDENT).append("</TextSettings>\n");
    }

    private void writeCollections(StringBuilder xml) {
        xml.append("""
                    <Collections>
                        <Collection Type="Binder" ID="%s" Color="1.0 1.0 1.0">
                            <Title>Binder</Title>
                        </Collection>
                    </Collections>
                """.formatted(newId()));
    }

    private void writeKeywords(StringBuilder xml) {
        List<String> keywords = mappings.sortedKeywords();
        if (keywords.isEmpty()) {
            return;
        }
        xml.append(INDENT).append("<Keywords>\n");
        for (String keyword : keywords) {
            int id = mappings.keywordIdFor(keyword);
            xml.append(INDENT).append(INDENT).append("<Keyword ID=\"").append(id).append("\">\n");
            xml.append(INDENT).append(INDENT).append(INDENT).append("<Title>").append(escape(keyword)).append("</Title>\n");
            xml.append(INDENT).append(INDENT).append(INDENT).append("<Color>")
                    .append(KEYWORD_PALETTE.get(id % KEYWORD_PALETTE.size())).append("</Color>\n");
            xml.append(INDENT).append(INDENT).append("</Keyword>\n");
        }
        xml.append(INDENT).append("</Keywords>\n");
    }

    private void writeSectionTypes(StringBuilder xml) {
        String heading = newId();
        String subHeading = newId();
        String section = newId();
        xml.append("""
                    <SectionTypes>
                        <TypeDefinitions>
                            <Type ID="%1$s">Heading</Type>
                            <Type ID="%2$s">Sub-Heading</Type>
                            <Type ID="%3$s">Section</Type>
                        </TypeDefinitions>
                        <LevelTypes>
                            <Folders>
                                <Type>%1$s</Type>
                            </Folders>
                            <Containers>
                                <Type>%3$s</Type>
                            </Containers>
                            <Files>
                                <Type>%3$s</Type>
                            </Files>
                        </LevelTypes>
                    </SectionTypes>
                """.formatted(heading, subHeading, section));
    }

    private void writeLabelSettings(StringBuilder xml) {
        xml.append(INDENT).append("<LabelSettings>\n");
        xml.append(INDENT).append(INDENT).append("<Title>Label</Title>\n");
        xml.append(INDENT).append(INDENT).append("<DefaultLabelID>-1</DefaultLabelID>\n");
        xml.append(INDENT).append(INDENT).append("<Labels>\n");
        xml.append(INDENT).append(INDENT).append(INDENT).append("<Label ID=\"-1\">No Label</Label>\n");
        for (Label label : project.getLabels()) {
            xml.append(INDENT).append(INDENT).append(INDENT)
                    .append("<Label ID=\"").append(mappings.labelIdFor(label.id()))
                    .append("\" Color=\"").append(labelColor(label.color())).append("\">")
                    .append(escape(label.name())).append("</Label>\n");
        }
        xml.append(INDENT).append(INDENT).append("</Labels>\n");
        xml.append(INDENT).append("</LabelSettings>\n");
    }

    private void writeStatusSettings(StringBuilder xml) {
        xml.append(INDENT).append("<StatusSettings>\n");
        xml.append(INDENT).append(INDENT).append("<Title>Status</Title>\n");
        xml.append(INDENT).append(INDENT).append("<DefaultStatusID>-1</DefaultStatusID>\n");
        xml.append(INDENT).append(INDENT).append("<StatusItems>\n");
        xml.append(INDENT).append(INDENT).append(INDENT).append("<Status ID=\"-1\">No Status</Status>\n");
        for (Status status : project.getStatuses()) {
            xml.append(INDENT).append(INDENT).append(INDENT)
                    .append("<Status ID=\"").append(mappings.statusIdFor(status.id())).append("\">")
                    .append(escape(status.name())).append("</Status>\n");
        }
        xml.append(INDENT).append(INDENT).append("</StatusItems>\n");
        xml.append(INDENT).append("</StatusSettings>\n");
    }

    private void writeProjectTargets(StringBuilder xml, String now) {
        ManuscriptTargets targets = project.getTargets();
        int draftWords = targets != null && targets.draftWordCount() != null ? targets.draftWordCount() : 0;
        int sessionWords = targets != null && targets.sessionWordCount() != null ? targets.sessionWordCount() : 0;
        Instant deadline = targets != null && targets.draftDeadline() != null ? targets.draftDeadline() : clock.instant();
        String nextReset = date(clock.instant().plus(1, ChronoUnit.DAYS));

        xml.append(INDENT).append("<ProjectTargets Notify=\"No\">\n");
        xml.append(INDENT).append(INDENT)
                .append("<DraftTarget Type=\"Words\" CountIncludedOnly=\"Yes\" CurrentCompileGroupOnly=\"No\" Deadline=\"")
                .append(date(deadline)).append("\" IgnoreDeadline=\"No\">")
                .append(draftWords).append("</DraftTarget>\n");
        xml.append(INDENT).append(INDENT)
                .append("<SessionTarget Type=\"Words\" CountDraftOnly=\"Yes\" AllowNegatives=\"No\" NextResetDate=\"")
                .append(nextReset)
                .append("\" ResetType=\"Midnight\" ResetTime=\"00:00\" DeterminedFromDeadline=\"No\" WritingDays=\"\" CanWriteOnDeadlineDate=\"No\">")
                .append(sessionWords).append("</SessionTarget>\n");
        xml.append(INDENT).append(INDENT)
                .append("<PreviousSession Words=\"0\" Characters=\"0\" Date=\"").append(now).append("\"/>\n");
        xml.append(INDENT).append("</ProjectTargets>\n");
    }

    private static void writeRecentWritingHistory(StringBuilder xml, String now) {
        xml.append("""
                    <RecentWritingHistory Date="%s">
                        <DraftWordCount>0</DraftWordCount>
                        <DraftCharCount>0</DraftCharCount>
                        <OtherWordCount>0</OtherWordCount>
                        <OtherCharCount>0</OtherCharCount>
                    </RecentWritingHistory>
                """.formatted(now));
    }

    private static void writePrintSettings(StringBuilder xml) {
        xml.append(INDENT).append("<PrintSettings PaperSize=\"612.0,792.0\" LeftMargin=\"72.0\" RightMargin=\"72.0\"")
                .append(" TopMargin=\"90.0\" BottomMargin=\"90.0\" PaperType=\"na-letter\" Orientation=\"Portrait\"")
                .append(" HorizontalPagination=\"Clip\" VerticalPagination=\"Auto\" ScaleFactor=\"1.0\"")
                .append(" HorizontallyCentered=\"Yes\" VerticallyCentered=\"Yes\" Collates=\"Yes\"")
                .append(" PagesAcross=\"1\" PagesDown=\"1\"/>\n");
    }

    static String labelColor(String hex) {
        if (hex == null) {
            return DEFAULT_LABEL_COLOR;
        }
        String digits = hex.trim();
        if (digits.startsWith("#")) {
            digits = digits.substring(1);
        }
        if (!digits.matches("[0-9A-Fa-f]{6}")) {
            return DEFAULT_LABEL_COLOR;
        }
        return RgbColor.fromHex(digits).toXmlValue();
    }

    private String date(Instant instant) {
        return ScrivenerDates.format(instant != null ? instant : clock.instant(), zone);
    }

    private static String newId() {
        return UUID.randomUUID().toString().toUpperCase();
    }

    static String escape(String value) {
        return XmlText.escape(value);
    }
}
