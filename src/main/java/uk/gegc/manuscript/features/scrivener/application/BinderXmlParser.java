package uk.gegc.manuscript.features.scrivener.application;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.xml.sax.Attributes;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;
import org.xml.sax.helpers.DefaultHandler;
import uk.gegc.manuscript.features.scrivener.domain.ImportError;
import uk.gegc.manuscript.features.scrivener.domain.ImportException;
import uk.gegc.manuscript.features.scrivener.domain.model.BinderItem;
import uk.gegc.manuscript.features.scrivener.domain.model.BinderItemType;
import uk.gegc.manuscript.features.scrivener.domain.model.RgbColor;
import uk.gegc.manuscript.features.scrivener.domain.model.ScrivenerKeyword;
import uk.gegc.manuscript.features.scrivener.domain.model.ScrivenerLabel;
import uk.gegc.manuscript.features.scrivener.domain.model.ScrivenerProject;
import uk.gegc.manuscript.features.scrivener.domain.model.ScrivenerStatus;
import uk.gegc.manuscript.features.scrivener.domain.model.ScrivenerTargets;
import uk.gegc.manuscript.shared.util.SecureXml;

import javax.xml.parsers.ParserConfigurationException;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.UUID;

/**
 * Single-pass SAX parser for {@code .scrivx} project manifests.
 * <p>
 * Binder items are rebuilt with two parallel stacks: the items still open and, one level per
 * open item, the children completed so far. Closing an item pops both frames and appends the
 * finished item to the new top of the children stack. The bottom frame collects the top-level
 * binder items.
 * <p>
 * Elements such as {@code Title}, {@code Keywords} or {@code Label} appear in unrelated contexts,
 * so context flags decide where their text goes. Labels are accepted both directly under
 * {@code LabelSettings} and nested in {@code Labels}; nothing depends on nesting depth.
 * Duplicate or missing IDs are kept as found.
 */
@Component
@Slf4j
public class BinderXmlParser {

    public ScrivenerProject parse(byte[] xml) throws ImportException {
        return parse(new ByteArrayInputStream(xml));
    }

    public ScrivenerProject parse(InputStream xml) throws ImportException {
        ManifestHandler handler = new ManifestHandler();
        try {
            SecureXml.newSaxParser().parse(xml, handler);
        } catch (SAXParseException e) {
            String detail = "line " + e.getLineNumber() + ", column " + e.getColumnNumber() + ": " + e.getMessage();
            log.error("Project manifest is not well-formed: {}", detail);
            throw new ImportException(ImportError.XML_PARSING_FAILED, detail, e);
        } catch (SAXException | IOException | ParserConfigurationException e) {
            log.error("Failed to parse project manifest: {}", e.getMessage());
            throw new ImportException(ImportError.XML_PARSING_FAILED, e.getMessage(), e);
        }
        ScrivenerProject project = handler.result();
        log.debug("Parsed manifest '{}' with {} top-level binder items, {} labels, {} statuses, {} keywords",
                project.getTitle(), project.getBinderItems().size(), project.getLabels().size(),
                project.getStatuses().size(), project.getKeywords().size());
        return project;
    }

    private static final class ManifestHandler extends DefaultHandler {

        private final Deque<BinderItem> itemStack = new ArrayDeque<>();
        private final Deque<List<BinderItem>> childrenStack = new ArrayDeque<>();
        private final StringBuilder text = new StringBuilder();

        private final List<ScrivenerLabel> labels = new ArrayList<>();
        private final List<ScrivenerStatus> statuses = new ArrayList<>();
        private final List<ScrivenerKeyword> keywords = new ArrayList<>();
        private ScrivenerTargets targets;
        private String projectTitle;

        private boolean inBinder;
        private boolean inLabelSettings;
        private boolean inStatusSettings;
        private boolean inKeywordSettings;
        private boolean inProjectTargets;
        private boolean inItemKeywords;

        private Integer currentDefinitionId;
        private RgbColor currentDefinitionColor;
        private String currentKeywordTitle;
        private boolean inKeywordDefinition;

        ManifestHandler() {
            childrenStack.push(new ArrayList<>());
        }

        ScrivenerProject result() {
            return ScrivenerProject.builder()
                    .title(projectTitle != null && !projectTitle.isEmpty() ? projectTitle : "Untitled Project")
                    .binderItems(childrenStack.getLast())
                    .labels(labels)
                    .statuses(statuses)
                    .keywords(keywords)
                    .targets(targets)
                    .build();
        }

        @Override
        public void startElement(String uri, String localName, String qName, Attributes attributes) {
            text.setLength(0);
            switch (qName) {
                case "Binder" -> inBinder = true;
                case "LabelSettings" -> inLabelSettings = true;
                case "StatusSettings" -> inStatusSettings = true;
                case "KeywordSettings" -> inKeywordSettings = true;
                case "Keywords" -> {
                    if (inBinder && !itemStack.isEmpty()) {
                        inItemKeywords = true;
                    } else {
                        inKeywordSettings = true;
                    }
                }
                case "ProjectTargets" -> {
                    inProjectTargets = true;
                    if (targets == null) {
                        targets = new ScrivenerTargets();
                    }
                }
                case "DraftTarget" -> {
                    if (inProjectTargets) {
                        targets.setDraftDeadline(ScrivenerDates.parse(attributes.getValue("Deadline")));
                        targets.setIgnoreDeadline(isYes(attributes.getValue("IgnoreDeadline"), false));
                        targets.setCountIncludedOnly(isYes(attributes.getValue("CountIncludedOnly"), true));
                    }
                }
                case "SessionTarget" -> {
                    if (inProjectTargets) {
                        targets.setSessionResetType(attributes.getValue("ResetType"));
                        targets.setSessionResetTime(attributes.getValue("ResetTime"));
                        targets.setAllowNegatives(isYes(attributes.getValue("AllowNegatives"), false));
                    }
                }
                case "BinderItem" -> {
                    if (inBinder) {
                        openItem(attributes);
                    }
                }
                case "Label" -> {
                    if (inLabelSettings) {
                        openDefinition(attributes);
                    }
                }
                case "Status" -> {
                    if (inStatusSettings) {
                        openDefinition(attributes);
                    }
                }
                case "Keyword" -> {
                    if (inKeywordSettings && !inItemKeywords) {
                        openDefinition(attributes);
                        inKeywordDefinition = true;
                        currentKeywordTitle = null;
                    }
                }
                default -> {
                    // other elements only contribute text
                }
            }
        }

        @Override
        public void characters(char[] ch, int start, int length) {
            text.append(ch, start, length);
        }

        @Override
        public void endElement(String uri, String localName, String qName) {
            String value = text.toString().trim();
            text.setLength(0);
            BinderItem item = itemStack.peek();

            switch (qName) {
                case "Binder" -> inBinder = false;
                case "LabelSettings" -> inLabelSettings = false;
                case "StatusSettings" -> inStatusSettings = false;
                case "KeywordSettings" -> inKeywordSettings = false;
                case "Keywords" -> {
                    if (inItemKeywords) {
                        inItemKeywords = false;
                    } else {
                        inKeywordSettings = false;
                    }
                }
                case "ProjectTargets" -> inProjectTargets = false;
                case "ProjectTitle" -> projectTitle = value;
                case "Title" -> {
                    if (inKeywordDefinition) {
                        currentKeywordTitle = value;
                    } else if (item != null && !inLabelSettings && !inStatusSettings) {
                        item.setTitle(value);
                    }
                }
                case "Color" -> {
                    if (inKeywordDefinition) {
                        currentDefinitionColor = RgbColor.parse(value);
                    }
                }
                case "Synopsis" -> {
                    if (item != null) {
                        item.setSynopsis(value);
                    }
                }
                case "LabelID" -> {
                    if (item != null) {
                        item.setLabelId(parseInt(value));
                    }
                }
                case "StatusID" -> {
                    if (item != null) {
                        item.setStatusId(parseInt(value));
                    }
                }
                case "IncludeInCompile" -> {
                    if (item != null) {
                        item.setIncludeInCompile(isYes(value, false));
                    }
                }
                case "Target" -> {
                    if (item != null) {
                        item.setTargetWordCount(parseInt(value));
                    }
                }
                case "IconFileName" -> {
                    if (item != null && !value.isEmpty()) {
                        item.setIconFileName(value);
                    }
                }
                case "KeywordID" -> {
                    Integer keywordId = parseInt(value);
                    if (inItemKeywords && item != null && keywordId != null) {
                        item.getKeywordIds().add(keywordId);
                    }
                }
                case "DraftTarget" -> {
                    if (inProjectTargets) {
                        targets.setDraftWordCount(parseInt(value));
                    }
                }
                case "SessionTarget" -> {
                    if (inProjectTargets) {
                        targets.setSessionWordCount(parseInt(value));
                    }
                }
                case "BinderItem" -> {
                    if (inBinder && item != null) {
                        closeItem();
                    }
                }
                case "Label" -> {
                    if (inLabelSettings && currentDefinitionId != null) {
                        labels.add(new ScrivenerLabel(currentDefinitionId, value, currentDefinitionColor));
                        currentDefinitionId = null;
                    }
                }
                case "Status" -> {
                    if (inStatusSettings && currentDefinitionId != null) {
                        statuses.add(new ScrivenerStatus(currentDefinitionId, value));
                        currentDefinitionId = null;
                    }
                }
                case "Keyword" -> {
                    if (inKeywordDefinition) {
                        String name = currentKeywordTitle != null ? currentKeywordTitle : value;
                        if (currentDefinitionId != null && !name.isEmpty()) {
                            keywords.add(new ScrivenerKeyword(currentDefinitionId, name, currentDefinitionColor));
                        }
                        inKeywordDefinition = false;
                        currentDefinitionId = null;
                    }
                }
                default -> {
                    // not interesting
                }
            }
        }

        private void openItem(Attributes attributes) {
            String id = attributes.getValue("ID");
            BinderItem item = BinderItem.builder()
                    .id(id != null && !id.isEmpty() ? id : UUID.randomUUID().toString())
                    .uuid(attributes.getValue("UUID"))
                    .type(BinderItemType.fromXml(attributes.getValue("Type")))
                    .created(ScrivenerDates.parse(attributes.getValue("Created")))
                    .modified(ScrivenerDates.parse(attributes.getValue("Modified")))
                    .build();
            itemStack.push(item);
            childrenStack.push(new ArrayList<>());
        }

        private void closeItem() {
            BinderItem item = itemStack.pop();
            item.setChildren(childrenStack.pop());
            if (item.getTitle() == null || item.getTitle().isEmpty()) {
                item.setTitle("Untitled");
            }
            childrenStack.peek().add(item);
        }

        private void openDefinition(Attributes attributes) {
            currentDefinitionId = parseInt(attributes.getValue("ID"));
            currentDefinitionColor = RgbColor.parse(attributes.getValue("Color"));
        }

        @Override
        public void endDocument() throws SAXException {
            if (!itemStack.isEmpty()) {
                throw new SAXException("Document ended with " + itemStack.size() + " unclosed binder item(s)");
            }
        }

        private static Integer parseInt(String value) {
            if (value == null || value.isBlank()) {
                return null;
            }
            try {
                return Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }

        private static boolean isYes(String value, boolean defaultValue) {
            if (value == null || value.isBlank()) {
                return defaultValue;
            }
            return value.equalsIgnoreCase("yes") || value.equalsIgnoreCase("true");
        }
    }
}
