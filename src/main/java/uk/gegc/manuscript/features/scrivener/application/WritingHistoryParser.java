package uk.gegc.manuscript.features.scrivener.application;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.xml.sax.Attributes;
import org.xml.sax.SAXException;
import org.xml.sax.helpers.DefaultHandler;
import uk.gegc.manuscript.features.project.domain.model.WritingSession;
import uk.gegc.manuscript.features.scrivener.domain.ImportError;
import uk.gegc.manuscript.features.scrivener.domain.ImportException;
import uk.gegc.manuscript.shared.util.SecureXml;

import javax.xml.parsers.ParserConfigurationException;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Reads {@code Files/writing.history}: one {@code <Day>} element per day with the counts as attributes.
 * Days without a parseable {@code Date} are dropped.
 */
@Component
@Slf4j
public class WritingHistoryParser {

    public List<WritingSession> parse(byte[] xml) throws ImportException {
        List<WritingSession> sessions = new ArrayList<>();
        try {
            SecureXml.newSaxParser().parse(new ByteArrayInputStream(xml), new DefaultHandler() {
                @Override
                public void startElement(String uri, String localName, String qName, Attributes attributes) {
                    if ("Day".equals(qName)) {
                        WritingSession session = toSession(attributes);
                        if (session != null) {
                            sessions.add(session);
                        }
                    }
                }
            });
        } catch (SAXException | IOException | ParserConfigurationException e) {
            throw new ImportException(ImportError.XML_PARSING_FAILED, e.getMessage(), e);
        }
        sessions.sort(Comparator.comparing(WritingSession::date));
        log.debug("Parsed {} writing history day(s)", sessions.size());
        return sessions;
    }

    private static WritingSession toSession(Attributes attributes) {
        String date = attributes.getValue("Date");
        if (date == null) {
            return null;
        }
        LocalDate day;
        try {
            day = LocalDate.parse(date.trim());
        } catch (DateTimeParseException e) {
            log.debug("Skipping writing history day with unreadable date '{}'", date);
            return null;
        }
        int words = (int) number(first(attributes, "WordCount", "Words"));
        int draftWords = (int) number(first(attributes, "DraftWordCount", "TotalWords"));
        long duration = number(first(attributes, "Duration", "SessionDuration"));
        return new WritingSession(day, words, draftWords, duration);
    }

    private static String first(Attributes attributes, String name, String alternative) {
        String value = attributes.getValue(name);
        return value != null ? value : attributes.getValue(alternative);
    }

    private static long number(String value) {
        if (value == null || value.isBlank()) {
            return 0;
        }
        try {
            return Math.round(Double.parseDouble(value.trim()));
        } catch (NumberFormatException e) {
            return 0;
        }
    }
}
