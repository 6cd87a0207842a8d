package uk.gegc.manuscript.shared.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

/**
 * Single source of time for everything that stamps dates into exported files:
 * ZIP entry timestamps, manifest modification dates, DOCX/EPUB metadata and
 * Markdown frontmatter.
 */
@Configuration
public class ClockConfig {

    @Value("${app.timezone:UTC}")
    private String timezone;

    /**
     * Creates the Clock used by exporters and pipelines.
     *
     * @return Clock instance configured with the application timezone
     */
    @Bean
    public Clock clock() {
        String configuredZone = timezone == null || timezone.isBlank()
                ? "UTC"
                : timezone.trim();
        return Clock.system(ZoneId.of(configuredZone));
    }
}
