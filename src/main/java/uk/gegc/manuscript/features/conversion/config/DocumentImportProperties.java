package uk.gegc.manuscript.features.conversion.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

@Component
@Data
@Validated
@ConfigurationProperties(prefix = "manuscript.import")
public class DocumentImportProperties {

    /** Files above this size are rejected. */
    @NotNull(message = "Property manuscript.import.max-file-size-bytes must be configured")
    @Min(value = 1, message = "manuscript.import.max-file-size-bytes must be at least 1")
    private Long maxFileSizeBytes = 50_000_000L;

    @NotNull(message = "Property manuscript.import.large-file-warning-bytes must be configured")
    @Min(value = 1, message = "manuscript.import.large-file-warning-bytes must be at least 1")
    private Long largeFileWarningBytes = 10_000_000L;
}
