package uk.gegc.manuscript.features.scrivener.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;
import uk.gegc.manuscript.features.scrivener.domain.ImportOptions;

@Component
@Data
@Validated
@ConfigurationProperties(prefix = "manuscript.scrivener")
public class ScrivenerProperties {

    @NotNull(message = "Property manuscript.scrivener.large-project-threshold must be configured")
    @Min(value = 1, message = "manuscript.scrivener.large-project-threshold must be at least 1")
    private Integer largeProjectThreshold = 500;

    @NotBlank(message = "Property manuscript.scrivener.format-version must be configured")
    private String formatVersion = "16";

    @NotBlank(message = "Property manuscript.scrivener.project-version must be configured")
    private String projectVersion = "2.0";

    @NotBlank(message = "Property manuscript.scrivener.creator must be configured")
    private String creator = "Manuscript-1.0";

    /** Written as the manifest's {@code Device} attribute. */
    @NotBlank(message = "Property manuscript.scrivener.device must be configured")
    private String device = "Manuscript";

    private boolean importSnapshots = true;

    private boolean importTrash = false;

    private boolean importResearch = true;

    private boolean preserveScrivenerIds = false;

    public ImportOptions defaultImportOptions() {
        return new ImportOptions(importSnapshots, importTrash, importResearch, preserveScrivenerIds);
    }
}
