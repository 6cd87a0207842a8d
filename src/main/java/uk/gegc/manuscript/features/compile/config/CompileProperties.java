package uk.gegc.manuscript.features.compile.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

@Component
@Data
@Validated
@ConfigurationProperties(prefix = "manuscript.compile")
public class CompileProperties {

    @NotNull(message = "Property manuscript.compile.words-per-page must be configured")
    @Min(value = 1, message = "manuscript.compile.words-per-page must be at least 1")
    private Integer wordsPerPage = 250;

    /** Written into DOCX app properties. */
    @NotBlank(message = "Property manuscript.compile.app-name must be configured")
    private String appName = "Manuscript";

    /** {@code dc:language} of EPUB output. */
    @NotBlank(message = "Property manuscript.compile.language must be configured")
    private String language = "en";
}
