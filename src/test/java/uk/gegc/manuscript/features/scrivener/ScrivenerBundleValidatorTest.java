package uk.gegc.manuscript.features.scrivener;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import uk.gegc.manuscript.features.scrivener.application.BinderXmlParser;
import uk.gegc.manuscript.features.scrivener.application.ScrivenerBundleValidator;
import uk.gegc.manuscript.features.scrivener.config.ScrivenerProperties;
import uk.gegc.manuscript.features.scrivener.domain.ImportError;
import uk.gegc.manuscript.features.scrivener.domain.ImportException;
import uk.gegc.manuscript.features.scrivener.domain.ValidationResult;
import uk.gegc.manuscript.features.scrivener.domain.model.ScrivenerVersion;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static uk.gegc.manuscript.features.scrivener.ScrivenerBundleFixture.manifestWithBinder;

class ScrivenerBundleValidatorTest {

    @TempDir
    Path tempDir;

    private ScrivenerProperties properties;
    private ScrivenerBundleValidator validator;

    @BeforeEach
    void setUp() {
        properties = new ScrivenerProperties();
        validator = new ScrivenerBundleValidator(new BinderXmlParser(), properties);
    }

    @Test
    void validate_v3Bundle_reportsTitleCountAndVersion() {
        // Given
        Path bundle = ScrivenerBundleFixture.at(tempDir, "Novel.scriv")
                .manifest("Novel.scrivx", """
                        <ScrivenerProject>
                            <ProjectTitle>My Novel</ProjectTitle>
                            <Binder>
                                <BinderItem UUID="A" Type="DraftFolder"><Title>Draft</Title>
                                    <Children><BinderItem UUID="B" Type="Text"><Title>One</Title></BinderItem></Children>
                                </BinderItem>
                            </Binder>
                        </ScrivenerProject>
                        """)
                .directory("Files/Data")
                .path();

        // When
        ValidationResult result = validator.validate(bundle);

        // Then
        assertThat(result.valid()).isTrue();
        assertThat(result.projectTitle()).isEqualTo("My Novel");
        assertThat(result.itemCount()).isEqualTo(2);
        assertThat(result.version()).isEqualTo(ScrivenerVersion.V3);
        assertThat(result.warnings()).isEmpty();
        assertThat(result.errors()).isEmpty();
    }

    @Test
    void validate_legacyBundleWithoutProjectTitle_usesBundleNameAndV2() {
        // Given
        Path bundle = ScrivenerBundleFixture.at(tempDir, "Old Story.scriv")
                .manifest("project.scrivx", manifestWithBinder(""))
                .directory("Files/Docs")
                .path();

        // When
        ValidationResult result = validator.validate(bundle);

        // Then
        assertThat(result.valid()).isTrue();
        assertThat(result.projectTitle()).isEqualTo("Old Story");
        assertThat(result.version()).isEqualTo(ScrivenerVersion.V2);
    }

    @Test
    void validate_largeProjectWithMediaAndNoContentDirectory_warnsButStaysValid() {
        // Given
        properties.setLargeProjectThreshold(1);
        Path bundle = ScrivenerBundleFixture.at(tempDir, "Big.scriv")
                .manifest("Big.scrivx", manifestWithBinder("""
                        <BinderItem UUID="A" Type="DraftFolder"><Title>Draft</Title>
                            <Children><BinderItem UUID="B" Type="Image"><Title>Map</Title></BinderItem></Children>
                        </BinderItem>
                        """))
                .path();

        // When
        ValidationResult result = validator.validate(bundle);

        // Then
        assertThat(result.valid()).isTrue();
        assertThat(result.warnings()).containsExactly(
                "No content directory found - documents may be empty",
                "Large project (2 items) - import may take a while",
                "Some media files (images, PDFs) will be referenced but not embedded");
    }

    @Test
    void validate_plainFile_isInvalid() throws Exception {
        // Given
        Path file = Files.writeString(tempDir.resolve("notes.scriv"), "not a bundle");

        // When
        ValidationResult result = validator.validate(file);

        // Then
        assertThat(result.valid()).isFalse();
        assertThat(result.errors()).containsExactly("The selected file is not a Scrivener project bundle");
    }

    @Test
    void validate_directoryWithoutManifest_isInvalid() {
        // Given
        Path bundle = ScrivenerBundleFixture.at(tempDir, "Empty.scriv").directory("Files/Data").path();

        // When
        ValidationResult result = validator.validate(bundle);

        // Then
        assertThat(result.valid()).isFalse();
        assertThat(result.errors()).hasSize(1);
        assertThat(result.errors().get(0)).contains("Missing .scrivx file");
    }

    @Test
    void validate_brokenManifest_collectsParseError() {
        // Given
        Path bundle = ScrivenerBundleFixture.at(tempDir, "Broken.scriv")
                .manifest("Broken.scrivx", "<ScrivenerProject><Binder>")
                .directory("Files/Data")
                .path();

        // When
        ValidationResult result = validator.validate(bundle);

        // Then
        assertThat(result.valid()).isFalse();
        assertThat(result.errors()).hasSize(1);
        assertThat(result.errors().get(0)).startsWith("Could not parse project file:");
        assertThat(result.projectTitle()).isEqualTo("Broken");
    }

    @Test
    void requireManifest_missingBundle_throwsNotABundle() {
        assertThatThrownBy(() -> validator.requireManifest(tempDir.resolve("nowhere.scriv")))
                .isInstanceOf(ImportException.class)
                .satisfies(e -> assertThat(((ImportException) e).getError()).isEqualTo(ImportError.NOT_A_BUNDLE));
    }

    @Test
    void requireManifest_legacyAndNamedManifests_prefersLegacyName() throws Exception {
        // Given
        Path bundle = ScrivenerBundleFixture.at(tempDir, "Both.scriv")
                .manifest("Both.scrivx", manifestWithBinder(""))
                .manifest("project.scrivx", manifestWithBinder(""))
                .path();

        // When
        Path manifest = validator.requireManifest(bundle);

        // Then
        assertThat(manifest.getFileName().toString()).isEqualTo("project.scrivx");
    }
}
