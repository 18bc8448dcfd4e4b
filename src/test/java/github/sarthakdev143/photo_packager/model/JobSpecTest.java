package github.sarthakdev143.photo_packager.model;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JobSpecTest {

    @Test
    void derivativeFoldersSitUnderTheirGroup() {
        JobSpec jobSpec = JobSpec.builder(Path.of("in"), Path.of("out")).shootBaseName("Gala").build();

        assertThat(jobSpec.outputRoot()).isEqualTo(Path.of("out", "Gala"));
        assertThat(jobSpec.categoryFolder(OutputCategory.OPTIMIZED_WEBP))
                .isEqualTo(Path.of("out", "Gala", "Optimized Files", "Optimized WebPs"));
        assertThat(jobSpec.categoryFolder(OutputCategory.RAW)).isEqualTo(Path.of("out", "Gala", "RAW Files"));
    }

    @Test
    void onlyDerivativeCategoriesAreEnabled() {
        JobSpec jobSpec = JobSpec.builder(Path.of("in"), Path.of("out"))
                .category(OutputCategory.ORIGINAL, CategorySettings.optimized(90))
                .withDefaultCategory(OutputCategory.COMPRESSED_WEBP)
                .withDefaultCategory(OutputCategory.OPTIMIZED_JPEG)
                .build();

        assertThat(jobSpec.enabledDerivatives())
                .containsExactly(OutputCategory.OPTIMIZED_JPEG, OutputCategory.COMPRESSED_WEBP);
        assertThatThrownBy(() -> jobSpec.settingsFor(OutputCategory.OPTIMIZED_WEBP))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void toBuilderRoundTripsEveryField() {
        JobSpec original = JobSpec.builder(Path.of("in"), Path.of("out"))
                .shootBaseName("Gala")
                .originalsAction(OriginalsAction.MOVE)
                .includeRaw(true)
                .rawAction(OriginalsAction.LEAVE)
                .metadataPolicy(MetadataPolicy.STRIP_CAMERA)
                .withDefaultCategory(OutputCategory.COMPRESSED_JPEG)
                .dryRun(true)
                .workerCount(3)
                .branding(new DeliveryBranding("Studio", "example.com", "hi@example.com"))
                .build();

        assertThat(original.toBuilder().build()).isEqualTo(original);
    }

    @Test
    void acceptedExtensionsAreNormalized() {
        CategorySettings settings = CategorySettings.optimized(90).withAcceptedExtensions(Set.of(".JPG", "jpeg "));

        assertThat(settings.accepts("jpg")).isTrue();
        assertThat(settings.accepts("JPEG")).isTrue();
        assertThat(settings.accepts("png")).isFalse();
        assertThat(CategorySettings.optimized(90).accepts("png")).isTrue();
    }

    @Test
    void parsesShortActionAndPolicyNames() {
        assertThat(OriginalsAction.fromInput("none")).isEqualTo(OriginalsAction.SKIP_EXPORT);
        assertThat(OriginalsAction.fromInput(" move ")).isEqualTo(OriginalsAction.MOVE);
        assertThat(MetadataPolicy.fromInput("both")).isEqualTo(MetadataPolicy.STRIP_DATE_AND_CAMERA);
        assertThat(MetadataPolicy.fromInput("strip-all")).isEqualTo(MetadataPolicy.STRIP_ALL);
        assertThatThrownBy(() -> OriginalsAction.fromInput("shred"))
                .hasMessage("originalsAction must be one of COPY, MOVE, LEAVE, SKIP_EXPORT.");
    }

    @Test
    void classifiesSourcesByExtension() {
        assertThat(SourceKind.fromExtension("JPG")).isEqualTo(SourceKind.RASTER);
        assertThat(SourceKind.fromExtension("cr3")).isEqualTo(SourceKind.CAMERA_RAW);
        assertThat(SourceKind.fromExtension("heic")).isEqualTo(SourceKind.UNDECODABLE_IMAGE);
        assertThat(SourceKind.fromExtension("txt")).isNull();
    }
}
