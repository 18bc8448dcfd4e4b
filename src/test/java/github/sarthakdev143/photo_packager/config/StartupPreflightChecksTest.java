package github.sarthakdev143.photo_packager.config;

import github.sarthakdev143.photo_packager.integration.image.ImageEncoder;
import github.sarthakdev143.photo_packager.model.OutputFormat;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.context.properties.bind.Bindable;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.MapConfigurationPropertySource;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class StartupPreflightChecksTest {

    @Mock
    private ImageEncoder imageEncoder;

    @Test
    void missingJpegWriterFailsStartup() {
        when(imageEncoder.supports(OutputFormat.JPEG)).thenReturn(false);
        StartupPreflightChecks checks = new StartupPreflightChecks(imageEncoder, properties(Map.of()));

        assertThatThrownBy(checks::checkJpegWriter)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("No JPEG image writer");
    }

    @Test
    void missingWebpWriterOnlyWarns() {
        when(imageEncoder.supports(OutputFormat.WEBP)).thenReturn(false);
        StartupPreflightChecks checks = new StartupPreflightChecks(imageEncoder, properties(Map.of()));

        assertThatCode(checks::checkWebpWriter).doesNotThrowAnyException();
    }

    @Test
    void invalidConfiguredActionFailsStartup() {
        StartupPreflightChecks checks = new StartupPreflightChecks(
                imageEncoder,
                properties(Map.of("photo-packager.originals-action", "shred")));

        assertThatThrownBy(checks::checkDefaults)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageStartingWith("Invalid photo-packager configuration:");
    }

    @Test
    void defaultConfigurationPasses() {
        StartupPreflightChecks checks = new StartupPreflightChecks(imageEncoder, properties(Map.of()));

        assertThatCode(checks::checkDefaults).doesNotThrowAnyException();
    }

    private PackagerProperties properties(Map<String, String> values) {
        return new Binder(new MapConfigurationPropertySource(values))
                .bindOrCreate("photo-packager", Bindable.of(PackagerProperties.class));
    }
}
