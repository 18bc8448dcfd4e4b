package github.sarthakdev143.photo_packager.config;

import github.sarthakdev143.photo_packager.integration.image.ImageEncoder;
import github.sarthakdev143.photo_packager.model.OutputFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import javax.imageio.ImageIO;
import java.nio.file.Path;

@Component
@ConditionalOnProperty(name = "photo-packager.preflight.enabled", havingValue = "true", matchIfMissing = true)
public class StartupPreflightChecks implements ApplicationRunner {

    private static final Logger logger = LoggerFactory.getLogger(StartupPreflightChecks.class);

    private final ImageEncoder imageEncoder;
    private final PackagerProperties properties;

    public StartupPreflightChecks(ImageEncoder imageEncoder, PackagerProperties properties) {
        this.imageEncoder = imageEncoder;
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        ImageIO.scanForPlugins();
        checkJpegWriter();
        checkWebpWriter();
        checkDefaults();
    }

    void checkJpegWriter() {
        if (!imageEncoder.supports(OutputFormat.JPEG)) {
            throw new IllegalStateException(
                    "No JPEG image writer is registered with ImageIO. JPEG derivatives cannot be produced.");
        }
    }

    void checkWebpWriter() {
        if (!imageEncoder.supports(OutputFormat.WEBP)) {
            logger.warn("No WebP image writer is registered (os={} arch={}); WebP categories will record failures.",
                    System.getProperty("os.name"),
                    System.getProperty("os.arch"));
        }
    }

    void checkDefaults() {
        try {
            properties.toJobSpecBuilder(Path.of("."), Path.of("."));
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Invalid photo-packager configuration: " + e.getMessage(), e);
        }
    }
}
