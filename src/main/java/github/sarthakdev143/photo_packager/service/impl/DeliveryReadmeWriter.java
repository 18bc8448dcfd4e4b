package github.sarthakdev143.photo_packager.service.impl;

import github.sarthakdev143.photo_packager.model.CategorySettings;
import github.sarthakdev143.photo_packager.model.DeliveryBranding;
import github.sarthakdev143.photo_packager.model.FolderLayout;
import github.sarthakdev143.photo_packager.model.JobSpec;
import github.sarthakdev143.photo_packager.model.OutputCategory;
import github.sarthakdev143.photo_packager.service.FileSystemGateway;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Locale;

@Component
public class DeliveryReadmeWriter {

    static final String README_FILE = "README.txt";

    public Path writeDeliveryReadme(JobSpec jobSpec, FileSystemGateway gateway) throws IOException {
        Path readme = jobSpec.outputRoot().resolve(README_FILE);
        gateway.writeBytes(readme, deliveryReadme(jobSpec).getBytes(StandardCharsets.UTF_8));
        return readme;
    }

    public Path writeRawReadme(JobSpec jobSpec, FileSystemGateway gateway) throws IOException {
        Path readme = jobSpec.categoryFolder(OutputCategory.RAW).resolve(README_FILE);
        gateway.writeBytes(readme, rawReadme(jobSpec).getBytes(StandardCharsets.UTF_8));
        return readme;
    }

    String deliveryReadme(JobSpec jobSpec) {
        FolderLayout folders = jobSpec.folders();
        DeliveryBranding branding = jobSpec.branding();
        String sender = branding.companyName().isEmpty() ? "your photographer" : branding.companyName();
        String nl = System.lineSeparator();

        StringBuilder text = new StringBuilder();
        text.append("DIGITAL DELIVERY").append(nl)
                .append("================").append(nl).append(nl)
                .append("Delivered by ").append(sender).append(nl)
                .append("Project: ").append(jobSpec.shootBaseName()).append(nl).append(nl)
                .append("Every photo carries the same number in every folder, so 004-")
                .append(jobSpec.shootBaseName()).append(" is the same picture wherever it appears.")
                .append(nl).append(nl)
                .append("Folders").append(nl)
                .append("-------").append(nl);

        if (jobSpec.originalsAction().writesFiles()) {
            text.append(folders.exportOriginals()).append("/").append(nl)
                    .append("    Full-resolution source files, unchanged. Use these for print and archiving.")
                    .append(nl);
        }
        if (jobSpec.includeRaw() && jobSpec.rawAction().writesFiles()) {
            text.append(folders.rawFiles()).append("/").append(nl)
                    .append("    Camera RAW files. They need RAW-capable editing software.").append(nl);
        }
        appendDerivative(text, jobSpec, OutputCategory.OPTIMIZED_JPEG, folders.optimizedRoot(), folders.optimizedJpeg(),
                "Full-size JPG files for print and general use");
        appendDerivative(text, jobSpec, OutputCategory.OPTIMIZED_WEBP, folders.optimizedRoot(), folders.optimizedWebp(),
                "Full-size WebP files, smaller than JPG at similar quality");
        appendDerivative(text, jobSpec, OutputCategory.COMPRESSED_JPEG, folders.compressedRoot(), folders.compressedJpeg(),
                "Resized JPG files for web, email and social media");
        appendDerivative(text, jobSpec, OutputCategory.COMPRESSED_WEBP, folders.compressedRoot(), folders.compressedWebp(),
                "Resized WebP files for fast-loading web galleries");

        if (jobSpec.createArchives()) {
            text.append(nl).append("Archives").append(nl)
                    .append("--------").append(nl)
                    .append("Each top-level folder is also provided as a .zip file. Extract it with your")
                    .append(" operating system's built-in tools before use.").append(nl);
        }

        if (!branding.website().isEmpty() || !branding.supportEmail().isEmpty()) {
            text.append(nl).append("Questions").append(nl)
                    .append("---------").append(nl);
            if (!branding.website().isEmpty()) {
                text.append("Website: ").append(branding.website()).append(nl);
            }
            if (!branding.supportEmail().isEmpty()) {
                text.append("Support: ").append(branding.supportEmail()).append(nl);
            }
        }
        return text.toString();
    }

    String rawReadme(JobSpec jobSpec) {
        DeliveryBranding branding = jobSpec.branding();
        String nl = System.lineSeparator();
        StringBuilder text = new StringBuilder();
        text.append(jobSpec.folders().rawFiles().toUpperCase(Locale.ROOT)).append(nl)
                .append("=".repeat(jobSpec.folders().rawFiles().length())).append(nl).append(nl)
                .append("These are the unprocessed files straight from the camera (.CR2, .NEF, .ARW, .DNG and similar).")
                .append(nl)
                .append("Open them with RAW-capable software such as Lightroom, Capture One or darktable.")
                .append(nl);
        if (!branding.supportEmail().isEmpty()) {
            text.append(nl).append("Questions about these files: ").append(branding.supportEmail()).append(nl);
        }
        return text.toString();
    }

    private void appendDerivative(
            StringBuilder text,
            JobSpec jobSpec,
            OutputCategory category,
            String root,
            String folder,
            String description) {
        if (!jobSpec.isEnabled(category)) {
            return;
        }
        CategorySettings settings = jobSpec.settingsFor(category);
        text.append(root).append("/").append(folder).append("/").append(System.lineSeparator())
                .append("    ").append(description).append(" (quality ").append(settings.quality());
        if (category.isCompressed()) {
            text.append(String.format(Locale.ROOT, ", about %.1f megapixels", settings.targetPixels() / 1_000_000.0));
        }
        text.append(").").append(System.lineSeparator());
    }
}
