package github.sarthakdev143.photo_packager.service.impl;

import github.sarthakdev143.photo_packager.model.JobSpec;
import github.sarthakdev143.photo_packager.service.FileSystemGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

@Component
public class Archiver {

    private static final Logger logger = LoggerFactory.getLogger(Archiver.class);
    static final String ARCHIVE_EXTENSION = ".zip";

    /**
     * Zips each populated top-level folder into {@code <folder>.zip} at the output root. A failed
     * archive is reported and the others are still attempted.
     */
    public List<Path> createArchives(JobSpec jobSpec, FileSystemGateway gateway, JobReporter reporter) {
        List<Path> archives = new ArrayList<>();
        Path outputRoot = jobSpec.outputRoot();
        for (String folderName : jobSpec.folders().archivedFolders()) {
            Path folder = outputRoot.resolve(folderName);
            List<Path> files;
            try {
                files = listFiles(folder);
            } catch (IOException e) {
                reporter.error("Could not list " + folder + " for archiving: " + e.getMessage());
                continue;
            }
            if (files.isEmpty()) {
                logger.debug("Skipping archive for empty folder {}", folder);
                continue;
            }

            Path archive = outputRoot.resolve(folderName + ARCHIVE_EXTENSION);
            try {
                gateway.writeStream(archive, outputStream -> writeZip(outputStream, folder, files));
                archives.add(archive);
                reporter.info("Created archive " + archive.getFileName() + " with " + files.size() + " file(s)");
            } catch (IOException e) {
                logger.error("Archive {} failed", archive, e);
                reporter.error("Could not create archive " + archive.getFileName() + ": " + e.getMessage());
            }
        }
        return archives;
    }

    /**
     * Archives a live run would create, given the output paths a dry run planned.
     */
    public List<Path> plannedArchives(JobSpec jobSpec, Collection<Path> plannedOutputs) {
        List<Path> planned = new ArrayList<>();
        Path outputRoot = jobSpec.outputRoot();
        for (String folderName : jobSpec.folders().archivedFolders()) {
            Path folder = outputRoot.resolve(folderName);
            if (plannedOutputs.stream().anyMatch(path -> path.startsWith(folder))) {
                planned.add(outputRoot.resolve(folderName + ARCHIVE_EXTENSION));
            }
        }
        return planned;
    }

    List<Path> listFiles(Path folder) throws IOException {
        if (!Files.isDirectory(folder)) {
            return List.of();
        }
        try (Stream<Path> walk = walk(folder)) {
            return walk.filter(Files::isRegularFile)
                    .sorted(Comparator.comparing(path -> entryName(folder, path)))
                    .collect(Collectors.toList());
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
    }

    Stream<Path> walk(Path folder) throws IOException {
        return Files.walk(folder);
    }

    private void writeZip(OutputStream outputStream, Path folder, List<Path> files) throws IOException {
        try (ZipOutputStream zip = new ZipOutputStream(outputStream)) {
            for (Path file : files) {
                ZipEntry entry = new ZipEntry(entryName(folder, file));
                entry.setTime(Files.getLastModifiedTime(file).toMillis());
                zip.putNextEntry(entry);
                Files.copy(file, zip);
                zip.closeEntry();
            }
        }
    }

    static String entryName(Path folder, Path file) {
        return folder.relativize(file).toString().replace('\\', '/');
    }
}
