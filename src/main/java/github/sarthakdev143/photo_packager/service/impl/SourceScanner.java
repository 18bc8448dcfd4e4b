package github.sarthakdev143.photo_packager.service.impl;

import github.sarthakdev143.photo_packager.model.ScanResult;
import github.sarthakdev143.photo_packager.model.SourceEntry;
import github.sarthakdev143.photo_packager.model.SourceKind;
import github.sarthakdev143.photo_packager.service.JobSetupException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

@Component
public class SourceScanner {

    private static final Logger logger = LoggerFactory.getLogger(SourceScanner.class);
    private static final int MIN_SEQUENCE_WIDTH = 3;

    /**
     * Case-insensitive file name, then raw name, then full path so equal names in different
     * subfolders still order deterministically.
     */
    static final Comparator<Path> SOURCE_ORDER = Comparator
            .comparing((Path path) -> path.getFileName().toString().toLowerCase(Locale.ROOT))
            .thenComparing(path -> path.getFileName().toString())
            .thenComparing(Path::toString);

    /**
     * Lists image files under {@code sourceDirectory} and numbers them 1..N in a stable order.
     * Unreadable files keep their number and carry a skip reason.
     *
     * @param excludedRoot directory to leave out of the walk, typically the job's own output root
     */
    public ScanResult scan(Path sourceDirectory, boolean recursive, boolean includeRaw, Path excludedRoot)
            throws JobSetupException {
        if (sourceDirectory == null || !Files.exists(sourceDirectory)) {
            throw new JobSetupException("Source directory does not exist: " + sourceDirectory);
        }
        if (!Files.isDirectory(sourceDirectory)) {
            throw new JobSetupException("Source path is not a directory: " + sourceDirectory);
        }

        List<String> warnings = new ArrayList<>();
        List<Candidate> candidates = new ArrayList<>();
        Path normalizedExclude = excludedRoot == null ? null : excludedRoot.toAbsolutePath().normalize();
        try {
            if (recursive) {
                walkTree(sourceDirectory, includeRaw, normalizedExclude, candidates, warnings);
            } else {
                listDirectory(sourceDirectory, includeRaw, candidates);
            }
        } catch (IOException e) {
            throw new JobSetupException("Source directory is not readable: " + sourceDirectory, e);
        }

        candidates.sort(Comparator.comparing(Candidate::path, SOURCE_ORDER));
        int width = sequenceWidth(candidates.size());
        List<SourceEntry> entries = new ArrayList<>(candidates.size());
        for (int index = 0; index < candidates.size(); index++) {
            Candidate candidate = candidates.get(index);
            int sequence = index + 1;
            String label = formatSequence(sequence, width);
            String unreadableReason = checkReadable(candidate.path());
            if (unreadableReason == null) {
                entries.add(SourceEntry.readable(candidate.path(), sequence, label, candidate.kind()));
            } else {
                entries.add(SourceEntry.unreadable(candidate.path(), sequence, label, candidate.kind(), unreadableReason));
                warnings.add("Skipping unreadable source " + candidate.path().getFileName() + ": " + unreadableReason);
                logger.warn("Unreadable source {}: {}", candidate.path(), unreadableReason);
            }
        }

        long rawCount = entries.stream().filter(SourceEntry::isRaw).count();
        logger.info(
                "Found {} source file(s) in {} ({} RAW, recursive={})",
                entries.size(),
                sourceDirectory,
                rawCount,
                recursive);
        return new ScanResult(entries, warnings);
    }

    static int sequenceWidth(int entryCount) {
        return Math.max(MIN_SEQUENCE_WIDTH, String.valueOf(entryCount).length());
    }

    static String formatSequence(int sequence, int width) {
        return String.format(Locale.ROOT, "%0" + width + "d", sequence);
    }

    private void listDirectory(Path sourceDirectory, boolean includeRaw, List<Candidate> candidates) throws IOException {
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(sourceDirectory)) {
            for (Path path : stream) {
                if (Files.isDirectory(path)) {
                    continue;
                }
                addCandidate(path, includeRaw, candidates);
            }
        }
    }

    private void walkTree(
            Path sourceDirectory,
            boolean includeRaw,
            Path excludedRoot,
            List<Candidate> candidates,
            List<String> warnings) throws IOException {
        Files.walkFileTree(sourceDirectory, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                if (excludedRoot != null && dir.toAbsolutePath().normalize().equals(excludedRoot)) {
                    logger.debug("Excluding output root {} from scan", dir);
                    return FileVisitResult.SKIP_SUBTREE;
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                if (!attrs.isDirectory()) {
                    addCandidate(file, includeRaw, candidates);
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException exc) throws IOException {
                if (file.equals(sourceDirectory)) {
                    throw exc;
                }
                if (kindOf(file, includeRaw) != null) {
                    addCandidate(file, includeRaw, candidates);
                } else {
                    warnings.add("Could not scan " + file + ": " + exc.getMessage());
                    logger.warn("Could not scan {}", file, exc);
                }
                return FileVisitResult.CONTINUE;
            }
        });
    }

    private void addCandidate(Path path, boolean includeRaw, List<Candidate> candidates) {
        SourceKind kind = kindOf(path, includeRaw);
        if (kind != null) {
            candidates.add(new Candidate(path, kind));
        }
    }

    private SourceKind kindOf(Path path, boolean includeRaw) {
        Path fileName = path.getFileName();
        if (fileName == null) {
            return null;
        }
        String name = fileName.toString();
        int dot = name.lastIndexOf('.');
        if (dot < 0) {
            return null;
        }
        SourceKind kind = SourceKind.fromExtension(name.substring(dot + 1));
        if (kind == SourceKind.CAMERA_RAW && !includeRaw) {
            return null;
        }
        return kind;
    }

    private String checkReadable(Path path) {
        if (Files.isSymbolicLink(path) && !Files.exists(path)) {
            return "broken symbolic link";
        }
        if (!Files.isRegularFile(path)) {
            return "not a regular file";
        }
        if (!Files.isReadable(path)) {
            return "permission denied";
        }
        return null;
    }

    private record Candidate(Path path, SourceKind kind) {
    }
}
