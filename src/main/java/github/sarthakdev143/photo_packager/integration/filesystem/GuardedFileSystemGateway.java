package github.sarthakdev143.photo_packager.integration.filesystem;

import github.sarthakdev143.photo_packager.service.FileSystemGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.function.Consumer;

/**
 * File system boundary for one job. In dry-run mode every mutation is reported to the
 * dry-run listener and nothing touches the disk.
 */
public class GuardedFileSystemGateway implements FileSystemGateway {

    private static final Logger logger = LoggerFactory.getLogger(GuardedFileSystemGateway.class);

    private final boolean dryRun;
    private final Consumer<String> dryRunListener;

    public GuardedFileSystemGateway(boolean dryRun, Consumer<String> dryRunListener) {
        this.dryRun = dryRun;
        this.dryRunListener = dryRunListener == null ? ignored -> {
        } : dryRunListener;
    }

    @Override
    public boolean isDryRun() {
        return dryRun;
    }

    @Override
    public void createDirectories(Path directory) throws IOException {
        guard("create directory", directory, () -> Files.createDirectories(directory));
    }

    @Override
    public void writeBytes(Path target, byte[] content) throws IOException {
        guard("write " + content.length + " bytes", target, () -> Files.write(
                target,
                content,
                StandardOpenOption.CREATE,
                StandardOpenOption.TRUNCATE_EXISTING,
                StandardOpenOption.WRITE));
    }

    @Override
    public void appendText(Path target, String text) throws IOException {
        guard("append log", target, () -> Files.writeString(
                target,
                text,
                StandardCharsets.UTF_8,
                StandardOpenOption.CREATE,
                StandardOpenOption.APPEND,
                StandardOpenOption.WRITE));
    }

    @Override
    public void writeStream(Path target, StreamWriter writer) throws IOException {
        guard("write", target, () -> {
            try (OutputStream outputStream = Files.newOutputStream(target)) {
                writer.writeTo(outputStream);
            } catch (IOException | RuntimeException e) {
                deleteQuietly(target);
                throw e;
            }
        });
    }

    @Override
    public void copy(Path source, Path target) throws IOException {
        guard("copy " + source, target, () -> Files.copy(
                source,
                target,
                StandardCopyOption.REPLACE_EXISTING,
                StandardCopyOption.COPY_ATTRIBUTES));
    }

    @Override
    public void rename(Path source, Path target) throws IOException {
        guard("rename " + source, target, () -> {
            try {
                Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
            }
        });
    }

    @Override
    public void delete(Path target) throws IOException {
        guard("delete", target, () -> Files.deleteIfExists(target));
    }

    private void guard(String action, Path target, Mutation mutation) throws IOException {
        if (dryRun) {
            String message = "Would " + action + " -> " + target;
            logger.info("[DRYRUN] {}", message);
            dryRunListener.accept(message);
            return;
        }
        mutation.run();
    }

    private void deleteQuietly(Path target) {
        try {
            Files.deleteIfExists(target);
        } catch (IOException e) {
            logger.warn("Could not remove partial file {}", target, e);
        }
    }

    @FunctionalInterface
    private interface Mutation {

        void run() throws IOException;
    }
}
