package github.sarthakdev143.photo_packager.service;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Path;

/**
 * Every write, copy, move, delete and archive a job performs goes through this boundary.
 * Reads are not routed here.
 */
public interface FileSystemGateway {

    boolean isDryRun();

    void createDirectories(Path directory) throws IOException;

    void writeBytes(Path target, byte[] content) throws IOException;

    void appendText(Path target, String text) throws IOException;

    /**
     * Streams content into {@code target}. A partially written target is deleted when the writer fails.
     */
    void writeStream(Path target, StreamWriter writer) throws IOException;

    void copy(Path source, Path target) throws IOException;

    /**
     * Renames within one file system, atomically where the file system supports it.
     */
    void rename(Path source, Path target) throws IOException;

    void delete(Path target) throws IOException;

    @FunctionalInterface
    interface StreamWriter {

        void writeTo(OutputStream outputStream) throws IOException;
    }
}
