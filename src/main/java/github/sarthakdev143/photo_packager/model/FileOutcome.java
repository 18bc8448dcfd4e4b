package github.sarthakdev143.photo_packager.model;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Result of one (source, category) unit. Built once and never changed after it is recorded.
 */
public record FileOutcome(
        int sequence,
        Path source,
        OutputCategory category,
        OutcomeStatus status,
        String reason,
        Path outputPath,
        Duration elapsed,
        List<String> warnings) {

    public static final String MOVE_VERIFICATION_FAILED = "move-verification-failed";
    public static final String CANCELLED = "cancelled";

    public FileOutcome {
        if (category == null || status == null) {
            throw new IllegalArgumentException("category and status are required.");
        }
        elapsed = elapsed == null ? Duration.ZERO : elapsed;
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
        outputPath = status == OutcomeStatus.SUCCESS ? outputPath : null;
    }

    public static FileOutcome success(
            SourceEntry entry,
            OutputCategory category,
            Path outputPath,
            Duration elapsed,
            List<String> warnings) {
        return new FileOutcome(entry.sequence(), entry.path(), category, OutcomeStatus.SUCCESS, null, outputPath, elapsed, warnings);
    }

    public static FileOutcome skipped(SourceEntry entry, OutputCategory category, String reason) {
        return new FileOutcome(entry.sequence(), entry.path(), category, OutcomeStatus.SKIPPED, reason, null, Duration.ZERO, List.of());
    }

    public static FileOutcome failed(SourceEntry entry, OutputCategory category, String reason, Duration elapsed) {
        return failed(entry, category, reason, elapsed, List.of());
    }

    public static FileOutcome failed(
            SourceEntry entry,
            OutputCategory category,
            String reason,
            Duration elapsed,
            List<String> warnings) {
        return new FileOutcome(entry.sequence(), entry.path(), category, OutcomeStatus.FAILED, reason, null, elapsed, warnings);
    }

    public boolean isSuccess() {
        return status == OutcomeStatus.SUCCESS;
    }

    public boolean isFailed() {
        return status == OutcomeStatus.FAILED;
    }

    public boolean isMoveVerificationFailure() {
        return status == OutcomeStatus.FAILED && MOVE_VERIFICATION_FAILED.equals(reason);
    }
}
