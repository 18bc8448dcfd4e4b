package github.sarthakdev143.photo_packager.model;

import java.nio.file.Path;
import java.time.Instant;

public record PackagingJobStatus(
        String jobId,
        PackagingJobState state,
        String message,
        Instant createdAt,
        Instant updatedAt,
        String shootBaseName,
        Path outputRoot,
        boolean dryRun,
        int processedSources,
        int totalSources,
        int failedOutcomes,
        String warningMessage) {

    public boolean isTerminal() {
        return state == PackagingJobState.COMPLETED
                || state == PackagingJobState.FAILED
                || state == PackagingJobState.CANCELLED;
    }
}
