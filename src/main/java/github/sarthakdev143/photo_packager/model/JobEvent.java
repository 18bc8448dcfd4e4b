package github.sarthakdev143.photo_packager.model;

import java.time.Instant;

/**
 * One timestamped entry of the per-job log. File-level events carry the source sequence,
 * job-level events (scan, archive, summary) carry {@code null}.
 */
public record JobEvent(
        Instant timestamp,
        Type type,
        Level level,
        Integer sequence,
        String message,
        FileOutcome outcome,
        Progress progress) {

    public enum Type {
        MESSAGE,
        OUTCOME,
        SCAN_FINISHED,
        FILE_FINISHED
    }

    public enum Level {
        INFO,
        WARNING,
        ERROR,
        DRYRUN
    }

    public JobEvent {
        timestamp = timestamp == null ? Instant.now() : timestamp;
        type = type == null ? Type.MESSAGE : type;
        level = level == null ? Level.INFO : level;
        message = message == null ? "" : message;
    }

    /**
     * Sources finished so far out of the scanned total. Present on scan and file-finished events.
     */
    public record Progress(int completed, int total) {
    }
}
