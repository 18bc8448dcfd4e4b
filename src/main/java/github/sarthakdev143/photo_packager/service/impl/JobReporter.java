package github.sarthakdev143.photo_packager.service.impl;

import github.sarthakdev143.photo_packager.model.CategoryCounts;
import github.sarthakdev143.photo_packager.model.FileOutcome;
import github.sarthakdev143.photo_packager.model.JobEvent;
import github.sarthakdev143.photo_packager.model.JobSpec;
import github.sarthakdev143.photo_packager.model.JobSummary;
import github.sarthakdev143.photo_packager.model.OutcomeStatus;
import github.sarthakdev143.photo_packager.model.OutputCategory;
import github.sarthakdev143.photo_packager.model.SourceEntry;
import github.sarthakdev143.photo_packager.service.JobEventListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * Append-only event sink for one job. Safe to call from every worker thread.
 */
public class JobReporter {

    private static final Logger logger = LoggerFactory.getLogger(JobReporter.class);

    static final Comparator<FileOutcome> OUTCOME_ORDER = Comparator
            .comparingInt(FileOutcome::sequence)
            .thenComparing(FileOutcome::category);

    private final Clock clock;
    private final JobEventListener listener;
    private final Object lock = new Object();
    private final List<JobEvent> events = new ArrayList<>();
    private final List<FileOutcome> outcomes = new ArrayList<>();
    private final List<String> warnings = new ArrayList<>();
    private final List<String> errors = new ArrayList<>();
    private final AtomicInteger finishedSources = new AtomicInteger();
    private volatile int totalSources;

    public JobReporter(Clock clock, JobEventListener listener) {
        this.clock = clock;
        this.listener = listener == null ? JobEventListener.NONE : listener;
    }

    public void info(String message) {
        append(JobEvent.Type.MESSAGE, JobEvent.Level.INFO, null, message, null, null);
    }

    public void warn(String message) {
        synchronized (lock) {
            warnings.add(message);
        }
        append(JobEvent.Type.MESSAGE, JobEvent.Level.WARNING, null, message, null, null);
    }

    public void error(String message) {
        synchronized (lock) {
            errors.add(message);
        }
        append(JobEvent.Type.MESSAGE, JobEvent.Level.ERROR, null, message, null, null);
    }

    public void dryRun(String message) {
        append(JobEvent.Type.MESSAGE, JobEvent.Level.DRYRUN, null, message, null, null);
    }

    public void record(FileOutcome outcome) {
        String label = "#" + outcome.sequence() + " " + outcome.category();
        synchronized (lock) {
            outcomes.add(outcome);
            for (String warning : outcome.warnings()) {
                warnings.add(label + ": " + warning);
            }
            if (outcome.isFailed()) {
                errors.add(label + ": " + outcome.reason());
            }
        }
        append(JobEvent.Type.OUTCOME, levelFor(outcome), outcome.sequence(), describe(outcome), outcome, null);
    }

    public void scanFinished(int sourceCount) {
        totalSources = sourceCount;
        append(
                JobEvent.Type.SCAN_FINISHED,
                JobEvent.Level.INFO,
                null,
                "Found " + sourceCount + " source file(s)",
                null,
                new JobEvent.Progress(0, sourceCount));
    }

    /**
     * Marks a source as fully handled. Progress counters key off these events.
     */
    public void fileFinished(SourceEntry entry) {
        int completed = finishedSources.incrementAndGet();
        append(
                JobEvent.Type.FILE_FINISHED,
                JobEvent.Level.INFO,
                entry.sequence(),
                "Finished " + entry.fileName(),
                null,
                new JobEvent.Progress(completed, totalSources));
    }

    public List<JobEvent> events() {
        synchronized (lock) {
            return List.copyOf(events);
        }
    }

    /**
     * Output paths of successful outcomes so far; in a dry run these are the planned destinations.
     */
    public List<Path> plannedOutputs() {
        synchronized (lock) {
            return outcomes.stream()
                    .filter(FileOutcome::isSuccess)
                    .map(FileOutcome::outputPath)
                    .filter(Objects::nonNull)
                    .collect(Collectors.toList());
        }
    }

    public int recordedOutcomes() {
        synchronized (lock) {
            return outcomes.size();
        }
    }

    public JobSummary summarize(
            JobSpec jobSpec,
            int totalSources,
            boolean cancelled,
            List<Path> archives,
            Duration elapsed,
            Path logFile) {
        List<FileOutcome> sorted;
        List<String> warningsCopy;
        List<String> errorsCopy;
        synchronized (lock) {
            sorted = new ArrayList<>(outcomes);
            warningsCopy = List.copyOf(warnings);
            errorsCopy = List.copyOf(errors);
        }
        sorted.sort(OUTCOME_ORDER);

        Map<OutputCategory, CategoryCounts> counts = new EnumMap<>(OutputCategory.class);
        for (FileOutcome outcome : sorted) {
            counts.merge(outcome.category(), CategoryCounts.EMPTY.plus(outcome.status()), (current, ignored) ->
                    current.plus(outcome.status()));
        }

        return new JobSummary(
                jobSpec.shootBaseName(),
                jobSpec.outputRoot(),
                jobSpec.dryRun(),
                cancelled,
                totalSources,
                counts,
                sorted,
                warningsCopy,
                errorsCopy,
                archives,
                elapsed,
                logFile);
    }

    /**
     * Renders every recorded event followed by the summary, in the plain-text log format.
     */
    public String renderLog(JobSummary summary) {
        StringBuilder log = new StringBuilder();
        for (JobEvent event : eventsInLogOrder()) {
            log.append(DateTimeFormatter.ISO_INSTANT.format(event.timestamp()))
                    .append(" [")
                    .append(event.level())
                    .append("] ");
            if (event.sequence() != null) {
                log.append('#').append(event.sequence()).append(' ');
            }
            log.append(event.message()).append(System.lineSeparator());
        }

        log.append("---- Summary").append(summary.dryRun() ? " [DRYRUN]" : "").append(" ----").append(System.lineSeparator());
        log.append("Shoot: ").append(summary.shootBaseName())
                .append(", sources: ").append(summary.totalSources())
                .append(", elapsed: ").append(summary.elapsed().toMillis()).append(" ms")
                .append(summary.cancelled() ? ", cancelled" : "")
                .append(System.lineSeparator());
        summary.counts().forEach((category, counts) -> log.append(category)
                .append(": succeeded=").append(counts.succeeded())
                .append(" skipped=").append(counts.skipped())
                .append(" failed=").append(counts.failed())
                .append(System.lineSeparator()));
        for (Path archive : summary.archives()) {
            log.append("Archive: ").append(archive).append(System.lineSeparator());
        }
        log.append("Warnings: ").append(summary.warnings().size())
                .append(", errors: ").append(summary.errors().size())
                .append(System.lineSeparator())
                .append(System.lineSeparator());
        return log.toString();
    }

    private List<JobEvent> eventsInLogOrder() {
        List<JobEvent> copy = events();
        List<JobEvent> ordered = new ArrayList<>(copy);
        ordered.sort(Comparator.comparing(JobEvent::timestamp));
        return ordered;
    }

    private void append(
            JobEvent.Type type,
            JobEvent.Level level,
            Integer sequence,
            String message,
            FileOutcome outcome,
            JobEvent.Progress progress) {
        JobEvent event = new JobEvent(clock.instant(), type, level, sequence, message, outcome, progress);
        synchronized (lock) {
            events.add(event);
        }
        try {
            listener.onEvent(event);
        } catch (RuntimeException e) {
            logger.warn("Job event listener failed on '{}'", message, e);
        }
    }

    private JobEvent.Level levelFor(FileOutcome outcome) {
        if (outcome.status() == OutcomeStatus.FAILED) {
            return JobEvent.Level.ERROR;
        }
        return outcome.warnings().isEmpty() ? JobEvent.Level.INFO : JobEvent.Level.WARNING;
    }

    private String describe(FileOutcome outcome) {
        String source = outcome.source().getFileName().toString();
        return switch (outcome.status()) {
            case SUCCESS -> outcome.category() + " " + source
                    + (outcome.outputPath() == null ? " left in place" : " -> " + outcome.outputPath());
            case SKIPPED -> outcome.category() + " " + source + " skipped: " + outcome.reason();
            case FAILED -> outcome.category() + " " + source + " failed: " + outcome.reason();
        };
    }
}
