package github.sarthakdev143.photo_packager.service.impl;

import github.sarthakdev143.photo_packager.model.CategoryCounts;
import github.sarthakdev143.photo_packager.model.FileOutcome;
import github.sarthakdev143.photo_packager.model.JobEvent;
import github.sarthakdev143.photo_packager.model.JobSpec;
import github.sarthakdev143.photo_packager.model.JobSummary;
import github.sarthakdev143.photo_packager.model.OutputCategory;
import github.sarthakdev143.photo_packager.model.SourceEntry;
import github.sarthakdev143.photo_packager.model.SourceKind;
import github.sarthakdev143.photo_packager.service.JobEventListener;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

class JobReporterTest {

    private final Clock clock = Clock.fixed(Instant.parse("2024-05-01T10:15:30Z"), ZoneOffset.UTC);
    private final JobSpec jobSpec = JobSpec.builder(Path.of("src"), Path.of("out")).shootBaseName("Gala").build();
    private final SourceEntry first = SourceEntry.readable(Path.of("src", "a.jpg"), 1, "001", SourceKind.RASTER);
    private final SourceEntry second = SourceEntry.readable(Path.of("src", "b.jpg"), 2, "002", SourceKind.RASTER);

    @Test
    void summaryOrdersOutcomesBySequenceThenCategoryAndCounts() {
        JobReporter reporter = new JobReporter(clock, JobEventListener.NONE);
        reporter.record(FileOutcome.success(second, OutputCategory.ORIGINAL, Path.of("out/Gala/x"), Duration.ZERO, List.of()));
        reporter.record(FileOutcome.failed(first, OutputCategory.COMPRESSED_JPEG, "encode failed: boom", Duration.ZERO));
        reporter.record(FileOutcome.skipped(first, OutputCategory.OPTIMIZED_JPEG, "raw source"));
        reporter.record(FileOutcome.success(first, OutputCategory.ORIGINAL, Path.of("out/Gala/y"), Duration.ZERO, List.of("slow disk")));

        JobSummary summary = reporter.summarize(jobSpec, 2, false, List.of(), Duration.ofSeconds(3), null);

        assertThat(summary.outcomes())
                .extracting(FileOutcome::sequence, FileOutcome::category)
                .containsExactly(
                        tuple(1, OutputCategory.ORIGINAL),
                        tuple(1, OutputCategory.OPTIMIZED_JPEG),
                        tuple(1, OutputCategory.COMPRESSED_JPEG),
                        tuple(2, OutputCategory.ORIGINAL));
        assertThat(summary.countsFor(OutputCategory.ORIGINAL)).isEqualTo(new CategoryCounts(2, 0, 0));
        assertThat(summary.countsFor(OutputCategory.COMPRESSED_JPEG)).isEqualTo(new CategoryCounts(0, 0, 1));
        assertThat(summary.failedCount()).isEqualTo(1);
        assertThat(summary.errors()).containsExactly("#1 COMPRESSED_JPEG: encode failed: boom");
        assertThat(summary.warnings()).containsExactly("#1 ORIGINAL: slow disk");
    }

    @Test
    void progressEventsCountFinishedSources() {
        QueueingJobEventListener listener = new QueueingJobEventListener();
        JobReporter reporter = new JobReporter(clock, listener);

        reporter.scanFinished(2);
        reporter.fileFinished(first);
        reporter.fileFinished(second);

        List<JobEvent> events = listener.drain();
        assertThat(events).extracting(JobEvent::type).containsExactly(
                JobEvent.Type.SCAN_FINISHED,
                JobEvent.Type.FILE_FINISHED,
                JobEvent.Type.FILE_FINISHED);
        assertThat(events.get(2).progress()).isEqualTo(new JobEvent.Progress(2, 2));
        assertThat(listener.drain()).isEmpty();
    }

    @Test
    void failingListenerDoesNotBreakTheJob() {
        JobReporter reporter = new JobReporter(clock, event -> {
            throw new IllegalStateException("ui closed");
        });

        reporter.info("Scanning");
        reporter.warn("careful");

        assertThat(reporter.events()).hasSize(2);
    }

    @Test
    void renderedLogCarriesLevelsSequencesAndSummary() {
        JobReporter reporter = new JobReporter(clock, JobEventListener.NONE);
        reporter.dryRun("Would create directory -> out/Gala");
        reporter.record(FileOutcome.skipped(first, OutputCategory.OPTIMIZED_WEBP, "raw source"));

        JobSummary summary = reporter.summarize(jobSpec.toBuilder().dryRun(true).build(), 1, false, List.of(), Duration.ofMillis(12), null);
        String log = reporter.renderLog(summary);

        assertThat(log)
                .contains("2024-05-01T10:15:30Z [DRYRUN] Would create directory -> out/Gala")
                .contains("[INFO] #1 OPTIMIZED_WEBP a.jpg skipped: raw source")
                .contains("---- Summary [DRYRUN] ----")
                .contains("OPTIMIZED_WEBP: succeeded=0 skipped=1 failed=0");
    }
}
