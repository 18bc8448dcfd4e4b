package github.sarthakdev143.photo_packager.service.impl;

import github.sarthakdev143.photo_packager.model.CategoryCounts;
import github.sarthakdev143.photo_packager.model.FileOutcome;
import github.sarthakdev143.photo_packager.model.JobEvent;
import github.sarthakdev143.photo_packager.model.JobSpec;
import github.sarthakdev143.photo_packager.model.JobSummary;
import github.sarthakdev143.photo_packager.model.OutputCategory;
import github.sarthakdev143.photo_packager.model.PackagingJobState;
import github.sarthakdev143.photo_packager.model.PackagingJobStatus;
import github.sarthakdev143.photo_packager.model.SourceEntry;
import github.sarthakdev143.photo_packager.model.SourceKind;
import github.sarthakdev143.photo_packager.service.JobEventListener;
import github.sarthakdev143.photo_packager.service.JobSetupException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.task.TaskExecutor;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DefaultPackagingJobServiceTest {

    @Mock
    private PackagingPipeline pipeline;

    private SimpleMeterRegistry meterRegistry;
    private List<Runnable> queuedTasks;
    private DefaultPackagingJobService service;
    private JobSpec jobSpec;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        queuedTasks = new ArrayList<>();
        TaskExecutor directExecutor = Runnable::run;
        service = new DefaultPackagingJobService(pipeline, new JobSpecValidator(), directExecutor, meterRegistry);
        jobSpec = JobSpec.builder(Path.of("shoots", "Gala"), Path.of("deliveries")).build();
    }

    @Test
    void completedJobStoresSummaryAndProgress() throws Exception {
        when(pipeline.run(any(JobSpec.class), any(JobEventListener.class), any(AtomicBoolean.class)))
                .thenAnswer(invocation -> {
                    JobEventListener listener = invocation.getArgument(1);
                    listener.onEvent(progressEvent(0, 2));
                    listener.onEvent(progressEvent(2, 2));
                    return summary(false, List.of());
                });
        List<JobEvent> forwarded = new ArrayList<>();

        String jobId = service.submitJob(jobSpec, forwarded::add);

        PackagingJobStatus status = service.getJobStatus(jobId).orElseThrow();
        assertThat(status.state()).isEqualTo(PackagingJobState.COMPLETED);
        assertThat(status.shootBaseName()).isEqualTo("Gala");
        assertThat(status.processedSources()).isEqualTo(2);
        assertThat(status.totalSources()).isEqualTo(2);
        assertThat(status.warningMessage()).isNull();
        assertThat(service.getSummary(jobId)).isPresent();
        assertThat(forwarded).hasSize(2);
        assertThat(meterRegistry.counter("photo_packager.jobs.completed").count()).isEqualTo(1.0);
    }

    @Test
    void submitPassesNormalizedSpecToPipeline() throws Exception {
        when(pipeline.run(any(JobSpec.class), any(JobEventListener.class), any(AtomicBoolean.class)))
                .thenReturn(summary(false, List.of()));
        ArgumentCaptor<JobSpec> captor = ArgumentCaptor.forClass(JobSpec.class);

        service.submitJob(jobSpec.toBuilder().shootBaseName("Gala: Night").dryRun(true).build());

        verify(pipeline).run(captor.capture(), any(JobEventListener.class), any(AtomicBoolean.class));
        assertThat(captor.getValue().shootBaseName()).isEqualTo("Gala_ Night");
        assertThat(meterRegistry.counter("photo_packager.jobs.dry_run").count()).isEqualTo(1.0);
    }

    @Test
    void failedOutputsAreCountedAndJobStillCompletes() throws Exception {
        when(pipeline.run(any(JobSpec.class), any(JobEventListener.class), any(AtomicBoolean.class)))
                .thenReturn(summary(false, List.of("#1 COMPRESSED_JPEG: slow")));

        String jobId = service.submitJob(jobSpec);

        PackagingJobStatus status = service.getJobStatus(jobId).orElseThrow();
        assertThat(status.state()).isEqualTo(PackagingJobState.COMPLETED);
        assertThat(status.failedOutcomes()).isEqualTo(1);
        assertThat(status.message()).contains("1 failed output");
        assertThat(status.warningMessage()).startsWith("1 warning(s)");
        assertThat(meterRegistry.counter("photo_packager.files.failed").count()).isEqualTo(1.0);
    }

    @Test
    void setupFailureMarksJobFailed() throws Exception {
        when(pipeline.run(any(JobSpec.class), any(JobEventListener.class), any(AtomicBoolean.class)))
                .thenThrow(new JobSetupException("Source directory does not exist: shoots/Gala"));

        String jobId = service.submitJob(jobSpec);

        PackagingJobStatus status = service.getJobStatus(jobId).orElseThrow();
        assertThat(status.state()).isEqualTo(PackagingJobState.FAILED);
        assertThat(status.message()).isEqualTo("Packaging failed: Source directory does not exist: shoots/Gala");
        assertThat(meterRegistry.counter("photo_packager.jobs.failed").count()).isEqualTo(1.0);
    }

    @Test
    void invalidSpecIsRejectedBeforeQueueing() {
        JobSpec invalid = jobSpec.toBuilder().workerCount(-1).build();

        assertThatThrownBy(() -> service.submitJob(invalid))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("jobSpec.workerCount must be between 0 and 64.");
        verifyNoInteractions(pipeline);
    }

    @Test
    void jobCancelledBeforeStartNeverRunsPipeline() {
        TaskExecutor queueingExecutor = queuedTasks::add;
        DefaultPackagingJobService queued = new DefaultPackagingJobService(
                pipeline, new JobSpecValidator(), queueingExecutor, meterRegistry);

        String jobId = queued.submitJob(jobSpec);
        assertThat(queued.getJobStatus(jobId).orElseThrow().state()).isEqualTo(PackagingJobState.QUEUED);
        assertThat(queued.cancelJob(jobId)).isTrue();
        queuedTasks.forEach(Runnable::run);

        assertThat(queued.getJobStatus(jobId).orElseThrow().state()).isEqualTo(PackagingJobState.CANCELLED);
        assertThat(queued.cancelJob(jobId)).isFalse();
        verifyNoInteractions(pipeline);
    }

    @Test
    void cancelledSummaryEndsInCancelledState() throws Exception {
        when(pipeline.run(any(JobSpec.class), any(JobEventListener.class), any(AtomicBoolean.class)))
                .thenReturn(summary(true, List.of()));

        String jobId = service.submitJob(jobSpec);

        assertThat(service.getJobStatus(jobId).orElseThrow().state()).isEqualTo(PackagingJobState.CANCELLED);
    }

    @Test
    void unknownJobIsReportedAsMissing() {
        assertThat(service.getJobStatus("missing")).isEmpty();
        assertThat(service.cancelJob("missing")).isFalse();
    }

    private JobEvent progressEvent(int completed, int total) {
        return new JobEvent(
                Instant.now(),
                JobEvent.Type.FILE_FINISHED,
                JobEvent.Level.INFO,
                completed == 0 ? null : completed,
                "progress",
                null,
                new JobEvent.Progress(completed, total));
    }

    private JobSummary summary(boolean cancelled, List<String> warnings) {
        SourceEntry entry = SourceEntry.readable(Path.of("shoots", "Gala", "a.jpg"), 1, "001", SourceKind.RASTER);
        List<FileOutcome> outcomes = new ArrayList<>();
        outcomes.add(FileOutcome.success(entry, OutputCategory.ORIGINAL, Path.of("deliveries/Gala/Export Originals/001-Gala.jpg"), Duration.ZERO, List.of()));
        List<String> errors = new ArrayList<>();
        Map<OutputCategory, CategoryCounts> counts = new EnumMap<>(OutputCategory.class);
        counts.put(OutputCategory.ORIGINAL, new CategoryCounts(1, 0, 0));
        if (!warnings.isEmpty()) {
            outcomes.add(FileOutcome.failed(entry, OutputCategory.COMPRESSED_JPEG, "encode failed: boom", Duration.ZERO));
            errors.add("#1 COMPRESSED_JPEG: encode failed: boom");
            counts.put(OutputCategory.COMPRESSED_JPEG, new CategoryCounts(0, 0, 1));
        }
        return new JobSummary(
                "Gala",
                Path.of("deliveries", "Gala"),
                false,
                cancelled,
                2,
                counts,
                outcomes,
                warnings,
                errors,
                List.of(),
                Duration.ofMillis(10),
                Path.of("deliveries", "Gala", "photopackager_run.log"));
    }
}
