package github.sarthakdev143.photo_packager.service.impl;

import github.sarthakdev143.photo_packager.model.JobEvent;
import github.sarthakdev143.photo_packager.model.JobSpec;
import github.sarthakdev143.photo_packager.model.JobSummary;
import github.sarthakdev143.photo_packager.model.PackagingJobState;
import github.sarthakdev143.photo_packager.model.PackagingJobStatus;
import github.sarthakdev143.photo_packager.service.JobEventListener;
import github.sarthakdev143.photo_packager.service.PackagingJobService;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

@Service
public class DefaultPackagingJobService implements PackagingJobService {

    private static final Logger logger = LoggerFactory.getLogger(DefaultPackagingJobService.class);

    private final PackagingPipeline pipeline;
    private final JobSpecValidator jobSpecValidator;
    private final TaskExecutor taskExecutor;
    private final Map<String, PackagingJobStatus> jobs = new ConcurrentHashMap<>();
    private final Map<String, JobSummary> summaries = new ConcurrentHashMap<>();
    private final Map<String, AtomicBoolean> cancelFlags = new ConcurrentHashMap<>();
    private final Counter jobsCompletedCounter;
    private final Counter jobsFailedCounter;
    private final Counter dryRunJobsCounter;
    private final Counter filesFailedCounter;

    public DefaultPackagingJobService(
            PackagingPipeline pipeline,
            JobSpecValidator jobSpecValidator,
            TaskExecutor taskExecutor,
            MeterRegistry meterRegistry) {
        this.pipeline = pipeline;
        this.jobSpecValidator = jobSpecValidator;
        this.taskExecutor = taskExecutor;
        this.jobsCompletedCounter = meterRegistry.counter("photo_packager.jobs.completed");
        this.jobsFailedCounter = meterRegistry.counter("photo_packager.jobs.failed");
        this.dryRunJobsCounter = meterRegistry.counter("photo_packager.jobs.dry_run");
        this.filesFailedCounter = meterRegistry.counter("photo_packager.files.failed");
    }

    @Override
    public String submitJob(JobSpec jobSpec) {
        return submitJob(jobSpec, JobEventListener.NONE);
    }

    @Override
    public String submitJob(JobSpec jobSpec, JobEventListener listener) {
        JobSpec normalized = jobSpecValidator.normalizeAndValidate(jobSpec);
        String jobId = UUID.randomUUID().toString();
        AtomicBoolean cancelRequested = new AtomicBoolean(false);
        cancelFlags.put(jobId, cancelRequested);

        Instant now = Instant.now();
        jobs.put(jobId, new PackagingJobStatus(
                jobId,
                PackagingJobState.QUEUED,
                "Job queued.",
                now,
                now,
                normalized.shootBaseName(),
                normalized.outputRoot(),
                normalized.dryRun(),
                0,
                0,
                0,
                null));
        if (normalized.dryRun()) {
            dryRunJobsCounter.increment();
        }

        logger.info(
                "Accepted packaging job {} shoot={} dryRun={} originals={} workers={}",
                jobId,
                normalized.shootBaseName(),
                normalized.dryRun(),
                normalized.originalsAction(),
                normalized.workerCount());

        JobEventListener safeListener = listener == null ? JobEventListener.NONE : listener;
        taskExecutor.execute(() -> processJob(jobId, normalized, safeListener, cancelRequested));
        return jobId;
    }

    @Override
    public Optional<PackagingJobStatus> getJobStatus(String jobId) {
        return Optional.ofNullable(jobs.get(jobId));
    }

    @Override
    public Optional<JobSummary> getSummary(String jobId) {
        return Optional.ofNullable(summaries.get(jobId));
    }

    @Override
    public boolean cancelJob(String jobId) {
        PackagingJobStatus status = jobs.get(jobId);
        AtomicBoolean flag = cancelFlags.get(jobId);
        if (status == null || flag == null || status.isTerminal()) {
            return false;
        }
        flag.set(true);
        logger.info("Cancellation requested for packaging job {}", jobId);
        return true;
    }

    private void processJob(
            String jobId,
            JobSpec jobSpec,
            JobEventListener listener,
            AtomicBoolean cancelRequested) {
        if (cancelRequested.get()) {
            markJobFinished(jobId, PackagingJobState.CANCELLED, "Job cancelled before it started.", null);
            cancelFlags.remove(jobId);
            return;
        }
        updateJobState(jobId, PackagingJobState.RUNNING, "Packaging photos.");

        JobEventListener progressListener = event -> {
            if (event.progress() != null) {
                updateProgress(jobId, event.progress());
            }
            listener.onEvent(event);
        };

        try {
            JobSummary summary = pipeline.run(jobSpec, progressListener, cancelRequested);
            summaries.put(jobId, summary);
            filesFailedCounter.increment(summary.failedCount());

            String warningMessage = summary.warnings().isEmpty()
                    ? null
                    : summary.warnings().size() + " warning(s) recorded; see " + summary.logFile().getFileName() + ".";
            if (summary.cancelled()) {
                markJobFinished(jobId, PackagingJobState.CANCELLED, "Job cancelled; finished files were kept.", summary);
            } else {
                String message = summary.hasFailures()
                        ? "Delivery packaged with " + summary.failedCount() + " failed output(s)."
                        : "Delivery packaged successfully.";
                markJobFinished(jobId, PackagingJobState.COMPLETED, message, summary);
            }
            updateWarning(jobId, warningMessage);
            jobsCompletedCounter.increment();
            logger.info(
                    "Completed packaging job {} sources={} failedOutputs={} cancelled={}",
                    jobId,
                    summary.totalSources(),
                    summary.failedCount(),
                    summary.cancelled());
        } catch (Exception e) {
            jobsFailedCounter.increment();
            logger.error("Packaging job {} failed", jobId, e);
            markJobFinished(jobId, PackagingJobState.FAILED, "Packaging failed: " + e.getMessage(), null);
        } finally {
            cancelFlags.remove(jobId);
        }
    }

    private void updateJobState(String jobId, PackagingJobState state, String message) {
        jobs.computeIfPresent(jobId, (ignored, current) -> new PackagingJobStatus(
                current.jobId(),
                state,
                message,
                current.createdAt(),
                Instant.now(),
                current.shootBaseName(),
                current.outputRoot(),
                current.dryRun(),
                current.processedSources(),
                current.totalSources(),
                current.failedOutcomes(),
                current.warningMessage()));
    }

    private void updateProgress(String jobId, JobEvent.Progress progress) {
        jobs.computeIfPresent(jobId, (ignored, current) -> new PackagingJobStatus(
                current.jobId(),
                current.state(),
                current.message(),
                current.createdAt(),
                Instant.now(),
                current.shootBaseName(),
                current.outputRoot(),
                current.dryRun(),
                Math.max(current.processedSources(), progress.completed()),
                Math.max(current.totalSources(), progress.total()),
                current.failedOutcomes(),
                current.warningMessage()));
    }

    private void markJobFinished(String jobId, PackagingJobState state, String message, JobSummary summary) {
        jobs.computeIfPresent(jobId, (ignored, current) -> new PackagingJobStatus(
                current.jobId(),
                state,
                message,
                current.createdAt(),
                Instant.now(),
                current.shootBaseName(),
                current.outputRoot(),
                current.dryRun(),
                current.processedSources(),
                summary == null ? current.totalSources() : summary.totalSources(),
                summary == null ? current.failedOutcomes() : summary.failedCount(),
                current.warningMessage()));
    }

    private void updateWarning(String jobId, String warningMessage) {
        if (warningMessage == null) {
            return;
        }
        jobs.computeIfPresent(jobId, (ignored, current) -> new PackagingJobStatus(
                current.jobId(),
                current.state(),
                current.message(),
                current.createdAt(),
                current.updatedAt(),
                current.shootBaseName(),
                current.outputRoot(),
                current.dryRun(),
                current.processedSources(),
                current.totalSources(),
                current.failedOutcomes(),
                warningMessage));
    }
}
