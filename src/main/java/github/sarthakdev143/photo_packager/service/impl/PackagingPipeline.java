package github.sarthakdev143.photo_packager.service.impl;

import github.sarthakdev143.photo_packager.factory.FileSystemGatewayFactory;
import github.sarthakdev143.photo_packager.model.FileOutcome;
import github.sarthakdev143.photo_packager.model.JobSpec;
import github.sarthakdev143.photo_packager.model.JobSummary;
import github.sarthakdev143.photo_packager.model.OriginalsAction;
import github.sarthakdev143.photo_packager.model.OutputCategory;
import github.sarthakdev143.photo_packager.model.ScanResult;
import github.sarthakdev143.photo_packager.model.SourceEntry;
import github.sarthakdev143.photo_packager.service.FileSystemGateway;
import github.sarthakdev143.photo_packager.service.JobEventListener;
import github.sarthakdev143.photo_packager.service.JobSetupException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs one packaging job end to end: scan, per-file derivatives and originals, README,
 * archives and the run log.
 */
@Component
public class PackagingPipeline {

    private static final Logger logger = LoggerFactory.getLogger(PackagingPipeline.class);

    static final String LOG_FILE_NAME = "photopackager_run.log";

    private final JobSpecValidator jobSpecValidator;
    private final SourceScanner sourceScanner;
    private final DerivativeGenerator derivativeGenerator;
    private final OriginalsHandler originalsHandler;
    private final ExecutionScheduler executionScheduler;
    private final Archiver archiver;
    private final DeliveryReadmeWriter readmeWriter;
    private final FileSystemGatewayFactory gatewayFactory;
    private final Clock clock;

    public PackagingPipeline(
            JobSpecValidator jobSpecValidator,
            SourceScanner sourceScanner,
            DerivativeGenerator derivativeGenerator,
            OriginalsHandler originalsHandler,
            ExecutionScheduler executionScheduler,
            Archiver archiver,
            DeliveryReadmeWriter readmeWriter,
            FileSystemGatewayFactory gatewayFactory) {
        this.jobSpecValidator = jobSpecValidator;
        this.sourceScanner = sourceScanner;
        this.derivativeGenerator = derivativeGenerator;
        this.originalsHandler = originalsHandler;
        this.executionScheduler = executionScheduler;
        this.archiver = archiver;
        this.readmeWriter = readmeWriter;
        this.gatewayFactory = gatewayFactory;
        this.clock = Clock.systemUTC();
    }

    public JobSummary run(JobSpec jobSpec) throws JobSetupException {
        return run(jobSpec, JobEventListener.NONE, new AtomicBoolean(false));
    }

    /**
     * @throws JobSetupException when the source directory is unusable or the output root cannot be created;
     *                           every per-file problem is reported in the returned summary instead
     */
    public JobSummary run(JobSpec requestedSpec, JobEventListener listener, AtomicBoolean cancelRequested)
            throws JobSetupException {
        long started = System.nanoTime();
        JobSpec jobSpec = jobSpecValidator.normalizeAndValidate(requestedSpec);
        JobReporter reporter = new JobReporter(clock, listener);
        FileSystemGateway gateway = gatewayFactory.create(jobSpec.dryRun(), reporter::dryRun);

        logger.info(
                "Starting packaging job shoot={} source={} output={} dryRun={} originals={} categories={}",
                jobSpec.shootBaseName(),
                jobSpec.sourceDirectory(),
                jobSpec.outputRoot(),
                jobSpec.dryRun(),
                jobSpec.originalsAction(),
                jobSpec.enabledDerivatives());
        reporter.info("Packaging " + jobSpec.sourceDirectory() + " into " + jobSpec.outputRoot()
                + (jobSpec.dryRun() ? " (dry run)" : ""));

        ScanResult scan = sourceScanner.scan(
                jobSpec.sourceDirectory(),
                jobSpec.recursive(),
                jobSpec.includeRaw(),
                jobSpec.outputRoot());
        scan.warnings().forEach(reporter::warn);
        reporter.scanFinished(scan.size());

        prepareOutput(jobSpec, scan, gateway);

        ExecutionScheduler.ExecutionReport execution = executionScheduler.execute(
                scan.entries(),
                jobSpec.workerCount(),
                cancelRequested,
                new ExecutionScheduler.FileTask() {
                    @Override
                    public void process(SourceEntry entry) {
                        processEntry(entry, jobSpec, gateway, reporter);
                    }

                    @Override
                    public void cancelled(SourceEntry entry) {
                        for (OutputCategory category : categoriesFor(entry, jobSpec)) {
                            reporter.record(FileOutcome.skipped(entry, category, FileOutcome.CANCELLED));
                        }
                    }
                });
        boolean cancelled = execution.cancelled() > 0;
        if (cancelled) {
            reporter.warn("Job cancelled; " + execution.cancelled() + " source file(s) were not started.");
        }

        writeReadmes(jobSpec, scan, gateway, reporter);

        List<Path> archives = List.of();
        if (jobSpec.createArchives()) {
            if (jobSpec.dryRun()) {
                for (Path archive : archiver.plannedArchives(jobSpec, reporter.plannedOutputs())) {
                    reporter.dryRun("Would create archive " + archive);
                }
            } else {
                archives = archiver.createArchives(jobSpec, gateway, reporter);
            }
        }

        Path logFile = jobSpec.outputRoot().resolve(LOG_FILE_NAME);
        Duration elapsed = Duration.ofNanos(System.nanoTime() - started);
        reporter.info("Job finished in " + elapsed.toMillis() + " ms");
        JobSummary summary = reporter.summarize(jobSpec, scan.size(), cancelled, archives, elapsed, logFile);
        try {
            gateway.appendText(logFile, reporter.renderLog(summary));
        } catch (IOException e) {
            logger.warn("Could not write run log {}", logFile, e);
            reporter.warn("Run log could not be written: " + e.getMessage());
            summary = reporter.summarize(jobSpec, scan.size(), cancelled, archives, elapsed, logFile);
        }

        logger.info(
                "Finished packaging job shoot={} sources={} failed={} warnings={} cancelled={} elapsedMs={}",
                summary.shootBaseName(),
                summary.totalSources(),
                summary.failedCount(),
                summary.warnings().size(),
                summary.cancelled(),
                elapsed.toMillis());
        return summary;
    }

    void processEntry(SourceEntry entry, JobSpec jobSpec, FileSystemGateway gateway, JobReporter reporter) {
        try {
            if (!entry.readable()) {
                for (OutputCategory category : categoriesFor(entry, jobSpec)) {
                    reporter.record(FileOutcome.skipped(entry, category, entry.skipReason()));
                }
                return;
            }

            for (FileOutcome outcome : derivativeGenerator.generate(entry, jobSpec, gateway)) {
                reporter.record(outcome);
            }

            OutputCategory originalsCategory = entry.isRaw() ? OutputCategory.RAW : OutputCategory.ORIGINAL;
            FileOutcome original = originalsHandler.handle(
                    entry,
                    originalsCategory,
                    actionFor(entry, jobSpec),
                    jobSpec,
                    gateway);
            if (original != null) {
                reporter.record(original);
            }
        } finally {
            reporter.fileFinished(entry);
        }
    }

    /**
     * Categories an entry produces an outcome in, derivatives first.
     */
    List<OutputCategory> categoriesFor(SourceEntry entry, JobSpec jobSpec) {
        List<OutputCategory> categories = new ArrayList<>(jobSpec.enabledDerivatives());
        if (actionFor(entry, jobSpec) != OriginalsAction.SKIP_EXPORT) {
            categories.add(entry.isRaw() ? OutputCategory.RAW : OutputCategory.ORIGINAL);
        }
        return categories;
    }

    private OriginalsAction actionFor(SourceEntry entry, JobSpec jobSpec) {
        return entry.isRaw() ? jobSpec.rawAction() : jobSpec.originalsAction();
    }

    private void prepareOutput(JobSpec jobSpec, ScanResult scan, FileSystemGateway gateway) throws JobSetupException {
        Path outputParent = jobSpec.outputParent();
        if (Files.exists(outputParent) && !Files.isDirectory(outputParent)) {
            throw new JobSetupException("Output parent is not a directory: " + outputParent);
        }

        Set<Path> folders = new LinkedHashSet<>();
        folders.add(jobSpec.outputRoot());
        if (jobSpec.originalsAction().writesFiles()) {
            folders.add(jobSpec.categoryFolder(OutputCategory.ORIGINAL));
        }
        boolean hasRaw = scan.entries().stream().anyMatch(SourceEntry::isRaw);
        if (hasRaw && jobSpec.rawAction().writesFiles()) {
            folders.add(jobSpec.categoryFolder(OutputCategory.RAW));
        }
        for (OutputCategory category : jobSpec.enabledDerivatives()) {
            folders.add(jobSpec.categoryFolder(category));
        }

        for (Path folder : folders) {
            try {
                gateway.createDirectories(folder);
            } catch (IOException e) {
                logger.error("Cannot create output folder {}", folder, e);
                throw new JobSetupException("Output folder cannot be created: " + folder, e);
            }
        }
    }

    private void writeReadmes(JobSpec jobSpec, ScanResult scan, FileSystemGateway gateway, JobReporter reporter) {
        if (!jobSpec.writeReadme()) {
            return;
        }
        try {
            readmeWriter.writeDeliveryReadme(jobSpec, gateway);
            boolean hasRaw = scan.entries().stream().anyMatch(SourceEntry::isRaw);
            if (hasRaw && jobSpec.rawAction().writesFiles()) {
                readmeWriter.writeRawReadme(jobSpec, gateway);
            }
        } catch (IOException e) {
            logger.warn("Could not write delivery README", e);
            reporter.warn("Delivery README could not be written: " + e.getMessage());
        }
    }
}
