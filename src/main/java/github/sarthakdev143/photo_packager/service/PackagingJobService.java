package github.sarthakdev143.photo_packager.service;

import github.sarthakdev143.photo_packager.model.JobSpec;
import github.sarthakdev143.photo_packager.model.JobSummary;
import github.sarthakdev143.photo_packager.model.PackagingJobStatus;

import java.util.Optional;

public interface PackagingJobService {

    String submitJob(JobSpec jobSpec);

    String submitJob(JobSpec jobSpec, JobEventListener listener);

    Optional<PackagingJobStatus> getJobStatus(String jobId);

    Optional<JobSummary> getSummary(String jobId);

    /**
     * Requests cancellation. Files already in flight finish; files not yet started are skipped.
     *
     * @return {@code false} when the job is unknown or already finished
     */
    boolean cancelJob(String jobId);
}
