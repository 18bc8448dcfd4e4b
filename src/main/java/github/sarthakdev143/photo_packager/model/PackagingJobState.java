package github.sarthakdev143.photo_packager.model;

public enum PackagingJobState {
    QUEUED,
    RUNNING,
    COMPLETED,
    FAILED,
    CANCELLED
}
